package io.github.hongjungwan.logrelay.core.ingest;

import io.github.hongjungwan.logrelay.api.http.Headers;

/**
 * 수집 요청. 호스트 웹 프레임워크가 채워서 넘긴다.
 *
 * @param headers       요청 헤더
 * @param remoteAddress 연결 원격 주소 (nullable)
 * @param body          요청 본문 (JSON {@code LogBatch})
 */
public record IngestionRequest(Headers headers, String remoteAddress, byte[] body) {

    public IngestionRequest {
        headers = headers == null ? Headers.empty() : headers;
        body = body == null ? new byte[0] : body;
    }
}
