package io.github.hongjungwan.logrelay.api.http;

/**
 * relay 가 주고받는 HTTP 헤더 이름.
 */
public final class RelayHeaders {

    /** 전송 reporter 인스턴스 ID */
    public static final String REPORTER_ID = "X-LogRelay-Reporter-Id";

    /** 이미 relay 를 거친 배치 표시 */
    public static final String PROCESSED = "X-LogRelay-Processed";

    /** 원천 애플리케이션 이름 */
    public static final String SOURCE = "X-LogRelay-Source";

    /** 429 응답 시 클라이언트 권장 동작: block, pause, backoff */
    public static final String ACTION = "X-LogRelay-Action";

    /** 429 를 유발한 tier */
    public static final String RATE_LIMIT_TIER = "X-LogRelay-Rate-Limit-Tier";

    public static final String RATE_LIMIT_LIMIT = "X-Rate-Limit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-Rate-Limit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-Rate-Limit-Reset";
    public static final String RATE_LIMIT_RETRY_AFTER = "X-Rate-Limit-Retry-After";
    public static final String RETRY_AFTER = "Retry-After";

    public static final String TRACEPARENT = "traceparent";
    public static final String TRACESTATE = "tracestate";

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String JSON_CONTENT_TYPE = "application/json";

    private RelayHeaders() {
    }
}
