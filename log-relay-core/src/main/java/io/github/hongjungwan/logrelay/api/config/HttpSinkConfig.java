package io.github.hongjungwan.logrelay.api.config;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * HttpSink 설정.
 */
@Getter
@Builder
public class HttpSinkConfig {

    /** 수집 엔드포인트 URL (필수) */
    private final String endpoint;

    /** 요청 타임아웃 (ms). 초과 시 요청 취소 */
    @Builder.Default
    private final long timeoutMs = 30_000;

    /** 최대 재시도 횟수 */
    @Builder.Default
    private final int maxRetries = 3;

    /** 첫 재시도 지연 (ms). 이후 2배씩 증가 */
    @Builder.Default
    private final long retryDelayMs = 1_000;

    /** 재시도 지연 상한 (ms) */
    @Builder.Default
    private final long maxRetryDelayMs = 60_000;

    /** 요청마다 추가되는 고정 헤더 */
    @Builder.Default
    private final Map<String, String> headers = Map.of();
}
