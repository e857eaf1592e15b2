package io.github.hongjungwan.logrelay.core.admission;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * 429 응답 (상태, 헤더, 본문).
 */
public record RateLimitResponse(int status, Map<String, String> headers, Body body) {

    public static final int TOO_MANY_REQUESTS = 429;

    /**
     * JSON 본문
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Body(
            String error,
            String message,
            long retryAfter,
            AdmissionAction action,
            int limit,
            int current,
            long resetTime,
            BlockInfo blockInfo
    ) {
    }

    public record BlockInfo(int level, long expiresAt) {
    }
}
