package io.github.hongjungwan.logrelay.core.admission;

import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;
import io.github.hongjungwan.logrelay.core.ratelimit.IpBlockRecord;
import io.github.hongjungwan.logrelay.core.ratelimit.RateLimitCheckResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 거부된 검사 결과를 429 응답으로 변환.
 */
public class RateLimitResponseFactory {

    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    public static final String IP_BLOCKED = "IP_BLOCKED";

    public RateLimitResponse create(RateLimitCheckResult result) {
        AdmissionAction action = actionFor(result);
        IpBlockRecord block = result.blockInfo();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(RelayHeaders.RATE_LIMIT_LIMIT, String.valueOf(result.limit()));
        headers.put(RelayHeaders.RATE_LIMIT_REMAINING, String.valueOf(Math.max(0, result.limit() - result.current())));
        headers.put(RelayHeaders.RATE_LIMIT_RESET, String.valueOf((long) Math.ceil(result.resetTime() / 1000.0)));
        headers.put(RelayHeaders.RATE_LIMIT_RETRY_AFTER, String.valueOf(result.retryAfter()));
        headers.put(RelayHeaders.RETRY_AFTER, String.valueOf(result.retryAfter()));
        headers.put(RelayHeaders.ACTION, action.wireName());
        headers.put(RelayHeaders.RATE_LIMIT_TIER, result.tier().wireName());
        headers.put(RelayHeaders.CONTENT_TYPE, RelayHeaders.JSON_CONTENT_TYPE);

        RateLimitResponse.Body body = new RateLimitResponse.Body(
                result.blocked() ? IP_BLOCKED : RATE_LIMIT_EXCEEDED,
                messageFor(result),
                result.retryAfter(),
                action,
                result.limit(),
                result.current(),
                result.resetTime(),
                block == null ? null : new RateLimitResponse.BlockInfo(block.level(), block.expiresAt())
        );

        return new RateLimitResponse(RateLimitResponse.TOO_MANY_REQUESTS, Collections.unmodifiableMap(headers), body);
    }

    static AdmissionAction actionFor(RateLimitCheckResult result) {
        if (result.blocked() || result.blockInfo() != null) {
            return AdmissionAction.BLOCK;
        }
        return result.tier() == RateLimitTier.GLOBAL ? AdmissionAction.PAUSE : AdmissionAction.BACKOFF;
    }

    private static String messageFor(RateLimitCheckResult result) {
        if (result.blocked()) {
            int level = result.blockInfo() == null ? 0 : result.blockInfo().level();
            return "IP address is temporarily blocked (level " + level + ")";
        }
        return "Rate limit exceeded for " + result.tier().wireName() + " tier";
    }
}
