package io.github.hongjungwan.logrelay.core.ratelimit;

import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;

/**
 * rate limit 대상 식별자.
 *
 * @param ip         검증된 클라이언트 IP 또는 {@link #UNKNOWN_IP}
 * @param reporterId reporter 인스턴스 ID (nullable)
 * @param appName    애플리케이션 이름 (nullable)
 */
public record RateLimitIdentifier(String ip, String reporterId, String appName) {

    public static final String UNKNOWN_IP = "unknown";

    public RateLimitIdentifier {
        ip = ip == null || ip.isBlank() ? UNKNOWN_IP : ip;
        reporterId = blankToNull(reporterId);
        appName = blankToNull(appName);
    }

    public static RateLimitIdentifier ofIp(String ip) {
        return new RateLimitIdentifier(ip, null, null);
    }

    /** tier 의 저장 키. 해당 차원의 값이 없으면 null (검사 생략) */
    public String keyFor(RateLimitTier tier) {
        return switch (tier) {
            case GLOBAL -> "all";
            case IP -> ip;
            case REPORTER -> reporterId;
            case APP -> appName;
        };
    }

    public boolean hasKnownIp() {
        return !UNKNOWN_IP.equals(ip);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
