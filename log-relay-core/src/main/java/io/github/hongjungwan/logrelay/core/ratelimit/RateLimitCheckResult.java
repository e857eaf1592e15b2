package io.github.hongjungwan.logrelay.core.ratelimit;

import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;

/**
 * tier 하나의 검사 결과.
 *
 * @param allowed    허용 여부
 * @param tier       검사한 tier
 * @param limit      tier 한도
 * @param current    window 안의 요청 수
 * @param resetTime  window 가 비워지는 시각 (epoch millis)
 * @param retryAfter 재시도까지 대기 시간 (seconds, 허용 시 0)
 * @param blocked    차단 기록으로 거부되었는지 여부
 * @param blockInfo  활성 차단 기록 (거부로 차단이 새로 생긴 경우 포함, nullable)
 */
public record RateLimitCheckResult(
        boolean allowed,
        RateLimitTier tier,
        int limit,
        int current,
        long resetTime,
        long retryAfter,
        boolean blocked,
        IpBlockRecord blockInfo
) {

    public RateLimitCheckResult withBlockInfo(IpBlockRecord record, long now) {
        long blockRetryAfter = secondsUntil(record.expiresAt(), now);
        return new RateLimitCheckResult(allowed, tier, limit, current, resetTime,
                Math.max(retryAfter, blockRetryAfter), blocked, record);
    }

    static long secondsUntil(long time, long now) {
        return Math.max(0, (long) Math.ceil((time - now) / 1000.0));
    }
}
