package io.github.hongjungwan.logrelay.core.ratelimit;

import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;

import java.util.Map;

/**
 * 식별자 기준 현재 사용량 (운영 조회용).
 */
public record RateLimitStats(RateLimitIdentifier identifier, Map<RateLimitTier, TierUsage> tiers, IpBlockRecord block) {

    public record TierUsage(int limit, int current, int windowSeconds, long resetTime) {

        public int remaining() {
            return Math.max(0, limit - current);
        }
    }
}
