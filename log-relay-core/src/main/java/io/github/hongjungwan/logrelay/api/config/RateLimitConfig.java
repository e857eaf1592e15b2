package io.github.hongjungwan.logrelay.api.config;

import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 수집 엔드포인트 rate limit 설정. tier 별 limit/window 와 IP 차단 단계.
 */
@Getter
@Builder
public class RateLimitConfig {

    /** rate limit 활성화. 비활성화 시 검사 결과는 null */
    @Builder.Default
    private final boolean enabled = true;

    /** 전체 요청 한도 (window 당) */
    @Builder.Default
    private final int globalLimit = 10_000;

    @Builder.Default
    private final int globalWindowSeconds = 60;

    /** IP 별 요청 한도 */
    @Builder.Default
    private final int ipLimit = 100;

    @Builder.Default
    private final int ipWindowSeconds = 60;

    /** reporter 인스턴스 별 요청 한도 */
    @Builder.Default
    private final int reporterLimit = 50;

    @Builder.Default
    private final int reporterWindowSeconds = 60;

    /** 애플리케이션 별 요청 한도 */
    @Builder.Default
    private final int appLimit = 30;

    @Builder.Default
    private final int appWindowSeconds = 60;

    /** 한도 초과 시 IP 차단 활성화 */
    @Builder.Default
    private final boolean blockingEnabled = true;

    /** 위반 이력이 초기화되기까지의 시간 (hours) */
    @Builder.Default
    private final int escalationResetHours = 24;

    /** 차단 단계별 시간 (seconds). 위반이 반복될수록 다음 단계 적용 */
    @Builder.Default
    private final List<Long> blockTimeoutsSeconds = List.of(60L, 300L, 1800L);

    /** 저장소 장애 시 요청 허용 여부 (false 면 거부) */
    @Builder.Default
    private final boolean failOpen = true;

    /** 만료 키 정리 주기 (ms) */
    @Builder.Default
    private final long cleanupIntervalMs = 5 * 60 * 1000L;

    /** 정리 시 한 번에 처리하는 키 수 */
    @Builder.Default
    private final int cleanupChunkSize = 100;

    public int limitFor(RateLimitTier tier) {
        return switch (tier) {
            case GLOBAL -> globalLimit;
            case IP -> ipLimit;
            case REPORTER -> reporterLimit;
            case APP -> appLimit;
        };
    }

    public int windowSecondsFor(RateLimitTier tier) {
        return switch (tier) {
            case GLOBAL -> globalWindowSeconds;
            case IP -> ipWindowSeconds;
            case REPORTER -> reporterWindowSeconds;
            case APP -> appWindowSeconds;
        };
    }

    /** limit 과 window 가 모두 양수인 tier 만 검사 대상 */
    public boolean isTierEnabled(RateLimitTier tier) {
        return limitFor(tier) > 0 && windowSecondsFor(tier) > 0;
    }
}
