package io.github.hongjungwan.logrelay.core.ratelimit;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.hongjungwan.logrelay.api.config.RateLimitConfig;
import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.scheduling.ScheduledTask;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import io.github.hongjungwan.logrelay.spi.KeyValueStore;
import io.github.hongjungwan.logrelay.spi.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 수집 엔드포인트용 다단계 sliding window rate limiter.
 *
 * <p>검사 순서:</p>
 * <ol>
 *   <li>IP 차단 기록 확인. 활성 차단이면 tier 검사 없이 거부</li>
 *   <li>global → ip → reporter → app 순서로 window 검사. 처음 거부된 tier 에서 중단</li>
 *   <li>모두 허용되면 각 tier window 에 현재 시각 기록</li>
 * </ol>
 *
 * <p>저장소 read-modify-write 는 트랜잭션이 아니다. 동시 요청이 같은 키에 몰리면
 * 한도가 약간 느슨하거나 엄격하게 적용될 수 있다.</p>
 *
 * <p>Thread-safety: 인스턴스 상태는 cleanup 핸들뿐이며 모든 window 상태는 KeyValueStore 에 있다.</p>
 */
@Slf4j
public class SlidingWindowRateLimiter implements AutoCloseable {

    private static final TypeReference<List<Long>> TIMESTAMPS = new TypeReference<>() {};

    static final String WINDOW_PREFIX = "rate_limit:";
    static final String BLOCK_PREFIX = "ip_block:";
    static final String VIOLATION_PREFIX = "ip_violations:";

    /** 비정상적으로 긴 window 목록 판단 배수 */
    private static final int OVERFLOW_FACTOR = 5;
    /** window 목록 보존 상한 배수 */
    private static final int RETAIN_FACTOR = 2;
    private static final long WINDOW_TTL_MARGIN_SECONDS = 60;
    private static final long BLOCK_TTL_MARGIN_SECONDS = 3600;

    private final RateLimitConfig config;
    private final KeyValueStore store;
    private final Scheduler scheduler;
    private final RelayMetrics metrics;

    private volatile ScheduledTask cleanupTask;

    public SlidingWindowRateLimiter(RateLimitConfig config, KeyValueStore store, Scheduler scheduler, RelayMetrics metrics) {
        if (config.isBlockingEnabled() && config.getBlockTimeoutsSeconds().isEmpty()) {
            throw new IllegalArgumentException("blockTimeoutsSeconds must not be empty when blocking is enabled");
        }
        this.config = config;
        this.store = store;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    /**
     * 주기적 만료 키 정리 시작.
     */
    public void start() {
        if (cleanupTask != null || !config.isEnabled()) {
            return;
        }
        long interval = config.getCleanupIntervalMs();
        cleanupTask = scheduler.scheduleAtFixedRate(this::cleanup, interval, interval);
        log.info("Rate limiter cleanup scheduled every {}ms", interval);
    }

    /**
     * 요청 허용 여부 검사.
     *
     * @return tier 별 결과 목록. 거부 시 마지막 원소가 거부 결과. 비활성화 시 null
     */
    public List<RateLimitCheckResult> checkRateLimit(RateLimitIdentifier identifier) {
        if (!config.isEnabled()) {
            return null;
        }

        long now = scheduler.currentTimeMillis();
        try {
            RateLimitCheckResult blocked = checkBlock(identifier.ip(), now);
            if (blocked != null) {
                metrics.recordAdmission(false, "block");
                return List.of(blocked);
            }

            List<RateLimitCheckResult> results = new ArrayList<>();
            Map<RateLimitTier, List<Long>> windows = new EnumMap<>(RateLimitTier.class);

            for (RateLimitTier tier : RateLimitTier.values()) {
                String key = identifier.keyFor(tier);
                if (key == null || !config.isTierEnabled(tier)) {
                    continue;
                }

                List<Long> timestamps = loadWindow(tier, key, now);
                RateLimitCheckResult result = evaluate(tier, timestamps, now);

                if (!result.allowed()) {
                    results.add(escalate(identifier, result, now));
                    metrics.recordAdmission(false, tier.wireName());
                    log.debug("Rate limit exceeded on {} tier for {} ({}/{})",
                            tier.wireName(), key, result.current(), result.limit());
                    return results;
                }

                results.add(result);
                windows.put(tier, timestamps);
            }

            recordRequest(identifier, windows, now);
            metrics.recordAdmission(true, null);
            return results;

        } catch (StorageException e) {
            metrics.recordStorageError();
            log.warn("Rate limit storage failure ({}): {}", config.isFailOpen() ? "fail-open" : "fail-closed", e.getMessage());
            if (config.isFailOpen()) {
                return List.of();
            }
            return List.of(new RateLimitCheckResult(false, RateLimitTier.GLOBAL, 0, 0, now + 1000, 1, false, null));
        }
    }

    /**
     * IP 차단 (또는 차단 단계 상향).
     *
     * <p>직전 위반이 escalationResetHours 안이면 단계를 올리고, 아니면 0 단계부터 다시 시작한다.</p>
     */
    public IpBlockRecord blockIp(String ip) {
        return blockIp(ip, scheduler.currentTimeMillis());
    }

    private IpBlockRecord blockIp(String ip, long now) {
        IpBlockRecord prior = store.get(BLOCK_PREFIX + ip, IpBlockRecord.class);
        if (prior == null) {
            prior = store.get(VIOLATION_PREFIX + ip, IpBlockRecord.class);
        }

        List<Long> timeouts = config.getBlockTimeoutsSeconds();
        long resetWindowMs = config.getEscalationResetHours() * 3_600_000L;
        boolean repeat = prior != null && now - prior.lastViolation() < resetWindowMs;

        int level = repeat ? Math.min(prior.level() + 1, timeouts.size() - 1) : 0;
        int violations = repeat ? prior.violations() + 1 : 1;
        long timeoutSeconds = timeouts.get(level);

        IpBlockRecord record = new IpBlockRecord(ip, level, now + timeoutSeconds * 1000, violations, now);
        store.set(BLOCK_PREFIX + ip, record, timeoutSeconds + BLOCK_TTL_MARGIN_SECONDS);
        store.set(VIOLATION_PREFIX + ip, record, config.getEscalationResetHours() * 3600L);

        metrics.recordIpBlock();
        log.warn("Blocked IP {} at level {} for {}s (violations: {})", ip, level, timeoutSeconds, violations);
        return record;
    }

    /**
     * 차단 해제 (운영용). 위반 이력도 함께 삭제한다.
     */
    public void clearIpBlock(String ip) {
        store.delete(BLOCK_PREFIX + ip);
        store.delete(VIOLATION_PREFIX + ip);
        log.info("Cleared IP block for {}", ip);
    }

    /**
     * 식별자 기준 현재 사용량 조회. window 를 기록하지 않는다.
     */
    public RateLimitStats getStats(RateLimitIdentifier identifier) {
        long now = scheduler.currentTimeMillis();
        Map<RateLimitTier, RateLimitStats.TierUsage> usage = new EnumMap<>(RateLimitTier.class);

        for (RateLimitTier tier : RateLimitTier.values()) {
            String key = identifier.keyFor(tier);
            if (key == null || !config.isTierEnabled(tier)) {
                continue;
            }
            List<Long> timestamps = inWindow(readWindow(tier, key), now, windowMillis(tier));
            usage.put(tier, new RateLimitStats.TierUsage(
                    config.limitFor(tier), timestamps.size(), config.windowSecondsFor(tier),
                    resetTime(timestamps, now, windowMillis(tier))));
        }

        IpBlockRecord block = store.get(BLOCK_PREFIX + identifier.ip(), IpBlockRecord.class);
        return new RateLimitStats(identifier, usage, block != null && block.isActive(now) ? block : null);
    }

    /**
     * 만료 키 정리. 실패해도 요청 경로에는 영향이 없다.
     *
     * @return 삭제된 키 수
     */
    public int cleanup() {
        try {
            return store.cleanup(config.getCleanupChunkSize());
        } catch (RuntimeException e) {
            log.warn("Rate limit cleanup failed: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public void close() {
        ScheduledTask task = cleanupTask;
        if (task != null) {
            task.cancel();
            cleanupTask = null;
        }
    }

    private RateLimitCheckResult checkBlock(String ip, long now) {
        IpBlockRecord record = store.get(BLOCK_PREFIX + ip, IpBlockRecord.class);
        if (record == null) {
            return null;
        }
        if (!record.isActive(now)) {
            store.delete(BLOCK_PREFIX + ip);
            log.debug("IP block expired for {}", ip);
            return null;
        }
        return new RateLimitCheckResult(false, RateLimitTier.IP, config.getIpLimit(), 0, record.expiresAt(),
                RateLimitCheckResult.secondsUntil(record.expiresAt(), now), true, record);
    }

    // global tier 초과는 특정 IP 책임이 아니므로 차단하지 않는다
    private RateLimitCheckResult escalate(RateLimitIdentifier identifier, RateLimitCheckResult result, long now) {
        if (!config.isBlockingEnabled() || result.tier() == RateLimitTier.GLOBAL || !identifier.hasKnownIp()) {
            return result;
        }
        IpBlockRecord record = blockIp(identifier.ip(), now);
        return result.withBlockInfo(record, now);
    }

    private List<Long> loadWindow(RateLimitTier tier, String key, long now) {
        List<Long> stored = readWindow(tier, key);
        int limit = config.limitFor(tier);

        if (stored.size() > (long) limit * OVERFLOW_FACTOR) {
            List<Long> trimmed = retainRecent(inWindow(stored, now, windowMillis(tier)), (long) limit * RETAIN_FACTOR);
            store.set(windowKey(tier, key), trimmed, config.windowSecondsFor(tier) + WINDOW_TTL_MARGIN_SECONDS);
            log.debug("Trimmed oversized {} window for {} from {} to {} entries", tier.wireName(), key, stored.size(), trimmed.size());
            return trimmed;
        }
        return stored;
    }

    private List<Long> readWindow(RateLimitTier tier, String key) {
        List<Long> stored = store.get(windowKey(tier, key), TIMESTAMPS);
        return stored == null ? new ArrayList<>() : new ArrayList<>(stored);
    }

    private RateLimitCheckResult evaluate(RateLimitTier tier, List<Long> timestamps, long now) {
        long window = windowMillis(tier);
        List<Long> active = inWindow(timestamps, now, window);
        int limit = config.limitFor(tier);
        int current = active.size();
        boolean allowed = current < limit;
        long resetTime = resetTime(active, now, window);
        long retryAfter = allowed ? 0 : Math.max(1, RateLimitCheckResult.secondsUntil(resetTime, now));
        return new RateLimitCheckResult(allowed, tier, limit, current, resetTime, retryAfter, false, null);
    }

    private void recordRequest(RateLimitIdentifier identifier, Map<RateLimitTier, List<Long>> windows, long now) {
        windows.forEach((tier, timestamps) -> {
            List<Long> updated = inWindow(timestamps, now, windowMillis(tier));
            updated.add(now);
            List<Long> capped = retainRecent(updated, (long) config.limitFor(tier) * RETAIN_FACTOR);
            store.set(windowKey(tier, identifier.keyFor(tier)), capped,
                    config.windowSecondsFor(tier) + WINDOW_TTL_MARGIN_SECONDS);
        });
    }

    private static List<Long> inWindow(List<Long> timestamps, long now, long windowMillis) {
        long cutoff = now - windowMillis;
        List<Long> result = new ArrayList<>(timestamps.size());
        for (Long ts : timestamps) {
            if (ts != null && ts > cutoff) {
                result.add(ts);
            }
        }
        return result;
    }

    /** 최근 max 개만 남기고 오름차순 정렬 */
    // limit 이 int 최대값에 가까우면 배수가 int 를 넘으므로 long 으로 받는다
    private static List<Long> retainRecent(List<Long> timestamps, long max) {
        List<Long> sorted = new ArrayList<>(timestamps);
        sorted.sort(Comparator.reverseOrder());
        int keep = (int) Math.min(sorted.size(), Math.max(1L, max));
        List<Long> recent = new ArrayList<>(sorted.subList(0, keep));
        Collections.reverse(recent);
        return recent;
    }

    private static long resetTime(List<Long> active, long now, long windowMillis) {
        return active.isEmpty()
                ? now + windowMillis
                : Collections.min(active) + windowMillis;
    }

    private long windowMillis(RateLimitTier tier) {
        return config.windowSecondsFor(tier) * 1000L;
    }

    private static String windowKey(RateLimitTier tier, String key) {
        return WINDOW_PREFIX + tier.wireName() + ":" + key;
    }
}
