package io.github.hongjungwan.logrelay.core.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.logrelay.api.config.RateLimitConfig;
import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.scheduling.ManualScheduler;
import io.github.hongjungwan.logrelay.core.storage.InMemoryStorageBackend;
import io.github.hongjungwan.logrelay.core.storage.TtlKeyValueStore;
import io.github.hongjungwan.logrelay.spi.StorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for SlidingWindowRateLimiter (tier window, IP 차단 단계)
 */
@DisplayName("SlidingWindowRateLimiter")
class SlidingWindowRateLimiterTest {

    private static final String IP = "203.0.113.7";

    private ManualScheduler scheduler;
    private InMemoryStorageBackend backend;
    private TtlKeyValueStore store;
    private RelayMetrics metrics;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        backend = new InMemoryStorageBackend();
        store = new TtlKeyValueStore(backend, "logrelay", new ObjectMapper(), scheduler::currentTimeMillis);
        metrics = new RelayMetrics();
    }

    private SlidingWindowRateLimiter limiter(RateLimitConfig config) {
        return new SlidingWindowRateLimiter(config, store, scheduler, metrics);
    }

    private static RateLimitConfig ipLimit(int limit) {
        return RateLimitConfig.builder()
                .ipLimit(limit)
                .ipWindowSeconds(60)
                .build();
    }

    private static RateLimitCheckResult last(List<RateLimitCheckResult> results) {
        return results.get(results.size() - 1);
    }

    @Nested
    @DisplayName("Sliding Window")
    class SlidingWindowTests {

        @Test
        @DisplayName("should allow requests up to the limit and reject the next one")
        void shouldRejectAfterLimit() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);

            for (int i = 0; i < 5; i++) {
                assertThat(last(limiter.checkRateLimit(id)).allowed()).isTrue();
                scheduler.advanceBy(100);
            }
            RateLimitCheckResult rejected = last(limiter.checkRateLimit(id));

            assertThat(rejected.allowed()).isFalse();
            assertThat(rejected.tier()).isEqualTo(RateLimitTier.IP);
            assertThat(rejected.limit()).isEqualTo(5);
            assertThat(rejected.current()).isEqualTo(5);
            assertThat(rejected.retryAfter()).isPositive();
        }

        @Test
        @DisplayName("should check tiers in order and stop at the first rejection")
        void shouldStopAtFirstRejectedTier() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .appLimit(1)
                    .blockingEnabled(false)
                    .build());
            RateLimitIdentifier id = new RateLimitIdentifier(IP, "reporter-1", "orders");

            List<RateLimitCheckResult> first = limiter.checkRateLimit(id);
            List<RateLimitCheckResult> second = limiter.checkRateLimit(id);

            assertThat(first).extracting(RateLimitCheckResult::tier)
                    .containsExactly(RateLimitTier.GLOBAL, RateLimitTier.IP, RateLimitTier.REPORTER, RateLimitTier.APP);
            assertThat(first).allMatch(RateLimitCheckResult::allowed);
            assertThat(last(second).tier()).isEqualTo(RateLimitTier.APP);
            assertThat(last(second).allowed()).isFalse();
        }

        @Test
        @DisplayName("should skip tiers whose identifier is missing")
        void shouldSkipMissingDimensions() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));

            List<RateLimitCheckResult> results = limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP));

            assertThat(results).extracting(RateLimitCheckResult::tier)
                    .containsExactly(RateLimitTier.GLOBAL, RateLimitTier.IP);
        }

        @Test
        @DisplayName("should not record rejected requests")
        void shouldNotRecordRejectedRequests() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .ipLimit(2)
                    .blockingEnabled(false)
                    .build());
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);

            limiter.checkRateLimit(id);
            limiter.checkRateLimit(id);
            limiter.checkRateLimit(id);
            limiter.checkRateLimit(id);

            assertThat(limiter.getStats(id).tiers().get(RateLimitTier.IP).current()).isEqualTo(2);
        }

        @Test
        @DisplayName("should allow again once old timestamps leave the window")
        void shouldSlide() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .ipLimit(2)
                    .blockingEnabled(false)
                    .build());
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);

            limiter.checkRateLimit(id);
            scheduler.advanceBy(30_000);
            limiter.checkRateLimit(id);
            assertThat(last(limiter.checkRateLimit(id)).allowed()).isFalse();

            scheduler.advanceBy(30_001);

            assertThat(last(limiter.checkRateLimit(id)).allowed()).isTrue();
        }

        @Test
        @DisplayName("should return null when disabled")
        void shouldReturnNullWhenDisabled() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder().enabled(false).build());

            assertThat(limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP))).isNull();
        }

        @Test
        @DisplayName("should trim oversized stored windows")
        void shouldTrimOversizedWindow() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .ipLimit(2)
                    .blockingEnabled(false)
                    .build());
            long now = scheduler.currentTimeMillis();
            List<Long> bloated = LongStream.range(0, 20)
                    .map(i -> now - 1_000 + i)
                    .boxed()
                    .toList();
            store.set(SlidingWindowRateLimiter.WINDOW_PREFIX + "ip:" + IP, bloated, 120);

            RateLimitCheckResult result = last(limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP)));

            assertThat(result.allowed()).isFalse();
            assertThat(result.current()).isEqualTo(4);
        }

        @Test
        @DisplayName("should keep the full window when the limit is near Integer.MAX_VALUE")
        void shouldNotOverflowRetainCapForHugeLimit() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .globalLimit(Integer.MAX_VALUE)
                    .ipLimit(Integer.MAX_VALUE)
                    .blockingEnabled(false)
                    .build());
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);

            RateLimitCheckResult result = null;
            for (int i = 0; i < 4; i++) {
                result = last(limiter.checkRateLimit(id));
                scheduler.advanceBy(10);
            }

            assertThat(result.allowed()).isTrue();
            assertThat(result.limit()).isEqualTo(Integer.MAX_VALUE);
            assertThat(result.current()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("IP Blocking")
    class IpBlockingTests {

        @Test
        @DisplayName("should block IP for the first timeout level on violation")
        void shouldBlockOnViolation() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);
            for (int i = 0; i < 5; i++) {
                limiter.checkRateLimit(id);
            }
            long now = scheduler.currentTimeMillis();

            RateLimitCheckResult rejected = last(limiter.checkRateLimit(id));

            assertThat(rejected.blockInfo()).isNotNull();
            assertThat(rejected.blockInfo().level()).isZero();
            assertThat(rejected.blockInfo().expiresAt()).isEqualTo(now + 60_000);
            assertThat(rejected.blockInfo().violations()).isEqualTo(1);
            assertThat(rejected.retryAfter()).isEqualTo(60);
            assertThat(metrics.getSnapshot().ipBlocks()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject blocked IP before evaluating tiers")
        void shouldRejectWhileBlocked() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);
            for (int i = 0; i < 6; i++) {
                limiter.checkRateLimit(id);
            }
            scheduler.advanceBy(10_000);

            List<RateLimitCheckResult> results = limiter.checkRateLimit(id);

            assertThat(results).hasSize(1);
            assertThat(results.get(0).blocked()).isTrue();
            assertThat(results.get(0).allowed()).isFalse();
            assertThat(results.get(0).retryAfter()).isEqualTo(50);
        }

        @Test
        @DisplayName("should lift expired block and allow traffic")
        void shouldLiftExpiredBlock() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);
            for (int i = 0; i < 6; i++) {
                limiter.checkRateLimit(id);
            }

            scheduler.advanceBy(61_000);

            assertThat(last(limiter.checkRateLimit(id)).allowed()).isTrue();
            assertThat(backend.getItem("logrelay:" + SlidingWindowRateLimiter.BLOCK_PREFIX + IP)).isNull();
            assertThat(limiter.getStats(id).block()).isNull();
        }

        @Test
        @DisplayName("should escalate block level on repeated violations")
        void shouldEscalate() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));
            RateLimitIdentifier id = RateLimitIdentifier.ofIp(IP);
            for (int i = 0; i < 6; i++) {
                limiter.checkRateLimit(id);
            }
            scheduler.advanceBy(61_000);
            for (int i = 0; i < 5; i++) {
                limiter.checkRateLimit(id);
            }

            RateLimitCheckResult second = last(limiter.checkRateLimit(id));

            assertThat(second.blockInfo().level()).isEqualTo(1);
            assertThat(second.blockInfo().violations()).isEqualTo(2);
            assertThat(second.retryAfter()).isEqualTo(300);
        }

        @Test
        @DisplayName("should cap level at the last timeout")
        void shouldCapLevel() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));

            limiter.blockIp(IP);
            limiter.blockIp(IP);
            limiter.blockIp(IP);
            IpBlockRecord record = limiter.blockIp(IP);

            assertThat(record.level()).isEqualTo(2);
            assertThat(record.violations()).isEqualTo(4);
        }

        @Test
        @DisplayName("should restart escalation after the reset window")
        void shouldResetEscalation() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .escalationResetHours(1)
                    .build());

            limiter.blockIp(IP);
            scheduler.advanceBy(2 * 3_600_000L);
            IpBlockRecord record = limiter.blockIp(IP);

            assertThat(record.level()).isZero();
            assertThat(record.violations()).isEqualTo(1);
        }

        @Test
        @DisplayName("should never block on global tier or unknown IP")
        void shouldNotBlockGlobalOrUnknown() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .globalLimit(1)
                    .build());

            limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP));
            RateLimitCheckResult global = last(limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP)));

            assertThat(global.tier()).isEqualTo(RateLimitTier.GLOBAL);
            assertThat(global.blockInfo()).isNull();

            SlidingWindowRateLimiter ipOnly = limiter(ipLimit(1));
            RateLimitIdentifier unknown = new RateLimitIdentifier(null, null, null);
            ipOnly.checkRateLimit(unknown);
            RateLimitCheckResult rejected = last(ipOnly.checkRateLimit(unknown));

            assertThat(rejected.allowed()).isFalse();
            assertThat(rejected.blockInfo()).isNull();
        }

        @Test
        @DisplayName("should clear block and violation history")
        void shouldClearBlock() {
            SlidingWindowRateLimiter limiter = limiter(ipLimit(5));
            limiter.blockIp(IP);

            limiter.clearIpBlock(IP);

            assertThat(last(limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP))).allowed()).isTrue();
            assertThat(limiter.blockIp(IP).level()).isZero();
        }
    }

    @Nested
    @DisplayName("Storage Failure")
    class StorageFailureTests {

        private TtlKeyValueStore brokenStore() {
            StorageBackend broken = new StorageBackend() {
                @Override
                public String getItem(String key) {
                    throw new IllegalStateException("redis down");
                }

                @Override
                public void setItem(String key, String value) {
                    throw new IllegalStateException("redis down");
                }

                @Override
                public void removeItem(String key) {
                    throw new IllegalStateException("redis down");
                }

                @Override
                public Set<String> getKeys(String prefix) {
                    throw new IllegalStateException("redis down");
                }
            };
            return new TtlKeyValueStore(broken, "logrelay", new ObjectMapper(), scheduler::currentTimeMillis);
        }

        @Test
        @DisplayName("should fail open by default")
        void shouldFailOpen() {
            SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                    RateLimitConfig.builder().build(), brokenStore(), scheduler, metrics);

            assertThat(limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP))).isEmpty();
            assertThat(metrics.getSnapshot().storageErrors()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject with global tier when fail-closed")
        void shouldFailClosed() {
            SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                    RateLimitConfig.builder().failOpen(false).build(), brokenStore(), scheduler, metrics);

            RateLimitCheckResult result = last(limiter.checkRateLimit(RateLimitIdentifier.ofIp(IP)));

            assertThat(result.allowed()).isFalse();
            assertThat(result.tier()).isEqualTo(RateLimitTier.GLOBAL);
            assertThat(result.retryAfter()).isEqualTo(1);
        }

        @Test
        @DisplayName("cleanup should swallow storage failures")
        void cleanupShouldNotThrow() {
            SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                    RateLimitConfig.builder().build(), brokenStore(), scheduler, metrics);

            assertThat(limiter.cleanup()).isZero();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should run periodic cleanup until closed")
        void shouldScheduleCleanup() {
            SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                    .cleanupIntervalMs(1_000)
                    .build());
            store.set("stale", "x", 1);

            limiter.start();
            scheduler.advanceBy(2_000);

            assertThat(backend.getItem("logrelay:stale")).isNull();

            limiter.close();
            assertThat(scheduler.pendingTaskCount()).isZero();
        }

        @Test
        @DisplayName("should reject empty block timeouts")
        void shouldRejectEmptyTimeouts() {
            assertThatThrownBy(() -> limiter(RateLimitConfig.builder().blockTimeoutsSeconds(List.of()).build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
