package io.github.hongjungwan.logrelay.core.resilience;

import io.github.hongjungwan.logrelay.core.scheduling.ManualScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for RetryPolicy (지수 backoff, Scheduler 기반 대기)
 */
@DisplayName("RetryPolicy")
class RetryPolicyTest {

    private final ManualScheduler scheduler = new ManualScheduler(0);

    @Nested
    @DisplayName("Successful Execution")
    class SuccessfulExecutionTests {

        @Test
        @DisplayName("should return result on success")
        void shouldReturnResultOnSuccess() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(3)
                    .build();

            CompletableFuture<String> result = policy.executeAsync(
                    () -> CompletableFuture.completedFuture("success"), scheduler);

            assertThat(result).isCompletedWithValue("success");
        }

        @Test
        @DisplayName("should not retry on success")
        void shouldNotRetryOnSuccess() {
            RetryPolicy policy = RetryPolicy.defaults();
            AtomicInteger attempts = new AtomicInteger(0);

            policy.executeAsync(() -> {
                attempts.incrementAndGet();
                return CompletableFuture.completedFuture("success");
            }, scheduler);

            assertThat(attempts.get()).isEqualTo(1);
            assertThat(scheduler.pendingTaskCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Retry Behavior")
    class RetryBehaviorTests {

        @Test
        @DisplayName("should retry up to max retries then fail")
        void shouldRetryUpToMaxRetries() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(3)
                    .initialDelay(Duration.ofMillis(100))
                    .build();
            AtomicInteger attempts = new AtomicInteger(0);

            CompletableFuture<String> result = policy.executeAsync(() -> {
                attempts.incrementAndGet();
                return CompletableFuture.failedFuture(new RuntimeException("always fails"));
            }, scheduler);

            scheduler.advanceBy(10_000);

            assertThat(attempts.get()).isEqualTo(4);
            assertThatThrownBy(result::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(RetryPolicy.RetryExhaustedException.class)
                    .hasRootCauseMessage("always fails");
            RetryPolicy.RetryExhaustedException exhausted =
                    (RetryPolicy.RetryExhaustedException) RetryPolicy.unwrap(catchThrowable(result::join));
            assertThat(exhausted.getAttempts()).isEqualTo(4);
        }

        @Test
        @DisplayName("should wait with exponential delays between attempts")
        void shouldWaitExponentialDelays() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(3)
                    .initialDelay(Duration.ofMillis(100))
                    .build();
            List<Long> attemptTimes = new ArrayList<>();

            policy.executeAsync(() -> {
                attemptTimes.add(scheduler.currentTimeMillis());
                return CompletableFuture.failedFuture(new RuntimeException("fail"));
            }, scheduler);

            scheduler.advanceBy(10_000);

            assertThat(attemptTimes).containsExactly(0L, 100L, 300L, 700L);
        }

        @Test
        @DisplayName("should succeed on last retry")
        void shouldSucceedOnLastRetry() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(2)
                    .initialDelay(Duration.ofMillis(1))
                    .build();
            AtomicInteger attempts = new AtomicInteger(0);

            CompletableFuture<String> result = policy.executeAsync(() -> attempts.incrementAndGet() < 3
                    ? CompletableFuture.failedFuture(new RuntimeException("not yet"))
                    : CompletableFuture.completedFuture("finally success"), scheduler);

            scheduler.advanceBy(100);

            assertThat(result).isCompletedWithValue("finally success");
            assertThat(attempts.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("should only retry specified exceptions")
        void shouldOnlyRetrySpecifiedExceptions() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(3)
                    .retryOnExceptions(IllegalArgumentException.class)
                    .initialDelay(Duration.ofMillis(1))
                    .build();
            AtomicInteger attempts = new AtomicInteger(0);

            CompletableFuture<Object> result = policy.executeAsync(() -> {
                attempts.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("not retryable"));
            }, scheduler);

            scheduler.advanceBy(100);

            assertThat(attempts.get()).isEqualTo(1);
            assertThat(result).isCompletedExceptionally();
            assertThat(catchThrowable(result::join).getCause())
                    .isInstanceOf(RetryPolicy.RetryExhaustedException.class)
                    .hasMessage("Non-retryable exception");
        }

        @Test
        @DisplayName("should use custom retry predicate")
        void shouldUseCustomRetryPredicate() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(5)
                    .retryOn(e -> e.getMessage() != null && e.getMessage().contains("retry"))
                    .initialDelay(Duration.ofMillis(1))
                    .build();
            AtomicInteger attempts = new AtomicInteger(0);

            policy.executeAsync(() -> {
                int attempt = attempts.incrementAndGet();
                return CompletableFuture.failedFuture(attempt < 3
                        ? new RuntimeException("please retry")
                        : new RuntimeException("do not continue"));
            }, scheduler);

            scheduler.advanceBy(1_000);

            assertThat(attempts.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("should treat synchronous throw as failed attempt")
        void shouldTreatThrowAsFailure() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxRetries(1)
                    .initialDelay(Duration.ofMillis(1))
                    .build();
            AtomicInteger attempts = new AtomicInteger(0);

            CompletableFuture<String> result = policy.executeAsync(() -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("thrown");
            }, scheduler);

            scheduler.advanceBy(100);

            assertThat(attempts.get()).isEqualTo(2);
            assertThat(result).isCompletedExceptionally();
        }
    }

    @Nested
    @DisplayName("Exponential Delay")
    class ExponentialDelayTests {

        @Test
        @DisplayName("should double delay per attempt")
        void shouldDoubleDelay() {
            RetryPolicy policy = RetryPolicy.builder()
                    .initialDelay(Duration.ofMillis(100))
                    .build();

            assertThat(policy.calculateDelay(0).toMillis()).isEqualTo(100);
            assertThat(policy.calculateDelay(1).toMillis()).isEqualTo(200);
            assertThat(policy.calculateDelay(2).toMillis()).isEqualTo(400);
        }

        @Test
        @DisplayName("should cap delay at max delay")
        void shouldCapDelay() {
            RetryPolicy policy = RetryPolicy.builder()
                    .initialDelay(Duration.ofMillis(1_000))
                    .maxDelay(Duration.ofMillis(5_000))
                    .build();

            assertThat(policy.calculateDelay(10).toMillis()).isEqualTo(5_000);
        }

        @Test
        @DisplayName("should reject invalid configuration")
        void shouldRejectInvalidConfiguration() {
            assertThatThrownBy(() -> RetryPolicy.builder().maxRetries(-1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RetryPolicy.builder().multiplier(0.5))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("none should not retry")
        void noneShouldNotRetry() {
            assertThat(RetryPolicy.none().getMaxRetries()).isZero();
        }
    }
}
