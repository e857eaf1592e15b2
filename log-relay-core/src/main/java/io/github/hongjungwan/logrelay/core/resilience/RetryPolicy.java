package io.github.hongjungwan.logrelay.core.resilience;

import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 지수 backoff 재시도 정책. 지연: initialDelay * multiplier^attempt (maxDelay 상한).
 *
 * <p>대기는 {@link Scheduler} 로 예약되므로 호출 스레드를 막지 않는다.</p>
 */
@Slf4j
public final class RetryPolicy {

    private final int maxRetries;
    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final Predicate<Throwable> retryPredicate;
    private final Set<Class<? extends Throwable>> retryableExceptions;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.initialDelayMs = builder.initialDelayMs;
        this.multiplier = builder.multiplier;
        this.maxDelayMs = builder.maxDelayMs;
        this.retryPredicate = builder.retryPredicate;
        this.retryableExceptions = builder.retryableExceptions;
    }

    /**
     * 비동기 작업을 정책에 따라 실행. 재시도가 소진되면 {@link RetryExhaustedException} 으로 완료된다.
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<CompletableFuture<T>> operation, Scheduler scheduler) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, scheduler, 0, result);
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> operation, Scheduler scheduler,
                             int attempt, CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }

        CompletableFuture<T> future;
        try {
            future = operation.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }

            Throwable cause = unwrap(error);
            if (!isRetryable(cause)) {
                result.completeExceptionally(new RetryExhaustedException("Non-retryable exception", cause, attempt + 1));
                return;
            }
            if (attempt >= maxRetries) {
                result.completeExceptionally(new RetryExhaustedException(
                        String.format("Exhausted %d retry attempts", maxRetries), cause, attempt + 1));
                return;
            }

            long delay = calculateDelay(attempt).toMillis();
            log.debug("Retry attempt {}/{} after {}ms: {}", attempt + 1, maxRetries, delay, cause.getMessage());
            scheduler.schedule(() -> attempt(operation, scheduler, attempt + 1, result), delay);
        });
    }

    /**
     * attempt 번째 재시도 전 지연 (0부터 시작)
     */
    public Duration calculateDelay(int attempt) {
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt));
        return Duration.ofMillis((long) Math.min(delay, maxDelayMs));
    }

    public boolean isRetryable(Throwable error) {
        // 커스텀 predicate 우선
        if (retryPredicate != null) {
            return retryPredicate.test(error);
        }

        // 지정된 예외 타입 확인
        if (!retryableExceptions.isEmpty()) {
            return retryableExceptions.stream()
                    .anyMatch(clazz -> clazz.isInstance(error));
        }

        // 기본: 모든 예외 재시도
        return true;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 기본 정책 생성 (3회 재시도, 1초부터 2배씩)
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * 재시도 없음
     */
    public static RetryPolicy none() {
        return builder().maxRetries(0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private long initialDelayMs = 1_000;
        private double multiplier = 2.0;
        private long maxDelayMs = Long.MAX_VALUE;
        private Predicate<Throwable> retryPredicate;
        private Set<Class<? extends Throwable>> retryableExceptions = Set.of();

        /**
         * 최대 재시도 횟수 (기본: 3). 총 시도 횟수는 maxRetries + 1
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * 첫 재시도 지연 (기본: 1초)
         */
        public Builder initialDelay(Duration initialDelay) {
            this.initialDelayMs = initialDelay.toMillis();
            return this;
        }

        /**
         * 지연 증가 배수 (기본: 2.0)
         */
        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
            }
            this.multiplier = multiplier;
            return this;
        }

        /**
         * 지연 상한
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelayMs = maxDelay.toMillis();
            return this;
        }

        /**
         * 재시도 조건 설정
         */
        public Builder retryOn(Predicate<Throwable> predicate) {
            this.retryPredicate = predicate;
            return this;
        }

        /**
         * 재시도할 예외 클래스 설정
         */
        @SafeVarargs
        public final Builder retryOnExceptions(Class<? extends Throwable>... exceptions) {
            this.retryableExceptions = Set.of(exceptions);
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }

    /**
     * 재시도 소진 시 발생하는 예외
     */
    public static class RetryExhaustedException extends RuntimeException {

        private final int attempts;

        public RetryExhaustedException(String message, Throwable cause, int attempts) {
            super(message, cause);
            this.attempts = attempts;
        }

        /** 실제 시도 횟수 (첫 시도 포함) */
        public int getAttempts() {
            return attempts;
        }
    }
}
