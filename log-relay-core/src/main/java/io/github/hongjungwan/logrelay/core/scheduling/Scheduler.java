package io.github.hongjungwan.logrelay.core.scheduling;

import java.util.concurrent.CompletableFuture;

/**
 * 타이머 추상화. flush 예약, 재시도 backoff, 주기적 정리가 모두 이 인터페이스를 거친다.
 *
 * <p>운영 환경은 {@link ExecutorScheduler}, 테스트는 {@link ManualScheduler} 로 가상 시계를 진행시킨다.</p>
 */
public interface Scheduler {

    /** 현재 시각 (epoch millis) */
    long currentTimeMillis();

    /** delayMillis 후 1회 실행 */
    ScheduledTask schedule(Runnable task, long delayMillis);

    /** initialDelayMillis 후 periodMillis 간격으로 반복 실행 */
    ScheduledTask scheduleAtFixedRate(Runnable task, long initialDelayMillis, long periodMillis);

    /** delayMillis 후 완료되는 future */
    default CompletableFuture<Void> delay(long delayMillis) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        schedule(() -> future.complete(null), delayMillis);
        return future;
    }
}
