package io.github.hongjungwan.logrelay.core.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ScheduledExecutorService 기반 Scheduler. daemon 스레드 사용.
 */
@Slf4j
public class ExecutorScheduler implements Scheduler, AutoCloseable {

    private final ScheduledExecutorService executor;

    public ExecutorScheduler(String threadNamePrefix, int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, threadNamePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ExecutorScheduler() {
        this("log-relay-scheduler", 1);
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMillis) {
        ScheduledFuture<?> future = executor.schedule(guard(task), Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, long initialDelayMillis, long periodMillis) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                guard(task), Math.max(0, initialDelayMillis), periodMillis, TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    // 예외가 전파되면 반복 작업이 조용히 중단된다
    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Scheduled task failed", e);
            }
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
