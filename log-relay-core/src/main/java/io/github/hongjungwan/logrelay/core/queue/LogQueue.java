package io.github.hongjungwan.logrelay.core.queue;

import io.github.hongjungwan.logrelay.api.config.LogQueueConfig;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.scheduling.ScheduledTask;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import io.github.hongjungwan.logrelay.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 클라이언트 측 전송 큐.
 *
 * <p>레코드를 maxQueueSize 까지 쌓고 (초과 시 오래된 것부터 버림) maxBatchSize 에 도달하거나
 * maxBatchAge 가 지나면 한 번에 {@link LogSink#logBatch(List)} 로 보낸다.
 * 전송은 한 번에 하나만 진행되며, 실패한 레코드는 큐 앞쪽으로 되돌려 다음 주기에 다시 보낸다.</p>
 */
@Slf4j
public class LogQueue implements AutoCloseable {

    private final LogQueueConfig config;
    private final LogSink transport;
    private final Scheduler scheduler;
    private final RelayMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private List<LogRecord> queue = new ArrayList<>();
    private ScheduledTask timer;
    private boolean sending;
    private CompletableFuture<Void> currentSend = CompletableFuture.completedFuture(null);

    public LogQueue(LogQueueConfig config, LogSink transport, Scheduler scheduler, RelayMetrics metrics) {
        this.config = config;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = metrics;
    }

    public LogQueue(LogQueueConfig config, LogSink transport, Scheduler scheduler) {
        this(config, transport, scheduler, new RelayMetrics());
    }

    public void enqueue(LogRecord record) {
        if (!config.isBatchingEnabled()) {
            sendImmediately(record);
            return;
        }

        boolean sendNow;
        lock.lock();
        try {
            queue.add(record);
            metrics.recordBuffered(1);
            int overflow = queue.size() - config.getMaxQueueSize();
            if (overflow > 0) {
                queue.subList(0, overflow).clear();
                metrics.recordDropped("queue-overflow", overflow);
                log.warn("Log queue full ({}), dropped {} oldest records", config.getMaxQueueSize(), overflow);
            }
            sendNow = scheduleSend();
        } finally {
            lock.unlock();
        }

        if (sendNow) {
            sendLogs();
        }
    }

    /**
     * 대기 중인 레코드를 바로 전송. 진행 중인 전송이 있으면 그 완료를 기다린 뒤 보낸다.
     */
    public CompletableFuture<Void> flush() {
        if (!config.isBatchingEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> running;
        lock.lock();
        try {
            running = currentSend;
        } finally {
            lock.unlock();
        }
        return running.handle((v, e) -> null).thenCompose(v -> sendLogs());
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /** 큐 스냅샷 (들어온 순서) */
    public List<LogRecord> snapshot() {
        lock.lock();
        try {
            return List.copyOf(queue);
        } finally {
            lock.unlock();
        }
    }

    public boolean isSending() {
        lock.lock();
        try {
            return sending;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            cancelTimer();
        } finally {
            lock.unlock();
        }
    }

    // lock 보유 상태에서 호출. 즉시 전송이 필요하면 true
    private boolean scheduleSend() {
        if (queue.size() >= config.getMaxBatchSize()) {
            return true;
        }
        if (timer != null) {
            return false;
        }
        timer = scheduler.schedule(this::onTimer, config.getMaxBatchAgeMs());
        return false;
    }

    private void onTimer() {
        lock.lock();
        try {
            timer = null;
        } finally {
            lock.unlock();
        }
        sendLogs();
    }

    private CompletableFuture<Void> sendLogs() {
        List<LogRecord> logs;
        CompletableFuture<Void> done = new CompletableFuture<>();
        lock.lock();
        try {
            if (queue.isEmpty() || sending) {
                return CompletableFuture.completedFuture(null);
            }
            cancelTimer();
            sending = true;
            currentSend = done;
            logs = queue;
            queue = new ArrayList<>();
        } finally {
            lock.unlock();
        }

        deliver(logs).whenComplete((v, error) -> {
            boolean sendAgain = false;
            lock.lock();
            try {
                sending = false;
                if (error == null) {
                    metrics.recordDelivered(logs.size());
                    if (!queue.isEmpty()) {
                        sendAgain = scheduleSend();
                    }
                } else {
                    requeue(logs, error);
                }
            } finally {
                lock.unlock();
            }
            done.complete(null);
            if (sendAgain) {
                sendLogs();
            }
        });
        return done;
    }

    // lock 보유 상태에서 호출
    private void requeue(List<LogRecord> logs, Throwable error) {
        List<LogRecord> restored = new ArrayList<>(logs.size() + queue.size());
        restored.addAll(logs);
        restored.addAll(queue);
        int overflow = restored.size() - config.getMaxQueueSize();
        if (overflow > 0) {
            restored.subList(0, overflow).clear();
            metrics.recordDropped("queue-overflow", overflow);
        }
        queue = restored;
        log.warn("Failed to send {} logs, {} kept for next attempt: {}", logs.size(), queue.size(), error.getMessage());

        // 실패 직후 바로 재전송하지 않고 age 타이머로 다음 주기를 기다린다
        if (timer == null) {
            timer = scheduler.schedule(this::onTimer, config.getMaxBatchAgeMs());
        }
    }

    private CompletableFuture<Void> deliver(List<LogRecord> logs) {
        try {
            CompletableFuture<Void> future = transport.logBatch(logs);
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void sendImmediately(LogRecord record) {
        deliver(List.of(record)).whenComplete((v, error) -> {
            if (error == null) {
                metrics.recordDelivered(1);
            } else {
                metrics.recordDropped("send-failed", 1);
                log.warn("Failed to send log immediately: {}", error.getMessage());
            }
        });
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }
}
