package io.github.hongjungwan.logrelay.core.batch;

import io.github.hongjungwan.logrelay.api.config.BatchConfig;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.resilience.RetryPolicy;
import io.github.hongjungwan.logrelay.core.scheduling.ScheduledTask;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import io.github.hongjungwan.logrelay.core.sink.LoggingDeliveryFailureListener;
import io.github.hongjungwan.logrelay.spi.DeliveryFailureListener;
import io.github.hongjungwan.logrelay.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 시간순 정렬 버퍼를 가진 배치 reporter.
 *
 * <p>레코드는 time 기준 이진 탐색으로 삽입되어 버퍼는 항상 오름차순이다.
 * flush 는 {@code time <= now - sortingWindowMs} 인 앞부분만 꺼내 전달하므로,
 * 늦게 도착했지만 시각이 앞선 레코드도 올바른 위치에 들어갈 수 있다.</p>
 *
 * <p>Flush 트리거:</p>
 * <ul>
 *   <li>크기: 버퍼가 maxSize 에 도달하면 즉시 (대상이 없으면 가장 오래된 레코드가 대상이 되는 시점에) flush</li>
 *   <li>시간: 대기 중인 타이머가 없을 때 새 레코드가 들어오면 maxAge 타이머 설정</li>
 *   <li>명시적: {@link #forceFlush()} 는 진행 중인 flush 를 기다린 뒤 정렬 대기 없이 전부 전달</li>
 * </ul>
 *
 * <p>전달 실패 시 retryDelay * 2^attempt 후 재시도하며, maxRetries 를 넘으면 배치를 버리고
 * {@link DeliveryFailureListener} 로 보고한다. 호출자에게 예외를 던지지 않는다.</p>
 *
 * <p>Thread-safety: 버퍼와 flush 상태는 ReentrantLock 으로 보호 (Virtual Thread compatible).
 * 한 인스턴스에서 flush 는 동시에 하나만 실행된다.</p>
 */
@Slf4j
public class BatchReporter implements LogSink {

    /** 대상이 없을 때 재예약 지연 하한. 미래 시각 레코드로 0ms 타이머가 반복되지 않도록 */
    static final long MIN_RESCHEDULE_MS = 100;

    private final String name;
    private final BatchConfig config;
    private final Scheduler scheduler;
    private final RelayMetrics metrics;
    private final DeliveryFailureListener failureListener;
    private final RetryPolicy retryPolicy;
    private final FlushHandler flushHandler;
    private final List<LogSink> downstream = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final List<LogRecord> buffer = new ArrayList<>();
    private final Map<String, RetryTask> retries = new ConcurrentHashMap<>();

    private ScheduledTask flushTimer;
    private boolean flushing;
    private CompletableFuture<Void> currentFlush = CompletableFuture.completedFuture(null);
    private volatile boolean closed;

    private BatchReporter(Builder builder) {
        this.name = builder.name;
        this.config = builder.config;
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.metrics = builder.metrics;
        this.failureListener = builder.failureListener;
        this.flushHandler = builder.flushHandler != null ? builder.flushHandler : this::fanOut;
        this.downstream.addAll(builder.sinks);
        this.retryPolicy = RetryPolicy.builder()
                .maxRetries(config.getMaxRetries())
                .initialDelay(Duration.ofMillis(config.getRetryDelayMs()))
                .multiplier(2.0)
                .build();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void log(LogRecord record) {
        logBatch(List.of(record));
    }

    /**
     * 레코드를 버퍼에 넣는다. 반환된 future 는 버퍼 반영 시 완료되며 전달 결과와 무관하다.
     */
    @Override
    public CompletableFuture<Void> logBatch(List<LogRecord> records) {
        if (records == null || records.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        if (closed) {
            metrics.recordDropped("reporter-closed", records.size());
            log.warn("Reporter {} is closed, dropping {} records", name, records.size());
            return CompletableFuture.completedFuture(null);
        }

        List<LogRecord> accepted = filterLevels(records);
        if (accepted.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        lock.lock();
        try {
            for (LogRecord record : accepted) {
                insertSorted(record);
            }
            metrics.recordBuffered(accepted.size());

            if (buffer.size() >= config.getMaxSize()) {
                handleMaxSizeReached();
            } else {
                scheduleFlush(config.getMaxAgeMs());
            }
        } finally {
            lock.unlock();
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 정렬 대기 시간이 지난 레코드를 전달.
     */
    @Override
    public CompletableFuture<Void> flush() {
        return doFlush(false);
    }

    /**
     * 진행 중인 flush 완료를 기다린 뒤 버퍼 전체를 전달. 빈 버퍼면 아무것도 하지 않는다.
     */
    @Override
    public CompletableFuture<Void> forceFlush() {
        CompletableFuture<Void> running;
        lock.lock();
        try {
            running = currentFlush;
        } finally {
            lock.unlock();
        }
        return running.handle((v, e) -> null).thenCompose(v -> doFlush(true));
    }

    /**
     * 타이머와 대기 중인 재시도를 취소. 남은 레코드와 재시도 배치는 실패 채널로 보고된다.
     */
    @Override
    public void close() {
        List<LogRecord> remaining;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            cancelFlushTimer();
            remaining = new ArrayList<>(buffer);
            buffer.clear();
        } finally {
            lock.unlock();
        }

        for (RetryTask task : retries.values()) {
            task.cancel();
            report(task.batchId(), task.records(), new IllegalStateException("Reporter closed with pending retry"));
        }
        retries.clear();

        if (!remaining.isEmpty()) {
            metrics.recordDropped("reporter-closed", remaining.size());
            report(null, remaining, new IllegalStateException("Reporter closed with buffered records"));
        }
        log.info("Reporter {} closed", name);
    }

    public void addSink(LogSink sink) {
        downstream.add(sink);
    }

    public boolean removeSink(LogSink sink) {
        return downstream.remove(sink);
    }

    public List<LogSink> getSinks() {
        return List.copyOf(downstream);
    }

    public int getBufferSize() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /** 버퍼 스냅샷 (시간 오름차순) */
    public List<LogRecord> getBufferSnapshot() {
        lock.lock();
        try {
            return List.copyOf(buffer);
        } finally {
            lock.unlock();
        }
    }

    /** batchId → 다음 재시도 번호 */
    public Map<String, Integer> getPendingRetries() {
        Map<String, Integer> view = new LinkedHashMap<>();
        retries.forEach((id, task) -> view.put(id, task.attempt()));
        return Collections.unmodifiableMap(view);
    }

    public boolean isFlushing() {
        lock.lock();
        try {
            return flushing;
        } finally {
            lock.unlock();
        }
    }

    // ---- buffering ----

    private List<LogRecord> filterLevels(List<LogRecord> records) {
        Set<Integer> levels = config.getLevels();
        if (levels == null) {
            return records;
        }
        List<LogRecord> accepted = new ArrayList<>(records.size());
        for (LogRecord record : records) {
            if (levels.contains(record.getLevel())) {
                accepted.add(record);
            }
        }
        return accepted;
    }

    private void insertSorted(LogRecord record) {
        int left = 0;
        int right = buffer.size();
        while (left < right) {
            int mid = (left + right) >>> 1;
            if (buffer.get(mid).getTime() <= record.getTime()) {
                left = mid + 1;
            } else {
                right = mid;
            }
        }
        buffer.add(left, record);
    }

    /** time <= cutoff 인 앞부분 길이 */
    private int eligibleCount(long cutoff) {
        int left = 0;
        int right = buffer.size();
        while (left < right) {
            int mid = (left + right) >>> 1;
            if (buffer.get(mid).getTime() <= cutoff) {
                left = mid + 1;
            } else {
                right = mid;
            }
        }
        return left;
    }

    private void handleMaxSizeReached() {
        long now = scheduler.currentTimeMillis();
        long oldest = buffer.get(0).getTime();
        long cutoff = now - config.getSortingWindowMs();

        if (oldest <= cutoff) {
            scheduleFlush(0);
        } else {
            scheduleFlush(untilEligible(now));
        }
    }

    // lock 보유 상태에서 호출. 가장 오래된 레코드가 flush 대상이 되기까지 남은 시간 (maxAge 상한)
    private long untilEligible(long now) {
        long delay = buffer.get(0).getTime() + config.getSortingWindowMs() - now;
        return Math.max(MIN_RESCHEDULE_MS, Math.min(delay, config.getMaxAgeMs()));
    }

    // lock 보유 상태에서 호출
    private void scheduleFlush(long delayMs) {
        if (flushing || closed) {
            return;
        }
        if (flushTimer != null && delayMs == config.getMaxAgeMs()) {
            return;
        }
        cancelFlushTimer();
        flushTimer = scheduler.schedule(this::onFlushTimer, delayMs);
    }

    private void cancelFlushTimer() {
        if (flushTimer != null) {
            flushTimer.cancel();
            flushTimer = null;
        }
    }

    private void onFlushTimer() {
        lock.lock();
        try {
            flushTimer = null;
        } finally {
            lock.unlock();
        }
        flush();
    }

    // ---- flushing ----

    private CompletableFuture<Void> doFlush(boolean force) {
        List<LogRecord> batch;
        CompletableFuture<Void> done = new CompletableFuture<>();
        long now = scheduler.currentTimeMillis();

        lock.lock();
        try {
            if (flushing) {
                if (force) {
                    CompletableFuture<Void> running = currentFlush;
                    return running.handle((v, e) -> null).thenCompose(v -> doFlush(true));
                }
                return CompletableFuture.completedFuture(null);
            }

            cancelFlushTimer();
            if (buffer.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }

            int count = force ? buffer.size() : eligibleCount(now - config.getSortingWindowMs());
            if (count == 0) {
                scheduleFlush(untilEligible(now));
                return CompletableFuture.completedFuture(null);
            }

            List<LogRecord> head = buffer.subList(0, count);
            batch = List.copyOf(head);
            head.clear();
            flushing = true;
            currentFlush = done;
        } finally {
            lock.unlock();
        }

        String batchId = newBatchId(now);
        log.debug("Reporter {} flushing batch {} ({} records)", name, batchId, batch.size());

        deliver(batch).whenComplete((v, error) -> {
            try {
                if (error == null) {
                    onDelivered(batchId, batch, 0);
                } else {
                    handleFailure(batchId, batch, error, 0);
                }
            } finally {
                finishFlush();
                done.complete(null);
            }
        });
        return done;
    }

    private void finishFlush() {
        lock.lock();
        try {
            flushing = false;
            if (!buffer.isEmpty()) {
                scheduleFlush(untilEligible(scheduler.currentTimeMillis()));
            }
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<Void> deliver(List<LogRecord> batch) {
        try {
            CompletableFuture<Void> future = flushHandler.onFlush(batch);
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** 기본 flush 처리: 하위 sink 에 병렬 전달 */
    private CompletableFuture<Void> fanOut(List<LogRecord> batch) {
        List<LogSink> sinks = List.copyOf(downstream);
        if (sinks.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] futures = sinks.stream()
                .map(sink -> {
                    try {
                        return sink.logBatch(batch);
                    } catch (RuntimeException e) {
                        return CompletableFuture.<Void>failedFuture(e);
                    }
                })
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures);
    }

    private void onDelivered(String batchId, List<LogRecord> batch, int attempt) {
        metrics.recordBatchFlushed();
        metrics.recordDelivered(batch.size());
        if (attempt > 0) {
            log.info("Reporter {} delivered batch {} on retry {}", name, batchId, attempt);
        }
    }

    // ---- retry ----

    private void handleFailure(String batchId, List<LogRecord> batch, Throwable error, int attempt) {
        Throwable cause = unwrap(error);

        if (!config.isRetryOnFailure()) {
            drop(batchId, batch, cause, attempt + 1);
            return;
        }
        if (attempt >= config.getMaxRetries() || closed) {
            drop(batchId, batch, cause, attempt + 1);
            return;
        }

        long delay = retryPolicy.calculateDelay(attempt).toMillis();
        RetryTask task = new RetryTask(batchId, batch, attempt + 1, delay);
        retries.put(batchId, task);
        metrics.recordBatchRetry();
        log.warn("Reporter {} failed to deliver batch {} ({} records), retry {}/{} in {}ms: {}",
                name, batchId, batch.size(), task.attempt(), config.getMaxRetries(), task.nextDelayMs(), cause.getMessage());

        task.arm(scheduler.schedule(() -> runRetry(task), delay));
    }

    private void runRetry(RetryTask task) {
        if (retries.get(task.batchId()) != task) {
            return;
        }
        deliver(task.records()).whenComplete((v, error) -> {
            if (error == null) {
                retries.remove(task.batchId(), task);
                onDelivered(task.batchId(), task.records(), task.attempt());
            } else {
                handleFailure(task.batchId(), task.records(), error, task.attempt());
            }
        });
    }

    private void drop(String batchId, List<LogRecord> batch, Throwable cause, int attempts) {
        retries.remove(batchId);
        metrics.recordBatchDropped();
        metrics.recordDropped("delivery-failed", batch.size());
        log.error("Reporter {} dropped batch {} ({} records) after {} attempts: {}",
                name, batchId, batch.size(), attempts, cause.getMessage());
        report(batchId, batch, cause);
    }

    private void report(String batchId, List<LogRecord> batch, Throwable cause) {
        try {
            failureListener.onDeliveryFailed(name, batchId, batch, cause);
        } catch (RuntimeException e) {
            log.warn("Delivery failure listener threw for batch {}", batchId, e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static String newBatchId(long now) {
        return "batch-" + now + "-" + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }

    /**
     * 배치 전달 처리기. 반환된 future 가 실패하면 재시도한다.
     */
    @FunctionalInterface
    public interface FlushHandler {
        CompletableFuture<Void> onFlush(List<LogRecord> batch);
    }

    /**
     * 예약된 재시도. attempt 는 이번에 수행할 재시도 번호 (1부터).
     */
    static final class RetryTask {

        private final String batchId;
        private final List<LogRecord> records;
        private final int attempt;
        private final long nextDelayMs;
        private volatile ScheduledTask handle;

        RetryTask(String batchId, List<LogRecord> records, int attempt, long nextDelayMs) {
            this.batchId = batchId;
            this.records = records;
            this.attempt = attempt;
            this.nextDelayMs = nextDelayMs;
        }

        String batchId() {
            return batchId;
        }

        List<LogRecord> records() {
            return records;
        }

        int attempt() {
            return attempt;
        }

        long nextDelayMs() {
            return nextDelayMs;
        }

        void arm(ScheduledTask handle) {
            this.handle = handle;
        }

        void cancel() {
            ScheduledTask current = handle;
            if (current != null) {
                current.cancel();
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private BatchConfig config = BatchConfig.builder().build();
        private Scheduler scheduler;
        private RelayMetrics metrics = new RelayMetrics();
        private DeliveryFailureListener failureListener = new LoggingDeliveryFailureListener();
        private FlushHandler flushHandler;
        private final List<LogSink> sinks = new ArrayList<>();

        public Builder(String name) {
            this.name = name;
        }

        public Builder config(BatchConfig config) {
            this.config = config;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder metrics(RelayMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder failureListener(DeliveryFailureListener failureListener) {
            this.failureListener = failureListener;
            return this;
        }

        /**
         * flush 처리기 지정. 지정하면 하위 sink 전달 대신 사용된다.
         */
        public Builder onFlush(FlushHandler flushHandler) {
            this.flushHandler = flushHandler;
            return this;
        }

        public Builder sink(LogSink sink) {
            this.sinks.add(sink);
            return this;
        }

        public Builder sinks(List<? extends LogSink> sinks) {
            this.sinks.addAll(sinks);
            return this;
        }

        public BatchReporter build() {
            return new BatchReporter(this);
        }
    }
}
