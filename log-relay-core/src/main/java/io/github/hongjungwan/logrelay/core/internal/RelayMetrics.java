package io.github.hongjungwan.logrelay.core.internal;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * relay 메트릭 수집 (LongAdder 기반 lock-free). 구성 요소마다 같은 인스턴스를 주입받는다.
 */
public final class RelayMetrics {

    private final Instant startTime = Instant.now();

    private final LongAdder recordsBuffered = new LongAdder();
    private final LongAdder recordsDelivered = new LongAdder();
    private final LongAdder recordsDropped = new LongAdder();
    private final LongAdder batchesFlushed = new LongAdder();
    private final LongAdder batchRetries = new LongAdder();
    private final LongAdder batchesDropped = new LongAdder();
    private final LongAdder bytesWritten = new LongAdder();
    private final LongAdder fileRotations = new LongAdder();
    private final LongAdder httpRequests = new LongAdder();
    private final LongAdder httpFailures = new LongAdder();
    private final LongAdder requestsAllowed = new LongAdder();
    private final LongAdder requestsRejected = new LongAdder();
    private final LongAdder ipBlocks = new LongAdder();
    private final LongAdder storageErrors = new LongAdder();
    private final Map<String, LongAdder> dropReasons = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> rejectedByTier = new ConcurrentHashMap<>();

    public void recordBuffered(int count) {
        recordsBuffered.add(count);
    }

    public void recordDelivered(int count) {
        recordsDelivered.add(count);
    }

    public void recordDropped(String reason, int count) {
        recordsDropped.add(count);
        dropReasons.computeIfAbsent(reason, k -> new LongAdder()).add(count);
    }

    public void recordBatchFlushed() {
        batchesFlushed.increment();
    }

    public void recordBatchRetry() {
        batchRetries.increment();
    }

    public void recordBatchDropped() {
        batchesDropped.increment();
    }

    public void recordBytesWritten(long bytes) {
        bytesWritten.add(bytes);
    }

    public void recordFileRotation() {
        fileRotations.increment();
    }

    public void recordHttpRequest(boolean success) {
        httpRequests.increment();
        if (!success) {
            httpFailures.increment();
        }
    }

    public void recordAdmission(boolean allowed, String tier) {
        if (allowed) {
            requestsAllowed.increment();
        } else {
            requestsRejected.increment();
            rejectedByTier.computeIfAbsent(tier, k -> new LongAdder()).increment();
        }
    }

    public void recordIpBlock() {
        ipBlocks.increment();
    }

    public void recordStorageError() {
        storageErrors.increment();
    }

    public Snapshot getSnapshot() {
        return new Snapshot(
                Instant.now(),
                startTime,
                recordsBuffered.sum(),
                recordsDelivered.sum(),
                recordsDropped.sum(),
                batchesFlushed.sum(),
                batchRetries.sum(),
                batchesDropped.sum(),
                bytesWritten.sum(),
                fileRotations.sum(),
                httpRequests.sum(),
                httpFailures.sum(),
                requestsAllowed.sum(),
                requestsRejected.sum(),
                ipBlocks.sum(),
                storageErrors.sum(),
                sums(dropReasons),
                sums(rejectedByTier)
        );
    }

    private static Map<String, Long> sums(Map<String, LongAdder> counters) {
        return counters.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().sum()));
    }

    /**
     * 메트릭 스냅샷
     */
    public record Snapshot(
            Instant timestamp,
            Instant startTime,
            long recordsBuffered,
            long recordsDelivered,
            long recordsDropped,
            long batchesFlushed,
            long batchRetries,
            long batchesDropped,
            long bytesWritten,
            long fileRotations,
            long httpRequests,
            long httpFailures,
            long requestsAllowed,
            long requestsRejected,
            long ipBlocks,
            long storageErrors,
            Map<String, Long> dropReasons,
            Map<String, Long> rejectedByTier
    ) {
        public double rejectionRate() {
            long total = requestsAllowed + requestsRejected;
            return total > 0 ? (double) requestsRejected / total : 0;
        }
    }
}
