package io.github.hongjungwan.logrelay.core.queue;

import io.github.hongjungwan.logrelay.api.config.LogRelayConfig;
import io.github.hongjungwan.logrelay.api.domain.LogBatch;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.core.admission.ProcessChainTracker;
import io.github.hongjungwan.logrelay.core.batch.BatchReporter;
import io.github.hongjungwan.logrelay.core.internal.LogRecordSerializer;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import io.github.hongjungwan.logrelay.core.scrub.LogScrubber;
import io.github.hongjungwan.logrelay.core.sink.FileSink;
import io.github.hongjungwan.logrelay.core.sink.HttpSink;
import io.github.hongjungwan.logrelay.spi.DeliveryFailureListener;
import io.github.hongjungwan.logrelay.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 서버 측 수집 큐. 수집된 레코드를 primary sink (보통 {@link BatchReporter}) 에 넘기고,
 * 종료 시 모든 sink 를 순서대로 flush 하고 닫는다.
 *
 * <p>primary 에 대한 호출 실패는 기록만 하고 호출자에게 전파하지 않는다.
 * scrubber 가 있으면 primary 에 넘기기 전에 context 를 scrub 한다.</p>
 */
@Slf4j
public class ServerLogQueue implements AutoCloseable {

    private final LogSink primary;
    private final LogScrubber scrubber;
    private final List<LogSink> sinks = new CopyOnWriteArrayList<>();
    private volatile boolean destroyed;

    /**
     * @param primary 레코드를 받는 sink
     * @param sinks   flush/종료 대상 전체. primary 를 포함하며 앞에서부터 flush 된다
     */
    public ServerLogQueue(LogSink primary, List<? extends LogSink> sinks) {
        this(primary, sinks, null);
    }

    /**
     * @param scrubber null 이면 레코드를 그대로 넘긴다
     */
    public ServerLogQueue(LogSink primary, List<? extends LogSink> sinks, LogScrubber scrubber) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.scrubber = scrubber;
        this.sinks.addAll(sinks);
        if (!this.sinks.contains(primary)) {
            this.sinks.add(0, primary);
        }
    }

    /**
     * 설정으로부터 sink 구성을 조립한다. 파일 sink (활성화 시) 와 HTTP 전달 sink (endpoint 설정 시) 를
     * 하위로 두고, 배치가 켜져 있으면 BatchReporter 를 primary 로 둔다.
     */
    public static ServerLogQueue create(LogRelayConfig config, Scheduler scheduler, RelayMetrics metrics,
                                        DeliveryFailureListener failureListener) {
        return create(config, scheduler, metrics, failureListener, null);
    }

    /**
     * @param processChain 수집한 배치의 처리 체인. HTTP 전달 시 이 relay 의 ID 앞에 붙는다
     */
    public static ServerLogQueue create(LogRelayConfig config, Scheduler scheduler, RelayMetrics metrics,
                                        DeliveryFailureListener failureListener, ProcessChainTracker processChain) {
        LogRecordSerializer serializer = new LogRecordSerializer();
        List<LogSink> delivery = new ArrayList<>();
        if (config.isFileEnabled()) {
            delivery.add(FileSink.builder("file")
                    .config(config.getFile())
                    .scheduler(scheduler)
                    .serializer(serializer)
                    .metrics(metrics)
                    .failureListener(failureListener)
                    .build());
        }
        if (config.getHttp() != null) {
            delivery.add(HttpSink.builder("http")
                    .config(config.getHttp())
                    .appInfo(config.appInfo())
                    .scheduler(scheduler)
                    .serializer(serializer)
                    .metrics(metrics)
                    .failureListener(failureListener)
                    .processChain(processChain)
                    .build());
        }
        return compose(config, delivery, scheduler, metrics, failureListener);
    }

    /**
     * 주어진 전달 sink 목록 위에 primary 를 구성한다.
     */
    public static ServerLogQueue compose(LogRelayConfig config, List<? extends LogSink> delivery, Scheduler scheduler,
                                         RelayMetrics metrics, DeliveryFailureListener failureListener) {
        if (delivery.isEmpty()) {
            throw new IllegalArgumentException("At least one delivery sink is required");
        }
        LogScrubber scrubber = config.getScrub().isEnabled() ? new LogScrubber(config.getScrub()) : null;
        if (!config.getBatch().isEnabled()) {
            if (delivery.size() > 1) {
                log.warn("Batching disabled, only {} receives logs", delivery.get(0).getName());
            }
            return new ServerLogQueue(delivery.get(0), delivery, scrubber);
        }

        BatchReporter reporter = BatchReporter.builder("batch")
                .config(config.getBatch())
                .scheduler(scheduler)
                .metrics(metrics)
                .failureListener(failureListener)
                .sinks(delivery)
                .build();
        List<LogSink> all = new ArrayList<>();
        all.add(reporter);
        all.addAll(delivery);
        return new ServerLogQueue(reporter, all, scrubber);
    }

    public void enqueue(LogRecord record) {
        if (destroyed) {
            log.warn("Server log queue destroyed, dropping record");
            return;
        }
        try {
            primary.log(scrubber != null ? scrubber.scrub(record) : record);
        } catch (RuntimeException e) {
            log.error("Primary sink {} rejected record", primary.getName(), e);
        }
    }

    /**
     * @return primary 로 넘긴 레코드 수
     */
    public int enqueueBatch(LogBatch batch) {
        if (batch == null || batch.size() == 0) {
            return 0;
        }
        if (destroyed) {
            log.warn("Server log queue destroyed, dropping {} records", batch.size());
            return 0;
        }
        log.debug("Enqueuing batch of {} logs via {}", batch.size(), primary.getName());
        try {
            List<LogRecord> logs = scrubber != null ? scrubber.scrubAll(batch.logs()) : batch.logs();
            primary.logBatch(logs).whenComplete((v, error) -> {
                if (error != null) {
                    log.error("Primary sink {} failed for batch of {} logs: {}",
                            primary.getName(), batch.size(), error.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.error("Primary sink {} rejected batch", primary.getName(), e);
            return 0;
        }
        return batch.size();
    }

    /**
     * 모든 sink 를 앞에서부터 force flush. 개별 실패는 기록하고 다음 sink 로 진행한다.
     */
    public CompletableFuture<Void> flush() {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (LogSink sink : sinks) {
            chain = chain.thenCompose(v -> forceFlushQuietly(sink));
        }
        return chain;
    }

    /**
     * flush 후 모든 sink 를 닫는다. 이후 enqueue 는 무시된다.
     */
    public void destroy() {
        if (destroyed) {
            return;
        }
        try {
            flush().join();
        } catch (RuntimeException e) {
            log.error("Flush before destroy failed", e);
        }
        destroyed = true;
        for (LogSink sink : sinks) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                log.error("Error closing {}", sink.getName(), e);
            }
        }
        log.info("Server log queue destroyed ({} sinks)", sinks.size());
    }

    @Override
    public void close() {
        destroy();
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public LogScrubber getScrubber() {
        return scrubber;
    }

    public LogSink getPrimary() {
        return primary;
    }

    public List<LogSink> getSinks() {
        return List.copyOf(sinks);
    }

    public ReporterInfo getReporterInfo() {
        return new ReporterInfo(primary.getName(), sinks.stream().map(LogSink::getName).toList());
    }

    private static CompletableFuture<Void> forceFlushQuietly(LogSink sink) {
        CompletableFuture<Void> future;
        try {
            future = sink.forceFlush();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(null);
        }
        return future.handle((v, error) -> {
            if (error != null) {
                log.error("Error flushing {}: {}", sink.getName(), error.getMessage());
            }
            return null;
        });
    }

    /**
     * @param primary   레코드를 받는 sink 이름
     * @param reporters 전체 sink 이름 (flush 순서)
     */
    public record ReporterInfo(String primary, List<String> reporters) {
    }
}
