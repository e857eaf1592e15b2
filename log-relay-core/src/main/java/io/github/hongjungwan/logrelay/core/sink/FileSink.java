package io.github.hongjungwan.logrelay.core.sink;

import io.github.hongjungwan.logrelay.api.config.FileSinkConfig;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.core.internal.LogRecordSerializer;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.scheduling.ScheduledTask;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import io.github.hongjungwan.logrelay.spi.DeliveryFailureListener;
import io.github.hongjungwan.logrelay.spi.LogSink;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * NDJSON 파일 sink. 한 줄에 레코드 하나 (UTF-8).
 *
 * <p>{@link #log(LogRecord)} 는 메모리 버퍼에 쌓고 flushInterval 타이머 또는 bufferMaxSize 도달 시 쓴다.
 * {@link #logBatch(List)} 는 버퍼를 거치지 않고 바로 쓰며 실패를 반환 future 로 알린다.</p>
 *
 * <p>모든 쓰기는 하나의 write chain 으로 직렬화되어 동시 flush 가 같은 스트림에 섞여 쓰이지 않는다.
 * 파일명은 쓰기 시점의 날짜 토큰으로 계산되며, {@code currentFileSize + pending > maxSize} 이면
 * 현재 파일을 타임스탬프 접미사로 rename 하고 새 파일을 연다.</p>
 */
@Slf4j
public class FileSink implements LogSink, AutoCloseable {

    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    private final String name;
    private final FileSinkConfig config;
    private final Path directory;
    private final FileNameTemplate fileNameTemplate;
    private final Scheduler scheduler;
    private final Executor ioExecutor;
    private final ExecutorService ownedExecutor;
    private final LogRecordSerializer serializer;
    private final RelayMetrics metrics;
    private final DeliveryFailureListener failureListener;

    private final ReentrantLock lock = new ReentrantLock();
    private List<PendingLine> pending = new ArrayList<>();
    private long bufferedBytes;
    private int consecutiveFailures;
    private ScheduledTask flushTimer;
    private CompletableFuture<Void> writeChain = CompletableFuture.completedFuture(null);

    // write chain 안에서만 접근. currentFile 은 getCurrentFile 이 다른 스레드에서 읽는다
    private OutputStream stream;
    private volatile Path currentFile;
    private long currentFileSize;

    private FileSink(Builder builder) {
        this.name = builder.name;
        this.config = builder.config;
        this.directory = Paths.get(config.getDirectory());
        this.fileNameTemplate = new FileNameTemplate(config.getFileNameFormat(), config.getZoneId());
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.serializer = builder.serializer;
        this.metrics = builder.metrics;
        this.failureListener = builder.failureListener;

        if (builder.ioExecutor != null) {
            this.ioExecutor = builder.ioExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "log-relay-file-writer-" + name);
                t.setDaemon(true);
                return t;
            });
            this.ioExecutor = ownedExecutor;
        }

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.error("Failed to create log directory {}, will retry on first write", directory, e);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void log(LogRecord record) {
        String line;
        try {
            line = serializer.toJsonLine(record, config.getAdditionalFields());
        } catch (LogRecordSerializer.SerializationException e) {
            metrics.recordDropped("serialization", 1);
            log.warn("Dropping unserializable record: {}", e.getMessage());
            return;
        }

        boolean flushNow;
        lock.lock();
        try {
            PendingLine pendingLine = new PendingLine(record, line, utf8Length(line));
            pending.add(pendingLine);
            bufferedBytes += pendingLine.bytes();
            flushNow = bufferedBytes >= config.getBufferMaxSize();
            if (!flushNow && flushTimer == null) {
                flushTimer = scheduler.schedule(this::onFlushTimer, config.getFlushIntervalMs());
            }
        } finally {
            lock.unlock();
        }

        if (flushNow) {
            flush();
        }
    }

    /**
     * 버퍼를 거치지 않고 바로 기록. 쓰기 실패는 반환 future 로 전달된다.
     */
    @Override
    public CompletableFuture<Void> logBatch(List<LogRecord> records) {
        if (records == null || records.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        StringBuilder content = new StringBuilder();
        for (LogRecord record : records) {
            try {
                content.append(serializer.toJsonLine(record, config.getAdditionalFields()));
            } catch (LogRecordSerializer.SerializationException e) {
                metrics.recordDropped("serialization", 1);
                log.warn("Dropping unserializable record: {}", e.getMessage());
            }
        }
        if (content.length() == 0) {
            return CompletableFuture.completedFuture(null);
        }
        int count = records.size();
        return enqueueWrite(content.toString())
                .thenRun(() -> metrics.recordDelivered(count));
    }

    /**
     * 버퍼 내용을 기록. 실패 시 버퍼를 복원하고 flush 를 다시 예약한 뒤 예외로 완료된다.
     */
    @Override
    public CompletableFuture<Void> flush() {
        List<PendingLine> lines;
        lock.lock();
        try {
            cancelFlushTimer();
            if (pending.isEmpty()) {
                return writeChain.handle((v, e) -> null);
            }
            lines = pending;
            pending = new ArrayList<>();
            bufferedBytes = 0;
        } finally {
            lock.unlock();
        }

        StringBuilder content = new StringBuilder();
        for (PendingLine line : lines) {
            content.append(line.line());
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        enqueueWrite(content.toString()).whenComplete((v, error) -> {
            if (error == null) {
                onWriteSucceeded(lines.size());
                result.complete(null);
            } else {
                restore(lines, error);
                result.completeExceptionally(error);
            }
        });
        return result;
    }

    /**
     * 타이머를 취소하고 버퍼를 기록한 뒤 스트림을 닫는다 (종료 시 사용).
     */
    @Override
    public CompletableFuture<Void> forceFlush() {
        lock.lock();
        try {
            cancelFlushTimer();
        } finally {
            lock.unlock();
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        flush().whenComplete((v, flushError) -> enqueue(this::closeStream).whenComplete((v2, closeError) -> {
            Throwable error = flushError != null ? flushError : closeError;
            if (error == null) {
                result.complete(null);
            } else {
                result.completeExceptionally(error);
            }
        }));
        return result;
    }

    @Override
    public void close() {
        try {
            forceFlush().get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing file sink {}", name);
        } catch (TimeoutException e) {
            log.warn("Timed out closing file sink {} after {}s", name, CLOSE_TIMEOUT_SECONDS);
        } catch (Exception e) {
            log.error("Final flush failed for file sink {}", name, e);
        } finally {
            if (ownedExecutor != null) {
                ownedExecutor.shutdown();
            }
        }
    }

    /** 현재 쓰기 대상 파일 (아직 열리지 않았으면 템플릿으로 계산) */
    public Path getCurrentFile() {
        Path file = currentFile;
        return file != null ? file : directory.resolve(fileNameTemplate.resolve(scheduler.currentTimeMillis()));
    }

    public long getBufferedBytes() {
        lock.lock();
        try {
            return bufferedBytes;
        } finally {
            lock.unlock();
        }
    }

    public int getBufferedCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    // ---- buffering ----

    private void onFlushTimer() {
        lock.lock();
        try {
            flushTimer = null;
        } finally {
            lock.unlock();
        }
        flush();
    }

    private void cancelFlushTimer() {
        if (flushTimer != null) {
            flushTimer.cancel();
            flushTimer = null;
        }
    }

    private void onWriteSucceeded(int count) {
        lock.lock();
        try {
            consecutiveFailures = 0;
        } finally {
            lock.unlock();
        }
        metrics.recordDelivered(count);
    }

    private void restore(List<PendingLine> lines, Throwable error) {
        List<LogRecord> dropped = null;
        lock.lock();
        try {
            consecutiveFailures++;
            List<PendingLine> restored = new ArrayList<>(lines.size() + pending.size());
            restored.addAll(lines);
            restored.addAll(pending);
            pending = restored;
            bufferedBytes = pending.stream().mapToLong(PendingLine::bytes).sum();

            if (consecutiveFailures > config.getMaxWriteRetries()) {
                dropped = pending.stream().map(PendingLine::record).toList();
                pending = new ArrayList<>();
                bufferedBytes = 0;
                consecutiveFailures = 0;
            } else if (flushTimer == null) {
                flushTimer = scheduler.schedule(this::onFlushTimer, config.getFlushIntervalMs());
            }
        } finally {
            lock.unlock();
        }

        if (dropped != null) {
            metrics.recordDropped("file-write-failed", dropped.size());
            log.error("File sink {} dropped {} buffered records after {} failed writes",
                    name, dropped.size(), config.getMaxWriteRetries() + 1, error);
            try {
                failureListener.onDeliveryFailed(name, null, dropped, error);
            } catch (RuntimeException e) {
                log.warn("Delivery failure listener threw", e);
            }
        } else {
            log.warn("File sink {} write failed, {} records kept for retry: {}", name, lines.size(), error.getMessage());
        }
    }

    // ---- write chain ----

    private CompletableFuture<Void> enqueueWrite(String content) {
        return enqueue(() -> write(content));
    }

    private CompletableFuture<Void> enqueue(Runnable task) {
        lock.lock();
        try {
            CompletableFuture<Void> next = writeChain.handle((v, e) -> null).thenRunAsync(task, ioExecutor);
            writeChain = next;
            return next;
        } finally {
            lock.unlock();
        }
    }

    private void write(String content) {
        byte[] data = content.getBytes(StandardCharsets.UTF_8);
        long now = scheduler.currentTimeMillis();
        Path target = directory.resolve(fileNameTemplate.resolve(now));

        try {
            if (stream == null || !target.equals(currentFile)) {
                openStream(target);
            }
            if (currentFileSize > 0 && currentFileSize + data.length > config.getMaxSize()) {
                rotate(target, now);
            }
            stream.write(data);
            stream.flush();
            currentFileSize += data.length;
            metrics.recordBytesWritten(data.length);
        } catch (IOException e) {
            closeStream();
            throw new UncheckedIOException("Failed to write to " + target, e);
        }
    }

    private void openStream(Path target) throws IOException {
        closeStream();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        currentFileSize = Files.exists(target) ? Files.size(target) : 0;
        stream = new BufferedOutputStream(Files.newOutputStream(target,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
        currentFile = target;
        log.debug("File sink {} opened {} (size: {} bytes)", name, target, currentFileSize);
    }

    private void rotate(Path target, long now) throws IOException {
        closeStream();
        String fileName = target.getFileName().toString();
        Path rotated = target.resolveSibling(FileNameTemplate.rotatedName(fileName, now));
        int suffix = 1;
        while (Files.exists(rotated)) {
            rotated = target.resolveSibling(FileNameTemplate.rotatedName(fileName, now) + "." + suffix++);
        }
        Files.move(target, rotated);
        metrics.recordFileRotation();
        log.info("File sink {} rotated {} to {}", name, target, rotated.getFileName());
        openStream(target);
    }

    private void closeStream() {
        OutputStream current = stream;
        stream = null;
        currentFile = null;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                log.warn("Failed to close log file stream: {}", e.getMessage());
            }
        }
    }

    private static int utf8Length(String line) {
        return line.getBytes(StandardCharsets.UTF_8).length;
    }

    private record PendingLine(LogRecord record, String line, int bytes) {
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private FileSinkConfig config = FileSinkConfig.builder().build();
        private Scheduler scheduler;
        private Executor ioExecutor;
        private LogRecordSerializer serializer = new LogRecordSerializer();
        private RelayMetrics metrics = new RelayMetrics();
        private DeliveryFailureListener failureListener = new LoggingDeliveryFailureListener();

        public Builder(String name) {
            this.name = name;
        }

        public Builder config(FileSinkConfig config) {
            this.config = config;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * 쓰기 실행기. 지정하지 않으면 전용 단일 스레드를 만든다.
         */
        public Builder ioExecutor(Executor ioExecutor) {
            this.ioExecutor = ioExecutor;
            return this;
        }

        public Builder serializer(LogRecordSerializer serializer) {
            this.serializer = serializer;
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

        public FileSink build() {
            return new FileSink(this);
        }
    }
}
