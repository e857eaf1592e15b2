package io.github.hongjungwan.logrelay.core.sink;

import io.github.hongjungwan.logrelay.api.config.HttpSinkConfig;
import io.github.hongjungwan.logrelay.api.domain.AppInfo;
import io.github.hongjungwan.logrelay.api.domain.BatchMeta;
import io.github.hongjungwan.logrelay.api.domain.LogBatch;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;
import io.github.hongjungwan.logrelay.api.trace.TraceHeaders;
import io.github.hongjungwan.logrelay.core.admission.AdmissionAction;
import io.github.hongjungwan.logrelay.core.admission.ProcessChainTracker;
import io.github.hongjungwan.logrelay.core.internal.LogRecordSerializer;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.resilience.RetryPolicy;
import io.github.hongjungwan.logrelay.core.scheduling.ScheduledTask;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import io.github.hongjungwan.logrelay.spi.DeliveryFailureListener;
import io.github.hongjungwan.logrelay.spi.LogSink;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.Header;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 배치를 다른 수집 엔드포인트로 POST 하는 sink.
 *
 * <p>요청마다 루프 방지 헤더 (reporter ID, processed 표시, source) 와 첫 레코드의 trace 에서 이어받은
 * W3C traceparent/tracestate 를 붙인다. 본문은 {@link LogBatch} 에 meta 를 채운 JSON.</p>
 *
 * <p>타임아웃이 지나면 진행 중인 요청을 abort 한다. 실패는 {@link RetryPolicy} 로 재시도하고,
 * 소진되면 반환 future 를 {@link DeliveryExhaustedException} 으로 완료하며 실패 채널에도 보고한다.
 * 4xx (408, 429 제외) 와 action=block 인 429 는 재시도하지 않는다.</p>
 */
@Slf4j
public class HttpSink implements LogSink, AutoCloseable {

    private static final String TRACESTATE_VENDOR = "logrelay";
    private static final int REQUEST_TIMEOUT = 408;
    private static final int TOO_MANY_REQUESTS = 429;

    private final String name;
    private final HttpSinkConfig config;
    private final URI endpoint;
    private final AppInfo appInfo;
    private final String instanceId;
    private final Scheduler scheduler;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final CloseableHttpClient httpClient;
    private final boolean ownsClient;
    private final LogRecordSerializer serializer;
    private final RelayMetrics metrics;
    private final DeliveryFailureListener failureListener;
    private final ProcessChainTracker processChain;
    private final RetryPolicy retryPolicy;

    private HttpSink(Builder builder) {
        this.name = builder.name;
        this.config = Objects.requireNonNull(builder.config, "config");
        this.endpoint = parseEndpoint(config.getEndpoint());
        this.appInfo = builder.appInfo;
        this.instanceId = "log-relay-http-" + UUID.randomUUID();
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.serializer = builder.serializer;
        this.metrics = builder.metrics;
        this.failureListener = builder.failureListener;
        this.processChain = builder.processChain;

        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "log-relay-http-" + name);
                t.setDaemon(true);
                return t;
            });
            this.executor = ownedExecutor;
        }

        if (builder.httpClient != null) {
            this.httpClient = builder.httpClient;
            this.ownsClient = false;
        } else {
            int timeout = (int) Math.min(Integer.MAX_VALUE, config.getTimeoutMs());
            this.httpClient = HttpClients.custom()
                    .setDefaultRequestConfig(RequestConfig.custom()
                            .setConnectTimeout(timeout)
                            .setConnectionRequestTimeout(timeout)
                            .setSocketTimeout(timeout)
                            .build())
                    .build();
            this.ownsClient = true;
        }

        this.retryPolicy = RetryPolicy.builder()
                .maxRetries(config.getMaxRetries())
                .initialDelay(Duration.ofMillis(config.getRetryDelayMs()))
                .multiplier(2.0)
                .maxDelay(Duration.ofMillis(config.getMaxRetryDelayMs()))
                .retryOn(HttpSink::isRetryable)
                .build();
    }

    @Override
    public String getName() {
        return name;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    /**
     * 레코드 하나를 즉시 전송. 최종 실패는 실패 채널로만 보고된다.
     */
    @Override
    public void log(LogRecord record) {
        logBatch(List.of(record)).exceptionally(error -> {
            log.debug("Single record delivery to {} failed: {}", endpoint, error.getMessage());
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> logBatch(List<LogRecord> records) {
        if (records == null || records.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        LogBatch batch = new LogBatch(records, appInfo,
                new BatchMeta(true, outboundChain(), appInfo.name(), scheduler.currentTimeMillis()));
        byte[] body;
        try {
            body = serializer.serializeBatch(batch);
        } catch (LogRecordSerializer.SerializationException e) {
            metrics.recordDropped("serialization", records.size());
            report(records, e);
            return CompletableFuture.failedFuture(e);
        }
        Map<String, String> headers = requestHeaders(records.get(0));

        CompletableFuture<Void> result = new CompletableFuture<>();
        retryPolicy.executeAsync(() -> send(body, headers), scheduler).whenComplete((v, error) -> {
            if (error == null) {
                metrics.recordDelivered(records.size());
                result.complete(null);
                return;
            }
            Throwable cause = RetryPolicy.unwrap(error);
            int attempts = cause instanceof RetryPolicy.RetryExhaustedException
                    ? ((RetryPolicy.RetryExhaustedException) cause).getAttempts()
                    : 1;
            Throwable root = cause.getCause() != null ? cause.getCause() : cause;
            DeliveryExhaustedException exhausted = new DeliveryExhaustedException(name, attempts, root);
            log.error("Http sink {} dropped {} records for {} after {} attempts: {}",
                    name, records.size(), endpoint, attempts, root.getMessage());
            report(records, exhausted);
            result.completeExceptionally(exhausted);
        });
        return result;
    }

    @Override
    public void close() {
        if (ownsClient) {
            try {
                httpClient.close();
            } catch (IOException e) {
                log.warn("Failed to close http client for sink {}: {}", name, e.getMessage());
            }
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    /** 수집 경로에서 이어받은 chain 뒤에 이 sink 의 ID */
    List<String> outboundChain() {
        return processChain != null ? processChain.outboundChain(instanceId) : List.of(instanceId);
    }

    Map<String, String> requestHeaders(LogRecord first) {
        Map<String, String> headers = new LinkedHashMap<>(config.getHeaders());
        headers.put(RelayHeaders.CONTENT_TYPE, RelayHeaders.JSON_CONTENT_TYPE);
        // 루프 방지
        headers.put(RelayHeaders.REPORTER_ID, instanceId);
        headers.put(RelayHeaders.PROCESSED, "true");
        headers.put(RelayHeaders.SOURCE, appInfo.name());
        headers.putAll(TraceHeaders.outbound(first.getTrace(), TRACESTATE_VENDOR, instanceId));
        return headers;
    }

    private CompletableFuture<Void> send(byte[] body, Map<String, String> headers) {
        return CompletableFuture.runAsync(() -> execute(body, headers), executor);
    }

    private void execute(byte[] body, Map<String, String> headers) {
        HttpPost post = new HttpPost(endpoint);
        headers.forEach(post::setHeader);
        post.setEntity(new ByteArrayEntity(body, ContentType.APPLICATION_JSON));

        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledTask timeout = scheduler.schedule(() -> {
            timedOut.set(true);
            post.abort();
        }, config.getTimeoutMs());

        try (CloseableHttpResponse response = httpClient.execute(post)) {
            int status = response.getStatusLine().getStatusCode();
            Header actionHeader = response.getFirstHeader(RelayHeaders.ACTION);
            EntityUtils.consumeQuietly(response.getEntity());

            boolean success = status >= 200 && status < 300;
            metrics.recordHttpRequest(success);
            if (!success) {
                String action = actionHeader != null ? actionHeader.getValue() : null;
                throw new HttpDeliveryException(
                        String.format("Endpoint %s responded with status %d", endpoint, status),
                        status, isRetryableStatus(status, action));
            }
        } catch (IOException e) {
            metrics.recordHttpRequest(false);
            if (timedOut.get()) {
                throw new HttpDeliveryException(
                        String.format("Request to %s timed out after %dms", endpoint, config.getTimeoutMs()), 0, true);
            }
            throw new UncheckedIOException("Request to " + endpoint + " failed", e);
        } finally {
            timeout.cancel();
        }
    }

    static boolean isRetryableStatus(int status, String action) {
        if (status == TOO_MANY_REQUESTS) {
            return AdmissionAction.fromWireName(action) != AdmissionAction.BLOCK;
        }
        if (status == REQUEST_TIMEOUT) {
            return true;
        }
        return status < 400 || status >= 500;
    }

    private static boolean isRetryable(Throwable error) {
        if (error instanceof HttpDeliveryException) {
            return ((HttpDeliveryException) error).isRetryable();
        }
        return true;
    }

    private void report(List<LogRecord> records, Throwable cause) {
        try {
            failureListener.onDeliveryFailed(name, null, records, cause);
        } catch (RuntimeException e) {
            log.warn("Delivery failure listener threw for sink {}", name, e);
        }
    }

    private static URI parseEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("HttpSink requires an endpoint");
        }
        URI uri;
        try {
            uri = URI.create(endpoint.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid HttpSink endpoint: " + endpoint, e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("HttpSink endpoint must be an http(s) URI: " + endpoint);
        }
        return uri;
    }

    /**
     * 엔드포인트가 2xx 가 아닌 응답을 주었거나 요청이 타임아웃됨
     */
    public static class HttpDeliveryException extends RuntimeException {

        private final int statusCode;
        private final boolean retryable;

        public HttpDeliveryException(String message, int statusCode, boolean retryable) {
            super(message);
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        /** HTTP 상태 코드. 타임아웃이면 0 */
        public int getStatusCode() {
            return statusCode;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private HttpSinkConfig config;
        private AppInfo appInfo = new AppInfo("unknown", "unknown");
        private Scheduler scheduler;
        private Executor executor;
        private CloseableHttpClient httpClient;
        private LogRecordSerializer serializer = new LogRecordSerializer();
        private RelayMetrics metrics = new RelayMetrics();
        private DeliveryFailureListener failureListener = new LoggingDeliveryFailureListener();
        private ProcessChainTracker processChain;

        public Builder(String name) {
            this.name = name;
        }

        public Builder config(HttpSinkConfig config) {
            this.config = config;
            return this;
        }

        public Builder appInfo(AppInfo appInfo) {
            this.appInfo = appInfo;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * 요청 실행기. 지정하지 않으면 전용 daemon 스레드 풀을 만든다.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * 외부에서 만든 클라이언트. 이 경우 close 는 호출자 책임이다.
         */
        public Builder httpClient(CloseableHttpClient httpClient) {
            this.httpClient = httpClient;
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

        /**
         * 수집한 배치의 chain 을 전달 meta 에 이어 붙인다. 없으면 이 sink 의 ID 만 보낸다.
         */
        public Builder processChain(ProcessChainTracker processChain) {
            this.processChain = processChain;
            return this;
        }

        public HttpSink build() {
            return new HttpSink(this);
        }
    }
}
