package io.github.hongjungwan.logrelay.starter;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.github.hongjungwan.logrelay.api.config.BatchConfig;
import io.github.hongjungwan.logrelay.api.config.FileSinkConfig;
import io.github.hongjungwan.logrelay.api.config.HttpSinkConfig;
import io.github.hongjungwan.logrelay.api.config.LogRelayConfig;
import io.github.hongjungwan.logrelay.api.config.RateLimitConfig;
import io.github.hongjungwan.logrelay.api.config.ScrubRule;
import io.github.hongjungwan.logrelay.api.config.ScrubberConfig;
import io.github.hongjungwan.logrelay.core.admission.LoopDetector;
import io.github.hongjungwan.logrelay.core.admission.ProcessChainTracker;
import io.github.hongjungwan.logrelay.core.admission.RateLimitIdentifierExtractor;
import io.github.hongjungwan.logrelay.core.admission.RateLimitResponseFactory;
import io.github.hongjungwan.logrelay.core.diagnostics.LogRelayDoctor;
import io.github.hongjungwan.logrelay.core.ingest.IngestionHandler;
import io.github.hongjungwan.logrelay.core.internal.LogRecordSerializer;
import io.github.hongjungwan.logrelay.core.internal.LogRelayAppender;
import io.github.hongjungwan.logrelay.core.internal.RelayMetrics;
import io.github.hongjungwan.logrelay.core.queue.ServerLogQueue;
import io.github.hongjungwan.logrelay.core.ratelimit.SlidingWindowRateLimiter;
import io.github.hongjungwan.logrelay.core.scheduling.ExecutorScheduler;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import io.github.hongjungwan.logrelay.core.sink.LoggingDeliveryFailureListener;
import io.github.hongjungwan.logrelay.core.storage.InMemoryStorageBackend;
import io.github.hongjungwan.logrelay.core.storage.TtlKeyValueStore;
import io.github.hongjungwan.logrelay.spi.DeliveryFailureListener;
import io.github.hongjungwan.logrelay.spi.KeyValueStore;
import io.github.hongjungwan.logrelay.spi.StorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * log-relay Spring Boot 자동 설정.
 *
 * <p>모든 서비스는 여기서 명시적으로 생성되고, 시작/종료는 {@link LogRelayLifecycle} 이 맡는다.</p>
 */
@AutoConfiguration
@EnableConfigurationProperties(LogRelayProperties.class)
@ConditionalOnProperty(prefix = "log-relay", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LogRelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LogRelayConfig logRelayConfig(LogRelayProperties properties) {
        LogRelayProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        LogRelayProperties.BatchProperties batch = properties.getBatch();
        LogRelayProperties.FileProperties file = properties.getFile();
        LogRelayProperties.HttpProperties http = properties.getHttp();
        LogRelayProperties.ScrubProperties scrub = properties.getScrub();

        List<ScrubRule> scrubRules = new ArrayList<>(ScrubberConfig.DEFAULT_RULES);
        if (scrub.getRedactFields() != null && !scrub.getRedactFields().isEmpty()) {
            scrubRules.add(new ScrubRule(ScrubRule.Action.REDACT_FULL, scrub.getRedactFields(), null,
                    110, "Configured redact fields"));
        }

        HttpSinkConfig httpConfig = null;
        if (http.getEndpoint() != null && !http.getEndpoint().isBlank()) {
            httpConfig = HttpSinkConfig.builder()
                    .endpoint(http.getEndpoint())
                    .timeoutMs(http.getTimeoutMs())
                    .maxRetries(http.getMaxRetries())
                    .retryDelayMs(http.getRetryDelayMs())
                    .headers(Map.copyOf(http.getHeaders()))
                    .build();
        }

        return LogRelayConfig.builder()
                .appName(properties.getAppName())
                .appVersion(properties.getAppVersion())
                .storageNamespace(properties.getStorageNamespace())
                .fileEnabled(file.isEnabled())
                .rateLimit(RateLimitConfig.builder()
                        .enabled(rateLimit.isEnabled())
                        .globalLimit(rateLimit.getGlobal().getLimit())
                        .globalWindowSeconds(rateLimit.getGlobal().getWindowSeconds())
                        .ipLimit(rateLimit.getIp().getLimit())
                        .ipWindowSeconds(rateLimit.getIp().getWindowSeconds())
                        .reporterLimit(rateLimit.getReporter().getLimit())
                        .reporterWindowSeconds(rateLimit.getReporter().getWindowSeconds())
                        .appLimit(rateLimit.getApp().getLimit())
                        .appWindowSeconds(rateLimit.getApp().getWindowSeconds())
                        .blockingEnabled(rateLimit.getBlocking().isEnabled())
                        .escalationResetHours(rateLimit.getBlocking().getEscalationResetHours())
                        .blockTimeoutsSeconds(List.copyOf(rateLimit.getBlocking().getTimeouts()))
                        .failOpen(rateLimit.isFailOpen())
                        .cleanupIntervalMs(rateLimit.getCleanupIntervalMs())
                        .build())
                .batch(BatchConfig.builder()
                        .enabled(batch.isEnabled())
                        .maxSize(batch.getMaxSize())
                        .maxAgeMs(batch.getMaxAgeMs())
                        .sortingWindowMs(batch.getSortingWindowMs())
                        .retryOnFailure(batch.isRetryOnFailure())
                        .maxRetries(batch.getMaxRetries())
                        .retryDelayMs(batch.getRetryDelayMs())
                        .levels(batch.getLevels() == null || batch.getLevels().isEmpty() ? null : Set.copyOf(batch.getLevels()))
                        .build())
                .file(FileSinkConfig.builder()
                        .directory(file.getDirectory())
                        .fileNameFormat(file.getFileNameFormat())
                        .maxSize(file.getMaxSize())
                        .flushIntervalMs(file.getFlushIntervalMs())
                        .bufferMaxSize(file.getBufferMaxSize())
                        .additionalFields(Map.copyOf(file.getAdditionalFields()))
                        .build())
                .http(httpConfig)
                .scrub(ScrubberConfig.builder()
                        .enabled(scrub.isEnabled())
                        .rules(List.copyOf(scrubRules))
                        .deepScrub(scrub.isDeepScrub())
                        .preserveTypes(scrub.isPreserveTypes())
                        .maxDepth(scrub.getMaxDepth())
                        .build())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public LogRecordSerializer logRecordSerializer() {
        return new LogRecordSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayMetrics relayMetrics() {
        return new RelayMetrics();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(Scheduler.class)
    public ExecutorScheduler logRelayScheduler(LogRelayProperties properties) {
        return new ExecutorScheduler("log-relay-scheduler", properties.getSchedulerThreads());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryFailureListener deliveryFailureListener() {
        return new LoggingDeliveryFailureListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public StorageBackend storageBackend() {
        return new InMemoryStorageBackend();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore(StorageBackend backend, LogRelayConfig config,
                                       LogRecordSerializer serializer, Scheduler scheduler) {
        return new TtlKeyValueStore(backend, config.getStorageNamespace(),
                serializer.getObjectMapper(), scheduler::currentTimeMillis);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(LogRelayConfig config, KeyValueStore store,
                                                             Scheduler scheduler, RelayMetrics metrics) {
        return new SlidingWindowRateLimiter(config.getRateLimit(), store, scheduler, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitIdentifierExtractor rateLimitIdentifierExtractor(LogRelayProperties properties) {
        return new RateLimitIdentifierExtractor(properties.isTrustForwardedHeaders());
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitResponseFactory rateLimitResponseFactory() {
        return new RateLimitResponseFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public LoopDetector loopDetector(LogRelayConfig config) {
        return new LoopDetector(config.getAppName());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessChainTracker processChainTracker() {
        return new ProcessChainTracker();
    }

    @Bean(destroyMethod = "destroy")
    @ConditionalOnMissingBean
    public ServerLogQueue serverLogQueue(LogRelayConfig config, Scheduler scheduler, RelayMetrics metrics,
                                         DeliveryFailureListener failureListener, ProcessChainTracker processChain) {
        return ServerLogQueue.create(config, scheduler, metrics, failureListener, processChain);
    }

    @Bean
    @ConditionalOnMissingBean
    public IngestionHandler ingestionHandler(SlidingWindowRateLimiter rateLimiter,
                                             RateLimitIdentifierExtractor extractor,
                                             RateLimitResponseFactory responseFactory,
                                             LoopDetector loopDetector,
                                             LogRecordSerializer serializer,
                                             ServerLogQueue queue,
                                             Scheduler scheduler,
                                             ProcessChainTracker processChain) {
        return new IngestionHandler(rateLimiter, extractor, responseFactory, loopDetector, serializer, queue,
                scheduler, processChain);
    }

    @Bean
    @ConditionalOnMissingBean
    public LogRelayDoctor logRelayDoctor(LogRelayConfig config, KeyValueStore store) {
        return new LogRelayDoctor(config, store);
    }

    @Bean
    public LogRelayLifecycle logRelayLifecycle(
            LogRelayDoctor doctor,
            SlidingWindowRateLimiter rateLimiter,
            ServerLogQueue queue,
            LogRelayProperties properties
    ) {
        return new LogRelayLifecycle(doctor, rateLimiter, queue, properties.isCaptureApplicationLogs());
    }

    /**
     * relay 초기화 및 종료를 관리하는 SmartLifecycle 구현체.
     */
    static class LogRelayLifecycle implements SmartLifecycle {

        private final LogRelayDoctor doctor;
        private final SlidingWindowRateLimiter rateLimiter;
        private final ServerLogQueue queue;
        private final boolean captureApplicationLogs;
        private volatile LogRelayAppender appender;
        private volatile boolean running = false;

        LogRelayLifecycle(LogRelayDoctor doctor, SlidingWindowRateLimiter rateLimiter,
                          ServerLogQueue queue, boolean captureApplicationLogs) {
            this.doctor = doctor;
            this.rateLimiter = rateLimiter;
            this.queue = queue;
            this.captureApplicationLogs = captureApplicationLogs;
        }

        @Override
        public void start() {
            log.info("Starting log-relay...");

            LogRelayDoctor.DiagnosticReport report = doctor.diagnose();
            if (report.hasFailures()) {
                log.warn("log-relay started with {} failed diagnostic checks", report.getFailedChecks().size());
            }

            rateLimiter.start();

            if (captureApplicationLogs) {
                attachAppender();
            }

            running = true;
            log.info("log-relay started (sinks: {})", queue.getReporterInfo().reporters());
        }

        @Override
        public void stop() {
            log.info("Stopping log-relay...");

            detachAppender();
            rateLimiter.close();
            queue.destroy();

            running = false;
            log.info("log-relay stopped");
        }

        private void attachAppender() {
            ILoggerFactory factory = LoggerFactory.getILoggerFactory();
            if (!(factory instanceof LoggerContext)) {
                log.warn("Logback is not the active SLF4J binding, application logs will not be captured");
                return;
            }
            LoggerContext context = (LoggerContext) factory;
            LogRelayAppender relayAppender = new LogRelayAppender(queue);
            relayAppender.setContext(context);
            relayAppender.start();
            context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(relayAppender);
            this.appender = relayAppender;
            log.info("LogRelayAppender attached to root logger");
        }

        private void detachAppender() {
            LogRelayAppender current = appender;
            if (current == null) {
                return;
            }
            ILoggerFactory factory = LoggerFactory.getILoggerFactory();
            if (factory instanceof LoggerContext) {
                ((LoggerContext) factory).getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(current);
            }
            current.stop();
            appender = null;
        }

        boolean isAppenderAttached() {
            return appender != null;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
