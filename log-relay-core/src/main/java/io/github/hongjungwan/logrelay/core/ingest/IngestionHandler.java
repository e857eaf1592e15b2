package io.github.hongjungwan.logrelay.core.ingest;

import io.github.hongjungwan.logrelay.api.domain.LogBatch;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.core.admission.LoopDetector;
import io.github.hongjungwan.logrelay.core.admission.ProcessChainTracker;
import io.github.hongjungwan.logrelay.core.admission.RateLimitIdentifierExtractor;
import io.github.hongjungwan.logrelay.core.admission.RateLimitResponseFactory;
import io.github.hongjungwan.logrelay.core.internal.LogRecordSerializer;
import io.github.hongjungwan.logrelay.core.queue.ServerLogQueue;
import io.github.hongjungwan.logrelay.core.ratelimit.RateLimitCheckResult;
import io.github.hongjungwan.logrelay.core.ratelimit.RateLimitIdentifier;
import io.github.hongjungwan.logrelay.core.ratelimit.SlidingWindowRateLimiter;
import io.github.hongjungwan.logrelay.core.scheduling.Scheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@code POST <endpoint>} 처리. 라우팅은 호스트 프레임워크가 맡고, 여기서는 순서대로
 * rate limit (429), 본문 검증 (400 INVALID_BATCH), 루프 감지 (400 LOOP_DETECTED) 를 거쳐
 * 서버 큐에 넘긴다 (202).
 *
 * <p>예외를 던지지 않는다. 모든 결과는 {@link IngestionResponse} 로 돌려준다.</p>
 */
@Slf4j
public class IngestionHandler {

    private final SlidingWindowRateLimiter rateLimiter;
    private final RateLimitIdentifierExtractor identifierExtractor;
    private final RateLimitResponseFactory responseFactory;
    private final LoopDetector loopDetector;
    private final LogRecordSerializer serializer;
    private final ServerLogQueue queue;
    private final Scheduler scheduler;
    private final ProcessChainTracker processChain;

    public IngestionHandler(SlidingWindowRateLimiter rateLimiter,
                            RateLimitIdentifierExtractor identifierExtractor,
                            RateLimitResponseFactory responseFactory,
                            LoopDetector loopDetector,
                            LogRecordSerializer serializer,
                            ServerLogQueue queue,
                            Scheduler scheduler) {
        this(rateLimiter, identifierExtractor, responseFactory, loopDetector, serializer, queue, scheduler,
                new ProcessChainTracker());
    }

    /**
     * @param processChain 받아들인 배치의 chain 을 기록할 곳. HTTP 전달 sink 와 같은 인스턴스여야 한다
     */
    public IngestionHandler(SlidingWindowRateLimiter rateLimiter,
                            RateLimitIdentifierExtractor identifierExtractor,
                            RateLimitResponseFactory responseFactory,
                            LoopDetector loopDetector,
                            LogRecordSerializer serializer,
                            ServerLogQueue queue,
                            Scheduler scheduler,
                            ProcessChainTracker processChain) {
        this.rateLimiter = rateLimiter;
        this.identifierExtractor = identifierExtractor;
        this.responseFactory = responseFactory;
        this.loopDetector = loopDetector;
        this.serializer = serializer;
        this.queue = queue;
        this.scheduler = scheduler;
        this.processChain = processChain;
    }

    public IngestionResponse handle(IngestionRequest request) {
        // 1. admission
        RateLimitIdentifier identifier = identifierExtractor.extract(request.headers(), request.remoteAddress());
        List<RateLimitCheckResult> results = rateLimiter.checkRateLimit(identifier);
        if (results != null && !results.isEmpty()) {
            RateLimitCheckResult last = results.get(results.size() - 1);
            if (!last.allowed()) {
                log.warn("Rate limit exceeded for {} ({} tier): {}/{}",
                        identifier.ip(), last.tier().wireName(), last.current(), last.limit());
                return IngestionResponse.rateLimited(responseFactory.create(last));
            }
        }

        // 2. body
        LogBatch batch;
        try {
            batch = serializer.deserializeBatch(request.body());
        } catch (LogRecordSerializer.SerializationException e) {
            log.debug("Rejecting unreadable batch from {}: {}", identifier.ip(), e.getMessage());
            return IngestionResponse.badRequest(IngestionResponse.INVALID_BATCH, e.getMessage(), null);
        }
        if (batch == null || batch.logs() == null) {
            return IngestionResponse.badRequest(IngestionResponse.INVALID_BATCH, "logs is required", null);
        }
        if (batch.logs().stream().anyMatch(record -> record == null)) {
            return IngestionResponse.badRequest(IngestionResponse.INVALID_BATCH, "logs must not contain null", null);
        }

        // 3. loop
        LoopDetector.Result loop = loopDetector.check(request.headers(), batch, scheduler.currentTimeMillis());
        if (loop.loop()) {
            log.error("Logging loop detected from {}: {}", identifier.ip(), String.join("; ", loop.reasons()));
            return IngestionResponse.badRequest(IngestionResponse.LOOP_DETECTED,
                    "Logging loop detected", loop.reasons());
        }
        if (!loop.warnings().isEmpty()) {
            log.warn("Potential loop risk from {}: {}", identifier.ip(), String.join("; ", loop.warnings()));
        }

        processChain.record(batch.meta());

        // 4. hand-off
        List<LogRecord> logs = batch.logs();
        if (!logs.isEmpty()) {
            queue.enqueueBatch(batch);
        }
        return IngestionResponse.accepted();
    }
}
