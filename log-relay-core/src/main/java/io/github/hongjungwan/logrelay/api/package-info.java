/**
 * Public API for log-relay.
 *
 * <p>Domain types, configuration and header helpers shared by clients and the relay server.
 * Classes in this package are immutable and safe to pass between threads.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.logrelay.api.domain.LogRecord} - Log record sent through the pipeline</li>
 *   <li>{@link io.github.hongjungwan.logrelay.api.domain.LogBatch} - Ingestion request body</li>
 *   <li>{@link io.github.hongjungwan.logrelay.api.config.LogRelayConfig} - Relay configuration</li>
 *   <li>{@link io.github.hongjungwan.logrelay.api.http.Headers} - Case-insensitive header access</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * LogRecord record = LogRecord.builder()
 *         .time(System.currentTimeMillis())
 *         .level(LogLevel.INFO.value())
 *         .message("Order placed")
 *         .context(Map.of("orderId", "A-1001"))
 *         .trace(TraceContext.of(TraceIds.newTraceId(), TraceIds.newSpanId()))
 *         .build();
 *
 * serverLogQueue.enqueue(record);
 * }</pre>
 */
package io.github.hongjungwan.logrelay.api;
