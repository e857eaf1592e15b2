package io.github.hongjungwan.logrelay.core.internal;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import io.github.hongjungwan.logrelay.api.domain.LogLevel;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.api.domain.TraceContext;
import io.github.hongjungwan.logrelay.core.queue.ServerLogQueue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 애플리케이션 자체 로그를 서버 큐로 보내는 Logback Appender.
 *
 * MDC 의 trace_id/span_id 는 trace 로, 나머지 MDC 는 context 로 옮긴다.
 * relay 자신의 패키지에서 나온 이벤트는 무시한다 (자기 로그가 다시 들어오는 루프 방지).
 */
public class LogRelayAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    static final String RELAY_PACKAGE = "io.github.hongjungwan.logrelay";
    static final String TRACE_ID_KEY = "trace_id";
    static final String SPAN_ID_KEY = "span_id";

    private final ServerLogQueue queue;
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public LogRelayAppender(ServerLogQueue queue) {
        this.queue = queue;
        setName("LOG_RELAY");
    }

    @Override
    protected void append(ILoggingEvent event) {
        String loggerName = event.getLoggerName();
        if (loggerName != null && loggerName.startsWith(RELAY_PACKAGE)) {
            return;
        }
        try {
            queue.enqueue(toRecord(event));
        } catch (RuntimeException e) {
            long dropped = droppedEvents.incrementAndGet();
            if (dropped % 1000 == 1) {
                addError("Failed to relay log event (dropped so far: " + dropped + ")", e);
            }
        }
    }

    static LogRecord toRecord(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("logger", event.getLoggerName());
        context.put("thread", event.getThreadName());
        if (mdc != null) {
            mdc.forEach((key, value) -> {
                if (!TRACE_ID_KEY.equals(key) && !SPAN_ID_KEY.equals(key)) {
                    context.put(key, value);
                }
            });
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            context.put("error", throwable.getClassName() + ": " + throwable.getMessage());
        }

        return LogRecord.builder()
                .time(event.getTimeStamp())
                .level(levelOf(event.getLevel()).value())
                .message(event.getFormattedMessage())
                .context(context)
                .trace(traceOf(mdc))
                .build();
    }

    static LogLevel levelOf(Level level) {
        if (level == null) {
            return LogLevel.INFO;
        }
        switch (level.toInt()) {
            case Level.ERROR_INT:
                return LogLevel.ERROR;
            case Level.WARN_INT:
                return LogLevel.WARN;
            case Level.DEBUG_INT:
                return LogLevel.DEBUG;
            case Level.TRACE_INT:
                return LogLevel.TRACE;
            default:
                return LogLevel.INFO;
        }
    }

    private static TraceContext traceOf(Map<String, String> mdc) {
        if (mdc == null) {
            return null;
        }
        String traceId = mdc.get(TRACE_ID_KEY);
        if (traceId == null || traceId.isEmpty()) {
            return null;
        }
        return TraceContext.of(traceId, mdc.get(SPAN_ID_KEY));
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }
}
