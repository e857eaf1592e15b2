package io.github.hongjungwan.logrelay.test;

import io.github.hongjungwan.logrelay.api.domain.LogLevel;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import org.assertj.core.api.AbstractAssert;

import java.util.List;

/**
 * 로그 레코드 검증용 Fluent API TestKit. AssertJ 스타일 메서드 체이닝 지원.
 */
public class LogRecordAssert extends AbstractAssert<LogRecordAssert, LogRecord> {

    public LogRecordAssert(LogRecord actual) {
        super(actual, LogRecordAssert.class);
    }

    public static LogRecordAssert assertThatRecord(LogRecord actual) {
        return new LogRecordAssert(actual);
    }

    /** 레코드 목록이 time 오름차순인지 검증 */
    public static void assertSortedByTime(List<LogRecord> records) {
        for (int i = 1; i < records.size(); i++) {
            long previous = records.get(i - 1).getTime();
            long current = records.get(i).getTime();
            if (previous > current) {
                throw new AssertionError(String.format(
                        "Expected records sorted by time but index %d (%d) came after index %d (%d)",
                        i, current, i - 1, previous));
            }
        }
    }

    /** 로그 레벨 검증 */
    public LogRecordAssert hasLevel(LogLevel level) {
        isNotNull();

        if (actual.getLevel() != level.value()) {
            failWithMessage("Expected log level to be <%s (%d)> but was <%d>", level, level.value(), actual.getLevel());
        }

        return this;
    }

    /** 발생 시각 검증 */
    public LogRecordAssert hasTime(long time) {
        isNotNull();

        if (actual.getTime() != time) {
            failWithMessage("Expected time to be <%d> but was <%d>", time, actual.getTime());
        }

        return this;
    }

    /** 메시지에 텍스트 포함 검증 */
    public LogRecordAssert messageContains(String text) {
        isNotNull();

        if (actual.getMessage() == null || !actual.getMessage().contains(text)) {
            failWithMessage("Expected message to contain <%s> but was <%s>", text, actual.getMessage());
        }

        return this;
    }

    /** Trace ID 검증 */
    public LogRecordAssert hasTraceId(String traceId) {
        isNotNull();

        if (actual.getTrace() == null) {
            failWithMessage("Expected log to have trace <%s> but trace was missing", traceId);
        }
        if (!traceId.equals(actual.getTrace().traceId())) {
            failWithMessage("Expected trace ID to be <%s> but was <%s>", traceId, actual.getTrace().traceId());
        }

        return this;
    }

    public LogRecordAssert hasNoTrace() {
        isNotNull();

        if (actual.getTrace() != null) {
            failWithMessage("Expected log to have no trace but was <%s>", actual.getTrace());
        }

        return this;
    }

    /** Context에 키 존재 검증 */
    public LogRecordAssert hasContextKey(String key) {
        isNotNull();

        if (!actual.getContext().containsKey(key)) {
            failWithMessage("Expected context to contain key <%s> but it was not present", key);
        }

        return this;
    }

    /** Context 값 일치 검증 */
    public LogRecordAssert hasContextValue(String key, Object value) {
        hasContextKey(key);

        Object actualValue = actual.getContext().get(key);
        if (!value.equals(actualValue)) {
            failWithMessage("Expected context[%s] to be <%s> but was <%s>", key, value, actualValue);
        }

        return this;
    }
}
