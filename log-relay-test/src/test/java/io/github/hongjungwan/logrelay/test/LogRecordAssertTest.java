package io.github.hongjungwan.logrelay.test;

import io.github.hongjungwan.logrelay.api.domain.LogLevel;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.api.domain.TraceContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.hongjungwan.logrelay.test.LogRecordAssert.assertSortedByTime;
import static io.github.hongjungwan.logrelay.test.LogRecordAssert.assertThatRecord;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test LogRecordAssert utility
 */
class LogRecordAssertTest {

    private static LogRecord record(long time) {
        return LogRecord.builder()
                .time(time)
                .level(LogLevel.INFO.value())
                .message("Order placed")
                .context(Map.of("orderId", "A-1001"))
                .build();
    }

    @Test
    void testLevelAndMessage() {
        assertThatRecord(record(1000))
                .hasLevel(LogLevel.INFO)
                .hasTime(1000)
                .messageContains("placed");
    }

    @Test
    void testContext() {
        assertThatRecord(record(1000))
                .hasContextKey("orderId")
                .hasContextValue("orderId", "A-1001");
    }

    @Test
    void testTracing() {
        LogRecord traced = record(1000).toBuilder()
                .trace(TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7"))
                .build();

        assertThatRecord(traced).hasTraceId("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThatRecord(record(1000)).hasNoTrace();
    }

    @Test
    void testFailureMessages() {
        assertThatThrownBy(() -> assertThatRecord(record(1000)).hasLevel(LogLevel.ERROR))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Expected log level");

        assertThatThrownBy(() -> assertThatRecord(record(1000)).hasContextKey("missing"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("missing");
    }

    @Test
    void testSortedByTime() {
        assertThatCode(() -> assertSortedByTime(List.of(record(1), record(2), record(2), record(5))))
                .doesNotThrowAnyException();

        assertThatThrownBy(() -> assertSortedByTime(List.of(record(3), record(1))))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("sorted by time");
    }
}
