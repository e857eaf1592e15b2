package io.github.hongjungwan.logrelay.api.trace;

import io.github.hongjungwan.logrelay.api.domain.TraceContext;
import io.github.hongjungwan.logrelay.api.http.Headers;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TraceHeaders 테스트")
class TraceHeadersTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
    private static final String SPAN_ID = "00f067aa0ba902b7";

    @Test
    @DisplayName("상위 traceId 를 이어받고 새 spanId 를 만든다")
    void shouldPropagateTraceId() {
        Map<String, String> headers = TraceHeaders.outbound(TraceContext.of(TRACE_ID, SPAN_ID), "logrelay", "r-1");

        String traceparent = headers.get(RelayHeaders.TRACEPARENT);
        assertThat(traceparent).matches("00-" + TRACE_ID + "-[0-9a-f]{16}-01");
        assertThat(traceparent).doesNotContain(SPAN_ID);
        assertThat(headers).containsEntry(RelayHeaders.TRACESTATE, "logrelay=r-1");
    }

    @Test
    @DisplayName("상위 컨텍스트가 없거나 잘못되면 새 traceId 를 만든다")
    void shouldGenerateTraceIdWhenMissing() {
        Map<String, String> fresh = TraceHeaders.outbound(null, null, null);
        Map<String, String> invalid = TraceHeaders.outbound(TraceContext.of("0".repeat(32), SPAN_ID), "k", null);

        assertThat(fresh.get(RelayHeaders.TRACEPARENT)).matches("00-[0-9a-f]{32}-[0-9a-f]{16}-01");
        assertThat(fresh).doesNotContainKey(RelayHeaders.TRACESTATE);
        assertThat(invalid.get(RelayHeaders.TRACEPARENT)).doesNotContain("0".repeat(32));
    }

    @Test
    @DisplayName("traceparent 파싱")
    void shouldParseTraceparent() {
        Optional<TraceContext> parsed = TraceHeaders.parse(
                Headers.of(Map.of("Traceparent", "00-" + TRACE_ID + "-" + SPAN_ID + "-01")));

        assertThat(parsed).contains(TraceContext.of(TRACE_ID, SPAN_ID));
        assertThat(TraceHeaders.parse(Headers.of(Map.of("traceparent", "00-xyz-" + SPAN_ID + "-01")))).isEmpty();
        assertThat(TraceHeaders.parse(Headers.empty())).isEmpty();
    }

    @Test
    @DisplayName("생성된 ID 는 항상 유효하다")
    void generatedIdsShouldBeValid() {
        for (int i = 0; i < 100; i++) {
            assertThat(TraceIds.isValidTraceId(TraceIds.newTraceId())).isTrue();
            assertThat(TraceIds.isValidSpanId(TraceIds.newSpanId())).isTrue();
        }
    }
}
