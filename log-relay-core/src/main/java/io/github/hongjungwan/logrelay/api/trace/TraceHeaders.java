package io.github.hongjungwan.logrelay.api.trace;

import io.github.hongjungwan.logrelay.api.domain.TraceContext;
import io.github.hongjungwan.logrelay.api.http.Headers;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * W3C Trace Context 헤더 (traceparent, tracestate) 생성과 파싱.
 *
 * Format: traceparent: 00-{trace-id}-{span-id}-{flags}
 */
public final class TraceHeaders {

    private static final String VERSION = "00";
    private static final String SAMPLED = "01";

    private TraceHeaders() {
    }

    /**
     * 상위 컨텍스트의 traceId 를 이어받고 새 spanId 로 traceparent 를 만든다.
     * traceId 가 유효하지 않으면 새로 생성한다.
     *
     * @param parent     상위 추적 컨텍스트 (nullable)
     * @param stateKey   tracestate 벤더 키 (소문자)
     * @param stateValue tracestate 값 (nullable 이면 tracestate 생략)
     */
    public static Map<String, String> outbound(TraceContext parent, String stateKey, String stateValue) {
        String traceId = parent != null && TraceIds.isValidTraceId(parent.traceId())
                ? parent.traceId()
                : TraceIds.newTraceId();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(RelayHeaders.TRACEPARENT, traceparent(traceId, TraceIds.newSpanId()));
        if (stateKey != null && stateValue != null) {
            headers.put(RelayHeaders.TRACESTATE, stateKey + "=" + stateValue);
        }
        return headers;
    }

    public static String traceparent(String traceId, String spanId) {
        return VERSION + "-" + traceId + "-" + spanId + "-" + SAMPLED;
    }

    /** traceparent 헤더 파싱. 형식이 틀리면 empty */
    public static Optional<TraceContext> parse(Headers headers) {
        String traceParent = headers.get(RelayHeaders.TRACEPARENT);
        if (traceParent == null || traceParent.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = traceParent.trim().split("-");
        if (parts.length != 4 || parts[0].length() != 2 || parts[3].length() != 2) {
            return Optional.empty();
        }
        if (!TraceIds.isValidTraceId(parts[1]) || !TraceIds.isValidSpanId(parts[2])) {
            return Optional.empty();
        }
        return Optional.of(TraceContext.of(parts[1], parts[2]));
    }
}
