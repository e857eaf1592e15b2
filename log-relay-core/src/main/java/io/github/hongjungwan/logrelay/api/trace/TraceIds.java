package io.github.hongjungwan.logrelay.api.trace;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * W3C trace/span ID 생성 및 검증.
 */
public final class TraceIds {

    private static final Pattern TRACE_ID = Pattern.compile("^[0-9a-f]{32}$");
    private static final Pattern SPAN_ID = Pattern.compile("^[0-9a-f]{16}$");
    private static final String INVALID_TRACE_ID = "0".repeat(32);
    private static final String INVALID_SPAN_ID = "0".repeat(16);

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private TraceIds() {
    }

    public static boolean isValidTraceId(String traceId) {
        return traceId != null && TRACE_ID.matcher(traceId).matches() && !INVALID_TRACE_ID.equals(traceId);
    }

    public static boolean isValidSpanId(String spanId) {
        return spanId != null && SPAN_ID.matcher(spanId).matches() && !INVALID_SPAN_ID.equals(spanId);
    }

    public static String newTraceId() {
        String id;
        do {
            id = randomHex(16);
        } while (!isValidTraceId(id));
        return id;
    }

    public static String newSpanId() {
        String id;
        do {
            id = randomHex(8);
        } while (!isValidSpanId(id));
        return id;
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HEX.formatHex(buffer);
    }
}
