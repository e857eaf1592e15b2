package io.github.hongjungwan.logrelay.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 레코드에 첨부되는 추적 컨텍스트. traceId 32 hex, spanId/parentId 16 hex.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraceContext(String traceId, String spanId, String parentId) {

    public static TraceContext of(String traceId, String spanId) {
        return new TraceContext(traceId, spanId, null);
    }
}
