package io.github.hongjungwan.logrelay.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 로그 레코드. 수집, 정렬, 전송 파이프라인의 기본 단위. 생성 후 불변.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = LogRecord.LogRecordBuilder.class)
public class LogRecord {

    /** 발생 시각 (epoch millis) */
    private final long time;

    /** 숫자 로그 레벨 (0 error ~ 5 trace, {@link LogLevel} 참고) */
    private final int level;

    /** 로그 메시지 */
    private final String message;

    /** 컨텍스트 필드 (삽입 순서 유지) */
    private final Map<String, Object> context;

    /** 분산 추적 컨텍스트 */
    private final TraceContext trace;

    @Builder(toBuilder = true)
    private LogRecord(long time, int level, String message, Map<String, Object> context, TraceContext trace) {
        this.time = time;
        this.level = level;
        this.message = message;
        this.context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.trace = trace;
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LogRecordBuilder {
    }
}
