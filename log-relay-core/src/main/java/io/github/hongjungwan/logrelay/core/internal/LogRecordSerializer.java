package io.github.hongjungwan.logrelay.core.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.logrelay.api.domain.LogBatch;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;

import java.io.IOException;
import java.util.Map;

/**
 * 레코드/배치 JSON 직렬화. 파일은 NDJSON, HTTP 는 배치 본문. 최대 페이로드 크기 제한으로 메모리 보호.
 */
public class LogRecordSerializer {

    public static final long DEFAULT_MAX_PAYLOAD_SIZE = 10 * 1024 * 1024L;  // 10MB

    private final ObjectMapper objectMapper;
    private final long maxPayloadSize;

    public LogRecordSerializer() {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    public LogRecordSerializer(long maxPayloadSize) {
        this.maxPayloadSize = maxPayloadSize;
        this.objectMapper = createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /** 한 줄 JSON (개행 포함). 고정 필드는 레코드 필드를 덮어쓰지 않는다 */
    public String toJsonLine(LogRecord record, Map<String, Object> additionalFields) {
        try {
            if (additionalFields == null || additionalFields.isEmpty()) {
                return objectMapper.writeValueAsString(record) + "\n";
            }
            ObjectNode node = objectMapper.valueToTree(record);
            additionalFields.forEach((key, value) -> {
                if (!node.has(key)) {
                    node.set(key, objectMapper.valueToTree(value));
                }
            });
            return objectMapper.writeValueAsString(node) + "\n";
        } catch (IOException | IllegalArgumentException e) {
            throw new SerializationException("Failed to serialize log record", e);
        }
    }

    public byte[] serializeBatch(LogBatch batch) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(batch);
            if (json.length > maxPayloadSize) {
                throw new SerializationException(
                        String.format("Log batch exceeds maximum allowed size: %d bytes (max: %d bytes)",
                                json.length, maxPayloadSize), null);
            }
            return json;
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize log batch", e);
        }
    }

    public LogBatch deserializeBatch(byte[] data) {
        if (data.length > maxPayloadSize) {
            throw new SerializationException(
                    String.format("Log batch exceeds maximum allowed size: %d bytes (max: %d bytes)",
                            data.length, maxPayloadSize), null);
        }
        try {
            return objectMapper.readValue(data, LogBatch.class);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize log batch", e);
        }
    }

    /**
     * 직렬화 실패
     */
    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
