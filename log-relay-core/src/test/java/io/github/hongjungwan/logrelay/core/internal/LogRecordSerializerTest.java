package io.github.hongjungwan.logrelay.core.internal;

import io.github.hongjungwan.logrelay.api.domain.AppInfo;
import io.github.hongjungwan.logrelay.api.domain.BatchMeta;
import io.github.hongjungwan.logrelay.api.domain.LogBatch;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.api.domain.TraceContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LogRecordSerializer 테스트")
class LogRecordSerializerTest {

    private final LogRecordSerializer serializer = new LogRecordSerializer();

    @Test
    @DisplayName("배치 JSON 을 읽고 알 수 없는 필드는 무시한다")
    void shouldReadBatchIgnoringUnknownFields() {
        String json = "{\"logs\":[{\"time\":10,\"level\":1,\"message\":\"m\",\"context\":{\"k\":\"v\"},"
                + "\"trace\":{\"traceId\":\"4bf92f3577b34da6a3ce929d0e0e4736\",\"spanId\":\"00f067aa0ba902b7\"},"
                + "\"extra\":true}],"
                + "\"app\":{\"name\":\"orders\",\"version\":\"1.0.0\"},"
                + "\"meta\":{\"processed\":true,\"processChain\":[\"r1\"],\"source\":\"orders\",\"time\":5}}";

        LogBatch batch = serializer.deserializeBatch(json.getBytes(StandardCharsets.UTF_8));

        assertThat(batch.size()).isEqualTo(1);
        LogRecord record = batch.logs().get(0);
        assertThat(record.getTime()).isEqualTo(10);
        assertThat(record.getContext()).containsEntry("k", "v");
        assertThat(record.getTrace()).isEqualTo(TraceContext.of("4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7"));
        assertThat(batch.meta().processChain()).containsExactly("r1");
    }

    @Test
    @DisplayName("NDJSON 한 줄은 개행으로 끝난다")
    void shouldWriteSingleLine() {
        LogRecord record = LogRecord.builder().time(1).level(3).message("multi\nline").build();

        String line = serializer.toJsonLine(record, Map.of());

        assertThat(line).endsWith("\n");
        assertThat(line.substring(0, line.length() - 1)).doesNotContain("\n");
    }

    @Test
    @DisplayName("최대 크기를 넘는 배치는 거부한다")
    void shouldRejectOversizedBatch() {
        LogRecordSerializer small = new LogRecordSerializer(64);
        LogBatch batch = new LogBatch(
                List.of(LogRecord.builder().time(1).level(3).message("x".repeat(100)).build()),
                new AppInfo("orders", "1.0.0"),
                new BatchMeta(true, List.of("r1"), "orders", 1));

        assertThatThrownBy(() -> small.serializeBatch(batch))
                .isInstanceOf(LogRecordSerializer.SerializationException.class)
                .hasMessageContaining("exceeds maximum");
        assertThatThrownBy(() -> small.deserializeBatch(new byte[65]))
                .isInstanceOf(LogRecordSerializer.SerializationException.class);
    }
}
