package io.github.hongjungwan.logrelay.test;

import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordingSink 테스트")
class RecordingSinkTest {

    private static final LogRecord RECORD = LogRecord.builder().time(1).level(3).message("m").build();

    @Test
    @DisplayName("성공한 배치만 기록한다")
    void shouldRecordSuccessfulBatches() {
        RecordingSink sink = new RecordingSink("recorder");

        sink.logBatch(List.of(RECORD, RECORD));
        sink.logBatch(List.of(RECORD));

        assertThat(sink.getBatches()).hasSize(2);
        assertThat(sink.getRecords()).hasSize(3);
        assertThat(sink.getAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("failNext 는 지정 횟수만 실패시킨다")
    void shouldFailInjectedNumberOfTimes() {
        RecordingSink sink = new RecordingSink().failNext(2);

        assertThat(sink.logBatch(List.of(RECORD))).isCompletedExceptionally();
        assertThat(sink.logBatch(List.of(RECORD))).isCompletedExceptionally();
        assertThat(sink.logBatch(List.of(RECORD))).isCompleted().isNotCompletedExceptionally();

        assertThat(sink.getAttempts()).isEqualTo(3);
        assertThat(sink.getBatches()).hasSize(1);
    }

    @Test
    @DisplayName("failAlways 해제 후에는 다시 성공한다")
    void shouldRecoverAfterFailAlwaysCleared() {
        RecordingSink sink = new RecordingSink().failAlways(true);
        assertThat(sink.logBatch(List.of(RECORD))).isCompletedExceptionally();

        sink.failAlways(false);
        assertThat(sink.logBatch(List.of(RECORD))).isNotCompletedExceptionally();

        sink.reset();
        assertThat(sink.getAttempts()).isZero();
        assertThat(sink.getBatches()).isEmpty();
    }
}
