package io.github.hongjungwan.logrelay.core.admission;

import io.github.hongjungwan.logrelay.api.domain.AppInfo;
import io.github.hongjungwan.logrelay.api.domain.BatchMeta;
import io.github.hongjungwan.logrelay.api.domain.LogBatch;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.api.http.Headers;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LoopDetector 테스트")
class LoopDetectorTest {

    private static final long NOW = 1_700_000_000_000L;

    private final LoopDetector detector = new LoopDetector("relay-server");

    private static LogBatch batch(BatchMeta meta) {
        return new LogBatch(List.of(LogRecord.builder().time(NOW).level(3).message("m").build()),
                new AppInfo("orders", "1.0.0"), meta);
    }

    @Test
    @DisplayName("일반 요청은 루프가 아니다")
    void shouldAcceptFreshBatch() {
        LoopDetector.Result result = detector.check(Headers.empty(),
                batch(new BatchMeta(true, List.of("a", "b"), "orders", NOW - 1_000)), NOW);

        assertThat(result.loop()).isFalse();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("processed 헤더만으로는 루프가 아니라 경고")
    void shouldWarnOnProcessedHeader() {
        Headers headers = Headers.of(Map.of(RelayHeaders.PROCESSED, "true"));

        LoopDetector.Result result = detector.check(headers, batch(null), NOW);

        assertThat(result.loop()).isFalse();
        assertThat(result.reasons()).isEmpty();
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains(RelayHeaders.PROCESSED);
    }

    @Test
    @DisplayName("자기 자신이 보낸 로그는 루프")
    void shouldDetectSelfSource() {
        Headers headers = Headers.of(Map.of(
                RelayHeaders.REPORTER_ID, "reporter-1",
                RelayHeaders.SOURCE, "relay-server"));

        assertThat(detector.check(headers, batch(null), NOW).loop()).isTrue();
        assertThat(new LoopDetector().check(headers, batch(null), NOW).loop()).isFalse();
    }

    @Test
    @DisplayName("process chain 에 중복 reporter 가 있으면 루프")
    void shouldDetectDuplicateChain() {
        LoopDetector.Result result = detector.check(Headers.empty(),
                batch(new BatchMeta(true, List.of("a", "b", "a"), "orders", NOW)), NOW);

        assertThat(result.loop()).isTrue();
    }

    @Test
    @DisplayName("처리되지 않은 배치는 chain 중복을 보지 않는다")
    void shouldIgnoreChainWhenNotProcessed() {
        LoopDetector.Result result = detector.check(Headers.empty(),
                batch(new BatchMeta(false, List.of("a", "a"), "orders", NOW)), NOW);

        assertThat(result.loop()).isFalse();
    }

    @Test
    @DisplayName("5분이 지난 배치는 경고, 10분이 지나면 루프")
    void shouldFlagStaleBatches() {
        LoopDetector.Result warning = detector.check(Headers.empty(),
                batch(new BatchMeta(false, List.of(), "orders", NOW - 6 * 60_000)), NOW);
        LoopDetector.Result loop = detector.check(Headers.empty(),
                batch(new BatchMeta(false, List.of(), "orders", NOW - 11 * 60_000)), NOW);

        assertThat(warning.loop()).isFalse();
        assertThat(warning.warnings()).hasSize(1);
        assertThat(loop.loop()).isTrue();
        assertThat(loop.reasons()).hasSize(1);
        assertThat(loop.reasons().get(0)).contains("660s");
    }
}
