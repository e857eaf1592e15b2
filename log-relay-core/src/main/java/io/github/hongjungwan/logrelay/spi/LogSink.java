package io.github.hongjungwan.logrelay.spi;

import io.github.hongjungwan.logrelay.api.domain.LogRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 로그 전달 대상 SPI. 파일, HTTP, 배치 reporter 가 구현하며 목록으로 조합된다.
 */
public interface LogSink {

    /** Sink 식별자 반환 */
    String getName();

    /** 단일 레코드 전달. 호출자를 막거나 예외를 던지지 않는다 */
    void log(LogRecord record);

    /** 배치 전달. 실패는 반환된 future 로 알린다 */
    CompletableFuture<Void> logBatch(List<LogRecord> records);

    /** 버퍼된 레코드 전달 */
    default CompletableFuture<Void> flush() {
        return CompletableFuture.completedFuture(null);
    }

    /** 남은 레코드를 모두 전달 (종료 직전 호출) */
    default CompletableFuture<Void> forceFlush() {
        return flush();
    }

    /** 리소스 해제 */
    default void close() {
    }
}
