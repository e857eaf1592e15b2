package io.github.hongjungwan.logrelay.core.support;

import io.github.hongjungwan.logrelay.api.domain.LogLevel;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;

import java.util.List;
import java.util.stream.Collectors;

public final class TestRecords {

    private TestRecords() {
    }

    public static LogRecord record(long time, String message) {
        return record(time, LogLevel.INFO, message);
    }

    public static LogRecord record(long time, LogLevel level, String message) {
        return LogRecord.builder()
                .time(time)
                .level(level.value())
                .message(message)
                .build();
    }

    public static List<String> messages(List<LogRecord> records) {
        return records.stream().map(LogRecord::getMessage).collect(Collectors.toList());
    }
}
