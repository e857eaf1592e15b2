package io.github.hongjungwan.logrelay.api.domain;

/**
 * 숫자 로그 레벨 매핑. 값이 작을수록 심각도가 높다.
 */
public enum LogLevel {

    ERROR(0),
    WARN(1),
    LOG(2),
    INFO(3),
    DEBUG(4),
    TRACE(5);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /** 범위를 벗어난 값은 가장 가까운 레벨로 맞춘다 */
    public static LogLevel fromValue(int value) {
        if (value <= 0) {
            return ERROR;
        }
        for (LogLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        return TRACE;
    }
}
