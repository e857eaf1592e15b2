package io.github.hongjungwan.logrelay.core.scheduling;

/**
 * 예약된 작업 핸들.
 */
public interface ScheduledTask {

    /** 아직 실행되지 않은 작업 취소. 취소되었으면 true */
    boolean cancel();

    boolean isDone();
}
