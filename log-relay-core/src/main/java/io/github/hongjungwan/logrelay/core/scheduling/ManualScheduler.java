package io.github.hongjungwan.logrelay.core.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 수동으로 진행시키는 가상 시계 Scheduler.
 *
 * <p>{@link #advanceBy(long)} 호출 시 기한이 된 작업을 예약 시각 순서대로 호출 스레드에서 실행한다.
 * 실행 중 새로 예약된 작업도 같은 진행 구간 안에 들어오면 함께 실행된다.</p>
 */
@Slf4j
public class ManualScheduler implements Scheduler {

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private long now;
    private long sequence;

    public ManualScheduler(long startMillis) {
        this.now = startMillis;
    }

    public ManualScheduler() {
        this(1_700_000_000_000L);
    }

    @Override
    public long currentTimeMillis() {
        lock.lock();
        try {
            return now;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMillis) {
        return enqueue(task, delayMillis, 0);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, long initialDelayMillis, long periodMillis) {
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("periodMillis must be positive: " + periodMillis);
        }
        return enqueue(task, initialDelayMillis, periodMillis);
    }

    private Entry enqueue(Runnable task, long delayMillis, long periodMillis) {
        lock.lock();
        try {
            Entry entry = new Entry(task, now + Math.max(0, delayMillis), periodMillis, sequence++);
            queue.add(entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /** 시계를 delta 만큼 진행하고 기한이 된 작업 실행 */
    public void advanceBy(long deltaMillis) {
        advanceTo(currentTimeMillis() + deltaMillis);
    }

    /** 시계를 target 시각까지 진행하고 기한이 된 작업 실행 */
    public void advanceTo(long targetMillis) {
        while (true) {
            Entry next;
            lock.lock();
            try {
                next = queue.peek();
                if (next == null || next.dueAt > targetMillis) {
                    now = Math.max(now, targetMillis);
                    return;
                }
                queue.poll();
                now = Math.max(now, next.dueAt);
            } finally {
                lock.unlock();
            }
            run(next);
        }
    }

    /** 시계를 움직이지 않고 현재 기한이 된 작업만 실행 */
    public void runDueTasks() {
        advanceBy(0);
    }

    /** 취소되지 않은 대기 작업 수 */
    public int pendingTaskCount() {
        lock.lock();
        try {
            return (int) queue.stream().filter(e -> !e.cancelled).count();
        } finally {
            lock.unlock();
        }
    }

    private void run(Entry entry) {
        if (entry.cancelled) {
            return;
        }
        try {
            entry.task.run();
        } catch (Exception e) {
            log.error("Scheduled task failed", e);
        }
        lock.lock();
        try {
            if (entry.periodMillis > 0 && !entry.cancelled) {
                entry.dueAt += entry.periodMillis;
                entry.sequence = sequence++;
                queue.add(entry);
            } else {
                entry.done = true;
            }
        } finally {
            lock.unlock();
        }
    }

    private final class Entry implements ScheduledTask, Comparable<Entry> {

        private final Runnable task;
        private final long periodMillis;
        private long dueAt;
        private long sequence;
        private volatile boolean cancelled;
        private volatile boolean done;

        private Entry(Runnable task, long dueAt, long periodMillis, long sequence) {
            this.task = task;
            this.dueAt = dueAt;
            this.periodMillis = periodMillis;
            this.sequence = sequence;
        }

        @Override
        public boolean cancel() {
            lock.lock();
            try {
                if (cancelled || done) {
                    return false;
                }
                cancelled = true;
                queue.remove(this);
                return true;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public int compareTo(Entry other) {
            int byTime = Long.compare(dueAt, other.dueAt);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
