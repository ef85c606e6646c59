package com.heterodain.smarthome.gpiocontroller.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

/**
 * 手動で時刻を進めるテスト用のタスクスケジューラー
 * <p>
 * タスクは {@link #advance(Duration)} を呼んだスレッドで、予定時刻順に実行される。
 */
public class ManualTaskScheduler implements TaskScheduler {
    private final ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<ManualFuture> tasks = new ArrayList<>();

    @Override
    public Clock getClock() {
        return clock;
    }

    /**
     * 時刻を進め、予定時刻を過ぎたタスクを実行する
     * 
     * @param duration 進める時間
     */
    public void advance(Duration duration) {
        var target = clock.instant().plus(duration);
        while (true) {
            ManualFuture next;
            synchronized (this) {
                next = tasks.stream().filter(t -> !t.fireAt.isAfter(target))
                        .min(Comparator.comparing(t -> t.fireAt)).orElse(null);
                if (next == null) {
                    break;
                }
                tasks.remove(next);
            }
            clock.now = next.fireAt;
            if (!next.cancelled) {
                next.done = true;
                next.task.run();
            }
        }
        clock.now = target;
    }

    /**
     * 実行待ちのタスク数
     * 
     * @return タスク数
     */
    public synchronized int pendingCount() {
        return (int) tasks.stream().filter(t -> !t.cancelled).count();
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        var future = new ManualFuture(task, startTime);
        synchronized (this) {
            tasks.add(future);
        }
        return future;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Date startTime) {
        return schedule(task, startTime.toInstant());
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Date startTime, long period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long period) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Date startTime, long delay) {
        throw new UnsupportedOperationException();
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, long delay) {
        throw new UnsupportedOperationException();
    }

    private static class ManualClock extends Clock {
        private volatile Instant now;

        ManualClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private class ManualFuture implements ScheduledFuture<Object> {
        private final Runnable task;
        private final Instant fireAt;
        private volatile boolean cancelled;
        private volatile boolean done;

        ManualFuture(Runnable task, Instant fireAt) {
            this.task = task;
            this.fireAt = fireAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), fireAt).toNanos(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed o) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), o.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done || cancelled) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
