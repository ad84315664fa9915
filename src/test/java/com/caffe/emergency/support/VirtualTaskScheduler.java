package com.caffe.emergency.support;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One-shot {@link TaskScheduler} driven by a {@link MutableClock}. Nothing runs until a
 * test calls {@link #advance} or {@link #runDueTasks}; tasks then run on the calling thread.
 */
public class VirtualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final PriorityQueue<VirtualTask> queue = new PriorityQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    public VirtualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        VirtualTask scheduled = new VirtualTask(task, startTime, sequence.incrementAndGet());
        synchronized (queue) {
            queue.add(scheduled);
        }
        return scheduled;
    }

    /**
     * Moves the clock forward, running every task that falls due on the way at its own time.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            VirtualTask next;
            synchronized (queue) {
                next = queue.peek();
                if (next == null || next.fireAt.isAfter(target)) {
                    break;
                }
                queue.poll();
            }
            if (next.fireAt.isAfter(clock.instant())) {
                clock.set(next.fireAt);
            }
            next.run();
        }
        if (target.isAfter(clock.instant())) {
            clock.set(target);
        }
    }

    public void runDueTasks() {
        advance(Duration.ZERO);
    }

    public int pendingCount() {
        synchronized (queue) {
            return (int) queue.stream().filter(task -> !task.cancelled).count();
        }
    }

    public List<Instant> pendingFireTimes() {
        synchronized (queue) {
            List<Instant> times = new ArrayList<>();
            queue.stream().filter(task -> !task.cancelled).forEach(task -> times.add(task.fireAt));
            times.sort(null);
            return times;
        }
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Triggers are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    private final class VirtualTask implements ScheduledFuture<Object> {
        private final Runnable task;
        private final Instant fireAt;
        private final long order;
        private volatile boolean cancelled;
        private volatile boolean done;

        private VirtualTask(Runnable task, Instant fireAt, long order) {
            this.task = task;
            this.fireAt = fireAt;
            this.order = order;
        }

        private void run() {
            if (cancelled) {
                return;
            }
            try {
                task.run();
            } finally {
                done = true;
            }
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            synchronized (queue) {
                queue.remove(this);
            }
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

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), fireAt));
        }

        @Override
        public int compareTo(Delayed other) {
            VirtualTask that = (VirtualTask) other;
            int byTime = fireAt.compareTo(that.fireAt);
            return byTime != 0 ? byTime : Long.compare(order, that.order);
        }
    }
}
