package com.caffe.emergency.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One cancellable, one-shot timer per alert id.
 *
 * <p>A timer's handle leaves the index either when it fires or when it is cancelled,
 * whichever removes it first; the loser does nothing. So a cancelled timer never runs
 * its action unless the action had already started.
 */
@Slf4j
public class EscalationScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Map<String, TimerHandle> timers = new ConcurrentHashMap<>();

    public EscalationScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Runs {@code action} once after {@code delay}.
     *
     * @throws IllegalStateException if a timer is already armed for the id
     */
    public void arm(String alertId, Duration delay, Runnable action) {
        Instant fireAt = clock.instant().plus(delay.isNegative() ? Duration.ZERO : delay);
        TimerHandle handle = new TimerHandle(fireAt);

        // Registered before scheduling so a zero-delay timer always finds its own handle
        if (timers.putIfAbsent(alertId, handle) != null) {
            throw new IllegalStateException("Escalation timer already armed for alert " + alertId);
        }
        try {
            handle.future = taskScheduler.schedule(() -> fire(alertId, handle, action), fireAt);
        } catch (RuntimeException e) {
            timers.remove(alertId, handle);
            throw e;
        }
        log.debug("⏱️ Escalation timer armed for alert {} at {}", alertId, fireAt);
    }

    /**
     * Idempotent: cancelling an unarmed or already fired timer does nothing.
     */
    public void cancel(String alertId) {
        TimerHandle handle = timers.remove(alertId);
        if (handle != null) {
            ScheduledFuture<?> future = handle.future;
            if (future != null) {
                future.cancel(false);
            }
            log.debug("Escalation timer cancelled for alert {}", alertId);
        }
    }

    public boolean isArmed(String alertId) {
        return timers.containsKey(alertId);
    }

    public Optional<Instant> fireTime(String alertId) {
        return Optional.ofNullable(timers.get(alertId)).map(handle -> handle.fireAt);
    }

    public int armedCount() {
        return timers.size();
    }

    public void cancelAll() {
        timers.keySet().forEach(this::cancel);
    }

    private void fire(String alertId, TimerHandle handle, Runnable action) {
        if (!timers.remove(alertId, handle)) {
            return;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("❌ Escalation action for alert {} failed", alertId, e);
        }
    }

    private static final class TimerHandle {
        private final Instant fireAt;
        private volatile ScheduledFuture<?> future;

        private TimerHandle(Instant fireAt) {
            this.fireAt = fireAt;
        }
    }
}
