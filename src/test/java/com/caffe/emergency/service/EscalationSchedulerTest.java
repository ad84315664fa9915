package com.caffe.emergency.service;

import com.caffe.emergency.support.MutableClock;
import com.caffe.emergency.support.VirtualTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EscalationScheduler Tests")
class EscalationSchedulerTest {

    private static final Instant START = Instant.parse("2024-09-03T12:00:00Z");

    private MutableClock clock;
    private VirtualTaskScheduler taskScheduler;
    private EscalationScheduler scheduler;
    private AtomicInteger fired;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        taskScheduler = new VirtualTaskScheduler(clock);
        scheduler = new EscalationScheduler(taskScheduler, clock);
        fired = new AtomicInteger();
    }

    @Test
    @DisplayName("fires the action once, only after the delay")
    void firesOnceAfterDelay() {
        scheduler.arm("a1", Duration.ofMinutes(5), fired::incrementAndGet);

        assertThat(scheduler.fireTime("a1")).contains(START.plus(Duration.ofMinutes(5)));

        taskScheduler.advance(Duration.ofMinutes(4).plusSeconds(59));
        assertThat(fired).hasValue(0);
        assertThat(scheduler.isArmed("a1")).isTrue();

        taskScheduler.advance(Duration.ofSeconds(1));
        assertThat(fired).hasValue(1);
        assertThat(scheduler.isArmed("a1")).isFalse();

        taskScheduler.advance(Duration.ofHours(1));
        assertThat(fired).hasValue(1);
    }

    @Test
    @DisplayName("cancelled timer never fires")
    void cancelledTimerNeverFires() {
        scheduler.arm("a1", Duration.ofMinutes(5), fired::incrementAndGet);

        scheduler.cancel("a1");
        taskScheduler.advance(Duration.ofMinutes(10));

        assertThat(fired).hasValue(0);
        assertThat(scheduler.armedCount()).isZero();
        assertThat(taskScheduler.pendingCount()).isZero();
    }

    @Test
    @DisplayName("cancel is idempotent for unarmed, cancelled and fired timers")
    void cancelIsIdempotent() {
        scheduler.cancel("unknown");

        scheduler.arm("a1", Duration.ofMinutes(1), fired::incrementAndGet);
        scheduler.cancel("a1");
        scheduler.cancel("a1");

        scheduler.arm("a2", Duration.ofMinutes(1), fired::incrementAndGet);
        taskScheduler.advance(Duration.ofMinutes(1));
        scheduler.cancel("a2");

        assertThat(fired).hasValue(1);
        assertThat(scheduler.armedCount()).isZero();
    }

    @Test
    @DisplayName("arming an armed timer throws")
    void armingTwiceFails() {
        scheduler.arm("a1", Duration.ofMinutes(5), fired::incrementAndGet);

        assertThatThrownBy(() -> scheduler.arm("a1", Duration.ofMinutes(1), fired::incrementAndGet))
                .isInstanceOf(IllegalStateException.class);

        taskScheduler.advance(Duration.ofMinutes(5));
        assertThat(fired).hasValue(1);
    }

    @Test
    @DisplayName("fired timer can be armed again")
    void canReArmAfterFiring() {
        scheduler.arm("a1", Duration.ofMinutes(1), fired::incrementAndGet);
        taskScheduler.advance(Duration.ofMinutes(1));

        scheduler.arm("a1", Duration.ofMinutes(1), fired::incrementAndGet);
        taskScheduler.advance(Duration.ofMinutes(1));

        assertThat(fired).hasValue(2);
    }

    @Test
    @DisplayName("negative delay fires immediately")
    void negativeDelayFiresImmediately() {
        scheduler.arm("a1", Duration.ofMinutes(-3), fired::incrementAndGet);

        assertThat(scheduler.fireTime("a1")).contains(START);
        taskScheduler.runDueTasks();

        assertThat(fired).hasValue(1);
    }

    @Test
    @DisplayName("failing action does not affect other timers")
    void failingActionDoesNotBreakOtherTimers() {
        scheduler.arm("broken", Duration.ofMinutes(1), () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.arm("ok", Duration.ofMinutes(2), fired::incrementAndGet);

        taskScheduler.advance(Duration.ofMinutes(2));

        assertThat(fired).hasValue(1);
        assertThat(scheduler.armedCount()).isZero();
    }

    @Test
    @DisplayName("cancelAll disarms every timer")
    void cancelAllDisarmsEverything() {
        scheduler.arm("a1", Duration.ofMinutes(1), fired::incrementAndGet);
        scheduler.arm("a2", Duration.ofMinutes(2), fired::incrementAndGet);

        scheduler.cancelAll();
        taskScheduler.advance(Duration.ofMinutes(5));

        assertThat(fired).hasValue(0);
        assertThat(scheduler.armedCount()).isZero();
    }
}
