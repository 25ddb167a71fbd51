package com.questrail.debounce.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Real-time {@link MonotonicScheduler} on top of a {@link ScheduledExecutorService}.
 *
 * <p>The deadline is turned into a relative delay against the supplied clock
 * when the task is scheduled. Deadlines already in the past are clamped to a
 * zero delay, so even a zero debounce timeout runs on an executor thread and
 * never on the thread that accepted the value.</p>
 *
 * <p>The executor is borrowed, not owned: shutting it down is the caller's job
 * ({@code DebounceRuntime} does so in {@code stop()}).</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos;
        try {
            delayNanos = Math.max(0L, Math.subtractExact(deadlineNanos, clock.nowNanos()));
        }
        catch (ArithmeticException overflow) {
            delayNanos = deadlineNanos > 0 ? Long.MAX_VALUE : 0L;
        }
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // A task that has already started is left to finish; cancellation is cooperative.
        return () -> future.cancel(false);
    }
}
