package com.questrail.debounce.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface used for the debounce delay and for suspension points
 * inside actions.
 *
 * <h2>Binding invariants</h2>
 * <ul>
 *   <li>Scheduling is expressed in monotonic ticks or durations, never in
 *       wall-clock instants.</li>
 *   <li>A task is never run inline by the scheduling call, even when its
 *       deadline has already passed. It runs at the next scheduling
 *       opportunity.</li>
 *   <li>A task whose {@link Cancellable} was cancelled before it started
 *       never runs.</li>
 * </ul>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task         runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedules {@code task} to run once {@code delay} has passed on {@code clock}.
     * A zero delay still goes through the scheduler. Delays too large to express
     * in nanoseconds are treated as "never" and saturate at {@link Long#MAX_VALUE}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long now = clock.nowNanos();
        long deadline;
        try {
            deadline = Math.addExact(now, delay.toNanos());
        }
        catch (ArithmeticException overflow) {
            deadline = Long.MAX_VALUE;
        }
        return scheduleAtNanos(deadline, task);
    }
}
