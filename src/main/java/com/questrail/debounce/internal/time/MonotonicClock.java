package com.questrail.debounce.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for debounce windows.
 *
 * <h2>Binding invariant</h2>
 * Debounce deadlines MUST be computed from a monotonic time source. Wall-clock
 * time (e.g. {@code Instant.now()}) is permitted only for observability.
 *
 * <p>
 * Implementations should be backed by {@link System#nanoTime()} in production,
 * or by a manually advanced clock for virtual-time tests.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
