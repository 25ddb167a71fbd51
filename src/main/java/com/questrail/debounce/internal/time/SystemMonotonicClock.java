package com.questrail.debounce.internal.time;

/**
 * {@link MonotonicClock} over {@link System#nanoTime()}. Immune to wall-clock
 * adjustments; use {@code ManualMonotonicClock} in virtual-time tests.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
