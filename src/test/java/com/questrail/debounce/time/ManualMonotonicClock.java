package com.questrail.debounce.time;

import com.questrail.debounce.internal.time.MonotonicClock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Virtual monotonic clock behind the debounce tests.
 *
 * <p>Time is moved by {@link DeterministicScheduler#advanceMillis(long)}, which
 * steps it to each debounce deadline in turn, so actions and tests can read
 * "when" something happened via {@link #nowMillis()} without any sleeping.
 * It starts at zero and refuses to move backwards.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos = new AtomicLong(0);

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    public void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        nowNanos.addAndGet(deltaNanos);
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }

    public long nowMillis() {
        return nowNanos.get() / 1_000_000L;
    }
}
