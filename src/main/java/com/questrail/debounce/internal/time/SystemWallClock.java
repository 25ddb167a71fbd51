package com.questrail.debounce.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for operational correctness.</strong> Debounce timing
 * uses {@link MonotonicClock} exclusively; this clock only stamps
 * observability events.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
