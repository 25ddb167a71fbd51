package com.questrail.debounce.observability;

import java.time.Instant;

/**
 * Record representing a failure that terminated the debounce pipeline.
 */
public record DebounceErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
