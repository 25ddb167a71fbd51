package com.questrail.debounce.observability;

import java.time.Instant;

/**
 * Record describing a value accepted by the debounce operator.
 *
 * @param timestamp       wall-clock time of acceptance (observational only)
 * @param sequence        sequence number of the pending task created for the value
 * @param value           the accepted value
 * @param supersededTask  sequence number of the task cancelled by this value, or 0 if none
 */
public record ValueAcceptedEvent(
    Instant timestamp,
    long sequence,
    Object value,
    long supersededTask
) {
    public boolean supersededPending() {
        return supersededTask != 0L;
    }
}
