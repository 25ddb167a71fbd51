package com.questrail.debounce.observability;

import com.questrail.debounce.core.TaskOutcome;
import com.questrail.debounce.core.TaskState;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a state transition of one pending debounce task.
 *
 * @param outcome the terminal outcome, present only when {@code newState} is terminal
 */
public record TaskTransitionEvent(
    Instant timestamp,
    long sequence,
    TaskState oldState,
    TaskState newState,
    Optional<TaskOutcome> outcome
) {
    public boolean isTerminal() {
        return newState.isTerminal();
    }
}
