package com.questrail.debounce.observability;

import com.questrail.debounce.core.TaskState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DebounceObservabilitySink that emits logs via SLF4J.
 *
 * <p>Superseded and cancelled tasks are routine for a debouncer and are only
 * logged at DEBUG.</p>
 */
public final class Slf4jDebounceObservabilitySink implements DebounceObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDebounceObservabilitySink.class);

    @Override
    public void onValueAccepted(ValueAcceptedEvent event) {
        if (event.supersededPending()) {
            log.debug("Debounce: accepted value for task #{} (supersedes #{})",
                event.sequence(), event.supersededTask());
        }
        else {
            log.debug("Debounce: accepted value for task #{}", event.sequence());
        }
    }

    @Override
    public void onTaskTransition(TaskTransitionEvent event) {
        if (event.newState() == TaskState.COMPLETED) {
            log.info("Debounce task #{}: {} -> {}", event.sequence(), event.oldState(), event.newState());
        }
        else {
            log.debug("Debounce task #{}: {} -> {}", event.sequence(), event.oldState(), event.newState());
        }
    }

    @Override
    public void onError(DebounceErrorEvent event) {
        log.error("Debounce pipeline terminated: {}", event.message(), event.cause());
    }
}
