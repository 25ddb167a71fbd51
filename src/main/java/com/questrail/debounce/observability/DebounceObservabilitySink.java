package com.questrail.debounce.observability;

/**
 * Main interface for receiving debounce pipeline observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on any thread: the accepting thread, a scheduler
 * thread, or whichever thread completed an action. For a given task the
 * {@link #onValueAccepted} callback always precedes its first
 * {@link #onTaskTransition}, because the task's delay is only armed after the
 * acceptance has been reported.</p>
 */
public interface DebounceObservabilitySink {
    /**
     * Called after a value has been accepted, before its pending task is armed.
     * @param event the acceptance details
     */
    void onValueAccepted(ValueAcceptedEvent event);

    /**
     * Called whenever a pending task changes state.
     * @param event the transition details
     */
    void onTaskTransition(TaskTransitionEvent event);

    /**
     * Called when an action or source fails and the pipeline terminates.
     * Cancellations are never reported here.
     * @param event the error event
     */
    void onError(DebounceErrorEvent event);
}
