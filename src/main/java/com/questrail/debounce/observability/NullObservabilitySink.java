package com.questrail.debounce.observability;

/**
 * No-op implementation of DebounceObservabilitySink.
 */
public final class NullObservabilitySink implements DebounceObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onValueAccepted(ValueAcceptedEvent event) {}

    @Override
    public void onTaskTransition(TaskTransitionEvent event) {}

    @Override
    public void onError(DebounceErrorEvent event) {}
}
