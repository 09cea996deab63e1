package com.questrail.conformance.observability;

/**
 * No-op implementation of HarnessObservabilitySink.
 */
public final class NullObservabilitySink implements HarnessObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onTestCompleted(TestCompletedEvent event) {}

    @Override
    public void onError(HarnessErrorEvent event) {}
}
