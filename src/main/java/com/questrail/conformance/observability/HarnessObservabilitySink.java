package com.questrail.conformance.observability;

/**
 * Receives lifecycle events from running tests.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface HarnessObservabilitySink {
    /**
     * Called when a state changes status.
     * @param event the transition details
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * Called once per test when it finishes, whatever the outcome.
     * @param event the completed test
     */
    void onTestCompleted(TestCompletedEvent event);

    /**
     * Called when an error escapes a worker: a failed action, a crashed
     * validator loop or a test that threw.
     * @param event the error event
     */
    void onError(HarnessErrorEvent event);
}
