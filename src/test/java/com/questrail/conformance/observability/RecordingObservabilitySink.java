package com.questrail.conformance.observability;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects every event for later assertions.
 */
public final class RecordingObservabilitySink implements HarnessObservabilitySink {

    public final List<StateTransitionEvent> transitions = new CopyOnWriteArrayList<>();
    public final List<TestCompletedEvent> completed = new CopyOnWriteArrayList<>();
    public final List<HarnessErrorEvent> errors = new CopyOnWriteArrayList<>();

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        transitions.add(event);
    }

    @Override
    public void onTestCompleted(TestCompletedEvent event) {
        completed.add(event);
    }

    @Override
    public void onError(HarnessErrorEvent event) {
        errors.add(event);
    }
}
