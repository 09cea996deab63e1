package com.questrail.conformance.observability;

import com.questrail.conformance.state.StateStatus;

import java.time.Instant;

/**
 * Record representing a status change of one state within a test.
 */
public record StateTransitionEvent(
    Instant timestamp,
    String testName,
    String stateName,
    StateStatus oldStatus,
    StateStatus newStatus
) {
    public boolean isTerminal() {
        return newStatus.isTerminal();
    }
}
