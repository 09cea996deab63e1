package com.questrail.conformance.state;

/**
 * Lifecycle of a single state. A state reaches exactly one terminal status.
 */
public enum StateStatus
{
    PENDING,
    RUNNING,
    /** Every required rule passed, or the timeout passed with nothing failed. */
    COMPLETED,
    /** The timeout passed with at least one tracked rule failed. */
    TIMED_OUT,
    /** The listener could not start, or the owning test aborted the state. */
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == ABORTED;
    }
}
