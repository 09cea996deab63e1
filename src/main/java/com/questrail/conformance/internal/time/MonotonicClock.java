package com.questrail.conformance.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every harness deadline: state timeouts, test budgets and
 * script evaluation limits.
 *
 * <h2>Binding invariant</h2>
 * Deadline arithmetic MUST use this clock. Wall-clock time
 * ({@code Instant.now()}) is only used for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful relative to each other.
     */
    long nowNanos();
}
