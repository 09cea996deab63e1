package com.questrail.conformance.observability;

import com.questrail.conformance.scenario.TestResult;

import java.time.Instant;

/**
 * Record representing a finished test.
 */
public record TestCompletedEvent(
    Instant timestamp,
    TestResult result
) {
}
