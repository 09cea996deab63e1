package com.questrail.conformance.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly while running tests.
 */
public record HarnessErrorEvent(
    Instant timestamp,
    String testName,
    String message,
    Throwable cause
) {
}
