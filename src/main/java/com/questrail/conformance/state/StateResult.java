package com.questrail.conformance.state;

import com.questrail.conformance.validation.ValidationReport;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a state, with the validation snapshot taken when it resolved.
 * {@code cause} is set for {@link StateStatus#ABORTED}.
 */
public record StateResult(
    String stateName,
    StateStatus status,
    ValidationReport report,
    Duration elapsed,
    Throwable cause
) {
    public StateResult {
        Objects.requireNonNull(stateName, "stateName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(elapsed, "elapsed");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("state result needs a terminal status, got " + status);
        }
    }

    public boolean completed() {
        return status == StateStatus.COMPLETED;
    }

    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(cause);
    }
}
