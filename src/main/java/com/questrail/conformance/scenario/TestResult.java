package com.questrail.conformance.scenario;

import com.questrail.conformance.state.StateResult;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Outcome of a test with the results of the states that ran, in run order.
 * {@code seed} is set when the states were shuffled.
 */
public record TestResult(
    String name,
    TestStatus status,
    List<StateResult> states,
    Duration elapsed,
    Long seed
) {
    public TestResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        states = List.copyOf(states);
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public boolean passed() {
        return status == TestStatus.PASSED;
    }

    public OptionalLong shuffleSeed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }
}
