package com.questrail.conformance.state;

import com.questrail.conformance.listener.ListenerDestination;
import com.questrail.conformance.runtime.HarnessServices;

import java.time.Duration;
import java.util.Objects;

/**
 * What a running test hands to each of its states.
 *
 * @param remainingBudget time left before the owning test's deadline
 */
public record StateContext(
    String testName,
    ListenerDestination destination,
    Duration remainingBudget,
    HarnessServices services
) {
    public StateContext {
        Objects.requireNonNull(testName, "testName");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(remainingBudget, "remainingBudget");
        Objects.requireNonNull(services, "services");
        if (remainingBudget.isNegative()) {
            remainingBudget = Duration.ZERO;
        }
    }
}
