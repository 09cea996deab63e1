package com.questrail.conformance.state;

import com.questrail.conformance.action.BoundAction;
import com.questrail.conformance.rules.RuleMap;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable definition of one step of a test: the actions to perform and the
 * triggers expected in response, within {@code timeout}.
 */
public record StateDescriptor(
    String name,
    String description,
    List<BoundAction> actions,
    RuleMap rules,
    Duration timeout
) {
    public StateDescriptor {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        actions = List.copyOf(actions);
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("state timeout must be positive: " + name);
        }
    }
}
