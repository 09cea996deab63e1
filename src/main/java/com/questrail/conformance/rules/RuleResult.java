package com.questrail.conformance.rules;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating one rule against one value.
 *
 * <p>{@code failingLabel} is present only when a combinator can name the child
 * that made it fail. The validator records that label instead of the
 * combinator's own label.</p>
 */
public record RuleResult(boolean matched, Optional<String> failingLabel) {

    private static final RuleResult MATCHED = new RuleResult(true, Optional.empty());
    private static final RuleResult NOT_MATCHED = new RuleResult(false, Optional.empty());

    public RuleResult {
        Objects.requireNonNull(failingLabel, "failingLabel");
        if (matched && failingLabel.isPresent()) {
            throw new IllegalArgumentException("a matching result has no failing label");
        }
    }

    public static RuleResult success() {
        return MATCHED;
    }

    public static RuleResult failure() {
        return NOT_MATCHED;
    }

    public static RuleResult of(boolean matched) {
        return matched ? MATCHED : NOT_MATCHED;
    }

    public static RuleResult failedOn(String label) {
        return new RuleResult(false, Optional.of(label));
    }
}
