package com.questrail.conformance.validation;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a validator's tracking at one point in time.
 *
 * <p>Only tracked rules (required and never_fire) appear here; advisory rules
 * are not counted.</p>
 */
public record ValidationReport(List<AttributeResult> attributes) {

    public ValidationReport {
        attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
    }

    public int matched() {
        return attributes.stream().mapToInt(AttributeResult::matched).sum();
    }

    public int total() {
        return attributes.stream().mapToInt(AttributeResult::total).sum();
    }

    public int failures() {
        return total() - matched();
    }

    public boolean hasFailures() {
        return failures() > 0;
    }

    /**
     * Outcome of one tracked rule. {@code label} is the failing child's label
     * when a combinator failed on one.
     */
    public record RuleOutcome(String label, boolean passed) {
        public RuleOutcome {
            Objects.requireNonNull(label, "label");
        }
    }

    public record AttributeResult(String attribute, List<RuleOutcome> rules) {

        public AttributeResult {
            Objects.requireNonNull(attribute, "attribute");
            rules = List.copyOf(rules);
        }

        public int matched() {
            return (int) rules.stream().filter(RuleOutcome::passed).count();
        }

        public int total() {
            return rules.size();
        }
    }
}
