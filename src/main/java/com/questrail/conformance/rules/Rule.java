package com.questrail.conformance.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rule
 * -----------------------------------------------------------------------------
 * A compiled condition over a single trigger value.
 *
 * <p>Rules are immutable data. Evaluation lives in {@link RuleEvaluator}, which
 * dispatches on the concrete variant; there is no
 * {@code test(String)} method here.</p>
 *
 * <p>Every rule carries the human readable {@link #label()} used in reports
 * and in the validator's pass/fail bookkeeping.</p>
 */
public sealed interface Rule
        permits Rule.Fire, Rule.NeverFire, Rule.Regex, Rule.Range, Rule.Script, Rule.Json, Rule.All, Rule.Any
{
    String label();

    /** {@code true} when the condition was written with the {@code may_} prefix. */
    boolean advisory();

    RuleKind kind();

    default TrackingPolicy tracking() {
        if (advisory()) {
            return TrackingPolicy.ADVISORY;
        }
        return kind() == RuleKind.NEVER_FIRE ? TrackingPolicy.FORBIDDEN : TrackingPolicy.REQUIRED;
    }

    /** Always matches. */
    record Fire(String label, boolean advisory) implements Rule {
        public Fire {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.FIRE;
        }
    }

    /** Never matches. */
    record NeverFire(String label, boolean advisory) implements Rule {
        public NeverFire {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.NEVER_FIRE;
        }
    }

    /** Regular expression anchored at the start of the value. */
    record Regex(String label, boolean advisory, java.util.regex.Pattern pattern) implements Rule {
        public Regex {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.PATTERN;
        }
    }

    /** Inclusive numeric range. */
    record Range(String label, boolean advisory, double minimum, double maximum) implements Rule {
        public Range {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.RANGE;
        }
    }

    /** Script fragment evaluated in the sandbox with the value bound as {@code string}. */
    record Script(String label, boolean advisory, String source) implements Rule {
        public Script {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(source, "source");
        }

        @Override
        public RuleKind kind() {
            return RuleKind.CODE;
        }
    }

    /**
     * Structural check of a JSON value: every key must be present and its value
     * must satisfy every rule listed for it.
     */
    record Json(String label, boolean advisory, Map<String, List<Rule>> fields) implements Rule {
        public Json {
            Objects.requireNonNull(label, "label");
            Map<String, List<Rule>> copy = new LinkedHashMap<>();
            fields.forEach((key, rules) -> copy.put(key, List.copyOf(rules)));
            fields = Collections.unmodifiableMap(copy);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.JSON;
        }
    }

    /** Matches when every child matches; reports the first child that does not. */
    record All(String label, boolean advisory, List<Rule> children) implements Rule {
        public All {
            Objects.requireNonNull(label, "label");
            children = List.copyOf(children);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.ALL;
        }
    }

    /** Matches when at least one child matches. */
    record Any(String label, boolean advisory, List<Rule> children) implements Rule {
        public Any {
            Objects.requireNonNull(label, "label");
            children = List.copyOf(children);
        }

        @Override
        public RuleKind kind() {
            return RuleKind.ANY;
        }
    }
}
