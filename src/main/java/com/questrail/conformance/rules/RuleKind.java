package com.questrail.conformance.rules;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of condition kinds understood by the rule engine.
 *
 * <p>This is the only place where condition names from configuration are
 * mapped to behavior. Everything after {@link RuleCompiler} works on
 * {@link Rule} variants, never on names.</p>
 */
public enum RuleKind {
    FIRE("pass", "fire"),
    NEVER_FIRE("fail", "never_fire"),
    PATTERN("pattern", "regex"),
    RANGE("range", "within_range"),
    CODE("code"),
    JSON("json"),
    ALL("all", "all_pass"),
    ANY("any", "any_pass");

    /** Prefix marking a condition as advisory. */
    public static final String ADVISORY_PREFIX = "may_";

    private final List<String> names;

    RuleKind(String... names) {
        this.names = List.of(names);
    }

    public List<String> names() {
        return names;
    }

    public boolean isCombinator() {
        return this == ALL || this == ANY;
    }

    /**
     * Resolves a condition name, ignoring case and any {@code may_} prefix.
     */
    public static Optional<RuleKind> fromName(String conditionName) {
        if (conditionName == null) {
            return Optional.empty();
        }
        String normalized = stripAdvisoryPrefix(conditionName.toLowerCase(Locale.ROOT));
        for (RuleKind kind : values()) {
            if (kind.names.contains(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static boolean isAdvisory(String conditionName) {
        return conditionName.toLowerCase(Locale.ROOT).startsWith(ADVISORY_PREFIX);
    }

    private static String stripAdvisoryPrefix(String lowerCaseName) {
        return lowerCaseName.startsWith(ADVISORY_PREFIX)
                ? lowerCaseName.substring(ADVISORY_PREFIX.length())
                : lowerCaseName;
    }
}
