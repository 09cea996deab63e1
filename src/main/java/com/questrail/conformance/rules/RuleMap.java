package com.questrail.conformance.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Attribute name to the ordered rules registered for it. Immutable.
 *
 * <p>Iteration order follows the order in which triggers were declared, which
 * is also the order used by the validation report.</p>
 */
public final class RuleMap {

    private static final RuleMap EMPTY = new RuleMap(Map.of());

    private final Map<String, List<Rule>> rules;

    private RuleMap(Map<String, List<Rule>> rules) {
        Map<String, List<Rule>> copy = new LinkedHashMap<>();
        rules.forEach((attribute, list) -> copy.put(
                Objects.requireNonNull(attribute, "attribute"),
                List.copyOf(list)));
        this.rules = Collections.unmodifiableMap(copy);
    }

    public static RuleMap of(Map<String, List<Rule>> rules) {
        return new RuleMap(Objects.requireNonNull(rules, "rules"));
    }

    public static RuleMap empty() {
        return EMPTY;
    }

    /**
     * Rules for {@code attribute} in declaration order; empty if none are registered.
     */
    public List<Rule> rulesFor(String attribute) {
        return rules.getOrDefault(attribute, List.of());
    }

    public Set<String> attributes() {
        return rules.keySet();
    }

    public Map<String, List<Rule>> asMap() {
        return rules;
    }

    public boolean hasRequiredRules() {
        return rules.values().stream()
                .flatMap(List::stream)
                .anyMatch(rule -> rule.tracking() == TrackingPolicy.REQUIRED);
    }

    @Override
    public String toString() {
        return "RuleMap" + rules.keySet();
    }
}
