package com.questrail.conformance.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * RuleCompiler
 * -----------------------------------------------------------------------------
 * Turns condition names and their parameters, as read from scenario files,
 * into immutable {@link Rule} values.
 *
 * <p>Compilation is strict: an unknown condition, a malformed parameter or a
 * {@code code} condition while scripting is disabled raises
 * {@link RuleConfigurationException} at load time rather than at run time.</p>
 *
 * <p>Accepted parameter shapes:</p>
 * <ul>
 *   <li>{@code pattern: "^abc"} or {@code pattern: {reg_pattern: "^abc"}}</li>
 *   <li>{@code range: [5, 15]}, {@code range: {minimum: 5, maximum: 15}} or {@code {min, max}}</li>
 *   <li>{@code code: "return true;"} or {@code code: {block: "..."}}</li>
 *   <li>{@code json: {key: {condition: params, ...}, ...}}</li>
 *   <li>{@code all: {condition: params, ...}} and {@code any: {...}}</li>
 * </ul>
 */
public final class RuleCompiler
{
    private static final String CODE_LABEL = "code block";

    private final boolean scriptingEnabled;

    public RuleCompiler(boolean scriptingEnabled) {
        this.scriptingEnabled = scriptingEnabled;
    }

    /**
     * Compiles the {@code triggers} section of a state: a list of single-key
     * objects mapping an attribute to its conditions.
     *
     * <p>An attribute listed without conditions is kept with an empty rule
     * list so that validating it reports a missing rule.</p>
     */
    public RuleMap compileTriggers(JsonNode triggers) {
        if (triggers == null || triggers.isNull() || triggers.isMissingNode()) {
            return RuleMap.empty();
        }
        if (!triggers.isArray()) {
            throw new RuleConfigurationException("triggers must be a list, got: " + triggers.getNodeType());
        }

        Map<String, List<Rule>> rules = new LinkedHashMap<>();
        for (JsonNode trigger : triggers) {
            if (!trigger.isObject()) {
                throw new RuleConfigurationException("trigger entry must be a mapping, got: " + trigger);
            }
            Iterator<Map.Entry<String, JsonNode>> attributes = trigger.fields();
            while (attributes.hasNext()) {
                Map.Entry<String, JsonNode> attribute = attributes.next();
                List<Rule> list = rules.computeIfAbsent(attribute.getKey(), k -> new ArrayList<>());
                list.addAll(compileConditions(attribute.getKey(), attribute.getValue()));
            }
        }
        return RuleMap.of(rules);
    }

    private List<Rule> compileConditions(String attribute, JsonNode conditions) {
        if (conditions == null || conditions.isNull()) {
            return List.of();
        }
        if (!conditions.isObject()) {
            throw new RuleConfigurationException(
                    "conditions for '" + attribute + "' must be a mapping, got: " + conditions);
        }
        List<Rule> compiled = new ArrayList<>();
        conditions.fields().forEachRemaining(e -> compiled.add(compile(e.getKey(), e.getValue())));
        return compiled;
    }

    /**
     * Compiles a single condition.
     *
     * @param conditionName condition name, optionally prefixed with {@code may_}
     * @param params        condition parameters; may be {@code null}
     */
    public Rule compile(String conditionName, JsonNode params) {
        RuleKind kind = RuleKind.fromName(conditionName)
                .orElseThrow(() -> new RuleConfigurationException("unknown condition: " + conditionName));
        boolean advisory = RuleKind.isAdvisory(conditionName);
        JsonNode p = params == null ? NullNode.getInstance() : params;
        String condition = conditionName.toLowerCase(Locale.ROOT);

        switch (kind) {
            case FIRE:
                return new Rule.Fire(label(condition, p), advisory);
            case NEVER_FIRE:
                return new Rule.NeverFire(label(condition, p), advisory);
            case PATTERN:
                return new Rule.Regex(label(condition, p), advisory, compilePattern(condition, p));
            case RANGE:
                return compileRange(condition, advisory, p);
            case CODE:
                return compileScript(condition, advisory, p);
            case JSON:
                return new Rule.Json(label(condition, p), advisory, compileJsonFields(condition, p));
            case ALL: {
                List<Rule> children = compileChildren(condition, p);
                return new Rule.All(combinatorLabel(condition, children), advisory, children);
            }
            case ANY: {
                List<Rule> children = compileChildren(condition, p);
                return new Rule.Any(combinatorLabel(condition, children), advisory, children);
            }
            default:
                throw new IllegalStateException("unhandled rule kind: " + kind);
        }
    }

    private static Pattern compilePattern(String condition, JsonNode p) {
        JsonNode source = p;
        if (p.isObject()) {
            source = firstPresent(p, "reg_pattern", "pattern", "regex");
        }
        if (source == null || !source.isValueNode() || source.isNull()) {
            throw new RuleConfigurationException(condition + " requires a regular expression, got: " + p);
        }
        try {
            return Pattern.compile(source.asText());
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException(condition + " has an invalid regular expression: " + source.asText(), e);
        }
    }

    private static Rule compileRange(String condition, boolean advisory, JsonNode p) {
        JsonNode min;
        JsonNode max;
        if (p.isArray() && p.size() == 2) {
            min = p.get(0);
            max = p.get(1);
        } else if (p.isObject()) {
            min = firstPresent(p, "minimum", "min");
            max = firstPresent(p, "maximum", "max");
        } else {
            throw new RuleConfigurationException(condition + " requires [min, max] or {minimum, maximum}, got: " + p);
        }
        if (min == null || max == null || !min.isNumber() || !max.isNumber()) {
            throw new RuleConfigurationException(condition + " bounds must be numbers, got: " + p);
        }
        double lo = min.asDouble();
        double hi = max.asDouble();
        if (lo > hi) {
            throw new RuleConfigurationException(condition + " minimum " + lo + " exceeds maximum " + hi);
        }
        return new Rule.Range(label(condition, p), advisory, lo, hi);
    }

    private Rule compileScript(String condition, boolean advisory, JsonNode p) {
        if (!scriptingEnabled) {
            throw new RuleConfigurationException(
                    condition + " rules are disabled; enable scripting in the harness configuration to use them");
        }
        JsonNode block = p.isObject() ? p.get("block") : p;
        if (block == null || !block.isTextual() || block.asText().isBlank()) {
            throw new RuleConfigurationException(condition + " requires a non-empty code block");
        }
        return new Rule.Script(condition + ": " + CODE_LABEL, advisory, block.asText());
    }

    private Map<String, List<Rule>> compileJsonFields(String condition, JsonNode p) {
        if (!p.isObject()) {
            throw new RuleConfigurationException(condition + " requires a mapping of keys to conditions, got: " + p);
        }
        Map<String, List<Rule>> fields = new LinkedHashMap<>();
        p.fields().forEachRemaining(field -> {
            JsonNode conditions = field.getValue();
            if (conditions == null || conditions.isNull()) {
                // presence check only
                fields.put(field.getKey(), List.of());
            } else {
                fields.put(field.getKey(), compileConditions(field.getKey(), conditions));
            }
        });
        return fields;
    }

    private List<Rule> compileChildren(String condition, JsonNode p) {
        if (!p.isObject() || p.isEmpty()) {
            throw new RuleConfigurationException(condition + " requires at least one nested condition, got: " + p);
        }
        List<Rule> children = new ArrayList<>();
        p.fields().forEachRemaining(e -> children.add(compile(e.getKey(), e.getValue())));
        return children;
    }

    private static JsonNode firstPresent(JsonNode object, String... names) {
        for (String name : names) {
            JsonNode node = object.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Labels
    // ---------------------------------------------------------------------

    static String label(String condition, JsonNode params) {
        String rendered = render(params);
        return rendered.isEmpty() ? condition : condition + ": " + rendered;
    }

    private static String combinatorLabel(String condition, List<Rule> children) {
        List<String> labels = new ArrayList<>();
        children.forEach(child -> labels.add(child.label()));
        return condition + ": " + String.join(", ", labels);
    }

    private static String render(JsonNode params) {
        if (params == null || params.isNull() || params.isMissingNode()) {
            return "";
        }
        if (params.isObject()) {
            List<String> parts = new ArrayList<>();
            params.fields().forEachRemaining(e -> parts.add(e.getKey() + "=" + scalar(e.getValue())));
            return String.join(", ", parts);
        }
        if (params.isArray()) {
            List<String> parts = new ArrayList<>();
            params.forEach(item -> parts.add(scalar(item)));
            return String.join(", ", parts);
        }
        return params.asText();
    }

    private static String scalar(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
