package com.questrail.conformance.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.conformance.rules.script.ScriptSandbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * RuleEvaluator
 * -----------------------------------------------------------------------------
 * Evaluates compiled {@link Rule}s against raw trigger values.
 *
 * <p>Evaluation is pure with respect to the harness: it never touches
 * validator bookkeeping. Malformed input (a non-numeric value for a range, a
 * non-JSON value for a json rule) is a non-match, never an exception.</p>
 */
public final class RuleEvaluator
{
    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final ScriptSandbox sandbox;
    private final ObjectMapper mapper;

    public RuleEvaluator(ScriptSandbox sandbox, ObjectMapper mapper) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public RuleEvaluator(ScriptSandbox sandbox) {
        this(sandbox, new ObjectMapper());
    }

    public RuleResult evaluate(Rule rule, String value) {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(value, "value");

        if (rule instanceof Rule.Fire) {
            return RuleResult.success();
        }
        if (rule instanceof Rule.NeverFire) {
            return RuleResult.failure();
        }
        if (rule instanceof Rule.Regex r) {
            return RuleResult.of(r.pattern().matcher(value).lookingAt());
        }
        if (rule instanceof Rule.Range r) {
            return RuleResult.of(withinRange(r, value));
        }
        if (rule instanceof Rule.Script s) {
            return RuleResult.of(sandbox.evaluate(s.source(), value));
        }
        if (rule instanceof Rule.Json j) {
            return RuleResult.of(matchesJson(j, value));
        }
        if (rule instanceof Rule.All a) {
            return evaluateAll(a, value);
        }
        if (rule instanceof Rule.Any a) {
            return evaluateAny(a, value);
        }
        throw new IllegalStateException("unhandled rule: " + rule);
    }

    private RuleResult evaluateAll(Rule.All all, String value) {
        for (Rule child : all.children()) {
            if (!evaluate(child, value).matched()) {
                log.debug("all-rule child failed: {} (value={})", child.label(), value);
                return RuleResult.failedOn("all: " + child.label());
            }
        }
        return RuleResult.success();
    }

    private RuleResult evaluateAny(Rule.Any any, String value) {
        for (Rule child : any.children()) {
            if (evaluate(child, value).matched()) {
                return RuleResult.success();
            }
        }
        return RuleResult.failure();
    }

    private static boolean withinRange(Rule.Range range, String value) {
        int colon = value.lastIndexOf(':');
        String numeric = (colon >= 0 ? value.substring(colon + 1) : value).strip();
        try {
            double v = Double.parseDouble(numeric);
            return v >= range.minimum() && v <= range.maximum();
        } catch (NumberFormatException e) {
            log.debug("range rule '{}' got non-numeric value '{}'", range.label(), value);
            return false;
        }
    }

    private boolean matchesJson(Rule.Json rule, String value) {
        Optional<JsonNode> parsed = OctetsJson.parse(mapper, value);
        if (parsed.isEmpty() || !parsed.get().isObject() || parsed.get().isEmpty()) {
            log.debug("json rule '{}' got a value that is not a JSON object: {}", rule.label(), value);
            return false;
        }
        return matchesFields(rule, parsed.get());
    }

    private boolean matchesFields(Rule.Json rule, JsonNode object) {
        for (Map.Entry<String, List<Rule>> field : rule.fields().entrySet()) {
            JsonNode node = object.get(field.getKey());
            if (node == null) {
                return false;
            }
            for (Rule nested : field.getValue()) {
                if (!matchesNode(nested, node)) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean matchesNode(Rule rule, JsonNode node) {
        if (rule instanceof Rule.Json nested) {
            return node.isObject() && matchesFields(nested, node);
        }
        String text = node.isTextual() ? node.asText() : node.toString();
        return evaluate(rule, text).matched();
    }
}
