package com.questrail.conformance.validation;

import com.questrail.conformance.api.TriggerEvent;
import com.questrail.conformance.rules.Rule;
import com.questrail.conformance.rules.RuleEvaluator;
import com.questrail.conformance.rules.RuleMap;
import com.questrail.conformance.rules.RuleResult;
import com.questrail.conformance.rules.TrackingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.function.BooleanSupplier;

/**
 * Validator
 * -----------------------------------------------------------------------------
 * Checks trigger events against one state's {@link RuleMap} and keeps per-rule
 * pass/fail bookkeeping.
 *
 * <h2>Tracking</h2>
 * <ul>
 *   <li>required rules start failed and move to passed on their first match</li>
 *   <li>never_fire rules start passed and move to failed when their attribute
 *       fires; nothing moves them back</li>
 *   <li>advisory ({@code may_}) rules are evaluated and logged, never tracked</li>
 * </ul>
 *
 * <p>Each tracked rule is in exactly one of the two sets at any time. A later
 * non-match moves a passed rule back to failed, so the report reflects the
 * most recent evidence for each rule.</p>
 *
 * <h2>Threading</h2>
 * <p>{@link #consume} is the single writer. Queries and {@link #report()} may
 * be called from any thread.</p>
 */
public final class Validator
{
    private static final Logger log = LoggerFactory.getLogger(Validator.class);

    private final RuleMap rules;
    private final RuleEvaluator evaluator;
    private final Object lock = new Object();

    // attribute -> tracked rule slots, parallel to rules.rulesFor(attribute)
    private final Map<String, List<Slot>> tracking = new LinkedHashMap<>();

    public Validator(RuleMap rules, RuleEvaluator evaluator) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");

        rules.asMap().forEach((attribute, list) -> {
            List<Slot> slots = new ArrayList<>(list.size());
            for (Rule rule : list) {
                slots.add(new Slot(rule));
            }
            tracking.put(attribute, slots);
        });
    }

    /**
     * Validates one value for {@code attribute}.
     *
     * @return {@code true} when a rule matched
     * @throws MissingRuleException when the attribute has no rules; tracking is untouched
     */
    public boolean validate(String attribute, String value) {
        List<Rule> list = rules.rulesFor(attribute);
        if (list.isEmpty()) {
            throw new MissingRuleException(attribute);
        }

        synchronized (lock) {
            List<Slot> slots = tracking.get(attribute);
            for (int i = 0; i < list.size(); i++) {
                Rule rule = list.get(i);
                Slot slot = slots.get(i);
                if (rule.tracking() == TrackingPolicy.FORBIDDEN) {
                    // the attribute arriving at all breaks the rule; the predicate is not consulted
                    log.warn("{} fired with '{}' but is declared never to fire ({})", attribute, value, rule.label());
                    slot.fail(null);
                    continue;
                }
                RuleResult result = evaluator.evaluate(rule, value);
                if (result.matched()) {
                    log.debug("{}='{}' matched {}", attribute, value, rule.label());
                    slot.pass();
                    return true;
                }
                log.debug("{}='{}' did not match {}", attribute, value, result.failingLabel().orElse(rule.label()));
                slot.fail(result.failingLabel().orElse(null));
            }
            return false;
        }
    }

    /**
     * Drains {@code queue} until {@code done} reports true or the thread is
     * interrupted. {@code afterEach} runs after every validated event.
     *
     * <p>Events still queued on exit are left in the queue.</p>
     */
    public void consume(BlockingQueue<TriggerEvent> queue, BooleanSupplier done, Runnable afterEach) {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(done, "done");
        Objects.requireNonNull(afterEach, "afterEach");

        while (!done.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
            TriggerEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            log.debug("Validating trigger {} with value '{}'", event.attribute(), event.value());
            try {
                boolean result = validate(event.attribute(), event.value());
                log.debug("Validation result: {}", result ? "PASSED" : "FAILED");
            } catch (MissingRuleException e) {
                log.debug("Validation skipped (no rules): {}", e.getMessage());
            }
            afterEach.run();
        }
        log.debug("Validator finished processing events");
    }

    /** The rule map this validator was built from. */
    public RuleMap unmatchedRules() {
        return rules;
    }

    /**
     * {@code true} when at least one required rule exists, all of them have
     * passed and no never_fire rule has failed.
     */
    public boolean requiredRulesSatisfied() {
        synchronized (lock) {
            boolean anyRequired = false;
            for (List<Slot> slots : tracking.values()) {
                for (Slot slot : slots) {
                    if (slot.tracked() && !slot.passed) {
                        return false;
                    }
                    anyRequired |= slot.rule.tracking() == TrackingPolicy.REQUIRED;
                }
            }
            return anyRequired;
        }
    }

    public boolean hasFailures() {
        synchronized (lock) {
            return tracking.values().stream()
                    .flatMap(List::stream)
                    .anyMatch(slot -> slot.tracked() && !slot.passed);
        }
    }

    public Map<String, Set<String>> passedRules() {
        return labels(true);
    }

    public Map<String, Set<String>> failedRules() {
        return labels(false);
    }

    private Map<String, Set<String>> labels(boolean passed) {
        synchronized (lock) {
            Map<String, Set<String>> out = new LinkedHashMap<>();
            tracking.forEach((attribute, slots) -> {
                Set<String> labels = new LinkedHashSet<>();
                for (Slot slot : slots) {
                    if (slot.tracked() && slot.passed == passed) {
                        labels.add(slot.label());
                    }
                }
                if (!labels.isEmpty()) {
                    out.put(attribute, Collections.unmodifiableSet(labels));
                }
            });
            return Collections.unmodifiableMap(out);
        }
    }

    public ValidationReport report() {
        synchronized (lock) {
            List<ValidationReport.AttributeResult> attributes = new ArrayList<>();
            tracking.forEach((attribute, slots) -> {
                List<ValidationReport.RuleOutcome> outcomes = new ArrayList<>();
                for (Slot slot : slots) {
                    if (slot.tracked()) {
                        outcomes.add(new ValidationReport.RuleOutcome(slot.label(), slot.passed));
                    }
                }
                if (!outcomes.isEmpty()) {
                    attributes.add(new ValidationReport.AttributeResult(attribute, outcomes));
                }
            });
            return new ValidationReport(attributes);
        }
    }

    public String resultsString(boolean detailed, boolean colorize) {
        return new ReportRenderer(colorize).render(report(), detailed);
    }

    public String resultsString(boolean detailed) {
        return resultsString(detailed, false);
    }

    private static final class Slot {
        private final Rule rule;
        private boolean passed;
        private String failedLabel;

        Slot(Rule rule) {
            this.rule = rule;
            this.passed = rule.tracking() == TrackingPolicy.FORBIDDEN;
        }

        boolean tracked() {
            return rule.tracking() != TrackingPolicy.ADVISORY;
        }

        void pass() {
            if (tracked()) {
                passed = true;
                failedLabel = null;
            }
        }

        void fail(String childLabel) {
            if (tracked()) {
                passed = false;
                failedLabel = childLabel;
            }
        }

        String label() {
            return !passed && failedLabel != null ? failedLabel : rule.label();
        }
    }
}
