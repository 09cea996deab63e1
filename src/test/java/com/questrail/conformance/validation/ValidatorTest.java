package com.questrail.conformance.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.conformance.api.TriggerEvent;
import com.questrail.conformance.rules.RuleCompiler;
import com.questrail.conformance.rules.RuleEvaluator;
import com.questrail.conformance.rules.RuleMap;
import com.questrail.conformance.rules.script.ScriptSandbox;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final RuleCompiler compiler = new RuleCompiler(false);
    private final RuleEvaluator evaluator = new RuleEvaluator(ScriptSandbox.disabled(), JSON);

    private Validator validator(String triggers) throws Exception {
        RuleMap rules = compiler.compileTriggers(JSON.readTree(triggers));
        return new Validator(rules, evaluator);
    }

    @Test
    void missingRuleLeavesTrackingUntouched() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\"}}, {\"Empty\": null}]");
        Map<String, Set<String>> failedBefore = v.failedRules();

        assertThrows(MissingRuleException.class, () -> v.validate("Unknown", "x"));
        MissingRuleException e = assertThrows(MissingRuleException.class, () -> v.validate("Empty", "x"));

        assertEquals("Empty", e.attribute());
        assertEquals(failedBefore, v.failedRules());
        assertTrue(v.passedRules().isEmpty());
    }

    @Test
    void requiredRulesStartFailed() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\"}}]");
        assertEquals(Map.of("A", Set.of("pattern: x")), v.failedRules());
        assertFalse(v.requiredRulesSatisfied());
        assertTrue(v.hasFailures());
    }

    @Test
    void neverFireIsSeededPassedUntilItsAttributeFires() throws Exception {
        Validator v = validator("[{\"A\": {\"never_fire\": null}}]");

        assertEquals(Map.of("A", Set.of("never_fire")), v.passedRules());
        assertFalse(v.hasFailures());

        assertFalse(v.validate("A", "fired anyway"));
        assertTrue(v.passedRules().isEmpty());
        assertEquals(Map.of("A", Set.of("never_fire")), v.failedRules());
        assertTrue(v.hasFailures());
        assertFalse(v.requiredRulesSatisfied(), "no required rules to satisfy");
    }

    @Test
    void firedNeverFireRuleBlocksCompletion() throws Exception {
        Validator v = validator("[{\"A\": {\"pass\": null}}, {\"Error-Cause\": {\"never_fire\": null}}]");

        v.validate("Error-Cause", "boom");
        v.validate("A", "x");

        assertEquals(Map.of("A", Set.of("pass")), v.passedRules());
        assertEquals(Map.of("Error-Cause", Set.of("never_fire")), v.failedRules());
        assertFalse(v.requiredRulesSatisfied());
        assertTrue(v.hasFailures());
    }

    @Test
    void passingIsIdempotent() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\"}}]");

        assertTrue(v.validate("A", "x1"));
        Map<String, Set<String>> once = v.passedRules();
        assertTrue(v.validate("A", "x2"));

        assertEquals(once, v.passedRules());
        assertEquals(Map.of("A", Set.of("pattern: x")), v.passedRules());
        assertTrue(v.failedRules().isEmpty());
        assertTrue(v.requiredRulesSatisfied());
    }

    @Test
    void laterNonMatchMovesRuleBackToFailed() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\"}}]");

        assertTrue(v.validate("A", "x"));
        assertFalse(v.validate("A", "y"));

        assertTrue(v.passedRules().isEmpty());
        assertEquals(Map.of("A", Set.of("pattern: x")), v.failedRules());
    }

    @Test
    void firstMatchingRuleWinsAndEarlierOnesAreMarkedFailed() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\", \"range\": [1, 5]}}]");

        assertTrue(v.validate("A", "x"));
        assertEquals(Set.of("pattern: x"), v.passedRules().get("A"));
        assertEquals(Set.of("range: 1, 5"), v.failedRules().get("A"));

        assertTrue(v.validate("A", "3"));
        assertEquals(Set.of("range: 1, 5"), v.passedRules().get("A"));
        assertEquals(Set.of("pattern: x"), v.failedRules().get("A"));
    }

    @Test
    void advisoryRulesAreNeverTracked() throws Exception {
        Validator v = validator("[{\"A\": {\"may_pattern\": \"x\", \"pattern\": \"y\"}}]");

        assertTrue(v.validate("A", "x"));
        assertEquals(Map.of("A", Set.of("pattern: y")), v.failedRules());
        assertTrue(v.passedRules().isEmpty());
        assertEquals(1, v.report().total());
    }

    @Test
    void combinatorFailureRecordsTheFailingChild() throws Exception {
        Validator v = validator("[{\"A\": {\"all\": {\"pattern\": \"^a\", \"range\": [1, 2]}}}]");

        assertFalse(v.validate("A", "a:9"));
        assertEquals(Map.of("A", Set.of("all: range: 1, 2")), v.failedRules());

        assertTrue(v.validate("A", "a:1"));
        assertEquals(Map.of("A", Set.of("all: pattern: ^a, range: 1, 2")), v.passedRules());
        assertTrue(v.failedRules().isEmpty());
    }

    @Test
    void everyTrackedRuleIsInExactlyOneSet() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\", \"never_fire\": null}}, {\"B\": {\"range\": [0, 1]}}]");
        String[][] events = {{"A", "x"}, {"B", "7"}, {"A", "q"}, {"B", "0.5"}, {"A", "x"}};

        for (String[] e : events) {
            v.validate(e[0], e[1]);
            for (String attribute : v.unmatchedRules().attributes()) {
                Set<String> passed = v.passedRules().getOrDefault(attribute, Set.of());
                Set<String> failed = v.failedRules().getOrDefault(attribute, Set.of());
                assertTrue(passed.stream().noneMatch(failed::contains), "overlap for " + attribute);
            }
        }
        assertEquals(3, v.report().total());
        assertEquals(2, v.report().matched(), "never_fire on A failed once A fired");
    }

    @Test
    void consumeDrainsUntilDoneAndSkipsMissingRules() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\"}}]");
        BlockingQueue<TriggerEvent> queue = new LinkedBlockingQueue<>();
        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger seen = new AtomicInteger();

        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<?> loop = exec.submit(() -> v.consume(queue, done::get, () -> {
                seen.incrementAndGet();
                if (v.requiredRulesSatisfied()) {
                    done.set(true);
                }
            }));

            queue.add(new TriggerEvent("Other", "ignored"));
            queue.add(new TriggerEvent("A", "x"));

            await().atMost(Duration.ofSeconds(5)).until(done::get);
            loop.get(5, TimeUnit.SECONDS);
            assertEquals(2, seen.get());
            assertTrue(v.requiredRulesSatisfied());
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void consumeExitsOnInterrupt() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\"}}]");
        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<?> loop = exec.submit(() -> v.consume(new LinkedBlockingQueue<>(), () -> false, () -> {}));
            Thread.sleep(50);
            loop.cancel(true);
            exec.shutdown();
            assertTrue(exec.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void resultsStringSummarisesCounts() throws Exception {
        Validator v = validator("[{\"A\": {\"pattern\": \"x\"}}, {\"B\": {\"pattern\": \"y\"}}]");
        v.validate("A", "x");

        String summary = v.resultsString(false);
        assertTrue(summary.contains("A: 1/1"), summary);
        assertTrue(summary.contains("B: 0/1"), summary);
        assertTrue(summary.contains("Matched: 1/2 (failures: 1)"), summary);
    }
}
