package com.questrail.conformance.runtime;

import com.questrail.conformance.scenario.TestResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a harness run produced.
 *
 * @param results  tests that ran to a verdict, in submission order
 * @param errors   tests that threw instead of producing a verdict, by test name
 * @param rejected tests that were not started because their listener
 *                 destination was already taken
 */
public record OrchestrationReport(
    List<TestResult> results,
    Map<String, Throwable> errors,
    List<String> rejected
) {
    public OrchestrationReport {
        results = List.copyOf(results);
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        rejected = List.copyOf(rejected);
    }

    public boolean allPassed() {
        return errors.isEmpty() && rejected.isEmpty() && results.stream().allMatch(TestResult::passed);
    }
}
