package com.questrail.conformance.observability;

import com.questrail.conformance.scenario.TestResult;
import com.questrail.conformance.scenario.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HarnessObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHarnessObservabilitySink implements HarnessObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHarnessObservabilitySink.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        if (event.isTerminal()) {
            log.info("[{}] State '{}': {} -> {}",
                event.testName(), event.stateName(), event.oldStatus(), event.newStatus());
        } else {
            log.debug("[{}] State '{}': {} -> {}",
                event.testName(), event.stateName(), event.oldStatus(), event.newStatus());
        }
    }

    @Override
    public void onTestCompleted(TestCompletedEvent event) {
        TestResult result = event.result();
        if (result.status() == TestStatus.PASSED) {
            log.info("Test '{}' PASSED in {} ms", result.name(), result.elapsed().toMillis());
        } else {
            log.warn("Test '{}' {} in {} ms", result.name(), result.status(), result.elapsed().toMillis());
        }
    }

    @Override
    public void onError(HarnessErrorEvent event) {
        log.error("[{}] {}", event.testName(), event.message(), event.cause());
    }
}
