package com.questrail.conformance.runtime;

import com.questrail.conformance.listener.ListenerDestination;
import com.questrail.conformance.observability.HarnessErrorEvent;
import com.questrail.conformance.scenario.TestResult;
import com.questrail.conformance.scenario.TestScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * TestOrchestrator
 * =============================================================================
 * Runs a batch of tests concurrently and collects every outcome.
 *
 * <p>Tests never share a listener destination: a scenario whose destination
 * is already used by an earlier one in the batch is rejected and logged. A
 * test that throws is recorded in the report and does not affect the
 * others.</p>
 */
public final class TestOrchestrator
{
    private static final Logger log = LoggerFactory.getLogger(TestOrchestrator.class);

    private final HarnessServices services;
    private final Set<TestScenario> running = ConcurrentHashMap.newKeySet();

    public TestOrchestrator(HarnessServices services) {
        this.services = Objects.requireNonNull(services, "services");
    }

    /**
     * Starts every scenario and blocks until all have finished.
     */
    public OrchestrationReport runAll(List<TestScenario> scenarios) throws InterruptedException {
        Objects.requireNonNull(scenarios, "scenarios");

        Set<ListenerDestination> claimed = new HashSet<>();
        List<String> rejected = new ArrayList<>();
        Map<TestScenario, CompletableFuture<TestResult>> futures = new LinkedHashMap<>();

        for (TestScenario scenario : scenarios) {
            if (!claimed.add(scenario.destination())) {
                log.error("Test '{}' rejected: listener destination {} is already in use",
                        scenario.name(), scenario.destination());
                rejected.add(scenario.name());
                continue;
            }
            running.add(scenario);
            CompletableFuture<TestResult> future;
            try {
                future = scenario.run(services);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            futures.put(scenario, future.whenComplete((r, e) -> running.remove(scenario)));
        }

        List<TestResult> results = new ArrayList<>();
        Map<String, Throwable> errors = new LinkedHashMap<>();
        for (Map.Entry<TestScenario, CompletableFuture<TestResult>> entry : futures.entrySet()) {
            String name = entry.getKey().name();
            try {
                results.add(entry.getValue().get());
            } catch (ExecutionException e) {
                Throwable cause = unwrap(e.getCause());
                errors.put(name, cause);
                services.sink().onError(new HarnessErrorEvent(Instant.now(), name, "test failed to run", cause));
            }
        }

        OrchestrationReport report = new OrchestrationReport(results, errors, rejected);
        log.info("Ran {} test(s): {} passed, {} not passed, {} errored, {} rejected",
                futures.size(),
                results.stream().filter(TestResult::passed).count(),
                results.stream().filter(r -> !r.passed()).count(),
                errors.size(),
                rejected.size());
        return report;
    }

    /**
     * Aborts every test currently running under this orchestrator.
     */
    public void abortAll(String reason) {
        for (TestScenario scenario : running) {
            scenario.abort(reason);
        }
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }
}
