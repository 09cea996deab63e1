package com.questrail.conformance.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.conformance.action.ActionRegistry;
import com.questrail.conformance.config.HarnessConfig;
import com.questrail.conformance.internal.time.MonotonicClock;
import com.questrail.conformance.internal.time.MonotonicScheduler;
import com.questrail.conformance.internal.time.ScheduledExecutorScheduler;
import com.questrail.conformance.internal.time.SystemMonotonicClock;
import com.questrail.conformance.listener.ListenerFactory;
import com.questrail.conformance.observability.HarnessObservabilitySink;
import com.questrail.conformance.observability.Slf4jHarnessObservabilitySink;
import com.questrail.conformance.rules.RuleCompiler;
import com.questrail.conformance.rules.RuleEvaluator;
import com.questrail.conformance.rules.script.GraalScriptSandbox;
import com.questrail.conformance.rules.script.ScriptSandbox;
import com.questrail.conformance.scenario.ScenarioLoader;
import com.questrail.conformance.scenario.TestScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HarnessRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a harness run.
 *
 * <p>Owns the validator and action pools, the control executor that runs
 * state cleanup and sequencing, and the deadline scheduler. {@link #stop()}
 * aborts running tests, then shuts the executors down.</p>
 */
public final class HarnessRuntime implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(HarnessRuntime.class);

    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final HarnessServices services;
    private final ActionRegistry actions;
    private final RuleCompiler compiler;
    private final TestOrchestrator orchestrator;
    private final List<ExecutorService> executors;
    private final ScriptSandbox sandbox;
    private final AtomicBoolean stopped = new AtomicBoolean();

    private HarnessRuntime(HarnessServices services,
                           ActionRegistry actions,
                           RuleCompiler compiler,
                           List<ExecutorService> executors,
                           ScriptSandbox sandbox)
    {
        this.services = services;
        this.actions = actions;
        this.compiler = compiler;
        this.orchestrator = new TestOrchestrator(services);
        this.executors = executors;
        this.sandbox = sandbox;
    }

    public HarnessServices services() {
        return services;
    }

    public ScenarioLoader scenarioLoader() {
        return new ScenarioLoader(services.config(), actions, compiler);
    }

    public OrchestrationReport runAll(List<TestScenario> scenarios) throws InterruptedException {
        if (stopped.get()) {
            throw new IllegalStateException("runtime stopped");
        }
        return orchestrator.runAll(scenarios);
    }

    /**
     * Aborts running tests and shuts the executors down, waiting up to five
     * seconds for each. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping harness runtime");
        orchestrator.abortAll("harness shutting down");

        for (ExecutorService executor : executors) {
            executor.shutdown();
        }
        for (ExecutorService executor : executors) {
            try {
                if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (sandbox instanceof AutoCloseable) {
            try {
                ((AutoCloseable) sandbox).close();
            } catch (Exception e) {
                log.warn("Closing script sandbox failed: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Stops the runtime on SIGINT/SIGTERM.
     */
    public void installShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "harness-shutdown"));
    }

    public static Builder builder(HarnessConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final HarnessConfig config;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private HarnessObservabilitySink observabilitySink = new Slf4jHarnessObservabilitySink();
        private ListenerFactory listenerFactory = ListenerFactory.defaults();
        private ActionRegistry actions;

        private Builder(HarnessConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withObservabilitySink(HarnessObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withListenerFactory(ListenerFactory factory) {
            this.listenerFactory = factory;
            return this;
        }

        public Builder withActions(ActionRegistry actions) {
            this.actions = actions;
            return this;
        }

        public HarnessRuntime build() {
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(listenerFactory, "listenerFactory");

            // 1. Executors
            ScheduledThreadPoolExecutor schedulerExec = new ScheduledThreadPoolExecutor(1, named("harness-scheduler"));
            schedulerExec.setRemoveOnCancelPolicy(true);
            schedulerExec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            ExecutorService validatorExec = Executors.newCachedThreadPool(named("validator"));
            ExecutorService actionExec = Executors.newCachedThreadPool(named("action"));
            ExecutorService controlExec = Executors.newSingleThreadExecutor(named("harness-control"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Rule engine
            ScriptSandbox sandbox = config.scriptingEnabled()
                    ? new GraalScriptSandbox(config.scriptTimeout(), config.scriptStatementLimit())
                    : ScriptSandbox.disabled();
            RuleEvaluator evaluator = new RuleEvaluator(sandbox, new ObjectMapper());
            RuleCompiler compiler = new RuleCompiler(config.scriptingEnabled());

            // 3. Actions
            ActionRegistry registry = actions != null ? actions : ActionRegistry.discover();

            HarnessServices services = new HarnessServices(
                    config, clock, scheduler,
                    validatorExec, actionExec, controlExec,
                    listenerFactory, evaluator, observabilitySink);

            return new HarnessRuntime(services, registry, compiler,
                    List.of(actionExec, validatorExec, schedulerExec, controlExec), sandbox);
        }

        private static ThreadFactory named(String prefix) {
            AtomicInteger count = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, prefix + "-" + count.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
