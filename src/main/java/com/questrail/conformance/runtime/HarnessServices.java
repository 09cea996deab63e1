package com.questrail.conformance.runtime;

import com.questrail.conformance.config.HarnessConfig;
import com.questrail.conformance.internal.time.MonotonicClock;
import com.questrail.conformance.internal.time.MonotonicScheduler;
import com.questrail.conformance.listener.ListenerFactory;
import com.questrail.conformance.observability.HarnessObservabilitySink;
import com.questrail.conformance.rules.RuleEvaluator;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Shared collaborators handed to every running test and state. Owned by
 * {@link HarnessRuntime}; tests may assemble their own.
 */
public record HarnessServices(
    HarnessConfig config,
    MonotonicClock clock,
    MonotonicScheduler scheduler,
    ExecutorService validatorExecutor,
    ExecutorService actionExecutor,
    Executor controlExecutor,
    ListenerFactory listenerFactory,
    RuleEvaluator evaluator,
    HarnessObservabilitySink sink
) {
    public HarnessServices {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(validatorExecutor, "validatorExecutor");
        Objects.requireNonNull(actionExecutor, "actionExecutor");
        Objects.requireNonNull(controlExecutor, "controlExecutor");
        Objects.requireNonNull(listenerFactory, "listenerFactory");
        Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(sink, "sink");
    }
}
