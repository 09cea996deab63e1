package com.questrail.conformance.state;

import com.questrail.conformance.action.BoundAction;
import com.questrail.conformance.api.TriggerEvent;
import com.questrail.conformance.internal.time.Cancellable;
import com.questrail.conformance.listener.TriggerListener;
import com.questrail.conformance.observability.HarnessErrorEvent;
import com.questrail.conformance.observability.StateTransitionEvent;
import com.questrail.conformance.runtime.HarnessServices;
import com.questrail.conformance.validation.ValidationReport;
import com.questrail.conformance.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TestState
 * =============================================================================
 * Runs one {@link StateDescriptor}: starts a listener, performs the actions
 * and validates incoming triggers until the state resolves.
 *
 * <h2>Resolution</h2>
 * The first of these wins, and only the first:
 * <ul>
 *   <li>every required rule has passed: {@link StateStatus#COMPLETED}</li>
 *   <li>the timeout fires: {@code COMPLETED} if nothing is failed, otherwise
 *       {@link StateStatus#TIMED_OUT}</li>
 *   <li>the listener fails to start, or {@link #abort(String)} is called:
 *       {@link StateStatus#ABORTED}</li>
 * </ul>
 *
 * <h2>Cleanup</h2>
 * Runs on the control executor after resolution, on every path: the timer is
 * cancelled, the validator loop interrupted, unfinished actions cancelled and
 * the listener stopped. The returned {@link StateResult} carries the report
 * snapshot taken at that point.
 *
 * <p>A {@code TestState} is single use.</p>
 */
public final class TestState
{
    private static final Logger log = LoggerFactory.getLogger(TestState.class);

    private final StateDescriptor descriptor;
    private final String testName;

    private final AtomicReference<StateStatus> status = new AtomicReference<>(StateStatus.PENDING);
    private final CompletableFuture<Resolution> resolution = new CompletableFuture<>();

    private final Object lock = new Object();
    // guarded by lock
    private boolean cleanedUp;
    private Future<?> validatorTask;
    private final List<Future<?>> actionTasks = new ArrayList<>();

    private volatile HarnessServices services;

    public TestState(StateDescriptor descriptor, String testName) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.testName = Objects.requireNonNull(testName, "testName");
    }

    public String name() {
        return descriptor.name();
    }

    public StateStatus status() {
        return status.get();
    }

    public CompletableFuture<StateResult> start(StateContext context) {
        Objects.requireNonNull(context, "context");
        if (!status.compareAndSet(StateStatus.PENDING, StateStatus.RUNNING)) {
            if (status.get() == StateStatus.ABORTED && resolution.isDone()) {
                // aborted before it ever ran
                return resolution.thenApply(r -> new StateResult(
                        name(), r.status(), new ValidationReport(List.of()), Duration.ZERO, r.cause()));
            }
            throw new IllegalStateException("state '" + name() + "' already started");
        }
        HarnessServices svc = context.services();
        this.services = svc;
        publishTransition(StateStatus.PENDING, StateStatus.RUNNING);

        long startNanos = svc.clock().nowNanos();
        BlockingQueue<TriggerEvent> queue = new LinkedBlockingQueue<>();
        Validator validator = new Validator(descriptor.rules(), svc.evaluator());
        TriggerListener listener = svc.listenerFactory().create(context.destination(), queue);

        Duration effective = descriptor.timeout().compareTo(context.remainingBudget()) <= 0
                ? descriptor.timeout()
                : context.remainingBudget();

        try (MDC.MDCCloseable t = MDC.putCloseable("test", testName);
             MDC.MDCCloseable s = MDC.putCloseable("state", name())) {
            log.info("Running state '{}': {} (timeout {} ms)", name(), descriptor.description(), effective.toMillis());
        }

        Cancellable timer = svc.scheduler().scheduleAfter(effective, svc.clock(), () -> onTimeout(validator));

        CompletableFuture<Void> ready;
        try {
            ready = listener.start();
        } catch (RuntimeException e) {
            ready = CompletableFuture.failedFuture(e);
        }

        ready.whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("[{}] Listener for state '{}' failed to start: {}", testName, name(), cause.getMessage());
                resolve(StateStatus.ABORTED, cause);
                return;
            }
            synchronized (lock) {
                if (cleanedUp || resolution.isDone()) {
                    return;
                }
                validatorTask = svc.validatorExecutor().submit(() -> runValidator(validator, queue));
                for (BoundAction action : descriptor.actions()) {
                    actionTasks.add(svc.actionExecutor().submit(() -> runAction(action)));
                }
            }
        });

        return resolution.thenApplyAsync(
                r -> cleanup(r, validator, listener, timer, startNanos),
                svc.controlExecutor());
    }

    /**
     * Resolves a running state as {@link StateStatus#ABORTED}. No effect once
     * the state has resolved.
     */
    public void abort(String reason) {
        resolve(StateStatus.ABORTED, new CancellationException(reason));
    }

    private void onTimeout(Validator validator) {
        boolean failures = validator.hasFailures();
        log.info("[{}] State '{}' reached its timeout{}", testName, name(),
                failures ? " with unmatched rules" : "");
        resolve(failures ? StateStatus.TIMED_OUT : StateStatus.COMPLETED, null);
    }

    private void checkCompletion(Validator validator) {
        if (validator.requiredRulesSatisfied()) {
            resolve(StateStatus.COMPLETED, null);
        }
    }

    private void resolve(StateStatus terminal, Throwable cause) {
        if (resolution.complete(new Resolution(terminal, cause))) {
            StateStatus previous = status.getAndSet(terminal);
            publishTransition(previous, terminal);
        }
    }

    private void runValidator(Validator validator, BlockingQueue<TriggerEvent> queue) {
        try (MDC.MDCCloseable t = MDC.putCloseable("test", testName);
             MDC.MDCCloseable s = MDC.putCloseable("state", name())) {
            validator.consume(queue, resolution::isDone, () -> checkCompletion(validator));
        } catch (Exception e) {
            reportError("validator loop for state '" + name() + "' failed", e);
        }
    }

    private void runAction(BoundAction action) {
        try (MDC.MDCCloseable t = MDC.putCloseable("test", testName);
             MDC.MDCCloseable s = MDC.putCloseable("state", name())) {
            log.debug("Running action {}", action);
            action.run();
            log.debug("Action {} finished", action);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Action {} interrupted", action);
        } catch (Exception e) {
            reportError("action " + action + " failed", e);
        }
    }

    private StateResult cleanup(Resolution r,
                                Validator validator,
                                TriggerListener listener,
                                Cancellable timer,
                                long startNanos)
    {
        try (MDC.MDCCloseable t = MDC.putCloseable("test", testName);
             MDC.MDCCloseable s = MDC.putCloseable("state", name())) {
            timer.cancel();
            synchronized (lock) {
                cleanedUp = true;
                if (validatorTask != null) {
                    validatorTask.cancel(true);
                }
                actionTasks.forEach(task -> task.cancel(true));
            }
            try {
                listener.stop();
            } catch (RuntimeException e) {
                reportError("stopping listener for state '" + name() + "' failed", e);
            }

            Duration elapsed = Duration.ofNanos(services.clock().nowNanos() - startNanos);
            StateResult result = new StateResult(name(), r.status(), validator.report(), elapsed, r.cause());

            boolean detailed = services.config().detailedReport();
            boolean colour = services.config().colorizeReport();
            log.info("State '{}' finished {} after {} ms{}", name(), r.status(), elapsed.toMillis(),
                    validator.resultsString(detailed, colour));
            return result;
        }
    }

    private void publishTransition(StateStatus from, StateStatus to) {
        HarnessServices svc = services;
        if (svc != null) {
            svc.sink().onStateTransition(new StateTransitionEvent(Instant.now(), testName, name(), from, to));
        }
    }

    private void reportError(String message, Throwable cause) {
        HarnessServices svc = services;
        if (svc != null) {
            svc.sink().onError(new HarnessErrorEvent(Instant.now(), testName, message, cause));
        } else {
            log.error("{}", message, cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private record Resolution(StateStatus status, Throwable cause) {
    }
}
