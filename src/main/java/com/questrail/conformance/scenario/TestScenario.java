package com.questrail.conformance.scenario;

import com.questrail.conformance.internal.time.Cancellable;
import com.questrail.conformance.internal.time.MonotonicClock;
import com.questrail.conformance.listener.ListenerDestination;
import com.questrail.conformance.observability.TestCompletedEvent;
import com.questrail.conformance.runtime.HarnessServices;
import com.questrail.conformance.state.StateContext;
import com.questrail.conformance.state.StateDescriptor;
import com.questrail.conformance.state.StateResult;
import com.questrail.conformance.state.StateStatus;
import com.questrail.conformance.state.TestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TestScenario
 * =============================================================================
 * An ordered list of states that share one listener destination and one
 * overall deadline.
 *
 * <p>States run one at a time. The first state that does not complete stops
 * the test with {@link TestStatus#FAILED}. The overall deadline is armed
 * independently and, when it fires, aborts whichever state is running and
 * yields {@link TestStatus#TIMED_OUT}.</p>
 *
 * <p>With {@link StateOrder#RANDOM} the order is fixed once, at construction,
 * by {@code Collections.shuffle(list, new Random(seed))}; the same seed always
 * gives the same order.</p>
 */
public final class TestScenario
{
    private static final Logger log = LoggerFactory.getLogger(TestScenario.class);

    private final String name;
    private final List<StateDescriptor> states;
    private final Duration timeout;
    private final ListenerDestination destination;
    private final Long seed;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean deadlinePassed = new AtomicBoolean();
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final AtomicReference<TestState> current = new AtomicReference<>();

    private TestScenario(String name,
                         List<StateDescriptor> states,
                         Duration timeout,
                         ListenerDestination destination,
                         Long seed)
    {
        this.name = name;
        this.states = states;
        this.timeout = timeout;
        this.destination = destination;
        this.seed = seed;
    }

    /**
     * @param seed used only with {@link StateOrder#RANDOM}; drawn at random and
     *             logged when empty
     */
    public static TestScenario create(String name,
                                      List<StateDescriptor> states,
                                      Duration timeout,
                                      ListenerDestination destination,
                                      StateOrder order,
                                      OptionalLong seed)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(seed, "seed");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("test timeout must be positive: " + name);
        }

        List<StateDescriptor> ordered = new ArrayList<>(states);
        Long used = null;
        if (order == StateOrder.RANDOM) {
            used = seed.isPresent() ? seed.getAsLong() : ThreadLocalRandom.current().nextLong(0, 1L << 32);
            log.info("Shuffling test {} states with seed: {}", name, used);
            Collections.shuffle(ordered, new Random(used));
        }
        return new TestScenario(name, Collections.unmodifiableList(ordered), timeout, destination, used);
    }

    public String name() {
        return name;
    }

    public List<StateDescriptor> states() {
        return states;
    }

    public Duration timeout() {
        return timeout;
    }

    public ListenerDestination destination() {
        return destination;
    }

    public OptionalLong seed() {
        return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
    }

    /**
     * Runs the test. May be called once.
     */
    public CompletableFuture<TestResult> run(HarnessServices services) {
        Objects.requireNonNull(services, "services");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("test '" + name + "' already started");
        }

        MonotonicClock clock = services.clock();
        long startNanos = clock.nowNanos();
        long deadlineNanos = startNanos + timeout.toNanos();

        try (MDC.MDCCloseable t = MDC.putCloseable("test", name)) {
            log.info("Starting test '{}' with {} state(s), timeout {} ms", name, states.size(), timeout.toMillis());
        }

        CompletableFuture<TestResult> result = new CompletableFuture<>();
        List<StateResult> results = Collections.synchronizedList(new ArrayList<>());
        Cancellable deadline = services.scheduler().scheduleAtNanos(deadlineNanos, this::onDeadline);

        Run run = new Run(services, startNanos, deadlineNanos, results, deadline, result);
        run.next(0);
        return result;
    }

    /**
     * Stops a running test: the current state is aborted and the test reports
     * {@link TestStatus#ABORTED}.
     */
    public void abort(String reason) {
        if (aborted.compareAndSet(false, true)) {
            TestState state = current.get();
            if (state != null) {
                state.abort(reason);
            }
        }
    }

    private void onDeadline() {
        deadlinePassed.set(true);
        TestState state = current.get();
        if (state != null) {
            state.abort("test '" + name + "' exceeded its timeout of " + timeout.toMillis() + " ms");
        }
    }

    private final class Run
    {
        private final HarnessServices services;
        private final long startNanos;
        private final long deadlineNanos;
        private final List<StateResult> results;
        private final Cancellable deadline;
        private final CompletableFuture<TestResult> result;

        Run(HarnessServices services,
            long startNanos,
            long deadlineNanos,
            List<StateResult> results,
            Cancellable deadline,
            CompletableFuture<TestResult> result)
        {
            this.services = services;
            this.startNanos = startNanos;
            this.deadlineNanos = deadlineNanos;
            this.results = results;
            this.deadline = deadline;
            this.result = result;
        }

        void next(int index) {
            if (deadlinePassed.get()) {
                finish(TestStatus.TIMED_OUT);
                return;
            }
            if (aborted.get()) {
                finish(TestStatus.ABORTED);
                return;
            }
            if (index == states.size()) {
                finish(TestStatus.PASSED);
                return;
            }

            TestState state = new TestState(states.get(index), name);
            current.set(state);
            Duration remaining = Duration.ofNanos(Math.max(0, deadlineNanos - services.clock().nowNanos()));

            CompletableFuture<StateResult> stateResult;
            try {
                stateResult = state.start(new StateContext(name, destination, remaining, services));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                deadline.cancel();
                return;
            }

            stateResult.whenComplete((sr, error) -> {
                current.compareAndSet(state, null);
                if (error != null) {
                    deadline.cancel();
                    result.completeExceptionally(error);
                    return;
                }
                results.add(sr);
                if (deadlinePassed.get() || services.clock().nowNanos() >= deadlineNanos) {
                    finish(TestStatus.TIMED_OUT);
                } else if (aborted.get()) {
                    finish(TestStatus.ABORTED);
                } else if (sr.status() != StateStatus.COMPLETED) {
                    finish(TestStatus.FAILED);
                } else {
                    next(index + 1);
                }
            });
        }

        private void finish(TestStatus status) {
            deadline.cancel();
            Duration elapsed = Duration.ofNanos(services.clock().nowNanos() - startNanos);
            TestResult r = new TestResult(name, status, new ArrayList<>(results), elapsed, seed);
            try (MDC.MDCCloseable t = MDC.putCloseable("test", name)) {
                log.info("Test '{}' finished {} after {} of {} state(s)", name, status, results.size(), states.size());
            }
            services.sink().onTestCompleted(new TestCompletedEvent(Instant.now(), r));
            result.complete(r);
        }
    }
}
