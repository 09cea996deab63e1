package com.questrail.conformance.listener;

import java.util.concurrent.CompletableFuture;

/**
 * TriggerListener
 * =============================================================================
 * Receives trigger lines from the hosts under test and turns them into
 * {@link com.questrail.conformance.api.TriggerEvent}s on the state's queue.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} may be called once. The returned future completes when
 *       the listener can receive events, or completes exceptionally with
 *       {@link ListenerStartupException}.</li>
 *   <li>{@link #stop()} releases every OS resource. It is idempotent and safe to
 *       call whether or not {@code start()} succeeded.</li>
 * </ul>
 */
public interface TriggerListener
{
    CompletableFuture<Void> start();

    void stop();

    ListenerDestination destination();
}
