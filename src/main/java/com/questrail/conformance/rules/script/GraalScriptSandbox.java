package com.questrail.conformance.rules.script;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * GraalScriptSandbox
 * -----------------------------------------------------------------------------
 * Runs code rules as JavaScript in a locked down GraalVM polyglot context.
 *
 * <p>Each evaluation gets a fresh {@link Context} sharing one {@link Engine}.
 * The context has no host class lookup, no IO, no native access, no threads
 * and no processes; the only host object it can call is {@link ScriptLogger}.
 * A wall clock timeout cancels the context and a statement limit bounds
 * runaway loops.</p>
 *
 * <p>The fragment is the body of a function {@code (string, logger)} and
 * must {@code return} a boolean. Anything else counts as a non-match.</p>
 */
public final class GraalScriptSandbox implements ScriptSandbox, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(GraalScriptSandbox.class);

    private static final String LANGUAGE = "js";

    private final Engine engine;
    private final ExecutorService worker;
    private final Duration timeout;
    private final long statementLimit;
    private final ScriptLogger scriptLogger = new ScriptLogger();

    public GraalScriptSandbox(Duration timeout, long statementLimit) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (statementLimit <= 0) {
            throw new IllegalArgumentException("statementLimit must be positive");
        }
        this.statementLimit = statementLimit;
        this.engine = Engine.newBuilder(LANGUAGE)
                .option("engine.WarnInterpreterOnly", "false")
                .build();
        AtomicInteger count = new AtomicInteger();
        this.worker = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "rule-script-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean evaluate(String source, String value) {
        String wrapped = "(function(string, logger) {\n" + source + "\n})";
        AtomicReference<Context> running = new AtomicReference<>();

        Future<Boolean> future = worker.submit(() -> run(wrapped, value, running));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("code rule exceeded {} ms; treating as non-match", timeout.toMillis());
            Context context = running.get();
            if (context != null) {
                context.close(true);
            }
            future.cancel(true);
            return false;
        } catch (ExecutionException e) {
            log.warn("code rule failed; treating as non-match: {}", e.getCause().getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return false;
        }
    }

    private boolean run(String wrapped, String value, AtomicReference<Context> running) {
        try (Context context = newContext()) {
            running.set(context);
            Value function = context.eval(LANGUAGE, wrapped);
            Value result = function.execute(value, scriptLogger);
            if (!result.isBoolean()) {
                log.debug("code rule returned a non-boolean result: {}", result);
                return false;
            }
            return result.asBoolean();
        } catch (PolyglotException e) {
            if (e.isCancelled() || e.isResourceExhausted()) {
                log.warn("code rule stopped: {}", e.getMessage());
                return false;
            }
            throw e;
        }
    }

    private Context newContext() {
        return Context.newBuilder(LANGUAGE)
                .engine(engine)
                .allowAllAccess(false)
                .allowHostAccess(HostAccess.newBuilder()
                        .allowAccessAnnotatedBy(HostAccess.Export.class)
                        .build())
                .allowHostClassLookup(className -> false)
                .allowIO(IOAccess.NONE)
                .allowNativeAccess(false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .resourceLimits(ResourceLimits.newBuilder()
                        .statementLimit(statementLimit, null)
                        .build())
                .build();
    }

    @Override
    public void close() {
        worker.shutdownNow();
        engine.close();
    }
}
