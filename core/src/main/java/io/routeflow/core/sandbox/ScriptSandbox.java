package io.routeflow.core.sandbox;

import io.routeflow.core.error.ScriptCompileException;
import io.routeflow.core.error.ScriptException;
import io.routeflow.core.error.ScriptRuntimeException;
import io.routeflow.core.error.ScriptTimeoutException;
import io.routeflow.core.spi.CompiledScript;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles and runs user scripts under a wall-clock budget.
 *
 * <p>Every call runs on a dedicated sandbox thread while the caller waits at most {@link ScriptBudget#timeoutMs()}.
 * On expiry the sandbox thread is interrupted and the caller gets a {@link ScriptTimeoutException}; a script that
 * ignores the interrupt keeps its thread until it finishes, but its result is discarded. Bindings are the only
 * values a script can reach.
 *
 * <p>Thread-safe. One sandbox is shared by all pipeline workers of a channel.
 */
public final class ScriptSandbox implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptSandbox.class);

    private final ScriptCache cache;
    private final ScriptBudget budget;
    private final ExecutorService executor;

    public ScriptSandbox(EngineRegistry engineRegistry, ScriptBudget budget) {
        this(new ScriptCache(engineRegistry), budget);
    }

    public ScriptSandbox(ScriptCache cache, ScriptBudget budget) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.budget = budget != null ? budget : ScriptBudget.DEFAULT;
        this.executor = Executors.newCachedThreadPool(new SandboxThreadFactory());
    }

    /** Sandbox with the built-in engines and the default budget. */
    public static ScriptSandbox withDefaults() {
        return new ScriptSandbox(EngineRegistry.withDefaults(), ScriptBudget.DEFAULT);
    }

    public ScriptBudget budget() {
        return budget;
    }

    public ScriptCache cache() {
        return cache;
    }

    /**
     * Returns the cached compiled form of a script.
     *
     * @throws ScriptCompileException if the engine is unknown or the source does not compile
     */
    public CompiledScript compile(String lang, String source, String scriptName) {
        return cache.getOrCompile(lang, source, scriptName);
    }

    /** Runs a compiled script with the sandbox's default budget. */
    public Object run(CompiledScript script, ScriptBindings bindings, String scriptName) {
        return run(script, bindings, scriptName, budget.timeoutMs());
    }

    /**
     * Runs a compiled script, waiting at most {@code timeoutMs}.
     *
     * @return the script's result, possibly {@code null}
     * @throws ScriptTimeoutException if the budget is exceeded
     * @throws ScriptRuntimeException if the script fails or the caller is interrupted
     */
    public Object run(CompiledScript script, ScriptBindings bindings, String scriptName, long timeoutMs) {
        Objects.requireNonNull(script, "script must not be null");
        ScriptBindings scope = bindings != null ? bindings : ScriptBindings.empty();
        Future<Object> future;
        try {
            future = executor.submit(() -> script.evaluate(scope));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Script sandbox is closed", e);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("script.timeout name={} timeoutMs={}", scriptName, timeoutMs);
            throw new ScriptTimeoutException(
                    "Script '" + scriptName + "' exceeded its " + timeoutMs + " ms budget", scriptName, timeoutMs);
        } catch (ExecutionException e) {
            throw named(e.getCause(), scriptName);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScriptRuntimeException("Interrupted while waiting for script '" + scriptName + "'", e, scriptName);
        }
    }

    /** Compiles (through the cache) and runs a script in one call. */
    public Object evaluate(String lang, String source, String scriptName, ScriptBindings bindings) {
        return run(compile(lang, source, scriptName), bindings, scriptName);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ScriptException named(Throwable failure, String scriptName) {
        if (failure instanceof ScriptTimeoutException timeout) {
            return timeout;
        }
        if (failure instanceof ScriptCompileException compile) {
            return compile.scriptName() != null
                    ? compile
                    : new ScriptCompileException(compile.getMessage(), compile.getCause(), scriptName);
        }
        if (failure instanceof ScriptRuntimeException runtime) {
            return runtime.scriptName() != null
                    ? runtime
                    : new ScriptRuntimeException(runtime.getMessage(), runtime.getCause(), scriptName);
        }
        String reason = failure.getMessage() != null
                ? failure.getMessage()
                : failure.getClass().getSimpleName();
        return new ScriptRuntimeException("Script '" + scriptName + "' failed: " + reason, failure, scriptName);
    }

    private static final class SandboxThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "routeflow-sandbox-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
