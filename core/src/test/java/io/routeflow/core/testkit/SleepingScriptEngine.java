package io.routeflow.core.testkit;

import io.routeflow.core.error.ScriptRuntimeException;
import io.routeflow.core.spi.CompiledScript;
import io.routeflow.core.spi.ScriptEngine;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test engine whose scripts sleep. The source is a number of milliseconds to sleep before returning
 * {@code "done"}, or {@code forever} for a script that never returns on its own.
 */
public final class SleepingScriptEngine implements ScriptEngine {

    public static final String ENGINE_ID = "sleep";

    private final AtomicInteger interrupted = new AtomicInteger();

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledScript compile(String source) {
        long sleepMs = "forever".equals(source.trim()) ? Long.MAX_VALUE : Long.parseLong(source.trim());
        return bindings -> {
            try {
                Thread.sleep(sleepMs);
                return "done";
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                Thread.currentThread().interrupt();
                throw new ScriptRuntimeException("interrupted", e, null);
            }
        };
    }

    /** Number of calls that were cancelled while sleeping. */
    public int interruptedCalls() {
        return interrupted.get();
    }
}
