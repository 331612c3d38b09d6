package io.routeflow.core.spi;

import io.routeflow.core.sandbox.ScriptBindings;

/**
 * An immutable, thread-safe compiled script produced by {@link ScriptEngine#compile(String)}. A single instance is
 * shared by every message and worker that runs the same source text.
 *
 * <p>Callers go through {@link io.routeflow.core.sandbox.ScriptSandbox}, which adds the wall-clock budget; do not
 * call {@link #evaluate} directly from pipeline code.
 */
@FunctionalInterface
public interface CompiledScript {

    /**
     * Runs the script against the given bindings.
     *
     * @param bindings the only values visible to the script
     * @return the script result as a plain Java value ({@code String}, {@code Boolean}, {@code Number}, {@code Map},
     *     {@code List}) or {@code null}
     * @throws io.routeflow.core.error.ScriptRuntimeException if the script fails while running
     */
    Object evaluate(ScriptBindings bindings);
}
