package io.routeflow.core.spi;

/**
 * Pluggable scripting language for filter rules, transformer steps and batch scripts. Implementations are registered
 * with {@link io.routeflow.core.sandbox.EngineRegistry} and selected by the {@code lang} field of a rule or step.
 *
 * <p>Implementations MUST be stateless and thread-safe, and MUST NOT expose host classes, the filesystem, the network
 * or timers to scripts beyond the bindings they are handed.
 */
public interface ScriptEngine {

    /**
     * Returns the engine identifier, e.g. {@code "spel"} or {@code "jslt"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles script source into an immutable, thread-safe handle.
     *
     * @param source the script text
     * @return the compiled script
     * @throws io.routeflow.core.error.ScriptCompileException if the script has syntax errors
     */
    CompiledScript compile(String source);
}
