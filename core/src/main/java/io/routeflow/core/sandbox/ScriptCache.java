package io.routeflow.core.sandbox;

import io.routeflow.core.error.ScriptCompileException;
import io.routeflow.core.spi.CompiledScript;
import io.routeflow.core.spi.ScriptEngine;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled-script cache keyed by engine id and source text. The only mutable state shared between pipeline workers.
 *
 * <p>Population is idempotent: concurrent first requests for the same key converge on one entry. A compile failure
 * is cached as well, so a broken script is compiled once and the same failure is reported on every later lookup.
 */
public final class ScriptCache {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptCache.class);

    private final EngineRegistry engineRegistry;
    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

    public ScriptCache(EngineRegistry engineRegistry) {
        this.engineRegistry = Objects.requireNonNull(engineRegistry, "engineRegistry must not be null");
    }

    /**
     * Returns the compiled form of {@code source}, compiling it on first use.
     *
     * @param lang       engine id
     * @param source     script text
     * @param scriptName rule/step name used in the error message
     * @throws ScriptCompileException if the engine is unknown or the script does not compile (now or earlier)
     */
    public CompiledScript getOrCompile(String lang, String source, String scriptName) {
        Objects.requireNonNull(source, "source must not be null");
        Entry entry = entries.computeIfAbsent(new Key(lang, source), this::compile);
        if (entry.script() != null) {
            return entry.script();
        }
        throw new ScriptCompileException(entry.failure(), entry.cause(), scriptName);
    }

    /** Number of cached entries, failures included. */
    public int size() {
        return entries.size();
    }

    /** Drops every cached entry; used when channel definitions are redeployed. */
    public void clear() {
        entries.clear();
    }

    private Entry compile(Key key) {
        try {
            ScriptEngine engine = engineRegistry.require(key.lang(), null);
            CompiledScript script = engine.compile(key.source());
            LOG.debug("script.compiled lang={} length={}", key.lang(), key.source().length());
            return new Entry(script, null, null);
        } catch (ScriptCompileException e) {
            LOG.warn("script.compile_failed lang={} reason={}", key.lang(), e.getMessage());
            return new Entry(null, e.getMessage(), e.getCause());
        }
    }

    private record Key(String lang, String source) {}

    private record Entry(CompiledScript script, String failure, Throwable cause) {}
}
