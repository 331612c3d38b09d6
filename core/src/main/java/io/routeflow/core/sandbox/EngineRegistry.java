package io.routeflow.core.sandbox;

import io.routeflow.core.error.ScriptCompileException;
import io.routeflow.core.sandbox.jslt.JsltScriptEngine;
import io.routeflow.core.sandbox.spel.SpelScriptEngine;
import io.routeflow.core.spi.ScriptEngine;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Script languages available to channel scripts, keyed by the {@code lang} value a rule, step or batch script
 * declares. Channels are checked against it at parse time and the {@link ScriptCache} resolves engines through it
 * at first compile.
 *
 * <p>Thread-safe.
 */
public final class EngineRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(EngineRegistry.class);

    private final Map<String, ScriptEngine> enginesByLang = new ConcurrentHashMap<>();

    /** Registry with {@code spel} and {@code jslt}. */
    public static EngineRegistry withDefaults() {
        return new EngineRegistry().register(new SpelScriptEngine()).register(new JsltScriptEngine());
    }

    /**
     * Makes a language available. A second engine for the same language takes its place.
     *
     * @return this registry
     * @throws IllegalArgumentException if the engine has no language id
     */
    public EngineRegistry register(ScriptEngine engine) {
        Objects.requireNonNull(engine, "engine must not be null");
        String lang = engine.id();
        if (lang == null || lang.isBlank()) {
            throw new IllegalArgumentException(
                    "Script engine " + engine.getClass().getName() + " declares no language id");
        }
        ScriptEngine previous = enginesByLang.put(lang, engine);
        LOG.debug("engine.registered lang={} replaced={}", lang, previous != null);
        return this;
    }

    public boolean supports(String lang) {
        return lang != null && enginesByLang.containsKey(lang);
    }

    /**
     * Resolves the engine for a script.
     *
     * @param lang       declared language
     * @param scriptName script the lookup is made for, carried by the failure
     * @throws ScriptCompileException if no engine serves {@code lang}
     */
    public ScriptEngine require(String lang, String scriptName) {
        ScriptEngine engine = lang != null ? enginesByLang.get(lang) : null;
        if (engine == null) {
            throw new ScriptCompileException(
                    "Unknown script engine '" + lang + "'; available: " + languages(), scriptName);
        }
        return engine;
    }

    /** Registered language ids, sorted. */
    public Set<String> languages() {
        return new TreeSet<>(enginesByLang.keySet());
    }
}
