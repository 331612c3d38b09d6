package io.routeflow.core.batch;

import io.routeflow.core.error.ConfigurationException;
import io.routeflow.core.model.BatchUnit;
import io.routeflow.core.sandbox.ScriptBindings;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.spi.CompiledScript;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Delegates each fetch to a user script bound to {@code reader} (a {@link BatchReader} over the payload) and a
 * read-only {@code sourceMap}. A {@code null} or empty result ends the batch. Each fetch is one sandbox call under the
 * sandbox's timeout; compile, runtime and timeout failures propagate to the caller.
 */
final class ScriptBatchSplitter implements BatchSplitter {

    static final String SCRIPT_NAME = "batch-script";

    private final ScriptSandbox sandbox;
    private final String lang;
    private final String script;
    private final BatchReader reader;
    private final Map<String, Object> sourceMap;

    private CompiledScript compiled;
    private boolean exhausted;
    private int sequenceId;

    ScriptBatchSplitter(String content, BatchOptions options, ScriptSandbox sandbox, Map<String, Object> sourceMap) {
        if (options.script() == null || options.script().isBlank()) {
            throw new ConfigurationException("No batch script was set");
        }
        if (sandbox == null) {
            throw new ConfigurationException("Script batch splitting requires a script sandbox");
        }
        this.sandbox = sandbox;
        this.lang = options.lang();
        this.script = options.script();
        this.reader = new BatchReader(content);
        this.sourceMap = Collections.unmodifiableMap(new LinkedHashMap<>(sourceMap != null ? sourceMap : Map.of()));
    }

    @Override
    public Optional<BatchUnit> nextUnit() {
        if (exhausted) {
            return Optional.empty();
        }
        if (compiled == null) {
            compiled = sandbox.compile(lang, script, SCRIPT_NAME);
        }
        ScriptBindings bindings = ScriptBindings.builder()
                .bind("reader", reader)
                .bind("sourceMap", sourceMap)
                .build();
        Object result = sandbox.run(compiled, bindings, SCRIPT_NAME);
        String text = result != null ? String.valueOf(result) : null;
        if (text == null || text.isEmpty()) {
            exhausted = true;
            return Optional.empty();
        }
        return Optional.of(new BatchUnit(++sequenceId, text));
    }

    @Override
    public void reset() {
        reader.reset();
        exhausted = false;
        sequenceId = 0;
    }
}
