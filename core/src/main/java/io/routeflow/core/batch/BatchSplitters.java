package io.routeflow.core.batch;

import io.routeflow.core.error.ConfigurationException;
import io.routeflow.core.sandbox.ScriptSandbox;
import java.util.Map;
import java.util.Objects;

/** Creates the splitter for a payload. Configuration problems surface here, before any unit is produced. */
public final class BatchSplitters {

    private BatchSplitters() {}

    /**
     * Creates a splitter for a strategy that needs no script.
     *
     * @throws ConfigurationException if a required option is missing or the strategy is {@link SplitType#SCRIPT}
     */
    public static BatchSplitter create(String content, BatchOptions options) {
        return create(content, options, null, Map.of());
    }

    /**
     * Creates a splitter.
     *
     * @param content   the raw payload
     * @param options   splitter configuration
     * @param sandbox   sandbox running the batch script; only used by {@link SplitType#SCRIPT}
     * @param sourceMap source map exposed read-only to the batch script
     * @throws ConfigurationException if a required option is missing
     */
    public static BatchSplitter create(
            String content, BatchOptions options, ScriptSandbox sandbox, Map<String, Object> sourceMap) {
        Objects.requireNonNull(options, "options must not be null");
        return switch (options.splitType()) {
            case RECORD -> new RecordSplitter(content, options);
            case SENTINEL -> new SentinelDelimiterSplitter(content, options);
            case GROUPING_COLUMN -> new GroupingColumnSplitter(content, options);
            case SCRIPT -> new ScriptBatchSplitter(content, options, sandbox, sourceMap);
            case HL7 -> new Hl7BatchSplitter(content);
        };
    }
}
