package io.routeflow.core.batch;

import io.routeflow.core.error.ScriptException;
import io.routeflow.core.model.BatchUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a splitter to exhaustion and hands every unit, in sequence order, to a per-message handler.
 *
 * <p>Each unit gets its own source map: a copy of the caller's map plus {@value #BATCH_SEQUENCE_ID} and
 * {@value #BATCH_COMPLETE}. A handler failure is logged and counted and the run continues with the next unit. A
 * failed unit fetch ends the run and is returned as the batch error.
 */
public final class BatchProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(BatchProcessor.class);

    /** Source map key carrying the unit's 1-based sequence id. */
    public static final String BATCH_SEQUENCE_ID = "batchSequenceId";

    /** Source map key set to {@code true} on the last unit of the batch. */
    public static final String BATCH_COMPLETE = "batchComplete";

    /** Receives one unit with its seeded source map. */
    @FunctionalInterface
    public interface UnitHandler {
        void handle(BatchUnit unit, Map<String, Object> sourceMap);
    }

    /**
     * Result of one batch run.
     *
     * @param units  number of units handed to the handler
     * @param failed number of units whose handler threw
     * @param error  the fetch failure that ended the run early, or {@code null}
     */
    public record Outcome(int units, int failed, ScriptException error) {

        public boolean completed() {
            return error == null;
        }
    }

    public Outcome process(BatchSplitter splitter, Map<String, Object> sourceMap, UnitHandler handler) {
        Map<String, Object> base = sourceMap != null ? sourceMap : Map.of();
        int units = 0;
        int failed = 0;
        ScriptException error = null;

        Optional<BatchUnit> current;
        try {
            current = splitter.nextUnit();
        } catch (ScriptException e) {
            LOG.warn("batch.fetch_failed sequenceId=1 kind={} reason={}", e.kind(), e.getMessage());
            return new Outcome(0, 0, e);
        }
        while (current.isPresent()) {
            BatchUnit unit = current.get();
            Optional<BatchUnit> next;
            try {
                next = splitter.nextUnit();
            } catch (ScriptException e) {
                LOG.warn(
                        "batch.fetch_failed sequenceId={} kind={} reason={}",
                        unit.sequenceId() + 1,
                        e.kind(),
                        e.getMessage());
                error = e;
                next = Optional.empty();
            }

            Map<String, Object> unitSourceMap = new LinkedHashMap<>(base);
            unitSourceMap.put(BATCH_SEQUENCE_ID, unit.sequenceId());
            unitSourceMap.put(BATCH_COMPLETE, next.isEmpty());
            units++;
            try {
                handler.handle(unit, unitSourceMap);
            } catch (RuntimeException e) {
                failed++;
                LOG.warn("batch.unit_failed sequenceId={} reason={}", unit.sequenceId(), e.getMessage(), e);
            }
            current = next;
        }
        LOG.debug("batch.finished units={} failed={} completed={}", units, failed, error == null);
        return new Outcome(units, failed, error);
    }
}
