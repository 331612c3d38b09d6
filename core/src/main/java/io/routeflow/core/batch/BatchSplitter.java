package io.routeflow.core.batch;

import io.routeflow.core.model.BatchUnit;
import java.util.Optional;

/**
 * A finite, ordered, lazily produced sequence of {@link BatchUnit}s cut from one raw payload. Units are numbered
 * {@code 1..N} without gaps.
 *
 * <p>Not thread-safe; a splitter is owned by the worker processing its payload.
 */
public interface BatchSplitter {

    /**
     * Produces the next unit.
     *
     * @return the next unit, or empty once the payload is exhausted
     * @throws io.routeflow.core.error.ScriptException if a script-driven fetch fails
     */
    Optional<BatchUnit> nextUnit();

    /** Restarts the sequence from the first unit. */
    void reset();
}
