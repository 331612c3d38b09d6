package io.routeflow.core.batch;

import static org.assertj.core.api.Assertions.assertThat;

import io.routeflow.core.error.ScriptTimeoutException;
import io.routeflow.core.model.BatchUnit;
import io.routeflow.core.sandbox.EngineRegistry;
import io.routeflow.core.sandbox.ScriptBudget;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.testkit.SleepingScriptEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BatchProcessor")
class BatchProcessorTest {

    private final BatchProcessor processor = new BatchProcessor();

    @Test
    @DisplayName("every unit gets its sequence id and the last one is marked complete")
    void seedsSourceMap() {
        List<Map<String, Object>> seen = new ArrayList<>();

        BatchProcessor.Outcome outcome = processor.process(
                BatchSplitters.create("a\nb\nc", BatchOptions.records()),
                Map.of("origin", "sftp"),
                (unit, sourceMap) -> seen.add(sourceMap));

        assertThat(outcome.units()).isEqualTo(3);
        assertThat(outcome.completed()).isTrue();
        assertThat(seen).extracting(m -> m.get(BatchProcessor.BATCH_SEQUENCE_ID)).containsExactly(1, 2, 3);
        assertThat(seen).extracting(m -> m.get(BatchProcessor.BATCH_COMPLETE)).containsExactly(false, false, true);
        assertThat(seen).allSatisfy(m -> assertThat(m).containsEntry("origin", "sftp"));
    }

    @Test
    @DisplayName("a failing unit is counted and the batch continues")
    void failureContinues() {
        List<String> handled = new ArrayList<>();

        BatchProcessor.Outcome outcome = processor.process(
                BatchSplitters.create("a\nboom\nc", BatchOptions.records()), Map.of(), (unit, sourceMap) -> {
                    if (unit.content().equals("boom")) {
                        throw new IllegalStateException("bad unit");
                    }
                    handled.add(unit.content());
                });

        assertThat(handled).containsExactly("a", "c");
        assertThat(outcome.units()).isEqualTo(3);
        assertThat(outcome.failed()).isEqualTo(1);
        assertThat(outcome.completed()).isTrue();
    }

    @Test
    @DisplayName("empty payload handles nothing")
    void emptyPayload() {
        BatchProcessor.Outcome outcome =
                processor.process(BatchSplitters.create("", BatchOptions.records()), null, (unit, sourceMap) -> {
                    throw new AssertionError("no unit expected");
                });

        assertThat(outcome.units()).isZero();
        assertThat(outcome.completed()).isTrue();
    }

    @Test
    @DisplayName("a timed-out fetch ends the batch without blocking the next payload")
    void fetchTimeout() {
        EngineRegistry registry = EngineRegistry.withDefaults();
        registry.register(new SleepingScriptEngine());
        try (ScriptSandbox sandbox = new ScriptSandbox(registry, new ScriptBudget(200))) {
            BatchOptions stuck =
                    BatchOptions.builder(SplitType.SCRIPT).lang("sleep").script("forever").build();

            BatchProcessor.Outcome failed = processor.process(
                    BatchSplitters.create("a", stuck, sandbox, Map.of()), Map.of(), (unit, sourceMap) -> {});

            assertThat(failed.completed()).isFalse();
            assertThat(failed.units()).isZero();
            assertThat(failed.error()).isInstanceOf(ScriptTimeoutException.class);

            BatchOptions lines = BatchOptions.builder(SplitType.SCRIPT).script("#reader.readLine()").build();
            List<BatchUnit> next = new ArrayList<>();
            BatchProcessor.Outcome ok = processor.process(
                    BatchSplitters.create("x\ny", lines, sandbox, Map.of()), Map.of(), (unit, sourceMap) -> next.add(unit));

            assertThat(ok.completed()).isTrue();
            assertThat(next).extracting(BatchUnit::content).containsExactly("x", "y");
        }
    }
}
