package io.routeflow.core.batch;

import static org.assertj.core.api.Assertions.assertThat;

import io.routeflow.core.model.BatchUnit;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Record splitting")
class RecordSplitterTest {

    private static RecordSplitter splitter(String content, BatchOptions options) {
        return new RecordSplitter(content, options);
    }

    @Test
    @DisplayName("one unit per record with contiguous sequence ids")
    void oneUnitPerRecord() {
        List<BatchUnit> units = Units.drain(splitter("a\nb\nc", BatchOptions.records()));

        assertThat(units).extracting(BatchUnit::sequenceId).containsExactly(1, 2, 3);
        assertThat(units).extracting(BatchUnit::content).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("joining the units gives back the payload without its trailing delimiters")
    void reconstruction() {
        String payload = "a\n\nb\nc\n\n";

        List<String> units = Units.contents(splitter(payload, BatchOptions.records()));

        assertThat(units).containsExactly("a", "", "b", "c");
        assertThat(String.join("\n", units)).isEqualTo("a\n\nb\nc");
    }

    @Test
    @DisplayName("custom multi-character delimiter")
    void customDelimiter() {
        BatchOptions options = BatchOptions.builder(SplitType.RECORD).recordDelimiter("\\r\\n").build();

        assertThat(Units.contents(splitter("x\r\ny\r\n", options))).containsExactly("x", "y");
    }

    @Test
    @DisplayName("empty payload yields no units")
    void emptyPayload() {
        assertThat(Units.drain(splitter("", BatchOptions.records()))).isEmpty();
        assertThat(Units.drain(splitter("\n\n", BatchOptions.records()))).isEmpty();
    }

    @Test
    @DisplayName("skipped first record becomes the header of every unit")
    void skippedHeader() {
        BatchOptions options = BatchOptions.builder(SplitType.RECORD)
                .skipRecords(2)
                .includeColumnNames(true)
                .build();

        assertThat(Units.contents(splitter("id,name\n# comment\n1,a\n2,b", options)))
                .containsExactly("id,name\n1,a", "id,name\n2,b");
    }

    @Test
    @DisplayName("configured column names are the header when nothing is skipped")
    void configuredHeader() {
        BatchOptions options = BatchOptions.builder(SplitType.RECORD)
                .columnNames("id,name")
                .includeColumnNames(true)
                .build();

        assertThat(Units.contents(splitter("1,a", options))).containsExactly("id,name\n1,a");
    }

    @Test
    @DisplayName("skip without header drops the records")
    void skipWithoutHeader() {
        BatchOptions options = BatchOptions.builder(SplitType.RECORD).skipRecords(1).build();

        assertThat(Units.contents(splitter("h\n1\n2", options))).containsExactly("1", "2");
    }

    @Test
    @DisplayName("reset restarts numbering and content")
    void reset() {
        RecordSplitter splitter = splitter("a\nb", BatchOptions.records());
        Units.drain(splitter);

        splitter.reset();

        assertThat(Units.drain(splitter)).extracting(BatchUnit::sequenceId).containsExactly(1, 2);
    }
}
