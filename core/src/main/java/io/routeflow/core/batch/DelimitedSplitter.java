package io.routeflow.core.batch;

import io.routeflow.core.model.BatchUnit;
import java.util.List;
import java.util.Optional;

/**
 * Shared record handling of the delimited strategies: record cursor, leading-record skip, header row, and unit
 * numbering.
 *
 * <p>The header is the first skipped record when records are skipped, otherwise the configured column-names row. It
 * is prepended, followed by the record delimiter, to every unit.
 */
abstract class DelimitedSplitter implements BatchSplitter {

    protected final String recordDelimiter;

    private final RecordCursor cursor;
    private final int skipRecords;
    private final boolean includeColumnNames;
    private final String configuredHeader;

    private boolean started;
    private String header;
    private int sequenceId;

    DelimitedSplitter(String content, BatchOptions options) {
        this.recordDelimiter = Delimiters.unescape(options.recordDelimiter());
        this.cursor = new RecordCursor(content, recordDelimiter);
        this.skipRecords = options.skipRecords();
        this.includeColumnNames = options.includeColumnNames();
        this.configuredHeader = options.columnNames();
    }

    /** Next record after the skipped ones, or empty at the end of the payload. */
    protected final Optional<String> nextRecord() {
        if (!started) {
            start();
        }
        return cursor.next();
    }

    /** Wraps a unit body with the header and assigns the next sequence id. */
    protected final Optional<BatchUnit> emit(String body) {
        String text = header != null ? header + recordDelimiter + body : body;
        return Optional.of(new BatchUnit(++sequenceId, text));
    }

    protected final String join(List<String> records) {
        return String.join(recordDelimiter, records);
    }

    @Override
    public final void reset() {
        cursor.reset();
        started = false;
        header = null;
        sequenceId = 0;
        onReset();
    }

    /** Clears strategy-specific state. */
    protected void onReset() {}

    private void start() {
        started = true;
        for (int i = 0; i < skipRecords; i++) {
            Optional<String> skipped = cursor.next();
            if (skipped.isEmpty()) {
                break;
            }
            if (i == 0 && includeColumnNames) {
                header = skipped.get();
            }
        }
        if (skipRecords == 0 && includeColumnNames && configuredHeader != null) {
            header = configuredHeader;
        }
    }
}
