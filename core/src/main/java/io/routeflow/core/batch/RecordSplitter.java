package io.routeflow.core.batch;

import io.routeflow.core.model.BatchUnit;
import java.util.Optional;

/** One unit per record, empty records in the middle of the payload included. */
final class RecordSplitter extends DelimitedSplitter {

    RecordSplitter(String content, BatchOptions options) {
        super(content, options);
    }

    @Override
    public Optional<BatchUnit> nextUnit() {
        Optional<String> record = nextRecord();
        return record.isPresent() ? emit(record.get()) : Optional.empty();
    }
}
