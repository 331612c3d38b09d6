package io.routeflow.core.batch;

import io.routeflow.core.error.ConfigurationException;
import io.routeflow.core.model.BatchUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates records until a record equal to the sentinel. The sentinel is dropped, or appended to its unit after
 * the record delimiter when {@code include-message-delimiter} is set. Trailing records without a sentinel form the
 * last unit.
 *
 * <p>With the sentinel included, a sentinel that closes no records becomes a unit of its own, so joining all units
 * with the record delimiter gives back the original record sequence.
 */
final class SentinelDelimiterSplitter extends DelimitedSplitter {

    private final String sentinel;
    private final boolean includeSentinel;

    SentinelDelimiterSplitter(String content, BatchOptions options) {
        super(content, options);
        if (options.messageDelimiter() == null || options.messageDelimiter().isEmpty()) {
            throw new ConfigurationException("No batch message delimiter was set");
        }
        this.sentinel = Delimiters.unescape(options.messageDelimiter());
        this.includeSentinel = options.includeMessageDelimiter();
    }

    @Override
    public Optional<BatchUnit> nextUnit() {
        List<String> group = new ArrayList<>();
        while (true) {
            Optional<String> next = nextRecord();
            if (next.isEmpty()) {
                return group.isEmpty() ? Optional.empty() : emit(join(group));
            }
            String record = next.get();
            if (!record.equals(sentinel)) {
                group.add(record);
                continue;
            }
            if (!group.isEmpty()) {
                String body = join(group);
                return emit(includeSentinel ? body + recordDelimiter + sentinel : body);
            }
            if (includeSentinel) {
                return emit(sentinel);
            }
        }
    }
}
