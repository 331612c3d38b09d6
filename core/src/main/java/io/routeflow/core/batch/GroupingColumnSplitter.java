package io.routeflow.core.batch;

import io.routeflow.core.error.ConfigurationException;
import io.routeflow.core.model.BatchUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups consecutive records that share the value of one column. A group closes only when the value changes, so a
 * value that comes back later starts a new group. Empty records are ignored.
 */
final class GroupingColumnSplitter extends DelimitedSplitter {

    private static final Pattern TRAILING_DIGITS = Pattern.compile("(\\d+)$");

    private final ColumnTokenizer tokenizer;
    private final int columnIndex;
    private String pending;

    GroupingColumnSplitter(String content, BatchOptions options) {
        super(content, options);
        if (options.groupingColumn() == null || options.groupingColumn().isBlank()) {
            throw new ConfigurationException("No batch grouping column was set");
        }
        this.tokenizer = new ColumnTokenizer(
                Delimiters.unescape(options.columnDelimiter()), Delimiters.unescape(options.quoteToken()));
        List<String> names = options.columnNames() != null ? tokenizer.tokenize(options.columnNames()) : List.of();
        this.columnIndex = resolveColumnIndex(options.groupingColumn().trim(), names);
    }

    /**
     * Resolves the grouping column: by name in the column-names row, else by the trailing digits of the name as a
     * 1-based position ({@code column2} and {@code 2} both mean the second column), else the first column.
     */
    static int resolveColumnIndex(String groupingColumn, List<String> columnNames) {
        int byName = columnNames.indexOf(groupingColumn);
        if (byName >= 0) {
            return byName;
        }
        Matcher digits = TRAILING_DIGITS.matcher(groupingColumn);
        if (digits.find()) {
            try {
                int position = Integer.parseInt(digits.group(1));
                return position > 0 ? position - 1 : 0;
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Grouping column index out of range: " + groupingColumn);
            }
        }
        return 0;
    }

    int columnIndex() {
        return columnIndex;
    }

    @Override
    public Optional<BatchUnit> nextUnit() {
        List<String> group = new ArrayList<>();
        String groupValue = null;
        if (pending != null) {
            group.add(pending);
            groupValue = valueOf(pending);
            pending = null;
        }
        while (true) {
            Optional<String> next = nextRecord();
            if (next.isEmpty()) {
                break;
            }
            String record = next.get();
            if (record.isEmpty()) {
                continue;
            }
            String value = valueOf(record);
            if (group.isEmpty()) {
                groupValue = value;
            } else if (!value.equals(groupValue)) {
                pending = record;
                break;
            }
            group.add(record);
        }
        return group.isEmpty() ? Optional.empty() : emit(join(group));
    }

    @Override
    protected void onReset() {
        pending = null;
    }

    private String valueOf(String record) {
        List<String> columns = tokenizer.tokenize(record);
        return columnIndex < columns.size() ? columns.get(columnIndex) : "";
    }
}
