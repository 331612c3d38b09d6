package io.routeflow.core.batch;

import io.routeflow.core.model.ScriptStep;
import java.util.Objects;

/**
 * Splitter configuration. Delimiters may be given in escaped form ({@code "\\n"}); they are unescaped when the
 * splitter is created.
 *
 * @param splitType               strategy
 * @param recordDelimiter         record separator (default {@code \n})
 * @param columnDelimiter         column separator for grouping (default {@code ,})
 * @param quoteToken              quote token for grouping (default {@code "})
 * @param messageDelimiter        sentinel record for {@link SplitType#SENTINEL}
 * @param includeMessageDelimiter whether the sentinel stays at the end of its unit
 * @param groupingColumn          column name or index for {@link SplitType#GROUPING_COLUMN}
 * @param columnNames             header row, in the column delimiter's format
 * @param includeColumnNames      whether a header row is prepended to every unit
 * @param skipRecords             number of leading records dropped before splitting
 * @param script                  batch script for {@link SplitType#SCRIPT}
 * @param lang                    engine id of the batch script
 */
public record BatchOptions(
        SplitType splitType,
        String recordDelimiter,
        String columnDelimiter,
        String quoteToken,
        String messageDelimiter,
        boolean includeMessageDelimiter,
        String groupingColumn,
        String columnNames,
        boolean includeColumnNames,
        int skipRecords,
        String script,
        String lang) {

    public static final String DEFAULT_RECORD_DELIMITER = "\\n";
    public static final String DEFAULT_COLUMN_DELIMITER = ",";
    public static final String DEFAULT_QUOTE_TOKEN = "\"";

    public BatchOptions {
        Objects.requireNonNull(splitType, "splitType must not be null");
        if (skipRecords < 0) {
            throw new IllegalArgumentException("skipRecords must be >= 0, got: " + skipRecords);
        }
        recordDelimiter = isEmpty(recordDelimiter) ? DEFAULT_RECORD_DELIMITER : recordDelimiter;
        columnDelimiter = isEmpty(columnDelimiter) ? DEFAULT_COLUMN_DELIMITER : columnDelimiter;
        quoteToken = isEmpty(quoteToken) ? DEFAULT_QUOTE_TOKEN : quoteToken;
        lang = isEmpty(lang) ? ScriptStep.DEFAULT_LANG : lang;
    }

    public static Builder builder(SplitType splitType) {
        return new Builder(splitType);
    }

    /** Record mode with default delimiters. */
    public static BatchOptions records() {
        return builder(SplitType.RECORD).build();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /** Fluent builder; unset fields take the defaults of the record. */
    public static final class Builder {

        private final SplitType splitType;
        private String recordDelimiter;
        private String columnDelimiter;
        private String quoteToken;
        private String messageDelimiter;
        private boolean includeMessageDelimiter;
        private String groupingColumn;
        private String columnNames;
        private boolean includeColumnNames;
        private int skipRecords;
        private String script;
        private String lang;

        private Builder(SplitType splitType) {
            this.splitType = splitType;
        }

        public Builder recordDelimiter(String recordDelimiter) {
            this.recordDelimiter = recordDelimiter;
            return this;
        }

        public Builder columnDelimiter(String columnDelimiter) {
            this.columnDelimiter = columnDelimiter;
            return this;
        }

        public Builder quoteToken(String quoteToken) {
            this.quoteToken = quoteToken;
            return this;
        }

        public Builder messageDelimiter(String messageDelimiter) {
            this.messageDelimiter = messageDelimiter;
            return this;
        }

        public Builder includeMessageDelimiter(boolean includeMessageDelimiter) {
            this.includeMessageDelimiter = includeMessageDelimiter;
            return this;
        }

        public Builder groupingColumn(String groupingColumn) {
            this.groupingColumn = groupingColumn;
            return this;
        }

        public Builder columnNames(String columnNames) {
            this.columnNames = columnNames;
            return this;
        }

        public Builder includeColumnNames(boolean includeColumnNames) {
            this.includeColumnNames = includeColumnNames;
            return this;
        }

        public Builder skipRecords(int skipRecords) {
            this.skipRecords = skipRecords;
            return this;
        }

        public Builder script(String script) {
            this.script = script;
            return this;
        }

        public Builder lang(String lang) {
            this.lang = lang;
            return this;
        }

        public BatchOptions build() {
            return new BatchOptions(
                    splitType,
                    recordDelimiter,
                    columnDelimiter,
                    quoteToken,
                    messageDelimiter,
                    includeMessageDelimiter,
                    groupingColumn,
                    columnNames,
                    includeColumnNames,
                    skipRecords,
                    script,
                    lang);
        }
    }
}
