package io.routeflow.core.batch;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote-aware column tokenizer. Inside quotes the column delimiter is literal and a doubled quote token stands for
 * one quote.
 */
final class ColumnTokenizer {

    private final String columnDelimiter;
    private final String quoteToken;

    ColumnTokenizer(String columnDelimiter, String quoteToken) {
        this.columnDelimiter = columnDelimiter;
        this.quoteToken = quoteToken;
    }

    List<String> tokenize(String record) {
        List<String> columns = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        int i = 0;
        while (i < record.length()) {
            if (inQuote) {
                if (record.startsWith(quoteToken + quoteToken, i)) {
                    current.append(quoteToken);
                    i += quoteToken.length() * 2;
                } else if (record.startsWith(quoteToken, i)) {
                    inQuote = false;
                    i += quoteToken.length();
                } else {
                    current.append(record.charAt(i++));
                }
            } else if (record.startsWith(quoteToken, i)) {
                inQuote = true;
                i += quoteToken.length();
            } else if (record.startsWith(columnDelimiter, i)) {
                columns.add(current.toString());
                current.setLength(0);
                i += columnDelimiter.length();
            } else {
                current.append(record.charAt(i++));
            }
        }
        columns.add(current.toString());
        return columns;
    }
}
