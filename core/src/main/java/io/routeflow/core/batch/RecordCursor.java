package io.routeflow.core.batch;

import java.util.Objects;
import java.util.Optional;

/**
 * Lazy forward cursor over the records of a payload. Empty records in the middle are returned; empty records left
 * by terminal delimiters are not.
 */
final class RecordCursor {

    private final String content;
    private final String delimiter;
    private final int end;
    private int position;

    RecordCursor(String content, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("record delimiter must not be empty");
        }
        this.content = Objects.requireNonNullElse(content, "");
        this.delimiter = delimiter;
        this.end = trimmedEnd(this.content, delimiter);
    }

    boolean hasNext() {
        return position < end;
    }

    Optional<String> next() {
        if (!hasNext()) {
            return Optional.empty();
        }
        int cut = content.indexOf(delimiter, position);
        String record;
        if (cut < 0 || cut + delimiter.length() > end) {
            record = content.substring(position, end);
            position = end;
        } else {
            record = content.substring(position, cut);
            position = cut + delimiter.length();
        }
        return Optional.of(record);
    }

    void reset() {
        position = 0;
    }

    private static int trimmedEnd(String content, String delimiter) {
        int end = content.length();
        while (end >= delimiter.length() && content.startsWith(delimiter, end - delimiter.length())) {
            end -= delimiter.length();
        }
        return end;
    }
}
