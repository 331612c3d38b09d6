package io.routeflow.core.batch;

import java.util.regex.Pattern;

/**
 * Line reader handed to batch scripts as {@code reader}. Lines end at {@code \n}, {@code \r\n} or {@code \r}; the
 * terminator is not part of the returned line.
 */
public final class BatchReader {

    private final String content;
    private int position;

    public BatchReader(String content) {
        this.content = content != null ? content : "";
    }

    /** The next line, or {@code null} at the end of the payload. */
    public String readLine() {
        if (position >= content.length()) {
            return null;
        }
        int end = lineEnd(position);
        String line = content.substring(position, end);
        position = skipTerminator(end);
        return line;
    }

    /** The next line without consuming it, or {@code null} at the end of the payload. */
    public String peek() {
        if (position >= content.length()) {
            return null;
        }
        return content.substring(position, lineEnd(position));
    }

    /**
     * Reads the current line and every following line up to, not including, the next line matching {@code regex}
     * (searched with {@link java.util.regex.Matcher#find()}). Lines are joined with {@code \n}.
     *
     * @return the joined lines, or {@code null} at the end of the payload
     */
    public String readUntilNext(String regex) {
        String first = readLine();
        if (first == null) {
            return null;
        }
        Pattern pattern = Pattern.compile(regex);
        StringBuilder sb = new StringBuilder(first);
        String line;
        while ((line = peek()) != null && !pattern.matcher(line).find()) {
            sb.append('\n').append(readLine());
        }
        return sb.toString();
    }

    public boolean hasMore() {
        return position < content.length();
    }

    void reset() {
        position = 0;
    }

    private int lineEnd(int from) {
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\n' || c == '\r') {
                break;
            }
            i++;
        }
        return i;
    }

    private int skipTerminator(int end) {
        if (end >= content.length()) {
            return end;
        }
        if (content.charAt(end) == '\r' && end + 1 < content.length() && content.charAt(end + 1) == '\n') {
            return end + 2;
        }
        return end + 1;
    }
}
