package io.routeflow.core.batch;

/** Delimiter helpers shared by the record-based splitters. */
public final class Delimiters {

    private Delimiters() {}

    /**
     * Replaces the escape sequences {@code \n}, {@code \r}, {@code \t} and {@code \\} with the characters they stand
     * for. Any other backslash sequence is kept verbatim.
     */
    public static String unescape(String value) {
        if (value == null || value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i + 1 == value.length()) {
                sb.append(c);
                continue;
            }
            char next = value.charAt(i + 1);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '\\' -> sb.append('\\');
                default -> {
                    sb.append(c).append(next);
                }
            }
            i++;
        }
        return sb.toString();
    }
}
