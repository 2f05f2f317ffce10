package com.regolith.core.flavor;

import java.util.Objects;

/**
 * Formats a {@link RegexParseException} for terminal output, with a caret under the
 * offending column.
 *
 * <pre>
 * Error parsing pattern:
 *
 *   a{3,1}
 *    ^
 *
 * invalid interval {3,1}: minimum is greater than maximum
 * </pre>
 */
public final class ParseErrorFormatter {

    private static final String INDENT = "  ";

    private ParseErrorFormatter() {
    }

    /**
     * Builds the multi-line error display.
     *
     * <p>For a multi-line pattern only the line named by the error is shown. The caret
     * line is omitted when the column is unknown or points past the end of that line.
     *
     * @param pattern the pattern that failed to parse
     * @param error the parse failure
     * @return formatted error text, without trailing newline
     */
    public static String format(String pattern, RegexParseException error) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(error, "error must not be null");

        String shown = pattern;
        String[] lines = pattern.split("\n", -1);
        if (lines.length > 1 && error.getLine() >= 1 && error.getLine() <= lines.length) {
            shown = lines[error.getLine() - 1];
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Error parsing pattern:\n\n");
        sb.append(INDENT).append(shown).append('\n');

        int column = error.getColumn();
        if (column >= 1 && column <= shown.length()) {
            sb.append(INDENT).append(" ".repeat(column - 1)).append("^\n");
        }

        sb.append('\n').append(error.getMessage());
        return sb.toString();
    }
}
