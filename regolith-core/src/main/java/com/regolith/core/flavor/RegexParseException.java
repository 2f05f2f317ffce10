package com.regolith.core.flavor;

/**
 * Thrown when a pattern is not valid in the flavor that parses it.
 *
 * <p>Carries the position of the offending character so callers can point at it.
 * Positions are 1-based; {@code 0} means the position is unknown.
 */
public class RegexParseException extends Exception {

    private final int line;
    private final int column;

    public RegexParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public RegexParseException(String message) {
        this(message, 0, 0);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Returns true if the exception knows which column is at fault.
     *
     * @return true when the column is set
     */
    public boolean hasPosition() {
        return column > 0;
    }
}
