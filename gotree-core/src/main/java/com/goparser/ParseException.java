package com.goparser;

/**
 * Thrown when a source file is not valid Go. Carries the 1-based line and column
 * of the offending position.
 */
public class ParseException extends RuntimeException {
    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
