package com.pinebridge.dsl;

/**
 * Thrown when the source cannot be tokenized. Lexing stops at the first error.
 */
public class LexException extends RuntimeException {

    private final int line;
    private final int column;
    private final String reason;

    public LexException(int line, int column, String reason) {
        super(reason + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getReason() {
        return reason;
    }
}
