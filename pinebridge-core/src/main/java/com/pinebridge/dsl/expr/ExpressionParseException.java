package com.pinebridge.dsl.expr;

/**
 * Thrown when an expression does not match the expression grammar.
 */
public class ExpressionParseException extends RuntimeException {

    private final int column;

    public ExpressionParseException(String message, int column) {
        super(message + " at column " + column);
        this.column = column;
    }

    public int getColumn() {
        return column;
    }
}
