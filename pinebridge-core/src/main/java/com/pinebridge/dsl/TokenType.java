package com.pinebridge.dsl;

/**
 * Token types for the script language.
 */
public enum TokenType {
    KEYWORD,        // var, if, and, true, na ...
    NAMESPACE,      // ta, math, strategy ... only when followed by '.'
    BUILTIN,        // close, volume, bar_index, plot, nz ...
    IDENTIFIER,
    OPERATOR,       // := => == != <= >= += -= *= /= %= + - * / % < > = ? :
    NUMBER,
    STRING,         // "..." '...' and #RRGGBB color literals
    PUNCTUATION,    // ( ) [ ] { } , .
    COMMENT,
    WHITESPACE,     // includes newlines
    EOF;

    /**
     * Whitespace and comments carry no meaning for the parser.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
