package com.pinebridge.dsl;

/**
 * A lexical token. Line and column are 1-based and point at the first character.
 */
public record Token(TokenType type, String text, int line, int column) {

    public static Token eof(int line, int column) {
        return new Token(TokenType.EOF, "", line, column);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    /**
     * True for the given punctuation or operator text, whatever the type.
     */
    public boolean isSymbol(String symbol) {
        return (type == TokenType.PUNCTUATION || type == TokenType.OPERATOR) && text.equals(symbol);
    }

    /**
     * Word-like tokens: identifiers, keywords, namespaces and builtins.
     */
    public boolean isWord() {
        return type == TokenType.IDENTIFIER || type == TokenType.KEYWORD
            || type == TokenType.NAMESPACE || type == TokenType.BUILTIN;
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + line + ":" + column;
    }
}
