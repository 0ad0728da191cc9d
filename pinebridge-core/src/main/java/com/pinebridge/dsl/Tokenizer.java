package com.pinebridge.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for indicator scripts. Emits every character of the input as part of
 * some token, whitespace and comments included, so the stream renders back to the
 * exact source.
 */
public class Tokenizer {

    private static final Set<String> KEYWORDS = Set.of(
        // Declarations and control flow
        "var", "varip", "if", "else", "for", "to", "by", "in", "while", "switch",
        "break", "continue", "export", "import", "as", "return", "type", "method",
        "indicator", "strategy", "library", "study",
        // Literals and logic
        "true", "false", "na", "and", "or", "not",
        // Type names
        "int", "float", "bool", "color", "string", "series", "simple", "const",
        "line", "label", "box", "table", "array", "matrix", "map", "void"
    );

    private static final Set<String> NAMESPACES = Set.of(
        "ta", "math", "strategy", "array", "matrix", "map", "line", "label", "box",
        "table", "color", "request", "timeframe", "ticker", "input", "str", "runtime",
        "session", "barstate", "syminfo", "barmerge", "chart", "polyline", "linefill",
        "plot", "shape", "location", "size", "position", "display", "alert", "currency",
        "dayofweek", "extend", "format", "hline", "order", "scale", "text", "xloc", "yloc"
    );

    private static final Set<String> BUILTINS = Set.of(
        // Series
        "open", "high", "low", "close", "volume", "time", "time_close", "hl2", "hlc3",
        "ohlc4", "hlcc4", "bar_index", "last_bar_index", "timenow", "year", "month",
        "weekofyear", "dayofmonth", "dayofweek", "hour", "minute", "second", "barstate",
        "syminfo", "timeframe",
        // Free functions
        "plot", "plotshape", "plotchar", "plotarrow", "plotcandle", "plotbar", "hline",
        "bgcolor", "barcolor", "fill", "nz", "fixnan", "timestamp", "alert",
        "alertcondition", "input", "security", "max_bars_back"
    );

    /** Longest first. */
    private static final List<String> OPERATORS = List.of(
        ":=", "=>", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=",
        "+", "-", "*", "/", "%", "<", ">", "=", "?", ":"
    );

    private final String source;
    private int position = 0;
    private int line = 1;
    private int column = 1;
    private final List<Token> tokens = new ArrayList<>();

    public Tokenizer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Convenience function to tokenize a string.
     */
    public static TokenStream tokenize(String source) {
        return new Tokenizer(source).run();
    }

    /**
     * Tokenize the whole source.
     *
     * @throws LexException on an unterminated string literal or block comment
     */
    public TokenStream run() {
        tokens.clear();
        position = 0;
        line = 1;
        column = 1;

        while (position < source.length()) {
            char c = source.charAt(position);

            if (isWhitespace(c)) {
                readWhitespace();
            } else if (c == '/' && peek(1) == '/') {
                readLineComment();
            } else if (c == '/' && peek(1) == '*') {
                readBlockComment();
            } else if (c == '"' || c == '\'') {
                readString(c);
            } else if (c == '#' && isHexDigit(peek(1))) {
                readColorLiteral();
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readWord();
            } else if (!readOperator()) {
                // Punctuation and anything unrecognized become single-char tokens
                emit(TokenType.PUNCTUATION, position + 1);
            }
        }

        tokens.add(Token.eof(line, column));
        return new TokenStream(tokens);
    }

    // ========== Readers ==========

    private void readWhitespace() {
        int end = position;
        while (end < source.length() && isWhitespace(source.charAt(end))) {
            end++;
        }
        emit(TokenType.WHITESPACE, end);
    }

    private void readLineComment() {
        int end = position;
        while (end < source.length() && source.charAt(end) != '\n') {
            end++;
        }
        emit(TokenType.COMMENT, end);
    }

    private void readBlockComment() {
        int close = source.indexOf("*/", position + 2);
        if (close < 0) {
            throw new LexException(line, column, "Unterminated block comment");
        }
        emit(TokenType.COMMENT, close + 2);
    }

    private void readString(char quote) {
        int end = position + 1;
        while (true) {
            if (end >= source.length() || source.charAt(end) == '\n') {
                throw new LexException(line, column, "Unterminated string literal");
            }
            char c = source.charAt(end);
            if (c == '\\' && end + 1 < source.length() && source.charAt(end + 1) != '\n') {
                end += 2;
                continue;
            }
            end++;
            if (c == quote) {
                break;
            }
        }
        emit(TokenType.STRING, end);
    }

    private void readColorLiteral() {
        int end = position + 1;
        while (end < source.length() && isHexDigit(source.charAt(end))) {
            end++;
        }
        emit(TokenType.STRING, end);
    }

    private void readNumber() {
        int end = position;
        boolean hasDecimal = false;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (Character.isDigit(c)) {
                end++;
            } else if (c == '.' && !hasDecimal && (end + 1 >= source.length()
                    || !Character.isLetter(source.charAt(end + 1)))) {
                hasDecimal = true;
                end++;
            } else {
                break;
            }
        }
        // Exponent
        if (end < source.length() && (source.charAt(end) == 'e' || source.charAt(end) == 'E')) {
            int exp = end + 1;
            if (exp < source.length() && (source.charAt(exp) == '+' || source.charAt(exp) == '-')) {
                exp++;
            }
            if (exp < source.length() && Character.isDigit(source.charAt(exp))) {
                end = exp;
                while (end < source.length() && Character.isDigit(source.charAt(end))) {
                    end++;
                }
            }
        }
        emit(TokenType.NUMBER, end);
    }

    private void readWord() {
        int end = position;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (Character.isLetterOrDigit(c) || c == '_') {
                end++;
            } else {
                break;
            }
        }
        String word = source.substring(position, end);
        boolean memberAccess = end < source.length() && source.charAt(end) == '.';
        emit(classify(word, memberAccess), end);
    }

    private TokenType classify(String word, boolean memberAccess) {
        Token previous = lastToken();
        if (previous != null && previous.is(TokenType.PUNCTUATION, ".")) {
            return TokenType.IDENTIFIER;
        }
        if (memberAccess && NAMESPACES.contains(word)) {
            return TokenType.NAMESPACE;
        }
        if (KEYWORDS.contains(word)) {
            return TokenType.KEYWORD;
        }
        if (BUILTINS.contains(word)) {
            return TokenType.BUILTIN;
        }
        return TokenType.IDENTIFIER;
    }

    private boolean readOperator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, position)) {
                emit(TokenType.OPERATOR, position + op.length());
                return true;
            }
        }
        return false;
    }

    // ========== Helpers ==========

    private void emit(TokenType type, int end) {
        String text = source.substring(position, end);
        tokens.add(new Token(type, text, line, column));
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        position = end;
    }

    private Token lastToken() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (!tokens.get(i).type().isTrivia()) {
                return tokens.get(i);
            }
        }
        return null;
    }

    private char peek(int offset) {
        int pos = position + offset;
        if (pos >= source.length()) {
            return '\0';
        }
        return source.charAt(pos);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f';
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
