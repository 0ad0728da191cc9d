package com.pinebridge.dsl.program;

import com.pinebridge.dsl.Token;
import com.pinebridge.dsl.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Helpers for slicing statement token lists: bracket matching, argument splitting
 * and normalized text rendering.
 */
final class TokenSlices {

    private static final Set<String> OPENERS = Set.of("(", "[", "{");
    private static final Set<String> CLOSERS = Set.of(")", "]", "}");

    /** Argument of a call, {@code name} is null for positional arguments. */
    record Arg(String name, List<Token> value) {
        String text() {
            return join(value);
        }
    }

    private TokenSlices() {}

    static boolean opens(Token t) {
        return t.is(TokenType.PUNCTUATION) && OPENERS.contains(t.text());
    }

    static boolean closes(Token t) {
        return t.is(TokenType.PUNCTUATION) && CLOSERS.contains(t.text());
    }

    /**
     * Index of the bracket closing the one at {@code open}, or -1 when unbalanced.
     */
    static int matching(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (opens(t)) {
                depth++;
            } else if (closes(t)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Index of the first depth-0 operator among {@code operators}, or -1.
     */
    static int findTopLevel(List<Token> tokens, Set<String> operators) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (opens(t)) {
                depth++;
            } else if (closes(t)) {
                depth--;
            } else if (depth == 0 && t.is(TokenType.OPERATOR) && operators.contains(t.text())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Split the arguments of the call whose opening parenthesis is at {@code open}.
     */
    static List<Arg> arguments(List<Token> tokens, int open) {
        List<Arg> args = new ArrayList<>();
        int close = matching(tokens, open);
        if (close < 0) {
            close = tokens.size();
        }
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (int i = open + 1; i < close; i++) {
            Token t = tokens.get(i);
            if (opens(t)) {
                depth++;
            } else if (closes(t)) {
                depth--;
            }
            if (depth == 0 && t.is(TokenType.PUNCTUATION, ",")) {
                addArg(args, current);
                current = new ArrayList<>();
            } else {
                current.add(t);
            }
        }
        addArg(args, current);
        return args;
    }

    private static void addArg(List<Arg> args, List<Token> tokens) {
        if (tokens.isEmpty()) {
            return;
        }
        if (tokens.size() >= 3 && tokens.get(0).isWord() && tokens.get(1).is(TokenType.OPERATOR, "=")) {
            args.add(new Arg(tokens.get(0).text(), List.copyOf(tokens.subList(2, tokens.size()))));
        } else {
            args.add(new Arg(null, List.copyOf(tokens)));
        }
    }

    /**
     * Render tokens as normalized single-line text. Equal token lists always render
     * the same way, whatever whitespace the source used.
     */
    static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        boolean unary = false;
        for (Token t : tokens) {
            if (t.type().isTrivia() || t.type() == TokenType.EOF) {
                continue;
            }
            if (prev != null && !unary && needsSpace(prev, t)) {
                sb.append(' ');
            }
            sb.append(t.text());
            // Sign directly after an operator, opener, comma or at the start binds to its operand
            unary = (t.isSymbol("-") || t.isSymbol("+"))
                && (prev == null || prev.is(TokenType.OPERATOR) || opens(prev) || prev.isSymbol(","));
            prev = t;
        }
        return sb.toString();
    }

    private static boolean needsSpace(Token prev, Token next) {
        if (prev.isSymbol(".") || next.isSymbol(".")) {
            return false;
        }
        if (prev.isSymbol("(") || prev.isSymbol("[") || next.isSymbol(")") || next.isSymbol("]")
                || next.isSymbol(",")) {
            return false;
        }
        return !((next.isSymbol("(") || next.isSymbol("[")) && (prev.isWord() || closes(prev)));
    }
}
