package com.pinebridge.dsl.expr;

import com.pinebridge.dsl.Token;
import com.pinebridge.dsl.TokenType;
import com.pinebridge.dsl.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for script expressions.
 *
 * Grammar (lowest precedence first):
 *   ternary        → or ('?' ternary ':' ternary)?
 *   or             → and ('or' and)*
 *   and            → equality ('and' equality)*
 *   equality       → comparison (('==' | '!=') comparison)*
 *   comparison     → additive (('<' | '>' | '<=' | '>=') additive)*
 *   additive       → multiplicative (('+' | '-') multiplicative)*
 *   multiplicative → unary (('*' | '/' | '%') unary)*
 *   unary          → ('not' | '-' | '+') unary | postfix
 *   postfix        → primary ('(' args ')' | '[' ternary ']' | '.' IDENT)*
 *   primary        → NUMBER | STRING | true | false | na | NAMESPACE '.' IDENT
 *                  | IDENT | '(' ternary ')' | '[' list ']'
 *
 * Input is bounded: more than {@link #MAX_DEPTH} nested levels or more than
 * {@link #MAX_OPERATIONS} operator nodes is rejected with an
 * {@link ExpressionParseException}, so the recursion always ends well before
 * the stack does.
 */
public class ExpressionParser {

    /** Parenthesis, argument, index and prefix-operator nesting. */
    public static final int MAX_DEPTH = 256;
    /** Operator, call, index and member nodes in one expression. */
    public static final int MAX_OPERATIONS = 1000;

    private static final Set<String> TYPE_CASTS = Set.of("int", "float", "bool", "string", "color");

    private final List<Token> tokens;
    private int pos = 0;
    private int depth = 0;
    private int operations = 0;

    public ExpressionParser(List<Token> tokens) {
        List<Token> clean = new ArrayList<>();
        for (Token t : tokens) {
            if (!t.type().isTrivia() && t.type() != TokenType.EOF) {
                clean.add(t);
            }
        }
        if (clean.isEmpty()) {
            clean.add(Token.eof(1, 1));
        } else {
            Token last = clean.get(clean.size() - 1);
            clean.add(Token.eof(last.line(), last.column() + last.text().length()));
        }
        this.tokens = clean;
    }

    /**
     * Convenience function to parse expression text.
     */
    public static ExprNode parse(String expression) {
        return new ExpressionParser(Tokenizer.tokenize(expression).tokens()).parse();
    }

    /**
     * Parse the whole token list as a single expression.
     */
    public ExprNode parse() {
        if (isAtEnd()) {
            throw error("Empty expression");
        }
        ExprNode expr = ternary();
        if (!isAtEnd()) {
            throw error("Unexpected token '" + current().text() + "'");
        }
        return expr;
    }

    // ========== Precedence levels ==========

    private ExprNode ternary() {
        enter();
        try {
            ExprNode condition = or();
            if (matchSymbol("?")) {
                ExprNode whenTrue = ternary();
                expectSymbol(":");
                ExprNode whenFalse = ternary();
                return operation(new ExprNode.Ternary(condition, whenTrue, whenFalse));
            }
            return condition;
        } finally {
            depth--;
        }
    }

    private ExprNode or() {
        ExprNode left = and();
        while (matchKeyword("or")) {
            left = operation(new ExprNode.Binary("or", left, and()));
        }
        return left;
    }

    private ExprNode and() {
        ExprNode left = equality();
        while (matchKeyword("and")) {
            left = operation(new ExprNode.Binary("and", left, equality()));
        }
        return left;
    }

    private ExprNode equality() {
        ExprNode left = comparison();
        while (checkSymbol("==") || checkSymbol("!=")) {
            String op = advance().text();
            left = operation(new ExprNode.Binary(op, left, comparison()));
        }
        return left;
    }

    private ExprNode comparison() {
        ExprNode left = additive();
        while (checkSymbol("<") || checkSymbol(">") || checkSymbol("<=") || checkSymbol(">=")) {
            String op = advance().text();
            left = operation(new ExprNode.Binary(op, left, additive()));
        }
        return left;
    }

    private ExprNode additive() {
        ExprNode left = multiplicative();
        while (checkSymbol("+") || checkSymbol("-")) {
            String op = advance().text();
            left = operation(new ExprNode.Binary(op, left, multiplicative()));
        }
        return left;
    }

    private ExprNode multiplicative() {
        ExprNode left = unary();
        while (checkSymbol("*") || checkSymbol("/") || checkSymbol("%")) {
            String op = advance().text();
            left = operation(new ExprNode.Binary(op, left, unary()));
        }
        return left;
    }

    private ExprNode unary() {
        if (matchKeyword("not")) {
            return prefixed("not");
        }
        if (checkSymbol("-") || checkSymbol("+")) {
            return prefixed(advance().text());
        }
        return postfix();
    }

    private ExprNode prefixed(String op) {
        enter();
        try {
            return operation(new ExprNode.Unary(op, unary()));
        } finally {
            depth--;
        }
    }

    private ExprNode postfix() {
        ExprNode expr = primary();
        while (true) {
            if (matchSymbol("(")) {
                expr = operation(new ExprNode.Call(expr, arguments()));
            } else if (matchSymbol("[")) {
                ExprNode offset = ternary();
                expectSymbol("]");
                expr = operation(new ExprNode.Index(expr, offset));
            } else if (matchSymbol(".")) {
                expr = operation(new ExprNode.Member(expr, expectWord().text()));
            } else {
                return expr;
            }
        }
    }

    private List<ExprNode.Argument> arguments() {
        List<ExprNode.Argument> args = new ArrayList<>();
        if (matchSymbol(")")) {
            return args;
        }
        do {
            if (current().isWord() && peek(1).is(TokenType.OPERATOR, "=")) {
                String name = advance().text();
                advance();
                args.add(new ExprNode.Argument(name, ternary()));
            } else {
                args.add(new ExprNode.Argument(null, ternary()));
            }
        } while (matchSymbol(","));
        expectSymbol(")");
        return args;
    }

    private ExprNode primary() {
        Token token = current();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new ExprNode.NumberLiteral(token.text());
            }
            case STRING -> {
                advance();
                return new ExprNode.StringLiteral(token.text());
            }
            case NAMESPACE -> {
                advance();
                expectSymbol(".");
                return new ExprNode.Qualified(token.text(), expectWord().text());
            }
            case IDENTIFIER, BUILTIN -> {
                advance();
                return new ExprNode.Identifier(token.text());
            }
            case KEYWORD -> {
                return keywordPrimary(token);
            }
            case PUNCTUATION -> {
                if (matchSymbol("(")) {
                    ExprNode inner = ternary();
                    expectSymbol(")");
                    return inner;
                }
                if (matchSymbol("[")) {
                    List<ExprNode> elements = new ArrayList<>();
                    if (!checkSymbol("]")) {
                        do {
                            elements.add(ternary());
                        } while (matchSymbol(","));
                    }
                    expectSymbol("]");
                    return new ExprNode.ArrayLiteral(elements);
                }
                throw error("Unexpected '" + token.text() + "'");
            }
            case EOF -> throw error("Unexpected end of expression");
            default -> throw error("Unexpected token '" + token.text() + "'");
        }
    }

    private ExprNode keywordPrimary(Token token) {
        String text = token.text();
        if (text.equals("true") || text.equals("false")) {
            advance();
            return new ExprNode.BoolLiteral(text.equals("true"));
        }
        if (text.equals("na")) {
            advance();
            return new ExprNode.NaLiteral();
        }
        if (TYPE_CASTS.contains(text)) {
            advance();
            return new ExprNode.Identifier(text);
        }
        throw error("Keyword '" + text + "' cannot start an expression");
    }

    // ========== Helper methods ==========

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("Expression nested too deeply (max " + MAX_DEPTH + ")");
        }
    }

    private ExprNode operation(ExprNode node) {
        if (++operations > MAX_OPERATIONS) {
            throw error("Expression has too many operations (max " + MAX_OPERATIONS + ")");
        }
        return node;
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = current();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private boolean isAtEnd() {
        return current().type() == TokenType.EOF;
    }

    private boolean checkSymbol(String symbol) {
        return current().isSymbol(symbol);
    }

    private boolean matchSymbol(String symbol) {
        if (checkSymbol(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (current().is(TokenType.KEYWORD, keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectSymbol(String symbol) {
        if (!matchSymbol(symbol)) {
            throw error("Expected '" + symbol + "' but found '" + current().text() + "'");
        }
    }

    private Token expectWord() {
        if (!current().isWord()) {
            throw error("Expected a name but found '" + current().text() + "'");
        }
        return advance();
    }

    private ExpressionParseException error(String message) {
        return new ExpressionParseException(message, current().column());
    }
}
