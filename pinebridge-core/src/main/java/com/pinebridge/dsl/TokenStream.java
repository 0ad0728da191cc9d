package com.pinebridge.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Immutable, restartable sequence of tokens. The trailing EOF token is always kept.
 */
public final class TokenStream implements Iterable<Token> {

    private final List<Token> tokens;

    public TokenStream(List<Token> tokens) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    /**
     * Stream without whitespace and comments.
     */
    public TokenStream clean() {
        return withTrivia(false, false);
    }

    public TokenStream withTrivia(boolean includeWhitespace, boolean includeComments) {
        return filter(t -> (includeWhitespace || t.type() != TokenType.WHITESPACE)
            && (includeComments || t.type() != TokenType.COMMENT));
    }

    public TokenStream ofType(TokenType type) {
        return filter(t -> t.type() == type || t.type() == TokenType.EOF);
    }

    private TokenStream filter(Predicate<Token> keep) {
        List<Token> kept = new ArrayList<>();
        for (Token t : tokens) {
            if (keep.test(t)) {
                kept.add(t);
            }
        }
        return new TokenStream(kept);
    }

    /**
     * Concatenate every token's text. For a full stream this is the original source.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.text());
        }
        return sb.toString();
    }

    public List<Token> tokens() {
        return tokens;
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenStream other && tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "TokenStream[" + tokens.size() + " tokens]";
    }
}
