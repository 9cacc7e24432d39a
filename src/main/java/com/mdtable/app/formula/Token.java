package com.mdtable.app.formula;

import com.mdtable.app.models.Span;

/**
 * Smallest unit of a formula expression together with where it came from.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final Span span;

    public Token(TokenType type, String text, Span span) {
        this.type = type;
        this.text = text;
        this.span = span;
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Token text as written. For STRING tokens the quotes are not included.
     */
    public String getText() {
        return text;
    }

    public Span getSpan() {
        return span;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type == TokenType.STRING ? "\"" + text + "\"" : text;
    }
}
