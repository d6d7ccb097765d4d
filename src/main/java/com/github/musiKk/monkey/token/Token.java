package com.github.musiKk.monkey.token;

import java.util.Objects;

public record Token(TokenType type, String literal) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(literal, "literal");
    }

    /**
     * Creates a token for a type with fixed source text, e.g. {@code Token.of(TokenType.LET)}.
     */
    public static Token of(TokenType type) {
        if (!type.hasFixedLiteral()) {
            throw new IllegalArgumentException(type + " has no fixed literal");
        }
        return new Token(type, type.literal());
    }

    public static Token ident(String name) {
        return new Token(TokenType.IDENT, name);
    }

    public static Token integer(long value) {
        return new Token(TokenType.INT, Long.toString(value));
    }

    public static Token string(String value) {
        return new Token(TokenType.STRING, value);
    }
}
