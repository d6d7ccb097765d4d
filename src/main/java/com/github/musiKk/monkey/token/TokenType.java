package com.github.musiKk.monkey.token;

import java.util.HashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

@AllArgsConstructor
public enum TokenType {
    ILLEGAL,
    EOF,

    IDENT,
    INT,
    STRING,

    ASSIGN("="),
    PLUS("+"), MINUS("-"),
    BANG("!"),
    ASTERISK("*"), SLASH("/"),
    LT("<"), GT(">"),
    EQ("=="), NOT_EQ("!="),

    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),

    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),

    FUNCTION("fn", true),
    LET("let", true),
    TRUE("true", true),
    FALSE("false", true),
    IF("if", true),
    ELSE("else", true),
    RETURN("return", true);

    /**
     * Fixed source text of this token type, or {@code null} for types whose text varies
     * (identifiers, literals).
     */
    @Accessors(fluent = true)
    @Getter
    private final String literal;
    @Accessors(fluent = true)
    @Getter
    private final boolean keyword;

    private TokenType() {
        this(null, false);
    }
    private TokenType(String literal) {
        this(literal, false);
    }

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (var tokenType : values()) {
            if (tokenType.keyword) {
                KEYWORDS.put(tokenType.literal, tokenType);
            }
        }
    }

    public static TokenType lookupIdent(String ident) {
        return KEYWORDS.getOrDefault(ident, IDENT);
    }

    public boolean hasFixedLiteral() {
        return literal != null;
    }
}
