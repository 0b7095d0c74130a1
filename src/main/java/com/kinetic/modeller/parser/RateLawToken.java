package com.kinetic.modeller.parser;

import lombok.Value;

/**
 * Represents a token from the rate-law tokenizer. Offsets index into the source text.
 */
@Value
public class RateLawToken {
    TokenType type;
    String value;
    int start;
    int end;

    public enum TokenType {
        NUMBER,
        IDENTIFIER,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        POWER,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        COMMA,
        EOF
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
