package com.sfgen.generator.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the Go source tokenizer.
 */
@Data
@AllArgsConstructor
public class GoToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        PACKAGE,
        IMPORT,
        TYPE,
        FUNC,
        VAR,
        CONST,
        STRUCT,
        INTERFACE,
        MAP,
        CHAN,
        IDENTIFIER,
        NUMERIC_LITERAL,
        STRING_LITERAL,
        RUNE_LITERAL,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        COMMA,
        SEMICOLON,
        DOT,
        ELLIPSIS,
        STAR,
        ASSIGN,
        ARROW,
        TILDE,
        OPERATOR,
        EOF
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Whether this token can begin a type expression.
     */
    public boolean startsType() {
        return switch (type) {
            case IDENTIFIER, STAR, LBRACKET, MAP, CHAN, FUNC, STRUCT, INTERFACE, LPAREN, ARROW -> true;
            default -> false;
        };
    }

    public boolean isOpening() {
        return type == TokenType.LPAREN || type == TokenType.LBRACKET || type == TokenType.LBRACE;
    }

    public boolean isClosing() {
        return type == TokenType.RPAREN || type == TokenType.RBRACKET || type == TokenType.RBRACE;
    }
}
