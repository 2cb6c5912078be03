package com.scanparse.grammar.expression;

import java.util.Objects;

/**
 * Represents a token in an expression line.
 *
 * @param type     Token type
 * @param text     Matched lexeme (digits stay text, never converted)
 * @param position Column in the line, 0-based
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    /**
     * Tag used in rendered parse trees: {@code IDENTIFIER(abc)}, {@code NUMBER(42)} or a bare {@code PLUS}.
     */
    public String label() {
        if (type.carriesLexeme()) {
            return type + "(" + text + ")";
        }
        return type.name();
    }

    @Override
    public String toString() {
        return label();
    }
}
