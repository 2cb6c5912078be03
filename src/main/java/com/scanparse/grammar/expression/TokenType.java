package com.scanparse.grammar.expression;

/**
 * Token types for expression scanning.
 */
public enum TokenType {
    // Lexeme-carrying
    IDENTIFIER(true),
    NUMBER(true),

    // Operators
    PLUS(false),
    STAR(false),

    // Delimiters
    BOPEN(false),
    BCLOSE(false),

    // Special
    EOF(false);

    private final boolean carriesLexeme;

    TokenType(boolean carriesLexeme) {
        this.carriesLexeme = carriesLexeme;
    }

    /**
     * Whether the token's label embeds its lexeme, e.g. {@code IDENTIFIER(x)}.
     */
    public boolean carriesLexeme() {
        return carriesLexeme;
    }
}
