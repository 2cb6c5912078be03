package com.scanparse.grammar.expression;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Character classes and LL(1) lookahead sets of the expression grammar.
 * <pre>
 * EXPR      := TERM EXPRDASH
 * EXPRDASH  := '+' TERM EXPRDASH | epsilon
 * TERM      := FACTOR TERMDASH
 * TERMDASH  := '*' FACTOR TERMDASH | epsilon
 * FACTOR    := '(' EXPR ')' | IDENTIFIER | NUMBER
 * </pre>
 */
public final class GrammarConfig {

    private GrammarConfig() {
    }

    /**
     * Lookaheads on which EXPRDASH derives epsilon.
     */
    public static final Set<TokenType> EXPRDASH_FOLLOW =
            Collections.unmodifiableSet(EnumSet.of(TokenType.BCLOSE, TokenType.EOF));

    /**
     * Lookaheads on which TERMDASH derives epsilon.
     */
    public static final Set<TokenType> TERMDASH_FOLLOW =
            Collections.unmodifiableSet(EnumSet.of(TokenType.PLUS, TokenType.BCLOSE, TokenType.EOF));

    /**
     * Lookaheads that start a FACTOR.
     */
    public static final Set<TokenType> FACTOR_FIRST =
            Collections.unmodifiableSet(EnumSet.of(TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.BOPEN));

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char PLUS = '+';
        public static final char STAR = '*';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';

        private Operators() {
        }
    }

    static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '\r';
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Expected set for EXPRDASH errors: '+' or anything that ends it.
     */
    static EnumSet<TokenType> exprDashExpected() {
        EnumSet<TokenType> expected = EnumSet.of(TokenType.PLUS);
        expected.addAll(EXPRDASH_FOLLOW);
        return expected;
    }

    /**
     * Expected set for TERMDASH errors: '*' or anything that ends it.
     */
    static EnumSet<TokenType> termDashExpected() {
        EnumSet<TokenType> expected = EnumSet.of(TokenType.STAR);
        expected.addAll(TERMDASH_FOLLOW);
        return expected;
    }
}
