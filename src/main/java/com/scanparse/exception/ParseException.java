package com.scanparse.exception;

import com.scanparse.grammar.expression.Token;
import com.scanparse.grammar.expression.TokenType;
import com.scanparse.tree.NonTerminal;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Exception thrown when a token sequence does not match the expression grammar.
 * <p>
 * Either a production found a token outside its lookahead set, or a complete
 * EXPR was followed by something other than EOF ("extra token").
 */
public class ParseException extends ScanParseException {

    private final NonTerminal context;
    private final Set<TokenType> expected;
    private final Token actual;

    private ParseException(String message, NonTerminal context, Set<TokenType> expected, Token actual) {
        super(message);
        this.context = context;
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Lookahead mismatch inside a production.
     */
    public static ParseException unexpected(NonTerminal context, Set<TokenType> expected, Token actual) {
        Set<TokenType> ordered = EnumSet.copyOf(expected);
        return new ParseException("Parse error in " + context + ": expected one of " + ordered
                + ", found " + actual + " at column " + actual.position(),
                context, Collections.unmodifiableSet(ordered), actual);
    }

    /**
     * Input left over after a structurally complete EXPR.
     */
    public static ParseException extraToken(Token actual) {
        return new ParseException("Parse error: extra token " + actual + " at column " + actual.position()
                + " after a complete " + NonTerminal.EXPR,
                null, Collections.unmodifiableSet(EnumSet.of(TokenType.EOF)), actual);
    }

    /**
     * Nonterminal being expanded when the error occurred; empty for an extra token.
     */
    public Optional<NonTerminal> getContext() {
        return Optional.ofNullable(context);
    }

    public Set<TokenType> getExpected() {
        return expected;
    }

    public Token getActual() {
        return actual;
    }

    public boolean isExtraToken() {
        return context == null;
    }
}
