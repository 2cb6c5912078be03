package com.scanparse.grammar.expression;

import com.scanparse.exception.LexicalException;

import java.util.ArrayList;
import java.util.List;

import static com.scanparse.grammar.expression.GrammarConfig.*;

/**
 * Scanner for expression lines.
 * Converts one line into a fully materialized token list terminated by EOF.
 */
public final class ExpressionScanner {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionScanner(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Scan the whole line.
     *
     * @return Tokens, the last one always EOF
     * @throws LexicalException on a character no token can start with
     */
    public List<Token> scanAll() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = scanToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token scanToken() {
        skipWhitespace();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", pos);
        }

        int start = pos;
        char c = advance();

        return switch (c) {
            case Operators.PLUS -> new Token(TokenType.PLUS, "+", start);
            case Operators.STAR -> new Token(TokenType.STAR, "*", start);
            case Operators.LEFT_PAREN -> new Token(TokenType.BOPEN, "(", start);
            case Operators.RIGHT_PAREN -> new Token(TokenType.BCLOSE, ")", start);
            default -> {
                if (isAsciiDigit(c)) {
                    yield readNumber(start);
                }
                if (isAsciiLetter(c)) {
                    yield readIdentifier(start);
                }
                throw new LexicalException(c, start);
            }
        };
    }

    private Token readNumber(int start) {
        while (!isAtEnd() && isAsciiDigit(peek())) {
            advance();
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    // Letters only: "abc123" is IDENTIFIER(abc) NUMBER(123)
    private Token readIdentifier(int start) {
        while (!isAtEnd() && isAsciiLetter(peek())) {
            advance();
        }
        return new Token(TokenType.IDENTIFIER, input.substring(start, pos), start);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isAsciiWhitespace(peek())) {
            advance();
        }
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
