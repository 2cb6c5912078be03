package com.scanparse.grammar.expression;

import com.scanparse.exception.ParseException;
import com.scanparse.tree.EpsilonNode;
import com.scanparse.tree.NonTerminal;
import com.scanparse.tree.NonTerminalNode;
import com.scanparse.tree.ParseNode;
import com.scanparse.tree.TerminalNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static com.scanparse.grammar.expression.GrammarConfig.*;

/**
 * Recursive descent parser for expression lines, one token of lookahead.
 * Builds the concrete parse tree while recognizing the grammar documented on {@link GrammarConfig}.
 * <p>
 * Right recursion through EXPRDASH and TERMDASH keeps '*' nested below '+':
 * a TERMDASH only ever appears under a TERM.
 */
public final class ExpressionParser {

    private final List<Token> tokens;
    private int index;

    /**
     * @param tokens Scanned tokens; must end with EOF
     */
    public ExpressionParser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token sequence must end with " + TokenType.EOF);
        }
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token sequence into an EXPR tree.
     *
     * @return Root EXPR node
     * @throws ParseException on a lookahead mismatch or trailing input
     */
    public NonTerminalNode parse() {
        NonTerminalNode root = parseExpr();
        if (!check(TokenType.EOF)) {
            throw ParseException.extraToken(peek());
        }
        return root;
    }

    private NonTerminalNode parseExpr() {
        ParseNode term = parseTerm();
        ParseNode exprDash = parseExprDash();
        return NonTerminalNode.of(NonTerminal.EXPR, term, exprDash);
    }

    private NonTerminalNode parseExprDash() {
        if (check(TokenType.PLUS)) {
            ParseNode plus = terminal();
            ParseNode term = parseTerm();
            ParseNode rest = parseExprDash();
            return NonTerminalNode.of(NonTerminal.EXPRDASH, plus, term, rest);
        }
        if (EXPRDASH_FOLLOW.contains(peek().type())) {
            return NonTerminalNode.of(NonTerminal.EXPRDASH, new EpsilonNode());
        }
        throw ParseException.unexpected(NonTerminal.EXPRDASH, exprDashExpected(), peek());
    }

    private NonTerminalNode parseTerm() {
        ParseNode factor = parseFactor();
        ParseNode termDash = parseTermDash();
        return NonTerminalNode.of(NonTerminal.TERM, factor, termDash);
    }

    private NonTerminalNode parseTermDash() {
        if (check(TokenType.STAR)) {
            ParseNode star = terminal();
            ParseNode factor = parseFactor();
            ParseNode rest = parseTermDash();
            return NonTerminalNode.of(NonTerminal.TERMDASH, star, factor, rest);
        }
        if (TERMDASH_FOLLOW.contains(peek().type())) {
            return NonTerminalNode.of(NonTerminal.TERMDASH, new EpsilonNode());
        }
        throw ParseException.unexpected(NonTerminal.TERMDASH, termDashExpected(), peek());
    }

    private NonTerminalNode parseFactor() {
        // Parenthesized expression
        if (check(TokenType.BOPEN)) {
            List<ParseNode> children = new ArrayList<>(3);
            children.add(terminal());
            children.add(parseExpr());
            if (!check(TokenType.BCLOSE)) {
                throw ParseException.unexpected(NonTerminal.FACTOR,
                        EnumSet.of(TokenType.BCLOSE), peek());
            }
            children.add(terminal());
            return new NonTerminalNode(NonTerminal.FACTOR, children);
        }

        if (check(TokenType.IDENTIFIER) || check(TokenType.NUMBER)) {
            return NonTerminalNode.of(NonTerminal.FACTOR, terminal());
        }

        throw ParseException.unexpected(NonTerminal.FACTOR, FACTOR_FIRST, peek());
    }

    private TerminalNode terminal() {
        return new TerminalNode(advance());
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    // Never moves past EOF: every caller checks the lookahead first
    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }
}
