package com.scanparse.grammar;

import com.scanparse.grammar.expression.ExpressionParser;
import com.scanparse.grammar.expression.ExpressionScanner;
import com.scanparse.grammar.expression.Token;
import com.scanparse.tree.NonTerminalNode;

import java.util.List;

/**
 * Facade for turning one expression line into its concrete parse tree.
 * <p>
 * Grammar (precedence: '*' over '+', both left-to-right by right recursion):
 * <pre>
 * EXPR     := TERM EXPRDASH
 * EXPRDASH := '+' TERM EXPRDASH | epsilon
 * TERM     := FACTOR TERMDASH
 * TERMDASH := '*' FACTOR TERMDASH | epsilon
 * FACTOR   := '(' EXPR ')' | IDENTIFIER | NUMBER
 * </pre>
 */
public final class ExpressionTreeParser {

    private ExpressionTreeParser() {
    }

    /**
     * Scan and parse a line.
     *
     * @param line Expression text
     * @return Root EXPR node
     * @throws com.scanparse.exception.LexicalException if the line cannot be scanned
     * @throws com.scanparse.exception.ParseException   if the tokens do not match the grammar
     */
    public static NonTerminalNode parse(String line) {
        // Tokenize
        List<Token> tokens = new ExpressionScanner(line).scanAll();

        // Parse
        return new ExpressionParser(tokens).parse();
    }
}
