package com.scanparse.tree;

import com.scanparse.grammar.ExpressionTreeParser;
import com.scanparse.grammar.expression.Token;
import com.scanparse.grammar.expression.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LevelOrderTreeRenderer.
 */
class LevelOrderTreeRendererTest {

    private TreeRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new LevelOrderTreeRenderer();
    }

    @Test
    @DisplayName("Single identifier renders one line per level")
    void rendersSingleIdentifier() {
        String rendered = renderer.render(ExpressionTreeParser.parse("x"));

        assertEquals("""
                EXPR
                TERM EXPRDASH
                FACTOR TERMDASH EPSILON
                IDENTIFIER(x) EPSILON
                """, rendered);
    }

    @Test
    @DisplayName("Sum with product groups nodes by depth, left to right")
    void rendersSumWithProduct() {
        String rendered = renderer.render(ExpressionTreeParser.parse("a+b*c"));

        assertEquals("""
                EXPR
                TERM EXPRDASH
                FACTOR TERMDASH PLUS TERM EXPRDASH
                IDENTIFIER(a) EPSILON FACTOR TERMDASH EPSILON
                IDENTIFIER(b) STAR FACTOR TERMDASH
                IDENTIFIER(c) EPSILON
                """, rendered);
    }

    @Test
    @DisplayName("Parentheses render as BOPEN and BCLOSE around a nested EXPR")
    void rendersParentheses() {
        String rendered = renderer.render(ExpressionTreeParser.parse("(x)"));

        assertEquals("""
                EXPR
                TERM EXPRDASH
                FACTOR TERMDASH EPSILON
                BOPEN EXPR BCLOSE EPSILON
                TERM EXPRDASH
                FACTOR TERMDASH EPSILON
                IDENTIFIER(x) EPSILON
                """, rendered);
    }

    @Test
    @DisplayName("Numbers embed their lexeme")
    void rendersNumbers() {
        String rendered = renderer.render(ExpressionTreeParser.parse("1*02"));

        assertEquals("""
                EXPR
                TERM EXPRDASH
                FACTOR TERMDASH EPSILON
                NUMBER(1) STAR FACTOR TERMDASH
                NUMBER(02) EPSILON
                """, rendered);
    }

    @Test
    @DisplayName("Re-rendering the same tree yields identical output")
    void renderingIsRepeatable() {
        ParseNode root = ExpressionTreeParser.parse("(a+b)*c+1");

        String first = renderer.render(root);
        String second = renderer.render(root);

        assertEquals(first, second);
        assertTrue(first.startsWith("EXPR\n"));
        assertTrue(first.endsWith("\n"));
        assertFalse(first.contains("\n\n"));
        assertFalse(first.contains(" \n"));
    }

    @Test
    @DisplayName("Null root renders as empty text")
    void rendersNullAsEmpty() {
        assertEquals("", renderer.render(null));
    }

    @Test
    @DisplayName("Lone leaf renders as a single line")
    void rendersLeaf() {
        assertEquals("EPSILON\n", renderer.render(new EpsilonNode()));
        assertEquals("EOF\n", renderer.render(new TerminalNode(new Token(TokenType.EOF, "", 0))));
    }

    @Test
    @DisplayName("Nonterminal must have children")
    void nonTerminalRequiresChildren() {
        assertThrows(IllegalArgumentException.class,
                () -> new NonTerminalNode(NonTerminal.EXPR, List.of()));
    }
}
