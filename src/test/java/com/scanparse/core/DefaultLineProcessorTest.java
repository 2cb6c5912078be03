package com.scanparse.core;

import com.scanparse.exception.LexicalException;
import com.scanparse.exception.ParseException;
import com.scanparse.tree.LevelOrderTreeRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultLineProcessor.
 */
class DefaultLineProcessorTest {

    private LineProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new DefaultLineProcessor(new LevelOrderTreeRenderer());
    }

    @Test
    @DisplayName("Valid line is rendered")
    void rendersValidLine() {
        LineResult result = processor.process(3, "x");

        assertEquals(LineStatus.RENDERED, result.status());
        assertEquals(3, result.lineNumber());
        assertEquals("x", result.line());
        assertEquals("EXPR\nTERM EXPRDASH\nFACTOR TERMDASH EPSILON\nIDENTIFIER(x) EPSILON\n",
                result.renderedText().orElseThrow());
        assertTrue(result.failure().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Blank lines are skipped without an error")
    @ValueSource(strings = {"", " ", "\t", "  \t  ", "\u00A0", "\u0085", "\u000B", "\u2003 \u3000"})
    void skipsBlankLines(String line) {
        LineResult result = processor.process(1, line);

        assertEquals(LineStatus.SKIPPED_BLANK, result.status());
        assertTrue(result.renderedText().isEmpty());
        assertTrue(result.failure().isEmpty());
    }

    @Test
    @DisplayName("Control separators are not blank and fail to scan")
    void fileSeparatorIsNotBlank() {
        LineResult result = processor.process(4, "\u001C");

        assertEquals(LineStatus.LEXICAL_ERROR, result.status());
        LexicalException error = assertInstanceOf(LexicalException.class, result.failure().orElseThrow());
        assertEquals('\u001C', error.getCharacter());
    }

    @Test
    @DisplayName("Unknown character yields a lexical error")
    void reportsLexicalError() {
        LineResult result = processor.process(7, "a#b");

        assertEquals(LineStatus.LEXICAL_ERROR, result.status());
        assertEquals(7, result.lineNumber());
        LexicalException error = assertInstanceOf(LexicalException.class, result.failure().orElseThrow());
        assertEquals('#', error.getCharacter());
        assertTrue(result.renderedText().isEmpty());
    }

    @Test
    @DisplayName("Grammar mismatch yields a parse error and no tree")
    void reportsParseError() {
        LineResult result = processor.process(2, "a+");

        assertEquals(LineStatus.PARSE_ERROR, result.status());
        assertInstanceOf(ParseException.class, result.failure().orElseThrow());
        assertTrue(result.renderedText().isEmpty());
    }

    @Test
    @DisplayName("A failing line does not affect the next one")
    void linesAreIndependent() {
        processor.process(1, "(a+");
        LineResult result = processor.process(2, "a");

        assertEquals(LineStatus.RENDERED, result.status());
    }
}
