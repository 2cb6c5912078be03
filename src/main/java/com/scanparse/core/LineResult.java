package com.scanparse.core;

import com.scanparse.exception.LexicalException;
import com.scanparse.exception.ParseException;
import com.scanparse.exception.ScanParseException;

import java.util.Optional;

/**
 * Result of processing one line.
 *
 * @param lineNumber 1-based line number
 * @param line       Raw line text
 * @param status     Outcome
 * @param rendered   Rendered tree, only for {@link LineStatus#RENDERED}
 * @param error      Failure, only for the error statuses
 */
public record LineResult(
        int lineNumber,
        String line,
        LineStatus status,
        String rendered,
        ScanParseException error
) {

    public static LineResult rendered(int lineNumber, String line, String rendered) {
        return new LineResult(lineNumber, line, LineStatus.RENDERED, rendered, null);
    }

    public static LineResult skipped(int lineNumber, String line) {
        return new LineResult(lineNumber, line, LineStatus.SKIPPED_BLANK, null, null);
    }

    public static LineResult lexicalError(int lineNumber, String line, LexicalException error) {
        return new LineResult(lineNumber, line, LineStatus.LEXICAL_ERROR, null, error);
    }

    public static LineResult parseError(int lineNumber, String line, ParseException error) {
        return new LineResult(lineNumber, line, LineStatus.PARSE_ERROR, null, error);
    }

    public Optional<String> renderedText() {
        return Optional.ofNullable(rendered);
    }

    public Optional<ScanParseException> failure() {
        return Optional.ofNullable(error);
    }
}
