package com.scanparse.core;

/**
 * Turns one input line into a rendered parse tree or a line-scoped failure.
 * Implementations never let a scan or parse failure escape; it is reported in the result.
 */
public interface LineProcessor {

    /**
     * Process a line.
     *
     * @param lineNumber 1-based line number used for attribution
     * @param line       Raw line text
     * @return Result of the line
     */
    LineResult process(int lineNumber, String line);
}
