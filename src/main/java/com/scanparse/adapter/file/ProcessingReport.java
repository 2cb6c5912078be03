package com.scanparse.adapter.file;

import java.nio.file.Path;

/**
 * Summary of one run over an input.
 *
 * @param input           Input file, null when lines were supplied directly
 * @param output          Output file, null when lines were supplied directly
 * @param totalLines      Lines read
 * @param renderedLines   Lines that produced a tree
 * @param skippedLines    Blank lines
 * @param lexicalFailures Lines rejected by the scanner
 * @param parseFailures   Lines rejected by the parser
 * @param accumulated     Concatenated rendered trees, in line order
 * @param outputWritten   Whether the accumulated text reached the output file
 */
public record ProcessingReport(
        Path input,
        Path output,
        int totalLines,
        int renderedLines,
        int skippedLines,
        int lexicalFailures,
        int parseFailures,
        String accumulated,
        boolean outputWritten
) {

    public int failedLines() {
        return lexicalFailures + parseFailures;
    }

    ProcessingReport withFiles(Path input, Path output, boolean outputWritten) {
        return new ProcessingReport(input, output, totalLines, renderedLines, skippedLines,
                lexicalFailures, parseFailures, accumulated, outputWritten);
    }
}
