package com.scanparse.core;

/**
 * Outcome of processing a single input line.
 */
public enum LineStatus {
    RENDERED,
    SKIPPED_BLANK,
    LEXICAL_ERROR,
    PARSE_ERROR
}
