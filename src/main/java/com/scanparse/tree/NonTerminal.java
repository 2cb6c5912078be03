package com.scanparse.tree;

/**
 * Grammar symbols that expand through a production.
 */
public enum NonTerminal {
    EXPR,
    EXPRDASH,
    TERM,
    TERMDASH,
    FACTOR
}
