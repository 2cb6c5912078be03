package com.scanparse.tree;

import java.util.List;

/**
 * Leaf for an empty derivation, where EXPRDASH or TERMDASH stops recursing.
 */
public record EpsilonNode() implements ParseNode {

    public static final String LABEL = "EPSILON";

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<ParseNode> children() {
        return List.of();
    }
}
