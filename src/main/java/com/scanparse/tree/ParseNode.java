package com.scanparse.tree;

import java.util.List;

/**
 * Node of a concrete parse tree.
 * <p>
 * Trees are built once by the parser, read by a {@link TreeRenderer}, then discarded.
 * Every node is owned by exactly one parent.
 */
public sealed interface ParseNode permits NonTerminalNode, TerminalNode, EpsilonNode {

    /**
     * Text shown for this node in a rendered tree.
     */
    String label();

    /**
     * Ordered children, left-to-right derivation order. Empty for leaves.
     */
    List<ParseNode> children();
}
