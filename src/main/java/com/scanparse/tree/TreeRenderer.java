package com.scanparse.tree;

/**
 * Serializes a parse tree to text.
 */
public interface TreeRenderer {

    /**
     * Render a tree.
     *
     * @param root Root node, may be null
     * @return Rendered text; empty for a null root
     */
    String render(ParseNode root);
}
