package com.scanparse.tree;

import java.util.List;
import java.util.Objects;

/**
 * Interior node: a nonterminal and the children its production derived.
 *
 * @param symbol   Grammar symbol
 * @param children Derived children, never empty
 */
public record NonTerminalNode(NonTerminal symbol, List<ParseNode> children) implements ParseNode {

    public NonTerminalNode {
        Objects.requireNonNull(symbol, "symbol");
        children = List.copyOf(children);
        if (children.isEmpty()) {
            throw new IllegalArgumentException(symbol + " must derive at least one child");
        }
    }

    public static NonTerminalNode of(NonTerminal symbol, ParseNode... children) {
        return new NonTerminalNode(symbol, List.of(children));
    }

    /**
     * Child at the given index.
     */
    public ParseNode child(int index) {
        return children.get(index);
    }

    @Override
    public String label() {
        return symbol.name();
    }
}
