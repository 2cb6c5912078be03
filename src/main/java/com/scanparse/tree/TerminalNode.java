package com.scanparse.tree;

import com.scanparse.grammar.expression.Token;

import java.util.List;
import java.util.Objects;

/**
 * Leaf matched directly from input.
 */
public record TerminalNode(Token token) implements ParseNode {

    public TerminalNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public String label() {
        return token.label();
    }

    @Override
    public List<ParseNode> children() {
        return List.of();
    }
}
