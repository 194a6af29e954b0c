package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * An optional argument in brackets.
 */
public final class BracketGroupNode implements TexNode {
    private final ParentNode body;

    public BracketGroupNode(ParentNode body) {
        this.body = body;
    }

    public ParentNode getBody() {
        return body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BRACKET_GROUP;
    }

    @Override
    public List<String> format(Budget budget) {
        return GroupLayout.delimited("[", "]", body, budget);
    }
}
