package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A brace group, either as a command argument or standing alone.
 */
public final class CurlyGroupNode implements TexNode {
    private final ParentNode body;

    public CurlyGroupNode(ParentNode body) {
        this.body = body;
    }

    public ParentNode getBody() {
        return body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CURLY_GROUP;
    }

    @Override
    public List<String> format(Budget budget) {
        return GroupLayout.delimited("{", "}", body, budget);
    }
}
