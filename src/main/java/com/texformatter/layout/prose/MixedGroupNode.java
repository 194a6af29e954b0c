package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A group whose delimiters need not match, such as a half-open interval {@code [0, 1)}.
 * The closing delimiter is empty when the source left the group open.
 */
public final class MixedGroupNode implements TexNode {
    private final String open;
    private final ParentNode body;
    private final String close;

    public MixedGroupNode(String open, ParentNode body, String close) {
        this.open = open;
        this.body = body;
        this.close = close;
    }

    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    public ParentNode getBody() {
        return body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MIXED_GROUP;
    }

    @Override
    public List<String> format(Budget budget) {
        return GroupLayout.hanging(open, close, body, budget);
    }
}
