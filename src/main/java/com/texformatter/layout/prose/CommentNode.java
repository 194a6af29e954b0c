package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A {@code %} comment. An attached comment was written directly after content, without a space.
 */
public final class CommentNode implements TexNode {
    private final String text;
    private final boolean attached;

    public CommentNode(String text, boolean attached) {
        this.text = text;
        this.attached = attached;
    }

    public String getText() {
        return text;
    }

    public boolean isAttached() {
        return attached;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMMENT;
    }

    @Override
    public List<String> format(Budget budget) {
        return List.of(text);
    }
}
