package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A run of plain words with whitespace collapsed to single spaces.
 */
public final class TextNode implements TexNode {
    private final String text;

    public TextNode(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }

    @Override
    public List<String> format(Budget budget) {
        return List.of(text);
    }
}
