package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * Paragraph break.
 */
public final class BlankLineNode implements TexNode {
    public static final BlankLineNode INSTANCE = new BlankLineNode();

    private BlankLineNode() {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLANK_LINE;
    }

    @Override
    public List<String> format(Budget budget) {
        return List.of("");
    }
}
