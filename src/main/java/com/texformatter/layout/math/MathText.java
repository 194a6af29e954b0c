package com.texformatter.layout.math;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * Symbols, operators and numbers between commands, or a comment when {@code comment} is set.
 */
public final class MathText implements MathNode {
    private final String text;
    private final boolean comment;

    public MathText(String text) {
        this(text, false);
    }

    public MathText(String text, boolean comment) {
        this.text = text;
        this.comment = comment;
    }

    public String getText() {
        return text;
    }

    public boolean isComment() {
        return comment;
    }

    @Override
    public MathKind kind() {
        return MathKind.TEXT;
    }

    @Override
    public List<String> format(Budget budget) {
        return List.of(text);
    }
}
