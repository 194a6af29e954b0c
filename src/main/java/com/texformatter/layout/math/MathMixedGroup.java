package com.texformatter.layout.math;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * Parentheses or brackets that may close with the other kind, as in {@code [0, 1)}.
 */
public final class MathMixedGroup implements MathNode {
    private final String open;
    private final MathParent body;
    private final String close;

    public MathMixedGroup(String open, MathParent body, String close) {
        this.open = open;
        this.body = body;
        this.close = close;
    }

    public MathParent getBody() {
        return body;
    }

    @Override
    public MathKind kind() {
        return MathKind.MIXED_GROUP;
    }

    @Override
    public List<String> format(Budget budget) {
        return MathGroups.wrap(open, body, close, budget);
    }
}
