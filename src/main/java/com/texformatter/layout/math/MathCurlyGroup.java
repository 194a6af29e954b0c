package com.texformatter.layout.math;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A brace group in math mode, such as a superscript.
 */
public final class MathCurlyGroup implements MathNode {
    private final MathParent body;

    public MathCurlyGroup(MathParent body) {
        this.body = body;
    }

    public MathParent getBody() {
        return body;
    }

    @Override
    public MathKind kind() {
        return MathKind.CURLY_GROUP;
    }

    @Override
    public List<String> format(Budget budget) {
        return MathGroups.wrap("{", body, "}", budget);
    }
}
