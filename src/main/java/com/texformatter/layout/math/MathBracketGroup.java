package com.texformatter.layout.math;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * An optional argument in math mode, such as the root index of {@code \sqrt}.
 */
public final class MathBracketGroup implements MathNode {
    private final MathParent body;

    public MathBracketGroup(MathParent body) {
        this.body = body;
    }

    public MathParent getBody() {
        return body;
    }

    @Override
    public MathKind kind() {
        return MathKind.BRACKET_GROUP;
    }

    @Override
    public List<String> format(Budget budget) {
        return MathGroups.wrap("[", body, "]", budget);
    }
}
