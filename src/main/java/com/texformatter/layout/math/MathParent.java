package com.texformatter.layout.math;

import java.util.List;

import com.texformatter.layout.Budget;

public final class MathParent implements MathNode {
    private final List<MathNode> children;

    public MathParent(List<MathNode> children) {
        this.children = List.copyOf(children);
    }

    public List<MathNode> getChildren() {
        return children;
    }

    @Override
    public MathKind kind() {
        return MathKind.PARENT;
    }

    @Override
    public List<String> format(Budget budget) {
        return MathPacker.pack(children, budget);
    }
}
