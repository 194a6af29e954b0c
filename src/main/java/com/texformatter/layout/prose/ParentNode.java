package com.texformatter.layout.prose;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.texformatter.layout.Budget;

/**
 * An ordered run of sibling nodes laid out by the {@link ProsePacker}.
 *
 * <p>Renderings are cached per budget. A tree is built for one format call and is never
 * shared between threads.
 */
public final class ParentNode implements TexNode {
    private final List<TexNode> children;
    private final Map<Budget, List<String>> layouts = new HashMap<>();

    public ParentNode(List<TexNode> children) {
        this.children = List.copyOf(children);
    }

    public List<TexNode> getChildren() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARENT;
    }

    @Override
    public List<String> format(Budget budget) {
        List<String> lines = layouts.get(budget);
        if (lines == null) {
            lines = List.copyOf(ProsePacker.pack(children, budget));
            layouts.put(budget, lines);
        }
        return lines;
    }
}
