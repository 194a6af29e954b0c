package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;

/**
 * An {@code \item} with everything up to the next item. An optional label is the first child
 * of the body.
 */
public final class ListItemNode implements TexNode {
    static final String MARKER = "\\item";
    private static final int MARKER_ALLOWANCE = 6;

    private final ParentNode body;

    public ListItemNode(ParentNode body) {
        this.body = body;
    }

    public ParentNode getBody() {
        return body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST_ITEM;
    }

    @Override
    public List<String> format(Budget budget) {
        List<String> rendered = body.format(budget.shrink(MARKER_ALLOWANCE));
        if (rendered.isEmpty()) {
            return List.of(MARKER);
        }
        List<String> lines = new ArrayList<>();
        String first = rendered.get(0).stripTrailing();
        if (first.isEmpty()) {
            lines.add(MARKER);
        } else {
            lines.add(MARKER + (first.startsWith("[") ? "" : " ") + first);
        }
        lines.addAll(Lines.indent(rendered.subList(1, rendered.size()), budget.indentUnit()));
        return lines;
    }
}
