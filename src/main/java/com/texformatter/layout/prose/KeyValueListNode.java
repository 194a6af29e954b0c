package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A bracketed option list such as {@code [a4paper, 12pt]}. Always rendered on one line.
 */
public final class KeyValueListNode implements TexNode {
    private final List<TexNode> entries;

    public KeyValueListNode(List<TexNode> entries) {
        this.entries = List.copyOf(entries);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KEY_VALUE_LIST;
    }

    @Override
    public List<String> format(Budget budget) {
        List<String> parts = new ArrayList<>();
        boolean glue = false;
        for (TexNode entry : entries) {
            String text = entry.flat(budget).trim();
            if (entry.kind() == NodeKind.TEXT && text.equals("=") && !parts.isEmpty()) {
                parts.set(parts.size() - 1, parts.get(parts.size() - 1) + "=");
                glue = true;
            } else if (glue) {
                parts.set(parts.size() - 1, parts.get(parts.size() - 1) + text);
                glue = false;
            } else if (!text.isEmpty()) {
                parts.add(text);
            }
        }
        return List.of("[" + String.join(", ", parts) + "]");
    }
}
