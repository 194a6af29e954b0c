package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * Source text that is emitted exactly as written: verbatim environments, {@code \verb} and URLs.
 * A block verbatim always stands on its own lines; an inline one is placed like a word.
 */
public final class VerbatimNode implements TexNode {
    private final String text;
    private final boolean block;

    public VerbatimNode(String text, boolean block) {
        this.text = text;
        this.block = block;
    }

    public String getText() {
        return text;
    }

    public boolean isBlock() {
        return block;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VERBATIM;
    }

    @Override
    public List<String> format(Budget budget) {
        return List.of(text);
    }
}
