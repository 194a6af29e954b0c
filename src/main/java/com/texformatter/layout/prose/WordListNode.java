package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A delimited, comma separated list of plain words: package names, labels, citation keys.
 */
public final class WordListNode implements TexNode {
    private final String open;
    private final String close;
    private final List<String> words;

    public WordListNode(String open, String close, List<String> words) {
        this.open = open;
        this.close = close;
        this.words = List.copyOf(words);
    }

    public List<String> getWords() {
        return words;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WORD_LIST;
    }

    @Override
    public List<String> format(Budget budget) {
        return List.of(open + String.join(", ", words) + close);
    }
}
