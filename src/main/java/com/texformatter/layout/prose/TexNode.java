package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A node of the prose formatting tree.
 *
 * <p>The set of variants is closed. Every variant renders itself into lines relative to its own
 * block; an empty list means the node produced nothing.
 */
public sealed interface TexNode permits ParentNode, CommandNode, EnvironmentNode, TextNode,
        KeyValueNode, KeyValueListNode, CurlyGroupNode, BracketGroupNode, MixedGroupNode,
        WordListNode, ListItemNode, FormulaNode, SectionNode, CommentNode, BlankLineNode,
        VerbatimNode {

    NodeKind kind();

    List<String> format(Budget budget);

    /**
     * The rendering without any line width limit, joined into a single string.
     */
    default String flat(Budget budget) {
        return String.join(" ", format(budget.flat()));
    }
}
