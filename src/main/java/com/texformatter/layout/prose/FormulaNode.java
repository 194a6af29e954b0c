package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;
import com.texformatter.layout.math.MathParent;

/**
 * Inline ({@code $..$}, {@code \(..\)}) or display ({@code $$..$$}, {@code \[..\]}) math. Output
 * always uses the bracket delimiters.
 */
public final class FormulaNode implements TexNode {
    private static final int DELIMITER_OVERHEAD = 6;

    private final boolean inline;
    private final MathParent body;

    public FormulaNode(boolean inline, MathParent body) {
        this.inline = inline;
        this.body = body;
    }

    public boolean isInline() {
        return inline;
    }

    public MathParent getBody() {
        return body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FORMULA;
    }

    @Override
    public List<String> format(Budget budget) {
        if (!inline) {
            return expanded("\\[", "\\]", budget, null);
        }
        List<String> flat = body.format(budget.flat());
        if (flat.isEmpty()) {
            return List.of("\\(\\)");
        }
        if (flat.size() == 1 && !Lines.hasComment(flat.get(0))) {
            String content = flat.get(0).trim();
            if (budget.remaining().fits(content.length() + DELIMITER_OVERHEAD)) {
                return List.of("\\( " + content + " \\)");
            }
        }
        return expanded("\\(", "\\)", budget, flat);
    }

    private List<String> expanded(String open, String close, Budget budget, List<String> flat) {
        List<String> content = flat == null || budget.isBounded() ? body.format(budget.nested()) : flat;
        List<String> lines = new ArrayList<>();
        lines.add(open);
        lines.addAll(Lines.indent(content, budget.indentUnit()));
        lines.add(close);
        return lines;
    }
}
