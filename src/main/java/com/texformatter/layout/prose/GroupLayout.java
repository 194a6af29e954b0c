package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;

/**
 * Shared layout of delimiter wrapped bodies.
 */
final class GroupLayout {

    private GroupLayout() {
    }

    /**
     * Collapses the body onto one line when its flat form has no line breaks or comments and fits together
     * with the delimiters. Otherwise the delimiters get their own lines and the body goes one
     * level deeper, its last line guarded so the break before the closing delimiter adds no
     * space.
     */
    static List<String> delimited(String open, String close, ParentNode body, Budget budget) {
        List<String> flat = body.format(budget.flat());
        if (flat.isEmpty()) {
            return List.of(open + close);
        }
        if (flat.size() == 1 && !Lines.hasComment(flat.get(0))) {
            String content = flat.get(0).trim();
            if (budget.remaining().fits(content.length() + open.length() + close.length())) {
                return List.of(open + content + close);
            }
        }
        // Without a width limit the nested rendering is the flat one.
        List<String> content = budget.isBounded() ? body.format(budget.nested()) : flat;
        List<String> lines = new ArrayList<>();
        lines.add(open);
        lines.addAll(Lines.indent(Lines.guardLast(content), budget.indentUnit()));
        lines.add(close);
        return lines;
    }

    /**
     * Hanging layout: the body continues right after the opening delimiter and the closing
     * delimiter follows its last line.
     */
    static List<String> hanging(String open, String close, ParentNode body, Budget budget) {
        List<String> flat = body.format(budget.flat());
        if (flat.isEmpty()) {
            return List.of(open + close);
        }
        if (flat.size() == 1 && !Lines.hasComment(flat.get(0))) {
            String content = flat.get(0).trim();
            if (budget.remaining().fits(content.length() + open.length() + close.length())) {
                return List.of(open + content + close);
            }
        }
        List<String> lines = new ArrayList<>(
                budget.isBounded() ? body.format(budget.consume(open.length())) : flat);
        lines.set(0, open + lines.get(0).trim());
        int last = lines.size() - 1;
        if (Lines.hasComment(lines.get(last))) {
            lines.add(close);
        } else {
            lines.set(last, lines.get(last) + close);
        }
        return lines;
    }
}
