package com.texformatter.layout.math;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;

final class MathGroups {

    private MathGroups() {
    }

    /**
     * {@code open + body + close} on one line. A body broken by comments keeps its lines, with
     * the closing delimiter moved below a trailing comment.
     */
    static List<String> wrap(String open, MathParent body, String close, Budget budget) {
        List<String> rendered = body.format(budget.flat());
        if (rendered.isEmpty()) {
            return List.of(open + close);
        }
        if (rendered.size() == 1 && !Lines.hasComment(rendered.get(0))) {
            return List.of(open + rendered.get(0) + close);
        }
        List<String> lines = new ArrayList<>(rendered);
        lines.set(0, open + lines.get(0));
        int last = lines.size() - 1;
        if (Lines.hasComment(lines.get(last))) {
            lines.add(close);
        } else {
            lines.set(last, lines.get(last) + close);
        }
        return lines;
    }
}
