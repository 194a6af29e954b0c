package com.texformatter.layout.math;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;
import com.texformatter.layout.WidthBudget;

/**
 * Line packer for math siblings. Line breaks are free in math mode, so no guards are needed;
 * the packer only decides where a separating space goes.
 */
final class MathPacker {
    private static final String LINE_BREAK = "\\\\";
    private static final String BINARY = "=+-*/<>,&";

    private final List<MathNode> children;
    private final Budget budget;
    private final WidthBudget width;
    private final List<String> output = new ArrayList<>();
    private StringBuilder line = new StringBuilder();

    private MathPacker(List<MathNode> children, Budget budget) {
        this.children = children;
        this.budget = budget;
        this.width = budget.remaining();
    }

    static List<String> pack(List<MathNode> children, Budget budget) {
        return new MathPacker(children, budget).run();
    }

    private List<String> run() {
        for (int i = 0; i < children.size(); i++) {
            MathNode node = children.get(i);
            MathNode next = i + 1 < children.size() ? children.get(i + 1) : null;
            switch (node.kind()) {
                case COMMAND:
                    placeCommand((MathCommand) node, next);
                    break;
                case TEXT:
                    placeText((MathText) node, next);
                    break;
                case CURLY_GROUP:
                case BRACKET_GROUP:
                case MIXED_GROUP:
                    placeGroup(node, next);
                    break;
                case ENVIRONMENT:
                case PARENT:
                    flush();
                    output.addAll(node.format(budget.fresh()));
                    break;
                default:
                    break;
            }
        }
        flush();
        return output;
    }

    private void placeCommand(MathCommand command, MathNode next) {
        List<String> rendered = command.format(budget.flat());
        if (rendered.size() == 1) {
            String text = rendered.get(0).trim();
            breakIfOverflowing(text.length());
            line.append(text);
        } else {
            append(rendered);
        }
        if (command.getName().equals(LINE_BREAK)) {
            flush();
            return;
        }
        if (next == null) {
            return;
        }
        if (next.kind() == MathKind.TEXT) {
            MathText text = (MathText) next;
            if (text.isComment() || !startsWithAny(text.getText(), ",^_'.")) {
                line.append(' ');
            }
        } else if (next.kind() == MathKind.COMMAND) {
            line.append(' ');
        }
    }

    private void placeText(MathText node, MathNode next) {
        String text = node.getText().trim();
        if (node.isComment()) {
            if (line.length() > 0 && line.charAt(line.length() - 1) != ' ') {
                line.append(' ');
            }
            line.append(text);
            flush();
            return;
        }
        breakIfOverflowing(text.length());
        boolean leading = isLineBlank();
        line.append(text);
        if (next == null || endsWithAny("^_")) {
            return;
        }
        // f(x) stays glued, an operator before a parenthesis gets its space.
        if (next.kind() == MathKind.MIXED_GROUP
                && (!endsWithAny(BINARY) || leading && (text.equals("-") || text.equals("+")))) {
            return;
        }
        if (next.kind() == MathKind.TEXT && !((MathText) next).isComment()) {
            String following = ((MathText) next).getText();
            if (startsWithAny(following, "^_',.")) {
                return;
            }
            // Keep relations such as &= and <= glued.
            if (following.startsWith("=") && endsWithAny("&<>!:")) {
                return;
            }
        }
        line.append(' ');
    }

    private void placeGroup(MathNode group, MathNode next) {
        append(group.format(budget.flat()));
        if (next == null) {
            return;
        }
        if (next.kind() == MathKind.TEXT) {
            MathText text = (MathText) next;
            if (text.isComment() || !startsWithAny(text.getText(), ".,^_-'")) {
                line.append(' ');
            }
        } else if (next.kind() == MathKind.COMMAND) {
            line.append(' ');
        }
    }

    private void append(List<String> rendered) {
        if (rendered.isEmpty()) {
            return;
        }
        if (rendered.size() == 1) {
            breakIfOverflowing(rendered.get(0).length());
            line.append(rendered.get(0));
            return;
        }
        line.append(rendered.get(0));
        flush();
        output.addAll(rendered.subList(1, rendered.size() - 1));
        line = new StringBuilder(rendered.get(rendered.size() - 1));
    }

    private void breakIfOverflowing(int length) {
        if (width.isBounded() && !isLineBlank() && !width.fits(line.length() + length)) {
            flush();
        }
    }

    private void flush() {
        if (!isLineBlank()) {
            output.add(Lines.stripTrailing(line));
        }
        line = new StringBuilder();
    }

    private boolean isLineBlank() {
        return line.toString().isBlank();
    }

    private boolean endsWithAny(String chars) {
        return line.length() > 0 && chars.indexOf(line.charAt(line.length() - 1)) >= 0;
    }

    private static boolean startsWithAny(String text, String chars) {
        return !text.isEmpty() && chars.indexOf(text.charAt(0)) >= 0;
    }
}
