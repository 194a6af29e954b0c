package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;
import com.texformatter.layout.WidthBudget;

/**
 * Greedy line packer for a run of prose siblings.
 *
 * <p>Walks the children left to right with a single open line. Inline material is appended
 * while it fits; block material closes the open line and contributes its own lines. A break
 * inserted between two pieces that were written without a space is guarded with {@code %}.
 */
final class ProsePacker {

    /** Commands that always begin a new line. */
    static final Set<String> START_NEW_LINE = Set.of(
            "\\newline", "\\newpage", "\\usepackage", "\\RequirePackage", "\\documentclass",
            "\\setlength", "\\pagestyle", "\\newcommand", "\\renewcommand", "\\providecommand",
            "\\newenvironment", "\\renewenvironment", "\\author", "\\title", "\\maketitle",
            "\\date", "\\institute", "\\usetheme", "\\usecolortheme", "\\tableofcontents",
            "\\clearpage", "\\bibliography", "\\bibliographystyle", "\\input", "\\include");

    private static final String LINE_BREAK = "\\\\";

    // No separator before text starting with one of these.
    private static final String TIGHT_AFTER_COMMAND = "})].,;~+|";
    private static final String TIGHT_AFTER_FORMULA = ".,?;:!-)]}'~|+";

    private final List<TexNode> children;
    private final Budget budget;
    private final WidthBudget width;
    private final List<String> output = new ArrayList<>();
    private StringBuilder line = new StringBuilder();
    // Length of the open line before the current child; 0 once the line was restarted.
    private int safe;

    private ProsePacker(List<TexNode> children, Budget budget) {
        this.children = children;
        this.budget = budget;
        this.width = budget.remaining();
    }

    static List<String> pack(List<TexNode> children, Budget budget) {
        return new ProsePacker(children, budget).run();
    }

    private List<String> run() {
        for (int i = 0; i < children.size(); i++) {
            TexNode node = children.get(i);
            TexNode next = i + 1 < children.size() ? children.get(i + 1) : null;
            if (width.isBounded() && !width.fits(line.length()) && !isAttachedComment(node)) {
                guardFlush();
            }
            safe = line.length();

            switch (node.kind()) {
                case COMMAND:
                    placeCommand((CommandNode) node, next);
                    break;
                case TEXT:
                    placeText((TextNode) node, next);
                    break;
                case ENVIRONMENT:
                case PARENT:
                case SECTION:
                case LIST_ITEM:
                    flush();
                    extend(node.format(budget.fresh()));
                    break;
                case FORMULA:
                    if (((FormulaNode) node).isInline()) {
                        placeAtomic(node, next);
                    } else {
                        flush();
                        extend(node.format(budget.fresh()));
                    }
                    break;
                case VERBATIM:
                    if (((VerbatimNode) node).isBlock()) {
                        flush();
                        extend(node.format(budget.fresh()));
                    } else {
                        placeAtomic(node, next);
                    }
                    break;
                case CURLY_GROUP:
                case BRACKET_GROUP:
                case WORD_LIST:
                    placeGroup(node, next);
                    break;
                case MIXED_GROUP:
                    placeAtomic(node, next);
                    break;
                case COMMENT:
                    placeComment((CommentNode) node);
                    break;
                case BLANK_LINE:
                    flush();
                    if (output.isEmpty() || !lastLine().isEmpty()) {
                        output.add("");
                    }
                    break;
                case KEY_VALUE:
                case KEY_VALUE_LIST:
                    line.append(node.flat(budget));
                    break;
                default:
                    break;
            }
        }
        finish();
        return output;
    }

    private void placeCommand(CommandNode command, TexNode next) {
        if (START_NEW_LINE.contains(command.getName())) {
            flush();
            extend(command.format(budget.fresh()));
            return;
        }
        if (command.getName().equals(LINE_BREAK)) {
            append(command.format(budget.consume(line.length())));
            flush();
            return;
        }
        append(render(command));
        tie(next);
    }

    private void placeGroup(TexNode group, TexNode next) {
        append(render(group));
        if (next != null && next.kind() == NodeKind.TEXT && line.length() > 0) {
            String text = ((TextNode) next).getText();
            if (!text.isEmpty() && TIGHT_AFTER_COMMAND.indexOf(text.charAt(0)) < 0) {
                line.append(' ');
            }
        }
    }

    /**
     * Formulas, mixed groups and inline verbatim are never split across the open line.
     */
    private void placeAtomic(TexNode node, TexNode next) {
        List<String> rendered = node.format(budget.consume(line.length()));
        if (!isLineBlank() && width.isBounded()
                && (rendered.size() > 1 || !width.fits(line.length() + rendered.get(0).length()))) {
            guardFlush();
            rendered = node.format(budget.fresh());
        }
        if (rendered.size() > 1) {
            flush();
            extend(rendered);
            return;
        }
        line.append(rendered.get(0));
        if (next == null) {
            return;
        }
        if (next.kind() == NodeKind.TEXT) {
            String text = ((TextNode) next).getText();
            if (!text.isEmpty() && TIGHT_AFTER_FORMULA.indexOf(text.charAt(0)) < 0) {
                line.append(' ');
            }
        } else if (next.kind() == NodeKind.FORMULA || next.kind() == NodeKind.COMMAND) {
            line.append(' ');
        }
    }

    private void placeText(TextNode node, TexNode next) {
        String text = node.getText().trim();
        if (text.isEmpty()) {
            return;
        }
        if (!width.isBounded() || width.fits(line.length() + text.length())) {
            line.append(text).append(' ');
        } else {
            for (String word : text.split(" ")) {
                if (word.isEmpty()) {
                    continue;
                }
                if (!width.fits(line.length() + word.length()) && !isLineBlank()) {
                    flush();
                }
                line.append(word).append(' ');
            }
        }
        // A tie written right before a command stays glued to it.
        if (next != null && next.kind() == NodeKind.COMMAND && endsWith("~ ")) {
            line.setLength(line.length() - 1);
        }
    }

    private void placeComment(CommentNode comment) {
        if (comment.isAttached()) {
            line = new StringBuilder(Lines.stripTrailing(line));
        } else if (line.length() > 0 && line.charAt(line.length() - 1) != ' ') {
            line.append(' ');
        }
        line.append(comment.getText());
        flush();
    }

    /**
     * Inserts the separator after a command: nothing before closing punctuation, a space after a
     * closing brace and a tie otherwise.
     */
    private void tie(TexNode next) {
        if (next == null || next.kind() != NodeKind.TEXT || line.length() == 0) {
            return;
        }
        String text = ((TextNode) next).getText();
        if (text.isEmpty() || TIGHT_AFTER_COMMAND.indexOf(text.charAt(0)) >= 0) {
            return;
        }
        line.append(endsWith("}") ? ' ' : '~');
    }

    /**
     * Renders {@code node} where the open line ends. The open line is closed first when the
     * node's first line would overflow it, or when the node only breaks because of where it
     * starts.
     */
    private List<String> render(TexNode node) {
        List<String> rendered = node.format(budget.consume(line.length()));
        if (isLineBlank() || !width.isBounded() || rendered.isEmpty()) {
            return rendered;
        }
        if (width.fits(line.length() + rendered.get(0).trim().length())) {
            if (rendered.size() == 1) {
                return rendered;
            }
            List<String> fresh = node.format(budget.fresh());
            if (fresh.size() > 1) {
                return rendered;
            }
            guardFlush();
            return fresh;
        }
        guardFlush();
        return node.format(budget.fresh());
    }

    private void append(List<String> rendered) {
        if (rendered.isEmpty()) {
            return;
        }
        line.append(rendered.get(0).trim());
        if (rendered.size() > 1) {
            flush();
            output.addAll(rendered.subList(1, rendered.size() - 1));
            line = new StringBuilder(rendered.get(rendered.size() - 1));
            safe = 0;
        }
    }

    private void extend(List<String> lines) {
        for (String rendered : lines) {
            if (rendered.isEmpty() && !output.isEmpty() && lastLine().isEmpty()) {
                continue;
            }
            output.add(rendered);
        }
    }

    private void flush() {
        if (!isLineBlank()) {
            output.add(Lines.stripTrailing(line));
        }
        line = new StringBuilder();
        safe = 0;
    }

    private void guardFlush() {
        if (!isLineBlank()) {
            output.add(Lines.guard(line.toString()));
        }
        line = new StringBuilder();
        safe = 0;
    }

    private void finish() {
        if (isLineBlank()) {
            return;
        }
        String text = Lines.stripTrailing(line);
        if (!width.isBounded() || width.fits(text.length()) || safe <= 0 || safe >= text.length()) {
            output.add(text);
            return;
        }
        String head = Lines.guard(line.substring(0, safe));
        String tail = line.substring(safe).trim();
        if (!head.isEmpty()) {
            output.add(head);
        }
        output.add(tail);
    }

    private static boolean isAttachedComment(TexNode node) {
        return node.kind() == NodeKind.COMMENT && ((CommentNode) node).isAttached();
    }

    private boolean isLineBlank() {
        return line.toString().isBlank();
    }

    private boolean endsWith(String suffix) {
        int start = line.length() - suffix.length();
        return start >= 0 && line.substring(start).equals(suffix);
    }

    private String lastLine() {
        return output.get(output.size() - 1);
    }
}
