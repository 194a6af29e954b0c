package com.texformatter.syntax;

/**
 * Renders a syntax tree as indented text, one node or token per line.
 */
public final class SyntaxTreePrinter {
    private static final String INDENT = "  ";

    private SyntaxTreePrinter() {
    }

    public static String print(SyntaxNode root) {
        StringBuilder sb = new StringBuilder();
        _print(root, 0, sb);
        return sb.toString();
    }

    private static void _print(SyntaxElement element, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth)).append(element.kind());
        if (element instanceof SyntaxToken) {
            sb.append(' ').append(_quote(element.text()));
        }
        sb.append('\n');
        if (element instanceof SyntaxNode) {
            for (SyntaxElement child : ((SyntaxNode) element).childrenWithTokens()) {
                _print(child, depth + 1, sb);
            }
        }
    }

    private static String _quote(String text) {
        return "\"" + text.replace("\\", "\\\\")
                .replace("\n", "\\n")
                .replace("\t", "\\t")
                .replace("\"", "\\\"") + "\"";
    }
}
