package com.texformatter.syntax;

/**
 * A leaf of the syntax tree.
 */
public final class SyntaxToken implements SyntaxElement {
    private final SyntaxKind kind;
    private final String text;
    private final int offset;

    public SyntaxToken(SyntaxKind kind, String text, int offset) {
        if (!kind.isToken()) {
            throw new IllegalArgumentException("Not a token kind: " + kind);
        }
        this.kind = kind;
        this.text = text;
        this.offset = offset;
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    @Override
    public String text() {
        return text;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Whether this is a whitespace token spanning at least one empty line.
     */
    public boolean isBlankLine() {
        if (kind != SyntaxKind.WHITESPACE) {
            return false;
        }
        int breaks = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                breaks++;
            }
        }
        return breaks >= 2;
    }

    @Override
    public String toString() {
        return kind + "@" + offset + " " + text.replace("\n", "\\n");
    }
}
