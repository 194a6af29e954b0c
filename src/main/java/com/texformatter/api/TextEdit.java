package com.texformatter.api;

/**
 * Replacement of a range of the original text, positions are zero-based line and column.
 */
public class TextEdit {
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final String newText;

    public TextEdit(int startLine, int startColumn, int endLine, int endColumn, String newText) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.newText = newText;
    }

    /**
     * An edit replacing all of {@code oldText} with {@code newText}.
     */
    public static TextEdit replaceAll(String oldText, String newText) {
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < oldText.length(); i++) {
            if (oldText.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new TextEdit(0, 0, line, oldText.length() - lineStart, newText);
    }

    public int getStartLine() { return startLine; }
    public int getStartColumn() { return startColumn; }
    public int getEndLine() { return endLine; }
    public int getEndColumn() { return endColumn; }
    public String getNewText() { return newText; }

    @Override
    public String toString() {
        return "TextEdit[" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn + "]";
    }
}
