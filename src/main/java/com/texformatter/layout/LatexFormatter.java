package com.texformatter.layout;

import java.util.List;

import com.texformatter.layout.prose.TexNode;
import com.texformatter.layout.prose.TexNodeBuilder;
import com.texformatter.syntax.LatexParser;
import com.texformatter.syntax.SyntaxNode;

/**
 * Entry point of the layout engine: turns a syntax tree into formatted LaTeX source.
 *
 * <p>Instances only hold the two layout parameters and may be shared between threads.
 */
public class LatexFormatter {
    public static final int DEFAULT_TAB_WIDTH = 2;
    public static final int DEFAULT_LINE_LENGTH = 80;

    private final int tabWidth;
    private final int lineLength;

    public LatexFormatter() {
        this(DEFAULT_TAB_WIDTH, DEFAULT_LINE_LENGTH);
    }

    public LatexFormatter(int tabWidth, int lineLength) {
        if (tabWidth < 0) {
            throw new IllegalArgumentException("Tab width must not be negative: " + tabWidth);
        }
        if (lineLength <= 0) {
            throw new IllegalArgumentException("Line length must be positive: " + lineLength);
        }
        this.tabWidth = tabWidth;
        this.lineLength = lineLength;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    public int getLineLength() {
        return lineLength;
    }

    /**
     * Formats the subtree rooted at {@code root}, returning the lines joined with {@code \n}.
     */
    public String format(SyntaxNode root) {
        TexNode tree = TexNodeBuilder.build(root);
        List<String> lines = tree.format(Budget.root(tabWidth, lineLength));
        return String.join("\n", lines);
    }

    /**
     * Parses and formats {@code source}. Syntax errors are tolerated; callers that must not touch
     * broken documents should parse first and inspect the errors.
     */
    public String format(String source) {
        return format(LatexParser.parse(source).getRoot());
    }
}
