package com.texformatter.layout;

import java.util.Objects;

/**
 * Layout constraints handed from a parent to a child formatter.
 *
 * <p>Lines produced under a budget are relative to the block of the node being formatted:
 * {@code width} is the room of that block and {@code offset} the number of columns already
 * taken on its first line. Containers indent the lines of their children themselves.
 */
public final class Budget {
    private final int indentLevel;
    private final int tabWidth;
    private final WidthBudget width;
    private final int offset;

    private Budget(int indentLevel, int tabWidth, WidthBudget width, int offset) {
        this.indentLevel = indentLevel;
        this.tabWidth = tabWidth;
        this.width = width;
        this.offset = offset;
    }

    public static Budget root(int tabWidth, int lineLength) {
        return new Budget(0, tabWidth, WidthBudget.of(lineLength), 0);
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    public WidthBudget getWidth() {
        return width;
    }

    public int getOffset() {
        return offset;
    }

    public boolean isBounded() {
        return width.isBounded();
    }

    /**
     * Room left on the first line.
     */
    public WidthBudget remaining() {
        return width.shrink(offset);
    }

    public Budget consume(int columns) {
        return new Budget(indentLevel, tabWidth, width, offset + columns);
    }

    /**
     * Budget for a body one indentation level deeper, starting on a fresh line.
     */
    public Budget nested() {
        return new Budget(indentLevel + 1, tabWidth, width.shrink(tabWidth), 0);
    }

    public Budget fresh() {
        return new Budget(indentLevel, tabWidth, width, 0);
    }

    /**
     * Same indentation without any width limit, used to measure flat renderings.
     */
    public Budget flat() {
        return new Budget(indentLevel, tabWidth, WidthBudget.UNBOUNDED, 0);
    }

    public Budget shrink(int columns) {
        return new Budget(indentLevel, tabWidth, width.shrink(columns), offset);
    }

    public String indentUnit() {
        return " ".repeat(tabWidth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Budget)) {
            return false;
        }
        Budget other = (Budget) o;
        return indentLevel == other.indentLevel && tabWidth == other.tabWidth
                && offset == other.offset && width.equals(other.width);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indentLevel, tabWidth, width, offset);
    }

    @Override
    public String toString() {
        return "Budget{level=" + indentLevel + ", tab=" + tabWidth + ", width=" + width + ", offset=" + offset + "}";
    }
}
