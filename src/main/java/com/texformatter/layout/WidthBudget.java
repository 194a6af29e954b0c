package com.texformatter.layout;

/**
 * Horizontal room available to a formatter: either a fixed number of columns or no limit at all.
 * The unbounded mode is used to measure the flat rendering of a node.
 */
public sealed interface WidthBudget permits WidthBudget.Bounded, WidthBudget.Unbounded {

    WidthBudget UNBOUNDED = new Unbounded();

    static WidthBudget of(int columns) {
        return new Bounded(columns);
    }

    /**
     * Whether content of the given length fits.
     */
    boolean fits(int length);

    /**
     * The budget left after giving away {@code columns}. Never drops below zero.
     */
    WidthBudget shrink(int columns);

    boolean isBounded();

    /**
     * Number of columns, {@link Integer#MAX_VALUE} when unbounded.
     */
    int columns();

    final class Bounded implements WidthBudget {
        private final int columns;

        private Bounded(int columns) {
            this.columns = Math.max(0, columns);
        }

        @Override
        public boolean fits(int length) {
            return length <= columns;
        }

        @Override
        public WidthBudget shrink(int amount) {
            return new Bounded(columns - amount);
        }

        @Override
        public boolean isBounded() {
            return true;
        }

        @Override
        public int columns() {
            return columns;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bounded && ((Bounded) o).columns == columns;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(columns);
        }

        @Override
        public String toString() {
            return "Bounded(" + columns + ")";
        }
    }

    final class Unbounded implements WidthBudget {
        private Unbounded() {
        }

        @Override
        public boolean fits(int length) {
            return true;
        }

        @Override
        public WidthBudget shrink(int amount) {
            return this;
        }

        @Override
        public boolean isBounded() {
            return false;
        }

        @Override
        public int columns() {
            return Integer.MAX_VALUE;
        }

        @Override
        public String toString() {
            return "Unbounded";
        }
    }
}
