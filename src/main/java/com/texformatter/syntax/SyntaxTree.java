package com.texformatter.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing a document: the root node, the errors found on the way and the
 * line index needed to report them.
 */
public class SyntaxTree {
    private final String source;
    private final SyntaxNode root;
    private final List<SyntaxError> errors;
    private final int[] lineStarts;

    public SyntaxTree(String source, SyntaxNode root, List<SyntaxError> errors) {
        this.source = source;
        this.root = root;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.lineStarts = _computeLineStarts(source);
    }

    public String getSource() {
        return source;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public List<SyntaxError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * One-based line number of the given offset.
     */
    public int lineOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * One-based column of the given offset.
     */
    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1] + 1;
    }

    private static int[] _computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }
}
