package com.texformatter.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Small helpers over rendered lines shared by the prose and math formatters.
 */
public final class Lines {

    private Lines() {
    }

    /**
     * Prefixes every non-blank line with {@code unit}. Multi-line elements (verbatim blocks) only
     * get their first physical line prefixed.
     */
    public static List<String> indent(List<String> lines, String unit) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(line.isBlank() ? "" : unit + line);
        }
        return result;
    }

    /**
     * Index of the first {@code %} that starts a comment, or -1.
     */
    public static int commentStart(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '%') {
                return i;
            }
        }
        return -1;
    }

    public static boolean hasComment(String line) {
        return commentStart(line) >= 0;
    }

    /**
     * Whether the line already ends with a comment marker.
     */
    public static boolean endsWithGuard(String line) {
        return line.endsWith("%") && commentStart(line) == line.length() - 1;
    }

    /**
     * Prepares a line for a forced break. A {@code %} is appended when the line ends right at
     * content, since the line break would otherwise be read as a space.
     */
    public static String guard(String line) {
        String stripped = line.stripTrailing();
        if (stripped.isEmpty() || stripped.length() < line.length() || hasComment(stripped)) {
            return stripped;
        }
        return stripped + "%";
    }

    /**
     * Appends {@code %} to the last non-blank line unless it already carries a comment, and drops
     * trailing blank lines.
     */
    public static List<String> guardLast(List<String> lines) {
        List<String> result = new ArrayList<>(lines);
        while (!result.isEmpty() && result.get(result.size() - 1).isBlank()) {
            result.remove(result.size() - 1);
        }
        if (!result.isEmpty()) {
            int last = result.size() - 1;
            String line = result.get(last).stripTrailing();
            result.set(last, hasComment(line) ? line : line + "%");
        }
        return result;
    }

    /**
     * Splits on {@code separator} characters that are not escaped with a backslash.
     */
    public static List<String> splitUnescaped(String line, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\' && i + 1 < line.length()) {
                current.append(c).append(line.charAt(++i));
            } else if (c == separator) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    public static boolean containsUnescaped(String line, char c) {
        return splitUnescaped(line, c).size() > 1;
    }

    public static String stripTrailing(CharSequence line) {
        return line.toString().stripTrailing();
    }
}
