package com.texformatter.layout.math;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Lines;

/**
 * Pads {@code &} separated columns of math rows to a common width.
 *
 * <p>Rows carrying a comment and rows of nested environments are left untouched and take no
 * part in the width computation.
 */
public final class AmpersandAligner {
    private static final String SEPARATOR = " & ";

    private AmpersandAligner() {
    }

    public static List<String> align(List<String> lines) {
        boolean hasColumns = false;
        for (String line : lines) {
            if (Lines.containsUnescaped(line, '&')) {
                hasColumns = true;
                break;
            }
        }
        if (!hasColumns) {
            return lines;
        }

        boolean[] passThrough = new boolean[lines.size()];
        List<List<String>> cells = new ArrayList<>(lines.size());
        List<Integer> widths = new ArrayList<>();
        int depth = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int opened = count(line, "\\begin{");
            int closed = count(line, "\\end{");
            passThrough[i] = depth > 0 || opened > 0 || closed > 0 || Lines.hasComment(line);
            depth = Math.max(0, depth + opened - closed);

            List<String> row = new ArrayList<>();
            if (!passThrough[i]) {
                for (String cell : Lines.splitUnescaped(line, '&')) {
                    row.add(cell.trim());
                }
                for (int c = 0; c < row.size(); c++) {
                    int length = row.get(c).length();
                    if (c == widths.size()) {
                        widths.add(length);
                    } else if (length > widths.get(c)) {
                        widths.set(c, length);
                    }
                }
            }
            cells.add(row);
        }

        List<String> result = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (passThrough[i]) {
                result.add(lines.get(i));
                continue;
            }
            List<String> row = cells.get(i);
            StringBuilder sb = new StringBuilder();
            for (int c = 0; c < row.size(); c++) {
                if (c > 0) {
                    sb.append(SEPARATOR);
                }
                sb.append(pad(row.get(c), widths.get(c)));
            }
            String aligned = sb.toString().stripTrailing();
            if (!aligned.isBlank()) {
                result.add(aligned);
            }
        }
        return result;
    }

    private static String pad(String cell, int width) {
        return cell + " ".repeat(width - cell.length());
    }

    private static int count(String line, String needle) {
        int count = 0;
        int index = line.indexOf(needle);
        while (index >= 0) {
            count++;
            index = line.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
