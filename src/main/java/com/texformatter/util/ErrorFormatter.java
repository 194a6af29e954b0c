package com.texformatter.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.texformatter.api.error.FormatterError;
import com.texformatter.api.error.Severity;

/**
 * Renders formatter errors for the console, optionally with ANSI colours.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one error as {@code SEVERITY: message (Line l, Column c)}, followed by the
     * suggestion on its own line when there is one.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ").append(error.getMessage());
        if (error.getLine() > 0) {
            sb.append(" (Line ").append(error.getLine());
            if (error.getColumn() > 0) {
                sb.append(", Column ").append(error.getColumn());
            }
            sb.append(")");
        }

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a per-file summary of error counts followed by the totals.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append("\n");

        long[] totals = new long[Severity.values().length];
        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }
            long[] counts = _count(errors);
            for (int i = 0; i < counts.length; i++) {
                totals[i] += counts[i];
            }
            sb.append(entry.getKey().getFileName()).append(": ").append(_describe(counts)).append("\n");
        }

        sb.append("\nTotal: ").append(_describe(totals));
        return sb.toString();
    }

    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FormatterError::getSeverity));
    }

    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private static long[] _count(List<FormatterError> errors) {
        long[] counts = new long[Severity.values().length];
        for (FormatterError error : errors) {
            counts[error.getSeverity().ordinal()]++;
        }
        return counts;
    }

    private String _describe(long[] counts) {
        StringBuilder sb = new StringBuilder();
        for (Severity severity : Severity.values()) {
            long count = counts[severity.ordinal()];
            if (count == 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(switch (severity) {
                case FATAL -> colorize(ANSI_RED, count + " fatal");
                case ERROR -> colorize(ANSI_RED, count + " errors");
                case WARNING -> colorize(ANSI_YELLOW, count + " warnings");
                case INFO -> colorize(ANSI_BLUE, count + " info");
            });
        }
        return sb.length() == 0 ? "no issues" : sb.toString();
    }
}
