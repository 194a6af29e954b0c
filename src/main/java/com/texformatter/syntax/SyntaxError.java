package com.texformatter.syntax;

/**
 * A problem found while parsing. Parsing always completes, errors are only collected.
 */
public class SyntaxError {
    private final String message;
    private final int offset;

    public SyntaxError(String message, int offset) {
        this.message = message;
        this.offset = offset;
    }

    public String getMessage() {
        return message;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return message + " at offset " + offset;
    }
}
