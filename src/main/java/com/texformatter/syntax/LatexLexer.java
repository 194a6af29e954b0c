package com.texformatter.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits LaTeX source into tokens on demand.
 *
 * <p>Tokens are produced lazily into a lookahead buffer. The raw read operations discard the
 * buffer and continue from the first unconsumed character, so the parser may peek freely before
 * deciding that a region has to be read verbatim.
 */
public class LatexLexer {
    private final String source;
    private int position;
    private final List<SyntaxToken> buffer = new ArrayList<>();

    public LatexLexer(String source) {
        this.source = source;
    }

    public SyntaxToken peek() {
        return peek(0);
    }

    /**
     * Returns the token {@code k} positions ahead, or {@code null} past the end of input.
     */
    public SyntaxToken peek(int k) {
        while (buffer.size() <= k) {
            SyntaxToken token = lexNext();
            if (token == null) {
                return null;
            }
            buffer.add(token);
        }
        return buffer.get(k);
    }

    public SyntaxToken next() {
        SyntaxToken token = peek(0);
        if (token != null) {
            buffer.remove(0);
        }
        return token;
    }

    /**
     * Offset of the first character not consumed yet.
     */
    public int offset() {
        return buffer.isEmpty() ? position : buffer.get(0).getOffset();
    }

    /**
     * Reads everything up to (not including) {@code terminator}, or to the end of input.
     *
     * @return the verbatim token, or {@code null} if the region is empty
     */
    public SyntaxToken readRawUntil(String terminator) {
        rewind();
        int end = source.indexOf(terminator, position);
        if (end < 0) {
            end = source.length();
        }
        return rawToken(end);
    }

    /**
     * Reads a {@code \verb} body: a delimiter character, the text and the same delimiter again,
     * all on one line.
     *
     * @return the verbatim token including both delimiters, or {@code null} if it is unterminated
     */
    public SyntaxToken readDelimited() {
        rewind();
        if (position >= source.length()) {
            return null;
        }
        char delimiter = source.charAt(position);
        if (Character.isWhitespace(delimiter) || Character.isLetter(delimiter)) {
            return null;
        }
        for (int i = position + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                return null;
            }
            if (c == delimiter) {
                return rawToken(i + 1);
            }
        }
        return null;
    }

    /**
     * Reads the body of a brace group whose opening brace was just consumed, up to the matching
     * closing brace. Escaped braces do not count.
     */
    public SyntaxToken readRawBalanced() {
        rewind();
        int depth = 1;
        int i = position;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            i++;
        }
        return rawToken(Math.min(i, source.length()));
    }

    private SyntaxToken rawToken(int end) {
        if (end <= position) {
            return null;
        }
        SyntaxToken token = new SyntaxToken(SyntaxKind.VERBATIM, source.substring(position, end), position);
        position = end;
        return token;
    }

    private void rewind() {
        position = offset();
        buffer.clear();
    }

    private SyntaxToken lexNext() {
        if (position >= source.length()) {
            return null;
        }
        int start = position;
        char c = source.charAt(start);

        if (Character.isWhitespace(c)) {
            int end = start;
            while (end < source.length() && Character.isWhitespace(source.charAt(end))) {
                end++;
            }
            return emit(SyntaxKind.WHITESPACE, start, end);
        }

        switch (c) {
            case '%': {
                int end = source.indexOf('\n', start);
                return emit(SyntaxKind.COMMENT, start, end < 0 ? source.length() : end);
            }
            case '\\':
                return lexCommand(start);
            case '{':
                return emit(SyntaxKind.L_CURLY, start, start + 1);
            case '}':
                return emit(SyntaxKind.R_CURLY, start, start + 1);
            case '[':
                return emit(SyntaxKind.L_BRACK, start, start + 1);
            case ']':
                return emit(SyntaxKind.R_BRACK, start, start + 1);
            case '(':
                return emit(SyntaxKind.L_PAREN, start, start + 1);
            case ')':
                return emit(SyntaxKind.R_PAREN, start, start + 1);
            case ',':
                return emit(SyntaxKind.COMMA, start, start + 1);
            case '=':
                return emit(SyntaxKind.EQUALITY_SIGN, start, start + 1);
            case '$': {
                boolean display = start + 1 < source.length() && source.charAt(start + 1) == '$';
                return emit(SyntaxKind.DOLLAR, start, display ? start + 2 : start + 1);
            }
            default: {
                int end = start;
                while (end < source.length() && !isSpecial(source.charAt(end))) {
                    end++;
                }
                return emit(SyntaxKind.WORD, start, end);
            }
        }
    }

    private SyntaxToken lexCommand(int start) {
        int end = start + 1;
        if (end >= source.length()) {
            return emit(SyntaxKind.WORD, start, end);
        }
        if (isCommandLetter(source.charAt(end))) {
            while (end < source.length() && isCommandLetter(source.charAt(end))) {
                end++;
            }
            if (end < source.length() && source.charAt(end) == '*') {
                end++;
            }
            return emit(SyntaxKind.COMMAND_NAME, start, end);
        }
        return emit(SyntaxKind.COMMAND_NAME, start, end + 1);
    }

    private SyntaxToken emit(SyntaxKind kind, int start, int end) {
        position = end;
        return new SyntaxToken(kind, source.substring(start, end), start);
    }

    private static boolean isCommandLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '@';
    }

    private static boolean isSpecial(char c) {
        if (Character.isWhitespace(c)) {
            return true;
        }
        switch (c) {
            case '%':
            case '\\':
            case '{':
            case '}':
            case '[':
            case ']':
            case '(':
            case ')':
            case ',':
            case '=':
            case '$':
                return true;
            default:
                return false;
        }
    }
}
