package com.texformatter.layout.math;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.syntax.LatexCommands;
import com.texformatter.syntax.LatexParser;
import com.texformatter.syntax.SyntaxElement;
import com.texformatter.syntax.SyntaxKind;
import com.texformatter.syntax.SyntaxNode;
import com.texformatter.syntax.SyntaxToken;

/**
 * Builds the math formatting tree from the syntax nodes of a formula or math environment.
 */
public final class MathNodeBuilder {
    private static final String OPERATORS = "+-*/<>";

    private MathNodeBuilder() {
    }

    /**
     * Builds a parent from a list of syntax elements, dropping whitespace and empty text.
     */
    public static MathParent buildParent(List<SyntaxElement> elements) {
        List<MathNode> children = new ArrayList<>();
        for (SyntaxElement element : elements) {
            MathNode node = buildElement(element);
            if (node != null) {
                children.add(node);
            }
        }
        return new MathParent(children);
    }

    public static MathEnvironment buildEnvironment(SyntaxNode environment) {
        String name = "";
        StringBuilder arguments = new StringBuilder();
        List<SyntaxElement> body = new ArrayList<>();
        for (SyntaxElement child : environment.childrenWithTokens()) {
            if (child.kind() == SyntaxKind.BEGIN) {
                SyntaxNode begin = (SyntaxNode) child;
                String found = LatexParser.environmentName(begin);
                name = found == null ? "" : found;
                boolean afterName = false;
                for (SyntaxNode part : begin.children()) {
                    if (afterName) {
                        arguments.append(part.text());
                    } else if (part.kind() == SyntaxKind.CURLY_GROUP_WORD || part.kind() == SyntaxKind.CURLY_GROUP) {
                        afterName = true;
                    }
                }
            } else if (child.kind() != SyntaxKind.END) {
                body.add(child);
            }
        }
        return new MathEnvironment(name, arguments.toString(), buildParent(body));
    }

    private static MathNode buildElement(SyntaxElement element) {
        if (element instanceof SyntaxToken) {
            return buildToken((SyntaxToken) element);
        }
        SyntaxNode node = (SyntaxNode) element;
        switch (node.kind()) {
            case TEXT:
            case KEY:
                return text(normalize(collapse(node.text())));
            case GENERIC_COMMAND:
            case LABEL_DEFINITION:
            case LABEL_REFERENCE:
            case CITATION:
            case CLASS_INCLUDE:
            case PACKAGE_INCLUDE:
            case NEW_COMMAND_DEFINITION:
                return buildCommand(node);
            case CURLY_GROUP:
                return new MathCurlyGroup(buildParent(inner(node, SyntaxKind.L_CURLY, SyntaxKind.R_CURLY)));
            case BRACK_GROUP:
                return new MathBracketGroup(buildParent(inner(node, SyntaxKind.L_BRACK, SyntaxKind.R_BRACK)));
            case MIXED_GROUP:
                return buildMixedGroup(node);
            case ENVIRONMENT:
                if (node.hasToken(SyntaxKind.VERBATIM)) {
                    return new MathText(node.text());
                }
                return buildEnvironment(node);
            default:
                return text(node.text().trim());
        }
    }

    private static MathNode buildToken(SyntaxToken token) {
        switch (token.kind()) {
            case WHITESPACE:
                return null;
            case COMMENT:
                return new MathText(token.text(), true);
            default:
                return text(token.text().trim());
        }
    }

    private static MathNode buildCommand(SyntaxNode node) {
        String name = "";
        List<MathNode> arguments = new ArrayList<>();
        boolean raw = false;
        for (SyntaxElement child : node.childrenWithTokens()) {
            if (child.kind() == SyntaxKind.COMMAND_NAME && name.isEmpty()) {
                name = child.text();
                raw = LatexCommands.TEXT_MODE_COMMANDS.contains(name);
            } else if (child.kind() == SyntaxKind.WHITESPACE) {
                continue;
            } else if (raw || child.kind() == SyntaxKind.VERBATIM || isWordGroup(child.kind())) {
                arguments.add(new MathText(child.text()));
            } else {
                MathNode argument = buildElement(child);
                if (argument != null) {
                    arguments.add(argument);
                }
            }
        }
        return new MathCommand(name, arguments);
    }

    private static MathNode buildMixedGroup(SyntaxNode node) {
        List<SyntaxElement> children = node.childrenWithTokens();
        String open = children.get(0).text();
        SyntaxElement last = children.get(children.size() - 1);
        boolean closed = children.size() > 1
                && (last.kind() == SyntaxKind.R_PAREN || last.kind() == SyntaxKind.R_BRACK);
        String close = closed ? last.text() : "";
        List<SyntaxElement> body = children.subList(1, closed ? children.size() - 1 : children.size());
        return new MathMixedGroup(open, buildParent(body), close);
    }

    private static boolean isWordGroup(SyntaxKind kind) {
        return kind == SyntaxKind.CURLY_GROUP_WORD
                || kind == SyntaxKind.CURLY_GROUP_WORD_LIST
                || kind == SyntaxKind.CURLY_GROUP_COMMAND
                || kind == SyntaxKind.BRACK_GROUP_WORD
                || kind == SyntaxKind.BRACK_GROUP_KEY_VALUE;
    }

    private static List<SyntaxElement> inner(SyntaxNode group, SyntaxKind open, SyntaxKind close) {
        List<SyntaxElement> children = new ArrayList<>(group.childrenWithTokens());
        if (!children.isEmpty() && children.get(0).kind() == open) {
            children.remove(0);
        }
        if (!children.isEmpty() && children.get(children.size() - 1).kind() == close) {
            children.remove(children.size() - 1);
        }
        return children;
    }

    private static MathText text(String text) {
        return text.isEmpty() ? null : new MathText(text);
    }

    private static String collapse(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * Puts single spaces around binary operators and after commas. A leading sign stays attached
     * to its operand.
     */
    static String normalize(String text) {
        if (text.length() <= 1) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                sb.append(c).append(text.charAt(i + 1));
                i += 2;
            } else if (OPERATORS.indexOf(c) >= 0) {
                int end = i;
                while (end < text.length() && OPERATORS.indexOf(text.charAt(end)) >= 0) {
                    end++;
                }
                trimEnd(sb);
                if (sb.length() > 0) {
                    sb.append(' ').append(text, i, end).append(' ');
                } else {
                    sb.append(text, i, end);
                }
                i = skipSpaces(text, end);
            } else if (c == ',') {
                trimEnd(sb);
                sb.append(", ");
                i = skipSpaces(text, i + 1);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString().trim();
    }

    private static void trimEnd(StringBuilder sb) {
        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') {
            sb.setLength(sb.length() - 1);
        }
    }

    private static int skipSpaces(String text, int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        return i;
    }
}
