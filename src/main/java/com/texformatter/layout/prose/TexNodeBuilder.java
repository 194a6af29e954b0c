package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.texformatter.layout.math.MathNodeBuilder;
import com.texformatter.syntax.LatexCommands;
import com.texformatter.syntax.LatexParser;
import com.texformatter.syntax.SyntaxElement;
import com.texformatter.syntax.SyntaxKind;
import com.texformatter.syntax.SyntaxNode;
import com.texformatter.syntax.SyntaxToken;

/**
 * Translates syntax nodes into the prose formatting tree.
 *
 * <p>Every syntax kind maps to some node; kinds without a rendering of their own become an
 * empty {@link TextNode} so that formatting never fails.
 */
public final class TexNodeBuilder {
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("[ \\t\\r\\f]*\\n[ \\t\\r\\f]*\\n\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TIGHT_COMMA = Pattern.compile(",(?=\\S)");

    private TexNodeBuilder() {
    }

    public static TexNode build(SyntaxNode node) {
        switch (node.kind()) {
            case ROOT:
                return buildParent(node.childrenWithTokens(), false);
            case PART:
            case CHAPTER:
            case SECTION:
            case SUBSECTION:
            case SUBSUBSECTION:
            case PARAGRAPH:
            case SUBPARAGRAPH:
                return buildSection(node);
            case GENERIC_COMMAND:
            case CLASS_INCLUDE:
            case PACKAGE_INCLUDE:
            case NEW_COMMAND_DEFINITION:
            case LABEL_DEFINITION:
            case LABEL_REFERENCE:
            case CITATION:
                return buildCommand(node);
            case ENVIRONMENT:
                return buildEnvironment(node);
            case TEXT: {
                List<TexNode> pieces = splitText(node.text(), false);
                if (pieces.size() == 1 && pieces.get(0).kind() == NodeKind.TEXT) {
                    return pieces.get(0);
                }
                return new ParentNode(pieces);
            }
            case KEY:
                return new TextNode(collapse(node.text()));
            case ERROR:
                return new TextNode(node.text().trim());
            case CURLY_GROUP:
                if (node.hasToken(SyntaxKind.VERBATIM)) {
                    return new VerbatimNode(node.text(), false);
                }
                return new CurlyGroupNode(buildParent(inner(node), false));
            case BRACK_GROUP:
                return new BracketGroupNode(buildParent(inner(node), true));
            case BRACK_GROUP_KEY_VALUE:
                return buildKeyValueList(node);
            case BRACK_GROUP_WORD:
                return new WordListNode("[", "]", words(node));
            case CURLY_GROUP_WORD:
            case CURLY_GROUP_WORD_LIST:
                return new WordListNode("{", "}", words(node));
            case CURLY_GROUP_COMMAND: {
                String name = "";
                for (SyntaxElement child : node.childrenWithTokens()) {
                    if (child.kind() == SyntaxKind.COMMAND_NAME) {
                        name = child.text();
                    }
                }
                if (node.hasToken(SyntaxKind.L_CURLY)) {
                    return new WordListNode("{", "}", List.of(name));
                }
                return new TextNode(name);
            }
            case KEY_VALUE_PAIR:
                return buildKeyValue(node);
            case MIXED_GROUP:
                return buildMixedGroup(node);
            case ENUM_ITEM:
                return new ListItemNode(buildParent(afterName(node), false));
            case FORMULA:
            case EQUATION:
                return buildFormula(node);
            default:
                return new TextNode("");
        }
    }

    /**
     * Builds a parent from a list of children, turning whitespace containing an empty line into
     * {@link BlankLineNode}s and keeping comments with the information whether they were glued to
     * the preceding content.
     */
    static ParentNode buildParent(List<SyntaxElement> elements, boolean normalizeCommas) {
        List<TexNode> children = new ArrayList<>();
        SyntaxElement previous = null;
        for (SyntaxElement element : elements) {
            if (element instanceof SyntaxToken) {
                SyntaxToken token = (SyntaxToken) element;
                switch (token.kind()) {
                    case WHITESPACE:
                        if (token.isBlankLine()) {
                            children.add(BlankLineNode.INSTANCE);
                        }
                        break;
                    case COMMENT: {
                        boolean attached = previous != null && previous.kind() != SyntaxKind.WHITESPACE;
                        children.add(new CommentNode(token.text(), attached));
                        break;
                    }
                    case VERBATIM:
                        children.add(new VerbatimNode(token.text(), false));
                        break;
                    default:
                        children.add(new TextNode(token.text()));
                        break;
                }
            } else if (element.kind() == SyntaxKind.TEXT) {
                children.addAll(splitText(element.text(), normalizeCommas));
            } else {
                children.add(build((SyntaxNode) element));
            }
            previous = element;
        }
        return new ParentNode(children);
    }

    private static List<TexNode> splitText(String text, boolean normalizeCommas) {
        List<TexNode> pieces = new ArrayList<>();
        String[] paragraphs = PARAGRAPH_BREAK.split(text, -1);
        for (int i = 0; i < paragraphs.length; i++) {
            if (i > 0) {
                pieces.add(BlankLineNode.INSTANCE);
            }
            String piece = collapse(paragraphs[i]);
            if (normalizeCommas) {
                piece = TIGHT_COMMA.matcher(piece).replaceAll(", ");
            }
            if (!piece.isEmpty()) {
                pieces.add(new TextNode(piece));
            }
        }
        return pieces;
    }

    private static TexNode buildSection(SyntaxNode node) {
        String command = "";
        TexNode shortTitle = null;
        TexNode title = null;
        List<SyntaxElement> body = new ArrayList<>();
        for (SyntaxElement child : node.childrenWithTokens()) {
            if (title != null) {
                body.add(child);
            } else if (child.kind() == SyntaxKind.COMMAND_NAME) {
                command = child.text();
            } else if (child.kind() == SyntaxKind.BRACK_GROUP) {
                shortTitle = build((SyntaxNode) child);
            } else if (child.kind() == SyntaxKind.CURLY_GROUP) {
                title = build((SyntaxNode) child);
            }
        }
        if (title == null) {
            return new CommandNode(command, shortTitle == null ? List.of() : List.of(shortTitle));
        }
        return new SectionNode(command, shortTitle, title, buildParent(body, false));
    }

    private static TexNode buildCommand(SyntaxNode node) {
        if (node.hasToken(SyntaxKind.VERBATIM)) {
            return new VerbatimNode(node.text(), false);
        }
        String name = "";
        List<TexNode> arguments = new ArrayList<>();
        for (SyntaxElement child : node.childrenWithTokens()) {
            if (child.kind() == SyntaxKind.COMMAND_NAME && name.isEmpty()) {
                name = child.text();
            } else if (child instanceof SyntaxNode) {
                arguments.add(build((SyntaxNode) child));
            }
        }
        return new CommandNode(name, arguments);
    }

    private static TexNode buildEnvironment(SyntaxNode node) {
        SyntaxNode begin = node.firstChild(SyntaxKind.BEGIN).orElse(null);
        String name = begin == null ? null : LatexParser.environmentName(begin);
        if (name == null) {
            return new TextNode(collapse(node.text()));
        }
        if (node.hasToken(SyntaxKind.VERBATIM) || LatexCommands.VERBATIM_ENVIRONMENTS.contains(name)) {
            return new VerbatimNode(node.text(), true);
        }
        if (LatexCommands.MATH_ENVIRONMENTS.contains(name)) {
            return new MathEnvironmentNode(MathNodeBuilder.buildEnvironment(node));
        }

        List<TexNode> arguments = new ArrayList<>();
        boolean afterName = false;
        for (SyntaxNode part : begin.children()) {
            if (afterName) {
                arguments.add(build(part));
            } else if (part.kind() == SyntaxKind.CURLY_GROUP_WORD || part.kind() == SyntaxKind.CURLY_GROUP) {
                afterName = true;
            }
        }
        List<SyntaxElement> body = new ArrayList<>();
        for (SyntaxElement child : node.childrenWithTokens()) {
            if (child.kind() != SyntaxKind.BEGIN && child.kind() != SyntaxKind.END) {
                body.add(child);
            }
        }
        return new ProseEnvironment(name, arguments, buildParent(body, false));
    }

    private static TexNode buildKeyValueList(SyntaxNode node) {
        List<TexNode> entries = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            entries.add(build(child));
        }
        return new KeyValueListNode(entries);
    }

    private static TexNode buildKeyValue(SyntaxNode node) {
        String key = node.firstChild(SyntaxKind.KEY).map(k -> collapse(k.text())).orElse("");
        String value = node.firstChild(SyntaxKind.VALUE).map(v -> collapse(v.text())).orElse(null);
        if (value == null && node.hasToken(SyntaxKind.EQUALITY_SIGN)) {
            value = "";
        }
        return new KeyValueNode(key, value);
    }

    private static TexNode buildMixedGroup(SyntaxNode node) {
        List<SyntaxElement> children = node.childrenWithTokens();
        String open = children.get(0).text();
        SyntaxElement last = children.get(children.size() - 1);
        boolean closed = children.size() > 1
                && (last.kind() == SyntaxKind.R_PAREN || last.kind() == SyntaxKind.R_BRACK);
        List<SyntaxElement> body = children.subList(1, closed ? children.size() - 1 : children.size());
        return new MixedGroupNode(open, buildParent(body, true), closed ? last.text() : "");
    }

    private static TexNode buildFormula(SyntaxNode node) {
        List<SyntaxElement> children = new ArrayList<>(node.childrenWithTokens());
        if (!children.isEmpty() && isFormulaDelimiter(children.get(0))) {
            children.remove(0);
        }
        if (!children.isEmpty() && isFormulaDelimiter(children.get(children.size() - 1))) {
            children.remove(children.size() - 1);
        }
        return new FormulaNode(node.kind() == SyntaxKind.FORMULA, MathNodeBuilder.buildParent(children));
    }

    private static boolean isFormulaDelimiter(SyntaxElement element) {
        if (element.kind() == SyntaxKind.DOLLAR) {
            return true;
        }
        if (element.kind() != SyntaxKind.COMMAND_NAME) {
            return false;
        }
        String text = element.text();
        return text.equals("\\(") || text.equals("\\)") || text.equals("\\[") || text.equals("\\]");
    }

    private static List<String> words(SyntaxNode group) {
        List<String> words = new ArrayList<>();
        for (SyntaxNode child : group.children()) {
            String word = collapse(child.text());
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static List<SyntaxElement> inner(SyntaxNode group) {
        List<SyntaxElement> children = new ArrayList<>(group.childrenWithTokens());
        if (!children.isEmpty() && children.get(0) instanceof SyntaxToken
                && (children.get(0).kind() == SyntaxKind.L_CURLY || children.get(0).kind() == SyntaxKind.L_BRACK)) {
            children.remove(0);
        }
        int last = children.size() - 1;
        if (last >= 0 && children.get(last) instanceof SyntaxToken
                && (children.get(last).kind() == SyntaxKind.R_CURLY || children.get(last).kind() == SyntaxKind.R_BRACK)) {
            children.remove(last);
        }
        return children;
    }

    private static List<SyntaxElement> afterName(SyntaxNode node) {
        List<SyntaxElement> children = node.childrenWithTokens();
        return children.isEmpty() ? children : children.subList(1, children.size());
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
