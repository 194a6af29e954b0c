package com.texformatter.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Error tolerant recursive descent parser for LaTeX documents.
 *
 * <p>The parser never fails: unbalanced input is recorded as {@link SyntaxError}s and the
 * resulting tree still covers every character of the source.
 */
public class LatexParser {
    private static final int LOOKAHEAD_LIMIT = 256;

    private final LatexLexer lexer;
    private final List<SyntaxError> errors = new ArrayList<>();

    private LatexParser(String source) {
        this.lexer = new LatexLexer(source);
    }

    public static SyntaxTree parse(String source) {
        LatexParser parser = new LatexParser(source);
        SyntaxNode root = new SyntaxNode(SyntaxKind.ROOT, parser.parseContent(Scope.root()));
        return new SyntaxTree(source, root, parser.errors);
    }

    private enum ScopeKind {
        ROOT, CURLY, BRACK, ENVIRONMENT, SECTION, ITEM, FORMULA, MIXED
    }

    /**
     * Where the parser currently is; decides which tokens end the current content run.
     */
    private static final class Scope {
        final ScopeKind kind;
        final boolean math;
        final int sectionLevel;

        private Scope(ScopeKind kind, boolean math, int sectionLevel) {
            this.kind = kind;
            this.math = math;
            this.sectionLevel = sectionLevel;
        }

        static Scope root() {
            return new Scope(ScopeKind.ROOT, false, -1);
        }

        static Scope of(ScopeKind kind, boolean math) {
            return new Scope(kind, math, -1);
        }

        static Scope section(int level) {
            return new Scope(ScopeKind.SECTION, false, level);
        }
    }

    private List<SyntaxElement> parseContent(Scope scope) {
        List<SyntaxElement> children = new ArrayList<>();
        while (!isStop(scope, lexer.peek())) {
            children.add(parseElement(scope));
        }
        return children;
    }

    private boolean isStop(Scope scope, SyntaxToken token) {
        if (token == null) {
            return true;
        }
        if (scope.kind == ScopeKind.ROOT) {
            return false;
        }
        if (token.kind() == SyntaxKind.R_CURLY || isCommand(token, "\\end")) {
            return true;
        }
        if (scope.math && isFormulaDelimiter(token)) {
            return true;
        }
        switch (scope.kind) {
            case BRACK:
                return token.kind() == SyntaxKind.R_BRACK;
            case MIXED:
                return token.kind() == SyntaxKind.R_BRACK || token.kind() == SyntaxKind.R_PAREN;
            case ITEM:
                return isCommand(token, "\\item");
            case SECTION: {
                if (isCommand(token, "\\item")) {
                    return true;
                }
                SyntaxKind section = token.kind() == SyntaxKind.COMMAND_NAME
                        ? LatexCommands.sectionKind(token.text())
                        : null;
                return section != null && section.sectionLevel() <= scope.sectionLevel;
            }
            default:
                return false;
        }
    }

    private SyntaxElement parseElement(Scope scope) {
        SyntaxToken token = lexer.peek();
        switch (token.kind()) {
            case WHITESPACE:
            case COMMENT:
                return lexer.next();
            case R_CURLY: {
                SyntaxToken brace = lexer.next();
                errors.add(new SyntaxError("Unmatched closing brace", brace.getOffset()));
                return node(SyntaxKind.ERROR, brace);
            }
            case L_CURLY:
                return parseCurlyGroup(scope.math);
            case DOLLAR:
                return parseFormula();
            case COMMAND_NAME:
                return parseCommand(scope);
            case L_PAREN:
            case L_BRACK:
                return scope.math ? parseMixedGroup() : parseText(scope);
            case EQUALITY_SIGN:
                return scope.math ? lexer.next() : parseText(scope);
            default:
                return parseText(scope);
        }
    }

    private SyntaxNode parseText(Scope scope) {
        List<SyntaxElement> tokens = new ArrayList<>();
        tokens.add(lexer.next());
        while (true) {
            SyntaxToken token = lexer.peek();
            if (isTextToken(scope, token)) {
                tokens.add(lexer.next());
            } else if (token != null && token.kind() == SyntaxKind.WHITESPACE
                    && isTextToken(scope, lexer.peek(1))) {
                tokens.add(lexer.next());
            } else {
                break;
            }
        }
        return new SyntaxNode(SyntaxKind.TEXT, tokens);
    }

    private boolean isTextToken(Scope scope, SyntaxToken token) {
        if (token == null || isStop(scope, token)) {
            return false;
        }
        switch (token.kind()) {
            case WORD:
            case COMMA:
                return true;
            case R_BRACK:
            case R_PAREN:
                return true;
            case L_BRACK:
            case L_PAREN:
            case EQUALITY_SIGN:
                return !scope.math;
            default:
                return false;
        }
    }

    // Groups

    private SyntaxNode parseCurlyGroup(boolean math) {
        List<SyntaxElement> children = new ArrayList<>();
        SyntaxToken open = lexer.next();
        children.add(open);
        children.addAll(parseContent(Scope.of(ScopeKind.CURLY, math)));
        expect(children, SyntaxKind.R_CURLY, "Unclosed brace group", open);
        return new SyntaxNode(SyntaxKind.CURLY_GROUP, children);
    }

    private SyntaxNode parseBrackGroup(boolean math) {
        List<SyntaxElement> children = new ArrayList<>();
        SyntaxToken open = lexer.next();
        children.add(open);
        children.addAll(parseContent(Scope.of(ScopeKind.BRACK, math)));
        expect(children, SyntaxKind.R_BRACK, "Unclosed bracket group", open);
        return new SyntaxNode(SyntaxKind.BRACK_GROUP, children);
    }

    private SyntaxNode parseMixedGroup() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        children.addAll(parseContent(Scope.of(ScopeKind.MIXED, true)));
        SyntaxToken close = lexer.peek();
        if (close != null && (close.kind() == SyntaxKind.R_PAREN || close.kind() == SyntaxKind.R_BRACK)) {
            children.add(lexer.next());
        }
        return new SyntaxNode(SyntaxKind.MIXED_GROUP, children);
    }

    /**
     * Parses a brace or bracket group holding a single word or a comma separated word list, or
     * falls back to an ordinary group when the content is not that simple.
     */
    private SyntaxNode parseWordGroup(SyntaxKind kind) {
        boolean curly = lexer.peek().kind() == SyntaxKind.L_CURLY;
        SyntaxKind closeKind = curly ? SyntaxKind.R_CURLY : SyntaxKind.R_BRACK;
        if (!isSimpleWordGroup(closeKind)) {
            return curly ? parseCurlyGroup(false) : parseBrackGroup(false);
        }
        boolean list = kind == SyntaxKind.CURLY_GROUP_WORD_LIST;
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        while (true) {
            SyntaxToken token = lexer.peek();
            if (token.kind() == closeKind) {
                children.add(lexer.next());
                break;
            }
            if (token.kind() == SyntaxKind.WHITESPACE || (list && token.kind() == SyntaxKind.COMMA)) {
                children.add(lexer.next());
            } else {
                children.add(parseKey(closeKind, list));
            }
        }
        return new SyntaxNode(kind, children);
    }

    private SyntaxNode parseKey(SyntaxKind closeKind, boolean stopAtComma) {
        List<SyntaxElement> tokens = new ArrayList<>();
        tokens.add(lexer.next());
        while (true) {
            SyntaxToken token = lexer.peek();
            if (isKeyToken(token, closeKind, stopAtComma)) {
                tokens.add(lexer.next());
            } else if (token.kind() == SyntaxKind.WHITESPACE
                    && isKeyToken(lexer.peek(1), closeKind, stopAtComma)) {
                tokens.add(lexer.next());
            } else {
                break;
            }
        }
        return new SyntaxNode(SyntaxKind.KEY, tokens);
    }

    private static boolean isKeyToken(SyntaxToken token, SyntaxKind closeKind, boolean stopAtComma) {
        return token != null
                && token.kind() != closeKind
                && token.kind() != SyntaxKind.WHITESPACE
                && !(stopAtComma && token.kind() == SyntaxKind.COMMA);
    }

    private boolean isSimpleWordGroup(SyntaxKind closeKind) {
        for (int i = 1; i < LOOKAHEAD_LIMIT; i++) {
            SyntaxToken token = lexer.peek(i);
            if (token == null) {
                return false;
            }
            if (token.kind() == closeKind) {
                return true;
            }
            switch (token.kind()) {
                case COMMENT:
                case DOLLAR:
                case L_CURLY:
                case R_CURLY:
                case VERBATIM:
                    return false;
                case L_BRACK:
                    if (closeKind == SyntaxKind.R_BRACK) {
                        return false;
                    }
                    break;
                case WHITESPACE:
                    if (token.isBlankLine()) {
                        return false;
                    }
                    break;
                case COMMAND_NAME:
                    if (!isPlainCommand(token)) {
                        return false;
                    }
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    private SyntaxNode parseKeyValueGroup() {
        if (!isSimpleKeyValueGroup()) {
            return parseBrackGroup(false);
        }
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        while (true) {
            SyntaxToken token = lexer.peek();
            if (token.kind() == SyntaxKind.R_BRACK) {
                children.add(lexer.next());
                break;
            }
            if (token.kind() == SyntaxKind.WHITESPACE || token.kind() == SyntaxKind.COMMA) {
                children.add(lexer.next());
            } else {
                children.add(parseKeyValuePair());
            }
        }
        return new SyntaxNode(SyntaxKind.BRACK_GROUP_KEY_VALUE, children);
    }

    private SyntaxNode parseKeyValuePair() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(new SyntaxNode(SyntaxKind.KEY, readValueTokens(true)));
        if (skipWhitespaceBefore(children, SyntaxKind.EQUALITY_SIGN)) {
            children.add(lexer.next());
            if (lexer.peek().kind() == SyntaxKind.WHITESPACE) {
                children.add(lexer.next());
            }
            children.add(new SyntaxNode(SyntaxKind.VALUE, readValueTokens(false)));
        }
        return new SyntaxNode(SyntaxKind.KEY_VALUE_PAIR, children);
    }

    /**
     * Reads a key or value up to the next top level comma or closing bracket, leaving trailing
     * whitespace alone.
     */
    private List<SyntaxElement> readValueTokens(boolean key) {
        List<SyntaxElement> tokens = new ArrayList<>();
        int depth = 0;
        int pending = 0;
        while (true) {
            SyntaxToken token = lexer.peek(pending);
            if (token.kind() == SyntaxKind.WHITESPACE) {
                pending++;
                continue;
            }
            if (depth == 0 && (token.kind() == SyntaxKind.COMMA || token.kind() == SyntaxKind.R_BRACK
                    || (key && token.kind() == SyntaxKind.EQUALITY_SIGN))) {
                break;
            }
            if (token.kind() == SyntaxKind.L_CURLY) {
                depth++;
            } else if (token.kind() == SyntaxKind.R_CURLY) {
                depth--;
            }
            for (int i = 0; i <= pending; i++) {
                tokens.add(lexer.next());
            }
            pending = 0;
        }
        return tokens;
    }

    private boolean isSimpleKeyValueGroup() {
        int depth = 0;
        for (int i = 1; i < LOOKAHEAD_LIMIT; i++) {
            SyntaxToken token = lexer.peek(i);
            if (token == null) {
                return false;
            }
            switch (token.kind()) {
                case R_BRACK:
                    if (depth == 0) {
                        return true;
                    }
                    break;
                case L_CURLY:
                    depth++;
                    break;
                case R_CURLY:
                    depth--;
                    if (depth < 0) {
                        return false;
                    }
                    break;
                case COMMENT:
                case DOLLAR:
                case L_BRACK:
                case VERBATIM:
                    return false;
                case WHITESPACE:
                    if (token.isBlankLine()) {
                        return false;
                    }
                    break;
                case COMMAND_NAME:
                    if (!isPlainCommand(token)) {
                        return false;
                    }
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    // Commands

    private SyntaxElement parseCommand(Scope scope) {
        SyntaxToken token = lexer.peek();
        String name = token.text();

        if (name.equals("\\begin")) {
            return parseEnvironment(scope);
        }
        if (name.equals("\\end")) {
            errors.add(new SyntaxError("Unexpected \\end without matching \\begin", token.getOffset()));
            return node(SyntaxKind.ERROR, parseEnd());
        }
        if (name.equals("\\verb") || name.equals("\\verb*")) {
            return parseVerb();
        }
        if (LatexCommands.URL_COMMANDS.contains(name)) {
            return parseUrl();
        }
        if (name.equals("\\label")) {
            return parseWordCommand(SyntaxKind.LABEL_DEFINITION, SyntaxKind.CURLY_GROUP_WORD);
        }
        if (LatexCommands.LABEL_REFERENCES.contains(name)) {
            return parseWordCommand(SyntaxKind.LABEL_REFERENCE, SyntaxKind.CURLY_GROUP_WORD_LIST);
        }
        if (LatexCommands.CITATIONS.contains(name)) {
            return parseCitation();
        }

        if (scope.math) {
            if (LatexCommands.DELIMITER_COMMANDS.contains(name)) {
                return node(SyntaxKind.GENERIC_COMMAND, lexer.next());
            }
            boolean textMode = LatexCommands.TEXT_MODE_COMMANDS.contains(name);
            return parseGenericCommand(!textMode);
        }

        if (name.equals("\\(")) {
            return parseDelimitedFormula(SyntaxKind.FORMULA, "\\)");
        }
        if (name.equals("\\[")) {
            return parseDelimitedFormula(SyntaxKind.EQUATION, "\\]");
        }
        if (name.equals("\\item")) {
            return parseItem();
        }
        SyntaxKind section = LatexCommands.sectionKind(name);
        if (section != null && hasTitleAhead()) {
            return parseSection(section);
        }
        if (name.equals("\\documentclass")) {
            return parseInclude(SyntaxKind.CLASS_INCLUDE);
        }
        if (LatexCommands.PACKAGE_INCLUDES.contains(name)) {
            return parseInclude(SyntaxKind.PACKAGE_INCLUDE);
        }
        if (LatexCommands.COMMAND_DEFINITIONS.contains(name)) {
            return parseCommandDefinition();
        }
        if (LatexCommands.ENVIRONMENT_DEFINITIONS.contains(name)) {
            return parseEnvironmentDefinition();
        }
        return parseGenericCommand(false);
    }

    private SyntaxNode parseGenericCommand(boolean math) {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        parseArguments(children, math);
        return new SyntaxNode(SyntaxKind.GENERIC_COMMAND, children);
    }

    /**
     * Adjacent {@code [..]} options (only before the first brace group) and {@code {..}}
     * arguments. In math mode whitespace may separate brace arguments from the command.
     */
    private void parseArguments(List<SyntaxElement> children, boolean math) {
        boolean seenCurly = false;
        while (true) {
            SyntaxToken token = lexer.peek();
            if (token == null) {
                return;
            }
            if (token.kind() == SyntaxKind.L_BRACK && !seenCurly) {
                children.add(parseBrackGroup(math));
            } else if (token.kind() == SyntaxKind.L_CURLY
                    || (math && skipWhitespaceBefore(children, SyntaxKind.L_CURLY))) {
                children.add(parseCurlyGroup(math));
                seenCurly = true;
            } else {
                return;
            }
        }
    }

    private SyntaxNode parseVerb() {
        List<SyntaxElement> children = new ArrayList<>();
        SyntaxToken name = lexer.next();
        children.add(name);
        SyntaxToken body = lexer.readDelimited();
        if (body == null) {
            errors.add(new SyntaxError("Unterminated \\verb", name.getOffset()));
        } else {
            children.add(body);
        }
        return new SyntaxNode(SyntaxKind.GENERIC_COMMAND, children);
    }

    private SyntaxNode parseUrl() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        SyntaxToken open = lexer.peek();
        if (open != null && open.kind() == SyntaxKind.L_CURLY) {
            List<SyntaxElement> group = new ArrayList<>();
            group.add(lexer.next());
            SyntaxToken body = lexer.readRawBalanced();
            if (body != null) {
                group.add(body);
            }
            expect(group, SyntaxKind.R_CURLY, "Unclosed brace group", open);
            children.add(new SyntaxNode(SyntaxKind.CURLY_GROUP, group));
        }
        parseArguments(children, false);
        return new SyntaxNode(SyntaxKind.GENERIC_COMMAND, children);
    }

    private SyntaxNode parseWordCommand(SyntaxKind kind, SyntaxKind groupKind) {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(parseWordGroup(groupKind));
        }
        return new SyntaxNode(kind, children);
    }

    private SyntaxNode parseCitation() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        for (int i = 0; i < 2 && skipWhitespaceBefore(children, SyntaxKind.L_BRACK); i++) {
            children.add(parseBrackGroup(false));
        }
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(parseWordGroup(SyntaxKind.CURLY_GROUP_WORD_LIST));
        }
        return new SyntaxNode(SyntaxKind.CITATION, children);
    }

    private SyntaxNode parseInclude(SyntaxKind kind) {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_BRACK)) {
            children.add(parseKeyValueGroup());
        }
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(parseWordGroup(SyntaxKind.CURLY_GROUP_WORD_LIST));
        }
        return new SyntaxNode(kind, children);
    }

    private SyntaxNode parseCommandDefinition() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(isBracedCommandName() ? parseBracedCommandName() : parseCurlyGroup(false));
        } else if (skipWhitespaceBefore(children, SyntaxKind.COMMAND_NAME)) {
            children.add(node(SyntaxKind.CURLY_GROUP_COMMAND, lexer.next()));
        }
        parseDefinitionTail(children, 1);
        return new SyntaxNode(SyntaxKind.NEW_COMMAND_DEFINITION, children);
    }

    private SyntaxNode parseEnvironmentDefinition() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(parseWordGroup(SyntaxKind.CURLY_GROUP_WORD));
        }
        parseDefinitionTail(children, 2);
        return new SyntaxNode(SyntaxKind.NEW_COMMAND_DEFINITION, children);
    }

    /**
     * Optional argument count, optional default value and the replacement text bodies.
     */
    private void parseDefinitionTail(List<SyntaxElement> children, int bodies) {
        if (skipWhitespaceBefore(children, SyntaxKind.L_BRACK)) {
            children.add(parseWordGroup(SyntaxKind.BRACK_GROUP_WORD));
        }
        if (skipWhitespaceBefore(children, SyntaxKind.L_BRACK)) {
            children.add(parseBrackGroup(false));
        }
        for (int i = 0; i < bodies && skipWhitespaceBefore(children, SyntaxKind.L_CURLY); i++) {
            children.add(parseCurlyGroup(false));
        }
    }

    private boolean isBracedCommandName() {
        int i = 1;
        if (kindAt(i) == SyntaxKind.WHITESPACE) {
            i++;
        }
        if (kindAt(i) != SyntaxKind.COMMAND_NAME) {
            return false;
        }
        i++;
        if (kindAt(i) == SyntaxKind.WHITESPACE) {
            i++;
        }
        return kindAt(i) == SyntaxKind.R_CURLY;
    }

    private SyntaxNode parseBracedCommandName() {
        List<SyntaxElement> children = new ArrayList<>();
        while (lexer.peek().kind() != SyntaxKind.R_CURLY) {
            children.add(lexer.next());
        }
        children.add(lexer.next());
        return new SyntaxNode(SyntaxKind.CURLY_GROUP_COMMAND, children);
    }

    // Structure

    private SyntaxNode parseEnvironment(Scope scope) {
        List<SyntaxElement> children = new ArrayList<>();
        SyntaxToken beginToken = lexer.peek();
        SyntaxNode begin = parseBegin();
        children.add(begin);
        String name = environmentName(begin);
        if (name == null) {
            errors.add(new SyntaxError("Missing environment name after \\begin", beginToken.getOffset()));
            return new SyntaxNode(SyntaxKind.ENVIRONMENT, children);
        }

        if (LatexCommands.VERBATIM_ENVIRONMENTS.contains(name)) {
            SyntaxToken body = lexer.readRawUntil("\\end{" + name + "}");
            if (body != null) {
                children.add(body);
            }
        } else {
            boolean math = scope.math || LatexCommands.MATH_ENVIRONMENTS.contains(name);
            children.addAll(parseContent(Scope.of(ScopeKind.ENVIRONMENT, math)));
        }

        SyntaxToken endToken = lexer.peek();
        if (isCommand(endToken, "\\end")) {
            SyntaxNode end = parseEnd();
            String endName = environmentName(end);
            if (!name.equals(endName)) {
                errors.add(new SyntaxError("Environment \\begin{" + name + "} closed by \\end{"
                        + endName + "}", endToken.getOffset()));
            }
            children.add(end);
        } else {
            errors.add(new SyntaxError("Unclosed environment \\begin{" + name + "}", beginToken.getOffset()));
        }
        return new SyntaxNode(SyntaxKind.ENVIRONMENT, children);
    }

    private SyntaxNode parseBegin() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(parseWordGroup(SyntaxKind.CURLY_GROUP_WORD));
            parseArguments(children, false);
        }
        return new SyntaxNode(SyntaxKind.BEGIN, children);
    }

    private SyntaxNode parseEnd() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(parseWordGroup(SyntaxKind.CURLY_GROUP_WORD));
        }
        return new SyntaxNode(SyntaxKind.END, children);
    }

    /**
     * Name written in the first group of a {@code \begin} or {@code \end} node.
     */
    public static String environmentName(SyntaxNode beginOrEnd) {
        for (SyntaxNode child : beginOrEnd.children()) {
            if (child.kind() == SyntaxKind.CURLY_GROUP_WORD || child.kind() == SyntaxKind.CURLY_GROUP) {
                String text = child.text();
                int close = text.endsWith("}") ? text.length() - 1 : text.length();
                return text.substring(1, close).trim();
            }
        }
        return null;
    }

    private SyntaxNode parseSection(SyntaxKind kind) {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_BRACK)) {
            children.add(parseBrackGroup(false));
        }
        if (skipWhitespaceBefore(children, SyntaxKind.L_CURLY)) {
            children.add(parseCurlyGroup(false));
        }
        children.addAll(parseContent(Scope.section(kind.sectionLevel())));
        return new SyntaxNode(kind, children);
    }

    private boolean hasTitleAhead() {
        int i = 1;
        if (isInlineWhitespace(lexer.peek(i))) {
            i++;
        }
        if (kindAt(i) == SyntaxKind.L_BRACK) {
            int depth = 0;
            for (; i < LOOKAHEAD_LIMIT; i++) {
                SyntaxKind kind = kindAt(i);
                if (kind == null) {
                    return false;
                }
                if (kind == SyntaxKind.L_BRACK) {
                    depth++;
                } else if (kind == SyntaxKind.R_BRACK && --depth == 0) {
                    break;
                }
            }
            if (i >= LOOKAHEAD_LIMIT) {
                return false;
            }
            i++;
            if (isInlineWhitespace(lexer.peek(i))) {
                i++;
            }
        }
        return kindAt(i) == SyntaxKind.L_CURLY;
    }

    private SyntaxNode parseItem() {
        List<SyntaxElement> children = new ArrayList<>();
        children.add(lexer.next());
        if (skipWhitespaceBefore(children, SyntaxKind.L_BRACK)) {
            children.add(parseBrackGroup(false));
        }
        children.addAll(parseContent(Scope.of(ScopeKind.ITEM, false)));
        return new SyntaxNode(SyntaxKind.ENUM_ITEM, children);
    }

    private SyntaxNode parseFormula() {
        SyntaxToken open = lexer.peek();
        boolean display = open.text().equals("$$");
        return parseDelimitedFormula(display ? SyntaxKind.EQUATION : SyntaxKind.FORMULA, open.text());
    }

    private SyntaxNode parseDelimitedFormula(SyntaxKind kind, String closer) {
        List<SyntaxElement> children = new ArrayList<>();
        SyntaxToken open = lexer.next();
        children.add(open);
        children.addAll(parseContent(Scope.of(ScopeKind.FORMULA, true)));
        SyntaxToken close = lexer.peek();
        if (close != null && isFormulaDelimiter(close) && close.text().equals(closer)) {
            children.add(lexer.next());
        } else {
            errors.add(new SyntaxError("Unclosed formula, expected " + closer, open.getOffset()));
        }
        return new SyntaxNode(kind, children);
    }

    // Helpers

    /**
     * Consumes a single whitespace token (never a blank line) when the token after it has the
     * wanted kind.
     *
     * @return whether the next token now has the wanted kind
     */
    private boolean skipWhitespaceBefore(List<SyntaxElement> children, SyntaxKind kind) {
        if (kindAt(0) == kind) {
            return true;
        }
        if (isInlineWhitespace(lexer.peek(0)) && kindAt(1) == kind) {
            children.add(lexer.next());
            return true;
        }
        return false;
    }

    private void expect(List<SyntaxElement> children, SyntaxKind kind, String message, SyntaxToken open) {
        SyntaxToken token = lexer.peek();
        if (token != null && token.kind() == kind) {
            children.add(lexer.next());
        } else {
            errors.add(new SyntaxError(message, open.getOffset()));
        }
    }

    private SyntaxKind kindAt(int k) {
        SyntaxToken token = lexer.peek(k);
        return token == null ? null : token.kind();
    }

    private static boolean isInlineWhitespace(SyntaxToken token) {
        return token != null && token.kind() == SyntaxKind.WHITESPACE && !token.isBlankLine();
    }

    private static boolean isCommand(SyntaxToken token, String name) {
        return token != null && token.kind() == SyntaxKind.COMMAND_NAME && token.text().equals(name);
    }

    private static boolean isFormulaDelimiter(SyntaxToken token) {
        return token.kind() == SyntaxKind.DOLLAR || isCommand(token, "\\)") || isCommand(token, "\\]");
    }

    private static boolean isPlainCommand(SyntaxToken token) {
        String name = token.text();
        return !name.startsWith("\\verb") && !name.equals("\\begin") && !name.equals("\\end")
                && !LatexCommands.URL_COMMANDS.contains(name);
    }

    private static SyntaxNode node(SyntaxKind kind, SyntaxElement... children) {
        return new SyntaxNode(kind, List.of(children));
    }
}
