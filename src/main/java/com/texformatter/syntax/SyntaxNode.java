package com.texformatter.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An immutable interior node of the syntax tree. A node exclusively owns its children.
 */
public final class SyntaxNode implements SyntaxElement {
    private final SyntaxKind kind;
    private final List<SyntaxElement> children;

    public SyntaxNode(SyntaxKind kind, List<SyntaxElement> children) {
        if (kind.isToken()) {
            throw new IllegalArgumentException("Not a node kind: " + kind);
        }
        this.kind = kind;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode) {
                ((SyntaxNode) child).appendText(sb);
            } else {
                sb.append(child.text());
            }
        }
    }

    /**
     * All children, nodes and tokens, in source order.
     */
    public List<SyntaxElement> childrenWithTokens() {
        return children;
    }

    /**
     * Only the node children, in source order.
     */
    public List<SyntaxNode> children() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode) {
                nodes.add((SyntaxNode) child);
            }
        }
        return nodes;
    }

    public Optional<SyntaxNode> firstChild() {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode) {
                return Optional.of((SyntaxNode) child);
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> firstChild(SyntaxKind childKind) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode && child.kind() == childKind) {
                return Optional.of((SyntaxNode) child);
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxToken> firstToken() {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxToken) {
                return Optional.of((SyntaxToken) child);
            }
            Optional<SyntaxToken> nested = ((SyntaxNode) child).firstToken();
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxToken> lastToken() {
        for (int i = children.size() - 1; i >= 0; i--) {
            SyntaxElement child = children.get(i);
            if (child instanceof SyntaxToken) {
                return Optional.of((SyntaxToken) child);
            }
            Optional<SyntaxToken> nested = ((SyntaxNode) child).lastToken();
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the direct children contain a token of the given kind.
     */
    public boolean hasToken(SyntaxKind tokenKind) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxToken && child.kind() == tokenKind) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return kind + " " + text().replace("\n", "\\n");
    }
}
