package com.texformatter.syntax;

/**
 * A child of a {@link SyntaxNode}: either a nested node or a token.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {
    SyntaxKind kind();

    /**
     * The exact source text covered by this element.
     */
    String text();
}
