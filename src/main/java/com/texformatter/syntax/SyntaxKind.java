package com.texformatter.syntax;

/**
 * Kinds of the nodes and tokens that make up a LaTeX syntax tree.
 */
public enum SyntaxKind {
    // Tokens
    WHITESPACE(true),
    COMMENT(true),
    COMMAND_NAME(true),
    WORD(true),
    COMMA(true),
    EQUALITY_SIGN(true),
    L_CURLY(true),
    R_CURLY(true),
    L_BRACK(true),
    R_BRACK(true),
    L_PAREN(true),
    R_PAREN(true),
    DOLLAR(true),
    VERBATIM(true),

    // Nodes
    ROOT(false),
    TEXT(false),
    KEY(false),
    VALUE(false),
    KEY_VALUE_PAIR(false),
    KEY_VALUE_BODY(false),
    GENERIC_COMMAND(false),
    CLASS_INCLUDE(false),
    PACKAGE_INCLUDE(false),
    NEW_COMMAND_DEFINITION(false),
    LABEL_DEFINITION(false),
    LABEL_REFERENCE(false),
    CITATION(false),
    CURLY_GROUP(false),
    CURLY_GROUP_WORD(false),
    CURLY_GROUP_WORD_LIST(false),
    CURLY_GROUP_COMMAND(false),
    BRACK_GROUP(false),
    BRACK_GROUP_WORD(false),
    BRACK_GROUP_KEY_VALUE(false),
    MIXED_GROUP(false),
    ENVIRONMENT(false),
    BEGIN(false),
    END(false),
    ENUM_ITEM(false),
    FORMULA(false),
    EQUATION(false),
    PART(false),
    CHAPTER(false),
    SECTION(false),
    SUBSECTION(false),
    SUBSUBSECTION(false),
    PARAGRAPH(false),
    SUBPARAGRAPH(false),
    ERROR(false);

    private final boolean token;

    SyntaxKind(boolean token) {
        this.token = token;
    }

    public boolean isToken() {
        return token;
    }

    /**
     * Whether this kind is one of the sectioning commands.
     */
    public boolean isSection() {
        return sectionLevel() >= 0;
    }

    /**
     * Nesting level of a sectioning kind, lower is more significant; -1 for other kinds.
     */
    public int sectionLevel() {
        return switch (this) {
            case PART -> 0;
            case CHAPTER -> 1;
            case SECTION -> 2;
            case SUBSECTION -> 3;
            case SUBSUBSECTION -> 4;
            case PARAGRAPH -> 5;
            case SUBPARAGRAPH -> 6;
            default -> -1;
        };
    }
}
