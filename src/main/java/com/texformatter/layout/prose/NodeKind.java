package com.texformatter.layout.prose;

/**
 * Tag of every {@link TexNode} variant, used for dispatch in the packer.
 */
public enum NodeKind {
    PARENT,
    COMMAND,
    ENVIRONMENT,
    TEXT,
    KEY_VALUE,
    KEY_VALUE_LIST,
    CURLY_GROUP,
    BRACKET_GROUP,
    MIXED_GROUP,
    WORD_LIST,
    LIST_ITEM,
    FORMULA,
    SECTION,
    COMMENT,
    BLANK_LINE,
    VERBATIM
}
