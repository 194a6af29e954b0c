package com.texformatter.layout.math;

/**
 * Tag of every {@link MathNode} variant.
 */
public enum MathKind {
    PARENT,
    COMMAND,
    ENVIRONMENT,
    TEXT,
    CURLY_GROUP,
    BRACKET_GROUP,
    MIXED_GROUP
}
