package com.texformatter.layout.math;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A node of the math formatting tree. Spacing inside formulas follows different rules than
 * prose, so math content has its own closed set of variants.
 */
public sealed interface MathNode permits MathParent, MathCommand, MathEnvironment, MathText,
        MathCurlyGroup, MathBracketGroup, MathMixedGroup {

    MathKind kind();

    List<String> format(Budget budget);
}
