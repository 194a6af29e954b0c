package com.texformatter.layout.math;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.texformatter.layout.Budget;

final class MathPackerTest {

    private static final Budget WIDE = Budget.root(2, 80);

    private static List<String> pack(MathNode... children) {
        return MathPacker.pack(List.of(children), WIDE);
    }

    @Test
    void commentEndsLine() {
        assertThat(pack(new MathText("a"), new MathText("% c", true), new MathText("b")))
                .containsExactly("a % c", "b");
    }

    @Test
    void functionCallStaysGlued() {
        MathMixedGroup call = new MathMixedGroup("(", new MathParent(List.of(new MathText("x"))), ")");

        assertThat(pack(new MathCommand("\\sin", List.of()), call)).containsExactly("\\sin(x)");
    }

    @Test
    void operatorBeforeParenthesisKeepsItsSpace() {
        MathMixedGroup sum = new MathMixedGroup("(", new MathParent(List.of(new MathText("a + b"))), ")");

        assertThat(pack(new MathText("y ="), sum)).containsExactly("y = (a + b)");
        assertThat(pack(new MathText("a +"), sum)).containsExactly("a + (a + b)");
        assertThat(pack(new MathText("x,"), sum)).containsExactly("x, (a + b)");
    }

    @Test
    void operandBeforeParenthesisStaysGlued() {
        MathMixedGroup argument = new MathMixedGroup("(", new MathParent(List.of(new MathText("x"))), ")");

        assertThat(pack(new MathText("f"), argument)).containsExactly("f(x)");
        assertThat(pack(new MathText("-"), argument)).containsExactly("-(x)");
    }

    @Test
    void alignmentRelationStaysGlued() {
        assertThat(pack(new MathText("a &"), new MathText("= b"))).containsExactly("a &= b");
    }

    @Test
    void superscriptGroupIsAttached() {
        MathCurlyGroup exponent = new MathCurlyGroup(new MathParent(List.of(new MathText("2"))));

        assertThat(pack(new MathText("x^"), exponent)).containsExactly("x^{2}");
    }

    @Test
    void rowBreakEndsLine() {
        assertThat(pack(new MathText("a"), new MathCommand("\\\\", List.of()), new MathText("b")))
                .containsExactly("a \\\\", "b");
    }

    @Test
    void breaksWhenLineIsFull() {
        List<String> lines = MathPacker.pack(List.of(new MathText("aaa"), new MathText("bbb")), Budget.root(2, 5));

        assertThat(lines).containsExactly("aaa", "bbb");
    }
}
