package com.texformatter.layout;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

final class LinesTest {

    @Test
    void guardProtectsLineEndingAtContent() {
        assertThat(Lines.guard("abc")).isEqualTo("abc%");
        assertThat(Lines.guard("abc ")).isEqualTo("abc");
        assertThat(Lines.guard("")).isEmpty();
        assertThat(Lines.guard("a % note")).isEqualTo("a % note");
    }

    @Test
    void escapedPercentIsNotAComment() {
        assertThat(Lines.commentStart("50\\% off % x")).isEqualTo(9);
        assertThat(Lines.hasComment("50\\% off")).isFalse();
        assertThat(Lines.endsWithGuard("abc%")).isTrue();
        assertThat(Lines.endsWithGuard("abc\\%")).isFalse();
    }

    @Test
    void guardLastDropsTrailingBlankLines() {
        assertThat(Lines.guardLast(List.of("a", "b", ""))).containsExactly("a", "b%");
        assertThat(Lines.guardLast(List.of("a % c"))).containsExactly("a % c");
        assertThat(Lines.guardLast(List.of())).isEmpty();
    }

    @Test
    void indentSkipsBlankLines() {
        assertThat(Lines.indent(List.of("a", "", "   "), "  ")).containsExactly("  a", "", "");
    }

    @Test
    void splitIgnoresEscapedSeparator() {
        assertThat(Lines.splitUnescaped("a & b \\& c & d", '&')).containsExactly("a ", " b \\& c ", " d");
        assertThat(Lines.containsUnescaped("x \\& y", '&')).isFalse();
        assertThat(Lines.containsUnescaped("x & y", '&')).isTrue();
    }
}
