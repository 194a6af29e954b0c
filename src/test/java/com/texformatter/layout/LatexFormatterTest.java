package com.texformatter.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class LatexFormatterTest {

    private final LatexFormatter formatter = new LatexFormatter();

    static Stream<Arguments> documents() {
        return Stream.of(
                Arguments.of("$E=mc^2$", "\\( E = mc^2 \\)"),
                Arguments.of("\\section{Introduction}This is the introduction.",
                        "\n\\section{Introduction}\n\nThis is the introduction."),
                Arguments.of("\\begin{itemize}\n\\item First\n\\item Second\n\\end{itemize}",
                        "\\begin{itemize}\n  \\item First\n  \\item Second\n\\end{itemize}"),
                Arguments.of("\\documentclass[a4paper,12pt]{article}", "\\documentclass[a4paper, 12pt]{article}"),
                Arguments.of("First paragraph.\n\n\n\nSecond paragraph.", "First paragraph.\n\nSecond paragraph."),
                Arguments.of("\\[ x \\]", "\\[\n  x\n\\]"),
                Arguments.of("$$x$$", "\\[\n  x\n\\]"),
                Arguments.of("\\LaTeX is nice", "\\LaTeX~is nice"),
                Arguments.of("Let $x$, then", "Let \\( x \\), then"),
                Arguments.of("$y=(a+b)$", "\\( y = (a + b) \\)"),
                Arguments.of("$f(x,y)=(a+b)^2$", "\\( f(x, y) = (a + b)^2 \\)"),
                Arguments.of("\\begin{align}\na &= b \\\\\nc + d &= e\n\\end{align}",
                        "\\begin{align}\n  a     & = b \\\\\n  c + d & = e\n\\end{align}"),
                Arguments.of("\\begin{theorem}[label=thm:example,another=option]\nThis is a theorem.\n\\end{theorem}",
                        "\\begin{theorem}[label=thm:example, another=option]\n  This is a theorem.\n\\end{theorem}"));
    }

    @ParameterizedTest
    @MethodSource("documents")
    void formatsDocument(String source, String expected) {
        assertThat(formatter.format(source)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "\\textbf{Hello, world!}",
            "First paragraph.\n\nSecond paragraph.",
            "text % comment\nmore",
            "text% comment\nmore",
            "See \\ref{fig} for details",
            "\\LaTeX.",
            "Use \\verb|x  y| here.",
            "See \\url{http://x.org/a%20b} now.",
            "\\begin{verbatim}\n  keep   this\n\tand {this\n\\end{verbatim}",
    })
    void leavesFormattedSourceAlone(String source) {
        assertThat(formatter.format(source)).isEqualTo(source);
    }

    static Stream<String> narrowDocuments() {
        return Stream.of(
                "Some text \\textbf{a very long argument that does not fit on one line at all here} after",
                "\\textbf{aaaa bbbb cccc dddd eeee ffff}",
                "\\begin{itemize}\\item aaa bbb ccc ddd eee fff ggg hhh iii jjj kkk\\item short\\end{itemize}",
                "\\begin{quote}\\begin{center}aaa bbb ccc ddd eee fff ggg hhh iii jjj\\end{center}\\end{quote}",
                "Text with \\emph{an emphasised phrase} and $a+b=c$ then more words to wrap");
    }

    @ParameterizedTest
    @MethodSource("documents")
    void delimitersStayBalanced(String source, String expected) {
        String formatted = formatter.format(source);

        assertThat(_count(formatted, '{')).isEqualTo(_count(source, '{'));
        assertThat(_count(formatted, '}')).isEqualTo(_count(source, '}'));
        assertThat(_count(formatted, '[')).isEqualTo(_count(source, '['));
        assertThat(_count(formatted, ']')).isEqualTo(_count(source, ']'));
    }

    @ParameterizedTest
    @MethodSource("narrowDocuments")
    void narrowDelimitersStayBalanced(String source) {
        String formatted = new LatexFormatter(2, 30).format(source);

        assertThat(_count(formatted, '{')).isEqualTo(_count(source, '{'));
        assertThat(_count(formatted, '}')).isEqualTo(_count(source, '}'));
    }

    @ParameterizedTest
    @MethodSource("documents")
    void formattingTwiceChangesNothing(String source, String expected) {
        String once = formatter.format(source);

        assertThat(formatter.format(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @MethodSource("narrowDocuments")
    void formattingTwiceChangesNothingWhenWrapped(String source) {
        LatexFormatter narrow = new LatexFormatter(2, 30);
        String once = narrow.format(source);

        assertThat(narrow.format(once)).isEqualTo(once);
    }

    @ParameterizedTest
    @MethodSource("narrowDocuments")
    void linesStayWithinWidth(String source) {
        for (String line : new LatexFormatter(2, 30).format(source).split("\n")) {
            String content = line.endsWith("%") ? line.substring(0, line.length() - 1) : line;
            assertThat(content.length() <= 30 || content.trim().indexOf(' ') < 0)
                    .as("line '%s'", line)
                    .isTrue();
        }
    }

    @Test
    void keepsArgumentOnLineWhenItBreaksAnyway() {
        LatexFormatter narrow = new LatexFormatter(2, 30);

        assertThat(narrow.format("Some text \\textbf{a very long argument that does not fit on one line at all here} after"))
                .isEqualTo("Some text \\textbf{\n"
                        + "  a very long argument that\n"
                        + "  does not fit on one line at\n"
                        + "  all here%\n"
                        + "} after");
    }

    @Test
    void movesArgumentThatFitsOnItsOwnLine() {
        LatexFormatter narrow = new LatexFormatter(2, 14);

        assertThat(narrow.format("aaaa \\textbf{bb}")).isEqualTo("aaaa\n\\textbf{bb}");
    }

    @Test
    void guardAtTinyWidthSurvivesReformatting() {
        LatexFormatter tiny = new LatexFormatter(2, 1);
        String once = tiny.format("\\foo{x}");

        assertThat(once).isEqualTo("\\foo{\n  x%\n}");
        assertThat(tiny.format(once)).isEqualTo(once);
    }

    @Test
    @Timeout(10)
    void deeplyNestedGroupsFormatQuickly() {
        LatexFormatter narrow = new LatexFormatter(2, 10);
        String source = "{".repeat(40) + "x" + "}".repeat(40);

        String once = narrow.format(source);
        String twice = narrow.format(once);

        assertThat(_count(twice, '{')).isEqualTo(40);
        assertThat(_count(twice, '}')).isEqualTo(40);
    }

    @Test
    void wrapsProseAtLineLength() {
        LatexFormatter narrow = new LatexFormatter(2, 20);

        assertThat(narrow.format("aaa bbb ccc ddd eee fff ggg")).isEqualTo("aaa bbb ccc ddd eee\nfff ggg");
    }

    @Test
    void guardsBreakBetweenCommands() {
        assertThat(new LatexFormatter(2, 6).format("\\foo\\bar")).isEqualTo("\\foo%\n\\bar");
    }

    @Test
    void expandsGroupThatDoesNotFit() {
        LatexFormatter narrow = new LatexFormatter(2, 30);

        assertThat(narrow.format("\\textbf{aaaa bbbb cccc dddd eeee ffff}"))
                .isEqualTo("\\textbf{\n  aaaa bbbb cccc dddd eeee\n  ffff%\n}");
    }

    @Test
    void emptyDocumentFormatsToEmptyText() {
        assertThat(formatter.format("")).isEmpty();
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> new LatexFormatter(-1, 80)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LatexFormatter(2, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Line length");
    }

    @Test
    void defaultsAreTwoAndEighty() {
        assertThat(formatter.getTabWidth()).isEqualTo(2);
        assertThat(formatter.getLineLength()).isEqualTo(80);
    }

    /**
     * Counts {@code c} outside control symbols such as {@code \\[} or {@code \\&}.
     */
    private static long _count(String text, char c) {
        long count = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i++;
            } else if (ch == c) {
                count++;
            }
        }
        return count;
    }
}
