package com.texformatter.layout.math;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.texformatter.layout.Budget;
import com.texformatter.syntax.LatexParser;
import com.texformatter.syntax.SyntaxElement;
import com.texformatter.syntax.SyntaxNode;

final class MathNodeBuilderTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "a+b    | a + b",
            "-x     | -x",
            "x,y    | x, y",
            "2*3    | 2 * 3",
            "a--b   | a -- b",
            "x      | x",
            "a  +  b| a + b",
    })
    void normalizesOperatorSpacing(String input, String expected) {
        assertThat(MathNodeBuilder.normalize(input)).isEqualTo(expected);
    }

    @Test
    void escapedOperatorIsNotSpaced() {
        assertThat(MathNodeBuilder.normalize("a\\+b")).isEqualTo("a\\+b");
    }

    @Test
    void commandArgumentsBecomeGroups() {
        SyntaxNode formula = LatexParser.parse("$\\frac{a}{b}$").getRoot().children().get(0);
        MathParent parent = MathNodeBuilder.buildParent(new ArrayList<SyntaxElement>(formula.children()));

        assertThat(parent.getChildren()).singleElement().isInstanceOfSatisfying(MathCommand.class, command -> {
            assertThat(command.getName()).isEqualTo("\\frac");
            assertThat(command.getArguments()).extracting(MathNode::kind)
                    .containsExactly(MathKind.CURLY_GROUP, MathKind.CURLY_GROUP);
        });
        assertThat(parent.format(Budget.root(2, 80))).containsExactly("\\frac{a}{b}");
    }

    @Test
    void environmentKeepsHeaderArguments() {
        SyntaxNode node = LatexParser.parse("\\begin{array}{cc}a\\end{array}").getRoot().children().get(0);
        MathEnvironment environment = MathNodeBuilder.buildEnvironment(node);

        assertThat(environment.getName()).isEqualTo("array");
        assertThat(environment.getArguments()).isEqualTo("{cc}");
        assertThat(environment.format(Budget.root(2, 80)))
                .containsExactly("\\begin{array}{cc}", "  a", "\\end{array}");
    }

    @Test
    void alignRowsArePadded() {
        SyntaxNode node = LatexParser.parse("\\begin{align}\na &= b \\\\\nc + d &= e\n\\end{align}")
                .getRoot().children().get(0);
        List<String> lines = MathNodeBuilder.buildEnvironment(node).format(Budget.root(2, 80));

        assertThat(lines).containsExactly(
                "\\begin{align}", "  a     & = b \\\\", "  c + d & = e", "\\end{align}");
    }
}
