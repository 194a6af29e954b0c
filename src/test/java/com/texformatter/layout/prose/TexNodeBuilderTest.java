package com.texformatter.layout.prose;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.texformatter.syntax.LatexParser;

final class TexNodeBuilderTest {

    private static List<TexNode> children(String source) {
        TexNode root = TexNodeBuilder.build(LatexParser.parse(source).getRoot());
        assertThat(root).isInstanceOf(ParentNode.class);
        return ((ParentNode) root).getChildren();
    }

    private static TexNode single(String source) {
        List<TexNode> children = children(source);
        assertThat(children).hasSize(1);
        return children.get(0);
    }

    @Test
    void collapsesWhitespaceInText() {
        assertThat(single("Hello \t  world")).isInstanceOfSatisfying(TextNode.class,
                text -> assertThat(text.getText()).isEqualTo("Hello world"));
    }

    @Test
    void splitsParagraphsAtBlankLines() {
        assertThat(children("a\n\n  b")).extracting(TexNode::kind)
                .containsExactly(NodeKind.TEXT, NodeKind.BLANK_LINE, NodeKind.TEXT);
    }

    @Test
    void remembersWhetherCommentWasAttached() {
        assertThat(children("x % c").get(1)).isInstanceOfSatisfying(CommentNode.class,
                comment -> assertThat(comment.isAttached()).isFalse());
        assertThat(children("x% c").get(1)).isInstanceOfSatisfying(CommentNode.class,
                comment -> assertThat(comment.isAttached()).isTrue());
    }

    @Test
    void buildsPackageIncludeWithOptions() {
        TexNode node = single("\\usepackage[margin = 1in]{geometry}");

        assertThat(node).isInstanceOfSatisfying(CommandNode.class, command -> {
            assertThat(command.getName()).isEqualTo("\\usepackage");
            assertThat(command.getArguments()).extracting(TexNode::kind)
                    .containsExactly(NodeKind.KEY_VALUE_LIST, NodeKind.WORD_LIST);
        });
    }

    @Test
    void citationKeysBecomeWordList() {
        CommandNode citation = (CommandNode) single("\\cite{a,  b}");

        assertThat(citation.getArguments()).singleElement().isInstanceOfSatisfying(WordListNode.class,
                list -> assertThat(list.getWords()).containsExactly("a", "b"));
    }

    @Test
    void verbatimEnvironmentKeepsSource() {
        String source = "\\begin{verbatim}\n x  y\n\\end{verbatim}";

        assertThat(single(source)).isInstanceOfSatisfying(VerbatimNode.class, verbatim -> {
            assertThat(verbatim.isBlock()).isTrue();
            assertThat(verbatim.getText()).isEqualTo(source);
        });
    }

    @Test
    void mathEnvironmentsAreSeparated() {
        assertThat(single("\\begin{equation}x\\end{equation}")).isInstanceOfSatisfying(EnvironmentNode.class,
                environment -> assertThat(environment.isMath()).isTrue());
        assertThat(single("\\begin{center}x\\end{center}")).isInstanceOfSatisfying(ProseEnvironment.class,
                environment -> assertThat(environment.getName()).isEqualTo("center"));
    }

    @Test
    void formulasKnowTheirMode() {
        assertThat(single("$x$")).isInstanceOfSatisfying(FormulaNode.class,
                formula -> assertThat(formula.isInline()).isTrue());
        assertThat(single("$$x$$")).isInstanceOfSatisfying(FormulaNode.class,
                formula -> assertThat(formula.isInline()).isFalse());
    }

    @Test
    void sectionOwnsFollowingContent() {
        assertThat(single("\\section{T} body")).isInstanceOfSatisfying(SectionNode.class, section -> {
            assertThat(section.getCommand()).isEqualTo("\\section");
            assertThat(section.getBody().getChildren()).extracting(TexNode::kind).containsExactly(NodeKind.TEXT);
        });
    }

    @Test
    void itemBodyStartsWithItsLabel() {
        ProseEnvironment list = (ProseEnvironment) single("\\begin{enumerate}\\item[a)] x\\end{enumerate}");
        ListItemNode item = (ListItemNode) list.getBody().getChildren().get(0);

        assertThat(item.getBody().getChildren()).extracting(TexNode::kind)
                .containsExactly(NodeKind.BRACKET_GROUP, NodeKind.TEXT);
    }
}
