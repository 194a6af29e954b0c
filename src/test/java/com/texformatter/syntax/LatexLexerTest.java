package com.texformatter.syntax;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

final class LatexLexerTest {

    private static List<SyntaxToken> tokens(String source) {
        LatexLexer lexer = new LatexLexer(source);
        List<SyntaxToken> tokens = new ArrayList<>();
        for (SyntaxToken token = lexer.next(); token != null; token = lexer.next()) {
            tokens.add(token);
        }
        return tokens;
    }

    private static List<SyntaxKind> kinds(String source) {
        List<SyntaxKind> kinds = new ArrayList<>();
        for (SyntaxToken token : tokens(source)) {
            kinds.add(token.kind());
        }
        return kinds;
    }

    @Test
    void whitespaceRunIsOneToken() {
        List<SyntaxToken> tokens = tokens("a  \n b");
        assertThat(tokens).extracting(SyntaxToken::kind)
                .containsExactly(SyntaxKind.WORD, SyntaxKind.WHITESPACE, SyntaxKind.WORD);
        assertThat(tokens.get(1).text()).isEqualTo("  \n ");
        assertThat(tokens.get(1).isBlankLine()).isFalse();
    }

    @Test
    void blankLineNeedsTwoLineBreaks() {
        assertThat(tokens("a\n \nb").get(1).isBlankLine()).isTrue();
    }

    @Test
    void commentRunsToEndOfLine() {
        List<SyntaxToken> tokens = tokens("x % note\ny");
        assertThat(tokens).extracting(SyntaxToken::kind).containsExactly(
                SyntaxKind.WORD, SyntaxKind.WHITESPACE, SyntaxKind.COMMENT, SyntaxKind.WHITESPACE, SyntaxKind.WORD);
        assertThat(tokens.get(2).text()).isEqualTo("% note");
    }

    @Test
    void controlWordsAbsorbStar() {
        List<SyntaxToken> tokens = tokens("\\section*{");
        assertThat(tokens.get(0).kind()).isEqualTo(SyntaxKind.COMMAND_NAME);
        assertThat(tokens.get(0).text()).isEqualTo("\\section*");
        assertThat(tokens.get(1).kind()).isEqualTo(SyntaxKind.L_CURLY);
    }

    @Test
    void controlWordsMayContainAt() {
        assertThat(tokens("\\make@title").get(0).text()).isEqualTo("\\make@title");
    }

    @Test
    void controlSymbolsAreSingleCharacter() {
        assertThat(tokens("\\%\\\\")).extracting(SyntaxToken::text).containsExactly("\\%", "\\\\");
    }

    @Test
    void doubleDollarIsOneToken() {
        List<SyntaxToken> tokens = tokens("$$x$");
        assertThat(tokens).extracting(SyntaxToken::text).containsExactly("$$", "x", "$");
        assertThat(tokens.get(0).kind()).isEqualTo(SyntaxKind.DOLLAR);
    }

    @Test
    void punctuationTokens() {
        assertThat(kinds("{}[](),=")).containsExactly(
                SyntaxKind.L_CURLY, SyntaxKind.R_CURLY, SyntaxKind.L_BRACK, SyntaxKind.R_BRACK,
                SyntaxKind.L_PAREN, SyntaxKind.R_PAREN, SyntaxKind.COMMA, SyntaxKind.EQUALITY_SIGN);
    }

    @Test
    void offsetsPointIntoSource() {
        List<SyntaxToken> tokens = tokens("ab \\cd");
        assertThat(tokens).extracting(SyntaxToken::getOffset).containsExactly(0, 2, 3);
    }

    @Test
    void peekPastEndIsNull() {
        LatexLexer lexer = new LatexLexer("a");
        assertThat(lexer.peek(1)).isNull();
        assertThat(lexer.next().text()).isEqualTo("a");
        assertThat(lexer.peek()).isNull();
        assertThat(lexer.offset()).isEqualTo(1);
    }

    @Test
    void rawReadUntilTerminatorDiscardsLookahead() {
        LatexLexer lexer = new LatexLexer("x {y}\\end{verbatim}z");
        lexer.peek(3);
        SyntaxToken raw = lexer.readRawUntil("\\end{verbatim}");
        assertThat(raw.kind()).isEqualTo(SyntaxKind.VERBATIM);
        assertThat(raw.text()).isEqualTo("x {y}");
        assertThat(lexer.next().text()).isEqualTo("\\end");
    }

    @Test
    void rawReadUntilMissingTerminatorTakesRest() {
        LatexLexer lexer = new LatexLexer("abc");
        assertThat(lexer.readRawUntil("\\end{comment}").text()).isEqualTo("abc");
        assertThat(lexer.next()).isNull();
    }

    @Test
    void delimitedReadKeepsDelimiters() {
        LatexLexer lexer = new LatexLexer("|a%b| rest");
        assertThat(lexer.readDelimited().text()).isEqualTo("|a%b|");
        assertThat(lexer.next().kind()).isEqualTo(SyntaxKind.WHITESPACE);
    }

    @Test
    void delimitedReadStopsAtLineEnd() {
        LatexLexer lexer = new LatexLexer("|abc\n|");
        assertThat(lexer.readDelimited()).isNull();
        assertThat(lexer.next().text()).isEqualTo("|abc");
    }

    @Test
    void balancedReadStopsAtMatchingBrace() {
        LatexLexer lexer = new LatexLexer("{http://x.org/%20{a}\\}}tail");
        assertThat(lexer.next().kind()).isEqualTo(SyntaxKind.L_CURLY);
        assertThat(lexer.readRawBalanced().text()).isEqualTo("http://x.org/%20{a}\\}");
        assertThat(lexer.next().kind()).isEqualTo(SyntaxKind.R_CURLY);
        assertThat(lexer.next().text()).isEqualTo("tail");
    }
}
