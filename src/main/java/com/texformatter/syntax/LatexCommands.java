package com.texformatter.syntax;

import java.util.Set;

/**
 * Fixed command and environment name tables shared by the parser and the layout engine.
 */
public final class LatexCommands {

    /** Environments whose body is kept byte-for-byte. */
    public static final Set<String> VERBATIM_ENVIRONMENTS = Set.of(
            "verbatim", "verbatim*", "Verbatim", "Verbatim*", "lstlisting", "minted", "comment");

    /** Environments whose body is typeset in math mode. */
    public static final Set<String> MATH_ENVIRONMENTS = Set.of(
            "math", "displaymath", "displaymath*",
            "equation", "equation*", "align", "align*", "alignat", "alignat*",
            "gather", "gather*", "multline", "multline*", "flalign", "flalign*",
            "xalignat", "xalignat*", "xxalignat", "xxalignat*", "array", "cases", "cases*",
            "split", "IEEEeqnarray", "IEEEeqnarray*", "dcases", "rcases", "tcases",
            "empheq", "dmath", "eqnarray");

    /** Commands whose arguments are ordinary text even inside a formula. */
    public static final Set<String> TEXT_MODE_COMMANDS = Set.of(
            "\\text", "\\textrm", "\\textbf", "\\textit", "\\texttt", "\\textsf", "\\textsc",
            "\\emph", "\\mbox", "\\hbox", "\\intertext", "\\shortintertext");

    /** Math delimiters sizing commands, they never take arguments. */
    public static final Set<String> DELIMITER_COMMANDS = Set.of(
            "\\left", "\\right", "\\middle",
            "\\big", "\\Big", "\\bigg", "\\Bigg",
            "\\bigl", "\\Bigl", "\\biggl", "\\Biggl",
            "\\bigr", "\\Bigr", "\\biggr", "\\Biggr",
            "\\bigm", "\\Bigm", "\\biggm", "\\Biggm");

    public static final Set<String> PACKAGE_INCLUDES = Set.of("\\usepackage", "\\RequirePackage");

    public static final Set<String> LABEL_REFERENCES = Set.of(
            "\\ref", "\\eqref", "\\pageref", "\\autoref", "\\cref", "\\Cref", "\\nameref");

    public static final Set<String> CITATIONS = Set.of(
            "\\cite", "\\cite*", "\\Cite", "\\nocite", "\\citep", "\\citep*", "\\citet", "\\citet*",
            "\\citealp", "\\citealt", "\\citeauthor", "\\citeyear", "\\parencite", "\\Parencite",
            "\\textcite", "\\Textcite", "\\autocite", "\\Autocite", "\\footcite", "\\supercite");

    public static final Set<String> COMMAND_DEFINITIONS = Set.of(
            "\\newcommand", "\\newcommand*", "\\renewcommand", "\\renewcommand*",
            "\\providecommand", "\\providecommand*", "\\DeclareRobustCommand",
            "\\DeclareRobustCommand*");

    public static final Set<String> ENVIRONMENT_DEFINITIONS = Set.of(
            "\\newenvironment", "\\newenvironment*", "\\renewenvironment", "\\renewenvironment*");

    /** Commands whose first argument is read raw, such as URLs containing {@code %} or {@code #}. */
    public static final Set<String> URL_COMMANDS = Set.of("\\url", "\\href");

    private LatexCommands() {
    }

    /**
     * Maps a sectioning command to its node kind, or returns {@code null} for other commands.
     */
    public static SyntaxKind sectionKind(String name) {
        String base = name.endsWith("*") ? name.substring(0, name.length() - 1) : name;
        return switch (base) {
            case "\\part" -> SyntaxKind.PART;
            case "\\chapter" -> SyntaxKind.CHAPTER;
            case "\\section" -> SyntaxKind.SECTION;
            case "\\subsection" -> SyntaxKind.SUBSECTION;
            case "\\subsubsection" -> SyntaxKind.SUBSUBSECTION;
            case "\\paragraph" -> SyntaxKind.PARAGRAPH;
            case "\\subparagraph" -> SyntaxKind.SUBPARAGRAPH;
            default -> null;
        };
    }
}
