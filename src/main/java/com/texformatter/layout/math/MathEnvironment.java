package com.texformatter.layout.math;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;

/**
 * A math environment such as {@code align} or {@code cases}. Header arguments are kept as
 * written and the body rows are column aligned on {@code &}.
 */
public final class MathEnvironment implements MathNode {
    private final String name;
    private final String arguments;
    private final MathParent body;

    public MathEnvironment(String name, String arguments, MathParent body) {
        this.name = name;
        this.arguments = arguments;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public String getArguments() {
        return arguments;
    }

    public MathParent getBody() {
        return body;
    }

    @Override
    public MathKind kind() {
        return MathKind.ENVIRONMENT;
    }

    @Override
    public List<String> format(Budget budget) {
        List<String> lines = new ArrayList<>();
        lines.add("\\begin{" + name + "}" + arguments);
        List<String> rows = AmpersandAligner.align(body.format(budget.nested()));
        lines.addAll(Lines.indent(rows, budget.indentUnit()));
        lines.add("\\end{" + name + "}");
        return lines;
    }
}
