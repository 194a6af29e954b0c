package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.Lines;
import com.texformatter.syntax.LatexCommands;

public final class ProseEnvironment extends EnvironmentNode {
    private final List<TexNode> arguments;
    private final ParentNode body;

    public ProseEnvironment(String name, List<TexNode> arguments, ParentNode body) {
        super(name);
        this.arguments = List.copyOf(arguments);
        this.body = body;
    }

    public List<TexNode> getArguments() {
        return arguments;
    }

    public ParentNode getBody() {
        return body;
    }

    @Override
    public boolean isMath() {
        return false;
    }

    @Override
    public List<String> format(Budget budget) {
        List<String> lines = new ArrayList<>(
                CommandNode.layout("\\begin{" + getName() + "}", arguments, budget.flat()));
        if (keepsBodyIndentation()) {
            for (String line : body.format(budget.fresh())) {
                lines.add(line.stripTrailing());
            }
        } else {
            for (String line : Lines.indent(body.format(budget.nested()), budget.indentUnit())) {
                lines.add(line.stripTrailing());
            }
        }
        lines.add("\\end{" + getName() + "}");
        return lines;
    }

    // The document body is not indented, and literal blocks must stay as written.
    private boolean keepsBodyIndentation() {
        return getName().equals("document") || LatexCommands.VERBATIM_ENVIRONMENTS.contains(getName());
    }
}
