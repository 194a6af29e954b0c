package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A control sequence followed by its arguments.
 */
public final class CommandNode implements TexNode {
    private final String name;
    private final List<TexNode> arguments;

    public CommandNode(String name, List<TexNode> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<TexNode> getArguments() {
        return arguments;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMMAND;
    }

    @Override
    public List<String> format(Budget budget) {
        return layout(name, arguments, budget);
    }

    /**
     * Appends each argument to {@code head}. An argument spanning several lines closes the line
     * built so far, and its last line becomes the line the next argument is appended to.
     */
    static List<String> layout(String head, List<TexNode> arguments, Budget budget) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder(head);
        Budget base = budget;
        for (TexNode argument : arguments) {
            List<String> rendered = argument.format(base.consume(current.length()));
            if (rendered.isEmpty()) {
                continue;
            }
            current.append(rendered.get(0).trim());
            if (rendered.size() > 1) {
                lines.add(current.toString());
                lines.addAll(rendered.subList(1, rendered.size() - 1));
                current = new StringBuilder(rendered.get(rendered.size() - 1).trim());
                base = budget.fresh();
            }
        }
        lines.add(current.toString());
        return lines;
    }
}
