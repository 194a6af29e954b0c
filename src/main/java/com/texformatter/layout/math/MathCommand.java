package com.texformatter.layout.math;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A control sequence in math mode. Arguments are always rendered flat and glued to the name.
 */
public final class MathCommand implements MathNode {
    private final String name;
    private final List<MathNode> arguments;

    public MathCommand(String name, List<MathNode> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<MathNode> getArguments() {
        return arguments;
    }

    @Override
    public MathKind kind() {
        return MathKind.COMMAND;
    }

    @Override
    public List<String> format(Budget budget) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder(name);
        for (MathNode argument : arguments) {
            List<String> rendered = argument.format(budget.flat());
            if (rendered.isEmpty()) {
                continue;
            }
            current.append(rendered.get(0));
            if (rendered.size() > 1) {
                lines.add(current.toString());
                lines.addAll(rendered.subList(1, rendered.size() - 1));
                current = new StringBuilder(rendered.get(rendered.size() - 1));
            }
        }
        lines.add(current.toString());
        return lines;
    }
}
