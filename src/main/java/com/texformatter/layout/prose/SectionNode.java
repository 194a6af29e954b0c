package com.texformatter.layout.prose;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.layout.Budget;

/**
 * A sectioning command with its title and the content up to the next heading of the same or
 * a higher level.
 */
public final class SectionNode implements TexNode {
    private final String command;
    private final TexNode shortTitle;
    private final TexNode title;
    private final ParentNode body;

    /**
     * @param command    the heading command, for example {@code \section*}
     * @param shortTitle the optional bracketed short title, may be {@code null}
     */
    public SectionNode(String command, TexNode shortTitle, TexNode title, ParentNode body) {
        this.command = command;
        this.shortTitle = shortTitle;
        this.title = title;
        this.body = body;
    }

    public String getCommand() {
        return command;
    }

    public ParentNode getBody() {
        return body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SECTION;
    }

    @Override
    public List<String> format(Budget budget) {
        List<TexNode> arguments = new ArrayList<>();
        if (shortTitle != null) {
            arguments.add(shortTitle);
        }
        arguments.add(title);

        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.addAll(CommandNode.layout(command, arguments, budget.fresh()));
        lines.add("");
        List<String> content = body.format(budget.fresh());
        int start = 0;
        while (start < content.size() && content.get(start).isEmpty()) {
            start++;
        }
        lines.addAll(content.subList(start, content.size()));
        return lines;
    }
}
