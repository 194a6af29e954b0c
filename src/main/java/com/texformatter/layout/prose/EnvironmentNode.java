package com.texformatter.layout.prose;

/**
 * A named {@code \begin ... \end} block. Math environments are laid out by the math subsystem.
 */
public abstract sealed class EnvironmentNode implements TexNode permits ProseEnvironment, MathEnvironmentNode {
    private final String name;

    protected EnvironmentNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ENVIRONMENT;
    }

    public abstract boolean isMath();
}
