package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;
import com.texformatter.layout.math.MathEnvironment;

/**
 * Bridge from the prose tree into a math environment such as {@code align}.
 */
public final class MathEnvironmentNode extends EnvironmentNode {
    private final MathEnvironment environment;

    public MathEnvironmentNode(MathEnvironment environment) {
        super(environment.getName());
        this.environment = environment;
    }

    public MathEnvironment getEnvironment() {
        return environment;
    }

    @Override
    public boolean isMath() {
        return true;
    }

    @Override
    public List<String> format(Budget budget) {
        return environment.format(budget);
    }
}
