package com.texformatter.layout.prose;

import java.util.List;

import com.texformatter.layout.Budget;

/**
 * One {@code key=value} option. A {@code null} value means the key was given alone.
 */
public final class KeyValueNode implements TexNode {
    private final String key;
    private final String value;

    public KeyValueNode(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KEY_VALUE;
    }

    @Override
    public List<String> format(Budget budget) {
        return List.of(value == null ? key : key + "=" + value);
    }
}
