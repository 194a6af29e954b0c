package com.texformatter.api;

import java.nio.file.Path;

import com.texformatter.config.FormatterConfig;

/**
 * A formatter for one family of file types.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source. Implementations report problems in the result instead of
     * throwing.
     */
    FormatterResult format(Path filePath, String sourceCode);

    /**
     * Release any resources held by the plugin.
     */
    default void close() {
    }
}
