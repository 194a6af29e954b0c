package com.texformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Formats LaTeX sources, one file at a time or a whole directory tree.
 */
public interface TexFormatter extends AutoCloseable {
    FormatterResult formatFile(Path filePath, String sourceCode);

    Map<Path, FormatterResult> formatDirectory(Path directory);

    @Override
    void close();
}
