package com.texformatter.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.texformatter.api.FormatterPlugin;
import com.texformatter.api.FormatterResult;
import com.texformatter.api.error.FormatterError;
import com.texformatter.api.error.Severity;
import com.texformatter.config.ConfigurationLoader;
import com.texformatter.config.FormatterConfig;
import com.texformatter.plugins.FileType;
import com.texformatter.plugins.latex.LatexFormatterPlugin;

final class DocumentFormatterTest {

    @TempDir
    Path tempDir;

    private DocumentFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new DocumentFormatter(ConfigurationLoader.loadDefaultConfig());
        formatter.registerPlugin(FileType.TEX, new LatexFormatterPlugin());
        formatter.registerPlugin(FileType.STY, new LatexFormatterPlugin());
    }

    @AfterEach
    void tearDown() {
        formatter.close();
    }

    private static FormatterPlugin failingPlugin(AtomicBoolean closed) {
        return new FormatterPlugin() {
            @Override
            public void initialize(FormatterConfig config) {
            }

            @Override
            public FormatterResult format(Path filePath, String sourceCode) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void close() {
                closed.set(true);
                throw new IllegalStateException("close failed");
            }
        };
    }

    @Test
    void formatsSingleFile() {
        FormatterResult result = formatter.formatFile(Path.of("a.tex"), "$x$");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("\\( x \\)\n");
        assertThat(formatter.getProcessedFileCount()).isEqualTo(1);
        assertThat(formatter.getSuccessCount()).isEqualTo(1);
    }

    @Test
    void unsupportedFileIsReportedWithoutCounting() {
        FormatterResult result = formatter.formatFile(Path.of("notes.txt"), "hello");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("hello");
        assertThat(result.getErrors()).extracting(FormatterError::getMessage)
                .containsExactly("No plugin registered for file type: UNKNOWN");
        assertThat(formatter.getProcessedFileCount()).isZero();
    }

    @Test
    void syntaxErrorCountsAsFailure() {
        formatter.formatFile(Path.of("a.tex"), "{");

        assertThat(formatter.getErrorCount()).isEqualTo(1);
        assertThat(formatter.getSuccessCount()).isZero();
    }

    @Test
    void pluginFailureBecomesFatalResult() {
        formatter.registerPlugin(FileType.CLS, failingPlugin(new AtomicBoolean()));

        FormatterResult result = formatter.formatFile(Path.of("thesis.cls"), "\\x");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("\\x");
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getSeverity()).isEqualTo(Severity.FATAL);
            assertThat(error.getMessage()).isEqualTo("Unexpected error: boom");
        });
        assertThat(formatter.getErrorCount()).isEqualTo(1);
    }

    @Test
    void formatsSupportedFilesBelowDirectory() throws IOException {
        Path document = Files.writeString(tempDir.resolve("a.tex"), "$x$");
        Path style = Files.createDirectories(tempDir.resolve("sub")).resolve("b.sty");
        Files.writeString(style, "\\foo");
        Files.writeString(tempDir.resolve("c.txt"), "ignored");

        Map<Path, FormatterResult> results = formatter.formatDirectory(tempDir, 2);

        assertThat(results).containsOnlyKeys(document, style);
        assertThat(results.get(document).getFormattedCode()).isEqualTo("\\( x \\)\n");
        assertThat(results.get(style).isSuccessful()).isTrue();
    }

    @Test
    void directoryThatDoesNotExistGivesNoResults() {
        assertThat(formatter.formatDirectory(tempDir.resolve("missing"))).isEmpty();
    }

    @Test
    void unreadableFileBecomesFatalResult() {
        Path missing = tempDir.resolve("missing.tex");

        Map<Path, FormatterResult> results = formatter.formatFiles(List.of(missing), 1);

        assertThat(results.get(missing).getFormattedCode()).isNull();
        assertThat(results.get(missing).getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getSeverity()).isEqualTo(Severity.FATAL);
            assertThat(error.getMessage()).startsWith("Failed to read file");
        });
    }

    @Test
    void closeReachesEveryPlugin() {
        AtomicBoolean closed = new AtomicBoolean();
        formatter.registerPlugin(FileType.CLS, failingPlugin(closed));

        formatter.close();

        assertThat(closed).isTrue();
        assertThat(formatter.hasPluginFor(FileType.TEX)).isFalse();
        assertThat(formatter.getPluginCount()).isZero();
    }
}
