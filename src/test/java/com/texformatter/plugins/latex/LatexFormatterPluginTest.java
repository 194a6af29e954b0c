package com.texformatter.plugins.latex;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.texformatter.api.FormatterResult;
import com.texformatter.api.TextEdit;
import com.texformatter.api.error.FormatterError;
import com.texformatter.api.error.Severity;
import com.texformatter.config.ConfigurationLoader;
import com.texformatter.config.FormatterConfig;

final class LatexFormatterPluginTest {

    private static final Path FILE = Path.of("paper.tex");

    private LatexFormatterPlugin plugin;

    @BeforeEach
    void setUp() {
        plugin = new LatexFormatterPlugin();
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());
    }

    private static FormatterConfig formatOnSyntaxError() {
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        plugins.put("latex", new HashMap<>(Map.of("formatOnSyntaxError", true)));
        return new FormatterConfig(new HashMap<>(Map.of("tabWidth", 4, "lineLength", 60)), plugins);
    }

    @Test
    void formatsAndReportsEdit() {
        FormatterResult result = plugin.format(FILE, "$E=mc^2$");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("\\( E = mc^2 \\)\n");
        assertThat(result.getEdits()).singleElement().satisfies(edit -> {
            assertThat(edit.getEndLine()).isZero();
            assertThat(edit.getEndColumn()).isEqualTo(8);
        });
    }

    @Test
    void formattedSourceHasNoEdits() {
        FormatterResult result = plugin.format(FILE, "\\textbf{Hello, world!}\n");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.hasChanges()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("\\textbf{Hello, world!}\n");
    }

    @Test
    void emptyDocumentIsLeftAlone() {
        FormatterResult result = plugin.format(FILE, "");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEmpty();
        assertThat(result.getEdits()).isEmpty();
    }

    @Test
    void syntaxErrorsKeepSourceUnchanged() {
        FormatterResult result = plugin.format(FILE, "text\n{abc");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("text\n{abc");
        assertThat(result.getEdits()).isEmpty();
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getSeverity()).isEqualTo(Severity.ERROR);
            assertThat(error.getMessage()).isEqualTo("Unclosed brace group");
            assertThat(error.getLine()).isEqualTo(2);
            assertThat(error.getColumn()).isEqualTo(1);
            assertThat(error.getSuggestion()).isNotBlank();
        });
    }

    @Test
    void syntaxErrorsBecomeWarningsWhenFormattingAnyway() {
        plugin.initialize(formatOnSyntaxError());

        FormatterResult result = plugin.format(FILE, "a}");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.WARNING);
        assertThat(result.getFormattedCode()).endsWith("\n");
    }

    @Test
    void initializeAppliesLayoutSettings() {
        plugin.initialize(formatOnSyntaxError());

        assertThat(plugin.getFormatter().getTabWidth()).isEqualTo(4);
        assertThat(plugin.getFormatter().getLineLength()).isEqualTo(60);
    }

    @Test
    void repeatedRequestsGiveSameResult() {
        FormatterResult first = plugin.format(FILE, "$x$");
        FormatterResult second = plugin.format(FILE, "$x$");
        plugin.close();
        FormatterResult third = plugin.format(FILE, "$x$");

        assertThat(second.getFormattedCode()).isEqualTo(first.getFormattedCode());
        assertThat(third.getFormattedCode()).isEqualTo("\\( x \\)\n");
        assertThat(third.getEdits()).extracting(TextEdit::getNewText).containsExactly("\\( x \\)\n");
    }
}
