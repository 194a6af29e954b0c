package com.texformatter.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

final class FormatterConfigTest {

    private static FormatterConfig config(Map<String, Object> general) {
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        plugins.put("latex", new HashMap<>(Map.of("formatOnSyntaxError", "true", "level", 3L)));
        return new FormatterConfig(new HashMap<>(general), plugins);
    }

    @Test
    void convertsValuesToTypeOfDefault() {
        FormatterConfig config = config(Map.of("a", "7", "b", "abc", "c", 42, "d", 3L));

        assertThat(config.getGeneralConfig("a", 5)).isEqualTo(7);
        assertThat(config.getGeneralConfig("b", 5)).isEqualTo(5);
        assertThat(config.getGeneralConfig("c", "x")).isEqualTo("42");
        assertThat(config.getGeneralConfig("d", 0)).isEqualTo(3);
        assertThat(config.getGeneralConfig("missing", 9)).isEqualTo(9);
    }

    @Test
    void readsPluginValues() {
        FormatterConfig config = config(Map.of());

        assertThat(config.getPluginConfig("latex", "formatOnSyntaxError", false)).isTrue();
        assertThat(config.getPluginConfig("latex", "level", 0)).isEqualTo(3);
        assertThat(config.getPluginConfig("other", "level", 1)).isEqualTo(1);
    }

    @Test
    void withGeneralConfigLeavesOriginalUntouched() {
        FormatterConfig original = config(Map.of("lineLength", 80));
        FormatterConfig changed = original.withGeneralConfig("lineLength", 100);

        assertThat(changed.getGeneralConfig("lineLength", 0)).isEqualTo(100);
        assertThat(original.getGeneralConfig("lineLength", 0)).isEqualTo(80);
    }

    @Test
    void mapsAreCopies() {
        FormatterConfig config = config(Map.of("tabWidth", 2));

        config.getGeneralConfigMap().put("tabWidth", 8);
        config.getPluginConfigsMap().get("latex").put("level", 9);

        assertThat(config.getGeneralConfig("tabWidth", 0)).isEqualTo(2);
        assertThat(config.getPluginConfig("latex", "level", 0)).isEqualTo(3);
    }
}
