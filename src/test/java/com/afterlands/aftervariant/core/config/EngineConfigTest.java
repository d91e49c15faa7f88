package com.afterlands.aftervariant.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.getDefaultLocale()).isEqualTo(Locale.ENGLISH);
        assertThat(config.isDebug()).isFalse();
        assertThat(config.isLogDiagnostics()).isTrue();
        assertThat(config.isDeduplicateDiagnostics()).isTrue();
        assertThat(config.getTemplateCacheSize()).isEqualTo(500);
        assertThat(config.getTemplateCacheTtlMinutes()).isEqualTo(30);
        assertThat(config.getPluralRulesCacheSize()).isEqualTo(64);
        assertThat(config.getLocaleCacheSize()).isEqualTo(256);
    }

    @Test
    void loadsYaml() {
        EngineConfig config = load(String.join("\n",
                "default-locale: pt_BR",
                "debug: true",
                "diagnostics:",
                "  log: false",
                "cache:",
                "  templates:",
                "    max-size: 10",
                "    ttl-minutes: 5",
                "  plural-rules:",
                "    max-size: 4",
                "  locales:",
                "    max-size: 12"
        ));

        assertThat(config.getDefaultLocale()).isEqualTo(Locale.forLanguageTag("pt-BR"));
        assertThat(config.isDebug()).isTrue();
        assertThat(config.isLogDiagnostics()).isFalse();
        assertThat(config.isDeduplicateDiagnostics()).isTrue();
        assertThat(config.getTemplateCacheSize()).isEqualTo(10);
        assertThat(config.getTemplateCacheTtlMinutes()).isEqualTo(5);
        assertThat(config.getPluralRulesCacheSize()).isEqualTo(4);
        assertThat(config.getLocaleCacheSize()).isEqualTo(12);
    }

    @Test
    void emptyDocumentGivesDefaults() {
        assertThat(load("").getTemplateCacheSize()).isEqualTo(500);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> load("debug: maybe")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("cache:\n  templates:\n    ttl-minutes: 0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ttl-minutes");
        assertThatThrownBy(() -> load("cache:\n  plural-rules:\n    max-size: -1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("cache: 5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("cache:\n  locales:\n    max-size: big"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("default-locale: '!!'")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> load("- a\n- b")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("aftervariant.yml");
        Files.writeString(file, "default-locale: de\n");

        assertThat(EngineConfig.load(file).getDefaultLocale()).isEqualTo(Locale.GERMAN);
        assertThatThrownBy(() -> EngineConfig.load(dir.resolve("missing.yml")))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void bundledResourceMatchesDefaults() {
        EngineConfig bundled = EngineConfig.loadDefault();
        EngineConfig defaults = EngineConfig.defaults();

        assertThat(bundled.getDefaultLocale()).isEqualTo(defaults.getDefaultLocale());
        assertThat(bundled.getTemplateCacheSize()).isEqualTo(defaults.getTemplateCacheSize());
        assertThat(bundled.getPluralRulesCacheSize()).isEqualTo(defaults.getPluralRulesCacheSize());
        assertThat(bundled.getLocaleCacheSize()).isEqualTo(defaults.getLocaleCacheSize());
        assertThat(bundled.isDeduplicateDiagnostics()).isEqualTo(defaults.isDeduplicateDiagnostics());
    }

    private static EngineConfig load(String yaml) {
        InputStream input = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
        return EngineConfig.load(input);
    }
}
