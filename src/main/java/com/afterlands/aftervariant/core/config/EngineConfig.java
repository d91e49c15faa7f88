package com.afterlands.aftervariant.core.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Engine settings.
 *
 * <h3>Configuration File (aftervariant.yml):</h3>
 * <pre>
 * default-locale: en
 * debug: false
 * diagnostics:
 *   log: true
 *   deduplicate: true
 * cache:
 *   templates:
 *     max-size: 500
 *     ttl-minutes: 30
 *   plural-rules:
 *     max-size: 64
 *   locales:
 *     max-size: 256
 * </pre>
 *
 * <p>Every key is optional; missing keys take the defaults above. Values of
 * the wrong type or out of range are rejected with {@link IllegalArgumentException}.</p>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public class EngineConfig {

    /**
     * Classpath resource holding the bundled defaults.
     */
    public static final String DEFAULT_RESOURCE = "aftervariant.yml";

    private final Locale defaultLocale;
    private final boolean debug;
    private final boolean logDiagnostics;
    private final boolean deduplicateDiagnostics;
    private final int templateCacheSize;
    private final int templateCacheTtlMinutes;
    private final int pluralRulesCacheSize;
    private final int localeCacheSize;

    /**
     * Creates a config from a parsed YAML document.
     *
     * @param root Root mapping (may be null or empty for all defaults)
     */
    public EngineConfig(@Nullable Map<String, Object> root) {
        Map<String, Object> config = root != null ? root : Map.of();

        String localeTag = getString(config, "default-locale", "en");
        this.defaultLocale = Locale.forLanguageTag(localeTag.trim().replace('_', '-'));
        if (defaultLocale.getLanguage().isEmpty()) {
            throw new IllegalArgumentException("Invalid default-locale: " + localeTag);
        }

        this.debug = getBoolean(config, "debug", false);

        Map<String, Object> diagnostics = getSection(config, "diagnostics");
        this.logDiagnostics = getBoolean(diagnostics, "log", true);
        this.deduplicateDiagnostics = getBoolean(diagnostics, "deduplicate", true);

        Map<String, Object> cache = getSection(config, "cache");
        Map<String, Object> templates = getSection(cache, "templates");
        this.templateCacheSize = getInt(templates, "max-size", 500, 0);
        this.templateCacheTtlMinutes = getInt(templates, "ttl-minutes", 30, 1);

        Map<String, Object> pluralRules = getSection(cache, "plural-rules");
        this.pluralRulesCacheSize = getInt(pluralRules, "max-size", 64, 0);

        Map<String, Object> locales = getSection(cache, "locales");
        this.localeCacheSize = getInt(locales, "max-size", 256, 0);
    }

    /**
     * Creates a config with all defaults.
     *
     * @return Default config
     */
    @NotNull
    public static EngineConfig defaults() {
        return new EngineConfig(null);
    }

    /**
     * Loads a config from YAML.
     *
     * @param input YAML stream (not closed)
     * @return Loaded config
     */
    @NotNull
    public static EngineConfig load(@NotNull InputStream input) {
        Objects.requireNonNull(input, "input cannot be null");
        Object document = new Yaml().load(input);
        if (document == null) {
            return defaults();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Configuration root must be a mapping");
        }
        return new EngineConfig(asSection(map, "root"));
    }

    /**
     * Loads a config from a YAML file.
     *
     * @param path Path to the YAML file
     * @return Loaded config
     */
    @NotNull
    public static EngineConfig load(@NotNull Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + path, e);
        }
    }

    /**
     * Loads the bundled {@value #DEFAULT_RESOURCE}, or defaults if it is not on the classpath.
     *
     * @return Loaded config
     */
    @NotNull
    public static EngineConfig loadDefault() {
        try (InputStream input = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            return input != null ? load(input) : defaults();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    // ==================== Section helpers ====================

    @NotNull
    private static Map<String, Object> getSection(@NotNull Map<String, Object> config, @NotNull String key) {
        Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("'" + key + "' must be a section");
        }
        return asSection(map, key);
    }

    @SuppressWarnings("unchecked")
    @NotNull
    private static Map<String, Object> asSection(@NotNull Map<?, ?> map, @NotNull String key) {
        for (Object sectionKey : map.keySet()) {
            if (!(sectionKey instanceof String)) {
                throw new IllegalArgumentException("Keys of '" + key + "' must be strings: " + sectionKey);
            }
        }
        return (Map<String, Object>) map;
    }

    @NotNull
    private static String getString(@NotNull Map<String, Object> config, @NotNull String key, @NotNull String def) {
        Object value = config.get(key);
        return value != null ? String.valueOf(value) : def;
    }

    private static boolean getBoolean(@NotNull Map<String, Object> config, @NotNull String key, boolean def) {
        Object value = config.get(key);
        if (value == null) {
            return def;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException("'" + key + "' must be true or false: " + value);
    }

    private static int getInt(@NotNull Map<String, Object> config, @NotNull String key, int def, int min) {
        Object value = config.get(key);
        if (value == null) {
            return def;
        }
        if (!(value instanceof Integer number)) {
            throw new IllegalArgumentException("'" + key + "' must be an integer: " + value);
        }
        if (number < min) {
            throw new IllegalArgumentException("'" + key + "' must be at least " + min + ": " + number);
        }
        return number;
    }

    // ==================== Getters ====================

    @NotNull
    public Locale getDefaultLocale() {
        return defaultLocale;
    }

    public boolean isDebug() {
        return debug;
    }

    public boolean isLogDiagnostics() {
        return logDiagnostics;
    }

    public boolean isDeduplicateDiagnostics() {
        return deduplicateDiagnostics;
    }

    public int getTemplateCacheSize() {
        return templateCacheSize;
    }

    public int getTemplateCacheTtlMinutes() {
        return templateCacheTtlMinutes;
    }

    public int getPluralRulesCacheSize() {
        return pluralRulesCacheSize;
    }

    public int getLocaleCacheSize() {
        return localeCacheSize;
    }

    @Override
    public String toString() {
        return "EngineConfig[defaultLocale=" + defaultLocale.toLanguageTag() +
               ", debug=" + debug +
               ", logDiagnostics=" + logDiagnostics +
               ", templateCache=" + templateCacheSize + "/" + templateCacheTtlMinutes + "m" +
               ", pluralRulesCache=" + pluralRulesCacheSize +
               ", localeCache=" + localeCacheSize + "]";
    }
}
