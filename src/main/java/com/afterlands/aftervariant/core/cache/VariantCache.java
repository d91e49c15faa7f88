package com.afterlands.aftervariant.core.cache;

import com.afterlands.aftervariant.api.model.PluralType;
import com.afterlands.aftervariant.core.template.CompiledMessage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.ibm.icu.text.PluralRules;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Caches shared by all evaluations of the engine.
 *
 * <h3>Cache Tiers:</h3>
 * <ul>
 *     <li><b>Templates:</b> compiled templates keyed by template text</li>
 *     <li><b>Plural rules:</b> ICU rule tables keyed by locale and plural type</li>
 *     <li><b>Locales:</b> resolved {@link Locale}s keyed by the code callers pass</li>
 * </ul>
 *
 * <p>All tiers are bounded, populate-once Caffeine caches; concurrent readers never
 * block each other and a value is computed at most once per key. Cached values
 * are immutable, so evaluations stay independent of each other.</p>
 */
public class VariantCache {

    /**
     * Template text -> compiled template.
     */
    private final Cache<String, CompiledMessage> templateCache;

    /**
     * "languageTag:TYPE" -> ICU plural rules.
     */
    private final Cache<String, PluralRules> pluralRulesCache;

    /**
     * Locale code -> resolved locale.
     */
    private final Cache<String, Locale> localeCache;

    private final int maxTemplateCacheSize;
    private final int maxPluralRulesCacheSize;
    private final int maxLocaleCacheSize;

    /**
     * Creates the caches.
     *
     * @param maxTemplateCacheSize Maximum compiled templates
     * @param templateCacheTtlMinutes Template TTL after access (minutes)
     * @param maxPluralRulesCacheSize Maximum locale/type rule tables
     * @param maxLocaleCacheSize Maximum resolved locale codes
     */
    public VariantCache(
            int maxTemplateCacheSize,
            int templateCacheTtlMinutes,
            int maxPluralRulesCacheSize,
            int maxLocaleCacheSize
    ) {
        if (maxTemplateCacheSize < 0 || maxPluralRulesCacheSize < 0 || maxLocaleCacheSize < 0) {
            throw new IllegalArgumentException("Cache sizes cannot be negative");
        }
        if (templateCacheTtlMinutes <= 0) {
            throw new IllegalArgumentException("Template cache TTL must be positive: " + templateCacheTtlMinutes);
        }
        this.maxTemplateCacheSize = maxTemplateCacheSize;
        this.maxPluralRulesCacheSize = maxPluralRulesCacheSize;
        this.maxLocaleCacheSize = maxLocaleCacheSize;

        this.templateCache = Caffeine.newBuilder()
                .maximumSize(maxTemplateCacheSize)
                .expireAfterAccess(templateCacheTtlMinutes, TimeUnit.MINUTES)
                .recordStats()
                .build();

        // Rule tables are locale data; they never go stale
        this.pluralRulesCache = Caffeine.newBuilder()
                .maximumSize(maxPluralRulesCacheSize)
                .recordStats()
                .build();

        this.localeCache = Caffeine.newBuilder()
                .maximumSize(maxLocaleCacheSize)
                .recordStats()
                .build();
    }

    // ==================== Template Cache ====================

    /**
     * Gets the compiled form of a template, compiling it on first use.
     *
     * @param template Template text
     * @param compiler Compiles the template on a miss
     * @return Compiled template
     */
    @NotNull
    public CompiledMessage getTemplate(
            @NotNull String template,
            @NotNull Function<String, CompiledMessage> compiler
    ) {
        return templateCache.get(template, compiler);
    }

    // ==================== Plural Rules Cache ====================

    /**
     * Gets the rule table for a locale and plural type, loading it on first use.
     *
     * @param locale Locale
     * @param type Cardinal or ordinal
     * @param loader Loads the rules on a miss
     * @return Plural rules
     */
    @NotNull
    public PluralRules getPluralRules(
            @NotNull Locale locale,
            @NotNull PluralType type,
            @NotNull Function<String, PluralRules> loader
    ) {
        return pluralRulesCache.get(buildPluralRulesKey(locale, type), loader);
    }

    @NotNull
    private String buildPluralRulesKey(@NotNull Locale locale, @NotNull PluralType type) {
        return locale.toLanguageTag() + ":" + type.name();
    }

    // ==================== Locale Cache ====================

    /**
     * Gets the locale for a code, resolving it on first use.
     *
     * @param code Locale code as passed by the caller
     * @param resolver Resolves the code on a miss
     * @return Resolved locale
     */
    @NotNull
    public Locale getLocale(@NotNull String code, @NotNull Function<String, Locale> resolver) {
        return localeCache.get(code, resolver);
    }

    // ==================== Invalidation ====================

    public void invalidateTemplates() {
        templateCache.invalidateAll();
    }

    /**
     * Clears all caches.
     */
    public void invalidateAll() {
        templateCache.invalidateAll();
        pluralRulesCache.invalidateAll();
        localeCache.invalidateAll();
    }

    /**
     * Runs pending evictions now, so sizes reflect the bounds.
     */
    public void cleanUp() {
        templateCache.cleanUp();
        pluralRulesCache.cleanUp();
        localeCache.cleanUp();
    }

    // ==================== Statistics ====================

    @NotNull
    public CacheStats getTemplateStats() {
        return templateCache.stats();
    }

    @NotNull
    public CacheStats getPluralRulesStats() {
        return pluralRulesCache.stats();
    }

    public long getTemplateSize() {
        return templateCache.estimatedSize();
    }

    public long getPluralRulesSize() {
        return pluralRulesCache.estimatedSize();
    }

    public long getLocaleSize() {
        return localeCache.estimatedSize();
    }

    /**
     * Gets formatted statistics string.
     *
     * @return Statistics summary
     */
    @NotNull
    public String formatStats() {
        cleanUp();
        CacheStats templateStats = getTemplateStats();
        CacheStats rulesStats = getPluralRulesStats();
        CacheStats localeStats = localeCache.stats();

        return String.format(
                "Templates: %d/%d entries (%.2f%% hit rate) | " +
                "Plural rules: %d/%d entries (%.2f%% hit rate) | " +
                "Locales: %d/%d entries (%.2f%% hit rate)",
                getTemplateSize(), maxTemplateCacheSize, templateStats.hitRate() * 100,
                getPluralRulesSize(), maxPluralRulesCacheSize, rulesStats.hitRate() * 100,
                getLocaleSize(), maxLocaleCacheSize, localeStats.hitRate() * 100
        );
    }
}
