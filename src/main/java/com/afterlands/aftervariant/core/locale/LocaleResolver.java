package com.afterlands.aftervariant.core.locale;

import com.afterlands.aftervariant.core.cache.VariantCache;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Turns the locale codes callers pass around into {@link Locale}s.
 *
 * <p>Accepts BCP 47 tags and the underscore codes used in translation files:</p>
 * <pre>
 * "en"     -> en
 * "pt-BR"  -> pt_BR
 * "pt_br"  -> pt_BR
 * "EN_us"  -> en_US
 * null, "" -> default locale
 * </pre>
 *
 * <p>Codes without a recognizable language subtag fall back to the default
 * locale. Resolved codes are remembered in the bounded locale tier of
 * {@link VariantCache}; this class is thread-safe.</p>
 */
public class LocaleResolver {

    private final Locale defaultLocale;
    private final VariantCache cache;

    public LocaleResolver(@NotNull Locale defaultLocale, @NotNull VariantCache cache) {
        this.defaultLocale = Objects.requireNonNull(defaultLocale, "defaultLocale cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    /**
     * Resolves a locale code.
     *
     * @param code Locale in any supported format
     * @return Resolved locale (never null)
     */
    @NotNull
    public Locale resolve(@Nullable String code) {
        if (code == null || code.isBlank()) {
            return defaultLocale;
        }
        return cache.getLocale(code, this::parse);
    }

    @NotNull
    public Locale getDefaultLocale() {
        return defaultLocale;
    }

    /**
     * Normalizes a locale code to a BCP 47 language tag.
     *
     * @param code Locale in any supported format
     * @return Language tag (e.g., "pt-BR")
     */
    @NotNull
    public String toLanguageTag(@Nullable String code) {
        return resolve(code).toLanguageTag();
    }

    @NotNull
    private Locale parse(@NotNull String code) {
        Locale locale = Locale.forLanguageTag(code.trim().replace('_', '-'));
        if (locale.getLanguage().isEmpty()) {
            return defaultLocale;
        }
        return locale;
    }

    @Override
    public String toString() {
        return "LocaleResolver[default=" + defaultLocale.toLanguageTag() + ", resolved=" + cache.getLocaleSize() + "]";
    }
}
