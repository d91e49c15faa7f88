package com.afterlands.aftervariant.core.plural;

import com.afterlands.aftervariant.api.model.PluralCategory;
import com.afterlands.aftervariant.api.model.PluralType;
import com.afterlands.aftervariant.core.cache.VariantCache;
import com.ibm.icu.text.PluralRules;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * {@link PluralCategorizer} backed by the CLDR data shipped with ICU4J.
 *
 * <p>Rule tables are loaded once per locale and type and kept in the
 * {@link VariantCache}. Locales without their own data resolve to their
 * closest CLDR parent, down to root (everything {@code other}).</p>
 *
 * <p>This class is thread-safe.</p>
 */
public class IcuPluralCategorizer implements PluralCategorizer {

    private final VariantCache cache;

    public IcuPluralCategorizer(@NotNull VariantCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    @Override
    @NotNull
    public PluralCategory categorize(double number, @NotNull Locale locale, @NotNull PluralType type) {
        String keyword = rules(locale, type).select(number);
        PluralCategory category = PluralCategory.fromKey(keyword);
        return category != null ? category : PluralCategory.OTHER;
    }

    @Override
    @NotNull
    public Set<PluralCategory> supportedCategories(@NotNull Locale locale, @NotNull PluralType type) {
        Set<PluralCategory> categories = EnumSet.of(PluralCategory.OTHER);
        for (String keyword : rules(locale, type).getKeywords()) {
            PluralCategory category = PluralCategory.fromKey(keyword);
            if (category != null) {
                categories.add(category);
            }
        }
        return Collections.unmodifiableSet(categories);
    }

    @NotNull
    private PluralRules rules(@NotNull Locale locale, @NotNull PluralType type) {
        Objects.requireNonNull(locale, "locale cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        return cache.getPluralRules(locale, type, key -> PluralRules.forLocale(locale, toIcuType(type)));
    }

    @NotNull
    private static PluralRules.PluralType toIcuType(@NotNull PluralType type) {
        return switch (type) {
            case CARDINAL -> PluralRules.PluralType.CARDINAL;
            case ORDINAL -> PluralRules.PluralType.ORDINAL;
        };
    }
}
