package com.afterlands.aftervariant.core.plural;

import com.afterlands.aftervariant.api.model.PluralCategory;
import com.afterlands.aftervariant.api.model.PluralType;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Set;

/**
 * Maps a number to its CLDR plural category for a locale.
 *
 * <p>This is the value a {@code plural} selector observes. It is injected into
 * the engine so the engine can be tested against a fixed table and run on any
 * source of CLDR data.</p>
 *
 * <h3>Examples:</h3>
 * <pre>
 * (1,  en, CARDINAL) -> ONE
 * (5,  en, CARDINAL) -> OTHER
 * (2,  en, ORDINAL)  -> TWO
 * (11, en, ORDINAL)  -> OTHER
 * (3,  pl, CARDINAL) -> FEW
 * </pre>
 *
 * <p>Implementations must be safe for concurrent use.</p>
 *
 * @see IcuPluralCategorizer
 * @see <a href="https://cldr.unicode.org/index/cldr-spec/plural-rules">CLDR Plural Rules</a>
 */
@FunctionalInterface
public interface PluralCategorizer {

    /**
     * Selects the plural category of a number.
     *
     * <p>Only called with finite numbers; the selector evaluator maps everything
     * else to {@link PluralCategory#OTHER} itself.</p>
     *
     * @param number Finite number to categorize (may be negative or fractional)
     * @param locale Locale whose rules apply
     * @param type Cardinal or ordinal rules
     * @return Plural category (never null)
     */
    @NotNull
    PluralCategory categorize(double number, @NotNull Locale locale, @NotNull PluralType type);

    /**
     * Returns every category the locale's rules can produce.
     *
     * <p>Editors use this to list the forms a translator has to fill in.
     * {@link PluralCategory#OTHER} is always included.</p>
     *
     * @param locale Locale
     * @param type Cardinal or ordinal rules
     * @return Supported categories (never empty)
     */
    @NotNull
    default Set<PluralCategory> supportedCategories(@NotNull Locale locale, @NotNull PluralType type) {
        return Set.of(PluralCategory.ONE, PluralCategory.OTHER);
    }
}
