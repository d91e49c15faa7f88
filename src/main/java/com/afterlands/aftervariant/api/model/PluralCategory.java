package com.afterlands.aftervariant.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * CLDR plural categories produced by a plural transform.
 *
 * <p>The lowercase {@link #getKey() key} is the value a {@code plural} selector
 * observes, so it is what match keys compare against ({@code countPlural=one}).</p>
 *
 * <h3>Examples (cardinal / ordinal):</h3>
 * <pre>
 * en cardinal: ONE (1), OTHER (0, 2+, 1.5)
 * en ordinal:  ONE (1, 21), TWO (2, 22), FEW (3, 23), OTHER (4, 11, 12, 13)
 * pl cardinal: ONE (1), FEW (2-4), MANY (5+), OTHER (fractions)
 * ar cardinal: ZERO (0), ONE (1), TWO (2), FEW (3-10), MANY (11-99), OTHER (100+)
 * </pre>
 *
 * @see <a href="https://cldr.unicode.org/index/cldr-spec/plural-rules">CLDR Plural Rules</a>
 */
public enum PluralCategory {

    ZERO,
    ONE,
    TWO,
    FEW,
    MANY,

    /**
     * Default category, defined by every locale for both cardinal and ordinal rules.
     */
    OTHER;

    /**
     * Returns the lowercase key as it appears in match keys.
     *
     * @return Lowercase category name (e.g., "zero", "one", "other")
     */
    @NotNull
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a plural category from its key.
     *
     * <p>Case-insensitive. Returns null if the key is not a CLDR category.</p>
     *
     * @param key Category key (e.g., "one", "FEW", "Other")
     * @return Corresponding PluralCategory, or null if not found
     */
    @Nullable
    public static PluralCategory fromKey(@Nullable String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
