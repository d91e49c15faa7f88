package com.afterlands.aftervariant.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Kind of plural rules a {@code plural} transform applies.
 *
 * <p>Selected by the {@code type} option of a local declaration:</p>
 * <pre>
 * local countPlural = count: plural               -> CARDINAL
 * local ordinal = position: plural type=ordinal   -> ORDINAL
 * </pre>
 */
public enum PluralType {

    /** Quantities: "1 item", "5 items". */
    CARDINAL,

    /** Positions: "1st", "2nd", "3rd", "4th". */
    ORDINAL;

    /**
     * Option key that selects the plural type.
     */
    public static final String OPTION_KEY = "type";

    /**
     * Resolves the plural type from a declaration's options.
     *
     * <p>Only {@code type=ordinal} selects ordinal rules; a missing or unrecognized
     * value falls back to cardinal.</p>
     *
     * @param options Declaration options
     * @return Plural type (never null)
     */
    @NotNull
    public static PluralType fromOptions(@Nullable Map<String, String> options) {
        if (options == null) {
            return CARDINAL;
        }
        String type = options.get(OPTION_KEY);
        if (type != null && type.trim().toLowerCase(Locale.ROOT).equals("ordinal")) {
            return ORDINAL;
        }
        return CARDINAL;
    }
}
