package com.afterlands.aftervariant.api.service;

import com.afterlands.aftervariant.api.model.Declaration;
import com.afterlands.aftervariant.api.model.PluralCategory;
import com.afterlands.aftervariant.api.model.PluralType;
import com.afterlands.aftervariant.api.model.SelectorValues;
import com.afterlands.aftervariant.api.model.VariantStructure;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Public API for resolving variant messages.
 *
 * <p>Variant messages choose their text from an ordered match table using
 * selectors: cardinal plurals, ordinal plurals, direct value matching and
 * combinations of those.</p>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * VariantResolutionAPI api = registry.getResolutionAPI();
 *
 * // Stored value -> structure
 * Optional<VariantStructure> variant = api.extractVariantStructure(storedValue);
 *
 * // "5 items"
 * String text = api.render(variant.get(), Map.of("count", 5), "en");
 *
 * // "countPlural=other" (pre-select the editing control)
 * Optional<String> active = api.detectActiveKey(variant.get(), Map.of("count", 5), "en");
 *
 * // Plain templates and variants through one call
 * String edited = api.renderTemplate("Hello {name}!", Map.of("name", "Ana"), "pt-BR");
 * }</pre>
 *
 * <h3>Failure Behavior:</h3>
 * <p>No method throws because of malformed data. Degradations are resolved
 * (first-entry fallback, empty text, {@code other} category) and reported to
 * the configured diagnostic listener.</p>
 *
 * <p>All methods are thread-safe and keep no state between calls. A null or
 * blank locale means the configured default locale.</p>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public interface VariantResolutionAPI {

    /**
     * Renders a variant: evaluates selectors, picks the first matching entry
     * and substitutes parameters into its template.
     *
     * <p>If no entry matches, the first template is rendered. If the structure
     * has no match table, the result is the empty string.</p>
     *
     * @param variant Variant structure
     * @param params Runtime parameters
     * @param locale Locale code for plural rules
     * @return Rendered text (never null)
     */
    @NotNull
    String render(@NotNull VariantStructure variant, @NotNull Map<String, ?> params, @Nullable String locale);

    /**
     * Returns the pattern key of the entry {@link #render} would use.
     *
     * <p>If no entry matches, the first key is returned. Empty when the
     * structure has no match table or the table is empty.</p>
     *
     * @param variant Variant structure
     * @param params Runtime parameters
     * @param locale Locale code for plural rules
     * @return Active pattern key
     */
    @NotNull
    Optional<String> detectActiveKey(@NotNull VariantStructure variant, @NotNull Map<String, ?> params, @Nullable String locale);

    /**
     * Extracts a variant structure from a stored value.
     *
     * @param rawValue Stored value: encoded text, a one-element sequence, or anything else
     * @return Variant structure, or empty for simple templates and unrecognized values
     */
    @NotNull
    Optional<VariantStructure> extractVariantStructure(@Nullable Object rawValue);

    /**
     * Parses declaration strings.
     *
     * @param rawDeclarations Raw declarations; non-string and empty entries are dropped
     * @return Declarations in input order
     */
    @NotNull
    List<Declaration> parseDeclarations(@Nullable List<?> rawDeclarations);

    /**
     * Renders a stored value that is either a plain template or a variant.
     *
     * @param template Plain template text, encoded variant, structure, or null
     * @param params Runtime parameters
     * @param locale Locale code for plural rules
     * @return Rendered text; empty for null or unsupported values
     */
    @NotNull
    String renderTemplate(@Nullable Object template, @NotNull Map<String, ?> params, @Nullable String locale);

    /**
     * Evaluates the selectors of a variant without matching.
     *
     * @param variant Variant structure
     * @param params Runtime parameters
     * @param locale Locale code for plural rules
     * @return Observed selector values
     */
    @NotNull
    SelectorValues evaluateSelectors(@NotNull VariantStructure variant, @NotNull Map<String, ?> params, @Nullable String locale);

    /**
     * Encodes a structure in its stored shape (a one-element JSON array).
     *
     * @param variant Variant structure
     * @return JSON text that {@link #extractVariantStructure} reads back
     */
    @NotNull
    String encode(@NotNull VariantStructure variant);

    /**
     * Lists the plural categories a locale uses.
     *
     * @param locale Locale code
     * @param type Cardinal or ordinal rules
     * @return Categories, always including {@link PluralCategory#OTHER}
     */
    @NotNull
    Set<PluralCategory> pluralCategories(@Nullable String locale, @NotNull PluralType type);
}
