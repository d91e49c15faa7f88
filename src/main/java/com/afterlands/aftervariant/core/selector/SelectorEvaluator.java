package com.afterlands.aftervariant.core.selector;

import com.afterlands.aftervariant.api.diagnostic.Diagnostic;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticCode;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.model.Declaration;
import com.afterlands.aftervariant.api.model.PluralCategory;
import com.afterlands.aftervariant.api.model.SelectorValues;
import com.afterlands.aftervariant.api.model.VariantStructure;
import com.afterlands.aftervariant.core.match.SelectorInference;
import com.afterlands.aftervariant.core.plural.PluralCategorizer;
import com.afterlands.aftervariant.core.template.ParamFormatter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Computes the observed value of every selector of a variant.
 *
 * <h3>Resolution per selector:</h3>
 * <ol>
 *     <li>{@code local x = src: plural [type=ordinal]} - plural category of {@code params[src]}</li>
 *     <li>{@code local x = src: <other transform>} - {@code params[src]} as text</li>
 *     <li>{@code input x} - {@code params[x]} as text</li>
 *     <li>no declaration, or an unknown one - {@code params[selector]} as text</li>
 * </ol>
 *
 * <p>Selectors come from the structure, or are inferred from the match keys when
 * the structure lists none. A missing parameter leaves the selector without a
 * value. A plural source that is not a number selects {@code other}.</p>
 */
public class SelectorEvaluator {

    private final SelectorInference inference;
    private final PluralCategorizer categorizer;
    private final DiagnosticListener diagnostics;

    public SelectorEvaluator(
            @NotNull SelectorInference inference,
            @NotNull PluralCategorizer categorizer,
            @NotNull DiagnosticListener diagnostics
    ) {
        this.inference = Objects.requireNonNull(inference, "inference cannot be null");
        this.categorizer = Objects.requireNonNull(categorizer, "categorizer cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
    }

    /**
     * Evaluates all selectors of a variant.
     *
     * @param variant Variant structure
     * @param params Runtime parameters
     * @param locale Locale for plural rules
     * @return Selector values in selector order
     */
    @NotNull
    public SelectorValues evaluate(
            @NotNull VariantStructure variant,
            @NotNull Map<String, ?> params,
            @NotNull Locale locale
    ) {
        List<String> selectors = selectorNames(variant);
        if (selectors.isEmpty()) {
            return SelectorValues.empty();
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (String selector : selectors) {
            Declaration declaration = findDeclaration(variant.declarations(), selector);
            values.put(selector, evaluate(selector, declaration, params, locale));
        }
        return SelectorValues.of(values);
    }

    /**
     * Explicit selectors, or the ones inferred from the match keys.
     *
     * @param variant Variant structure
     * @return Selector names in evaluation order
     */
    @NotNull
    public List<String> selectorNames(@NotNull VariantStructure variant) {
        if (!variant.selectors().isEmpty()) {
            return variant.selectors();
        }
        if (variant.entries().isEmpty()) {
            return List.of();
        }
        return inference.infer(variant.entries());
    }

    @Nullable
    private String evaluate(
            @NotNull String selector,
            @Nullable Declaration declaration,
            @NotNull Map<String, ?> params,
            @NotNull Locale locale
    ) {
        if (declaration == null) {
            return stringify(params.get(selector));
        }

        return switch (declaration.kind()) {
            case LOCAL -> evaluateLocal((Declaration.Local) declaration, params, locale);
            case INPUT -> stringify(params.get(declaration.name()));
            case UNKNOWN -> stringify(params.get(selector));
        };
    }

    @Nullable
    private String evaluateLocal(
            @NotNull Declaration.Local local,
            @NotNull Map<String, ?> params,
            @NotNull Locale locale
    ) {
        Object sourceValue = params.get(local.source());
        if (!local.isPlural()) {
            return stringify(sourceValue);
        }

        OptionalDouble number = NumericCoercion.toNumber(sourceValue);
        if (number.isEmpty()) {
            diagnostics.report(Diagnostic.of(
                    DiagnosticCode.NON_NUMERIC_PLURAL_SOURCE,
                    "Plural source '" + local.source() + "' is not a number (" + sourceValue + "), using 'other'",
                    local.raw()
            ));
            return PluralCategory.OTHER.getKey();
        }

        return categorizer.categorize(number.getAsDouble(), locale, local.pluralType()).getKey();
    }

    @Nullable
    private static Declaration findDeclaration(@NotNull List<Declaration> declarations, @NotNull String name) {
        for (Declaration declaration : declarations) {
            if (name.equals(declaration.name())) {
                return declaration;
            }
        }
        return null;
    }

    @Nullable
    private static String stringify(@Nullable Object value) {
        return value == null ? null : ParamFormatter.format(value);
    }
}
