package com.afterlands.aftervariant.core.service;

import com.afterlands.aftervariant.api.diagnostic.Diagnostic;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticCode;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.model.Declaration;
import com.afterlands.aftervariant.api.model.MatchEntry;
import com.afterlands.aftervariant.api.model.PluralCategory;
import com.afterlands.aftervariant.api.model.PluralType;
import com.afterlands.aftervariant.api.model.SelectorValues;
import com.afterlands.aftervariant.api.model.VariantStructure;
import com.afterlands.aftervariant.api.service.VariantResolutionAPI;
import com.afterlands.aftervariant.core.codec.VariantStructureCodec;
import com.afterlands.aftervariant.core.codec.VariantStructureExtractor;
import com.afterlands.aftervariant.core.declaration.DeclarationParser;
import com.afterlands.aftervariant.core.locale.LocaleResolver;
import com.afterlands.aftervariant.core.match.PatternMatcher;
import com.afterlands.aftervariant.core.plural.PluralCategorizer;
import com.afterlands.aftervariant.core.selector.SelectorEvaluator;
import com.afterlands.aftervariant.core.template.TemplateEngine;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Implementation of {@link VariantResolutionAPI}.
 *
 * <h3>Resolution Pipeline:</h3>
 * <ol>
 *     <li>Resolve the locale code (default locale when absent)</li>
 *     <li>Evaluate selectors ({@link SelectorEvaluator})</li>
 *     <li>Pick the first satisfied entry ({@link PatternMatcher}), or the first
 *     entry when none is satisfied</li>
 *     <li>Render its template ({@link TemplateEngine}) or return its key</li>
 * </ol>
 *
 * <p>Render and detect share steps 1 to 3, so the key reported as active is
 * always the key of the template that gets rendered.</p>
 */
public class VariantResolutionService implements VariantResolutionAPI {

    private final DeclarationParser declarationParser;
    private final SelectorEvaluator selectorEvaluator;
    private final PatternMatcher patternMatcher;
    private final TemplateEngine templateEngine;
    private final VariantStructureExtractor extractor;
    private final VariantStructureCodec codec;
    private final PluralCategorizer categorizer;
    private final LocaleResolver localeResolver;
    private final DiagnosticListener diagnostics;
    private final Logger logger;
    private final boolean debug;

    public VariantResolutionService(
            @NotNull DeclarationParser declarationParser,
            @NotNull SelectorEvaluator selectorEvaluator,
            @NotNull PatternMatcher patternMatcher,
            @NotNull TemplateEngine templateEngine,
            @NotNull VariantStructureExtractor extractor,
            @NotNull VariantStructureCodec codec,
            @NotNull PluralCategorizer categorizer,
            @NotNull LocaleResolver localeResolver,
            @NotNull DiagnosticListener diagnostics,
            @NotNull Logger logger,
            boolean debug
    ) {
        this.declarationParser = Objects.requireNonNull(declarationParser, "declarationParser cannot be null");
        this.selectorEvaluator = Objects.requireNonNull(selectorEvaluator, "selectorEvaluator cannot be null");
        this.patternMatcher = Objects.requireNonNull(patternMatcher, "patternMatcher cannot be null");
        this.templateEngine = Objects.requireNonNull(templateEngine, "templateEngine cannot be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.categorizer = Objects.requireNonNull(categorizer, "categorizer cannot be null");
        this.localeResolver = Objects.requireNonNull(localeResolver, "localeResolver cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = debug;
    }

    @Override
    @NotNull
    public String render(@NotNull VariantStructure variant, @NotNull Map<String, ?> params, @Nullable String locale) {
        Optional<MatchEntry> entry = resolveEntry(variant, params, locale, "render");
        if (entry.isEmpty()) {
            return "";
        }
        return templateEngine.render(entry.get().template(), params);
    }

    @Override
    @NotNull
    public Optional<String> detectActiveKey(
            @NotNull VariantStructure variant,
            @NotNull Map<String, ?> params,
            @Nullable String locale
    ) {
        return resolveEntry(variant, params, locale, "detect").map(MatchEntry::key);
    }

    @Override
    @NotNull
    public Optional<VariantStructure> extractVariantStructure(@Nullable Object rawValue) {
        return extractor.extract(rawValue);
    }

    @Override
    @NotNull
    public List<Declaration> parseDeclarations(@Nullable List<?> rawDeclarations) {
        return declarationParser.parseAll(rawDeclarations);
    }

    @Override
    @NotNull
    public String renderTemplate(@Nullable Object template, @NotNull Map<String, ?> params, @Nullable String locale) {
        if (template == null) {
            return "";
        }
        if (template instanceof VariantStructure variant) {
            return render(variant, params, locale);
        }

        Optional<VariantStructure> variant = template instanceof Map<?, ?>
                ? extractor.extract(List.of(template))
                : extractor.extract(template);
        if (variant.isPresent()) {
            return render(variant.get(), params, locale);
        }

        // Undecodable variant text is shown as a plain template
        if (template instanceof CharSequence text) {
            return templateEngine.render(text.toString(), params);
        }
        return "";
    }

    @Override
    @NotNull
    public SelectorValues evaluateSelectors(
            @NotNull VariantStructure variant,
            @NotNull Map<String, ?> params,
            @Nullable String locale
    ) {
        return selectorEvaluator.evaluate(variant, params, localeResolver.resolve(locale));
    }

    @Override
    @NotNull
    public String encode(@NotNull VariantStructure variant) {
        return codec.encode(variant);
    }

    @Override
    @NotNull
    public Set<PluralCategory> pluralCategories(@Nullable String locale, @NotNull PluralType type) {
        return categorizer.supportedCategories(localeResolver.resolve(locale), type);
    }

    /**
     * Selects the entry shared by render and detect.
     *
     * @return Winning entry, the first entry when nothing matched, or empty
     * when there is no entry at all
     */
    @NotNull
    private Optional<MatchEntry> resolveEntry(
            @NotNull VariantStructure variant,
            @NotNull Map<String, ?> params,
            @Nullable String localeCode,
            @NotNull String operation
    ) {
        if (!variant.hasMatch()) {
            diagnostics.report(Diagnostic.of(
                    DiagnosticCode.INVALID_STRUCTURE,
                    "Invalid variant: missing match table (" + operation + ")",
                    variant.declarations().isEmpty() ? "" : variant.declarations().get(0).raw()
            ));
            return Optional.empty();
        }

        List<MatchEntry> entries = variant.entries();
        if (entries.isEmpty()) {
            return Optional.empty();
        }

        Locale locale = localeResolver.resolve(localeCode);
        SelectorValues values = selectorEvaluator.evaluate(variant, params, locale);
        Optional<MatchEntry> winner = patternMatcher.findFirst(entries, values);

        if (debug) {
            logger.info("[VariantEngine] " + operation + " locale=" + locale.toLanguageTag() +
                        " selectors=" + values.asMap() +
                        " match=" + winner.map(MatchEntry::key).orElse("<none>"));
        }

        if (winner.isPresent()) {
            return winner;
        }

        MatchEntry first = entries.get(0);
        diagnostics.report(Diagnostic.of(
                DiagnosticCode.NO_MATCH,
                "No matching template found for " + values.asMap() + ", using first entry",
                first.key()
        ));
        return Optional.of(first);
    }
}
