package com.afterlands.aftervariant.bootstrap;

import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.service.VariantResolutionAPI;
import com.afterlands.aftervariant.core.cache.VariantCache;
import com.afterlands.aftervariant.core.codec.VariantStructureCodec;
import com.afterlands.aftervariant.core.codec.VariantStructureExtractor;
import com.afterlands.aftervariant.core.config.EngineConfig;
import com.afterlands.aftervariant.core.declaration.DeclarationParser;
import com.afterlands.aftervariant.core.diagnostic.LoggingDiagnosticListener;
import com.afterlands.aftervariant.core.locale.LocaleResolver;
import com.afterlands.aftervariant.core.match.PatternKeyParser;
import com.afterlands.aftervariant.core.match.PatternMatcher;
import com.afterlands.aftervariant.core.match.SelectorInference;
import com.afterlands.aftervariant.core.plural.IcuPluralCategorizer;
import com.afterlands.aftervariant.core.plural.PluralCategorizer;
import com.afterlands.aftervariant.core.selector.SelectorEvaluator;
import com.afterlands.aftervariant.core.service.VariantResolutionService;
import com.afterlands.aftervariant.core.template.TemplateEngine;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the engine's services.
 *
 * <h3>Service Initialization Order:</h3>
 * <ol>
 *     <li>Diagnostics (logging listener, or the supplied one)</li>
 *     <li>Cache (compiled templates, plural rule tables)</li>
 *     <li>Plural categorizer (ICU4J, or the supplied one)</li>
 *     <li>Parsers, matcher, selector evaluator, template engine</li>
 *     <li>Codec and extractor</li>
 *     <li>Resolution service</li>
 * </ol>
 *
 * <p>The services hold no per-call state; one registry can serve any number
 * of threads.</p>
 */
public class EngineRegistry {

    private final EngineConfig config;
    private final Logger logger;
    private final boolean debug;

    @Nullable
    private final PluralCategorizer categorizerOverride;
    @Nullable
    private final DiagnosticListener diagnosticsOverride;

    private DiagnosticListener diagnostics;
    private VariantCache cache;
    private PluralCategorizer categorizer;
    private VariantResolutionService resolutionService;

    private boolean initialized;

    public EngineRegistry(@NotNull EngineConfig config, @NotNull Logger logger) {
        this(config, logger, null, null);
    }

    /**
     * Creates a registry with replaced collaborators.
     *
     * @param config Engine configuration
     * @param logger Logger for output
     * @param categorizer Plural categorizer to use instead of ICU4J (optional)
     * @param diagnostics Diagnostic listener to use instead of logging (optional)
     */
    public EngineRegistry(
            @NotNull EngineConfig config,
            @NotNull Logger logger,
            @Nullable PluralCategorizer categorizer,
            @Nullable DiagnosticListener diagnostics
    ) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.debug = config.isDebug();
        this.categorizerOverride = categorizer;
        this.diagnosticsOverride = diagnostics;
    }

    /**
     * Initializes all services in dependency order.
     *
     * @return this registry
     */
    @NotNull
    public synchronized EngineRegistry initialize() {
        if (initialized) {
            return this;
        }
        logger.info("[Registry] Initializing services...");

        // 1. Diagnostics
        if (diagnosticsOverride != null) {
            this.diagnostics = diagnosticsOverride;
        } else if (config.isLogDiagnostics()) {
            this.diagnostics = new LoggingDiagnosticListener(logger, Level.WARNING,
                    config.isDeduplicateDiagnostics());
        } else {
            this.diagnostics = DiagnosticListener.NONE;
        }

        // 2. Cache
        this.cache = new VariantCache(
                config.getTemplateCacheSize(),
                config.getTemplateCacheTtlMinutes(),
                config.getPluralRulesCacheSize(),
                config.getLocaleCacheSize()
        );

        // 3. Plural categorizer
        this.categorizer = categorizerOverride != null ? categorizerOverride : new IcuPluralCategorizer(cache);

        // 4. Parsing, matching, rendering
        DeclarationParser declarationParser = new DeclarationParser(diagnostics);
        PatternKeyParser keyParser = new PatternKeyParser(diagnostics);
        PatternMatcher patternMatcher = new PatternMatcher(keyParser);
        SelectorEvaluator selectorEvaluator = new SelectorEvaluator(
                new SelectorInference(keyParser), categorizer, diagnostics);
        TemplateEngine templateEngine = new TemplateEngine(cache);

        // 5. Stored values
        VariantStructureCodec codec = new VariantStructureCodec(declarationParser);
        VariantStructureExtractor extractor = new VariantStructureExtractor(codec, declarationParser, diagnostics);

        // 6. Service
        this.resolutionService = new VariantResolutionService(
                declarationParser,
                selectorEvaluator,
                patternMatcher,
                templateEngine,
                extractor,
                codec,
                categorizer,
                new LocaleResolver(config.getDefaultLocale(), cache),
                diagnostics,
                logger,
                debug
        );

        initialized = true;
        if (debug) {
            logger.info("[Registry] " + config);
        }
        logger.info("[Registry] Services initialized (default locale: "
                + config.getDefaultLocale().toLanguageTag() + ")");
        return this;
    }

    /**
     * Releases cached data.
     */
    public synchronized void shutdown() {
        if (!initialized) {
            return;
        }
        if (debug) {
            logger.info("[Registry] Cache stats: " + cache.formatStats());
        }
        cache.invalidateAll();
        initialized = false;
        logger.info("[Registry] Services shut down");
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    @NotNull
    public synchronized VariantResolutionAPI getResolutionAPI() {
        requireInitialized();
        return resolutionService;
    }

    @NotNull
    public synchronized VariantCache getCache() {
        requireInitialized();
        return cache;
    }

    @NotNull
    public synchronized PluralCategorizer getCategorizer() {
        requireInitialized();
        return categorizer;
    }

    @NotNull
    public synchronized DiagnosticListener getDiagnostics() {
        requireInitialized();
        return diagnostics;
    }

    @NotNull
    public EngineConfig getConfig() {
        return config;
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("EngineRegistry not initialized; call initialize() first");
        }
    }
}
