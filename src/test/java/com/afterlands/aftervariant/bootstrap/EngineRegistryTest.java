package com.afterlands.aftervariant.bootstrap;

import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.model.MatchEntry;
import com.afterlands.aftervariant.api.model.PluralType;
import com.afterlands.aftervariant.api.model.VariantStructure;
import com.afterlands.aftervariant.core.config.EngineConfig;
import com.afterlands.aftervariant.core.diagnostic.LoggingDiagnosticListener;
import com.afterlands.aftervariant.core.plural.IcuPluralCategorizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineRegistryTest {

    private static final Logger LOGGER = Logger.getLogger("AfterVariantTest.registry");

    @Test
    void servicesRequireInitialization() {
        EngineRegistry registry = new EngineRegistry(EngineConfig.defaults(), LOGGER);

        assertThat(registry.isInitialized()).isFalse();
        assertThatThrownBy(registry::getResolutionAPI).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(registry::getCache).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void wiresDefaultServices() {
        EngineRegistry registry = new EngineRegistry(EngineConfig.defaults(), LOGGER).initialize();

        assertThat(registry.isInitialized()).isTrue();
        assertThat(registry.getCategorizer()).isInstanceOf(IcuPluralCategorizer.class);
        assertThat(registry.getDiagnostics()).isInstanceOf(LoggingDiagnosticListener.class);
        assertThat(registry.initialize().getResolutionAPI()).isSameAs(registry.getResolutionAPI());
    }

    @Test
    void diagnosticsLoggingCanBeDisabled() {
        EngineConfig config = new EngineConfig(Map.of("diagnostics", Map.of("log", false)));

        EngineRegistry registry = new EngineRegistry(config, LOGGER).initialize();

        assertThat(registry.getDiagnostics()).isSameAs(DiagnosticListener.NONE);
    }

    @Test
    void usesConfiguredDefaultLocale() {
        EngineConfig config = new EngineConfig(Map.of("default-locale", "pl"));
        EngineRegistry registry = new EngineRegistry(config, LOGGER).initialize();
        VariantStructure files = VariantStructure.ofMatch(List.of(MatchEntry.of("n=*", "{n}")));

        assertThat(registry.getResolutionAPI().render(files, Map.of("n", 3), null)).isEqualTo("3");
        assertThat(registry.getResolutionAPI().pluralCategories(null, PluralType.CARDINAL)).hasSize(4);
    }

    @Test
    void shutdownClearsCaches() {
        EngineRegistry registry = new EngineRegistry(EngineConfig.defaults(), LOGGER).initialize();
        VariantStructure items = VariantStructure.ofMatch(List.of(MatchEntry.of("n=*", "{n} items")));
        registry.getResolutionAPI().render(items, Map.of("n", 2), "en");
        assertThat(registry.getCache().getTemplateSize()).isEqualTo(1);

        registry.shutdown();

        assertThat(registry.isInitialized()).isFalse();
        assertThatThrownBy(registry::getResolutionAPI).isInstanceOf(IllegalStateException.class);
    }
}
