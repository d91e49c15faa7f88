package com.afterlands.aftervariant.core.cache;

import com.afterlands.aftervariant.api.model.PluralType;
import com.afterlands.aftervariant.core.template.TemplateEngine;
import com.ibm.icu.text.PluralRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariantCacheTest {

    private VariantCache cache;

    @BeforeEach
    void setUp() {
        cache = new VariantCache(100, 30, 16, 32);
    }

    @Test
    void compilesTemplateOnce() {
        TemplateEngine engine = new TemplateEngine(null);
        AtomicInteger compilations = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            cache.getTemplate("{count} items", template -> {
                compilations.incrementAndGet();
                return engine.compile(template);
            });
        }

        assertThat(compilations).hasValue(1);
        assertThat(cache.getTemplateStats().hitCount()).isEqualTo(2);
    }

    @Test
    void pluralRulesAreKeyedByLocaleAndType() {
        AtomicInteger loads = new AtomicInteger();

        cache.getPluralRules(Locale.ENGLISH, PluralType.CARDINAL, key -> load(loads, key));
        cache.getPluralRules(Locale.ENGLISH, PluralType.CARDINAL, key -> load(loads, key));
        cache.getPluralRules(Locale.ENGLISH, PluralType.ORDINAL, key -> load(loads, key));
        cache.getPluralRules(Locale.forLanguageTag("pl"), PluralType.CARDINAL, key -> load(loads, key));

        assertThat(loads).hasValue(3);
        assertThat(cache.getPluralRulesSize()).isEqualTo(3);
    }

    @Test
    void localesAreResolvedOncePerCode() {
        AtomicInteger resolutions = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            cache.getLocale("pt_BR", code -> {
                resolutions.incrementAndGet();
                return Locale.forLanguageTag("pt-BR");
            });
        }

        assertThat(resolutions).hasValue(1);
        assertThat(cache.getLocaleSize()).isEqualTo(1);
    }

    @Test
    void localeTierIsBounded() {
        for (int i = 0; i < 1_000; i++) {
            cache.getLocale("code-" + i, code -> Locale.ENGLISH);
        }

        cache.cleanUp();

        assertThat(cache.getLocaleSize()).isLessThanOrEqualTo(32);
    }

    @Test
    void invalidation() {
        cache.getTemplate("a", new TemplateEngine(null)::compile);
        cache.getPluralRules(Locale.ENGLISH, PluralType.CARDINAL, key -> PluralRules.DEFAULT);

        cache.invalidateTemplates();
        assertThat(cache.getTemplateSize()).isZero();
        assertThat(cache.getPluralRulesSize()).isEqualTo(1);

        cache.getLocale("en", code -> Locale.ENGLISH);
        cache.invalidateAll();
        assertThat(cache.getPluralRulesSize()).isZero();
        assertThat(cache.getLocaleSize()).isZero();
    }

    @Test
    void formatsStats() {
        assertThat(cache.formatStats()).contains("Templates: 0/100").contains("Plural rules: 0/16")
                .contains("Locales: 0/32");
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new VariantCache(-1, 30, 16, 32)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VariantCache(10, 0, 16, 32)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VariantCache(10, 30, 16, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static PluralRules load(AtomicInteger loads, String key) {
        loads.incrementAndGet();
        return PluralRules.DEFAULT;
    }
}
