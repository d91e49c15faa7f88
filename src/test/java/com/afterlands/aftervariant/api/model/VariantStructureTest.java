package com.afterlands.aftervariant.api.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariantStructureTest {

    private final VariantStructure platform = VariantStructure.ofMatch(List.of(
            MatchEntry.of("platform=android", "Android"),
            MatchEntry.of("platform=*", "Other")
    ));

    @Test
    void keysFollowTableOrder() {
        assertThat(platform.keys()).containsExactly("platform=android", "platform=*");
    }

    @Test
    void looksUpTemplateByKey() {
        assertThat(platform.template("platform=*")).contains("Other");
        assertThat(platform.template("platform=ios")).isEmpty();
    }

    @Test
    void withTemplateReplacesInPlace() {
        VariantStructure edited = platform.withTemplate("platform=android", "Droid");

        assertThat(edited.entries()).containsExactly(
                MatchEntry.of("platform=android", "Droid"),
                MatchEntry.of("platform=*", "Other")
        );
        assertThat(platform.template("platform=android")).contains("Android");
    }

    @Test
    void withTemplateAppendsNewKey() {
        VariantStructure edited = platform.withTemplate("platform=ios", "iOS");

        assertThat(edited.keys()).containsExactly("platform=android", "platform=*", "platform=ios");
    }

    @Test
    void copiesAreImmutable() {
        List<MatchEntry> source = new ArrayList<>(List.of(MatchEntry.of("a=1", "x")));
        VariantStructure variant = VariantStructure.ofMatch(source);
        source.add(MatchEntry.of("a=2", "y"));

        assertThat(variant.entries()).hasSize(1);
        assertThatThrownBy(() -> variant.entries().add(MatchEntry.of("a=3", "z")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void missingTableIsDistinctFromEmptyTable() {
        VariantStructure missing = new VariantStructure(null, null, null);

        assertThat(missing.hasMatch()).isFalse();
        assertThat(missing.entries()).isEmpty();
        assertThat(missing.keys()).isEmpty();
        assertThat(VariantStructure.ofMatch(List.of()).hasMatch()).isTrue();
    }
}
