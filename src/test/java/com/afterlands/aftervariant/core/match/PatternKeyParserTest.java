package com.afterlands.aftervariant.core.match;

import com.afterlands.aftervariant.api.diagnostic.DiagnosticCode;
import com.afterlands.aftervariant.api.model.PatternKey;
import com.afterlands.aftervariant.testing.RecordingDiagnosticListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatternKeyParserTest {

    private RecordingDiagnosticListener diagnostics;
    private PatternKeyParser parser;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnosticListener();
        parser = new PatternKeyParser(diagnostics);
    }

    @Test
    void parsesSingleCondition() {
        PatternKey key = parser.parse("countPlural=one");

        assertThat(key.raw()).isEqualTo("countPlural=one");
        assertThat(key.conditions()).containsExactly(new PatternKey.Condition("countPlural", "one"));
    }

    @Test
    void parsesConditionsInKeyOrderAndTrimsWhitespace() {
        PatternKey key = parser.parse("  gender = male ,countPlural=one");

        assertThat(key.selectorNames()).containsExactly("gender", "countPlural");
        assertThat(key.conditions().get(0).value()).isEqualTo("male");
    }

    @Test
    void recognizesWildcard() {
        PatternKey key = parser.parse("countPlural=other, gender=*");

        assertThat(key.conditions().get(0).isWildcard()).isFalse();
        assertThat(key.conditions().get(1).isWildcard()).isTrue();
    }

    @Test
    void skipsMalformedClausesWithDiagnostic() {
        PatternKey key = parser.parse("platform, =ios, os=, device=phone");

        assertThat(key.conditions()).containsExactly(new PatternKey.Condition("device", "phone"));
        assertThat(diagnostics.codes()).containsOnly(DiagnosticCode.INVALID_PATTERN_KEY).hasSize(3);
    }

    @Test
    void repeatedSelectorKeepsFirstPositionAndLastValue() {
        PatternKey key = parser.parse("a=1, b=2, a=3");

        assertThat(key.conditions()).containsExactly(
                new PatternKey.Condition("a", "3"),
                new PatternKey.Condition("b", "2")
        );
    }

    @Test
    void emptyKeyHasNoConditions() {
        assertThat(parser.parse("").conditions()).isEmpty();
        assertThat(diagnostics.all()).isEmpty();
    }
}
