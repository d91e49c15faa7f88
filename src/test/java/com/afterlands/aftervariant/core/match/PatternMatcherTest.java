package com.afterlands.aftervariant.core.match;

import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.model.MatchEntry;
import com.afterlands.aftervariant.api.model.SelectorValues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PatternMatcherTest {

    private PatternMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new PatternMatcher(new PatternKeyParser(DiagnosticListener.NONE));
    }

    @Test
    void wildcardEntryCatchesUnlistedValue() {
        List<MatchEntry> match = List.of(
                MatchEntry.of("platform=android", "A"),
                MatchEntry.of("platform=*", "Def")
        );

        assertThat(matcher.findFirst(match, values("platform", "ios")))
                .contains(MatchEntry.of("platform=*", "Def"));
    }

    @Test
    void exactEntryWinsWhenListedFirst() {
        List<MatchEntry> match = List.of(
                MatchEntry.of("platform=android", "A"),
                MatchEntry.of("platform=*", "Def")
        );

        assertThat(matcher.findFirst(match, values("platform", "android")))
                .contains(MatchEntry.of("platform=android", "A"));
    }

    @Test
    void firstSatisfiedEntryWinsOverMoreSpecificLaterEntry() {
        List<MatchEntry> match = List.of(
                MatchEntry.of("countPlural=one, gender=*", "They have 1"),
                MatchEntry.of("countPlural=one, gender=female", "She has 1")
        );

        assertThat(matcher.findFirst(match, values("countPlural", "one", "gender", "female")))
                .contains(MatchEntry.of("countPlural=one, gender=*", "They have 1"));
    }

    @Test
    void multiSelectorRequiresEveryCondition() {
        List<MatchEntry> match = List.of(
                MatchEntry.of("countPlural=one, gender=male", "He has 1"),
                MatchEntry.of("countPlural=one, gender=female", "She has 1"),
                MatchEntry.of("countPlural=one, gender=*", "They have 1"),
                MatchEntry.of("countPlural=other, gender=*", "They have {count}")
        );

        assertThat(matcher.findFirst(match, values("countPlural", "one", "gender", "female")))
                .map(MatchEntry::template).contains("She has 1");
        assertThat(matcher.findFirst(match, values("countPlural", "one", "gender", "other")))
                .map(MatchEntry::template).contains("They have 1");
        assertThat(matcher.findFirst(match, values("countPlural", "other", "gender", "male")))
                .map(MatchEntry::template).contains("They have {count}");
    }

    @Test
    void noSatisfiedEntryGivesEmpty() {
        List<MatchEntry> match = List.of(
                MatchEntry.of("platform=android", "A"),
                MatchEntry.of("platform=ios", "I")
        );

        assertThat(matcher.findFirst(match, values("platform", "web"))).isEmpty();
        assertThat(matcher.findFirst(List.of(), values("platform", "web"))).isEmpty();
    }

    @Test
    void missingValueOnlySatisfiesWildcard() {
        Map<String, String> raw = new HashMap<>();
        raw.put("platform", null);
        SelectorValues missing = SelectorValues.of(raw);

        List<MatchEntry> match = List.of(
                MatchEntry.of("platform=null", "N"),
                MatchEntry.of("platform=*", "Any")
        );

        assertThat(matcher.findFirst(match, missing)).map(MatchEntry::template).contains("Any");
    }

    @Test
    void comparisonIsExactString() {
        List<MatchEntry> match = List.of(MatchEntry.of("count=5", "five"));

        assertThat(matcher.findFirst(match, values("count", "5.0"))).isEmpty();
        assertThat(matcher.findFirst(match, values("count", "5"))).isPresent();
    }

    private static SelectorValues values(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return SelectorValues.of(map);
    }
}
