package com.afterlands.aftervariant.core.match;

import com.afterlands.aftervariant.api.model.MatchEntry;
import com.afterlands.aftervariant.api.model.PatternKey;
import com.afterlands.aftervariant.api.model.SelectorValues;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects the match entry for a set of selector values.
 *
 * <p>Entries are tried in table order and the first one whose conditions all
 * hold wins, even when a later entry is more specific. Producers emit specific
 * keys before wildcard ones, so this reproduces their selection exactly:</p>
 * <pre>
 * countPlural=one, gender=male    -> "He has 1"
 * countPlural=one, gender=female  -> "She has 1"
 * countPlural=one, gender=*       -> "They have 1"
 * countPlural=other, gender=*     -> "They have {count}"
 * </pre>
 *
 * <p>A condition holds when its value is the wildcard or equals the observed
 * value. A selector without an observed value only satisfies the wildcard.</p>
 */
public class PatternMatcher {

    private final PatternKeyParser keyParser;

    public PatternMatcher(@NotNull PatternKeyParser keyParser) {
        this.keyParser = Objects.requireNonNull(keyParser, "keyParser cannot be null");
    }

    /**
     * Finds the first satisfied entry.
     *
     * @param match Match table in producer order
     * @param values Observed selector values
     * @return Winning entry, or empty when no entry is satisfied
     */
    @NotNull
    public Optional<MatchEntry> findFirst(@NotNull List<MatchEntry> match, @NotNull SelectorValues values) {
        for (MatchEntry entry : match) {
            if (matches(keyParser.parse(entry.key()), values)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public boolean matches(@NotNull PatternKey key, @NotNull SelectorValues values) {
        for (PatternKey.Condition condition : key.conditions()) {
            if (condition.isWildcard()) {
                continue;
            }
            String actual = values.get(condition.selector());
            if (actual == null || !actual.equals(condition.value())) {
                return false;
            }
        }
        return true;
    }
}
