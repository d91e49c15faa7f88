package com.afterlands.aftervariant.core.match;

import com.afterlands.aftervariant.api.model.MatchEntry;
import com.afterlands.aftervariant.api.model.PatternKey;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives selector names from match keys when a structure declares none.
 *
 * <p>Names are collected in first-seen order across the keys, in table order:</p>
 * <pre>
 * ["platform=android", "platform=*"]                     -> [platform]
 * ["gender=male, countPlural=one", "countPlural=other"]  -> [gender, countPlural]
 * </pre>
 */
public class SelectorInference {

    private final PatternKeyParser keyParser;

    public SelectorInference(@NotNull PatternKeyParser keyParser) {
        this.keyParser = Objects.requireNonNull(keyParser, "keyParser cannot be null");
    }

    @NotNull
    public List<String> infer(@NotNull List<MatchEntry> match) {
        Set<String> names = new LinkedHashSet<>();
        for (MatchEntry entry : match) {
            PatternKey key = keyParser.parse(entry.key());
            names.addAll(key.selectorNames());
        }
        return List.copyOf(names);
    }
}
