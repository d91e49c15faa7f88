package com.afterlands.aftervariant.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed match key: the ordered conditions of {@code sel1=val1, sel2=val2}.
 *
 * @param raw Key text as it appears in the match table
 * @param conditions Conditions in key order
 */
public record PatternKey(@NotNull String raw, @NotNull List<Condition> conditions) {

    /**
     * Value that satisfies a condition regardless of the observed value.
     */
    public static final String WILDCARD = "*";

    public PatternKey {
        Objects.requireNonNull(raw, "raw cannot be null");
        Objects.requireNonNull(conditions, "conditions cannot be null");
        conditions = List.copyOf(conditions);
    }

    /**
     * Selector names referenced by this key, in key order.
     *
     * @return Selector names
     */
    @NotNull
    public List<String> selectorNames() {
        List<String> names = new ArrayList<>(conditions.size());
        for (Condition condition : conditions) {
            names.add(condition.selector());
        }
        return names;
    }

    /**
     * A single {@code selector=value} clause.
     *
     * @param selector Selector name
     * @param value Expected value, or {@value PatternKey#WILDCARD}
     */
    public record Condition(@NotNull String selector, @NotNull String value) {

        public Condition {
            Objects.requireNonNull(selector, "selector cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }

        public boolean isWildcard() {
            return WILDCARD.equals(value);
        }

        @Override
        public String toString() {
            return selector + "=" + value;
        }
    }
}
