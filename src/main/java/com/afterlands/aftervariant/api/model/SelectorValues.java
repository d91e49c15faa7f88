package com.afterlands.aftervariant.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Observed value of every selector for one evaluation.
 *
 * <p>Iteration follows selector order. A selector whose parameter was missing
 * is listed in {@link #selectors()} but has no value.</p>
 */
public final class SelectorValues {

    private static final SelectorValues EMPTY = new SelectorValues(Map.of());

    private final Map<String, String> values;

    private SelectorValues(@NotNull Map<String, String> values) {
        this.values = values;
    }

    @NotNull
    public static SelectorValues empty() {
        return EMPTY;
    }

    /**
     * Creates selector values from a map; null values mean "no value".
     *
     * @param values Selector name to observed value, in selector order
     * @return Selector values
     */
    @NotNull
    public static SelectorValues of(@NotNull Map<String, String> values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new SelectorValues(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    @Nullable
    public String get(@NotNull String selector) {
        return values.get(selector);
    }

    public boolean hasValue(@NotNull String selector) {
        return values.get(selector) != null;
    }

    @NotNull
    public Set<String> selectors() {
        return values.keySet();
    }

    @NotNull
    public Map<String, String> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SelectorValues other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SelectorValues" + values;
    }
}
