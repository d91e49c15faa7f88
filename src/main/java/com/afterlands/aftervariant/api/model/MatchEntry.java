package com.afterlands.aftervariant.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One row of a match table: pattern key and the template it selects.
 *
 * @param key Pattern key text (e.g., "countPlural=one, gender=*")
 * @param template Template text with {@code {placeholder}} syntax
 */
public record MatchEntry(@NotNull String key, @NotNull String template) {

    public MatchEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(template, "template cannot be null");
    }

    @NotNull
    public static MatchEntry of(@NotNull String key, @NotNull String template) {
        return new MatchEntry(key, template);
    }
}
