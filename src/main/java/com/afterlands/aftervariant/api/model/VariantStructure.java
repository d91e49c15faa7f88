package com.afterlands.aftervariant.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A variant message: declarations, selectors and the ordered match table.
 *
 * <p>The order of {@link #match()} decides which entry wins (first match wins),
 * so it is held as a list and every copy preserves it.</p>
 *
 * <h3>Example:</h3>
 * <pre>{@code
 * VariantStructure items = VariantStructure.of(
 *         List.of(Declaration.Input.of("count"), ...),
 *         List.of("countPlural"),
 *         List.of(
 *                 MatchEntry.of("countPlural=one", "1 item"),
 *                 MatchEntry.of("countPlural=other", "{count} items")
 *         )
 * );
 * }</pre>
 *
 * @param declarations Declarations in stored order
 * @param selectors Explicit selector names; empty means "infer from match keys"
 * @param match Match table, or null when the stored value had no usable table
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public record VariantStructure(
        @NotNull List<Declaration> declarations,
        @NotNull List<String> selectors,
        @Nullable List<MatchEntry> match
) {

    public VariantStructure {
        declarations = declarations == null ? List.of() : List.copyOf(declarations);
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
        match = match == null ? null : List.copyOf(match);
    }

    @NotNull
    public static VariantStructure of(
            @NotNull List<Declaration> declarations,
            @NotNull List<String> selectors,
            @NotNull List<MatchEntry> match
    ) {
        return new VariantStructure(declarations, selectors, match);
    }

    /**
     * Creates a structure with only a match table (direct matching).
     *
     * @param match Match table
     * @return Variant structure
     */
    @NotNull
    public static VariantStructure ofMatch(@NotNull List<MatchEntry> match) {
        return new VariantStructure(List.of(), List.of(), match);
    }

    public boolean hasMatch() {
        return match != null;
    }

    /**
     * Match table, or an empty list when there is none.
     */
    @NotNull
    public List<MatchEntry> entries() {
        return match == null ? List.of() : match;
    }

    /**
     * Pattern keys in table order.
     *
     * @return Keys (empty if no match table)
     */
    @NotNull
    public List<String> keys() {
        List<String> keys = new ArrayList<>(entries().size());
        for (MatchEntry entry : entries()) {
            keys.add(entry.key());
        }
        return Collections.unmodifiableList(keys);
    }

    /**
     * Looks up the template stored under a key.
     *
     * @param key Pattern key text
     * @return Template, or empty if the key is not in the table
     */
    @NotNull
    public Optional<String> template(@NotNull String key) {
        for (MatchEntry entry : entries()) {
            if (entry.key().equals(key)) {
                return Optional.of(entry.template());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy with the template of one key replaced.
     *
     * <p>An existing key keeps its position; a new key is appended, so the
     * precedence of the other entries is unchanged.</p>
     *
     * @param key Pattern key text
     * @param template New template
     * @return Updated copy
     */
    @NotNull
    public VariantStructure withTemplate(@NotNull String key, @NotNull String template) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(template, "template cannot be null");

        List<MatchEntry> updated = new ArrayList<>(entries().size() + 1);
        boolean replaced = false;
        for (MatchEntry entry : entries()) {
            if (!replaced && entry.key().equals(key)) {
                updated.add(MatchEntry.of(key, template));
                replaced = true;
            } else {
                updated.add(entry);
            }
        }
        if (!replaced) {
            updated.add(MatchEntry.of(key, template));
        }
        return new VariantStructure(declarations, selectors, updated);
    }
}
