package com.afterlands.aftervariant.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named value source of a variant message.
 *
 * <p>One of exactly three shapes, identified by {@link #kind()}:</p>
 * <ul>
 *     <li>{@link Input} - {@code input count}: the parameter is used verbatim</li>
 *     <li>{@link Local} - {@code local countPlural = count: plural}: derived from a
 *     source parameter by a transform</li>
 *     <li>{@link Unknown} - text that matched neither grammar; evaluation falls back
 *     to a parameter lookup by selector name</li>
 * </ul>
 *
 * <p>Consumers dispatch with a {@code switch} on {@link Kind} so that each shape
 * has to be handled. Every shape keeps the text it was parsed from, which is
 * what gets written back when a structure is re-encoded.</p>
 *
 * @author AfterLands Team
 * @since 1.0.0
 */
public interface Declaration {

    enum Kind {
        INPUT,
        LOCAL,
        UNKNOWN
    }

    @NotNull
    Kind kind();

    /**
     * Name this declaration binds, matched against selector names.
     *
     * @return Declared name, or null for {@link Unknown}
     */
    @Nullable
    String name();

    /**
     * Declaration text as it was stored.
     *
     * @return Raw declaration text
     */
    @NotNull
    String raw();

    /**
     * {@code input <name>}.
     *
     * @param name Parameter name
     * @param raw Raw text
     */
    record Input(@NotNull String name, @NotNull String raw) implements Declaration {

        public Input {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(raw, "raw cannot be null");
        }

        @NotNull
        public static Input of(@NotNull String name) {
            return new Input(name, "input " + name);
        }

        @Override
        @NotNull
        public Kind kind() {
            return Kind.INPUT;
        }
    }

    /**
     * {@code local <name> = <source>: <transform> [key=value ...]}.
     *
     * @param name Local variable name
     * @param source Parameter the value is derived from
     * @param transform Transform name (e.g., "plural")
     * @param options Transform options in declaration order (e.g., type=ordinal)
     * @param raw Raw text
     */
    record Local(
            @NotNull String name,
            @NotNull String source,
            @NotNull String transform,
            @NotNull Map<String, String> options,
            @NotNull String raw
    ) implements Declaration {

        /**
         * Transform name that maps a number to its plural category.
         */
        public static final String PLURAL_TRANSFORM = "plural";

        public Local {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(source, "source cannot be null");
            Objects.requireNonNull(transform, "transform cannot be null");
            Objects.requireNonNull(raw, "raw cannot be null");
            options = options == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        }

        /**
         * Creates a local declaration and writes its text from the fields.
         *
         * <pre>
         * Local.of("ord", "pos", "plural", Map.of("type", "ordinal"))
         *   -> "local ord = pos: plural type=ordinal"
         * </pre>
         *
         * @param name Local variable name
         * @param source Source parameter
         * @param transform Transform name
         * @param options Transform options in order (may be empty)
         * @return Local declaration whose raw text parses back to the same fields
         */
        @NotNull
        public static Local of(
                @NotNull String name,
                @NotNull String source,
                @NotNull String transform,
                @NotNull Map<String, String> options
        ) {
            StringBuilder raw = new StringBuilder("local ")
                    .append(name).append(" = ").append(source).append(": ").append(transform);
            options.forEach((key, value) -> raw.append(' ').append(key).append('=').append(value));
            return new Local(name, source, transform, options, raw.toString());
        }

        public boolean isPlural() {
            return PLURAL_TRANSFORM.equals(transform);
        }

        @NotNull
        public PluralType pluralType() {
            return PluralType.fromOptions(options);
        }

        @Override
        @NotNull
        public Kind kind() {
            return Kind.LOCAL;
        }
    }

    /**
     * Declaration text that matched no known grammar.
     *
     * <p>Construction never fails, so malformed input always stays representable.</p>
     *
     * @param raw Raw text
     */
    record Unknown(@NotNull String raw) implements Declaration {

        public Unknown {
            raw = raw == null ? "" : raw;
        }

        @Override
        @NotNull
        public Kind kind() {
            return Kind.UNKNOWN;
        }

        @Override
        @Nullable
        public String name() {
            return null;
        }
    }
}
