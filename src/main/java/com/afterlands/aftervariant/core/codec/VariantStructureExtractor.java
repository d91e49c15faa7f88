package com.afterlands.aftervariant.core.codec;

import com.afterlands.aftervariant.api.diagnostic.Diagnostic;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticCode;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.model.Declaration;
import com.afterlands.aftervariant.api.model.MatchEntry;
import com.afterlands.aftervariant.api.model.VariantStructure;
import com.afterlands.aftervariant.core.declaration.DeclarationParser;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Recognizes stored translation values that hold a variant structure.
 *
 * <h3>Accepted Shapes:</h3>
 * <ol>
 *     <li>a sequence ({@link List}, array, {@link JsonArray}) whose first element has
 *     a {@code match} field that is not null, empty, zero or false: a {@link VariantStructure},
 *     a {@link Map} or a {@link JsonObject}</li>
 *     <li>text whose trimmed form starts with {@code [{}, decoded as JSON and then
 *     checked as in 1</li>
 * </ol>
 *
 * <p>Anything else (a plain template string, null, numbers) is not a variant and
 * yields empty. Text that looks encoded but fails to decode also yields empty,
 * with an {@link DiagnosticCode#UNPARSEABLE_VARIANT} diagnostic.</p>
 */
public class VariantStructureExtractor {

    private static final String ENCODED_PREFIX = "[{";

    private final VariantStructureCodec codec;
    private final DeclarationParser declarationParser;
    private final DiagnosticListener diagnostics;

    public VariantStructureExtractor(
            @NotNull VariantStructureCodec codec,
            @NotNull DeclarationParser declarationParser,
            @NotNull DiagnosticListener diagnostics
    ) {
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.declarationParser = Objects.requireNonNull(declarationParser, "declarationParser cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
    }

    /**
     * Extracts the variant structure held by a stored value.
     *
     * @param rawValue Stored value in any shape
     * @return Variant structure, or empty for simple (non-variant) values
     */
    @NotNull
    public Optional<VariantStructure> extract(@Nullable Object rawValue) {
        if (rawValue == null) {
            return Optional.empty();
        }
        if (rawValue instanceof CharSequence text) {
            return extractFromText(text.toString());
        }
        if (rawValue instanceof JsonArray array) {
            return array.isEmpty() ? Optional.empty() : fromElement(array.get(0));
        }
        if (rawValue instanceof List<?> list) {
            return list.isEmpty() ? Optional.empty() : fromElement(list.get(0));
        }
        if (rawValue instanceof Object[] array) {
            return array.length == 0 ? Optional.empty() : fromElement(array[0]);
        }
        return Optional.empty();
    }

    /**
     * Checks whether a stored value holds a variant structure.
     *
     * @param rawValue Stored value
     * @return true if {@link #extract(Object)} finds a structure
     */
    public boolean isVariant(@Nullable Object rawValue) {
        return extract(rawValue).isPresent();
    }

    @NotNull
    private Optional<VariantStructure> extractFromText(@NotNull String text) {
        if (!text.trim().startsWith(ENCODED_PREFIX)) {
            return Optional.empty();
        }

        JsonElement parsed;
        try {
            parsed = codec.parse(text);
        } catch (JsonParseException e) {
            diagnostics.report(Diagnostic.of(
                    DiagnosticCode.UNPARSEABLE_VARIANT,
                    "Failed to decode variant: " + e.getMessage(),
                    text
            ));
            return Optional.empty();
        }

        if (!parsed.isJsonArray() || parsed.getAsJsonArray().isEmpty()) {
            return Optional.empty();
        }
        return fromElement(parsed.getAsJsonArray().get(0));
    }

    @NotNull
    private Optional<VariantStructure> fromElement(@Nullable Object element) {
        if (element instanceof VariantStructure variant) {
            return Optional.of(variant);
        }
        if (element instanceof JsonObject object) {
            return isPresent(object.get(VariantStructureCodec.MATCH))
                    ? Optional.of(codec.fromJson(object))
                    : Optional.empty();
        }
        if (element instanceof Map<?, ?> map) {
            return isPresent(map.get(VariantStructureCodec.MATCH))
                    ? Optional.of(fromMap(map))
                    : Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Whether a {@code match} value marks a variant.
     *
     * <p>Null, {@code ""}, {@code 0} and {@code false} count as absent; any other
     * value does, even when it is not a usable table.</p>
     */
    private static boolean isPresent(@Nullable Object match) {
        if (match == null || match instanceof JsonNull) {
            return false;
        }
        if (match instanceof JsonPrimitive primitive) {
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                return isNonZero(primitive.getAsNumber());
            }
            return !primitive.getAsString().isEmpty();
        }
        if (match instanceof Boolean bool) {
            return bool;
        }
        if (match instanceof Number number) {
            return isNonZero(number);
        }
        if (match instanceof CharSequence text) {
            return text.length() > 0;
        }
        return true;
    }

    private static boolean isNonZero(@NotNull Number number) {
        double value = number.doubleValue();
        return value != 0 && !Double.isNaN(value);
    }

    @NotNull
    private VariantStructure fromMap(@NotNull Map<?, ?> map) {
        List<Declaration> declarations = new ArrayList<>();
        for (Object raw : asList(map.get(VariantStructureCodec.DECLARATIONS))) {
            if (raw instanceof Declaration declaration) {
                declarations.add(declaration);
            } else if (raw instanceof String text && !text.isEmpty()) {
                declarations.add(declarationParser.parse(text));
            }
        }

        List<String> selectors = new ArrayList<>();
        for (Object selector : asList(map.get(VariantStructureCodec.SELECTORS))) {
            if (selector instanceof String name) {
                selectors.add(name);
            }
        }

        return new VariantStructure(declarations, selectors, matchEntries(map.get(VariantStructureCodec.MATCH)));
    }

    /**
     * Reads a match table from an ordered map or a list of entries.
     */
    @Nullable
    private static List<MatchEntry> matchEntries(@Nullable Object match) {
        if (match instanceof Map<?, ?> map) {
            List<MatchEntry> entries = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.add(MatchEntry.of(String.valueOf(entry.getKey()), templateText(entry.getValue())));
            }
            return entries;
        }
        if (match instanceof List<?> list) {
            List<MatchEntry> entries = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item instanceof MatchEntry entry) {
                    entries.add(entry);
                } else if (item instanceof Map.Entry<?, ?> pair) {
                    entries.add(MatchEntry.of(String.valueOf(pair.getKey()), templateText(pair.getValue())));
                } else {
                    return null;
                }
            }
            return entries;
        }
        return null;
    }

    @NotNull
    private static String templateText(@Nullable Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    @NotNull
    private static List<?> asList(@Nullable Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return List.of();
    }
}
