package com.afterlands.aftervariant.core.codec;

import com.afterlands.aftervariant.api.model.Declaration;
import com.afterlands.aftervariant.api.model.MatchEntry;
import com.afterlands.aftervariant.api.model.VariantStructure;
import com.afterlands.aftervariant.core.declaration.DeclarationParser;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of variant structures.
 *
 * <h3>Stored Shape:</h3>
 * <pre>{@code
 * [{
 *   "declarations": ["input count", "local countPlural = count: plural"],
 *   "selectors": ["countPlural"],
 *   "match": {
 *     "countPlural=one": "1 item",
 *     "countPlural=other": "{count} items"
 *   }
 * }]
 * }</pre>
 *
 * <p>The outer single-element array is kept for compatibility with stored
 * values. Member order of {@code match} is the match order and is preserved
 * in both directions.</p>
 */
public class VariantStructureCodec {

    static final String DECLARATIONS = "declarations";
    static final String SELECTORS = "selectors";
    static final String MATCH = "match";

    private final Gson gson;
    private final TypeAdapter<JsonElement> elementAdapter;
    private final DeclarationParser declarationParser;

    public VariantStructureCodec(@NotNull DeclarationParser declarationParser) {
        this.declarationParser = Objects.requireNonNull(declarationParser, "declarationParser cannot be null");
        this.gson = new GsonBuilder()
                .disableHtmlEscaping()
                .create();
        this.elementAdapter = gson.getAdapter(JsonElement.class);
    }

    // ==================== Encoding ====================

    /**
     * Encodes a structure in its stored shape.
     *
     * <p>Empty declarations and selectors are omitted. A structure without a
     * match table is written with an empty one.</p>
     *
     * @param variant Variant structure
     * @return JSON text
     */
    @NotNull
    public String encode(@NotNull VariantStructure variant) {
        JsonArray wrapper = new JsonArray();
        wrapper.add(toJson(variant));
        return gson.toJson(wrapper);
    }

    @NotNull
    public JsonObject toJson(@NotNull VariantStructure variant) {
        Objects.requireNonNull(variant, "variant cannot be null");
        JsonObject object = new JsonObject();

        if (!variant.declarations().isEmpty()) {
            JsonArray declarations = new JsonArray();
            for (Declaration declaration : variant.declarations()) {
                declarations.add(declaration.raw());
            }
            object.add(DECLARATIONS, declarations);
        }

        if (!variant.selectors().isEmpty()) {
            JsonArray selectors = new JsonArray();
            for (String selector : variant.selectors()) {
                selectors.add(selector);
            }
            object.add(SELECTORS, selectors);
        }

        JsonObject match = new JsonObject();
        for (MatchEntry entry : variant.entries()) {
            match.addProperty(entry.key(), entry.template());
        }
        object.add(MATCH, match);

        return object;
    }

    // ==================== Decoding ====================

    /**
     * Parses JSON text strictly.
     *
     * <p>Unquoted names, single quotes, {@code NaN}, comments and trailing
     * content are rejected, so such text stays a plain template.</p>
     *
     * @param json JSON text
     * @return Parsed element
     * @throws JsonParseException if the text is not strict JSON
     */
    @NotNull
    JsonElement parse(@NotNull String json) {
        try (JsonReader reader = new JsonReader(new StringReader(json))) {
            reader.setLenient(false);
            JsonElement element = elementAdapter.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonSyntaxException("Unexpected content after JSON document");
            }
            return element;
        } catch (IOException e) {
            throw new JsonSyntaxException(e.getMessage(), e);
        }
    }

    /**
     * Converts a JSON object with a {@code match} member to a structure.
     *
     * <p>A {@code match} that is not an object yields a structure without a
     * match table.</p>
     *
     * @param object Variant object
     * @return Variant structure
     */
    @NotNull
    public VariantStructure fromJson(@NotNull JsonObject object) {
        List<Object> rawDeclarations = new ArrayList<>();
        JsonElement declarations = object.get(DECLARATIONS);
        if (declarations != null && declarations.isJsonArray()) {
            for (JsonElement element : declarations.getAsJsonArray()) {
                rawDeclarations.add(isString(element) ? element.getAsString() : null);
            }
        }

        List<String> selectors = new ArrayList<>();
        JsonElement selectorArray = object.get(SELECTORS);
        if (selectorArray != null && selectorArray.isJsonArray()) {
            for (JsonElement element : selectorArray.getAsJsonArray()) {
                if (isString(element)) {
                    selectors.add(element.getAsString());
                }
            }
        }

        List<MatchEntry> match = null;
        JsonElement matchObject = object.get(MATCH);
        if (matchObject != null && matchObject.isJsonObject()) {
            match = new ArrayList<>();
            for (Map.Entry<String, JsonElement> member : matchObject.getAsJsonObject().entrySet()) {
                match.add(MatchEntry.of(member.getKey(), templateText(member.getValue())));
            }
        }

        return new VariantStructure(declarationParser.parseAll(rawDeclarations), selectors, match);
    }

    @NotNull
    private static String templateText(@Nullable JsonElement value) {
        if (value == null || value.isJsonNull()) {
            return "";
        }
        if (value.isJsonPrimitive()) {
            return value.getAsString();
        }
        return value.toString();
    }

    private static boolean isString(@Nullable JsonElement element) {
        return element instanceof JsonPrimitive primitive && primitive.isString();
    }
}
