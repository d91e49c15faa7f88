package com.afterlands.aftervariant.core.template;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pre-compiled template for fast placeholder substitution.
 *
 * <p>The template is split once into static parts and placeholder names;
 * applying values is then a single pass with no regex.</p>
 *
 * @param template Original template string
 * @param parts Static text parts (between placeholders)
 * @param placeholders Placeholder keys in order
 */
public record CompiledMessage(
        @NotNull String template,
        @NotNull List<String> parts,
        @NotNull List<String> placeholders
) {

    public CompiledMessage {
        Objects.requireNonNull(template, "template cannot be null");
        Objects.requireNonNull(parts, "parts cannot be null");
        Objects.requireNonNull(placeholders, "placeholders cannot be null");

        parts = List.copyOf(parts);
        placeholders = List.copyOf(placeholders);

        // "Hello {name}!" -> parts=["Hello ", "!"], placeholders=["name"]
        if (parts.size() != placeholders.size() + 1) {
            throw new IllegalArgumentException(
                "Invalid compiled message: parts.size() must equal placeholders.size() + 1"
            );
        }
    }

    /**
     * Substitutes parameter values into the template.
     *
     * <p>A placeholder without a value (missing or null) stays in the output
     * as {@code {key}}. Substituted values are not scanned again.</p>
     *
     * @param params Parameter values (name -> value)
     * @return Rendered text
     */
    @NotNull
    public String apply(@NotNull Map<String, ?> params) {
        if (placeholders.isEmpty()) {
            return template;
        }

        StringBuilder result = new StringBuilder(template.length() + 32);

        for (int i = 0; i < placeholders.size(); i++) {
            result.append(parts.get(i));

            String placeholderKey = placeholders.get(i);
            Object value = params.get(placeholderKey);

            if (value != null) {
                result.append(ParamFormatter.format(value));
            } else {
                result.append('{').append(placeholderKey).append('}');
            }
        }

        result.append(parts.get(parts.size() - 1));

        return result.toString();
    }

    @Override
    public String toString() {
        return "CompiledMessage{template=\"" + template + "\", placeholders=" + placeholders + "}";
    }
}
