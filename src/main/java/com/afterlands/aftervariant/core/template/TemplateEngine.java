package com.afterlands.aftervariant.core.template;

import com.afterlands.aftervariant.core.cache.VariantCache;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles and renders message templates with {@code {placeholder}} syntax.
 *
 * <h3>Supported Syntax:</h3>
 * <ul>
 *     <li>{@code {count}} - word characters only ({@code [a-zA-Z0-9_]})</li>
 *     <li>{@code {UPPERCASE}} - case-sensitive</li>
 * </ul>
 *
 * <p>Anything else in braces ({@code {a-b}}, {@code { x }}, {@code {}}) is plain
 * text. Compiled templates are kept in the {@link VariantCache}.</p>
 */
public class TemplateEngine {

    /**
     * Pattern for matching placeholders: {key}
     */
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{(\\w+)\\}");

    @Nullable
    private final VariantCache cache;

    /**
     * Creates a template engine.
     *
     * @param cache Cache for compiled templates, or null to compile on every render
     */
    public TemplateEngine(@Nullable VariantCache cache) {
        this.cache = cache;
    }

    /**
     * Compiles a template string into a CompiledMessage.
     *
     * @param template Template string with placeholders
     * @return Compiled message
     */
    @NotNull
    public CompiledMessage compile(@NotNull String template) {
        List<String> parts = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);

        int lastEnd = 0;

        while (matcher.find()) {
            parts.add(template.substring(lastEnd, matcher.start()));
            placeholders.add(matcher.group(1));
            lastEnd = matcher.end();
        }

        parts.add(template.substring(lastEnd));

        return new CompiledMessage(template, parts, placeholders);
    }

    /**
     * Renders a template with parameter values.
     *
     * @param template Template string
     * @param params Parameter values
     * @return Rendered text; unresolved placeholders are left intact
     */
    @NotNull
    public String render(@NotNull String template, @NotNull Map<String, ?> params) {
        CompiledMessage compiled = cache != null
                ? cache.getTemplate(template, this::compile)
                : compile(template);
        return compiled.apply(params);
    }
}
