package com.afterlands.aftervariant.core.declaration;

import com.afterlands.aftervariant.api.diagnostic.Diagnostic;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticCode;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.model.Declaration;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses declaration strings of a variant message.
 *
 * <h3>Supported Syntax:</h3>
 * <ul>
 *     <li>{@code input count} - input parameter</li>
 *     <li>{@code local countPlural = count: plural} - cardinal plural of {@code count}</li>
 *     <li>{@code local ordinal = position: plural type=ordinal} - transform with options</li>
 * </ul>
 *
 * <p>Parsing is total: text that does not fit either form becomes
 * {@link Declaration.Unknown} and is reported as {@link DiagnosticCode#INVALID_DECLARATION}.
 * Entries that are not strings, or are empty, are dropped.</p>
 */
public class DeclarationParser {

    private static final String INPUT_PREFIX = "input ";
    private static final String LOCAL_PREFIX = "local ";

    private final DiagnosticListener diagnostics;

    public DeclarationParser(@NotNull DiagnosticListener diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
    }

    /**
     * Parses a sequence of raw declarations.
     *
     * @param rawDeclarations Raw values; non-string and empty entries are skipped
     * @return Parsed declarations in input order
     */
    @NotNull
    public List<Declaration> parseAll(@Nullable List<?> rawDeclarations) {
        if (rawDeclarations == null || rawDeclarations.isEmpty()) {
            return List.of();
        }

        List<Declaration> parsed = new ArrayList<>(rawDeclarations.size());
        for (Object raw : rawDeclarations) {
            if (raw instanceof String text && !text.isEmpty()) {
                parsed.add(parse(text));
            }
        }
        return Collections.unmodifiableList(parsed);
    }

    /**
     * Parses a single declaration.
     *
     * @param raw Declaration text
     * @return Parsed declaration (never null)
     */
    @NotNull
    public Declaration parse(@NotNull String raw) {
        if (raw.startsWith(INPUT_PREFIX)) {
            String name = raw.substring(INPUT_PREFIX.length()).trim();
            if (name.isEmpty()) {
                return unknown(raw, "Input declaration without a name");
            }
            return new Declaration.Input(name, raw);
        }

        if (raw.startsWith(LOCAL_PREFIX)) {
            return parseLocal(raw);
        }

        return unknown(raw, "Unknown declaration format");
    }

    @NotNull
    private Declaration parseLocal(@NotNull String raw) {
        String rest = raw.substring(LOCAL_PREFIX.length()).trim();

        int equalsPos = rest.indexOf('=');
        if (equalsPos == -1) {
            return unknown(raw, "Invalid local declaration (missing =)");
        }

        String name = rest.substring(0, equalsPos).trim();
        String afterEquals = rest.substring(equalsPos + 1).trim();

        int colonPos = afterEquals.indexOf(':');
        if (colonPos == -1) {
            return unknown(raw, "Invalid local declaration (missing :)");
        }

        String source = afterEquals.substring(0, colonPos).trim();
        String afterColon = afterEquals.substring(colonPos + 1).trim();

        String[] tokens = afterColon.split("\\s+");
        String transform = tokens.length > 0 ? tokens[0] : "";

        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 1; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty() || token.indexOf('=') == -1) {
                continue;
            }
            String[] keyValue = token.split("=", -1);
            String key = keyValue[0].trim();
            String value = keyValue[1].trim();
            if (!key.isEmpty() && !value.isEmpty()) {
                options.put(key, value);
            }
        }

        return new Declaration.Local(name, source, transform, options, raw);
    }

    @NotNull
    private Declaration unknown(@NotNull String raw, @NotNull String reason) {
        diagnostics.report(Diagnostic.of(DiagnosticCode.INVALID_DECLARATION, reason, raw));
        return new Declaration.Unknown(raw);
    }
}
