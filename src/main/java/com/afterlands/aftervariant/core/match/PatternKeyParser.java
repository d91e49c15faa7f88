package com.afterlands.aftervariant.core.match;

import com.afterlands.aftervariant.api.diagnostic.Diagnostic;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticCode;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import com.afterlands.aftervariant.api.model.PatternKey;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses match keys into {@link PatternKey} conditions.
 *
 * <pre>
 * "countPlural=one"               -> [countPlural=one]
 * "countPlural=one, gender=male"  -> [countPlural=one, gender=male]
 * "platform=*"                    -> [platform=*]  (wildcard)
 * </pre>
 *
 * <p>Clauses without {@code =}, or with an empty selector or value, are skipped
 * and reported. When a selector repeats, the last value wins but the clause
 * keeps the position of its first occurrence.</p>
 */
public class PatternKeyParser {

    private final DiagnosticListener diagnostics;

    public PatternKeyParser(@NotNull DiagnosticListener diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
    }

    @NotNull
    public PatternKey parse(@NotNull String key) {
        Objects.requireNonNull(key, "key cannot be null");

        Map<String, String> conditions = new LinkedHashMap<>();
        for (String clause : key.split(",")) {
            String trimmed = clause.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            String[] parts = trimmed.split("=", -1);
            String selector = parts[0].trim();
            String value = parts.length > 1 ? parts[1].trim() : "";

            if (selector.isEmpty() || value.isEmpty()) {
                diagnostics.report(Diagnostic.of(
                        DiagnosticCode.INVALID_PATTERN_KEY,
                        "Ignoring malformed clause '" + trimmed + "'",
                        key
                ));
                continue;
            }
            conditions.put(selector, value);
        }

        List<PatternKey.Condition> parsed = new ArrayList<>(conditions.size());
        for (Map.Entry<String, String> entry : conditions.entrySet()) {
            parsed.add(new PatternKey.Condition(entry.getKey(), entry.getValue()));
        }
        return new PatternKey(key, parsed);
    }
}
