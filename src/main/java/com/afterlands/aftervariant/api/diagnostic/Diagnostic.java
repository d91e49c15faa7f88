package com.afterlands.aftervariant.api.diagnostic;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A degradation reported by the engine.
 *
 * @param code Diagnostic kind
 * @param message Human-readable description
 * @param subject The offending input (declaration text, key, locale...), may be empty
 */
public record Diagnostic(@NotNull DiagnosticCode code, @NotNull String message, @NotNull String subject) {

    public Diagnostic {
        Objects.requireNonNull(code, "code cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        subject = subject == null ? "" : subject;
    }

    @NotNull
    public static Diagnostic of(@NotNull DiagnosticCode code, @NotNull String message, Object subject) {
        return new Diagnostic(code, message, subject == null ? "" : String.valueOf(subject));
    }

    @Override
    public String toString() {
        return subject.isEmpty() ? code + ": " + message : code + ": " + message + " [" + subject + "]";
    }
}
