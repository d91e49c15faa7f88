package com.afterlands.aftervariant.api.diagnostic;

import org.jetbrains.annotations.NotNull;

/**
 * Receives diagnostics emitted while parsing, matching and rendering.
 *
 * <p>Implementations must not throw; they are called from the render path.</p>
 */
@FunctionalInterface
public interface DiagnosticListener {

    /**
     * Listener that discards every diagnostic.
     */
    DiagnosticListener NONE = diagnostic -> { };

    void report(@NotNull Diagnostic diagnostic);
}
