package com.afterlands.aftervariant.core.diagnostic;

import com.afterlands.aftervariant.api.diagnostic.Diagnostic;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticListener;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes diagnostics to a {@link Logger}.
 *
 * <p>With deduplication enabled, a diagnostic with the same code and subject is
 * logged once until {@link #resetTracking()} is called. Render runs for every
 * display refresh, so the same malformed message would otherwise flood the log.</p>
 */
public class LoggingDiagnosticListener implements DiagnosticListener {

    private final Logger logger;
    private final Level level;
    private final boolean deduplicate;

    private final Set<String> loggedDiagnostics = ConcurrentHashMap.newKeySet();

    /**
     * Creates a logging listener.
     *
     * @param logger Logger for output
     * @param level Level diagnostics are logged at
     * @param deduplicate Log each code/subject pair only once
     */
    public LoggingDiagnosticListener(@NotNull Logger logger, @NotNull Level level, boolean deduplicate) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.level = Objects.requireNonNull(level, "level cannot be null");
        this.deduplicate = deduplicate;
    }

    public LoggingDiagnosticListener(@NotNull Logger logger) {
        this(logger, Level.WARNING, true);
    }

    @Override
    public void report(@NotNull Diagnostic diagnostic) {
        if (!logger.isLoggable(level)) {
            return;
        }
        if (deduplicate && !loggedDiagnostics.add(diagnostic.code() + "|" + diagnostic.subject())) {
            return;
        }
        logger.log(level, "[VariantEngine] " + diagnostic);
    }

    /**
     * Forgets which diagnostics were logged, so they are logged again.
     */
    public void resetTracking() {
        loggedDiagnostics.clear();
    }

    public int trackedCount() {
        return loggedDiagnostics.size();
    }
}
