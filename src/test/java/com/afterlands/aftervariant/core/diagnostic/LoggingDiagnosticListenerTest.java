package com.afterlands.aftervariant.core.diagnostic;

import com.afterlands.aftervariant.api.diagnostic.Diagnostic;
import com.afterlands.aftervariant.api.diagnostic.DiagnosticCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingDiagnosticListenerTest {

    private Logger logger;
    private CapturingHandler handler;

    @BeforeEach
    void setUp() {
        logger = Logger.getLogger("AfterVariantTest.diagnostics");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        handler = new CapturingHandler();
        logger.addHandler(handler);
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(handler);
    }

    @Test
    void logsDiagnosticWithTag() {
        new LoggingDiagnosticListener(logger).report(noMatch("items"));

        assertThat(handler.records).hasSize(1);
        assertThat(handler.records.get(0).getLevel()).isEqualTo(Level.WARNING);
        assertThat(handler.records.get(0).getMessage())
                .startsWith("[VariantEngine]")
                .contains("NO_MATCH");
    }

    @Test
    void deduplicatesByCodeAndSubject() {
        LoggingDiagnosticListener listener = new LoggingDiagnosticListener(logger);

        listener.report(noMatch("items"));
        listener.report(noMatch("items"));
        listener.report(noMatch("users"));

        assertThat(handler.records).hasSize(2);
        assertThat(listener.trackedCount()).isEqualTo(2);

        listener.resetTracking();
        listener.report(noMatch("items"));

        assertThat(handler.records).hasSize(3);
    }

    @Test
    void logsEveryReportWithoutDeduplication() {
        LoggingDiagnosticListener listener = new LoggingDiagnosticListener(logger, Level.INFO, false);

        listener.report(noMatch("items"));
        listener.report(noMatch("items"));

        assertThat(handler.records).hasSize(2).allMatch(record -> record.getLevel() == Level.INFO);
        assertThat(listener.trackedCount()).isZero();
    }

    @Test
    void skipsWhenLevelIsDisabled() {
        logger.setLevel(Level.SEVERE);
        LoggingDiagnosticListener listener = new LoggingDiagnosticListener(logger);

        listener.report(noMatch("items"));

        assertThat(handler.records).isEmpty();
        assertThat(listener.trackedCount()).isZero();
    }

    private static Diagnostic noMatch(String subject) {
        return Diagnostic.of(DiagnosticCode.NO_MATCH, "No entry matched", subject);
    }

    private static final class CapturingHandler extends Handler {

        private final List<LogRecord> records = new CopyOnWriteArrayList<>();

        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
