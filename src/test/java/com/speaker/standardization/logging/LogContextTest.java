package com.speaker.standardization.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("unify", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSource should set runId, source and operation in MDC")
    void forSourceSetsMDC() {
        try (LogContext ctx = LogContext.forSource("run-1", "bigspeak")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("bigspeak", MDC.get("source"));
            assertEquals("ingest", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forFlush("bigspeak", 1000);
        assertEquals("1000", MDC.get("offset"));

        ctx.close();

        assertNull(MDC.get("source"));
        assertNull(MDC.get("offset"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Closing a nested context should restore the outer values")
    void nestedRestoresOuter() {
        try (LogContext source = LogContext.forSource("run-1", "bigspeak")) {
            try (LogContext flush = LogContext.forFlush("bigspeak", 2000)) {
                assertEquals("flush", MDC.get("operation"));
            }
            assertEquals("ingest", MDC.get("operation"));
            assertEquals("bigspeak", MDC.get("source"));
            assertEquals("run-1", MDC.get("runId"));
            assertNull(MDC.get("offset"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forRun("run-1").with("database", "speaker_database")) {
            assertEquals("speaker_database", MDC.get("database"));
        }
        assertNull(MDC.get("database"));
    }

    @Test
    @DisplayName("generateRunId should produce unique IDs")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
