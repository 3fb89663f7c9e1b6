package com.speaker.standardization.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NormalizationSupport Tests")
class NormalizationSupportTest {

    @ParameterizedTest
    @CsvSource({
            "2025-01-16T10:15:30Z, 2025-01-16T10:15:30Z",
            "2025-01-16T12:15:30+02:00, 2025-01-16T10:15:30Z",
            "2025-01-16T10:15:30.500, 2025-01-16T10:15:30.500Z",
            "2025-01-16, 2025-01-16T00:00:00Z"
    })
    @DisplayName("Should parse ISO-8601 strings")
    void parsesIso(String raw, String expected) {
        assertEquals(Instant.parse(expected), NormalizationSupport.safeDate(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yesterday", "16/01/2025", "  "})
    @DisplayName("Unparseable strings should give null")
    void unparseable(String raw) {
        assertNull(NormalizationSupport.safeDate(raw));
    }

    @Test
    @DisplayName("Dates and instants should pass through")
    void passThrough() {
        Instant instant = Instant.parse("2024-06-01T08:00:00Z");

        assertEquals(instant, NormalizationSupport.safeDate(Date.from(instant)));
        assertEquals(instant, NormalizationSupport.safeDate(instant));
        assertNull(NormalizationSupport.safeDate(null));
        assertNull(NormalizationSupport.safeDate(12345));
    }

    @Test
    @DisplayName("firstNonBlank should skip null and blank values")
    void firstNonBlank() {
        assertEquals("b", NormalizationSupport.firstNonBlank(null, " ", "b", "c"));
        assertNull(NormalizationSupport.firstNonBlank(null, ""));
    }
}
