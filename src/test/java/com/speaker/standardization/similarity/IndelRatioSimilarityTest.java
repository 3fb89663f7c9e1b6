package com.speaker.standardization.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IndelRatioSimilarity Tests")
class IndelRatioSimilarityTest {

    private final IndelRatioSimilarity similarity = new IndelRatioSimilarity();

    @Test
    @DisplayName("Identical strings should score 100")
    void identical() {
        assertEquals(100.0, similarity.percentage("Jane Smith", "Jane Smith"));
    }

    @Test
    @DisplayName("Two empty strings should score 100")
    void bothEmpty() {
        assertEquals(100.0, similarity.percentage("", ""));
    }

    @Test
    @DisplayName("Null input should score 0")
    void nullInput() {
        assertEquals(0.0, similarity.percentage(null, "Jane"));
        assertEquals(0.0, similarity.percentage("Jane", null));
    }

    @Test
    @DisplayName("One empty string should score 0")
    void oneEmpty() {
        assertEquals(0.0, similarity.percentage("", "Jane"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Ann Smith | Ann  Smith. | 90.0",
            "Jane Smith | Jane Smyth | 90.0",
            "Jane Smith | Jane-Smith | 90.0",
            "abc | abd | 66.66666666666667"
    })
    @DisplayName("Should match the normalized Indel ratio")
    void knownValues(String a, String b, double expected) {
        assertEquals(expected, similarity.percentage(a, b), 1e-9);
    }

    @Test
    @DisplayName("Should score just above the base threshold for one extra character")
    void oneExtraCharacter() {
        assertEquals(94.7368, similarity.percentage("Ann Smith", "Ann Smith."), 1e-4);
        assertEquals(85.7142, similarity.percentage("Ann Smith", "Ann. Smith.."), 1e-4);
    }

    @Test
    @DisplayName("Should be case-sensitive")
    void caseSensitive() {
        assertTrue(similarity.percentage("jane smith", "Jane Smith") < 100.0);
    }

    @Test
    @DisplayName("Should be symmetric")
    void symmetric() {
        assertEquals(similarity.percentage("Mary Ann", "Maryanne"), similarity.percentage("Maryanne", "Mary Ann"));
    }

    @Test
    @DisplayName("Should report its name")
    void name() {
        assertEquals("IndelRatio", similarity.getName());
    }
}
