package com.speaker.standardization.dedup;

import com.speaker.standardization.api.DeduplicationOptions;
import com.speaker.standardization.index.CandidateIndex;
import com.speaker.standardization.metrics.MetricsService;
import com.speaker.standardization.similarity.IndelRatioSimilarity;
import com.speaker.standardization.similarity.NameFingerprinter;
import com.speaker.standardization.similarity.SimilarityAlgorithm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("DuplicateDetector Tests")
class DuplicateDetectorTest {

    private final NameFingerprinter fingerprinter = new NameFingerprinter();

    @Nested
    @DisplayName("Decision rule boundaries")
    @ExtendWith(MockitoExtension.class)
    class Boundaries {

        @Mock
        SimilarityAlgorithm similarity;

        @Mock
        MetricsService metrics;

        private DuplicateDetector detector;
        private CandidateIndex index;

        @BeforeEach
        void setUp() {
            detector = new DuplicateDetector(fingerprinter, similarity, DeduplicationOptions.defaults(), metrics);
            index = new CandidateIndex();
            index.register("janesmith", "id-1", "Jane Smith", "New York");
        }

        @Test
        @DisplayName("Score of exactly 90 without a shared city should not match")
        void exactlyBaseThreshold() {
            when(similarity.percentage("Jane Smith!", "Jane Smith")).thenReturn(90.0);

            assertTrue(detector.findDuplicate("Jane Smith!", "Chicago", index).isEmpty());
            verify(metrics).recordSimilarityScore(90.0);
        }

        @Test
        @DisplayName("Score of 91 should match on name alone")
        void aboveBaseThreshold() {
            when(similarity.percentage("Jane Smith!", "Jane Smith")).thenReturn(91.0);

            Optional<DuplicateMatch> match = detector.findDuplicate("Jane Smith!", "", index);

            assertTrue(match.isPresent());
            assertEquals("id-1", match.get().identityId());
            assertEquals(MatchRule.NAME_SIMILARITY, match.get().rule());
            assertEquals(91.0, match.get().score());
        }

        @Test
        @DisplayName("Score of 86 should match only with the same city")
        void locationRule() {
            when(similarity.percentage("Jane Smith!", "Jane Smith")).thenReturn(86.0);

            Optional<DuplicateMatch> sameCity = detector.findDuplicate("Jane Smith!", "  new york ", index);
            Optional<DuplicateMatch> otherCity = detector.findDuplicate("Jane Smith!", "Boston", index);
            Optional<DuplicateMatch> noCity = detector.findDuplicate("Jane Smith!", "", index);

            assertTrue(sameCity.isPresent());
            assertEquals(MatchRule.NAME_AND_LOCATION, sameCity.get().rule());
            assertTrue(otherCity.isEmpty());
            assertTrue(noCity.isEmpty());
        }

        @Test
        @DisplayName("Score of exactly 85 should not match even with the same city")
        void exactlyLocationThreshold() {
            when(similarity.percentage("Jane Smith!", "Jane Smith")).thenReturn(85.0);

            assertTrue(detector.findDuplicate("Jane Smith!", "New York", index).isEmpty());
        }

        @Test
        @DisplayName("Candidates outside the fingerprint bucket should never be scored")
        void differentBucket() {
            assertTrue(detector.findDuplicate("John Doe", "New York", index).isEmpty());
            verifyNoInteractions(similarity);
        }

        @Test
        @DisplayName("Empty fingerprint should never match")
        void emptyFingerprint() {
            assertTrue(detector.findDuplicate("...", "New York", index).isEmpty());
            verifyNoInteractions(similarity);
        }
    }

    @Nested
    @DisplayName("With the Indel ratio")
    class WithIndelRatio {

        private final DuplicateDetector detector = new DuplicateDetector(
                fingerprinter, new IndelRatioSimilarity(), DeduplicationOptions.defaults());

        @Test
        @DisplayName("Boundary strings should follow the thresholds")
        void realStrings() {
            CandidateIndex index = new CandidateIndex();
            index.register(fingerprinter.fingerprint("Ann Smith"), "ann", "Ann Smith", "Paris");

            assertTrue(detector.findDuplicate("Ann  Smith.", "", index).isEmpty(), "exactly 90");
            assertTrue(detector.findDuplicate("Ann Smith.", "", index).isPresent(), "94.7");
            assertTrue(detector.findDuplicate("Ann. Smith..", "", index).isEmpty(), "85.7 without city");
            assertTrue(detector.findDuplicate("Ann. Smith..", "paris", index).isPresent(), "85.7 with city");
        }

        @Test
        @DisplayName("First qualifying entry should win")
        void firstMatchWins() {
            CandidateIndex index = new CandidateIndex();
            index.register("janesmith", "first", "Jane Smith", "Boston");
            index.register("janesmith", "second", "Jane Smith", "Denver");

            Optional<DuplicateMatch> match = detector.findDuplicate("Jane Smith", "Denver", index);

            assertTrue(match.isPresent());
            assertEquals("first", match.get().identityId());
        }

        @Test
        @DisplayName("A later entry should match when earlier ones do not qualify")
        void scansWholeBucket() {
            CandidateIndex index = new CandidateIndex();
            index.register("janesmith", "far", "JANE SMITH", "Boston");
            index.register("janesmith", "near", "Jane Smith", "Denver");

            Optional<DuplicateMatch> match = detector.findDuplicate("Jane Smith", "", index);

            assertEquals("near", match.orElseThrow().identityId());
        }

        @Test
        @DisplayName("Names with different fingerprints should stay separate")
        void differentFingerprints() {
            CandidateIndex index = new CandidateIndex();
            index.register("janesmith", "id-1", "Jane Smith", "Boston");

            assertTrue(detector.findDuplicate("Jane Smyth", "Boston", index).isEmpty());
        }

        @Test
        @DisplayName("Thresholds should come from the options")
        void configurableThresholds() {
            DuplicateDetector strict = new DuplicateDetector(fingerprinter, new IndelRatioSimilarity(),
                    DeduplicationOptions.builder().baseThreshold(99).locationThreshold(98).build());
            CandidateIndex index = new CandidateIndex();
            index.register("annsmith", "ann", "Ann Smith", "");

            assertTrue(strict.findDuplicate("Ann Smith.", "", index).isEmpty());
            assertTrue(strict.findDuplicate("Ann Smith", "", index).isPresent());
        }
    }

    @Test
    @DisplayName("Should require a key strategy and a similarity algorithm")
    void requiresCollaborators() {
        NullPointerException noSimilarity = assertThrows(NullPointerException.class, () ->
                new DuplicateDetector(fingerprinter, null, DeduplicationOptions.defaults()));
        assertEquals("similarity is required", noSimilarity.getMessage());
        assertThrows(NullPointerException.class, () ->
                new DuplicateDetector(null, new IndelRatioSimilarity(), null));
    }
}
