package com.speaker.standardization.ingest;

import com.speaker.standardization.api.DeduplicationOptions;
import com.speaker.standardization.core.model.Location;
import com.speaker.standardization.core.model.NormalizedCandidate;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.index.CandidateIndex;
import com.speaker.standardization.normalize.SourceNormalizationException;
import com.speaker.standardization.similarity.NameFingerprinter;
import com.speaker.standardization.store.BatchFlushException;
import com.speaker.standardization.store.InMemorySpeakerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpeakerIngestionService Tests")
class SpeakerIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private InMemorySpeakerStore store;
    private CandidateIndex index;

    @BeforeEach
    void setUp() {
        store = new InMemorySpeakerStore();
        index = new CandidateIndex();
    }

    private SpeakerIngestionService service(DeduplicationOptions options) {
        return SpeakerIngestionService.builder()
                .store(store)
                .index(index)
                .options(options)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private SpeakerIngestionService service() {
        return service(DeduplicationOptions.defaults());
    }

    private static NormalizedCandidate candidate(String id, String name, String city, String... topics) {
        return new NormalizedCandidate(id, SpeakerProfile.builder()
                .name(name)
                .location(Location.of(city, null, null, null))
                .topics(List.of(topics))
                .build());
    }

    @Nested
    @DisplayName("Inserts and merges")
    class InsertsAndMerges {

        @Test
        @DisplayName("Two distinct speakers should both be inserted")
        void distinctSpeakers() {
            SourceRunResult result = service().runSource("test", List.of(
                    candidate("a", "Jane Smith", "Boston"),
                    candidate("b", "Ravi Patel", "Austin")).iterator());

            assertEquals(2, result.inserted());
            assertEquals(0, result.updated());
            assertEquals(2, store.count());
            assertEquals(2, index.size());
        }

        @Test
        @DisplayName("A duplicate later in the same source should be merged, not inserted")
        void sameBatchDuplicate() {
            SourceRunResult result = service().runSource("test", List.of(
                    candidate("a", "Jane Smith", "", "AI"),
                    candidate("b", "Jane Smith.", "", "Leadership")).iterator());

            assertEquals(1, result.inserted());
            assertEquals(1, result.updated());
            assertEquals(1, store.count());
            assertEquals(List.of("AI", "Leadership"), store.findById("a").orElseThrow().getProfile().getTopics());
            assertTrue(store.findById("b").isEmpty());
        }

        @Test
        @DisplayName("A score of exactly 90 should merge only through a shared city")
        void sameBatchLocationRule() {
            SourceRunResult sameCity = service().runSource("s1", List.of(
                    candidate("a", "Jane Smith", "Denver"),
                    candidate("b", "Jane-Smith", "denver")).iterator());

            assertEquals(1, sameCity.inserted());
            assertEquals(1, sameCity.updated());

            SourceRunResult otherCity = service().runSource("s2", List.of(
                    candidate("c", "Jane-Smith", "Miami")).iterator());

            assertEquals(1, otherCity.inserted());
            assertEquals(2, store.count());
        }

        @Test
        @DisplayName("Names with different fingerprints should stay separate")
        void smythStaysSeparate() {
            SourceRunResult result = service().runSource("test", List.of(
                    candidate("a", "Jane Smith", "Boston"),
                    candidate("b", "Jane Smyth", "Boston")).iterator());

            assertEquals(2, result.inserted());
        }

        @Test
        @DisplayName("A candidate should merge into an identity persisted by an earlier run")
        void mergesIntoStoredIdentity() {
            service().runSource("first", List.of(candidate("a", "Jane Smith", "New York", "AI")).iterator());

            CandidateIndex rebuilt = CandidateIndex.rebuild(store, new NameFingerprinter());
            SpeakerIngestionService second = SpeakerIngestionService.builder()
                    .store(store).index(rebuilt).clock(Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC)).build();
            SourceRunResult result = second.runSource("second",
                    List.of(candidate("z", "Jane Smith", "New York", "Leadership")).iterator());

            assertEquals(0, result.inserted());
            assertEquals(1, result.updated());
            UnifiedSpeaker stored = store.findById("a").orElseThrow();
            assertEquals(List.of("AI", "Leadership"), stored.getProfile().getTopics());
            assertEquals(NOW, stored.getCreatedAt());
            assertEquals(NOW.plusSeconds(60), stored.getUpdatedAt());
        }

        @Test
        @DisplayName("Re-ingesting the same record should update it, not duplicate it")
        void reingestion() {
            service().runSource("test", List.of(candidate("a", "Jane Smith", "Boston")).iterator());
            SourceRunResult again = service().runSource("test",
                    List.of(candidate("a", "Jane Smith", "Boston")).iterator());

            assertEquals(0, again.inserted());
            assertEquals(1, again.updated());
            assertEquals(1, store.count());
        }

        @Test
        @DisplayName("A name without a fingerprint should be inserted and never indexed")
        void emptyFingerprint() {
            SourceRunResult result = service().runSource("test", List.of(
                    candidate("a", "???", ""),
                    candidate("b", "???", "")).iterator());

            assertEquals(2, result.inserted());
            assertEquals(0, index.size());
        }

        @Test
        @DisplayName("A repeated id without a fingerprint should update the pending record")
        void repeatedIdWithoutFingerprintSameRun() {
            NormalizedCandidate first = new NormalizedCandidate("a", SpeakerProfile.builder()
                    .name("")
                    .biography("Keynote speaker")
                    .topics(List.of("AI"))
                    .build());

            SourceRunResult result = service().runSource("test",
                    List.of(first, candidate("a", "", "", "Leadership")).iterator());

            assertEquals(1, result.inserted());
            assertEquals(1, result.updated());
            assertEquals(1, store.count());
            UnifiedSpeaker stored = store.findById("a").orElseThrow();
            assertEquals(List.of("AI", "Leadership"), stored.getProfile().getTopics());
            assertEquals("Keynote speaker", stored.getProfile().getBiography());
        }

        @Test
        @DisplayName("A repeated id without a fingerprint should update the stored record on a later run")
        void repeatedIdWithoutFingerprintNextRun() {
            service().runSource("first", List.of(candidate("a", "", "", "AI")).iterator());

            CandidateIndex rebuilt = CandidateIndex.rebuild(store, new NameFingerprinter());
            SpeakerIngestionService second = SpeakerIngestionService.builder()
                    .store(store).index(rebuilt).clock(Clock.fixed(NOW, ZoneOffset.UTC)).build();
            SourceRunResult result = second.runSource("second",
                    List.of(candidate("a", "", "", "Leadership")).iterator());

            assertFalse(rebuilt.contains("a"));
            assertEquals(0, result.inserted());
            assertEquals(1, result.updated());
            assertEquals(List.of("AI", "Leadership"), store.findById("a").orElseThrow().getProfile().getTopics());
        }

        @Test
        @DisplayName("An empty source should produce an empty result")
        void emptySource() {
            SourceRunResult result = service().runSource("test", List.<NormalizedCandidate>of().iterator());

            assertEquals(0, result.processed());
            assertEquals(0, store.getFlushCount());
        }
    }

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("Should flush when the batch is full and once more at the end")
        void flushesAtCapacity() {
            List<NormalizedCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                candidates.add(candidate("id-" + i, "Speaker " + (char) ('A' + i), ""));
            }

            service(DeduplicationOptions.builder().batchSize(2).build()).runSource("test", candidates.iterator());

            assertEquals(3, store.getFlushCount());
            assertEquals(5, store.count());
        }

        @Test
        @DisplayName("A match against a flushed identity should load it from the store")
        void mergeAfterFlush() {
            service(DeduplicationOptions.builder().batchSize(1).build()).runSource("test", List.of(
                    candidate("a", "Jane Smith", "", "AI"),
                    candidate("b", "Jane Smith", "", "Leadership")).iterator());

            assertEquals(List.of("AI", "Leadership"), store.findById("a").orElseThrow().getProfile().getTopics());
        }

        @Test
        @DisplayName("A failing flush should abort with the source and offset")
        void flushFailure() {
            store.failOnFlush(2);
            List<NormalizedCandidate> candidates = List.of(
                    candidate("a", "Ann Lee", ""),
                    candidate("b", "Bo Chen", ""),
                    candidate("c", "Cy Diaz", ""),
                    candidate("d", "Di Evans", ""),
                    candidate("e", "Ed Fox", ""));

            BatchFlushException e = assertThrows(BatchFlushException.class, () ->
                    service(DeduplicationOptions.builder().batchSize(2).build())
                            .runSource("bigspeak", candidates.iterator()));

            assertEquals("bigspeak", e.getSourceName());
            assertEquals(4, e.getOffset());
            assertEquals(2, e.getPendingWrites());
            assertEquals(2, store.count());
        }
    }

    @Nested
    @DisplayName("Malformed records")
    class Malformed {

        @Test
        @DisplayName("A record failing normalization should be skipped and counted")
        void skipsRecord() {
            Iterator<NormalizedCandidate> candidates = new Iterator<>() {
                private int position = 0;

                @Override
                public boolean hasNext() {
                    return position < 3;
                }

                @Override
                public NormalizedCandidate next() {
                    if (position >= 3) {
                        throw new NoSuchElementException();
                    }
                    position++;
                    if (position == 2) {
                        throw new SourceNormalizationException("test", "missing id");
                    }
                    return candidate("id-" + position, "Speaker " + position, "");
                }
            };

            SourceRunResult result = service().runSource("test", candidates);

            assertEquals(3, result.processed());
            assertEquals(2, result.inserted());
            assertEquals(1, result.skipped());
            assertEquals(2, result.skippedRecords().get(0).offset());
        }
    }

    @Test
    @DisplayName("Progress should be reported at the configured interval and at completion")
    void reportsProgress() {
        List<Long> reported = new ArrayList<>();
        SpeakerIngestionService service = SpeakerIngestionService.builder()
                .store(store)
                .index(index)
                .options(DeduplicationOptions.builder().progressInterval(2).build())
                .progressCallback((source, processed, message) -> reported.add(processed))
                .build();

        service.runSource("test", List.of(
                candidate("a", "Ann Lee", ""),
                candidate("b", "Bo Chen", ""),
                candidate("c", "Cy Diaz", "")).iterator());

        assertEquals(List.of(2L, 3L), reported);
    }
}
