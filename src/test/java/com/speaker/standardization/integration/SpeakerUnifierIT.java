package com.speaker.standardization.integration;

import com.speaker.standardization.api.SpeakerUnifier;
import com.speaker.standardization.api.UnificationReport;
import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.normalize.SpeakerIds;
import com.speaker.standardization.normalize.TopicCanonicalizer;
import com.speaker.standardization.source.MongoSourceDocumentReader;
import com.speaker.standardization.source.SpeakerSource;
import com.speaker.standardization.store.MongoSpeakerStore;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpeakerUnifier Integration Tests")
class SpeakerUnifierIT extends AbstractMongoIntegrationTest {

    private MongoSpeakerStore store;

    @BeforeEach
    void setUp() {
        store = createStore("unifier_it");

        client.getDatabase(SpeakerSource.A_SPEAKERS.getDatabaseName())
                .getCollection(SpeakerSource.A_SPEAKERS.getCollectionName())
                .insertOne(new Document("_id", "a-1")
                        .append("name", "Dr. Jane Smith")
                        .append("location", "New York, NY, USA")
                        .append("topics", List.of("AI")));

        // Stored under a non-standard collection name
        client.getDatabase(SpeakerSource.BIGSPEAK.getDatabaseName())
                .getCollection("speakers_2024")
                .insertOne(new Document("speaker_id", "b-1")
                        .append("name", "Jane Smith")
                        .append("location", new Document("travels_from", "New York, NY, USA"))
                        .append("topics", List.of(new Document("name", "Leadership"))));
    }

    @AfterEach
    void dropSources() {
        client.getDatabase(SpeakerSource.A_SPEAKERS.getDatabaseName()).drop();
        client.getDatabase(SpeakerSource.BIGSPEAK.getDatabaseName()).drop();
    }

    private SpeakerUnifier unifier() {
        return SpeakerUnifier.builder()
                .store(store)
                .sourceReader(new MongoSourceDocumentReader(client))
                .topicCanonicalizer(new TopicCanonicalizer(Map.of()))
                .build();
    }

    @Test
    @DisplayName("Should unify one speaker found in two source databases")
    void unifiesAcrossDatabases() {
        UnificationReport report = unifier().run();

        assertEquals(1, report.inserted());
        assertEquals(1, report.updated());
        assertEquals(1, report.totalNow());
        assertEquals(7, report.skippedSources().size());

        UnifiedSpeaker speaker = store.findById(SpeakerIds.of("a_speakers", "a-1")).orElseThrow();
        assertEquals("Jane Smith", speaker.getName());
        assertEquals(List.of("AI", "Leadership"), speaker.getProfile().getTopics());
        assertEquals("a_speakers", speaker.getProfile().getSourceInfo().originalSource());
    }

    @Test
    @DisplayName("A second run should rebuild the index from the store")
    void rerun() {
        unifier().run();

        UnificationReport again = unifier().run();

        assertEquals(0, again.inserted());
        assertEquals(2, again.updated());
        assertEquals(1, again.totalNow());
    }
}
