package com.speaker.standardization.ingest;

import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.store.SpeakerWrite;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WriteBatch Tests")
class WriteBatchTest {

    private static UnifiedSpeaker speaker(String id, String name) {
        return UnifiedSpeaker.builder()
                .id(id)
                .profile(SpeakerProfile.builder().name(name).build())
                .createdAt(Instant.EPOCH)
                .build();
    }

    @Test
    @DisplayName("Later write to the same id should replace the pending one")
    void replacesById() {
        WriteBatch batch = new WriteBatch(10);
        batch.add(SpeakerWrite.update(speaker("a", "First")));
        batch.add(SpeakerWrite.update(speaker("a", "Second")));

        assertEquals(1, batch.size());
        assertEquals("Second", batch.find("a").orElseThrow().getName());
    }

    @Test
    @DisplayName("An update of a pending insert should stay an insert")
    void insertStaysInsert() {
        WriteBatch batch = new WriteBatch(10);
        batch.add(SpeakerWrite.insert(speaker("a", "First")));
        batch.add(SpeakerWrite.update(speaker("a", "Merged")));

        List<SpeakerWrite> writes = batch.snapshot();
        assertEquals(1, writes.size());
        assertEquals(SpeakerWrite.Kind.INSERT, writes.get(0).kind());
        assertEquals("Merged", writes.get(0).speaker().getName());
    }

    @Test
    @DisplayName("Should report full at capacity and keep first-queued order")
    void capacityAndOrder() {
        WriteBatch batch = new WriteBatch(2);
        batch.add(SpeakerWrite.insert(speaker("b", "B")));
        assertFalse(batch.isFull());
        batch.add(SpeakerWrite.insert(speaker("a", "A")));
        assertTrue(batch.isFull());

        assertEquals(List.of("b", "a"), batch.snapshot().stream().map(SpeakerWrite::id).toList());

        batch.clear();
        assertTrue(batch.isEmpty());
        assertTrue(batch.find("a").isEmpty());
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new WriteBatch(0));
    }
}
