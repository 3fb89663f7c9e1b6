package com.speaker.standardization.ingest;

import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.store.SpeakerWrite;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending writes keyed by speaker id, in first-queued order.
 *
 * <p>A later write to an id replaces the pending one. When the pending write is an insert,
 * the replacement stays an insert: the id is not in the store yet.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class WriteBatch {

    private final int capacity;
    private final Map<String, SpeakerWrite> pending = new LinkedHashMap<>();

    public WriteBatch(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    public void add(SpeakerWrite write) {
        SpeakerWrite previous = pending.get(write.id());
        if (previous != null && previous.kind() == SpeakerWrite.Kind.INSERT) {
            pending.put(write.id(), SpeakerWrite.insert(write.speaker()));
        } else {
            pending.put(write.id(), write);
        }
    }

    /**
     * Returns the queued version of a speaker, if any.
     */
    public Optional<UnifiedSpeaker> find(String id) {
        SpeakerWrite write = pending.get(id);
        return write != null ? Optional.of(write.speaker()) : Optional.empty();
    }

    public boolean isFull() {
        return pending.size() >= capacity;
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    /**
     * Returns the pending writes without clearing them.
     */
    public List<SpeakerWrite> snapshot() {
        return new ArrayList<>(pending.values());
    }

    public void clear() {
        pending.clear();
    }
}
