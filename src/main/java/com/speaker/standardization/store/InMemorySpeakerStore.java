package com.speaker.standardization.store;

import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.index.IndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link SpeakerStore}.
 * Suitable for testing and dry runs. Data is lost on restart.
 *
 * <p>Supports failure injection: {@link #failOnFlush(int)} makes the n-th bulk write throw,
 * and {@link #setConnected(boolean)} simulates an unreachable store.</p>
 */
public class InMemorySpeakerStore implements SpeakerStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySpeakerStore.class);

    private final Map<String, UnifiedSpeaker> documents = new LinkedHashMap<>();
    private int flushCount = 0;
    private int failingFlush = -1;
    private boolean connected = true;

    @Override
    public String getName() {
        return "in-memory";
    }

    @Override
    public synchronized void bulkWrite(List<SpeakerWrite> writes) {
        flushCount++;
        if (!connected) {
            throw new SpeakerStoreException("In-memory store is disconnected");
        }
        if (flushCount == failingFlush) {
            throw new SpeakerStoreException("Injected failure on flush " + flushCount);
        }
        for (SpeakerWrite write : writes) {
            if (write.kind() == SpeakerWrite.Kind.INSERT) {
                documents.putIfAbsent(write.id(), write.speaker());
            } else {
                documents.put(write.id(), write.speaker());
            }
        }
        log.debug("store.bulkWrite writes={} total={}", writes.size(), documents.size());
    }

    @Override
    public synchronized Optional<UnifiedSpeaker> findById(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public synchronized void forEachIdentity(Consumer<IndexEntry> consumer) {
        for (UnifiedSpeaker speaker : new ArrayList<>(documents.values())) {
            consumer.accept(new IndexEntry(speaker.getId(), speaker.getName(), speaker.getCity()));
        }
    }

    @Override
    public synchronized long count() {
        return documents.size();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    /**
     * Makes the given bulk write (1-based, counted over the store's lifetime) fail.
     */
    public synchronized void failOnFlush(int flushNumber) {
        this.failingFlush = flushNumber;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    /**
     * Number of bulk writes attempted so far.
     */
    public synchronized int getFlushCount() {
        return flushCount;
    }

    /**
     * Returns a snapshot of all stored speakers in insertion order.
     */
    public synchronized List<UnifiedSpeaker> findAll() {
        return List.copyOf(documents.values());
    }

    /**
     * Seeds the store directly, bypassing write semantics.
     */
    public synchronized void put(UnifiedSpeaker speaker) {
        documents.put(speaker.getId(), speaker);
    }
}
