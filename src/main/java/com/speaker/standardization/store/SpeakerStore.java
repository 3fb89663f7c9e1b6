package com.speaker.standardization.store;

import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.index.IndexEntry;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistent store of unified speaker identities.
 * The store is the source of truth; the candidate index is rebuilt from it on every run.
 *
 * <p>Every write is an upsert keyed by the speaker id, so replaying a batch is harmless.</p>
 */
public interface SpeakerStore {

    /**
     * Short name used in logs and health checks.
     */
    String getName();

    /**
     * Applies a batch of upserts. Writes are independent of each other; there is no
     * cross-document transaction.
     *
     * @throws SpeakerStoreException if the store rejects the batch or cannot be reached
     */
    void bulkWrite(List<SpeakerWrite> writes);

    /**
     * Loads one identity by id.
     */
    Optional<UnifiedSpeaker> findById(String id);

    /**
     * Scans every persisted identity once, exposing only the fields the index needs.
     */
    void forEachIdentity(Consumer<IndexEntry> consumer);

    /**
     * Number of persisted identities.
     */
    long count();

    /**
     * Checks if the store is reachable.
     */
    boolean isConnected();
}
