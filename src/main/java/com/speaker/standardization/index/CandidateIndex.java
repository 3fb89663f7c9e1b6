package com.speaker.standardization.index;

import com.speaker.standardization.similarity.BlockingKeyStrategy;
import com.speaker.standardization.store.SpeakerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory lookup from name fingerprint to the identities sharing it.
 *
 * <p>Buckets keep insertion order, which is the tie-break order of the duplicate decision.
 * Several distinct people may share a fingerprint; the index only groups them.
 * Each identity id is indexed at most once.</p>
 *
 * <p>The index is not persisted. It is rebuilt from the store at the start of every run with
 * {@link #rebuild(SpeakerStore, BlockingKeyStrategy)} and mutated only by the ingestion driver.
 * Not thread-safe.</p>
 */
public class CandidateIndex {
    private static final Logger log = LoggerFactory.getLogger(CandidateIndex.class);

    private final Map<String, List<IndexEntry>> buckets = new HashMap<>();
    private final Set<String> identityIds = new HashSet<>();

    /**
     * Builds an index from every identity persisted in the store.
     * Identities whose name has no fingerprint are not indexed.
     */
    public static CandidateIndex rebuild(SpeakerStore store, BlockingKeyStrategy keyStrategy) {
        CandidateIndex index = new CandidateIndex();
        long[] skipped = {0};
        store.forEachIdentity(entry -> {
            String key = keyStrategy.generateKey(entry.name());
            if (key.isEmpty()) {
                skipped[0]++;
                return;
            }
            index.register(key, entry.identityId(), entry.name(), entry.city());
        });
        log.info("index.rebuilt identities={} buckets={} unkeyed={}",
                index.size(), index.bucketCount(), skipped[0]);
        return index;
    }

    /**
     * Returns the entries sharing a fingerprint, in registration order.
     * The empty fingerprint never has entries.
     */
    public List<IndexEntry> lookup(String fingerprint) {
        if (fingerprint == null || fingerprint.isEmpty()) {
            return List.of();
        }
        List<IndexEntry> bucket = buckets.get(fingerprint);
        return bucket != null ? Collections.unmodifiableList(bucket) : List.of();
    }

    /**
     * Appends an identity to the bucket of its fingerprint.
     *
     * @return true if the identity was added, false if the fingerprint is empty
     *         or the identity is already indexed
     */
    public boolean register(String fingerprint, String identityId, String name, String city) {
        if (fingerprint == null || fingerprint.isEmpty()) {
            return false;
        }
        if (!identityIds.add(identityId)) {
            log.debug("index.register.skipped identityId={} reason=already-indexed", identityId);
            return false;
        }
        buckets.computeIfAbsent(fingerprint, k -> new ArrayList<>(1))
                .add(new IndexEntry(identityId, name, city));
        return true;
    }

    /**
     * Returns true if the identity is already indexed.
     */
    public boolean contains(String identityId) {
        return identityIds.contains(identityId);
    }

    /**
     * Number of indexed identities.
     */
    public int size() {
        return identityIds.size();
    }

    /**
     * Number of distinct fingerprints.
     */
    public int bucketCount() {
        return buckets.size();
    }
}
