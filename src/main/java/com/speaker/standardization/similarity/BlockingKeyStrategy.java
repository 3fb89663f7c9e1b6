package com.speaker.standardization.similarity;

/**
 * Strategy interface for generating the blocking key of a speaker name.
 * Blocking keys bucket identities so that fuzzy comparison only runs inside a bucket,
 * avoiding a full-collection comparison for every incoming record.
 *
 * <p>Two names with different keys are never compared. The empty key means
 * "no key" and must never be used for matching.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * The reserved key for names that cannot be bucketed.
     */
    String NO_KEY = "";

    /**
     * Generates the blocking key for a name.
     *
     * @param name the speaker name, may be null
     * @return the key, or {@link #NO_KEY} (never null)
     */
    String generateKey(String name);
}
