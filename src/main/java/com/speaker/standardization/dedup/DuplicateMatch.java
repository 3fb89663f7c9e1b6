package com.speaker.standardization.dedup;

import com.speaker.standardization.index.IndexEntry;

import java.util.Objects;

/**
 * An existing identity accepted as the same speaker as an incoming candidate.
 *
 * @param entry the matched index entry
 * @param score name similarity in percent
 * @param rule  the rule that accepted the pair
 */
public record DuplicateMatch(IndexEntry entry, double score, MatchRule rule) {

    public DuplicateMatch {
        Objects.requireNonNull(entry, "entry is required");
        Objects.requireNonNull(rule, "rule is required");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100");
        }
    }

    public String identityId() {
        return entry.identityId();
    }
}
