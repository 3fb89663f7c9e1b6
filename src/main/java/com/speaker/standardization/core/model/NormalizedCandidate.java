package com.speaker.standardization.core.model;

import java.util.Objects;

/**
 * A source record after normalization, ready for deduplication.
 * Every normalizer converges to this type regardless of the source layout.
 *
 * @param id      deterministic unified id derived from the source and its local id
 * @param profile the normalized descriptive fields
 */
public record NormalizedCandidate(String id, SpeakerProfile profile) {

    public NormalizedCandidate {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(profile, "profile is required");
    }

    public String name() {
        return profile.getName();
    }

    public String city() {
        return profile.getLocation().city();
    }
}
