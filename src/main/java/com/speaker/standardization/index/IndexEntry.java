package com.speaker.standardization.index;

import java.util.Objects;

/**
 * One identity known to the {@link CandidateIndex}.
 *
 * @param identityId id of the unified record
 * @param name       name the identity was indexed under
 * @param city       city the identity was indexed under, empty when unknown
 */
public record IndexEntry(String identityId, String name, String city) {

    public IndexEntry {
        Objects.requireNonNull(identityId, "identityId is required");
        name = name != null ? name : "";
        city = city != null ? city : "";
    }
}
