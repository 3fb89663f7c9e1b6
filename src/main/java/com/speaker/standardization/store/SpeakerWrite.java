package com.speaker.standardization.store;

import com.speaker.standardization.core.model.UnifiedSpeaker;

import java.util.Objects;

/**
 * One pending upsert keyed by the speaker id.
 *
 * @param speaker the full record to persist
 * @param kind    {@link Kind#INSERT} writes only when no document has the id yet,
 *                {@link Kind#UPDATE} replaces the document with the same id
 */
public record SpeakerWrite(UnifiedSpeaker speaker, Kind kind) {

    public enum Kind { INSERT, UPDATE }

    public SpeakerWrite {
        Objects.requireNonNull(speaker, "speaker is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    public static SpeakerWrite insert(UnifiedSpeaker speaker) {
        return new SpeakerWrite(speaker, Kind.INSERT);
    }

    public static SpeakerWrite update(UnifiedSpeaker speaker) {
        return new SpeakerWrite(speaker, Kind.UPDATE);
    }

    public String id() {
        return speaker.getId();
    }
}
