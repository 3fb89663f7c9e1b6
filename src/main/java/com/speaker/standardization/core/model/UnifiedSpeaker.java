package com.speaker.standardization.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted speaker identity in the unified collection.
 * Core domain object of the standardization pipeline.
 */
public final class UnifiedSpeaker {
    private final String id;
    private final SpeakerProfile profile;
    private final Instant createdAt;
    private final Instant updatedAt;

    private UnifiedSpeaker(Builder builder) {
        this.id = builder.id;
        this.profile = builder.profile;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
    }

    /**
     * Creates a new identity from a candidate that matched nothing in the index.
     */
    public static UnifiedSpeaker fromCandidate(NormalizedCandidate candidate, Instant now) {
        return builder()
                .id(candidate.id())
                .profile(candidate.profile())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public String getId() {
        return id;
    }

    public SpeakerProfile getProfile() {
        return profile;
    }

    public String getName() {
        return profile.getName();
    }

    public String getCity() {
        return profile.getLocation().city();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UnifiedSpeaker that = (UnifiedSpeaker) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "UnifiedSpeaker{" +
                "id='" + id + '\'' +
                ", name='" + profile.getName() + '\'' +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(UnifiedSpeaker speaker) {
        return new Builder()
                .id(speaker.id)
                .profile(speaker.profile)
                .createdAt(speaker.createdAt)
                .updatedAt(speaker.updatedAt);
    }

    public static class Builder {
        private String id;
        private SpeakerProfile profile;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder profile(SpeakerProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public UnifiedSpeaker build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(profile, "profile is required");
            Objects.requireNonNull(createdAt, "createdAt is required");
            return new UnifiedSpeaker(this);
        }
    }
}
