package com.speaker.standardization.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive fields of a speaker, shared by normalized candidates and unified records.
 * Instances are immutable; use {@link #builder(SpeakerProfile)} to derive a modified copy.
 *
 * <p>{@code name} is never null. Collections are never null and never contain null elements.</p>
 */
public final class SpeakerProfile {
    private final String name;
    private final String displayName;
    private final String jobTitle;
    private final String description;
    private final String biography;
    private final String tagline;
    private final Location location;
    private final SpeakingInfo speakingInfo;
    private final List<String> topics;
    private final List<String> categories;
    private final List<String> topicsUnmapped;
    private final List<Object> keynotes;
    private final List<Object> reviews;
    private final Map<String, Object> ratings;
    private final Media media;
    private final List<Object> books;
    private final Contact contact;
    private final SourceInfo sourceInfo;

    private SpeakerProfile(Builder builder) {
        this.name = builder.name != null ? builder.name : "";
        this.displayName = builder.displayName;
        this.jobTitle = builder.jobTitle;
        this.description = builder.description;
        this.biography = builder.biography;
        this.tagline = builder.tagline;
        this.location = builder.location != null ? builder.location : Location.empty();
        this.speakingInfo = builder.speakingInfo != null ? builder.speakingInfo : SpeakingInfo.empty();
        this.topics = copy(builder.topics);
        this.categories = copy(builder.categories);
        this.topicsUnmapped = copy(builder.topicsUnmapped);
        this.keynotes = copy(builder.keynotes);
        this.reviews = copy(builder.reviews);
        this.ratings = builder.ratings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.ratings)) : Map.of();
        this.media = builder.media != null ? builder.media : Media.empty();
        this.books = copy(builder.books);
        this.contact = builder.contact != null ? builder.contact : Contact.empty();
        this.sourceInfo = builder.sourceInfo;
    }

    private static <T> List<T> copy(List<T> values) {
        return values != null ? values.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getJobTitle() {
        return jobTitle;
    }

    public String getDescription() {
        return description;
    }

    public String getBiography() {
        return biography;
    }

    public String getTagline() {
        return tagline;
    }

    public Location getLocation() {
        return location;
    }

    public SpeakingInfo getSpeakingInfo() {
        return speakingInfo;
    }

    public List<String> getTopics() {
        return topics;
    }

    public List<String> getCategories() {
        return categories;
    }

    public List<String> getTopicsUnmapped() {
        return topicsUnmapped;
    }

    public List<Object> getKeynotes() {
        return keynotes;
    }

    public List<Object> getReviews() {
        return reviews;
    }

    public Map<String, Object> getRatings() {
        return ratings;
    }

    public Media getMedia() {
        return media;
    }

    public List<Object> getBooks() {
        return books;
    }

    public Contact getContact() {
        return contact;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpeakerProfile that = (SpeakerProfile) o;
        return name.equals(that.name)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(jobTitle, that.jobTitle)
                && Objects.equals(description, that.description)
                && Objects.equals(biography, that.biography)
                && Objects.equals(tagline, that.tagline)
                && location.equals(that.location)
                && speakingInfo.equals(that.speakingInfo)
                && topics.equals(that.topics)
                && categories.equals(that.categories)
                && topicsUnmapped.equals(that.topicsUnmapped)
                && keynotes.equals(that.keynotes)
                && reviews.equals(that.reviews)
                && ratings.equals(that.ratings)
                && media.equals(that.media)
                && books.equals(that.books)
                && contact.equals(that.contact)
                && Objects.equals(sourceInfo, that.sourceInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, displayName, jobTitle, location, topics, sourceInfo);
    }

    @Override
    public String toString() {
        return "SpeakerProfile{" +
                "name='" + name + '\'' +
                ", city='" + location.city() + '\'' +
                ", topics=" + topics +
                ", source=" + (sourceInfo != null ? sourceInfo.originalSource() : null) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(SpeakerProfile profile) {
        return new Builder()
                .name(profile.name)
                .displayName(profile.displayName)
                .jobTitle(profile.jobTitle)
                .description(profile.description)
                .biography(profile.biography)
                .tagline(profile.tagline)
                .location(profile.location)
                .speakingInfo(profile.speakingInfo)
                .topics(profile.topics)
                .categories(profile.categories)
                .topicsUnmapped(profile.topicsUnmapped)
                .keynotes(profile.keynotes)
                .reviews(profile.reviews)
                .ratings(profile.ratings)
                .media(profile.media)
                .books(profile.books)
                .contact(profile.contact)
                .sourceInfo(profile.sourceInfo);
    }

    public static class Builder {
        private String name;
        private String displayName;
        private String jobTitle;
        private String description;
        private String biography;
        private String tagline;
        private Location location;
        private SpeakingInfo speakingInfo;
        private List<String> topics;
        private List<String> categories;
        private List<String> topicsUnmapped;
        private List<Object> keynotes;
        private List<Object> reviews;
        private Map<String, Object> ratings;
        private Media media;
        private List<Object> books;
        private Contact contact;
        private SourceInfo sourceInfo;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder jobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder biography(String biography) {
            this.biography = biography;
            return this;
        }

        public Builder tagline(String tagline) {
            this.tagline = tagline;
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder speakingInfo(SpeakingInfo speakingInfo) {
            this.speakingInfo = speakingInfo;
            return this;
        }

        public Builder topics(List<String> topics) {
            this.topics = topics;
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories = categories;
            return this;
        }

        public Builder topicsUnmapped(List<String> topicsUnmapped) {
            this.topicsUnmapped = topicsUnmapped;
            return this;
        }

        public Builder keynotes(List<Object> keynotes) {
            this.keynotes = keynotes;
            return this;
        }

        public Builder reviews(List<Object> reviews) {
            this.reviews = reviews;
            return this;
        }

        public Builder ratings(Map<String, Object> ratings) {
            this.ratings = ratings;
            return this;
        }

        public Builder media(Media media) {
            this.media = media;
            return this;
        }

        public Builder books(List<Object> books) {
            this.books = books;
            return this;
        }

        public Builder contact(Contact contact) {
            this.contact = contact;
            return this;
        }

        public Builder sourceInfo(SourceInfo sourceInfo) {
            this.sourceInfo = sourceInfo;
            return this;
        }

        public SpeakerProfile build() {
            return new SpeakerProfile(this);
        }
    }
}
