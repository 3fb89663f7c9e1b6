package com.speaker.standardization.source;

/**
 * The scraped source databases, in processing order.
 *
 * <p>Order matters: earlier sources create identities and later sources merge into them,
 * so the resulting store content depends on it.</p>
 */
public enum SpeakerSource {
    A_SPEAKERS("a_speakers", "speakers", "a_speakers", "a_speakers"),
    ALL_AMERICAN("allamericanspeakers", "speakers", "allamericanspeakers", "allamerican"),
    BIGSPEAK("bigspeak_scraper", "speaker_profiles", "bigspeak", "bigspeak"),
    EVENTRAPTOR("eventraptor", "speakers", "eventraptor", "eventraptor"),
    FREE_SPEAKER_BUREAU("freespeakerbureau_scraper", "speakers_profiles", "freespeakerbureau", "freespeaker"),
    LEADING_AUTHORITIES("leading_authorities", "speakers_final_details", "leadingauthorities", "leadingauth"),
    SESSIONIZE("sessionize_scraper", "speaker_profiles", "sessionize", "sessionize"),
    SPEAKERHUB("speakerhub_scraper", "speaker_details", "speakerhub", "speakerhub"),
    SPEAKER_HANDBOOK("thespeakerhandbook_scraper", "speaker_profiles", "thespeakerhandbook", "tsh");

    private final String databaseName;
    private final String collectionName;
    private final String label;
    private final String idPrefix;

    SpeakerSource(String databaseName, String collectionName, String label, String idPrefix) {
        this.databaseName = databaseName;
        this.collectionName = collectionName;
        this.label = label;
        this.idPrefix = idPrefix;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    /**
     * Expected collection; readers may fall back to another speaker collection.
     */
    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Value written to {@code source_info.original_source}.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Prefix hashed together with the source-local id to form the unified id.
     */
    public String getIdPrefix() {
        return idPrefix;
    }
}
