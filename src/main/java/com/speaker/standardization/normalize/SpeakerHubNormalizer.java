package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SpeakingInfo;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizer for SpeakerHub. Location parts are separate fields and are joined into a
 * {@code "City, State, Country"} string before parsing.
 */
public class SpeakerHubNormalizer extends AbstractSourceNormalizer {

    public SpeakerHubNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.SPEAKERHUB, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.string("_id");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        List<String> topics = new ArrayList<>(doc.stringList("topic_categories"));
        topics.addAll(doc.stringList("topics"));
        return topics;
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        Object fees = doc.has("speaker_fees") ? doc.get("speaker_fees") : doc.get("fee_range");
        builder.name(doc.string("name"))
                .displayName(doc.string("name"))
                .jobTitle(doc.firstString("job_title", "professional_title"))
                .biography(doc.firstString("full_bio", "bio_summary"))
                .location(LocationParser.parse(locationString(doc)))
                .speakingInfo(new SpeakingInfo(feeRanges(fees), List.of()))
                .media(new Media(doc.firstString("profile_picture_url", "profile_picture"), List.of()));
    }

    static String locationString(RawSourceDocument doc) {
        List<String> parts = new ArrayList<>();
        String city = doc.firstString("city");
        String state = doc.firstString("state_province", "state");
        String country = doc.firstString("country");
        if (city != null) {
            parts.add(city);
        }
        if (state != null) {
            parts.add(state);
        }
        if (country != null) {
            parts.add(country);
        }
        return String.join(", ", parts);
    }

    @Override
    protected String sourceUrl(RawSourceDocument doc) {
        return doc.string("profile_url");
    }
}
