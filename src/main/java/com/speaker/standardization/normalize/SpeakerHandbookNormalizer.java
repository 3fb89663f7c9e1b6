package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.List;

/**
 * Normalizer for The Speaker Handbook, whose documents carry {@code display_name} only.
 */
public class SpeakerHandbookNormalizer extends AbstractSourceNormalizer {

    public SpeakerHandbookNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.SPEAKER_HANDBOOK, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.firstString("speaker_id", "_id");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        return doc.stringList("topics");
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        builder.name(doc.string("display_name"))
                .displayName(doc.string("display_name"))
                .jobTitle(doc.string("job_title"))
                .biography(doc.string("biography"))
                .location(LocationParser.parse(doc.firstString("travels_from", "home_country")))
                .media(new Media(doc.firstString("image_url_hd", "image_url"), List.of()));
    }

    @Override
    protected String sourceUrl(RawSourceDocument doc) {
        return doc.string("profile_url");
    }
}
