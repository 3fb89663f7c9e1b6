package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Location;
import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SpeakingInfo;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizer for Leading Authorities. Documents are identified by their speaker page URL,
 * while {@code source_id} keeps the Mongo id.
 */
public class LeadingAuthoritiesNormalizer extends AbstractSourceNormalizer {

    public LeadingAuthoritiesNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.LEADING_AUTHORITIES, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.string("speaker_page_url");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        List<String> topics = new ArrayList<>();
        for (RawSourceDocument topic : doc.documentList("topics_and_types")) {
            String name = topic.string("name");
            if (name != null) {
                topics.add(name);
            }
        }
        return topics;
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        builder.name(doc.string("name"))
                .displayName(doc.string("name"))
                .jobTitle(doc.string("job_title"))
                .description(doc.string("description"))
                .biography(doc.string("description"))
                .location(Location.empty())
                .speakingInfo(new SpeakingInfo(feeRanges(doc.get("speaker_fees")), List.of()))
                .books(doc.list("books_and_publications"))
                .media(new Media(doc.string("speaker_image_url"), doc.list("videos")));
    }

    @Override
    protected String sourceUrl(RawSourceDocument doc) {
        return doc.string("speaker_page_url");
    }

    @Override
    protected String sourceId(RawSourceDocument doc, String localId) {
        return doc.string("_id");
    }
}
