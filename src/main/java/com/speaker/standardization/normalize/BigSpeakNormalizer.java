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
 * Normalizer for BigSpeak. The single description serves as biography too.
 */
public class BigSpeakNormalizer extends AbstractSourceNormalizer {

    public BigSpeakNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.BIGSPEAK, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.string("speaker_id");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        List<String> topics = new ArrayList<>();
        for (RawSourceDocument topic : doc.documentList("topics")) {
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
                .description(doc.string("description"))
                .biography(doc.string("description"))
                .location(LocationParser.parse(doc.nested("location").get("travels_from")))
                .speakingInfo(new SpeakingInfo(feeRanges(doc.get("fee_range")), List.of()))
                .media(new Media(doc.string("image_url"), List.of()));
    }

    @Override
    protected String sourceUrl(RawSourceDocument doc) {
        return doc.string("profile_url");
    }
}
