package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Contact;
import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizer for the Free Speaker Bureau. Topics merge areas of expertise and speaking topics.
 */
public class FreeSpeakerBureauNormalizer extends AbstractSourceNormalizer {

    public FreeSpeakerBureauNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.FREE_SPEAKER_BUREAU, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.string("_id");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        List<String> topics = new ArrayList<>(doc.stringList("areas_of_expertise"));
        topics.addAll(doc.stringList("speaking_topics"));
        return topics;
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        builder.name(doc.string("name"))
                .displayName(doc.string("name"))
                .jobTitle(doc.string("role"))
                .biography(doc.string("biography"))
                .location(LocationParser.parse(doc.get("location")))
                .media(new Media(doc.string("image_url"), List.of()))
                .contact(new Contact(null, doc.nested("contact_info").string("phone"), doc.string("website")));
    }

    @Override
    protected String sourceUrl(RawSourceDocument doc) {
        return doc.string("profile_url");
    }
}
