package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Contact;
import com.speaker.standardization.core.model.Location;
import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.List;

/**
 * Normalizer for EventRaptor. Business areas are the topics; no location is published.
 */
public class EventRaptorNormalizer extends AbstractSourceNormalizer {

    public EventRaptorNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.EVENTRAPTOR, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.string("speaker_id");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        return doc.stringList("business_areas");
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        builder.name(doc.string("name"))
                .displayName(doc.string("name"))
                .tagline(doc.string("tagline"))
                .biography(doc.string("biography"))
                .contact(new Contact(doc.string("email"), null, null))
                .location(Location.empty())
                .media(new Media(doc.string("profile_image"), List.of()));
    }
}
