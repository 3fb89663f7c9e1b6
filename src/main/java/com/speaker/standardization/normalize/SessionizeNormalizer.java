package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.List;

/**
 * Normalizer for Sessionize profiles, which nest their fields under {@code basic_info},
 * {@code professional_info} and {@code metadata}.
 */
public class SessionizeNormalizer extends AbstractSourceNormalizer {

    public SessionizeNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.SESSIONIZE, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return NormalizationSupport.firstNonBlank(
                doc.nested("basic_info").string("username"),
                doc.string("username"),
                doc.string("_id"));
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        return doc.nested("professional_info").stringList("topics");
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        RawSourceDocument basic = doc.nested("basic_info");
        String name = NormalizationSupport.firstNonBlank(basic.string("name"), doc.string("name"));
        builder.name(name)
                .displayName(name)
                .tagline(basic.string("tagline"))
                .biography(basic.string("bio"))
                .location(LocationParser.parse(basic.get("location")))
                .media(new Media(basic.string("profile_picture"), List.of()));
    }

    @Override
    protected String sourceUrl(RawSourceDocument doc) {
        return doc.nested("basic_info").string("url");
    }

    @Override
    protected Object scrapedAt(RawSourceDocument doc) {
        return doc.nested("metadata").get("scraped_at");
    }
}
