package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SpeakingInfo;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizer for the A-Speakers bureau. Its documents are keyed by {@code _id}.
 */
public class ASpeakersNormalizer extends AbstractSourceNormalizer {

    public ASpeakersNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.A_SPEAKERS, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.string("_id");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        return doc.stringList("topics");
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        Map<String, Object> ratings = new LinkedHashMap<>();
        if (doc.has("average_rating") || doc.has("total_reviews")) {
            ratings.put("average_rating", doc.get("average_rating"));
            ratings.put("total_reviews", doc.get("total_reviews"));
        }
        List<String> languages = doc.get("languages") instanceof String language && !language.isBlank()
                ? List.of(language)
                : doc.stringList("languages");

        builder.name(doc.string("name"))
                .displayName(doc.string("name"))
                .jobTitle(doc.string("job_title"))
                .description(doc.string("description"))
                .biography(doc.string("full_bio"))
                .location(LocationParser.parse(doc.get("location")))
                .speakingInfo(new SpeakingInfo(feeRanges(doc.get("fee_range")), languages))
                .keynotes(doc.list("keynotes"))
                .reviews(doc.list("reviews"))
                .ratings(ratings)
                .media(new Media(doc.string("image_url"), doc.list("videos")));
    }
}
