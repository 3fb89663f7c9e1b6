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
 * Normalizer for All American Speakers. Topics combine the bureau categories with the titles
 * of the speaking topics; the speaking topics themselves become keynotes.
 */
public class AllAmericanNormalizer extends AbstractSourceNormalizer {

    public AllAmericanNormalizer(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        super(SpeakerSource.ALL_AMERICAN, topics, nameEngine);
    }

    @Override
    protected String localId(RawSourceDocument doc) {
        return doc.string("speaker_id");
    }

    @Override
    protected List<String> rawTopics(RawSourceDocument doc) {
        List<String> topics = new ArrayList<>(doc.stringList("categories"));
        for (RawSourceDocument topic : doc.documentList("speaking_topics")) {
            String title = topic.string("title");
            if (title != null) {
                topics.add(title);
            }
        }
        return topics;
    }

    @Override
    protected void populate(RawSourceDocument doc, SpeakerProfile.Builder builder) {
        String profileImage = null;
        for (RawSourceDocument image : doc.documentList("images")) {
            if ("profile".equals(image.string("type"))) {
                profileImage = image.string("url");
                break;
            }
        }
        builder.name(doc.string("name"))
                .displayName(doc.string("name"))
                .jobTitle(doc.string("job_title"))
                .biography(doc.string("biography"))
                .location(LocationParser.parse(doc.get("location")))
                .speakingInfo(new SpeakingInfo(feeRanges(doc.get("fee_range")), List.of()))
                .keynotes(doc.list("speaking_topics"))
                .media(new Media(profileImage, doc.list("videos")))
                .ratings(doc.map("rating"))
                .reviews(doc.list("reviews"));
    }
}
