package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.NormalizedCandidate;
import com.speaker.standardization.core.model.SourceInfo;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template for source normalizers. Subclasses map source fields onto the profile; this class
 * derives the id, canonicalizes topics, cleans the name and fills the source info.
 */
public abstract class AbstractSourceNormalizer implements SourceNormalizer {

    private final SpeakerSource source;
    private final TopicCanonicalizer topicCanonicalizer;
    private final NameNormalizationEngine nameEngine;

    protected AbstractSourceNormalizer(SpeakerSource source, TopicCanonicalizer topicCanonicalizer,
                                       NameNormalizationEngine nameEngine) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.topicCanonicalizer = Objects.requireNonNull(topicCanonicalizer, "topicCanonicalizer is required");
        this.nameEngine = Objects.requireNonNull(nameEngine, "nameEngine is required");
    }

    @Override
    public SpeakerSource source() {
        return source;
    }

    @Override
    public NormalizedCandidate normalize(RawSourceDocument document) {
        if (document.source() != source) {
            throw new IllegalArgumentException(
                    "Document of " + document.source() + " passed to normalizer of " + source);
        }
        String localId = localId(document);
        if (localId == null || localId.isBlank()) {
            throw new SourceNormalizationException(source.getLabel(),
                    "Document of " + source.getLabel() + " has no id");
        }
        try {
            SpeakerProfile.Builder builder = SpeakerProfile.builder();
            populate(document, builder);

            TopicResult topics = topicCanonicalizer.canonicalize(rawTopics(document));
            builder.topics(topics.canonical())
                    .categories(topics.canonical())
                    .topicsUnmapped(topics.unmapped())
                    .sourceInfo(new SourceInfo(
                            source.getLabel(),
                            sourceUrl(document),
                            NormalizationSupport.safeDate(scrapedAt(document)),
                            sourceId(document, localId)));

            SpeakerProfile raw = builder.build();
            SpeakerProfile profile = SpeakerProfile.builder(raw)
                    .name(nameEngine.clean(raw.getName()))
                    .build();
            return new NormalizedCandidate(SpeakerIds.of(source.getIdPrefix(), localId), profile);
        } catch (RuntimeException e) {
            throw new SourceNormalizationException(source.getLabel(),
                    "Cannot normalize " + source.getLabel() + " document " + localId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Source-local id hashed into the unified id; null when missing.
     */
    protected abstract String localId(RawSourceDocument document);

    protected abstract List<String> rawTopics(RawSourceDocument document);

    /**
     * Copies the descriptive fields. Topics, categories and source info are set afterwards.
     */
    protected abstract void populate(RawSourceDocument document, SpeakerProfile.Builder builder);

    protected String sourceUrl(RawSourceDocument document) {
        return document.string("url");
    }

    protected Object scrapedAt(RawSourceDocument document) {
        return document.get("scraped_at");
    }

    protected String sourceId(RawSourceDocument document, String localId) {
        return localId;
    }

    /**
     * Fee data as published: a map is kept, a scalar is filed under {@code live_event}.
     */
    protected static Map<String, Object> feeRanges(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
        } else if (value != null && !(value instanceof String s && s.isBlank())) {
            result.put("live_event", value);
        }
        return result;
    }
}
