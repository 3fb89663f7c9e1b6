package com.speaker.standardization.normalize;

import com.speaker.standardization.rules.NameNormalizationEngine;
import com.speaker.standardization.rules.PersonNameRules;
import com.speaker.standardization.source.SpeakerSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry holding one {@link SourceNormalizer} per {@link SpeakerSource}.
 */
public final class SourceNormalizers {

    private final Map<SpeakerSource, SourceNormalizer> normalizers = new EnumMap<>(SpeakerSource.class);

    private SourceNormalizers(List<SourceNormalizer> all) {
        for (SourceNormalizer normalizer : all) {
            normalizers.put(normalizer.source(), normalizer);
        }
        for (SpeakerSource source : SpeakerSource.values()) {
            if (!normalizers.containsKey(source)) {
                throw new IllegalStateException("No normalizer registered for " + source);
            }
        }
    }

    /**
     * Creates the standard normalizers with the default person name rules.
     */
    public static SourceNormalizers create(TopicCanonicalizer topics) {
        return create(topics, PersonNameRules.createDefaultEngine());
    }

    public static SourceNormalizers create(TopicCanonicalizer topics, NameNormalizationEngine nameEngine) {
        return new SourceNormalizers(List.of(
                new ASpeakersNormalizer(topics, nameEngine),
                new AllAmericanNormalizer(topics, nameEngine),
                new BigSpeakNormalizer(topics, nameEngine),
                new EventRaptorNormalizer(topics, nameEngine),
                new FreeSpeakerBureauNormalizer(topics, nameEngine),
                new LeadingAuthoritiesNormalizer(topics, nameEngine),
                new SessionizeNormalizer(topics, nameEngine),
                new SpeakerHubNormalizer(topics, nameEngine),
                new SpeakerHandbookNormalizer(topics, nameEngine)));
    }

    public SourceNormalizer forSource(SpeakerSource source) {
        return normalizers.get(source);
    }
}
