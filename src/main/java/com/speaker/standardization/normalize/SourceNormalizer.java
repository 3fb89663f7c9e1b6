package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.NormalizedCandidate;
import com.speaker.standardization.source.RawSourceDocument;
import com.speaker.standardization.source.SpeakerSource;

/**
 * Converts one source's raw documents into normalized candidates.
 */
public interface SourceNormalizer {

    SpeakerSource source();

    /**
     * @throws SourceNormalizationException if the document lacks what a candidate needs, such as its id
     */
    NormalizedCandidate normalize(RawSourceDocument document);
}
