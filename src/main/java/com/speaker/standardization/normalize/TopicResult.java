package com.speaker.standardization.normalize;

import java.util.List;

/**
 * Canonicalized topics of one record.
 *
 * @param canonical canonical terms plus every unmapped raw topic, sorted and distinct
 * @param unmapped  raw topics with no canonical term, sorted and distinct
 */
public record TopicResult(List<String> canonical, List<String> unmapped) {

    public TopicResult {
        canonical = canonical != null ? List.copyOf(canonical) : List.of();
        unmapped = unmapped != null ? List.copyOf(unmapped) : List.of();
    }

    public static TopicResult empty() {
        return new TopicResult(List.of(), List.of());
    }
}
