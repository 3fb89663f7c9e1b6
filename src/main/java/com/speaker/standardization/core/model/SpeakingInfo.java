package com.speaker.standardization.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fee ranges and speaking languages.
 * Fee ranges keep whatever shape the source publishes, keyed by event type.
 */
public record SpeakingInfo(Map<String, Object> feeRanges, List<String> languages) {

    private static final SpeakingInfo EMPTY = new SpeakingInfo(Map.of(), List.of());

    public SpeakingInfo {
        feeRanges = feeRanges != null ? Collections.unmodifiableMap(new LinkedHashMap<>(feeRanges)) : Map.of();
        languages = languages != null ? languages.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static SpeakingInfo empty() {
        return EMPTY;
    }
}
