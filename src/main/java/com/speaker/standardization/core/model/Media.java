package com.speaker.standardization.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Profile image and video references.
 */
public record Media(String profileImage, List<Object> videos) {

    private static final Media EMPTY = new Media(null, List.of());

    public Media {
        videos = videos != null ? videos.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static Media empty() {
        return EMPTY;
    }
}
