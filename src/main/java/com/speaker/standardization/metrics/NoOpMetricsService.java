package com.speaker.standardization.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementSpeakerInserted(String source) {
    }

    @Override
    public void incrementSpeakerMerged(String source) {
    }

    @Override
    public void incrementRecordSkipped(String source) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordFlushSize(int size) {
    }

    @Override
    public void recordSourceDuration(String source, Duration duration) {
    }
}
