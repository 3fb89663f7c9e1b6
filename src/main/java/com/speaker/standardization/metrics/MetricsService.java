package com.speaker.standardization.metrics;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs without
 * a meter registry.
 */
public interface MetricsService {

    void incrementSpeakerInserted(String source);

    void incrementSpeakerMerged(String source);

    void incrementRecordSkipped(String source);

    void recordSimilarityScore(double score);

    void recordFlushSize(int size);

    void recordSourceDuration(String source, Duration duration);
}
