package com.speaker.standardization.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code speaker.inserted}: Counter (tag: source)</li>
 *   <li>{@code speaker.merged}: Counter (tag: source)</li>
 *   <li>{@code speaker.skipped}: Counter (tag: source)</li>
 *   <li>{@code speaker.similarity.score}: DistributionSummary</li>
 *   <li>{@code speaker.flush.size}: DistributionSummary</li>
 *   <li>{@code speaker.source.duration}: Timer (tag: source)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary flushSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("speaker.similarity.score")
                .description("Distribution of name similarity scores inside fingerprint buckets")
                .register(registry);
        this.flushSizeSummary = DistributionSummary.builder("speaker.flush.size")
                .description("Number of writes per bulk flush")
                .register(registry);
    }

    @Override
    public void incrementSpeakerInserted(String source) {
        counter("speaker.inserted", "Number of new speaker identities", source).increment();
    }

    @Override
    public void incrementSpeakerMerged(String source) {
        counter("speaker.merged", "Number of records merged into existing identities", source).increment();
    }

    @Override
    public void incrementRecordSkipped(String source) {
        counter("speaker.skipped", "Number of source documents that could not be normalized", source).increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordFlushSize(int size) {
        flushSizeSummary.record(size);
    }

    @Override
    public void recordSourceDuration(String source, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(source, k ->
                Timer.builder("speaker.source.duration")
                        .description("Time spent ingesting one source")
                        .tag("source", source)
                        .register(registry));
        timer.record(duration);
    }

    private Counter counter(String name, String description, String source) {
        return counterCache.computeIfAbsent(name + ":" + source, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("source", source)
                        .register(registry));
    }
}
