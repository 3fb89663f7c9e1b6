package com.speaker.standardization.cdi;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.speaker.standardization.api.DeduplicationOptions;
import com.speaker.standardization.api.SpeakerUnifier;
import com.speaker.standardization.metrics.MetricsService;
import com.speaker.standardization.metrics.MicrometerMetricsService;
import com.speaker.standardization.metrics.NoOpMetricsService;
import com.speaker.standardization.normalize.TopicCanonicalizer;
import com.speaker.standardization.source.MongoSourceDocumentReader;
import com.speaker.standardization.source.SourceDocumentReader;
import com.speaker.standardization.store.MongoSpeakerStore;
import com.speaker.standardization.store.SpeakerStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires the speaker pipeline from MicroProfile Config properties.
 *
 * <pre>
 * speaker-pipeline:
 *   mongo:
 *     uri: mongodb://localhost:27017
 *     target-database: speaker_database
 *     target-collection: unified_speakers
 *   topics:
 *     mapping-path: /etc/speakers/topic_mapping.json
 *   dedup:
 *     base-threshold: 90
 *     location-threshold: 85
 *     batch-size: 1000
 * </pre>
 *
 * <p>Without {@code topics.mapping-path} the mapping bundled on the classpath is used.
 * Metrics go to the container's {@link MeterRegistry} when one is available.</p>
 */
@ApplicationScoped
public class SpeakerPipelineProducer {

    private static final Logger log = LoggerFactory.getLogger(SpeakerPipelineProducer.class);

    // ── MongoDB ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "speaker-pipeline.mongo.uri", defaultValue = "mongodb://localhost:27017")
    String mongoUri;

    @Inject
    @ConfigProperty(name = "speaker-pipeline.mongo.target-database", defaultValue = "speaker_database")
    String targetDatabase;

    @Inject
    @ConfigProperty(name = "speaker-pipeline.mongo.target-collection", defaultValue = "unified_speakers")
    String targetCollection;

    // ── Topics ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "speaker-pipeline.topics.mapping-path")
    Optional<String> topicMappingPath;

    // ── Deduplication ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "speaker-pipeline.dedup.base-threshold", defaultValue = "90")
    double baseThreshold;

    @Inject
    @ConfigProperty(name = "speaker-pipeline.dedup.location-threshold", defaultValue = "85")
    double locationThreshold;

    @Inject
    @ConfigProperty(name = "speaker-pipeline.dedup.batch-size", defaultValue = "1000")
    int batchSize;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "speaker-pipeline.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MongoClient mongoClient() {
        log.info("Producing MongoClient");
        return MongoClients.create(mongoUri);
    }

    public void closeMongoClient(@Disposes MongoClient client) {
        log.info("Closing MongoClient");
        client.close();
    }

    @Produces
    @ApplicationScoped
    public SpeakerStore speakerStore(MongoClient client) {
        log.info("Producing SpeakerStore: {}.{}", targetDatabase, targetCollection);
        return new MongoSpeakerStore(client, targetDatabase, targetCollection);
    }

    @Produces
    @ApplicationScoped
    public SourceDocumentReader sourceDocumentReader(MongoClient client) {
        return new MongoSourceDocumentReader(client);
    }

    @Produces
    @ApplicationScoped
    public TopicCanonicalizer topicCanonicalizer() {
        return topicMappingPath
                .map(path -> TopicCanonicalizer.fromPath(Path.of(path)))
                .orElseGet(TopicCanonicalizer::fromClasspath);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (metricsEnabled && meterRegistry.isResolvable()) {
            log.info("Metrics enabled");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public DeduplicationOptions deduplicationOptions() {
        return DeduplicationOptions.builder()
                .baseThreshold(baseThreshold)
                .locationThreshold(locationThreshold)
                .batchSize(batchSize)
                .build();
    }

    @Produces
    @ApplicationScoped
    public SpeakerUnifier speakerUnifier(SpeakerStore store, SourceDocumentReader reader,
                                         TopicCanonicalizer topics, MetricsService metrics,
                                         DeduplicationOptions options) {
        return SpeakerUnifier.builder()
                .store(store)
                .sourceReader(reader)
                .topicCanonicalizer(topics)
                .metricsService(metrics)
                .options(options)
                .build();
    }
}
