package com.speaker.standardization.api;

import com.speaker.standardization.core.model.NormalizedCandidate;
import com.speaker.standardization.health.HealthCheckRegistry;
import com.speaker.standardization.health.HealthStatus;
import com.speaker.standardization.health.SpeakerStoreHealthCheck;
import com.speaker.standardization.index.CandidateIndex;
import com.speaker.standardization.ingest.ProgressCallback;
import com.speaker.standardization.ingest.SourceRunResult;
import com.speaker.standardization.ingest.SpeakerIngestionService;
import com.speaker.standardization.logging.LogContext;
import com.speaker.standardization.metrics.MetricsService;
import com.speaker.standardization.metrics.NoOpMetricsService;
import com.speaker.standardization.normalize.SourceNormalizer;
import com.speaker.standardization.normalize.SourceNormalizers;
import com.speaker.standardization.normalize.TopicCanonicalizer;
import com.speaker.standardization.similarity.BlockingKeyStrategy;
import com.speaker.standardization.similarity.NameFingerprinter;
import com.speaker.standardization.source.SourceCursor;
import com.speaker.standardization.source.SourceDocumentReader;
import com.speaker.standardization.source.SpeakerSource;
import com.speaker.standardization.store.BatchFlushException;
import com.speaker.standardization.store.SpeakerStore;
import com.speaker.standardization.store.SpeakerStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the speaker standardization pipeline.
 *
 * <p>A run checks that the store is reachable, rebuilds the candidate index from the unified
 * collection, then streams every source through its normalizer into the ingestion service.
 * Sources are processed one after the other in {@link SpeakerSource} order.</p>
 *
 * <pre>
 * SpeakerUnifier unifier = SpeakerUnifier.builder()
 *     .store(new MongoSpeakerStore(client, "speaker_database", "unified_speakers"))
 *     .sourceReader(new MongoSourceDocumentReader(client))
 *     .topicCanonicalizer(TopicCanonicalizer.fromClasspath())
 *     .build();
 * UnificationReport report = unifier.run();
 * </pre>
 */
public class SpeakerUnifier {
    private static final Logger log = LoggerFactory.getLogger(SpeakerUnifier.class);

    private final SpeakerStore store;
    private final SourceDocumentReader sourceReader;
    private final SourceNormalizers normalizers;
    private final BlockingKeyStrategy keyStrategy;
    private final DeduplicationOptions options;
    private final MetricsService metricsService;
    private final ProgressCallback progressCallback;
    private final Clock clock;
    private final List<SpeakerSource> sources;
    private final HealthCheckRegistry healthCheckRegistry;

    private SpeakerUnifier(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.sourceReader = Objects.requireNonNull(builder.sourceReader, "sourceReader is required");
        if (builder.normalizers != null) {
            this.normalizers = builder.normalizers;
        } else {
            TopicCanonicalizer topics = builder.topicCanonicalizer != null
                    ? builder.topicCanonicalizer : TopicCanonicalizer.fromClasspath();
            this.normalizers = SourceNormalizers.create(topics);
        }
        this.keyStrategy = builder.keyStrategy != null ? builder.keyStrategy : new NameFingerprinter();
        this.options = builder.options != null ? builder.options : DeduplicationOptions.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.progressCallback = builder.progressCallback != null ? builder.progressCallback : ProgressCallback.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.sources = builder.sources != null ? List.copyOf(builder.sources) : List.of(SpeakerSource.values());

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new SpeakerStoreHealthCheck(store));

        log.info("unifier.initialized store={} sources={} options={}", store.getName(), sources.size(), options);
    }

    /**
     * Runs the pipeline over all configured sources.
     *
     * @throws SpeakerStoreException if the store is unreachable
     * @throws BatchFlushException   if a bulk write fails; the run stops at that batch
     */
    public UnificationReport run() {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId)) {
            HealthStatus health = healthCheckRegistry.checkAll();
            if (!health.isUp()) {
                log.error("unify.unhealthy message={} details={}", health.message(), health.details());
                throw new SpeakerStoreException("Speaker store unavailable: " + health.message());
            }

            log.info("unify.starting sources={}", sources.size());
            CandidateIndex index = CandidateIndex.rebuild(store, keyStrategy);
            SpeakerIngestionService ingestion = SpeakerIngestionService.builder()
                    .store(store)
                    .index(index)
                    .keyStrategy(keyStrategy)
                    .options(options)
                    .metricsService(metricsService)
                    .progressCallback(progressCallback)
                    .clock(clock)
                    .runId(runId)
                    .build();

            Map<String, SourceRunResult> perSource = new LinkedHashMap<>();
            List<String> skippedSources = new ArrayList<>();
            try {
                for (SpeakerSource source : sources) {
                    Optional<SourceCursor> cursor = sourceReader.open(source);
                    if (cursor.isEmpty()) {
                        skippedSources.add(source.getLabel());
                        continue;
                    }
                    try (SourceCursor c = cursor.get()) {
                        SourceRunResult result = ingestion.runSource(source.getLabel(),
                                normalizing(c, normalizers.forSource(source)));
                        perSource.put(source.getLabel(), result);
                    }
                }
            } catch (BatchFlushException e) {
                log.error("unify.aborted source={} offset={} error={}",
                        e.getSourceName(), e.getOffset(), e.getMessage());
                throw e;
            }

            UnificationReport report = UnificationReport.of(perSource, skippedSources, store.count());
            log.info("unify.completed ingested={} inserted={} updated={} skipped={} totalNow={}",
                    report.ingested(), report.inserted(), report.updated(), report.skipped(), report.totalNow());
            return report;
        }
    }

    /**
     * Returns the aggregate health of the pipeline's dependencies.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    private static Iterator<NormalizedCandidate> normalizing(SourceCursor cursor, SourceNormalizer normalizer) {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return cursor.hasNext();
            }

            @Override
            public NormalizedCandidate next() {
                return normalizer.normalize(cursor.next());
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SpeakerStore store;
        private SourceDocumentReader sourceReader;
        private SourceNormalizers normalizers;
        private TopicCanonicalizer topicCanonicalizer;
        private BlockingKeyStrategy keyStrategy;
        private DeduplicationOptions options;
        private MetricsService metricsService;
        private ProgressCallback progressCallback;
        private Clock clock;
        private List<SpeakerSource> sources;

        public Builder store(SpeakerStore store) {
            this.store = store;
            return this;
        }

        public Builder sourceReader(SourceDocumentReader sourceReader) {
            this.sourceReader = sourceReader;
            return this;
        }

        /**
         * Overrides the normalizers; {@link #topicCanonicalizer} is then ignored.
         */
        public Builder normalizers(SourceNormalizers normalizers) {
            this.normalizers = normalizers;
            return this;
        }

        public Builder topicCanonicalizer(TopicCanonicalizer topicCanonicalizer) {
            this.topicCanonicalizer = topicCanonicalizer;
            return this;
        }

        public Builder keyStrategy(BlockingKeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
            return this;
        }

        public Builder options(DeduplicationOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Restricts the run to these sources, processed in the given order.
         */
        public Builder sources(List<SpeakerSource> sources) {
            this.sources = sources;
            return this;
        }

        public SpeakerUnifier build() {
            return new SpeakerUnifier(this);
        }
    }
}
