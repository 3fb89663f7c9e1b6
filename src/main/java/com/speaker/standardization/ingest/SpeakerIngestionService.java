package com.speaker.standardization.ingest;

import com.speaker.standardization.api.DeduplicationOptions;
import com.speaker.standardization.core.model.NormalizedCandidate;
import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.dedup.DuplicateDetector;
import com.speaker.standardization.dedup.DuplicateMatch;
import com.speaker.standardization.index.CandidateIndex;
import com.speaker.standardization.logging.LogContext;
import com.speaker.standardization.merge.SpeakerMergeResolver;
import com.speaker.standardization.metrics.MetricsService;
import com.speaker.standardization.metrics.NoOpMetricsService;
import com.speaker.standardization.normalize.SourceNormalizationException;
import com.speaker.standardization.similarity.BlockingKeyStrategy;
import com.speaker.standardization.similarity.IndelRatioSimilarity;
import com.speaker.standardization.similarity.NameFingerprinter;
import com.speaker.standardization.store.BatchFlushException;
import com.speaker.standardization.store.SpeakerStore;
import com.speaker.standardization.store.SpeakerStoreException;
import com.speaker.standardization.store.SpeakerWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams normalized candidates into the unified store.
 *
 * <p>For each candidate, in order: a duplicate match is merged into the matched identity;
 * a candidate whose own id is already pending or stored is merged into that document; anything else
 * becomes a new identity and is registered in the {@link CandidateIndex} immediately, so
 * later candidates of the same batch can match it. Writes are buffered in a {@link WriteBatch}
 * and flushed when it is full and when the source is exhausted.</p>
 *
 * <p>Not thread-safe. One instance serves one run; the index it holds is mutated in place.</p>
 */
public class SpeakerIngestionService {
    private static final Logger log = LoggerFactory.getLogger(SpeakerIngestionService.class);

    private final SpeakerStore store;
    private final CandidateIndex index;
    private final BlockingKeyStrategy keyStrategy;
    private final DuplicateDetector detector;
    private final SpeakerMergeResolver mergeResolver;
    private final DeduplicationOptions options;
    private final MetricsService metricsService;
    private final ProgressCallback progressCallback;
    private final Clock clock;
    private final String runId;

    private SpeakerIngestionService(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.index = Objects.requireNonNull(builder.index, "index is required");
        this.options = builder.options != null ? builder.options : DeduplicationOptions.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.keyStrategy = builder.keyStrategy != null ? builder.keyStrategy : new NameFingerprinter();
        this.detector = builder.detector != null ? builder.detector
                : new DuplicateDetector(keyStrategy, new IndelRatioSimilarity(), options, metricsService);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.mergeResolver = builder.mergeResolver != null ? builder.mergeResolver : new SpeakerMergeResolver(clock);
        this.progressCallback = builder.progressCallback != null ? builder.progressCallback : ProgressCallback.NOOP;
        this.runId = builder.runId != null ? builder.runId : LogContext.generateRunId();
    }

    /**
     * Ingests every candidate of one source.
     *
     * <p>The iterator may throw {@link SourceNormalizationException} from {@code next()} for a
     * malformed record; that record is skipped and the source continues.</p>
     *
     * @param sourceName label of the source, used for logging and metrics
     * @param candidates normalized candidates in source order
     * @return counts for this source
     * @throws BatchFlushException if a bulk write fails; nothing after the failed batch is processed
     */
    public SourceRunResult runSource(String sourceName, Iterator<NormalizedCandidate> candidates) {
        try (LogContext ctx = LogContext.forSource(runId, sourceName)) {
            Instant started = clock.instant();
            log.info("ingest.source.starting batchSize={} indexed={}", options.getBatchSize(), index.size());

            WriteBatch batch = new WriteBatch(options.getBatchSize());
            List<SourceRunResult.SkippedRecord> skipped = new ArrayList<>();
            long processed = 0;
            long inserted = 0;
            long updated = 0;

            while (candidates.hasNext()) {
                processed++;
                NormalizedCandidate candidate;
                try {
                    candidate = candidates.next();
                } catch (SourceNormalizationException e) {
                    log.warn("ingest.record.skipped offset={} reason={}", processed, e.getMessage());
                    skipped.add(new SourceRunResult.SkippedRecord(processed, e.getMessage()));
                    metricsService.incrementRecordSkipped(sourceName);
                    continue;
                }

                if (ingest(candidate, batch, sourceName)) {
                    inserted++;
                } else {
                    updated++;
                }

                if (batch.isFull()) {
                    flush(batch, sourceName, processed);
                }
                if (processed % options.getProgressInterval() == 0) {
                    progressCallback.onProgress(sourceName, processed,
                            "inserted=" + inserted + " updated=" + updated);
                }
            }
            flush(batch, sourceName, processed);

            Duration elapsed = Duration.between(started, clock.instant());
            metricsService.recordSourceDuration(sourceName, elapsed);
            progressCallback.onProgress(sourceName, processed, "completed");

            SourceRunResult result = new SourceRunResult(sourceName, processed, inserted, updated, skipped);
            log.info("ingest.source.completed processed={} inserted={} updated={} skipped={} durationMs={}",
                    processed, inserted, updated, skipped.size(), elapsed.toMillis());
            return result;
        }
    }

    /**
     * @return true if the candidate became a new identity, false if it was merged
     */
    private boolean ingest(NormalizedCandidate candidate, WriteBatch batch, String sourceName) {
        Optional<DuplicateMatch> match = detector.findDuplicate(candidate.name(), candidate.city(), index);
        if (match.isPresent()) {
            String targetId = match.get().identityId();
            UnifiedSpeaker existing = loadExisting(targetId, batch)
                    .orElseThrow(() -> new SpeakerStoreException("Indexed speaker " + targetId + " not found"));
            batch.add(SpeakerWrite.update(mergeResolver.merge(existing, candidate)));
            metricsService.incrementSpeakerMerged(sourceName);
            log.debug("ingest.merged candidateId={} targetId={} score={} rule={}",
                    candidate.id(), targetId, match.get().score(), match.get().rule());
            return false;
        }

        Optional<UnifiedSpeaker> known = findKnownId(candidate, batch);
        if (known.isPresent()) {
            batch.add(SpeakerWrite.update(mergeResolver.merge(known.get(), candidate)));
            metricsService.incrementSpeakerMerged(sourceName);
            log.debug("ingest.reingested id={}", candidate.id());
            return false;
        }

        UnifiedSpeaker created = UnifiedSpeaker.fromCandidate(candidate, clock.instant());
        batch.add(SpeakerWrite.insert(created));
        index.register(keyStrategy.generateKey(created.getName()), created.getId(), created.getName(), created.getCity());
        metricsService.incrementSpeakerInserted(sourceName);
        log.debug("ingest.inserted id={} name='{}'", created.getId(), created.getName());
        return true;
    }

    /**
     * Looks up a speaker already holding the candidate's own id, pending or stored.
     * Names without a fingerprint are never indexed, so for those the store is always asked.
     */
    private Optional<UnifiedSpeaker> findKnownId(NormalizedCandidate candidate, WriteBatch batch) {
        Optional<UnifiedSpeaker> pending = batch.find(candidate.id());
        if (pending.isPresent()) {
            return pending;
        }
        if (index.contains(candidate.id()) || keyStrategy.generateKey(candidate.name()).isEmpty()) {
            return store.findById(candidate.id());
        }
        return Optional.empty();
    }

    private Optional<UnifiedSpeaker> loadExisting(String id, WriteBatch batch) {
        Optional<UnifiedSpeaker> pending = batch.find(id);
        return pending.isPresent() ? pending : store.findById(id);
    }

    private void flush(WriteBatch batch, String sourceName, long offset) {
        if (batch.isEmpty()) {
            return;
        }
        int size = batch.size();
        try (LogContext ctx = LogContext.forFlush(sourceName, offset)) {
            try {
                store.bulkWrite(batch.snapshot());
            } catch (SpeakerStoreException e) {
                log.error("ingest.flush.failed writes={} error={}", size, e.getMessage());
                throw new BatchFlushException(sourceName, offset, size, e);
            }
            batch.clear();
            metricsService.recordFlushSize(size);
            log.debug("ingest.flushed writes={}", size);
        }
    }

    public CandidateIndex getIndex() {
        return index;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SpeakerStore store;
        private CandidateIndex index;
        private BlockingKeyStrategy keyStrategy;
        private DuplicateDetector detector;
        private SpeakerMergeResolver mergeResolver;
        private DeduplicationOptions options;
        private MetricsService metricsService;
        private ProgressCallback progressCallback;
        private Clock clock;
        private String runId;

        public Builder store(SpeakerStore store) {
            this.store = store;
            return this;
        }

        public Builder index(CandidateIndex index) {
            this.index = index;
            return this;
        }

        public Builder keyStrategy(BlockingKeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
            return this;
        }

        public Builder detector(DuplicateDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder mergeResolver(SpeakerMergeResolver mergeResolver) {
            this.mergeResolver = mergeResolver;
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

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public SpeakerIngestionService build() {
            return new SpeakerIngestionService(this);
        }
    }
}
