package com.speaker.standardization.dedup;

import com.speaker.standardization.api.DeduplicationOptions;
import com.speaker.standardization.index.CandidateIndex;
import com.speaker.standardization.index.IndexEntry;
import com.speaker.standardization.metrics.MetricsService;
import com.speaker.standardization.metrics.NoOpMetricsService;
import com.speaker.standardization.similarity.BlockingKeyStrategy;
import com.speaker.standardization.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether an incoming name refers to an identity already in the {@link CandidateIndex}.
 *
 * <p>Only identities sharing the candidate's fingerprint are compared. Entries are evaluated in
 * index order and the first one accepted wins:</p>
 * <ol>
 *   <li>similarity strictly above the base threshold, or</li>
 *   <li>similarity strictly above the location threshold when both cities are non-blank and
 *       equal after trimming, ignoring case.</li>
 * </ol>
 * <p>A candidate without a fingerprint never matches.</p>
 */
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final BlockingKeyStrategy keyStrategy;
    private final SimilarityAlgorithm similarity;
    private final DeduplicationOptions options;
    private final MetricsService metricsService;

    public DuplicateDetector(BlockingKeyStrategy keyStrategy, SimilarityAlgorithm similarity,
                             DeduplicationOptions options) {
        this(keyStrategy, similarity, options, new NoOpMetricsService());
    }

    public DuplicateDetector(BlockingKeyStrategy keyStrategy, SimilarityAlgorithm similarity,
                             DeduplicationOptions options, MetricsService metricsService) {
        this.keyStrategy = Objects.requireNonNull(keyStrategy, "keyStrategy is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.options = options != null ? options : DeduplicationOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        log.debug("dedup.detector.created algorithm={} baseThreshold={} locationThreshold={}",
                similarity.getName(), this.options.getBaseThreshold(), this.options.getLocationThreshold());
    }

    /**
     * Finds the identity an incoming candidate duplicates.
     *
     * @param candidateName name of the incoming candidate
     * @param candidateCity city of the incoming candidate, may be empty
     * @param index         the current index state
     * @return the first accepted identity, or empty to insert the candidate as new
     */
    public Optional<DuplicateMatch> findDuplicate(String candidateName, String candidateCity, CandidateIndex index) {
        String fingerprint = keyStrategy.generateKey(candidateName);
        if (fingerprint.isEmpty()) {
            log.debug("dedup.skipped reason=no-fingerprint name='{}'", candidateName);
            return Optional.empty();
        }

        List<IndexEntry> entries = index.lookup(fingerprint);
        if (entries.isEmpty()) {
            return Optional.empty();
        }

        boolean candidateHasCity = hasText(candidateCity);
        for (IndexEntry entry : entries) {
            double score = similarity.percentage(candidateName, entry.name());
            metricsService.recordSimilarityScore(score);

            if (score > options.getBaseThreshold()) {
                log.debug("dedup.matched identityId={} score={} rule={}", entry.identityId(), score,
                        MatchRule.NAME_SIMILARITY);
                return Optional.of(new DuplicateMatch(entry, score, MatchRule.NAME_SIMILARITY));
            }
            if (score > options.getLocationThreshold()
                    && candidateHasCity
                    && sameCity(candidateCity, entry.city())) {
                log.debug("dedup.matched identityId={} score={} rule={}", entry.identityId(), score,
                        MatchRule.NAME_AND_LOCATION);
                return Optional.of(new DuplicateMatch(entry, score, MatchRule.NAME_AND_LOCATION));
            }
            log.debug("dedup.rejected identityId={} score={} candidate='{}' indexed='{}'",
                    entry.identityId(), score, candidateName, entry.name());
        }

        return Optional.empty();
    }

    private static boolean sameCity(String candidateCity, String indexedCity) {
        if (!hasText(indexedCity)) {
            return false;
        }
        return candidateCity.trim().toLowerCase(Locale.ROOT)
                .equals(indexedCity.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
