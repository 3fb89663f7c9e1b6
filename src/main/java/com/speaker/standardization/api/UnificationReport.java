package com.speaker.standardization.api;

import com.speaker.standardization.ingest.SourceRunResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one unification run.
 *
 * @param ingested       records read across all sources
 * @param inserted       new unified speakers
 * @param updated        records merged into existing speakers
 * @param skipped        records dropped during normalization
 * @param totalNow       documents in the unified collection after the run
 * @param perSource      per-source results in processing order, keyed by source label
 * @param skippedSources labels of sources that were not found
 */
public record UnificationReport(
        long ingested,
        long inserted,
        long updated,
        long skipped,
        long totalNow,
        Map<String, SourceRunResult> perSource,
        List<String> skippedSources
) {
    public UnificationReport {
        perSource = perSource != null ? Collections.unmodifiableMap(new LinkedHashMap<>(perSource)) : Map.of();
        skippedSources = skippedSources != null ? List.copyOf(skippedSources) : List.of();
    }

    /**
     * Builds the report by summing the per-source results.
     */
    public static UnificationReport of(Map<String, SourceRunResult> perSource, List<String> skippedSources,
                                       long totalNow) {
        long ingested = 0;
        long inserted = 0;
        long updated = 0;
        long skipped = 0;
        for (SourceRunResult result : perSource.values()) {
            ingested += result.processed();
            inserted += result.inserted();
            updated += result.updated();
            skipped += result.skipped();
        }
        return new UnificationReport(ingested, inserted, updated, skipped, totalNow, perSource, skippedSources);
    }

    @Override
    public String toString() {
        return "UnificationReport{ingested=" + ingested +
                ", inserted=" + inserted +
                ", updated=" + updated +
                ", skipped=" + skipped +
                ", totalNow=" + totalNow +
                ", skippedSources=" + skippedSources + '}';
    }
}
