package com.speaker.standardization.ingest;

import java.util.List;

/**
 * Outcome of ingesting one source.
 *
 * @param sourceName     the source label
 * @param processed      records read from the source, skipped ones included
 * @param inserted       new unified speakers
 * @param updated        records merged into an existing unified speaker
 * @param skippedRecords records that could not be normalized
 */
public record SourceRunResult(
        String sourceName,
        long processed,
        long inserted,
        long updated,
        List<SkippedRecord> skippedRecords
) {
    public SourceRunResult {
        skippedRecords = skippedRecords != null ? List.copyOf(skippedRecords) : List.of();
    }

    public long skipped() {
        return skippedRecords.size();
    }

    public boolean hasSkipped() {
        return !skippedRecords.isEmpty();
    }

    /**
     * A source record dropped during normalization.
     *
     * @param offset  1-based position of the record in the source
     * @param message why it was dropped
     */
    public record SkippedRecord(long offset, String message) {}

    @Override
    public String toString() {
        return "SourceRunResult{source=" + sourceName +
                ", processed=" + processed +
                ", inserted=" + inserted +
                ", updated=" + updated +
                ", skipped=" + skippedRecords.size() + '}';
    }
}
