package com.speaker.standardization.store;

/**
 * Thrown when a bulk flush fails. Records how far ingestion got so the run can be
 * restarted; a restart rebuilds the index from whatever the store committed.
 */
public class BatchFlushException extends SpeakerStoreException {

    private final String sourceName;
    private final long offset;
    private final int pendingWrites;

    public BatchFlushException(String sourceName, long offset, int pendingWrites, Throwable cause) {
        super("Bulk flush failed for source " + sourceName + " at offset " + offset +
                " (" + pendingWrites + " pending writes): " + cause.getMessage(), cause);
        this.sourceName = sourceName;
        this.offset = offset;
        this.pendingWrites = pendingWrites;
    }

    /**
     * Source being ingested when the flush failed.
     */
    public String getSourceName() {
        return sourceName;
    }

    /**
     * Number of records of the source already processed when the flush failed.
     */
    public long getOffset() {
        return offset;
    }

    /**
     * Number of writes in the failed batch.
     */
    public int getPendingWrites() {
        return pendingWrites;
    }
}
