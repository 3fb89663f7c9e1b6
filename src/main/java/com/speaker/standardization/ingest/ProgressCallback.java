package com.speaker.standardization.ingest;

/**
 * Receives progress notifications while a source is ingested.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param sourceName the source being ingested
     * @param processed  records read from the source so far
     * @param message    short status text
     */
    void onProgress(String sourceName, long processed, String message);

    ProgressCallback NOOP = (sourceName, processed, message) -> {};
}
