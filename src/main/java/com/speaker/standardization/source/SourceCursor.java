package com.speaker.standardization.source;

import java.util.Iterator;

/**
 * Forward-only stream of raw documents from one source. Must be closed.
 */
public interface SourceCursor extends Iterator<RawSourceDocument>, AutoCloseable {

    /**
     * Collection actually being read; differs from the configured one after a fallback.
     */
    String getCollectionName();

    @Override
    void close();
}
