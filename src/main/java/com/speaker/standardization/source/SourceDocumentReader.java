package com.speaker.standardization.source;

import java.util.Optional;

/**
 * Opens raw document streams for the scraped sources.
 */
public interface SourceDocumentReader {

    /**
     * Opens a cursor over every document of the source.
     *
     * @return empty when the source database, or any speaker collection in it, does not exist
     */
    Optional<SourceCursor> open(SpeakerSource source);
}
