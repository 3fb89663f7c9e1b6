package com.speaker.standardization.core.model;

import java.time.Instant;

/**
 * Provenance of a unified record: the source that founded the identity.
 *
 * @param originalSource source label, e.g. {@code bigspeak}
 * @param sourceUrl      profile URL on the source site
 * @param scrapedAt      scrape time reported by the source, may be null
 * @param sourceId       identifier of the record inside its source
 */
public record SourceInfo(String originalSource, String sourceUrl, Instant scrapedAt, String sourceId) {
}
