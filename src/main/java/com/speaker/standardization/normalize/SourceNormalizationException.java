package com.speaker.standardization.normalize;

/**
 * Thrown when a single source document cannot be turned into a candidate,
 * for example because its id field is missing. The document is skipped; the run continues.
 */
public class SourceNormalizationException extends RuntimeException {

    private final String sourceName;

    public SourceNormalizationException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public SourceNormalizationException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
