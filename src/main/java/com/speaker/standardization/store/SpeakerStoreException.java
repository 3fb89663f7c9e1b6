package com.speaker.standardization.store;

/**
 * Runtime exception thrown when the speaker store cannot be reached or rejects a write.
 * Fatal for the current run.
 */
public class SpeakerStoreException extends RuntimeException {

    public SpeakerStoreException(String message) {
        super(message);
    }

    public SpeakerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
