package com.speaker.standardization.normalize;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives unified speaker ids: the lowercase SHA-1 hex digest of {@code prefix|localId}.
 * The same source record always maps to the same id.
 */
public final class SpeakerIds {

    private SpeakerIds() {
        // Utility class
    }

    public static String of(String prefix, String localId) {
        return sha1Hex(prefix + "|" + localId);
    }

    static String sha1Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
