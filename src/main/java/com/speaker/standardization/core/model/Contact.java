package com.speaker.standardization.core.model;

/**
 * Contact details published by a source. Any field may be null.
 */
public record Contact(String email, String phone, String website) {

    private static final Contact EMPTY = new Contact(null, null, null);

    public static Contact empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return isBlank(email) && isBlank(phone) && isBlank(website);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
