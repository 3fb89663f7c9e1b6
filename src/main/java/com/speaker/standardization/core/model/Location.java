package com.speaker.standardization.core.model;

/**
 * Structured speaker location.
 * {@code city} is never null; an unknown city is the empty string.
 */
public record Location(String city, String state, String country, String fullLocation) {

    private static final Location EMPTY = new Location("", null, null, null);

    public Location {
        city = city != null ? city : "";
    }

    public static Location empty() {
        return EMPTY;
    }

    public static Location of(String city, String state, String country, String fullLocation) {
        return new Location(city, state, country, fullLocation);
    }

    /**
     * Returns true when no part of the location is known.
     */
    public boolean isEmpty() {
        return city.isBlank() && isBlank(state) && isBlank(country) && isBlank(fullLocation);
    }

    public boolean hasCity() {
        return !city.isBlank();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
