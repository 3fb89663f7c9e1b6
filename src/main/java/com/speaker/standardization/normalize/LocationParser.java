package com.speaker.standardization.normalize;

import com.speaker.standardization.core.model.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the location shapes found in source documents into a {@link Location}.
 *
 * <ul>
 *   <li>{@code "City, State, Country"} and {@code "City, Country"} split on commas;</li>
 *   <li>any other string is taken as the country;</li>
 *   <li>a map passes through, with {@code state_province} as fallback for {@code state}.</li>
 * </ul>
 */
public final class LocationParser {

    private LocationParser() {
        // Utility class
    }

    public static Location parse(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return fromMap(map);
        }
        if (raw instanceof String text && !text.isBlank()) {
            return fromString(text);
        }
        return Location.empty();
    }

    static Location fromString(String text) {
        String[] parts = text.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].strip();
        }
        return switch (parts.length) {
            case 3 -> new Location(parts[0], parts[1], parts[2], text);
            case 2 -> new Location(parts[0], null, parts[1], text);
            default -> new Location(null, null, parts[0], text);
        };
    }

    static Location fromMap(Map<?, ?> map) {
        if (map.isEmpty()) {
            return Location.empty();
        }
        String state = text(map.get("state"));
        if (state == null) {
            state = text(map.get("state_province"));
        }
        List<String> present = new ArrayList<>();
        for (Object value : map.values()) {
            String part = text(value);
            if (part != null) {
                present.add(part);
            }
        }
        return new Location(text(map.get("city")), state, text(map.get("country")), String.join(", ", present));
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString();
        return s.isBlank() ? null : s;
    }
}
