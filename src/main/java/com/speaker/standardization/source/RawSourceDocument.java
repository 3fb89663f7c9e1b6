package com.speaker.standardization.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An untyped document read from a source collection, tagged with its source.
 * Accessors are lenient: a missing key or a value of the wrong shape reads as absent.
 */
public record RawSourceDocument(SpeakerSource source, Map<String, Object> fields) {

    public RawSourceDocument {
        Objects.requireNonNull(source, "source is required");
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean has(String key) {
        return fields.get(key) != null;
    }

    /**
     * Returns the value as a string, or null. Non-string scalars (ObjectId, numbers) use {@code toString()}.
     */
    public String string(String key) {
        Object value = fields.get(key);
        if (value == null || value instanceof Map || value instanceof List) {
            return null;
        }
        return value.toString();
    }

    /**
     * Returns the first of the keys holding a non-blank string.
     */
    public String firstString(String... keys) {
        for (String key : keys) {
            String value = string(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the nested document under {@code key}, empty if absent.
     */
    public RawSourceDocument nested(String key) {
        return new RawSourceDocument(source, map(key));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        Object value = fields.get(key);
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> result = new LinkedHashMap<>();
            m.forEach((k, v) -> result.put(String.valueOf(k), v));
            return result;
        }
        return Map.of();
    }

    public List<Object> list(String key) {
        Object value = fields.get(key);
        if (value instanceof List<?> l) {
            List<Object> result = new ArrayList<>();
            for (Object item : l) {
                if (item != null) {
                    result.add(item);
                }
            }
            return result;
        }
        return List.of();
    }

    /**
     * String elements of the list under {@code key}; other element types are dropped.
     */
    public List<String> stringList(String key) {
        List<String> result = new ArrayList<>();
        for (Object item : list(key)) {
            if (item instanceof String s) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * Map elements of the list under {@code key}, each wrapped as a document of the same source.
     */
    public List<RawSourceDocument> documentList(String key) {
        List<RawSourceDocument> result = new ArrayList<>();
        for (Object item : list(key)) {
            if (item instanceof Map<?, ?> m) {
                Map<String, Object> fieldsOfItem = new LinkedHashMap<>();
                m.forEach((k, v) -> fieldsOfItem.put(String.valueOf(k), v));
                result.add(new RawSourceDocument(source, fieldsOfItem));
            }
        }
        return result;
    }
}
