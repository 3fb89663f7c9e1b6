package com.speaker.standardization.normalize;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw topic strings to canonical terms.
 *
 * <p>The mapping file is a JSON object {@code {"Canonical Term": ["raw 1", "raw 2"]}}. Lookups are
 * exact after collapsing whitespace. A raw topic without a canonical term is kept as is and
 * also reported as unmapped. Both lists are sorted and hold each topic once, compared
 * without regard to case.</p>
 */
public class TopicCanonicalizer {
    private static final Logger log = LoggerFactory.getLogger(TopicCanonicalizer.class);

    public static final String DEFAULT_RESOURCE = "topic_mapping.json";

    private static final TypeReference<Map<String, List<String>>> MAPPING_TYPE = new TypeReference<>() {};

    private final Map<String, String> rawToCanonical;

    public TopicCanonicalizer(Map<String, List<String>> mapping) {
        Map<String, String> reverse = new HashMap<>();
        mapping.forEach((canonical, raws) -> {
            if (raws != null) {
                for (String raw : raws) {
                    if (raw != null) {
                        reverse.put(raw, canonical);
                    }
                }
            }
        });
        this.rawToCanonical = Map.copyOf(reverse);
    }

    /**
     * Loads the mapping bundled on the classpath.
     */
    public static TopicCanonicalizer fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static TopicCanonicalizer fromClasspath(String resource) {
        try (InputStream in = TopicCanonicalizer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Topic mapping resource not found: " + resource);
            }
            return load(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read topic mapping " + resource, e);
        }
    }

    public static TopicCanonicalizer fromPath(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Topic mapping file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read topic mapping " + path, e);
        }
    }

    private static TopicCanonicalizer load(InputStream in, String origin) throws IOException {
        Map<String, List<String>> mapping = new ObjectMapper().readValue(in, MAPPING_TYPE);
        TopicCanonicalizer canonicalizer = new TopicCanonicalizer(mapping);
        log.info("topics.mapping.loaded origin={} canonical={} raw={}",
                origin, mapping.size(), canonicalizer.size());
        return canonicalizer;
    }

    /**
     * Canonicalizes the raw topics of one record. Null and blank topics are ignored.
     */
    public TopicResult canonicalize(Collection<String> rawTopics) {
        if (rawTopics == null || rawTopics.isEmpty()) {
            return TopicResult.empty();
        }
        Map<String, String> canonical = new LinkedHashMap<>();
        Map<String, String> unmapped = new LinkedHashMap<>();
        for (String raw : rawTopics) {
            if (raw == null) {
                continue;
            }
            String clean = raw.replaceAll("\\s+", " ").strip();
            if (clean.isEmpty()) {
                continue;
            }
            String mapped = rawToCanonical.get(clean);
            if (mapped != null) {
                canonical.putIfAbsent(topicKey(mapped), mapped);
            } else {
                canonical.putIfAbsent(topicKey(clean), clean);
                unmapped.putIfAbsent(topicKey(clean), clean);
            }
        }
        return new TopicResult(sorted(canonical.values()), sorted(unmapped.values()));
    }

    /**
     * Case-insensitive identity of a cleaned topic; the first spelling seen is kept.
     */
    private static String topicKey(String topic) {
        return topic.toLowerCase(Locale.ROOT);
    }

    private static List<String> sorted(Collection<String> topics) {
        List<String> result = new ArrayList<>(topics);
        result.sort(null);
        return List.copyOf(result);
    }

    /**
     * Number of raw spellings known.
     */
    public int size() {
        return rawToCanonical.size();
    }
}
