package com.speaker.standardization.source;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SourceDocumentReader} over documents held in memory.
 * A source with no documents registered behaves like a missing database.
 */
public class InMemorySourceDocumentReader implements SourceDocumentReader {

    private final Map<SpeakerSource, List<Map<String, Object>>> documents = new EnumMap<>(SpeakerSource.class);

    public InMemorySourceDocumentReader add(SpeakerSource source, Map<String, Object> document) {
        documents.computeIfAbsent(source, s -> new ArrayList<>()).add(document);
        return this;
    }

    /**
     * Registers documents for the source. An empty list marks the source as present but empty.
     */
    public InMemorySourceDocumentReader addAll(SpeakerSource source, List<Map<String, Object>> docs) {
        documents.computeIfAbsent(source, s -> new ArrayList<>()).addAll(docs);
        return this;
    }

    @Override
    public Optional<SourceCursor> open(SpeakerSource source) {
        List<Map<String, Object>> docs = documents.get(source);
        if (docs == null) {
            return Optional.empty();
        }
        Iterator<Map<String, Object>> iterator = List.copyOf(docs).iterator();
        return Optional.of(new SourceCursor() {
            @Override
            public String getCollectionName() {
                return source.getCollectionName();
            }

            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public RawSourceDocument next() {
                return new RawSourceDocument(source, iterator.next());
            }

            @Override
            public void close() {
                // nothing to release
            }
        });
    }
}
