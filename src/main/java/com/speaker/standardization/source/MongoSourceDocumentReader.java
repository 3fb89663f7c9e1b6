package com.speaker.standardization.source;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.speaker.standardization.store.SpeakerStoreException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads source documents from the scraper databases on one MongoDB deployment.
 *
 * <p>A missing database skips the source. A missing collection falls back to the first
 * collection whose name contains {@code speaker}, ignoring case.</p>
 */
public class MongoSourceDocumentReader implements SourceDocumentReader {
    private static final Logger log = LoggerFactory.getLogger(MongoSourceDocumentReader.class);

    private final MongoClient client;

    public MongoSourceDocumentReader(MongoClient client) {
        this.client = Objects.requireNonNull(client, "client is required");
    }

    @Override
    public Optional<SourceCursor> open(SpeakerSource source) {
        try {
            List<String> databases = client.listDatabaseNames().into(new ArrayList<>());
            if (!databases.contains(source.getDatabaseName())) {
                log.warn("source.skipped source={} reason=database-not-found", source.getDatabaseName());
                return Optional.empty();
            }

            MongoDatabase database = client.getDatabase(source.getDatabaseName());
            List<String> collections = database.listCollectionNames().into(new ArrayList<>());
            String collectionName = resolveCollection(source.getCollectionName(), collections);
            if (collectionName == null) {
                log.warn("source.skipped source={} reason=no-speaker-collection", source.getDatabaseName());
                return Optional.empty();
            }
            if (!collectionName.equals(source.getCollectionName())) {
                log.info("source.collection.fallback source={} configured={} using={}",
                        source.getDatabaseName(), source.getCollectionName(), collectionName);
            }

            MongoCursor<Document> cursor = database.getCollection(collectionName).find().iterator();
            return Optional.of(new MongoSourceCursor(source, collectionName, cursor));
        } catch (MongoException e) {
            throw new SpeakerStoreException("Failed to open source " + source.getDatabaseName() + ": " + e.getMessage(), e);
        }
    }

    static String resolveCollection(String configured, List<String> available) {
        if (available.contains(configured)) {
            return configured;
        }
        for (String name : available) {
            if (name.toLowerCase(Locale.ROOT).contains("speaker")) {
                return name;
            }
        }
        return null;
    }

    private static final class MongoSourceCursor implements SourceCursor {
        private final SpeakerSource source;
        private final String collectionName;
        private final MongoCursor<Document> cursor;

        private MongoSourceCursor(SpeakerSource source, String collectionName, MongoCursor<Document> cursor) {
            this.source = source;
            this.collectionName = collectionName;
            this.cursor = cursor;
        }

        @Override
        public String getCollectionName() {
            return collectionName;
        }

        @Override
        public boolean hasNext() {
            try {
                return cursor.hasNext();
            } catch (MongoException e) {
                throw new SpeakerStoreException("Failed to read " + source.getDatabaseName() + "." + collectionName, e);
            }
        }

        @Override
        public RawSourceDocument next() {
            try {
                return new RawSourceDocument(source, cursor.next());
            } catch (MongoException e) {
                throw new SpeakerStoreException("Failed to read " + source.getDatabaseName() + "." + collectionName, e);
            }
        }

        @Override
        public void close() {
            cursor.close();
        }
    }
}
