package com.speaker.standardization.store;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOneModel;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.WriteModel;
import com.speaker.standardization.core.model.UnifiedSpeaker;
import com.speaker.standardization.index.IndexEntry;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link SpeakerStore} backed by a MongoDB collection.
 *
 * <p>Inserts are written as {@code $setOnInsert} upserts so that an id which already exists
 * is never overwritten by a fresh record. Updates replace the whole document.
 * Bulk writes are unordered.</p>
 */
public class MongoSpeakerStore implements SpeakerStore {
    private static final Logger log = LoggerFactory.getLogger(MongoSpeakerStore.class);

    private final MongoClient client;
    private final String databaseName;
    private final MongoCollection<Document> collection;

    public MongoSpeakerStore(MongoClient client, String databaseName, String collectionName) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName is required");
        Objects.requireNonNull(collectionName, "collectionName is required");
        this.collection = client.getDatabase(databaseName).getCollection(collectionName);
    }

    @Override
    public String getName() {
        return "mongo:" + collection.getNamespace().getFullName();
    }

    @Override
    public void bulkWrite(List<SpeakerWrite> writes) {
        if (writes.isEmpty()) {
            return;
        }
        List<WriteModel<Document>> ops = new ArrayList<>(writes.size());
        for (SpeakerWrite write : writes) {
            Document doc = SpeakerDocumentMapper.toDocument(write.speaker());
            if (write.kind() == SpeakerWrite.Kind.INSERT) {
                Document fields = new Document(doc);
                fields.remove(SpeakerDocumentMapper.ID);
                ops.add(new UpdateOneModel<>(
                        Filters.eq(SpeakerDocumentMapper.ID, write.id()),
                        new Document("$setOnInsert", fields),
                        new UpdateOptions().upsert(true)));
            } else {
                ops.add(new ReplaceOneModel<>(
                        Filters.eq(SpeakerDocumentMapper.ID, write.id()),
                        doc,
                        new ReplaceOptions().upsert(true)));
            }
        }
        try {
            var result = collection.bulkWrite(ops, new BulkWriteOptions().ordered(false));
            log.debug("store.bulkWrite writes={} upserted={} modified={}",
                    ops.size(), result.getUpserts().size(), result.getModifiedCount());
        } catch (MongoException e) {
            throw new SpeakerStoreException("MongoDB bulk write failed for " + getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<UnifiedSpeaker> findById(String id) {
        try {
            Document doc = collection.find(Filters.eq(SpeakerDocumentMapper.ID, id)).first();
            return Optional.ofNullable(doc).map(SpeakerDocumentMapper::fromDocument);
        } catch (MongoException e) {
            throw new SpeakerStoreException("Failed to read speaker " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void forEachIdentity(Consumer<IndexEntry> consumer) {
        String cityPath = SpeakerDocumentMapper.LOCATION + "." + SpeakerDocumentMapper.CITY;
        try (MongoCursor<Document> cursor = collection.find()
                .projection(Projections.include(SpeakerDocumentMapper.NAME, cityPath))
                .iterator()) {
            while (cursor.hasNext()) {
                Document doc = cursor.next();
                String city = null;
                if (doc.get(SpeakerDocumentMapper.LOCATION) instanceof Document location) {
                    city = location.getString(SpeakerDocumentMapper.CITY);
                }
                consumer.accept(new IndexEntry(
                        String.valueOf(doc.get(SpeakerDocumentMapper.ID)),
                        doc.getString(SpeakerDocumentMapper.NAME),
                        city));
            }
        } catch (MongoException e) {
            throw new SpeakerStoreException("Failed to scan " + getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long count() {
        try {
            return collection.countDocuments();
        } catch (MongoException e) {
            throw new SpeakerStoreException("Failed to count " + getName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        try {
            client.getDatabase(databaseName).runCommand(new Document("ping", 1));
            return true;
        } catch (MongoException e) {
            log.warn("store.ping.failed store={} error={}", getName(), e.getMessage());
            return false;
        }
    }
}
