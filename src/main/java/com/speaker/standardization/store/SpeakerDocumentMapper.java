package com.speaker.standardization.store;

import com.speaker.standardization.core.model.Contact;
import com.speaker.standardization.core.model.Location;
import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.SourceInfo;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.core.model.SpeakingInfo;
import com.speaker.standardization.core.model.UnifiedSpeaker;
import org.bson.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link UnifiedSpeaker} and the BSON shape of the {@code unified_speakers} collection.
 * Keys are snake_case; instants are stored as BSON dates.
 */
public final class SpeakerDocumentMapper {

    static final String ID = "_id";
    static final String NAME = "name";
    static final String LOCATION = "location";
    static final String CITY = "city";

    private SpeakerDocumentMapper() {
        // Utility class
    }

    public static Document toDocument(UnifiedSpeaker speaker) {
        SpeakerProfile p = speaker.getProfile();
        Location location = p.getLocation();
        SpeakingInfo speakingInfo = p.getSpeakingInfo();
        Media media = p.getMedia();
        Contact contact = p.getContact();

        Document doc = new Document(ID, speaker.getId())
                .append(NAME, p.getName())
                .append("display_name", p.getDisplayName())
                .append("job_title", p.getJobTitle())
                .append("description", p.getDescription())
                .append("biography", p.getBiography())
                .append("tagline", p.getTagline())
                .append(LOCATION, new Document(CITY, location.city())
                        .append("state", location.state())
                        .append("country", location.country())
                        .append("full_location", location.fullLocation()))
                .append("speaking_info", new Document("fee_ranges", new Document(speakingInfo.feeRanges()))
                        .append("languages", speakingInfo.languages()))
                .append("topics", p.getTopics())
                .append("categories", p.getCategories())
                .append("topics_unmapped", p.getTopicsUnmapped())
                .append("keynotes", p.getKeynotes())
                .append("reviews", p.getReviews())
                .append("ratings", new Document(p.getRatings()))
                .append("media", new Document("profile_image", media.profileImage())
                        .append("videos", media.videos()))
                .append("books", p.getBooks())
                .append("contact", new Document("email", contact.email())
                        .append("phone", contact.phone())
                        .append("website", contact.website()));

        SourceInfo sourceInfo = p.getSourceInfo();
        if (sourceInfo != null) {
            doc.append("source_info", new Document("original_source", sourceInfo.originalSource())
                    .append("source_url", sourceInfo.sourceUrl())
                    .append("scraped_at", toDate(sourceInfo.scrapedAt()))
                    .append("source_id", sourceInfo.sourceId()));
        }

        doc.append("created_at", toDate(speaker.getCreatedAt()))
                .append("updated_at", toDate(speaker.getUpdatedAt()));
        return doc;
    }

    public static UnifiedSpeaker fromDocument(Document doc) {
        Document location = subDocument(doc, LOCATION);
        Document speakingInfo = subDocument(doc, "speaking_info");
        Document media = subDocument(doc, "media");
        Document contact = subDocument(doc, "contact");

        SpeakerProfile.Builder profile = SpeakerProfile.builder()
                .name(string(doc, NAME))
                .displayName(string(doc, "display_name"))
                .jobTitle(string(doc, "job_title"))
                .description(string(doc, "description"))
                .biography(string(doc, "biography"))
                .tagline(string(doc, "tagline"))
                .location(new Location(string(location, CITY), string(location, "state"),
                        string(location, "country"), string(location, "full_location")))
                .speakingInfo(new SpeakingInfo(map(speakingInfo, "fee_ranges"), strings(speakingInfo, "languages")))
                .topics(strings(doc, "topics"))
                .categories(strings(doc, "categories"))
                .topicsUnmapped(strings(doc, "topics_unmapped"))
                .keynotes(objects(doc, "keynotes"))
                .reviews(objects(doc, "reviews"))
                .ratings(map(doc, "ratings"))
                .media(new Media(string(media, "profile_image"), objects(media, "videos")))
                .books(objects(doc, "books"))
                .contact(new Contact(string(contact, "email"), string(contact, "phone"), string(contact, "website")));

        if (doc.get("source_info") instanceof Document sourceInfo) {
            profile.sourceInfo(new SourceInfo(
                    string(sourceInfo, "original_source"),
                    string(sourceInfo, "source_url"),
                    toInstant(sourceInfo.get("scraped_at")),
                    string(sourceInfo, "source_id")));
        }

        Instant createdAt = toInstant(doc.get("created_at"));
        Instant updatedAt = toInstant(doc.get("updated_at"));
        return UnifiedSpeaker.builder()
                .id(String.valueOf(doc.get(ID)))
                .profile(profile.build())
                .createdAt(createdAt != null ? createdAt : Instant.EPOCH)
                .updatedAt(updatedAt)
                .build();
    }

    private static Document subDocument(Document doc, String key) {
        Object value = doc.get(key);
        if (value instanceof Document d) {
            return d;
        }
        if (value instanceof Map<?, ?> m) {
            Document d = new Document();
            m.forEach((k, v) -> d.append(String.valueOf(k), v));
            return d;
        }
        return new Document();
    }

    private static String string(Document doc, String key) {
        Object value = doc.get(key);
        return value != null ? value.toString() : null;
    }

    private static List<String> strings(Document doc, String key) {
        List<String> result = new ArrayList<>();
        if (doc.get(key) instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static List<Object> objects(Document doc, String key) {
        if (doc.get(key) instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return List.of();
    }

    private static Map<String, Object> map(Document doc, String key) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (doc.get(key) instanceof Map<?, ?> m) {
            m.forEach((k, v) -> result.put(String.valueOf(k), v));
        }
        return result;
    }

    private static Date toDate(Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }
}
