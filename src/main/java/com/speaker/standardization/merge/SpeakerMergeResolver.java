package com.speaker.standardization.merge;

import com.speaker.standardization.core.model.Contact;
import com.speaker.standardization.core.model.Location;
import com.speaker.standardization.core.model.Media;
import com.speaker.standardization.core.model.NormalizedCandidate;
import com.speaker.standardization.core.model.SpeakerProfile;
import com.speaker.standardization.core.model.SpeakingInfo;
import com.speaker.standardization.core.model.UnifiedSpeaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Folds an incoming candidate into an existing unified speaker without losing information.
 *
 * <p>Merge rules:</p>
 * <ul>
 *   <li>Scalars: the incoming value is used only when the existing one is null or blank.</li>
 *   <li>Location, fee ranges and ratings: taken from the incoming record only when the existing group is empty.</li>
 *   <li>Lists: union with existing items first. Strings compare ignoring case and surrounding/repeated
 *       whitespace; other items compare by {@code equals}.</li>
 *   <li>Source info and creation time always stay with the existing record.</li>
 * </ul>
 *
 * <p>The resolver is stateless apart from its clock and may be shared.</p>
 */
public class SpeakerMergeResolver {
    private static final Logger log = LoggerFactory.getLogger(SpeakerMergeResolver.class);

    private final Clock clock;

    public SpeakerMergeResolver() {
        this(Clock.systemUTC());
    }

    public SpeakerMergeResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Merges {@code incoming} into {@code existing}.
     *
     * @return a new unified speaker with the existing id and creation time
     */
    public UnifiedSpeaker merge(UnifiedSpeaker existing, NormalizedCandidate incoming) {
        Objects.requireNonNull(existing, "existing is required");
        Objects.requireNonNull(incoming, "incoming is required");

        SpeakerProfile base = existing.getProfile();
        SpeakerProfile other = incoming.profile();

        SpeakerProfile merged = SpeakerProfile.builder(base)
                .name(fill(base.getName(), other.getName()))
                .displayName(fill(base.getDisplayName(), other.getDisplayName()))
                .jobTitle(fill(base.getJobTitle(), other.getJobTitle()))
                .description(fill(base.getDescription(), other.getDescription()))
                .biography(fill(base.getBiography(), other.getBiography()))
                .tagline(fill(base.getTagline(), other.getTagline()))
                .location(mergeLocation(base.getLocation(), other.getLocation()))
                .speakingInfo(mergeSpeakingInfo(base.getSpeakingInfo(), other.getSpeakingInfo()))
                .topics(unionStrings(base.getTopics(), other.getTopics()))
                .categories(unionStrings(base.getCategories(), other.getCategories()))
                .topicsUnmapped(unionStrings(base.getTopicsUnmapped(), other.getTopicsUnmapped()))
                .keynotes(unionObjects(base.getKeynotes(), other.getKeynotes()))
                .reviews(unionObjects(base.getReviews(), other.getReviews()))
                .ratings(base.getRatings().isEmpty() ? other.getRatings() : base.getRatings())
                .media(mergeMedia(base.getMedia(), other.getMedia()))
                .books(unionObjects(base.getBooks(), other.getBooks()))
                .contact(mergeContact(base.getContact(), other.getContact()))
                .sourceInfo(base.getSourceInfo())
                .build();

        log.debug("merge.resolved id={} incomingId={} topics={}",
                existing.getId(), incoming.id(), merged.getTopics().size());

        return UnifiedSpeaker.builder(existing)
                .profile(merged)
                .updatedAt(clock.instant())
                .build();
    }

    private static Location mergeLocation(Location existing, Location incoming) {
        return existing.isEmpty() ? incoming : existing;
    }

    private static SpeakingInfo mergeSpeakingInfo(SpeakingInfo existing, SpeakingInfo incoming) {
        Map<String, Object> fees = existing.feeRanges().isEmpty() ? incoming.feeRanges() : existing.feeRanges();
        return new SpeakingInfo(fees, unionStrings(existing.languages(), incoming.languages()));
    }

    private static Media mergeMedia(Media existing, Media incoming) {
        return new Media(
                fill(existing.profileImage(), incoming.profileImage()),
                unionObjects(existing.videos(), incoming.videos()));
    }

    private static Contact mergeContact(Contact existing, Contact incoming) {
        return new Contact(
                fill(existing.email(), incoming.email()),
                fill(existing.phone(), incoming.phone()),
                fill(existing.website(), incoming.website()));
    }

    static String fill(String existing, String incoming) {
        if (existing != null && !existing.isBlank()) {
            return existing;
        }
        return incoming != null && !incoming.isBlank() ? incoming : existing;
    }

    static List<String> unionStrings(List<String> existing, List<String> incoming) {
        return union(existing, incoming, SpeakerMergeResolver::comparableText);
    }

    static List<Object> unionObjects(List<Object> existing, List<Object> incoming) {
        return union(existing, incoming, item -> item instanceof String s ? comparableText(s) : item);
    }

    private static <T> List<T> union(List<T> existing, List<T> incoming, Function<T, Object> keyFn) {
        List<T> result = new ArrayList<>(existing);
        Set<Object> seen = new HashSet<>();
        for (T item : existing) {
            seen.add(keyFn.apply(item));
        }
        for (T item : incoming) {
            if (seen.add(keyFn.apply(item))) {
                result.add(item);
            }
        }
        return result;
    }

    private static String comparableText(String value) {
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
