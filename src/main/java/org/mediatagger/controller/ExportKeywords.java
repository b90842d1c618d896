package org.mediatagger.controller;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.mediatagger.model.MediaMetadata;

/**
 * Adds the keywords a processed still image is tagged with on top of its
 * own: one for its star rating, one marking it as exported, and one
 * recording the day of the export.
 *
 * <p>Ratings are shifted down by one star, so that a one-star "seen"
 * rating and no rating at all both become {@code 0-star}.
 */
public class ExportKeywords {

    static final String EXPORT_KEYWORD = "Lightroom_Export";
    static final String EXPORT_DAY_PREFIX = EXPORT_KEYWORD + "_on_";

    private static final DateTimeFormatter EXPORT_DAY = DateTimeFormatter.ofPattern("yyyy_MM_dd");
    private static final Pattern RATING_KEYWORD = Pattern.compile("^\\d+-star$");

    private final Clock clock;

    /**
     * @param clock the clock the export day is taken from
     */
    public ExportKeywords(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param rating a star rating; null counts as no stars
     * @return {@code 0-star} for ratings up to one, otherwise one star less
     *         than the rating, e.g. {@code 4-star} for five
     */
    public static String ratingKeyword(Integer rating) {
        if (rating == null || rating <= 1) {
            return "0-star";
        }
        return (rating - 1) + "-star";
    }

    /**
     * @return the export keyword and the keyword for today's export
     */
    public List<String> exportKeywords() {
        return List.of(EXPORT_KEYWORD, EXPORT_DAY_PREFIX + LocalDate.now(clock).format(EXPORT_DAY));
    }

    /**
     * @param metadata the aggregated metadata of a still image
     * @return the same metadata with the rating and export keywords appended;
     *         a rating keyword or today's export keywords already present
     *         are moved to the end, earlier export days are kept
     */
    public MediaMetadata addTo(MediaMetadata metadata) {
        List<String> added = new ArrayList<>();
        added.add(ratingKeyword(metadata.getRating()));
        added.addAll(exportKeywords());

        List<String> keywords = new ArrayList<>();
        for (String keyword : metadata.getKeywords()) {
            if (!RATING_KEYWORD.matcher(keyword).matches() && !added.contains(keyword)) {
                keywords.add(keyword);
            }
        }
        keywords.addAll(added);
        return metadata.toBuilder().keywords(keywords).build();
    }
}
