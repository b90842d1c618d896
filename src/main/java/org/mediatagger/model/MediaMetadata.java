package org.mediatagger.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.mediatagger.controller.util.StringUtils;

/**
 * The merged metadata for one media file.
 *
 * <p>Instances are immutable; use {@link Builder} to assemble one from
 * several sources.  Any field no source provided is null (keywords: an empty
 * list).  The date, when present, is always in clock form
 * {@code YYYY:MM:DD HH:MM:SS}.  The star rating is carried along but is not
 * metadata of its own: a file with only a rating is still empty.
 */
public final class MediaMetadata {

    public static final MediaMetadata EMPTY = new Builder().build();

    private final String title;
    private final List<String> keywords;
    private final String date;
    private final String caption;
    private final MediaLocation location;
    private final GpsPosition gps;
    private final Integer rating;

    private MediaMetadata(Builder builder) {
        title = builder.title;
        keywords = Collections.unmodifiableList(new ArrayList<>(builder.keywords));
        date = builder.date;
        caption = builder.caption;
        location = builder.location;
        gps = builder.gps;
        rating = builder.rating;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public String getDate() {
        return date;
    }

    public String getCaption() {
        return caption;
    }

    /** @return never null; components may be */
    public MediaLocation getLocation() {
        return location;
    }

    public GpsPosition getGps() {
        return gps;
    }

    /** @return the star rating, 0 to 5; null if none was found */
    public Integer getRating() {
        return rating;
    }

    /**
     * @return true iff no field carries a value
     */
    public boolean isEmpty() {
        return title == null
            && keywords.isEmpty()
            && date == null
            && caption == null
            && location.isEmpty()
            && (gps == null || !gps.isComplete());
    }

    public Builder toBuilder() {
        return new Builder()
            .title(title)
            .keywords(keywords)
            .date(date)
            .caption(caption)
            .location(location)
            .gps(gps)
            .rating(rating);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MediaMetadata)) {
            return false;
        }
        MediaMetadata that = (MediaMetadata) o;
        return Objects.equals(title, that.title)
            && keywords.equals(that.keywords)
            && Objects.equals(date, that.date)
            && Objects.equals(caption, that.caption)
            && location.equals(that.location)
            && Objects.equals(gps, that.gps)
            && Objects.equals(rating, that.rating);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, keywords, date, caption, location, gps, rating);
    }

    @Override
    public String toString() {
        return "MediaMetadata[title=" + title
            + ", keywords=" + keywords
            + ", date=" + date
            + ", caption=" + caption
            + ", location=" + location
            + ", gps=" + gps
            + ", rating=" + rating + "]";
    }

    public static class Builder {
        private String title;
        private final Set<String> keywords = new LinkedHashSet<>();
        private String date;
        private String caption;
        private MediaLocation location = MediaLocation.EMPTY;
        private GpsPosition gps;
        private Integer rating;

        public Builder title(String title) {
            this.title = StringUtils.trimToNull(title);
            return this;
        }

        /**
         * Replaces the keywords.  Blank entries are dropped and duplicates
         * collapse onto their first occurrence.
         *
         * @param keywords the keywords, may be null
         * @return this builder
         */
        public Builder keywords(List<String> keywords) {
            this.keywords.clear();
            if (keywords != null) {
                for (String keyword : keywords) {
                    String k = StringUtils.trimToNull(keyword);
                    if (k != null) {
                        this.keywords.add(k);
                    }
                }
            }
            return this;
        }

        /**
         * @param date a date already in clock form, or null
         * @return this builder
         */
        public Builder date(String date) {
            this.date = StringUtils.trimToNull(date);
            return this;
        }

        public Builder caption(String caption) {
            this.caption = StringUtils.trimToNull(caption);
            return this;
        }

        public Builder location(MediaLocation location) {
            this.location = (location == null) ? MediaLocation.EMPTY : location;
            return this;
        }

        public Builder gps(GpsPosition gps) {
            this.gps = gps;
            return this;
        }

        public Builder rating(Integer rating) {
            this.rating = rating;
            return this;
        }

        public MediaMetadata build() {
            return new MediaMetadata(this);
        }
    }
}
