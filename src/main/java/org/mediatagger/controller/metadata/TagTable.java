package org.mediatagger.controller.metadata;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.mediatagger.controller.util.StringUtils;
import org.mediatagger.model.GpsPosition;
import org.mediatagger.model.MediaLocation;
import org.mediatagger.model.MediaMetadata;

/**
 * Maps each {@link FieldKind} to the concrete tag names it is written to.
 *
 * <p>There is one table for still images and one for videos; a field kind
 * may map to several tags at once (a title goes to four), so that every
 * photo manager finds it where it looks.  Both tables share one read order,
 * used when the aggregator falls back to tags already embedded in a file.
 */
public final class TagTable {

    private static final Logger logger = Logger.getLogger(TagTable.class.getName());

    public static final TagTable IMAGE = new TagTable(
        "image",
        Set.of(".jpg", ".jpeg", ".heic", ".tif", ".tiff", ".png", ".dng"),
        imageWriteTags()
    );

    public static final TagTable VIDEO = new TagTable(
        "video",
        Set.of(".mp4", ".mov", ".m4v", ".mpg", ".mpeg"),
        videoWriteTags()
    );

    private static final Map<FieldKind, List<String>> READ_ORDER = readOrder();

    // Last-resort tag names, matched in any group.
    private static final Map<FieldKind, List<String>> ANY_GROUP_NAMES = anyGroupNames();

    // XMP stores GPS as degrees and decimal minutes: 32,54.99N
    private static final Pattern XMP_COORDINATE =
        Pattern.compile("^(\\d+),(\\d+(?:\\.\\d+)?)([NSEW])$");

    private final String name;
    private final Set<String> extensions;
    private final Map<FieldKind, List<String>> writeTags;

    private TagTable(String name, Set<String> extensions, Map<FieldKind, List<String>> writeTags) {
        this.name = name;
        this.extensions = extensions;
        this.writeTags = writeTags;
    }

    private static Map<FieldKind, List<String>> imageWriteTags() {
        Map<FieldKind, List<String>> tags = new EnumMap<>(FieldKind.class);
        tags.put(FieldKind.TITLE, List.of("XMP:Title", "IPTC:ObjectName", "IPTC:Headline", "EXIF:XPTitle"));
        tags.put(FieldKind.KEYWORDS, List.of("XMP:Subject", "IPTC:Keywords"));
        tags.put(FieldKind.DATE, List.of("EXIF:DateTimeOriginal", "XMP:DateTimeOriginal"));
        tags.put(FieldKind.CAPTION, List.of("XMP:Description", "IPTC:Caption-Abstract", "EXIF:ImageDescription"));
        tags.put(FieldKind.LOCATION, List.of("XMP:Location"));
        tags.put(FieldKind.CITY, List.of("XMP:City", "IPTC:City"));
        tags.put(FieldKind.STATE, List.of("XMP:State", "IPTC:Province-State"));
        tags.put(FieldKind.COUNTRY, List.of("XMP:Country", "IPTC:Country-PrimaryLocationName"));
        tags.put(FieldKind.GPS, List.of());
        tags.put(FieldKind.RATING, List.of());
        return Collections.unmodifiableMap(tags);
    }

    private static Map<FieldKind, List<String>> videoWriteTags() {
        Map<FieldKind, List<String>> tags = new EnumMap<>(FieldKind.class);
        tags.put(FieldKind.TITLE, List.of("XMP:Title", "QuickTime:Title", "ItemList:Title", "XMP-dc:Title"));
        tags.put(FieldKind.KEYWORDS, List.of("QuickTime:Keywords", "XMP:Subject"));
        tags.put(FieldKind.DATE, List.of(
            "QuickTime:CreateDate", "QuickTime:MediaCreateDate", "XMP:CreateDate", "XMP:DateTimeOriginal"));
        tags.put(FieldKind.CAPTION, List.of("QuickTime:Description", "XMP:Description", "ItemList:Description"));
        tags.put(FieldKind.LOCATION, List.of("XMP:Location", "QuickTime:LocationName"));
        tags.put(FieldKind.CITY, List.of("XMP:City", "QuickTime:City"));
        tags.put(FieldKind.STATE, List.of("XMP:State"));
        tags.put(FieldKind.COUNTRY, List.of("XMP:Country", "QuickTime:Country"));
        tags.put(FieldKind.GPS, List.of(
            "QuickTime:GPSCoordinates", "XMP:GPSLatitude", "XMP:GPSLongitude", "XMP:GPSAltitude"));
        tags.put(FieldKind.RATING, List.of());
        return Collections.unmodifiableMap(tags);
    }

    private static Map<FieldKind, List<String>> readOrder() {
        Map<FieldKind, List<String>> order = new EnumMap<>(FieldKind.class);
        order.put(FieldKind.TITLE, List.of(
            "XMP:Title", "IPTC:ObjectName", "QuickTime:Title", "ItemList:Title", "IPTC:Headline", "EXIF:XPTitle"));
        order.put(FieldKind.KEYWORDS, List.of("XMP:Subject", "IPTC:Keywords", "QuickTime:Keywords"));
        order.put(FieldKind.DATE, List.of(
            "EXIF:DateTimeOriginal", "XMP:DateTimeOriginal", "QuickTime:CreateDate",
            "XMP:CreateDate", "EXIF:CreateDate", "QuickTime:MediaCreateDate"));
        order.put(FieldKind.CAPTION, List.of(
            "XMP:Description", "IPTC:Caption-Abstract", "EXIF:ImageDescription",
            "QuickTime:Description", "ItemList:Description"));
        order.put(FieldKind.LOCATION, List.of("XMP:Location", "IPTC:Sub-location", "QuickTime:LocationName"));
        order.put(FieldKind.CITY, List.of("XMP:City", "IPTC:City", "QuickTime:City"));
        order.put(FieldKind.STATE, List.of("XMP:State", "IPTC:Province-State"));
        order.put(FieldKind.COUNTRY, List.of(
            "XMP:Country", "IPTC:Country-PrimaryLocationName", "QuickTime:Country"));
        order.put(FieldKind.GPS, List.of());
        order.put(FieldKind.RATING, List.of("XMP:Rating", "EXIF:Rating"));
        return Collections.unmodifiableMap(order);
    }

    private static Map<FieldKind, List<String>> anyGroupNames() {
        Map<FieldKind, List<String>> names = new EnumMap<>(FieldKind.class);
        names.put(FieldKind.TITLE, List.of("Title"));
        names.put(FieldKind.KEYWORDS, List.of("Subject", "Keywords"));
        names.put(FieldKind.DATE, List.of("DateTimeOriginal", "CreateDate"));
        names.put(FieldKind.CAPTION, List.of("Description"));
        names.put(FieldKind.LOCATION, List.of("Location", "LocationName"));
        names.put(FieldKind.CITY, List.of("City"));
        names.put(FieldKind.STATE, List.of("State"));
        names.put(FieldKind.COUNTRY, List.of("Country"));
        names.put(FieldKind.GPS, List.of());
        names.put(FieldKind.RATING, List.of("Rating"));
        return Collections.unmodifiableMap(names);
    }

    /**
     * Choose the table for a file by its extension.  Anything that is not a
     * known video is treated as an image.
     *
     * @param file the media file
     * @return the table to write the file's tags with
     */
    public static TagTable forFile(Path file) {
        String ext = StringUtils.getExtension(file.getFileName().toString());
        return VIDEO.supportsExtension(ext) ? VIDEO : IMAGE;
    }

    /**
     * @param file a file
     * @return true if either table knows the file's extension
     */
    public static boolean isSupported(Path file) {
        String ext = StringUtils.getExtension(file.getFileName().toString());
        return IMAGE.supportsExtension(ext) || VIDEO.supportsExtension(ext);
    }

    /**
     * @param extension file extension including the dot (e.g., ".mp4"); any case
     * @return true if this table handles the format
     */
    public boolean supportsExtension(String extension) {
        if (extension == null) {
            return false;
        }
        return extensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public String getName() {
        return name;
    }

    /**
     * @param kind a field kind
     * @return the tags a value of that kind is written to; may be empty
     */
    public List<String> writeTags(FieldKind kind) {
        return writeTags.get(kind);
    }

    /**
     * The tag names (without group) a value of the given kind is verified
     * against after writing.
     *
     * @param kind a field kind
     * @return the bare tag names, in write order, without duplicates
     */
    public List<String> verifyNames(FieldKind kind) {
        List<String> names = new ArrayList<>();
        for (String tag : writeTags(kind)) {
            String bare = tagName(tag);
            if (!names.contains(bare)) {
                names.add(bare);
            }
        }
        return names;
    }

    /**
     * The first value of the given kind found in a file's embedded tags,
     * trying the preferred tags in order and then the same tag name in any
     * group.
     *
     * @param tags tags as read by a {@link MetadataCodec}
     * @param kind a field kind
     * @return the value, or null if no tag of that kind has one
     */
    public static String readValue(Map<String, String> tags, FieldKind kind) {
        for (String tag : READ_ORDER.get(kind)) {
            String value = StringUtils.trimToNull(tags.get(tag));
            if (value != null) {
                return value;
            }
        }
        for (String bare : ANY_GROUP_NAMES.get(kind)) {
            for (Map.Entry<String, String> entry : tags.entrySet()) {
                if (bare.equals(tagName(entry.getKey()))) {
                    String value = StringUtils.trimToNull(entry.getValue());
                    if (value != null) {
                        return value;
                    }
                }
            }
        }
        return null;
    }

    /**
     * @param value a rating as stored in XMP or EXIF, such as {@code 3} or {@code 3.0}
     * @return the rating as a whole number, or null if value is absent or not a number
     */
    public static Integer parseRating(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            return (int) Double.parseDouble(trimmed);
        } catch (NumberFormatException nfe) {
            logger.fine("Unreadable rating: " + value);
            return null;
        }
    }

    /**
     * Build one write instruction per tag for every field of the metadata
     * that has a value.
     *
     * @param metadata the metadata to write
     * @return tag name to value, in a stable order
     */
    public Map<String, String> buildWriteTags(MediaMetadata metadata) {
        Map<String, String> result = new LinkedHashMap<>();
        put(result, FieldKind.TITLE, metadata.getTitle());
        if (!metadata.getKeywords().isEmpty()) {
            put(result, FieldKind.KEYWORDS, String.join(", ", metadata.getKeywords()));
        }
        put(result, FieldKind.DATE, metadata.getDate());
        put(result, FieldKind.CAPTION, metadata.getCaption());

        MediaLocation location = metadata.getLocation();
        put(result, FieldKind.LOCATION, location.combined());
        put(result, FieldKind.CITY, location.city());
        put(result, FieldKind.STATE, location.state());
        put(result, FieldKind.COUNTRY, location.country());

        GpsPosition gps = metadata.getGps();
        if (gps != null && gps.isComplete() && !writeTags(FieldKind.GPS).isEmpty()) {
            putGps(result, gps);
        }
        return result;
    }

    private void put(Map<String, String> result, FieldKind kind, String value) {
        if (value == null) {
            return;
        }
        for (String tag : writeTags(kind)) {
            result.put(tag, value);
        }
    }

    private void putGps(Map<String, String> result, GpsPosition gps) {
        String latitude = toQuickTimeCoordinate(gps.latitude());
        String longitude = toQuickTimeCoordinate(gps.longitude());
        if (latitude == null || longitude == null) {
            logger.warning("Unrecognized GPS coordinates, not written: " + gps);
            return;
        }
        String altitude = toMeters(gps.altitude());
        String coordinates = latitude + ", " + longitude;
        if (altitude != null) {
            coordinates += ", " + altitude;
        }
        for (String tag : writeTags(FieldKind.GPS)) {
            switch (tagName(tag)) {
                case "GPSCoordinates" -> result.put(tag, coordinates);
                case "GPSLatitude" -> result.put(tag, latitude);
                case "GPSLongitude" -> result.put(tag, longitude);
                case "GPSAltitude" -> {
                    if (altitude != null) {
                        result.put(tag, altitude);
                    }
                }
                default -> logger.fine("No GPS value for tag " + tag);
            }
        }
    }

    /**
     * Convert an XMP coordinate such as {@code 32,54.99N} to the form
     * exiftool accepts for QuickTime tags, {@code 32 deg 54' 59.40" N}.
     *
     * @param xmp the XMP coordinate
     * @return the converted coordinate, or null if xmp is not recognized
     */
    static String toQuickTimeCoordinate(String xmp) {
        if (xmp == null) {
            return null;
        }
        Matcher m = XMP_COORDINATE.matcher(xmp.trim());
        if (!m.matches()) {
            return null;
        }
        int degrees = Integer.parseInt(m.group(1));
        double decimalMinutes = Double.parseDouble(m.group(2));
        int minutes = (int) decimalMinutes;
        double seconds = (decimalMinutes - minutes) * 60.0;
        return String.format(Locale.ROOT, "%d deg %d' %.2f\" %s", degrees, minutes, seconds, m.group(3));
    }

    /**
     * @param altitude meters, either decimal or a rational such as {@code 741/5}
     * @return the altitude as a decimal string, or null if absent or unreadable
     */
    static String toMeters(String altitude) {
        if (altitude == null) {
            return null;
        }
        try {
            int slash = altitude.indexOf('/');
            double meters;
            if (slash > 0) {
                double denominator = Double.parseDouble(altitude.substring(slash + 1));
                if (denominator == 0) {
                    return null;
                }
                meters = Double.parseDouble(altitude.substring(0, slash)) / denominator;
            } else {
                meters = Double.parseDouble(altitude);
            }
            return String.format(Locale.ROOT, "%.3f", meters);
        } catch (NumberFormatException nfe) {
            logger.fine("Unreadable GPS altitude: " + altitude);
            return null;
        }
    }

    /**
     * @param tag a tag, with or without group
     * @return the part after the last colon
     */
    public static String tagName(String tag) {
        int colon = tag.lastIndexOf(':');
        return (colon < 0) ? tag : tag.substring(colon + 1);
    }

    @Override
    public String toString() {
        return "TagTable[" + name + "]";
    }
}
