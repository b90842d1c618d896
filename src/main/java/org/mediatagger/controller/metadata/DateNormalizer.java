package org.mediatagger.controller.metadata;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the date formats found in sidecars and embedded tags into the
 * clock form {@code YYYY:MM:DD HH:MM:SS}, and compares dates across formats.
 *
 * <p>Accepted inputs use {@code :}, {@code -} or {@code _} between date
 * parts, a space or {@code T} before the time, optional seconds, optional
 * sub-seconds and an optional timezone ({@code Z}, {@code +HH:MM},
 * {@code -HHMM}).  Sub-seconds and timezone are dropped, not applied.
 */
public final class DateNormalizer {

    private static final Pattern DATE_PATTERN = Pattern.compile(
        "^(\\d{4})[:\\-_](\\d{2})[:\\-_](\\d{2})"
            + "(?:[ T](\\d{2}):(\\d{2})(?::(\\d{2}))?(?:\\.\\d+)?)?"
            + "\\s*(?:Z|[+-]\\d{2}:?\\d{2})?$"
    );

    private static final String ZERO_YEAR = "0000";

    private DateNormalizer() {
        // utility class
    }

    /**
     * @param raw a date in any accepted format, may be null
     * @return the date in clock form, or null if raw is not a usable date
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher m = DATE_PATTERN.matcher(raw.trim());
        if (!m.matches()) {
            return null;
        }
        // QuickTime writes all zeros when a video has no creation date
        if (ZERO_YEAR.equals(m.group(1))) {
            return null;
        }
        String hours = (m.group(4) == null) ? "00" : m.group(4);
        String minutes = (m.group(5) == null) ? "00" : m.group(5);
        String seconds = (m.group(6) == null) ? "00" : m.group(6);
        return m.group(1) + ":" + m.group(2) + ":" + m.group(3)
            + " " + hours + ":" + minutes + ":" + seconds;
    }

    /**
     * @param raw a date in any accepted format
     * @return the date as {@code YYYY_MM_DD}, or null if raw is not a usable date
     */
    public static String toFilenameForm(String raw) {
        String clock = normalize(raw);
        if (clock == null) {
            return null;
        }
        return clock.substring(0, 10).replace(':', '_');
    }

    /**
     * Whether two dates name the same second, ignoring format differences,
     * sub-seconds and timezone suffixes.
     *
     * @param expected one date
     * @param actual another date
     * @return true if both normalize, and to the same value
     */
    public static boolean matches(String expected, String actual) {
        String a = normalize(expected);
        return a != null && a.equals(normalize(actual));
    }
}
