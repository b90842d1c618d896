package org.mediatagger.controller.util;

import java.util.Locale;

public class StringUtils {

    private StringUtils() {
        // utility class
    }

    /**
     * @param value any string, may be null
     * @return the trimmed string, or null if it was null or blank
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Returns the extension of the filename, including the dot, exactly as
     * it appears (no case folding).
     *
     * @param filename a bare filename
     * @return the extension with its leading dot, or "" if there is none
     */
    public static String getExtension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return filename.substring(dot);
    }

    /**
     * @param filename a bare filename
     * @return the filename without its extension
     */
    public static String removeExtension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0) {
            return filename;
        }
        return filename.substring(0, dot);
    }

    /**
     * Case-insensitive containment, using the root locale.
     *
     * @param haystack text to search in; null never contains anything
     * @param needle text to search for
     * @return true if needle occurs in haystack ignoring case
     */
    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
