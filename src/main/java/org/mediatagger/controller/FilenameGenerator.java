package org.mediatagger.controller;

import static org.mediatagger.model.util.Constants.MAX_COMPONENT_LENGTH;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.mediatagger.controller.metadata.DateNormalizer;
import org.mediatagger.controller.util.StringUtils;
import org.mediatagger.model.MediaLocation;
import org.mediatagger.model.MediaMetadata;

/**
 * Builds the name a processed file is renamed to:
 *
 * <pre>
 * &lt;date&gt;[_&lt;title&gt;][_&lt;location&gt;][_&lt;city&gt;][_&lt;country&gt;][_&lt;sequence&gt;]&lt;marker&gt;&lt;ext&gt;
 * </pre>
 *
 * The date is in filename form ({@code YYYY_MM_DD}); the extension is
 * lower-cased.  Generation is a pure function of its arguments.
 */
public class FilenameGenerator {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}\\-_()\\[\\]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");

    private static final String SEPARATOR = "_";

    private final String completionMarker;

    /**
     * @param completionMarker the token appended before the extension to mark
     *        a file as processed, including its underscores (e.g. "__LRE")
     */
    public FilenameGenerator(String completionMarker) {
        this.completionMarker = completionMarker;
    }

    /**
     * Generate the target filename.
     *
     * @param metadata the aggregated metadata
     * @param originalFilename the file's current name, for its stem and extension
     * @param sequence an optional disambiguating number; null for none
     * @return the filename, or null if the metadata has no date
     */
    public String generate(MediaMetadata metadata, String originalFilename, Integer sequence) {
        String date = DateNormalizer.toFilenameForm(metadata.getDate());
        if (date == null) {
            return null;
        }

        List<String> optional = new ArrayList<>();
        String title = clean(metadata.getTitle());
        if (!title.isEmpty()) {
            optional.add(title);
        }
        MediaLocation location = metadata.getLocation();
        addUnlessRepeated(optional, clean(location.location()));
        addUnlessRepeated(optional, clean(location.city()));
        addUnlessRepeated(optional, clean(location.country()));

        if (optional.isEmpty()) {
            return fallback(originalFilename, sequence);
        }

        StringBuilder name = new StringBuilder(date);
        for (String component : optional) {
            name.append(SEPARATOR).append(component);
        }
        if (sequence != null) {
            name.append(SEPARATOR).append(sequence);
        }
        name.append(completionMarker).append(extensionOf(originalFilename));
        return name.toString();
    }

    /**
     * The name used when there is nothing better: the original stem, marked
     * as processed.
     *
     * @param originalFilename the file's current name
     * @param sequence an optional disambiguating number; null for none
     * @return {@code <stem>[_<sequence>]<marker><ext>}
     */
    public String fallback(String originalFilename, Integer sequence) {
        StringBuilder name = new StringBuilder(StringUtils.removeExtension(originalFilename));
        if (sequence != null) {
            name.append(SEPARATOR).append(sequence);
        }
        name.append(completionMarker).append(extensionOf(originalFilename));
        return name.toString();
    }

    private static void addUnlessRepeated(List<String> components, String candidate) {
        if (candidate.isEmpty()) {
            return;
        }
        // Compared one component at a time, so text spanning two of them
        // does not count as a repeat.
        for (String included : components) {
            if (StringUtils.containsIgnoreCase(included, candidate)) {
                return;
            }
        }
        components.add(candidate);
    }

    private static String extensionOf(String filename) {
        return StringUtils.getExtension(filename).toLowerCase(Locale.ROOT);
    }

    /**
     * Make free text safe for a filename.
     *
     * @param text the text, may be null
     * @return the cleaned text; empty if nothing usable remains
     */
    static String clean(String text) {
        String value = StringUtils.trimToNull(text);
        if (value == null) {
            return "";
        }
        // JSON that leaked into a text field
        if (value.startsWith("{") || value.startsWith("[")) {
            return "";
        }
        value = WHITESPACE.matcher(value).replaceAll(SEPARATOR);
        value = DISALLOWED.matcher(value).replaceAll(SEPARATOR);
        value = trimSeparators(UNDERSCORES.matcher(value).replaceAll(SEPARATOR));
        if (value.length() > MAX_COMPONENT_LENGTH) {
            value = trimSeparators(value.substring(0, MAX_COMPONENT_LENGTH));
        }
        return value;
    }

    private static String trimSeparators(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
