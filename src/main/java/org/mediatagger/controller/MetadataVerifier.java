package org.mediatagger.controller;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import org.mediatagger.controller.metadata.DateNormalizer;
import org.mediatagger.controller.metadata.FieldKind;
import org.mediatagger.controller.metadata.TagTable;
import org.mediatagger.model.MediaLocation;
import org.mediatagger.model.MediaMetadata;

/**
 * Confirms that tags read back from a file match the metadata written to it.
 *
 * <p>Tags are matched by name, whatever group exiftool reports them under.
 * Keyword mismatches are logged and tolerated, since the tags keywords are
 * stored in differ in how they keep lists.  GPS is not verified.
 */
public class MetadataVerifier {

    private static final Logger logger = Logger.getLogger(MetadataVerifier.class.getName());

    private static final String COMPONENT_SEPARATOR = ", ";

    /**
     * @param expected the metadata that was written
     * @param actual the tags read back after writing
     * @param table the table the tags were written with
     * @return true if every required field matches
     */
    public boolean verify(MediaMetadata expected, Map<String, String> actual, TagTable table) {
        boolean ok = true;

        String title = expected.getTitle();
        if (title != null && !anyEquals(title, candidates(actual, table, FieldKind.TITLE))) {
            logger.warning("Title mismatch: expected '" + title + "'");
            ok = false;
        }

        String caption = expected.getCaption();
        if (caption != null && !anyEquals(caption, candidates(actual, table, FieldKind.CAPTION))) {
            logger.warning("Caption mismatch: expected '" + caption + "'");
            ok = false;
        }

        if (!expected.getKeywords().isEmpty()) {
            verifyKeywords(expected.getKeywords(), candidates(actual, table, FieldKind.KEYWORDS));
        }

        String date = expected.getDate();
        if (date != null && !anyDateMatches(date, candidates(actual, table, FieldKind.DATE))) {
            logger.warning("Date mismatch: expected '" + date + "'");
            ok = false;
        }

        MediaLocation location = expected.getLocation();
        List<String> locationCandidates = candidates(actual, table, FieldKind.LOCATION);
        if (location.location() != null
            && !anyEqualsOrComponent(location.location(), locationCandidates)) {
            logger.warning("Location mismatch: expected '" + location.location() + "'");
            ok = false;
        }
        if (location.state() != null) {
            List<String> stateCandidates = new ArrayList<>(candidates(actual, table, FieldKind.STATE));
            stateCandidates.addAll(locationCandidates);
            if (!anyEqualsOrComponent(location.state(), stateCandidates)) {
                logger.warning("State mismatch: expected '" + location.state() + "'");
                ok = false;
            }
        }
        if (location.city() != null
            && !anyEquals(location.city(), candidates(actual, table, FieldKind.CITY))) {
            logger.warning("City mismatch: expected '" + location.city() + "'");
            ok = false;
        }
        if (location.country() != null
            && !anyEquals(location.country(), candidates(actual, table, FieldKind.COUNTRY))) {
            logger.warning("Country mismatch: expected '" + location.country() + "'");
            ok = false;
        }

        return ok;
    }

    private static void verifyKeywords(List<String> expected, List<String> candidates) {
        Set<String> wanted = new HashSet<>(expected);
        for (String candidate : candidates) {
            if (wanted.equals(new HashSet<>(MetadataAggregator.splitList(candidate)))) {
                return;
            }
        }
        // TODO: decide whether keyword mismatches should fail verification once
        // real-world files show which tags lose list items.
        logger.warning("Keyword mismatch tolerated: expected " + expected + ", found " + candidates);
    }

    /**
     * Values of every tag whose name (ignoring group) is one the field kind
     * is written to.
     */
    static List<String> candidates(Map<String, String> actual, TagTable table, FieldKind kind) {
        List<String> names = table.verifyNames(kind);
        List<String> values = new ArrayList<>();
        for (Map.Entry<String, String> entry : actual.entrySet()) {
            if (entry.getValue() != null && names.contains(TagTable.tagName(entry.getKey()))) {
                values.add(entry.getValue());
            }
        }
        return values;
    }

    private static boolean anyEquals(String expected, List<String> candidates) {
        for (String candidate : candidates) {
            if (expected.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyEqualsOrComponent(String expected, List<String> candidates) {
        for (String candidate : candidates) {
            if (expected.equals(candidate)) {
                return true;
            }
            for (String component : candidate.split(COMPONENT_SEPARATOR)) {
                if (expected.equals(component.trim())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean anyDateMatches(String expected, List<String> candidates) {
        for (String candidate : candidates) {
            if (DateNormalizer.matches(expected, candidate)) {
                return true;
            }
        }
        return false;
    }
}
