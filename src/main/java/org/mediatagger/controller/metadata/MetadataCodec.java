package org.mediatagger.controller.metadata;

import java.nio.file.Path;
import java.util.Map;

/**
 * Reads and writes the tags embedded in a media file.
 */
public interface MetadataCodec {

    /**
     * Read every tag from the file.
     *
     * @param file the media file
     * @return a mapping of {@code Group:TagName} to value, with list values
     *         joined by {@code ", "}; empty if the file could not be read
     */
    Map<String, String> readTags(Path file);

    /**
     * Write the given tags into the file, in place.
     *
     * @param file the media file
     * @param tags a mapping of {@code Group:TagName} to value
     * @return true if the tool reported success
     */
    boolean writeTags(Path file, Map<String, String> tags);

    /**
     * @return true if the external tool is installed and accessible
     */
    boolean isAvailable();

    /**
     * @return the tool name or path, or "none" if unavailable
     */
    String getToolName();
}
