package org.mediatagger.controller.library;

import java.nio.file.Path;
import java.util.List;

/**
 * The asset-management service processed files are handed to.
 *
 * <p>Implementations import the file and place it in each album, creating
 * albums as needed.  A call may be repeated for the same file when an
 * earlier outcome is unknown, so it should not duplicate the asset.
 */
public interface AssetLibrary {

    /**
     * @param file the processed media file
     * @param albumPaths {@code /}-separated album paths; may be empty
     * @return true if the asset is in the library and in every album
     */
    boolean importAsset(Path file, List<String> albumPaths);
}
