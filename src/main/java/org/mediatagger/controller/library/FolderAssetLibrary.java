package org.mediatagger.controller.library;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import org.mediatagger.controller.util.FileUtilities;

/**
 * An asset library kept as plain folders: every album path becomes a
 * folder hierarchy under the library root, and the asset is copied into
 * each album folder.  Assets with no album go into the root itself.
 */
public class FolderAssetLibrary implements AssetLibrary {

    private static final Logger logger = Logger.getLogger(FolderAssetLibrary.class.getName());

    private final Path root;

    public FolderAssetLibrary(Path root) {
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public boolean importAsset(Path file, List<String> albumPaths) {
        if (albumPaths.isEmpty()) {
            return copyInto(file, root);
        }
        boolean ok = true;
        for (String albumPath : albumPaths) {
            Path album = albumFolder(albumPath);
            if (album == null) {
                logger.warning("Album path escapes the library, skipped: " + albumPath);
                ok = false;
                continue;
            }
            ok &= copyInto(file, album);
        }
        return ok;
    }

    /**
     * @param albumPath a {@code /}-separated album path
     * @return the folder for it, or null if it would lie outside the root
     */
    Path albumFolder(String albumPath) {
        Path folder = root;
        for (String segment : albumPath.split("/")) {
            String name = segment.trim();
            if (name.isEmpty() || name.equals(".")) {
                continue;
            }
            folder = folder.resolve(name);
        }
        Path normalized = folder.normalize();
        return normalized.startsWith(root.normalize()) ? normalized : null;
    }

    private static boolean copyInto(Path file, Path folder) {
        if (!FileUtilities.mkdirs(folder)) {
            logger.warning("Could not create album folder " + folder);
            return false;
        }
        boolean copied = FileUtilities.copyFile(file, folder.resolve(file.getFileName()));
        if (copied) {
            logger.fine("Placed " + file.getFileName() + " in " + folder);
        }
        return copied;
    }
}
