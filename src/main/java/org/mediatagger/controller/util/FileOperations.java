package org.mediatagger.controller.util;

import java.nio.file.Path;

/**
 * The two destructive file operations the pipeline performs once metadata is
 * verified.  Injected so callers can observe or fail them.
 */
public interface FileOperations {

    /** Delegates to {@link FileUtilities}. */
    FileOperations DEFAULT = new FileOperations() {
        @Override
        public boolean deleteFile(Path file) {
            return FileUtilities.deleteFile(file);
        }

        @Override
        public Path renameFile(Path srcFile, Path destFile) {
            return FileUtilities.renameFile(srcFile, destFile);
        }
    };

    /**
     * @param file the file to delete
     * @return true if the file existed and was deleted
     */
    boolean deleteFile(Path file);

    /**
     * @param srcFile the file to rename
     * @param destFile the full destination path; must not exist
     * @return the new path, or null if the file was not renamed
     */
    Path renameFile(Path srcFile, Path destFile);
}
