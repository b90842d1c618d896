package org.mediatagger.controller.util;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * File-system helpers that report problems through logging rather than
 * exceptions, so the pipeline can decide per call whether a failure is fatal.
 */
public class FileUtilities {

    private static final Logger logger = Logger.getLogger(
        FileUtilities.class.getName()
    );

    private FileUtilities() {
        // utility class
    }

    /**
     * Returns a safe string representation of a Path, handling null gracefully.
     *
     * @param p the path to convert (may be null)
     * @return the path as a string, or "&lt;null&gt;" if the path is null
     */
    public static String safePath(Path p) {
        return (p == null) ? "<null>" : p.toString();
    }

    /**
     * Delete the given regular file.
     *
     * @param file
     *    the file to be deleted
     * @return
     *    true if the file existed and was deleted; false if not
     */
    public static boolean deleteFile(Path file) {
        if (file == null) {
            logger.warning("cannot delete file: path is null");
            return false;
        }
        if (Files.notExists(file)) {
            logger.warning("cannot delete file, does not exist: " + file);
            return false;
        }
        try {
            Files.delete(file);
            return true;
        } catch (AccessDeniedException ade) {
            logger.warning(
                "Could not delete file \"" + file + "\"; access denied"
            );
            return false;
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "Error deleting file " + file, ioe);
            return false;
        }
    }

    /**
     * Try to figure out the state of the world after a call to Files.move
     * did not succeed, nor did it completely fail.
     *
     * <p>Files.move() is defined to return the destination, and nothing in
     * its Javadoc suggests it could land somewhere else; still, a renamed
     * media file must never be lost track of, so every combination is logged.
     *
     * @param srcFile
     *    the file we wanted to rename
     * @param destFile
     *    the destination we wanted file to be renamed to
     * @param actualDest
     *    the value that Files.move() returned to us
     * @return
     *    presumably null, but could return a Path if, somehow, the source file
     *    appears to have been moved despite the apparent failure
     */
    private static Path unexpectedMoveResult(
        final Path srcFile,
        final Path destFile,
        final Path actualDest
    ) {
        if (Files.exists(srcFile)) {
            // The original file was not touched; there may be a partial copy.
            if (Files.exists(destFile)) {
                logger.warning(
                    "may have done an incomplete copy of " +
                        srcFile +
                        " to " +
                        destFile
                );
            }
            return null;
        }
        if (Files.exists(destFile)) {
            logger.warning(
                srcFile +
                    " is gone and " +
                    destFile +
                    " exists, so rename seemed successful"
            );
            logger.warning("Nevertheless, something went wrong.");
            return null;
        }
        if (actualDest == null) {
            logger.warning("No idea what happened to " + srcFile);
            return null;
        }
        if (Files.exists(actualDest)) {
            logger.warning(
                "somehow moved file to different destination: " + actualDest
            );
        }
        return actualDest;
    }

    /**
     * Rename the given file to the given destination.  If the file is renamed,
     * returns the new Path.  If the file could not be renamed, returns null.
     *
     * <p>The destination must be a non-existent path, explicitly including
     * the destination file name.  Existing files are never overwritten.
     *
     * @param srcFile
     *    the file to be renamed
     * @param destFile
     *    the destination for the file to be renamed to; should not exist
     *    (either as a file or a directory)
     * @return
     *    the new destination if the file was renamed; null if it was not
     */
    public static Path renameFile(final Path srcFile, final Path destFile) {
        if (srcFile == null || destFile == null) {
            logger.warning(
                "cannot rename file: src/dest is null\n  src=" +
                    safePath(srcFile) +
                    "\n  dest=" +
                    safePath(destFile)
            );
            return null;
        }
        if (Files.notExists(srcFile)) {
            logger.warning("cannot rename file, does not exist: " + srcFile);
            return null;
        }
        if (Files.exists(destFile)) {
            logger.warning("will not overwrite existing file: " + destFile);
            return null;
        }
        Path actualDest = null;
        try {
            actualDest = Files.move(srcFile, destFile);
            if (actualDest != null && Files.exists(actualDest)) {
                return actualDest;
            }
        } catch (AccessDeniedException ade) {
            logger.warning(
                "Could not rename file \"" + srcFile + "\"; access denied"
            );
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "Error renaming file " + srcFile, ioe);
        }
        if (Files.exists(srcFile) && Files.notExists(destFile)) {
            // Looks like we did nothing.
            return null;
        }
        return unexpectedMoveResult(srcFile, destFile, actualDest);
    }

    /**
     * Creates a directory by creating all nonexistent parent directories first.
     * No exception is thrown if the directory could not be created because it
     * already exists.
     *
     * @param dir - the directory to create
     * @return
     *    true if the the directory exists at the conclusion of this method;
     *    false if we could not create the directory
     */
    public static boolean mkdirs(final Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException ioe) {
            logger.log(
                Level.WARNING,
                "exception trying to create directory " + dir,
                ioe
            );
            return false;
        }
        return Files.exists(dir);
    }

    /**
     * Copies the source file into the destination, keeping its file
     * attributes where the platform allows.  An existing destination is left
     * alone and counted as success when it has the same size as the source.
     *
     * @param source the file to copy
     * @param dest the full destination path
     * @return true if dest holds a copy of source at the end of this call
     */
    public static boolean copyFile(final Path source, final Path dest) {
        try {
            if (Files.exists(dest)) {
                boolean same = Files.size(dest) == Files.size(source);
                if (!same) {
                    logger.warning("will not overwrite different file: " + dest);
                }
                return same;
            }
            Files.copy(source, dest, StandardCopyOption.COPY_ATTRIBUTES);
            return true;
        } catch (IOException ioe) {
            logger.log(
                Level.WARNING,
                "Error copying " + source + " to " + dest,
                ioe
            );
            return false;
        }
    }
}
