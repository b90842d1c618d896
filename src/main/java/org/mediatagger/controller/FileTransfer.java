package org.mediatagger.controller;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.mediatagger.controller.library.AssetLibrary;
import org.mediatagger.controller.util.FileUtilities;
import org.mediatagger.controller.util.StringUtils;
import org.mediatagger.model.MediaMetadata;
import org.mediatagger.model.PipelineSettings;

/**
 * Moves a processed file out of its incoming directory and hands it to the
 * asset library with the albums it belongs in.
 *
 * <p>A file is transferred only once it carries the completion marker, its
 * incoming directory has a destination configured, it is old enough, and no
 * other process holds a lock on it.  A file this process has just written
 * skips the age check.  A file that is too new or locked is deferred to a
 * later pass.  The library call is bounded by a timeout and is not retried.
 */
public class FileTransfer {

    private static final Logger logger = Logger.getLogger(FileTransfer.class.getName());

    private static final String LIBRARY_THREAD_LABEL = "asset-library";
    private static final long LOCK_RETRY_MILLIS = 100;

    /** What became of one file. */
    public enum Result {
        TRANSFERRED,
        /** Too new or locked; try again on a later pass. */
        DEFERRED,
        /** Not processed yet, or no destination configured. */
        NOT_ELIGIBLE,
        FAILED
    }

    // One import at a time, in the order files are transferred.  Replaced
    // when an import times out; the stuck thread may never return.
    private static ExecutorService executor = newExecutor();

    private static ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, LIBRARY_THREAD_LABEL);
            t.setDaemon(true);
            return t;
        });
    }

    private static synchronized ExecutorService executor() {
        return executor;
    }

    private static synchronized void abandon(ExecutorService stuck) {
        if (executor == stuck) {
            stuck.shutdownNow();
            executor = newExecutor();
        }
    }

    private final PipelineSettings settings;
    private final MetadataAggregator aggregator;
    private final AlbumPathResolver resolver;
    private final AssetLibrary library;

    public FileTransfer(PipelineSettings settings,
                        MetadataAggregator aggregator,
                        AlbumPathResolver resolver,
                        AssetLibrary library) {
        this.settings = settings;
        this.aggregator = aggregator;
        this.resolver = resolver;
        this.library = library;
    }

    /**
     * Transfer one file found in an incoming directory.  Never throws.
     *
     * @param file a processed media file in an incoming directory
     * @return what became of the file
     */
    public Result transfer(Path file) {
        return transfer(file, true);
    }

    /**
     * Transfer a file this process has just finished writing.  Its
     * modification time is our own, so the minimum age does not apply.
     * Never throws.
     *
     * @param file a media file the pipeline has just renamed
     * @return what became of the file
     */
    public Result transferJustProcessed(Path file) {
        return transfer(file, false);
    }

    private Result transfer(Path file, boolean checkAge) {
        try {
            Result eligibility = checkEligible(file, checkAge);
            if (eligibility != null) {
                return eligibility;
            }
            Path destDir = settings.getTransferDestination(file.getParent());
            if (!FileUtilities.mkdirs(destDir)) {
                return Result.FAILED;
            }
            Path moved = FileUtilities.renameFile(file, destDir.resolve(file.getFileName()));
            if (moved == null) {
                return Result.FAILED;
            }
            MediaMetadata metadata = aggregator.aggregate(moved);
            List<String> albums = resolver.resolve(metadata);
            logger.info("Importing " + moved.getFileName() + " into " + albums);
            return importWithTimeout(moved, albums) ? Result.TRANSFERRED : Result.FAILED;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error transferring " + file, e);
            return Result.FAILED;
        }
    }

    /**
     * @return null if the file may be moved now, otherwise why not
     */
    private Result checkEligible(Path file, boolean checkAge) {
        if (!Files.isRegularFile(file)) {
            logger.warning("cannot transfer, not a file: " + file);
            return Result.FAILED;
        }
        String stem = StringUtils.removeExtension(file.getFileName().toString());
        if (!stem.contains(settings.getCompletionMarker())) {
            logger.fine("Not processed yet, not transferring: " + file);
            return Result.NOT_ELIGIBLE;
        }
        if (settings.getTransferDestination(file.getParent()) == null) {
            logger.warning("No transfer destination configured for " + file.getParent());
            return Result.NOT_ELIGIBLE;
        }
        if (checkAge && !isOldEnough(file)) {
            logger.fine("Too recently modified, not transferring yet: " + file);
            return Result.DEFERRED;
        }
        if (!waitForLock(file, settings.getLockTimeoutSeconds())) {
            logger.warning("File is locked by another process, not transferring yet: " + file);
            return Result.DEFERRED;
        }
        return null;
    }

    private boolean isOldEnough(Path file) {
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            Duration age = Duration.between(modified, Instant.now());
            return age.getSeconds() >= settings.getMinFileAgeSeconds();
        } catch (IOException ioe) {
            logger.log(Level.WARNING, "Could not read modification time of " + file, ioe);
            return false;
        }
    }

    /**
     * Check whether another process is writing the file by trying to take an
     * exclusive lock on it, retrying until the timeout.  The lock is released
     * immediately; this does not keep anyone else out.
     *
     * @param file the file to check
     * @param timeoutSeconds how long to keep trying
     * @return true if the lock could be taken
     */
    static boolean waitForLock(Path file, int timeoutSeconds) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(Math.max(0, timeoutSeconds));
        while (true) {
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock lock = channel.tryLock()) {
                if (lock != null) {
                    return true;
                }
            } catch (OverlappingFileLockException ofle) {
                logger.fine("Lock held within this process: " + file);
            } catch (IOException ioe) {
                logger.log(Level.FINE, "Could not lock " + file, ioe);
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(LOCK_RETRY_MILLIS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private boolean importWithTimeout(Path file, List<String> albums) {
        int timeout = settings.getLibraryTimeoutSeconds();
        ExecutorService importer = executor();
        Future<Boolean> future = importer.submit(() -> library.importAsset(file, albums));
        try {
            boolean imported = future.get(timeout, TimeUnit.SECONDS);
            if (!imported) {
                logger.warning("Asset library did not import " + file);
            }
            return imported;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            logger.warning("Interrupted importing " + file);
            return false;
        } catch (TimeoutException te) {
            future.cancel(true);
            abandon(importer);
            logger.warning("Import of " + file + " timed out after " + timeout + " seconds; not retried."
                + " Later imports use a new library thread.");
            return false;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
            logger.log(Level.WARNING, "Exception importing " + file, cause);
            return false;
        }
    }
}
