package org.mediatagger.model;

import static org.mediatagger.model.util.Constants.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.mediatagger.controller.PipelineSettingsPersistence;

public class PipelineSettings {

    private static final Logger logger = Logger.getLogger(
        PipelineSettings.class.getName()
    );

    private String completionMarker;
    private String exiftoolPath;
    private int codecTimeoutSeconds;
    private String categoryPrefix;
    private String albumMappingFile;
    private String libraryRoot;
    private int minFileAgeSeconds;
    private int lockTimeoutSeconds;
    private int libraryTimeoutSeconds;

    // Incoming directory -> directory processed files are moved to on transfer.
    private final Map<String, String> transferDestinations = new LinkedHashMap<>();

    /**
     * PipelineSettings constructor which uses the defaults from
     * {@link org.mediatagger.model.util.Constants}
     */
    public PipelineSettings() {
        completionMarker = DEFAULT_COMPLETION_MARKER;
        exiftoolPath = "";
        codecTimeoutSeconds = DEFAULT_CODEC_TIMEOUT_SECONDS;
        categoryPrefix = DEFAULT_CATEGORY_PREFIX;
        albumMappingFile = DEFAULT_ALBUM_MAPPING_FILE.toString();
        libraryRoot = DEFAULT_LIBRARY_ROOT.toString();
        minFileAgeSeconds = DEFAULT_MIN_FILE_AGE_SECONDS;
        lockTimeoutSeconds = DEFAULT_LOCK_TIMEOUT_SECONDS;
        libraryTimeoutSeconds = DEFAULT_LIBRARY_TIMEOUT_SECONDS;
    }

    /**
     * Load settings from the given file, creating it with defaults when it
     * does not exist or cannot be read.
     *
     * @param path the settings file
     * @return the settings; never null
     */
    public static PipelineSettings load(Path path) {
        PipelineSettings settings = PipelineSettingsPersistence.retrieve(path);
        if (settings != null) {
            logger.fine("Successfully read settings from: " + path.toAbsolutePath());
            return settings;
        }
        settings = new PipelineSettings();
        PipelineSettingsPersistence.persist(settings, path);
        return settings;
    }

    public String getCompletionMarker() {
        return completionMarker;
    }

    public void setCompletionMarker(String completionMarker) {
        this.completionMarker = completionMarker;
    }

    public String getExiftoolPath() {
        return exiftoolPath;
    }

    public void setExiftoolPath(String exiftoolPath) {
        this.exiftoolPath = exiftoolPath;
    }

    /** @return seconds to wait for exiftool; zero or less waits indefinitely */
    public int getCodecTimeoutSeconds() {
        return codecTimeoutSeconds;
    }

    public void setCodecTimeoutSeconds(int codecTimeoutSeconds) {
        this.codecTimeoutSeconds = codecTimeoutSeconds;
    }

    public String getCategoryPrefix() {
        return categoryPrefix;
    }

    public void setCategoryPrefix(String categoryPrefix) {
        this.categoryPrefix = categoryPrefix;
    }

    public Path getAlbumMappingFile() {
        return Paths.get(albumMappingFile);
    }

    public void setAlbumMappingFile(Path albumMappingFile) {
        this.albumMappingFile = albumMappingFile.toString();
    }

    public Path getLibraryRoot() {
        return Paths.get(libraryRoot);
    }

    public void setLibraryRoot(Path libraryRoot) {
        this.libraryRoot = libraryRoot.toString();
    }

    public int getMinFileAgeSeconds() {
        return minFileAgeSeconds;
    }

    public void setMinFileAgeSeconds(int minFileAgeSeconds) {
        this.minFileAgeSeconds = minFileAgeSeconds;
    }

    public int getLockTimeoutSeconds() {
        return lockTimeoutSeconds;
    }

    public void setLockTimeoutSeconds(int lockTimeoutSeconds) {
        this.lockTimeoutSeconds = lockTimeoutSeconds;
    }

    public int getLibraryTimeoutSeconds() {
        return libraryTimeoutSeconds;
    }

    public void setLibraryTimeoutSeconds(int libraryTimeoutSeconds) {
        this.libraryTimeoutSeconds = libraryTimeoutSeconds;
    }

    /**
     * @param sourceDir an incoming directory
     * @return the configured destination for files from that directory, or null
     */
    public Path getTransferDestination(Path sourceDir) {
        if (sourceDir == null) {
            return null;
        }
        String dest = transferDestinations.get(sourceDir.toAbsolutePath().normalize().toString());
        return (dest == null) ? null : Paths.get(dest);
    }

    public void addTransferDestination(Path sourceDir, Path destDir) {
        transferDestinations.put(
            sourceDir.toAbsolutePath().normalize().toString(),
            destDir.toAbsolutePath().normalize().toString()
        );
    }
}
