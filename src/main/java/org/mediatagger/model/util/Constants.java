package org.mediatagger.model.util;

import java.nio.file.Path;
import java.nio.file.Paths;

public class Constants {

    public static final String APPLICATION_NAME = "mediatagger";

    public static final String LOGGING_PROPERTIES = "/logging.properties";
    public static final String DEBUG_PROPERTY = "mediatagger.debug";
    public static final String LOG_FILENAME = "mediatagger.log";

    public static final String USER_HOME = System.getProperty("user.home");

    public static final Path CONFIGURATION_DIRECTORY =
        Paths.get(USER_HOME, "." + APPLICATION_NAME);
    public static final Path SETTINGS_FILE =
        CONFIGURATION_DIRECTORY.resolve("settings.xml");
    public static final Path DEFAULT_ALBUM_MAPPING_FILE =
        CONFIGURATION_DIRECTORY.resolve("albums.xml");
    public static final Path DEFAULT_LIBRARY_ROOT =
        Paths.get(USER_HOME, "Pictures", "Albums");

    public static final String SIDECAR_EXTENSION = ".xmp";
    public static final String DEFAULT_COMPLETION_MARKER = "__LRE";
    public static final String DEFAULT_CATEGORY_PREFIX = "Categories";
    public static final char ALBUM_PATH_SEPARATOR = '/';

    public static final int DEFAULT_CODEC_TIMEOUT_SECONDS = 0;
    public static final int DEFAULT_MIN_FILE_AGE_SECONDS = 60;
    public static final int DEFAULT_LOCK_TIMEOUT_SECONDS = 5;
    public static final int DEFAULT_LIBRARY_TIMEOUT_SECONDS = 30;

    public static final int MAX_COMPONENT_LENGTH = 50;
    public static final int MAX_COLLISION_SEQUENCE = 99;

    private Constants() {
        // constants only
    }
}
