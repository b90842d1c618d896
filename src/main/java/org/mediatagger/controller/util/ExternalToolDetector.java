package org.mediatagger.controller.util;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Locates external command-line tools.
 *
 * <p>Checks PATH first (via {@code -ver}, which exiftool accepts where it
 * rejects {@code --version}), then platform-specific well-known locations
 * (Windows Program Files, macOS Homebrew and the exiftool package installer).
 */
public final class ExternalToolDetector {

    private static final String OS_NAME =
        System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    private static final boolean IS_WINDOWS = OS_NAME.contains("win");
    private static final boolean IS_MAC = OS_NAME.contains("mac");

    private static final int CHECK_TIMEOUT_SECONDS = 5;

    private ExternalToolDetector() {
        // utility class
    }

    /**
     * Check if an executable is available in PATH by running it with the given check flag.
     *
     * @param executable the executable name to check
     * @param checkFlag  a harmless flag the tool answers with exit code 0 (e.g. "-ver")
     * @return true if it runs successfully within 5 seconds
     */
    public static boolean isExecutableInPath(String executable, String checkFlag) {
        return ProcessRunner.run(List.of(executable, checkFlag), CHECK_TIMEOUT_SECONDS).success();
    }

    /**
     * Detect an external tool by trying PATH names first, then platform-specific paths.
     *
     * @param checkFlag       flag passed when checking PATH names
     * @param pathNames       names to try via PATH (e.g. "exiftool")
     * @param windowsPaths    absolute paths to check on Windows (may be empty)
     * @param macPaths        absolute paths to check on macOS (may be empty)
     * @return the detected path/name, or empty string if not found
     */
    public static String detect(String checkFlag, String[] pathNames,
                                String[] windowsPaths, String[] macPaths) {
        for (String name : pathNames) {
            if (isExecutableInPath(name, checkFlag)) {
                return name;
            }
        }

        if (IS_WINDOWS) {
            for (String path : windowsPaths) {
                if (Files.isExecutable(Paths.get(path))) {
                    return path;
                }
            }
        }

        if (IS_MAC) {
            for (String path : macPaths) {
                if (Files.isExecutable(Paths.get(path))) {
                    return path;
                }
            }
        }

        return "";
    }
}
