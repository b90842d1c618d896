package org.mediatagger.controller;

import static org.mediatagger.model.util.Constants.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.mediatagger.controller.library.FolderAssetLibrary;
import org.mediatagger.controller.metadata.ExifToolCodec;
import org.mediatagger.controller.metadata.SidecarReader;
import org.mediatagger.controller.metadata.TagTable;
import org.mediatagger.controller.util.FileOperations;
import org.mediatagger.model.PipelineOutcome;
import org.mediatagger.model.PipelineState;
import org.mediatagger.model.PipelineSettings;

/**
 * Command-line entry point: processes the media files (or the media files
 * in the directories) named on the command line.  With a leading
 * {@code --transfer}, each successfully processed file is then moved to its
 * destination and imported into the asset library.
 *
 * Logging strategy:
 * - Primary configuration comes from {@code /logging.properties}.
 * - A file log ({@code mediatagger.log}) in the configuration directory is
 *   created only when debug is enabled via {@code -Dmediatagger.debug=true},
 *   or when a fatal error occurs.
 */
class Launcher {

    private static final Logger logger = Logger.getLogger(
        Launcher.class.getName()
    );

    static final String TRANSFER_SWITCH = "--transfer";

    private static volatile FileHandler fileHandler;

    static void initializeLoggingConfig() {
        try (
            InputStream in = Launcher.class.getResourceAsStream(
                LOGGING_PROPERTIES
            )
        ) {
            if (in == null) {
                // Keep default JUL configuration; do not hard-fail startup.
                logger.warning(
                    "logging.properties not found on classpath; using default JDK logging configuration."
                );
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to load logging configuration: " + e);
            logger.log(
                Level.WARNING,
                "Failed to load logging configuration",
                e
            );
        }
    }

    private static boolean isDebugEnabled() {
        return Boolean.parseBoolean(
            System.getProperty(DEBUG_PROPERTY, "false")
        );
    }

    private static synchronized void ensureFileLoggingAttached() {
        if (fileHandler != null) {
            return;
        }

        Path logPath = CONFIGURATION_DIRECTORY.resolve(LOG_FILENAME);

        try {
            Files.createDirectories(CONFIGURATION_DIRECTORY);
            // Overwrite each run (append=false)
            fileHandler = new FileHandler(logPath.toString(), false);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(Level.ALL);

            Logger root = Logger.getLogger("");
            root.addHandler(fileHandler);

            // Do not force root level here; honor logging.properties.
            logger.info("File logging enabled: " + logPath);
        } catch (IOException | SecurityException e) {
            // If we can't create the log file, do not block startup.
            System.err.println(
                "Could not create log file at " +
                    logPath +
                    ": " +
                    e.getMessage()
            );
            logger.log(
                Level.WARNING,
                "Could not create log file at " + logPath,
                e
            );
        }
    }

    private static String buildEnvironmentSummary() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("=== mediatagger Environment ===\n");
        sb
            .append("Java Version: ")
            .append(System.getProperty("java.version"))
            .append('\n');
        sb
            .append("OS: ")
            .append(System.getProperty("os.name"))
            .append(' ')
            .append(System.getProperty("os.arch"))
            .append('\n');
        sb
            .append("Working Directory: ")
            .append(System.getProperty("user.dir"))
            .append('\n');
        sb.append("Settings: ").append(SETTINGS_FILE).append('\n');
        return sb.toString();
    }

    private static String stackTraceToString(Throwable t) {
        StringWriter sw = new StringWriter(4096);
        PrintWriter pw = new PrintWriter(sw);
        t.printStackTrace(pw);
        pw.flush();
        return sw.toString();
    }

    private static void logFatal(String context, Throwable t) {
        // Attach file logging if not already enabled.
        ensureFileLoggingAttached();

        logger.severe("FATAL: " + context);
        logger.severe(buildEnvironmentSummary());
        logger.severe(stackTraceToString(t));
    }

    /**
     * Expand the command-line arguments into media files.  A directory
     * stands for the supported files directly inside it, in name order.
     *
     * @param args file and directory names
     * @return the media files to process
     */
    static List<Path> collectFiles(List<String> args) {
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            Path path = Paths.get(arg);
            if (Files.isDirectory(path)) {
                try (Stream<Path> entries = Files.list(path)) {
                    files.addAll(entries
                        .filter(Files::isRegularFile)
                        .filter(TagTable::isSupported)
                        .sorted()
                        .collect(Collectors.toList()));
                } catch (IOException ioe) {
                    logger.log(Level.WARNING, "Could not list directory " + path, ioe);
                }
            } else if (Files.isRegularFile(path) && TagTable.isSupported(path)) {
                files.add(path);
            } else {
                logger.warning("Not a supported media file, ignored: " + path);
            }
        }
        return files;
    }

    private static int run(List<String> args) {
        boolean transfer = !args.isEmpty() && TRANSFER_SWITCH.equals(args.get(0));
        List<Path> files = collectFiles(transfer ? args.subList(1, args.size()) : args);
        if (files.isEmpty()) {
            logger.warning("Usage: mediatagger [" + TRANSFER_SWITCH + "] <file-or-directory>...");
            return 2;
        }

        PipelineSettings settings = PipelineSettings.load(SETTINGS_FILE);

        ExifToolCodec codec = new ExifToolCodec(
            settings.getExiftoolPath(),
            settings.getCodecTimeoutSeconds()
        );
        if (!codec.isAvailable()) {
            logger.severe("exiftool is not available; install it or set its path in " + SETTINGS_FILE);
            return 1;
        }

        MetadataAggregator aggregator = new MetadataAggregator(new SidecarReader(), codec);
        MediaPipeline pipeline = new MediaPipeline(
            codec,
            aggregator,
            new FilenameGenerator(settings.getCompletionMarker()),
            new MetadataVerifier(),
            FileOperations.DEFAULT,
            new ExportKeywords(Clock.systemDefaultZone()),
            settings.getCompletionMarker()
        );
        FileTransfer fileTransfer = new FileTransfer(
            settings,
            aggregator,
            new AlbumPathResolver(
                new AlbumMappingsPersistence(settings.getAlbumMappingFile()),
                settings.getCategoryPrefix()
            ),
            new FolderAssetLibrary(settings.getLibraryRoot())
        );

        int failures = processAll(files, pipeline, transfer ? fileTransfer : null);
        logger.info("Processed " + files.size() + " files, " + failures + " not completed");
        return (failures == 0) ? 0 : 1;
    }

    /**
     * Process each file, then transfer it when a transfer is given.  A file
     * the pipeline has just renamed skips the minimum age; a deferred
     * transfer is not a failure.
     *
     * @param files media files to process
     * @param pipeline the per-file pipeline
     * @param fileTransfer the transfer step, or null to only process
     * @return the number of files not completed
     */
    static int processAll(List<Path> files, MediaPipeline pipeline, FileTransfer fileTransfer) {
        int failures = 0;
        for (Path file : files) {
            PipelineOutcome outcome = pipeline.process(file);
            if (!outcome.isSuccess()) {
                failures++;
                continue;
            }
            if (fileTransfer == null) {
                continue;
            }
            FileTransfer.Result result = (outcome.state() == PipelineState.RENAMED)
                ? fileTransfer.transferJustProcessed(outcome.path())
                : fileTransfer.transfer(outcome.path());
            if (result == FileTransfer.Result.DEFERRED) {
                logger.info("Transfer of " + outcome.path() + " deferred to a later run");
            } else if (result != FileTransfer.Result.TRANSFERRED) {
                failures++;
            }
        }
        return failures;
    }

    public static void main(String[] args) {
        // Configure logging from logging.properties (best effort).
        initializeLoggingConfig();

        // If debug enabled, create/overwrite mediatagger.log immediately.
        if (isDebugEnabled()) {
            ensureFileLoggingAttached();
            logger.info("Debug enabled via -D" + DEBUG_PROPERTY + "=true");
        }

        int status;
        try {
            logger.info("=== mediatagger Startup ===");
            status = run(Arrays.asList(args));
            logger.info("=== mediatagger Exit ===");
        } catch (RuntimeException e) {
            logFatal("Exception in main()", e);
            status = 1;
        }

        FileHandler handler = fileHandler;
        if (handler != null) {
            handler.close();
        }
        System.exit(status);
    }
}
