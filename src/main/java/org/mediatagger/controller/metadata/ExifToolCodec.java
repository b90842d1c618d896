package org.mediatagger.controller.metadata;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.mediatagger.controller.util.ExternalToolDetector;
import org.mediatagger.controller.util.ProcessRunner;

/**
 * Reads and writes embedded tags with exiftool.
 *
 * <p>Reads run {@code exiftool -j -G -m <file>} and flatten the JSON answer
 * into {@code Group:TagName} keys.  Writes run
 * {@code exiftool -overwrite_original -m -sep ", " -TAG=value ... <file>},
 * so a comma-joined keyword list lands as separate items in list tags.
 */
public class ExifToolCodec implements MetadataCodec {

    private static final Logger logger = Logger.getLogger(ExifToolCodec.class.getName());

    static final String LIST_SEPARATOR = ", ";

    private static final String SOURCE_FILE_KEY = "SourceFile";

    // Cached detection result
    private static volatile String detectedPath = null;
    private static final Object DETECTION_LOCK = new Object();

    private final String configuredPath;
    private final int timeoutSeconds;

    /**
     * @param configuredPath path to the exiftool executable; blank to detect it
     * @param timeoutSeconds how long to wait for each call; zero or less waits indefinitely
     */
    public ExifToolCodec(String configuredPath, int timeoutSeconds) {
        this.configuredPath = (configuredPath == null) ? "" : configuredPath.trim();
        this.timeoutSeconds = timeoutSeconds;
    }

    private String executable() {
        if (!configuredPath.isEmpty()) {
            return configuredPath;
        }
        return detect();
    }

    private static String detect() {
        if (detectedPath != null) {
            return detectedPath;
        }
        synchronized (DETECTION_LOCK) {
            if (detectedPath == null) {
                String found = ExternalToolDetector.detect(
                    "-ver",
                    new String[] { "exiftool" },
                    new String[] {
                        "C:\\Program Files\\ExifTool\\exiftool.exe",
                        "C:\\Program Files (x86)\\ExifTool\\exiftool.exe"
                    },
                    new String[] {
                        "/usr/local/bin/exiftool",
                        "/opt/homebrew/bin/exiftool"
                    }
                );
                if (found.isEmpty()) {
                    logger.warning("exiftool not found - metadata cannot be read or written");
                } else {
                    logger.info("Found exiftool: " + found);
                }
                detectedPath = found;
            }
            return detectedPath;
        }
    }

    @Override
    public boolean isAvailable() {
        if (!configuredPath.isEmpty()) {
            return ExternalToolDetector.isExecutableInPath(configuredPath, "-ver");
        }
        return !detect().isEmpty();
    }

    @Override
    public String getToolName() {
        String exe = executable();
        return exe.isEmpty() ? "none" : exe;
    }

    @Override
    public Map<String, String> readTags(Path file) {
        String exe = executable();
        if (exe.isEmpty()) {
            return Collections.emptyMap();
        }
        ProcessRunner.Result result = ProcessRunner.runForOutput(buildReadCommand(exe, file), timeoutSeconds);
        if (!result.success()) {
            // With -m, exiftool still prints what it could read on minor errors.
            logger.warning("exiftool read failed (exit " + result.exitCode() + ") for: " + file);
            if (result.output().isBlank()) {
                return Collections.emptyMap();
            }
        }
        return parseReadOutput(result.output());
    }

    @Override
    public boolean writeTags(Path file, Map<String, String> tags) {
        if (tags.isEmpty()) {
            logger.fine("Nothing to write for " + file);
            return true;
        }
        String exe = executable();
        if (exe.isEmpty()) {
            logger.warning("Cannot write tags, exiftool unavailable: " + file);
            return false;
        }
        ProcessRunner.Result result = ProcessRunner.run(buildWriteCommand(exe, file, tags), timeoutSeconds);
        if (!result.success()) {
            logger.warning("exiftool failed (exit " + result.exitCode() + ") for: "
                + file + "\nOutput: " + result.output());
            return false;
        }
        logger.fine("Wrote " + tags.size() + " tags to " + file);
        return true;
    }

    static List<String> buildReadCommand(String exe, Path file) {
        return List.of(exe, "-j", "-G", "-m", file.toString());
    }

    static List<String> buildWriteCommand(String exe, Path file, Map<String, String> tags) {
        List<String> cmd = new ArrayList<>();
        cmd.add(exe);
        cmd.add("-overwrite_original");
        cmd.add("-m");
        cmd.add("-sep");
        cmd.add(LIST_SEPARATOR);
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            cmd.add("-" + tag.getKey() + "=" + tag.getValue());
        }
        cmd.add(file.toString());
        return cmd;
    }

    /**
     * Flatten exiftool's JSON output for a single file.
     *
     * @param json the output of {@code exiftool -j -G}
     * @return tag to string value; empty if the output is not what exiftool writes
     */
    static Map<String, String> parseReadOutput(String json) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return tags;
        }
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonArray() || root.getAsJsonArray().isEmpty()) {
                logger.warning("Unexpected exiftool output: " + json);
                return tags;
            }
            JsonElement first = root.getAsJsonArray().get(0);
            if (!first.isJsonObject()) {
                logger.warning("Unexpected exiftool output: " + json);
                return tags;
            }
            JsonObject object = first.getAsJsonObject();
            for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
                if (SOURCE_FILE_KEY.equals(entry.getKey())) {
                    continue;
                }
                String value = toText(entry.getValue());
                if (value != null) {
                    tags.put(entry.getKey(), value);
                }
            }
        } catch (JsonParseException | IllegalStateException e) {
            logger.warning("Could not parse exiftool output: " + e.getMessage());
            tags.clear();
        }
        return tags;
    }

    private static String toText(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            List<String> items = new ArrayList<>();
            for (JsonElement item : array) {
                String text = toText(item);
                if (text != null) {
                    items.add(text);
                }
            }
            return String.join(LIST_SEPARATOR, items);
        }
        // Structures (e.g. XMP regions) have no single string value.
        return null;
    }
}
