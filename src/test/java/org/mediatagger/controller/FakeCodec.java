package org.mediatagger.controller;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mediatagger.controller.metadata.MetadataCodec;

/**
 * In-memory stand-in for exiftool.  Written tags are stored per file and
 * read back, unless a test replaces what reading returns.
 */
class FakeCodec implements MetadataCodec {

    final Map<Path, Map<String, String>> stored = new HashMap<>();
    final List<Path> writes = new ArrayList<>();
    final List<Path> reads = new ArrayList<>();

    boolean failWrites = false;
    // Replaces the value of a tag on read-back, to simulate a lossy write.
    final Map<String, String> readOverrides = new HashMap<>();

    FakeCodec embed(Path file, String tag, String value) {
        stored.computeIfAbsent(file, f -> new LinkedHashMap<>()).put(tag, value);
        return this;
    }

    @Override
    public Map<String, String> readTags(Path file) {
        reads.add(file);
        Map<String, String> tags = new LinkedHashMap<>(stored.getOrDefault(file, Map.of()));
        for (Map.Entry<String, String> override : readOverrides.entrySet()) {
            if (tags.containsKey(override.getKey())) {
                tags.put(override.getKey(), override.getValue());
            }
        }
        return tags;
    }

    @Override
    public boolean writeTags(Path file, Map<String, String> tags) {
        writes.add(file);
        if (failWrites) {
            return false;
        }
        stored.computeIfAbsent(file, f -> new LinkedHashMap<>()).putAll(tags);
        return true;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getToolName() {
        return "fake";
    }
}
