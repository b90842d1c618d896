package org.mediatagger.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the album mapping document: a key (city, state, location
 * name or folder keyword) and the base album paths it routes to.
 */
public class AlbumMapping {

    private String key;
    private List<String> paths = new ArrayList<>();

    public AlbumMapping() {
    }

    public AlbumMapping(String key, List<String> paths) {
        this.key = key;
        this.paths = new ArrayList<>(paths);
    }

    public String getKey() {
        return key;
    }

    public List<String> getPaths() {
        return (paths == null) ? List.of() : paths;
    }
}
