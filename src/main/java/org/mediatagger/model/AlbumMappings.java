package org.mediatagger.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The album mapping document: keys to base album paths.  A path ending in
 * {@code /} asks for the asset's title to be appended as the album name; any
 * other path is a complete album path.
 */
public class AlbumMappings {

    private List<AlbumMapping> mappings = new ArrayList<>();

    public AlbumMappings() {
    }

    public AlbumMappings(List<AlbumMapping> mappings) {
        this.mappings = new ArrayList<>(mappings);
    }

    public boolean containsKey(String key) {
        return !lookup(key).isEmpty();
    }

    /**
     * Exact, case-sensitive lookup.  A key listed more than once contributes
     * the paths of every entry, in document order.
     *
     * @param key the key to look up; null matches nothing
     * @return the mapped paths, empty if the key is unknown
     */
    public List<String> lookup(String key) {
        List<String> found = new ArrayList<>();
        if (key == null || mappings == null) {
            return found;
        }
        for (AlbumMapping mapping : mappings) {
            if (key.equals(mapping.getKey())) {
                found.addAll(mapping.getPaths());
            }
        }
        return found;
    }

    public int size() {
        return (mappings == null) ? 0 : mappings.size();
    }
}
