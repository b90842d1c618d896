package org.mediatagger.controller;

import static org.mediatagger.model.util.Constants.ALBUM_PATH_SEPARATOR;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.mediatagger.controller.util.StringUtils;
import org.mediatagger.model.AlbumMappings;
import org.mediatagger.model.MediaLocation;
import org.mediatagger.model.MediaMetadata;

/**
 * Works out which albums an asset belongs in.
 *
 * <p>Every rule that matches contributes; the results are unioned in rule
 * order and duplicates dropped:
 * <ol>
 *   <li>a keyword {@code "Category: detail"} gives
 *       {@code <prefix>/Category/Category: detail};</li>
 *   <li>a keyword {@code "Folder/Album"} whose folder is mapped gives the
 *       mapped path joined with the album, or with the title if the album
 *       part is empty;</li>
 *   <li>a bare keyword that is a mapping key is treated like a mapped city;</li>
 *   <li>the city, then the state, then the location are looked up;</li>
 *   <li>a title of the form {@code "Category: detail"} is treated like rule 1;</li>
 *   <li>so is a caption of that form.</li>
 * </ol>
 * A mapped path ending in {@code /} gets the title appended as the album
 * name; any other mapped path is used as it is.
 *
 * <p>The mapping table is loaded fresh for every call.
 */
public class AlbumPathResolver {

    private static final Logger logger = Logger.getLogger(AlbumPathResolver.class.getName());

    private static final String SEPARATOR = String.valueOf(ALBUM_PATH_SEPARATOR);

    private final AlbumMappingSource source;
    private final String categoryPrefix;

    /**
     * @param source where the mapping table comes from
     * @param categoryPrefix the top folder for colon-category albums
     */
    public AlbumPathResolver(AlbumMappingSource source, String categoryPrefix) {
        this.source = source;
        this.categoryPrefix = categoryPrefix;
    }

    /**
     * @param metadata aggregated metadata of the asset
     * @return the album paths, possibly empty; never null
     */
    public List<String> resolve(MediaMetadata metadata) {
        MediaLocation location = metadata.getLocation();
        return resolve(metadata.getKeywords(), metadata.getTitle(), metadata.getCaption(),
            location.city(), location.state(), location.location());
    }

    /**
     * Compute the album paths for an asset without a caption.
     *
     * @see #resolve(List, String, String, String, String, String)
     */
    public List<String> resolve(List<String> keywords, String title,
                                String city, String state, String location) {
        return resolve(keywords, title, null, city, state, location);
    }

    /**
     * Compute the album paths for an asset.  Never throws; an unreadable
     * mapping table is logged and produces no paths.
     *
     * @param keywords the asset's keywords
     * @param title the asset's title, may be null
     * @param caption the asset's caption, may be null
     * @param city may be null
     * @param state may be null
     * @param location may be null
     * @return the album paths in first-seen order, without duplicates
     */
    public List<String> resolve(List<String> keywords, String title, String caption,
                                String city, String state, String location) {
        AlbumMappings mappings;
        try {
            mappings = source.load();
        } catch (AlbumMappingException e) {
            logger.log(Level.SEVERE, "Cannot resolve albums: " + e.getMessage(), e);
            return new ArrayList<>();
        }

        String albumTitle = StringUtils.trimToNull(title);
        Set<String> paths = new LinkedHashSet<>();

        if (keywords != null) {
            for (String raw : keywords) {
                String keyword = StringUtils.trimToNull(raw);
                if (keyword == null) {
                    continue;
                }
                if (keyword.indexOf(':') >= 0) {
                    addIfPresent(paths, categoryPath(keyword));
                } else if (keyword.indexOf(ALBUM_PATH_SEPARATOR) >= 0) {
                    addFolderAlbum(paths, mappings, keyword, albumTitle);
                } else {
                    addMapped(paths, mappings, keyword, albumTitle);
                }
            }
        }

        addMapped(paths, mappings, StringUtils.trimToNull(city), albumTitle);
        addMapped(paths, mappings, StringUtils.trimToNull(state), albumTitle);
        addMapped(paths, mappings, StringUtils.trimToNull(location), albumTitle);

        if (albumTitle != null) {
            addIfPresent(paths, categoryPath(albumTitle));
        }
        String albumCaption = StringUtils.trimToNull(caption);
        if (albumCaption != null) {
            addIfPresent(paths, categoryPath(albumCaption));
        }

        List<String> result = new ArrayList<>(paths);
        logger.fine(() -> "Resolved albums " + result + " for keywords " + keywords + ", title " + title);
        return result;
    }

    /**
     * @param text a keyword, title or caption
     * @return {@code <prefix>/<category>/<text>} if text has exactly one colon,
     *         followed by a space and some detail; otherwise null
     */
    String categoryPath(String text) {
        int colon = text.indexOf(':');
        if (colon <= 0 || colon != text.lastIndexOf(':')) {
            return null;
        }
        if (colon + 1 >= text.length() || text.charAt(colon + 1) != ' ') {
            return null;
        }
        String category = text.substring(0, colon).trim();
        String detail = text.substring(colon + 1).trim();
        if (category.isEmpty() || detail.isEmpty()) {
            return null;
        }
        return categoryPrefix + SEPARATOR + category + SEPARATOR + text;
    }

    private static void addFolderAlbum(Set<String> paths, AlbumMappings mappings,
                                       String keyword, String title) {
        int slash = keyword.indexOf(ALBUM_PATH_SEPARATOR);
        String folder = keyword.substring(0, slash).trim();
        String album = keyword.substring(slash + 1).trim();
        for (String base : mappings.lookup(folder)) {
            if (album.isEmpty()) {
                addIfPresent(paths, applyMapping(base, title));
            } else {
                paths.add(stripTrailingSeparator(base) + SEPARATOR + album);
            }
        }
    }

    private static void addMapped(Set<String> paths, AlbumMappings mappings, String key, String title) {
        if (key == null) {
            return;
        }
        for (String value : mappings.lookup(key)) {
            addIfPresent(paths, applyMapping(value, title));
        }
    }

    /**
     * @param value a mapped path
     * @param title the asset's title, may be null
     * @return value with the title appended if value ends in a separator
     *         (null if there is no title to append); value itself otherwise
     */
    static String applyMapping(String value, String title) {
        if (value.endsWith(SEPARATOR)) {
            return (title == null) ? null : value + title;
        }
        return value;
    }

    private static String stripTrailingSeparator(String path) {
        String stripped = path;
        while (stripped.endsWith(SEPARATOR)) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }

    private static void addIfPresent(Set<String> paths, String path) {
        if (path != null && !path.isEmpty()) {
            paths.add(path);
        }
    }
}
