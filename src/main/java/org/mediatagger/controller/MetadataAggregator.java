package org.mediatagger.controller;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import org.mediatagger.controller.metadata.DateNormalizer;
import org.mediatagger.controller.metadata.FieldKind;
import org.mediatagger.controller.metadata.MetadataCodec;
import org.mediatagger.controller.metadata.SidecarReader;
import org.mediatagger.controller.metadata.TagTable;
import org.mediatagger.model.MediaLocation;
import org.mediatagger.model.MediaMetadata;

/**
 * Merges what a file's sidecar says with what the file already carries.
 * A sidecar value always wins; embedded tags only fill fields the sidecar
 * leaves empty.  Nothing is cached between files.
 */
public class MetadataAggregator {

    private static final Logger logger = Logger.getLogger(MetadataAggregator.class.getName());

    private final SidecarReader sidecarReader;
    private final MetadataCodec codec;

    public MetadataAggregator(SidecarReader sidecarReader, MetadataCodec codec) {
        this.sidecarReader = sidecarReader;
        this.codec = codec;
    }

    /**
     * Read both sources for a media file and merge them.
     *
     * @param mediaFile the media file
     * @return the merged metadata
     */
    public MediaMetadata aggregate(Path mediaFile) {
        MediaMetadata sidecar = sidecarReader.read(mediaFile);
        Map<String, String> embedded = codec.readTags(mediaFile);
        MediaMetadata merged = merge(sidecar, embedded);
        logger.fine("Aggregated metadata for " + mediaFile + ": " + merged);
        return merged;
    }

    /**
     * @param sidecar metadata read from the sidecar
     * @param embedded tags read from the media file
     * @return the sidecar's values, completed field by field from the embedded tags
     */
    public MediaMetadata merge(MediaMetadata sidecar, Map<String, String> embedded) {
        MediaMetadata.Builder builder = sidecar.toBuilder();

        if (sidecar.getTitle() == null) {
            builder.title(TagTable.readValue(embedded, FieldKind.TITLE));
        }
        if (sidecar.getKeywords().isEmpty()) {
            builder.keywords(splitList(TagTable.readValue(embedded, FieldKind.KEYWORDS)));
        }
        if (sidecar.getDate() == null) {
            builder.date(DateNormalizer.normalize(TagTable.readValue(embedded, FieldKind.DATE)));
        }
        if (sidecar.getCaption() == null) {
            builder.caption(TagTable.readValue(embedded, FieldKind.CAPTION));
        }
        if (sidecar.getRating() == null) {
            builder.rating(TagTable.parseRating(TagTable.readValue(embedded, FieldKind.RATING)));
        }

        MediaLocation embeddedLocation = new MediaLocation(
            TagTable.readValue(embedded, FieldKind.LOCATION),
            TagTable.readValue(embedded, FieldKind.CITY),
            TagTable.readValue(embedded, FieldKind.STATE),
            TagTable.readValue(embedded, FieldKind.COUNTRY)
        );
        builder.location(sidecar.getLocation().orElse(embeddedLocation));

        return builder.build();
    }

    /**
     * @param metadata any metadata
     * @return true iff no field of it carries a value
     */
    public static boolean isEmpty(MediaMetadata metadata) {
        return metadata == null || metadata.isEmpty();
    }

    static List<String> splitList(String joined) {
        List<String> items = new ArrayList<>();
        if (joined == null) {
            return items;
        }
        for (String item : joined.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }
}
