package org.mediatagger.controller;

import com.thoughtworks.xstream.XStream;
import com.thoughtworks.xstream.XStreamException;
import com.thoughtworks.xstream.converters.reflection.PureJavaReflectionProvider;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.mediatagger.model.AlbumMapping;
import org.mediatagger.model.AlbumMappings;

/**
 * Reads and writes the album mapping document:
 *
 * <pre>{@code
 * <albums>
 *   <mapping key="Stuttgart">
 *     <path>02/DE/Stuttgart/</path>
 *   </mapping>
 * </albums>
 * }</pre>
 */
public class AlbumMappingsPersistence implements AlbumMappingSource {

    private static final Logger logger = Logger.getLogger(
        AlbumMappingsPersistence.class.getName()
    );

    private static final XStream xstream = new XStream(
        new PureJavaReflectionProvider()
    );

    static {
        // XStream requires explicit security permissions.
        xstream.allowTypes(new Class[] { AlbumMappings.class, AlbumMapping.class });

        xstream.alias("albums", AlbumMappings.class);
        xstream.alias("mapping", AlbumMapping.class);
        xstream.addImplicitCollection(AlbumMappings.class, "mappings", "mapping", AlbumMapping.class);
        xstream.useAttributeFor(AlbumMapping.class, "key");
        xstream.addImplicitCollection(AlbumMapping.class, "paths", "path", String.class);
    }

    private final Path path;

    /**
     * @param path the mapping document this source reads on every {@link #load()}
     */
    public AlbumMappingsPersistence(Path path) {
        this.path = path;
    }

    @Override
    public AlbumMappings load() throws AlbumMappingException {
        return retrieve(path);
    }

    /**
     * Save the mappings to the path.
     *
     * @param mappings the mappings to save
     * @param path the path to save them to
     */
    public static void persist(AlbumMappings mappings, Path path) {
        String xml = xstream.toXML(mappings);

        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, xml);
        } catch (
            IOException
            | UnsupportedOperationException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception occurred when writing album mapping file '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
        }
    }

    /**
     * Load the mappings from path.
     *
     * @param path the path to read
     * @return the populated mappings
     * @throws AlbumMappingException if the file is missing or cannot be parsed
     */
    public static AlbumMappings retrieve(Path path) throws AlbumMappingException {
        if (Files.notExists(path)) {
            throw new AlbumMappingException(
                "Album mapping file '" + path.toAbsolutePath() + "' does not exist"
            );
        }

        try (InputStream in = Files.newInputStream(path)) {
            Object parsed = xstream.fromXML(in);
            if (!(parsed instanceof AlbumMappings)) {
                throw new AlbumMappingException(
                    "Album mapping file '" + path.toAbsolutePath() + "' has no <albums> root"
                );
            }
            AlbumMappings mappings = (AlbumMappings) parsed;
            logger.fine(() -> "Loaded " + mappings.size() + " album mappings from " + path);
            return mappings;
        } catch (IOException | XStreamException | SecurityException | ClassCastException e) {
            throw new AlbumMappingException(
                "Exception reading album mapping file '" + path.toAbsolutePath() + "'",
                e
            );
        }
    }
}
