package org.mediatagger.controller;

import com.thoughtworks.xstream.XStream;
import com.thoughtworks.xstream.converters.reflection.AbstractReflectionConverter.UnknownFieldException;
import com.thoughtworks.xstream.converters.reflection.PureJavaReflectionProvider;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.mediatagger.model.PipelineSettings;

public class PipelineSettingsPersistence {

    private static final Logger logger = Logger.getLogger(
        PipelineSettingsPersistence.class.getName()
    );

    // Use reflection provider so the default constructor is called, and
    // settings missing from an older file keep their defaults.
    private static final XStream xstream = new XStream(
        new PureJavaReflectionProvider()
    );

    static {
        // XStream requires explicit security permissions
        xstream.allowTypes(new Class[] { PipelineSettings.class });

        xstream.alias("settings", PipelineSettings.class);
        xstream.aliasField("marker", PipelineSettings.class, "completionMarker");
        xstream.aliasField("exiftool", PipelineSettings.class, "exiftoolPath");
        xstream.aliasField("albums", PipelineSettings.class, "albumMappingFile");
        xstream.aliasField("transfers", PipelineSettings.class, "transferDestinations");
    }

    private PipelineSettingsPersistence() {
        // static persistence only
    }

    /**
     * Save the settings object to the path.
     *
     * @param settings the settings object to save
     * @param path     the path to save it to
     */
    public static void persist(PipelineSettings settings, Path path) {
        String xml = xstream.toXML(settings);

        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            // Overwrite any existing file
            Files.writeString(path, xml);
        } catch (
            IOException
            | UnsupportedOperationException
            | SecurityException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception occurred when writing settings file '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
        }
    }

    /**
     * Load the settings from path.
     *
     * @param path the path to read
     * @return the populated settings object, or null if there is no usable file
     */
    public static PipelineSettings retrieve(Path path) {
        if (Files.notExists(path)) {
            logger.fine(
                "Settings file '" +
                    path.toAbsolutePath() +
                    "' does not exist - assuming defaults"
            );
            return null;
        }

        try (InputStream in = Files.newInputStream(path)) {
            try {
                return (PipelineSettings) xstream.fromXML(in);
            } catch (UnknownFieldException ufe) {
                // Settings written by a newer build may carry fields this one lacks.
                logger.log(
                    Level.INFO,
                    "Ignoring unknown field(s) while reading settings file '" +
                        path.toAbsolutePath() +
                        "': " +
                        ufe.getMessage(),
                    ufe
                );

                xstream.ignoreUnknownElements();
                try (InputStream inRetry = Files.newInputStream(path)) {
                    return (PipelineSettings) xstream.fromXML(inRetry);
                }
            }
        } catch (
            IOException
            | IllegalArgumentException
            | SecurityException
            | com.thoughtworks.xstream.XStreamException e
        ) {
            logger.log(
                Level.SEVERE,
                "Exception reading settings file '" +
                    path.toAbsolutePath() +
                    "'",
                e
            );
            logger.info("assuming default settings");
            return null;
        }
    }
}
