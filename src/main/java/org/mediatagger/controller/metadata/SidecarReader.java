package org.mediatagger.controller.metadata;

import static org.mediatagger.controller.util.XPathUtilities.firstNonEmptyText;
import static org.mediatagger.controller.util.XPathUtilities.nodeListValue;
import static org.mediatagger.model.util.Constants.SIDECAR_EXTENSION;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPathExpressionException;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import org.mediatagger.controller.util.StringUtils;
import org.mediatagger.model.GpsPosition;
import org.mediatagger.model.MediaLocation;
import org.mediatagger.model.MediaMetadata;

/**
 * Extracts metadata from the XMP sidecar written next to a media file.
 *
 * <p>Every field is read by an ordered list of {@link SidecarStrategy}s; the
 * first one that finds a value wins and the rest are not tried.  A missing
 * or unparseable sidecar yields {@link MediaMetadata#EMPTY}.
 */
public class SidecarReader {

    private static final Logger logger = Logger.getLogger(SidecarReader.class.getName());

    private static final Pattern HIERARCHY_SEPARATOR = Pattern.compile("\\|");

    private static final List<SidecarStrategy<String>> TITLE_STRATEGIES = List.of(
        text("//dc:title/rdf:Alt/rdf:li[@xml:lang='x-default']"),
        text("//dc:title/rdf:Alt/rdf:li"),
        text("//dc:title/rdf:li[@xml:lang='x-default']"),
        text("//dc:title/rdf:li"),
        text("//rdf:Description/@photoshop:Headline | //photoshop:Headline"),
        text("//rdf:Description/@Iptc4xmpCore:Location | //Iptc4xmpCore:Location")
    );

    private static final List<SidecarStrategy<List<String>>> KEYWORD_STRATEGIES = List.of(
        SidecarReader::hierarchicalKeywords,
        items("//dc:subject/rdf:Bag/rdf:li"),
        items("//dc:subject/rdf:Seq/rdf:li")
    );

    private static final List<SidecarStrategy<String>> CAPTION_STRATEGIES = List.of(
        text("//dc:description/rdf:Alt/rdf:li[@xml:lang='x-default']"),
        text("//dc:description/rdf:Alt/rdf:li")
    );

    private static final List<SidecarStrategy<MediaLocation>> LOCATION_STRATEGIES = List.of(
        SidecarReader::iptcLocation,
        SidecarReader::photoshopLocation
    );

    private static final List<SidecarStrategy<String>> DATE_STRATEGIES = List.of(
        date("//rdf:Description/@exif:DateTimeOriginal | //exif:DateTimeOriginal"),
        date("//rdf:Description/@photoshop:DateCreated | //photoshop:DateCreated"),
        date("//rdf:Description/@xmp:CreateDate | //xmp:CreateDate")
    );

    private static final List<SidecarStrategy<GpsPosition>> GPS_STRATEGIES = List.of(
        SidecarReader::exifGps
    );

    private static final List<SidecarStrategy<Integer>> RATING_STRATEGIES = List.of(
        doc -> TagTable.parseRating(firstNonEmptyText("//rdf:Description/@xmp:Rating | //xmp:Rating", doc))
    );

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY = newFactory();

    private static DocumentBuilderFactory newFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException pce) {
            logger.log(Level.WARNING, "XML parser does not support secure processing features", pce);
        }
        return factory;
    }

    /**
     * Look for the sidecar of a media file: {@code <stem>.xmp} first, then
     * {@code <fullname>.xmp}.
     *
     * @param mediaFile the media file
     * @return the sidecar path, or null if neither candidate exists
     */
    public static Path findSidecar(Path mediaFile) {
        String filename = mediaFile.getFileName().toString();
        Path byStem = mediaFile.resolveSibling(StringUtils.removeExtension(filename) + SIDECAR_EXTENSION);
        if (Files.isRegularFile(byStem)) {
            return byStem;
        }
        Path byFullName = mediaFile.resolveSibling(filename + SIDECAR_EXTENSION);
        if (Files.isRegularFile(byFullName)) {
            return byFullName;
        }
        return null;
    }

    /**
     * Read the sidecar belonging to a media file.
     *
     * @param mediaFile the media file
     * @return the sidecar's metadata; {@link MediaMetadata#EMPTY} if there is none
     */
    public MediaMetadata read(Path mediaFile) {
        Path sidecar = findSidecar(mediaFile);
        if (sidecar == null) {
            logger.fine("No sidecar for " + mediaFile);
            return MediaMetadata.EMPTY;
        }
        return readSidecar(sidecar);
    }

    /**
     * Parse a sidecar document.
     *
     * @param sidecar the XMP file
     * @return its metadata; {@link MediaMetadata#EMPTY} if it cannot be parsed
     */
    public MediaMetadata readSidecar(Path sidecar) {
        Document doc;
        try (InputStream in = Files.newInputStream(sidecar)) {
            DocumentBuilder builder = DOCUMENT_BUILDER_FACTORY.newDocumentBuilder();
            doc = builder.parse(in);
        } catch (IOException | SAXException | ParserConfigurationException e) {
            logger.warning("Could not parse sidecar " + sidecar + ": " + e.getMessage());
            return MediaMetadata.EMPTY;
        }

        try {
            MediaMetadata metadata = new MediaMetadata.Builder()
                .title(first(TITLE_STRATEGIES, doc))
                .keywords(first(KEYWORD_STRATEGIES, doc))
                .caption(first(CAPTION_STRATEGIES, doc))
                .location(first(LOCATION_STRATEGIES, doc))
                .date(first(DATE_STRATEGIES, doc))
                .gps(first(GPS_STRATEGIES, doc))
                .rating(first(RATING_STRATEGIES, doc))
                .build();
            logger.fine("Read sidecar " + sidecar + ": " + metadata);
            return metadata;
        } catch (XPathExpressionException xpe) {
            logger.log(Level.WARNING, "Could not evaluate sidecar " + sidecar, xpe);
            return MediaMetadata.EMPTY;
        }
    }

    private static <T> T first(List<SidecarStrategy<T>> strategies, Document doc)
        throws XPathExpressionException {
        for (SidecarStrategy<T> strategy : strategies) {
            T value = strategy.extract(doc);
            if (value instanceof Collection && ((Collection<?>) value).isEmpty()) {
                continue;
            }
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static SidecarStrategy<String> text(String expression) {
        return doc -> firstNonEmptyText(expression, doc);
    }

    private static SidecarStrategy<String> date(String expression) {
        return doc -> DateNormalizer.normalize(firstNonEmptyText(expression, doc));
    }

    private static SidecarStrategy<List<String>> items(String expression) {
        return doc -> {
            Set<String> keywords = new LinkedHashSet<>();
            NodeList nodes = nodeListValue(expression, doc);
            for (int i = 0; i < nodes.getLength(); i++) {
                String keyword = StringUtils.trimToNull(nodes.item(i).getTextContent());
                if (keyword != null) {
                    keywords.add(keyword);
                }
            }
            return new ArrayList<>(keywords);
        };
    }

    private static List<String> hierarchicalKeywords(Document doc) throws XPathExpressionException {
        Set<String> keywords = new LinkedHashSet<>();
        NodeList nodes = nodeListValue("//lr:hierarchicalSubject/rdf:Bag/rdf:li", doc);
        for (int i = 0; i < nodes.getLength(); i++) {
            String entry = nodes.item(i).getTextContent();
            if (StringUtils.isBlank(entry)) {
                continue;
            }
            for (String part : HIERARCHY_SEPARATOR.split(entry)) {
                String keyword = StringUtils.trimToNull(part);
                if (keyword != null) {
                    keywords.add(keyword);
                }
            }
        }
        return new ArrayList<>(keywords);
    }

    private static MediaLocation iptcLocation(Document doc) throws XPathExpressionException {
        MediaLocation location = new MediaLocation(
            firstNonEmptyText("//rdf:Description/@Iptc4xmpCore:Location | //Iptc4xmpCore:Location", doc),
            firstNonEmptyText("//rdf:Description/@Iptc4xmpCore:City | //Iptc4xmpCore:City", doc),
            null,
            firstNonEmptyText("//rdf:Description/@Iptc4xmpCore:CountryName | //Iptc4xmpCore:CountryName", doc)
        );
        return location.isEmpty() ? null : location;
    }

    private static MediaLocation photoshopLocation(Document doc) throws XPathExpressionException {
        MediaLocation location = new MediaLocation(
            null,
            firstNonEmptyText("//rdf:Description/@photoshop:City", doc),
            firstNonEmptyText("//rdf:Description/@photoshop:State", doc),
            firstNonEmptyText("//rdf:Description/@photoshop:Country", doc)
        );
        return location.isEmpty() ? null : location;
    }

    private static GpsPosition exifGps(Document doc) throws XPathExpressionException {
        GpsPosition gps = new GpsPosition(
            firstNonEmptyText("//rdf:Description/@exif:GPSLatitude | //exif:GPSLatitude", doc),
            firstNonEmptyText("//rdf:Description/@exif:GPSLongitude | //exif:GPSLongitude", doc),
            firstNonEmptyText("//rdf:Description/@exif:GPSAltitude | //exif:GPSAltitude", doc)
        );
        return gps.isComplete() ? gps : null;
    }
}
