package com.phototrack.gpx;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.phototrack.exception.PhotoTrackException;
import com.phototrack.model.PlaceRecord;
import com.phototrack.model.TrackPoint;

/**
 * Reads track points from any GPX file, namespaced or not.
 *
 * Points without a parsable lat/lon or time are skipped and counted. The
 * {@code desc} written by {@link GpxWriter} is split back into place fields.
 */
public class GpxReader {

    private static final Logger log = LoggerFactory.getLogger(GpxReader.class);

    private static final Pattern GPS_LABEL = Pattern.compile(
        "^" + Pattern.quote(PlaceRecord.GPS_LABEL_PREFIX) + "-?\\d+(?:\\.\\d+)?, -?\\d+(?:\\.\\d+)?");

    public GpxTrack read(Path gpxFile) {
        Document doc = parse(gpxFile);
        NodeList nodes = doc.getElementsByTagNameNS("*", "trkpt");

        List<TrackPoint> points = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < nodes.getLength(); i++) {
            TrackPoint point = toTrackPoint((Element) nodes.item(i));
            if (point == null) {
                skipped++;
            } else {
                points.add(point);
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} track points without usable position or time in {}", skipped, gpxFile);
        }
        return new GpxTrack(points, skipped);
    }

    private TrackPoint toTrackPoint(Element trkpt) {
        double lat;
        double lon;
        try {
            lat = Double.parseDouble(trkpt.getAttribute("lat"));
            lon = Double.parseDouble(trkpt.getAttribute("lon"));
        } catch (NumberFormatException e) {
            return null;
        }

        Instant time = parseTime(childText(trkpt, "time"));
        if (time == null) {
            return null;
        }

        Double altitude = null;
        String ele = childText(trkpt, "ele");
        if (ele != null) {
            try {
                altitude = Double.parseDouble(ele);
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparsable elevation '{}'", ele);
            }
        }

        String[] place = parseDescription(childText(trkpt, "desc"));
        return new TrackPoint(lat, lon, time, altitude, childText(trkpt, "name"),
            place[0], place[1], place[2], place[3]);
    }

    /**
     * Accepts "...Z", "...+02:00" and zone-less times; the latter are taken as UTC.
     */
    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    /**
     * "City, State, Country (CODE)" into {city, state, country, code}.
     */
    static String[] parseDescription(String desc) {
        String[] place = new String[4];
        if (desc == null || desc.isBlank()) {
            return place;
        }
        String text = desc.trim();
        if (text.endsWith(")") && text.lastIndexOf(" (") > 0) {
            int open = text.lastIndexOf(" (");
            String code = text.substring(open + 2, text.length() - 1).trim();
            place[3] = code.isEmpty() ? null : code;
            text = text.substring(0, open);
        }
        // the coordinate fallback label carries its own comma
        Matcher gpsLabel = GPS_LABEL.matcher(text);
        if (gpsLabel.find()) {
            place[0] = gpsLabel.group();
            String rest = text.substring(gpsLabel.end()).trim();
            if (rest.startsWith(",")) {
                rest = rest.substring(1);
            }
            String[] parts = splitTrimmed(rest);
            if (parts.length >= 2) {
                place[1] = parts[0];
                place[2] = parts[1];
            } else {
                place[2] = parts[0];
            }
            return blankToNull(place);
        }
        String[] parts = splitTrimmed(text);
        if (parts.length >= 3) {
            place[0] = parts[0];
            place[1] = parts[1];
            place[2] = parts[2];
        } else if (parts.length == 2) {
            place[0] = parts[0];
            place[2] = parts[1];
        } else {
            place[0] = parts[0];
        }
        return blankToNull(place);
    }

    private static String[] splitTrimmed(String text) {
        String[] parts = text.split(",");
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
        }
        return parts;
    }

    private static String[] blankToNull(String[] place) {
        for (int i = 0; i < 3; i++) {
            if (place[i] != null && place[i].isEmpty()) {
                place[i] = null;
            }
        }
        return place;
    }

    private static String childText(Element parent, String localName) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                String text = node.getTextContent();
                return text != null ? text.trim() : null;
            }
        }
        return null;
    }

    private static Document parse(Path gpxFile) {
        if (!Files.isRegularFile(gpxFile)) {
            throw new PhotoTrackException("GPX file not found: " + gpxFile);
        }
        try (InputStream in = Files.newInputStream(gpxFile)) {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return factory.newDocumentBuilder().parse(in);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML support unavailable", e);
        } catch (SAXException | IOException e) {
            throw new PhotoTrackException("Could not read GPX file " + gpxFile + ": " + e.getMessage(), e);
        }
    }
}
