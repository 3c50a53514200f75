package com.phototrack.gpx;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.phototrack.exception.PhotoTrackException;
import com.phototrack.model.GeotaggedPhoto;

/**
 * Writes GPX 1.1 tracks: one trk, one trkseg, one trkpt per photo.
 */
public class GpxWriter {

    private static final Logger log = LoggerFactory.getLogger(GpxWriter.class);

    public static final String GPX_NS = "http://www.topografix.com/GPX/1/1";
    public static final String CREATOR = "PhotoTrack";

    public void write(Path outputFile, String trackName, String description, List<GeotaggedPhoto> photos) {
        Document doc = newDocument();

        Element gpx = doc.createElementNS(GPX_NS, "gpx");
        gpx.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", GPX_NS);
        gpx.setAttribute("version", "1.1");
        gpx.setAttribute("creator", CREATOR);
        doc.appendChild(gpx);

        Element metadata = child(doc, gpx, "metadata");
        text(doc, metadata, "name", trackName);
        text(doc, metadata, "desc", description);

        Element trk = child(doc, gpx, "trk");
        text(doc, trk, "name", trackName);
        Element segment = child(doc, trk, "trkseg");

        for (GeotaggedPhoto photo : photos) {
            Element trkpt = child(doc, segment, "trkpt");
            trkpt.setAttribute("lat", BigDecimal.valueOf(photo.getLat()).toPlainString());
            trkpt.setAttribute("lon", BigDecimal.valueOf(photo.getLon()).toPlainString());
            if (photo.getAltitude() != null && photo.getAltitude() != 0.0) {
                text(doc, trkpt, "ele", BigDecimal.valueOf(photo.getAltitude()).toPlainString());
            }
            if (photo.getCapturedAt() != null) {
                text(doc, trkpt, "time", DateTimeFormatter.ISO_INSTANT.format(photo.getCapturedAt()));
            }
            text(doc, trkpt, "name", photo.getFileName());
            if (photo.getPlace() != null) {
                text(doc, trkpt, "desc", photo.getPlace().toLocationLabel());
            }
        }

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(outputFile)) {
                Transformer transformer = TransformerFactory.newInstance().newTransformer();
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
                transformer.transform(new DOMSource(doc), new StreamResult(out));
            }
        } catch (IOException | TransformerException e) {
            throw new PhotoTrackException("Could not write GPX file " + outputFile + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} track points to {}", photos.size(), outputFile);
    }

    /**
     * gps_track_[folder][_anonymized].gpx in {@code dir}, with _v2, _v3, ... appended
     * while the name is taken.
     */
    public static Path versionedOutputFile(Path dir, String folderName, boolean anonymized) {
        String base = "gps_track_" + folderName + (anonymized ? "_anonymized" : "");
        Path candidate = dir.resolve(base + ".gpx");
        int version = 2;
        while (Files.exists(candidate)) {
            candidate = dir.resolve(base + "_v" + version + ".gpx");
            version++;
        }
        return candidate;
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML support unavailable", e);
        }
    }

    private static Element child(Document doc, Element parent, String name) {
        Element element = doc.createElementNS(GPX_NS, name);
        parent.appendChild(element);
        return element;
    }

    private static void text(Document doc, Element parent, String name, String value) {
        child(doc, parent, name).setTextContent(value != null ? value : "");
    }
}
