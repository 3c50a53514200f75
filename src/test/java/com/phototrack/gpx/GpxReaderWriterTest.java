package com.phototrack.gpx;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.phototrack.exception.PhotoTrackException;
import com.phototrack.model.GeotaggedPhoto;
import com.phototrack.model.PlaceRecord;
import com.phototrack.model.TrackPoint;

import static org.junit.jupiter.api.Assertions.*;

public class GpxReaderWriterTest {

    @TempDir
    Path tempDir;

    private final GpxWriter writer = new GpxWriter();
    private final GpxReader reader = new GpxReader();

    @Test
    void writtenTrackCarriesPositionTimePlaceAndName() throws Exception {
        PlaceRecord paris = new PlaceRecord("Paris", "Ile-de-France", "France", "FR", 48.8584, 2.2945);
        List<GeotaggedPhoto> photos = List.of(
            new GeotaggedPhoto("IMG_0001.jpg", Instant.parse("2024-06-01T10:15:30Z"), 48.8584, 2.2945, 35.5, paris)
        );
        Path out = tempDir.resolve("track.gpx");

        writer.write(out, "Photo track paris", "Track generated from 1 photos", photos);

        String xml = Files.readString(out);
        assertTrue(xml.contains("xmlns=\"http://www.topografix.com/GPX/1/1\""));
        assertTrue(xml.contains("creator=\"PhotoTrack\""));
        assertTrue(xml.contains("<time>2024-06-01T10:15:30Z</time>"));
        assertTrue(xml.contains("<desc>Paris, Ile-de-France, France (FR)</desc>"));
        assertTrue(xml.contains("<ele>35.5</ele>"));

        GpxTrack track = reader.read(out);
        assertEquals(1, track.getPoints().size());
        TrackPoint point = track.getPoints().get(0);
        assertEquals(48.8584, point.getLat(), 1e-9);
        assertEquals(2.2945, point.getLon(), 1e-9);
        assertEquals(Instant.parse("2024-06-01T10:15:30Z"), point.getTime());
        assertEquals(35.5, point.getAltitude(), 1e-9);
        assertEquals("IMG_0001.jpg", point.getName());
        assertEquals("Paris", point.getCity());
        assertEquals("Ile-de-France", point.getState());
        assertEquals("France", point.getCountry());
        assertEquals("FR", point.getCountryCode());
    }

    @Test
    void zeroAltitudeAndMissingTimeAreOmitted() throws Exception {
        PlaceRecord monaco = new PlaceRecord("Monaco", "", "Monaco", "MC", 43.7384, 7.4246);
        Path out = tempDir.resolve("track.gpx");

        writer.write(out, "t", "d", List.of(new GeotaggedPhoto("a.jpg", null, 43.7384, 7.4246, 0.0, monaco)));

        String xml = Files.readString(out);
        assertFalse(xml.contains("<ele>"));
        assertFalse(xml.contains("<time>"));
        assertTrue(xml.contains("<desc>Monaco, Monaco (MC)</desc>"));

        GpxTrack track = reader.read(out);
        assertTrue(track.isEmpty());
        assertEquals(1, track.getSkippedPoints());
    }

    @Test
    void readsPlainGpxWithoutNamespaceAndMixedTimeFormats() throws Exception {
        Path gpx = tempDir.resolve("device.gpx");
        Files.writeString(gpx, "<?xml version=\"1.0\"?>\n"
            + "<gpx version=\"1.0\"><trk><trkseg>\n"
            + "  <trkpt lat=\"45.1\" lon=\"6.1\"><ele>1200</ele><time>2024-06-01T08:00:00Z</time></trkpt>\n"
            + "  <trkpt lat=\"45.2\" lon=\"6.2\"><time>2024-06-01T10:00:00+02:00</time></trkpt>\n"
            + "  <trkpt lat=\"45.3\" lon=\"6.3\"><time>2024-06-01T09:30:00</time></trkpt>\n"
            + "  <trkpt lat=\"45.4\" lon=\"6.4\"/>\n"
            + "  <trkpt lat=\"bad\" lon=\"6.5\"><time>2024-06-01T09:45:00Z</time></trkpt>\n"
            + "  <trkpt lat=\"45.6\" lon=\"6.6\"><time>yesterday</time></trkpt>\n"
            + "</trkseg></trk></gpx>\n");

        GpxTrack track = reader.read(gpx);

        assertEquals(3, track.getPoints().size());
        assertEquals(3, track.getSkippedPoints());
        assertEquals(Instant.parse("2024-06-01T08:00:00Z"), track.getPoints().get(0).getTime());
        assertEquals(Instant.parse("2024-06-01T08:00:00Z"), track.getPoints().get(1).getTime());
        assertEquals(Instant.parse("2024-06-01T09:30:00Z"), track.getPoints().get(2).getTime());
        assertEquals(1200.0, track.getPoints().get(0).getAltitude(), 1e-9);
        assertNull(track.getPoints().get(1).getAltitude());
        assertFalse(track.getPoints().get(0).hasPlace());
        assertEquals(Instant.parse("2024-06-01T08:00:00Z"), track.getStart());
        assertEquals(Instant.parse("2024-06-01T09:30:00Z"), track.getEnd());
    }

    @Test
    void missingFileIsFatal() {
        assertThrows(PhotoTrackException.class, () -> reader.read(tempDir.resolve("nope.gpx")));
    }

    @Test
    void malformedXmlIsFatal() throws Exception {
        Path gpx = tempDir.resolve("broken.gpx");
        Files.writeString(gpx, "<gpx><trk>");

        assertThrows(PhotoTrackException.class, () -> reader.read(gpx));
    }

    @Test
    void descriptionIsSplitIntoPlaceFields() {
        assertArrayEquals(new String[]{"Paris", "Ile-de-France", "France", "FR"},
            GpxReader.parseDescription("Paris, Ile-de-France, France (FR)"));
        assertArrayEquals(new String[]{"Monaco", null, "Monaco", "MC"},
            GpxReader.parseDescription("Monaco, Monaco (MC)"));
        assertArrayEquals(new String[]{"Somewhere", null, null, null},
            GpxReader.parseDescription("Somewhere"));
        assertArrayEquals(new String[]{null, null, null, null},
            GpxReader.parseDescription(null));
    }

    @Test
    void coordinateFallbackLabelSurvivesTheTrackFile() throws Exception {
        PlaceRecord fallback = PlaceRecord.gpsFallback(45.1234, 6.5678, null);
        List<GeotaggedPhoto> photos = List.of(
            new GeotaggedPhoto("IMG_0042.jpg", Instant.parse("2024-07-14T08:00:00Z"), 45.1234, 6.5678, null, fallback)
        );
        Path out = tempDir.resolve("fallback.gpx");

        writer.write(out, "Photo track alps", "Track generated from 1 photos", photos);

        TrackPoint point = reader.read(out).getPoints().get(0);
        assertEquals("GPS 45.1234, 6.5678", point.getCity());
        assertNull(point.getState());
        assertEquals("Unknown", point.getCountry());
        assertNull(point.getCountryCode());
    }

    @Test
    void coordinateFallbackLabelKeepsLastKnownRegion() {
        assertArrayEquals(new String[]{"GPS 67.2833, 14.3833", "Nordland", "Norway", "NO"},
            GpxReader.parseDescription("GPS 67.2833, 14.3833, Nordland, Norway (NO)"));
        assertArrayEquals(new String[]{"GPS -12.5000, -130.2500", null, "Unknown", null},
            GpxReader.parseDescription("GPS -12.5000, -130.2500, Unknown ()"));
    }

    @Test
    void versionedFileNameSkipsExistingFiles() throws Exception {
        assertEquals(tempDir.resolve("gps_track_holiday.gpx"),
            GpxWriter.versionedOutputFile(tempDir, "holiday", false));
        assertEquals(tempDir.resolve("gps_track_holiday_anonymized.gpx"),
            GpxWriter.versionedOutputFile(tempDir, "holiday", true));

        Files.createFile(tempDir.resolve("gps_track_holiday.gpx"));
        Files.createFile(tempDir.resolve("gps_track_holiday_v2.gpx"));

        assertEquals(tempDir.resolve("gps_track_holiday_v3.gpx"),
            GpxWriter.versionedOutputFile(tempDir, "holiday", false));
    }
}
