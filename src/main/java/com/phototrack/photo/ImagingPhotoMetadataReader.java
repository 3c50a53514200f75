package com.phototrack.photo;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.GpsTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phototrack.model.PhotoMetadata;

/**
 * EXIF extraction with Apache Commons Imaging. Handles JPEG and the TIFF-based
 * raw formats the library recognises.
 */
public class ImagingPhotoMetadataReader implements PhotoMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(ImagingPhotoMetadataReader.class);

    private static final int BELOW_SEA_LEVEL = 1;

    static final DateTimeFormatter EXIF_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    // capture time candidates, most specific first
    private static final List<TagInfo> DATE_TAGS = List.of(
        ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL,
        ExifTagConstants.EXIF_TAG_DATE_TIME_DIGITIZED,
        TiffTagConstants.TIFF_TAG_DATE_TIME
    );

    private final ZoneId cameraZone;

    public ImagingPhotoMetadataReader(ZoneId cameraZone) {
        this.cameraZone = cameraZone;
    }

    @Override
    public Optional<PhotoMetadata> read(Path photo) {
        TiffImageMetadata exif;
        try {
            exif = exifOf(Imaging.getMetadata(photo.toFile()));
        } catch (ImageReadException | IOException | RuntimeException e) {
            log.debug("No readable metadata in {}: {}", photo, e.getMessage());
            return Optional.empty();
        }
        if (exif == null) {
            return Optional.empty();
        }

        Double latitude = null;
        Double longitude = null;
        Double altitude = null;
        try {
            TiffImageMetadata.GPSInfo gps = exif.getGPS();
            if (gps != null) {
                latitude = gps.getLatitudeAsDegreesNorth();
                longitude = gps.getLongitudeAsDegreesEast();
                altitude = readAltitude(exif);
            }
        } catch (ImageReadException | RuntimeException e) {
            log.debug("Unreadable GPS block in {}: {}", photo, e.getMessage());
            latitude = null;
            longitude = null;
        }

        return Optional.of(new PhotoMetadata(photo, latitude, longitude, altitude, readCaptureTime(exif, photo)));
    }

    private static TiffImageMetadata exifOf(ImageMetadata metadata) {
        if (metadata instanceof JpegImageMetadata) {
            return ((JpegImageMetadata) metadata).getExif();
        }
        if (metadata instanceof TiffImageMetadata) {
            return (TiffImageMetadata) metadata;
        }
        return null;
    }

    private static Double readAltitude(TiffImageMetadata exif) throws ImageReadException {
        TiffField field = exif.findField(GpsTagConstants.GPS_TAG_GPS_ALTITUDE);
        if (field == null) {
            return null;
        }
        double altitude = field.getDoubleValue();
        TiffField ref = exif.findField(GpsTagConstants.GPS_TAG_GPS_ALTITUDE_REF);
        if (ref != null && firstByte(ref.getValue()) == BELOW_SEA_LEVEL) {
            altitude = -altitude;
        }
        return altitude;
    }

    private Instant readCaptureTime(TiffImageMetadata exif, Path photo) {
        for (TagInfo tag : DATE_TAGS) {
            try {
                TiffField field = exif.findField(tag);
                String value = field != null ? asString(field.getValue()) : null;
                if (value == null || value.isBlank()) {
                    continue;
                }
                return LocalDateTime.parse(value.trim(), EXIF_DATE_FORMAT).atZone(cameraZone).toInstant();
            } catch (ImageReadException | DateTimeParseException e) {
                log.debug("Unusable {} in {}: {}", tag.name, photo, e.getMessage());
            }
        }
        return null;
    }

    private static String asString(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof String[] && ((String[]) value).length > 0) {
            return ((String[]) value)[0];
        }
        return null;
    }

    private static int firstByte(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof byte[] && ((byte[]) value).length > 0) {
            return ((byte[]) value)[0];
        }
        return 0;
    }
}
