package com.phototrack.photo;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.ImageWriteException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegPhotoshopMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.jpeg.iptc.IptcBlock;
import org.apache.commons.imaging.formats.jpeg.iptc.IptcRecord;
import org.apache.commons.imaging.formats.jpeg.iptc.IptcTypes;
import org.apache.commons.imaging.formats.jpeg.iptc.JpegIptcRewriter;
import org.apache.commons.imaging.formats.jpeg.iptc.PhotoshopApp13Data;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.GpsTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phototrack.model.TrackPoint;

/**
 * Writes EXIF GPS tags and IPTC place names into JPEG files, losslessly.
 * Other EXIF directories and unrelated IPTC records are preserved.
 */
public class ImagingPhotoMetadataWriter implements PhotoMetadataWriter {

    private static final Logger log = LoggerFactory.getLogger(ImagingPhotoMetadataWriter.class);

    private static final Set<String> WRITABLE_EXTENSIONS = Set.of("jpg", "jpeg");

    private static final Set<Integer> PLACE_RECORD_TYPES = Set.of(
        IptcTypes.CITY.getType(),
        IptcTypes.PROVINCE_STATE.getType(),
        IptcTypes.COUNTRY_PRIMARY_LOCATION_NAME.getType(),
        IptcTypes.COUNTRY_PRIMARY_LOCATION_CODE.getType()
    );

    @Override
    public boolean write(Path photo, TrackPoint point) {
        if (!isWritable(photo)) {
            log.warn("Metadata writing not supported for {}", photo.getFileName());
            return false;
        }
        try {
            byte[] original = Files.readAllBytes(photo);
            ImageMetadata metadata = Imaging.getMetadata(original);
            JpegImageMetadata jpeg = metadata instanceof JpegImageMetadata ? (JpegImageMetadata) metadata : null;

            byte[] withExif = writeGps(original, jpeg, point);
            byte[] withIptc = writePlace(withExif, jpeg, point);

            Files.write(photo, withIptc);
            return true;
        } catch (ImageReadException | ImageWriteException | IOException | RuntimeException e) {
            log.warn("Could not write metadata to {}: {}", photo.getFileName(), e.getMessage());
            return false;
        }
    }

    static boolean isWritable(Path photo) {
        String name = photo.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && WRITABLE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static byte[] writeGps(byte[] image, JpegImageMetadata jpeg, TrackPoint point)
            throws ImageReadException, ImageWriteException, IOException {
        TiffOutputSet outputSet = null;
        if (jpeg != null) {
            TiffImageMetadata exif = jpeg.getExif();
            if (exif != null) {
                outputSet = exif.getOutputSet();
            }
        }
        if (outputSet == null) {
            outputSet = new TiffOutputSet();
        }

        TiffOutputDirectory gps = outputSet.getOrCreateGPSDirectory();
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_VERSION_ID);
        gps.add(GpsTagConstants.GPS_TAG_GPS_VERSION_ID, (byte) 2, (byte) 3, (byte) 0, (byte) 0);

        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF, point.getLat() >= 0
            ? GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF_VALUE_NORTH
            : GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF_VALUE_SOUTH);
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LATITUDE);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LATITUDE, Sexagesimal.toRationals(point.getLat()));

        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF, point.getLon() >= 0
            ? GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF_VALUE_EAST
            : GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF_VALUE_WEST);
        gps.removeField(GpsTagConstants.GPS_TAG_GPS_LONGITUDE);
        gps.add(GpsTagConstants.GPS_TAG_GPS_LONGITUDE, Sexagesimal.toRationals(point.getLon()));

        if (point.getAltitude() != null) {
            gps.removeField(GpsTagConstants.GPS_TAG_GPS_ALTITUDE);
            gps.add(GpsTagConstants.GPS_TAG_GPS_ALTITUDE, Sexagesimal.altitude(point.getAltitude()));
            gps.removeField(GpsTagConstants.GPS_TAG_GPS_ALTITUDE_REF);
            gps.add(GpsTagConstants.GPS_TAG_GPS_ALTITUDE_REF, (byte) (point.getAltitude() >= 0 ? 0 : 1));
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(image.length + 1024);
        new ExifRewriter().updateExifMetadataLossless(image, out, outputSet);
        return out.toByteArray();
    }

    private static byte[] writePlace(byte[] image, JpegImageMetadata jpeg, TrackPoint point)
            throws ImageReadException, ImageWriteException, IOException {
        if (!point.hasPlace()) {
            return image;
        }
        List<IptcRecord> records = new ArrayList<>();
        List<IptcBlock> otherBlocks = Collections.emptyList();
        JpegPhotoshopMetadata photoshop = jpeg != null ? jpeg.getPhotoshop() : null;
        if (photoshop != null && photoshop.photoshopApp13Data != null) {
            for (IptcRecord existing : photoshop.photoshopApp13Data.getRecords()) {
                if (!PLACE_RECORD_TYPES.contains(existing.iptcType.getType())) {
                    records.add(existing);
                }
            }
            otherBlocks = photoshop.photoshopApp13Data.getNonIptcBlocks();
        }

        addIfPresent(records, IptcTypes.CITY, point.getCity());
        addIfPresent(records, IptcTypes.PROVINCE_STATE, point.getState());
        addIfPresent(records, IptcTypes.COUNTRY_PRIMARY_LOCATION_NAME, point.getCountry());
        addIfPresent(records, IptcTypes.COUNTRY_PRIMARY_LOCATION_CODE, point.getCountryCode());

        ByteArrayOutputStream out = new ByteArrayOutputStream(image.length + 512);
        new JpegIptcRewriter().writeIPTC(image, out, new PhotoshopApp13Data(records, otherBlocks));
        return out.toByteArray();
    }

    private static void addIfPresent(List<IptcRecord> records, IptcTypes type, String value) {
        if (value != null && !value.isBlank()) {
            records.add(new IptcRecord(type, value));
        }
    }
}
