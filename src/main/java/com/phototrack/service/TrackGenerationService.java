package com.phototrack.service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.phototrack.cache.GeocodingCache;
import com.phototrack.config.AppProperties;
import com.phototrack.exception.PhotoTrackException;
import com.phototrack.gpx.GpxWriter;
import com.phototrack.model.CoordinateRequest;
import com.phototrack.model.GeotaggedPhoto;
import com.phototrack.model.PhotoMetadata;
import com.phototrack.model.PlaceRecord;
import com.phototrack.photo.PhotoMetadataReader;
import com.phototrack.photo.PhotoScanner;
import com.phototrack.service.BatchGeocodingService.BatchResult;
import com.phototrack.util.GeoMath;

/**
 * Builds a GPX track from the geotagged photos of a folder.
 *
 * 1. Extract GPS position and capture time from every photo
 * 2. Geocode the positions in one batch, cache first
 * 3. Attach places; anonymized places replace the exact position
 * 4. Sort by capture time, undated photos first, and write a versioned GPX file
 */
@Service
public class TrackGenerationService {

    private static final Logger log = LoggerFactory.getLogger(TrackGenerationService.class);

    private static final Comparator<GeotaggedPhoto> BY_CAPTURE_TIME = Comparator.comparing(
        GeotaggedPhoto::getCapturedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    private final GeocodingCache cache;
    private final BatchGeocodingService batchGeocodingService;
    private final ReverseGeocoder reverseGeocoder;
    private final PhotoScanner photoScanner;
    private final PhotoMetadataReader metadataReader;
    private final GpxWriter gpxWriter;
    private final List<String> extensions;

    public TrackGenerationService(GeocodingCache cache, BatchGeocodingService batchGeocodingService,
                                  ReverseGeocoder reverseGeocoder, PhotoScanner photoScanner,
                                  PhotoMetadataReader metadataReader, GpxWriter gpxWriter,
                                  AppProperties appProperties) {
        this.cache = cache;
        this.batchGeocodingService = batchGeocodingService;
        this.reverseGeocoder = reverseGeocoder;
        this.photoScanner = photoScanner;
        this.metadataReader = metadataReader;
        this.gpxWriter = gpxWriter;
        this.extensions = appProperties.getGenerate().getExtensions();
    }

    public GenerationResult generate(Path photoDir, Path outputDir, boolean anonymize) {
        if (!Files.isDirectory(photoDir)) {
            throw new PhotoTrackException("Folder '" + photoDir + "' does not exist");
        }
        Path targetDir = outputDir != null ? outputDir : photoDir;
        long start = System.nanoTime();

        cache.load();

        System.out.println("🔍 Searching for photos in: " + photoDir);
        System.out.println();
        System.out.println("📸 Phase 1: GPS data extraction...");
        List<Path> files = photoScanner.scan(photoDir, extensions);
        System.out.println("   Found " + files.size() + " photos");

        GenerationResult result = new GenerationResult();
        result.totalPhotos = files.size();
        List<PhotoMetadata> located = new ArrayList<>();
        List<CoordinateRequest> requests = new ArrayList<>();

        for (Path file : files) {
            Optional<PhotoMetadata> metadata = metadataReader.read(file);
            if (metadata.isEmpty()) {
                System.out.println("   ⚠️ No EXIF data: " + file.getFileName());
                result.noExif++;
                continue;
            }
            PhotoMetadata photo = metadata.get();
            if (!photo.hasGps()) {
                System.out.println("   ⚠️ No GPS data: " + photo.getFileName());
                result.noGps++;
                continue;
            }
            if (!GeoMath.isValidCoordinate(photo.getLatitude(), photo.getLongitude())) {
                System.out.println("   ⚠️ Invalid GPS: " + photo.getFileName());
                result.invalidGps++;
                continue;
            }
            requests.add(new CoordinateRequest(located.size(), photo.getLatitude(), photo.getLongitude()));
            located.add(photo);
        }

        if (located.isEmpty()) {
            throw new PhotoTrackException("No photos with GPS data found!");
        }
        System.out.println("   ✓ " + located.size() + " photos with GPS found");

        System.out.println();
        System.out.println("🌍 Phase 2: Reverse geocoding (" + requests.size() + " potential requests)...");
        BatchResult batch;
        try {
            batch = batchGeocodingService.resolveBatch(requests, anonymize);
        } finally {
            cache.save();
        }
        result.cacheHits = batch.getCacheHits();
        result.networkResolutions = batch.getNetworkResolutions();

        System.out.println();
        System.out.println("📋 Phase 3: Data association...");
        List<GeotaggedPhoto> photos = new ArrayList<>();
        for (int i = 0; i < located.size(); i++) {
            PhotoMetadata photo = located.get(i);
            PlaceRecord place = batch.get(i);
            double lat = photo.getLatitude();
            double lon = photo.getLongitude();
            if (anonymize && place.isAnonymized()) {
                lat = place.getLat();
                lon = place.getLon();
            }
            photos.add(new GeotaggedPhoto(photo.getFileName(), photo.getCapturedAt(), lat, lon, photo.getAltitude(), place));
        }
        photos.sort(BY_CAPTURE_TIME);
        result.photos = photos;

        String folderName = photoDir.toAbsolutePath().normalize().getFileName().toString();
        Path outputFile = GpxWriter.versionedOutputFile(targetDir, folderName, anonymize);
        String description = "Track generated from " + photos.size() + " photos"
            + (anonymize ? " (anonymized coordinates)" : "");
        gpxWriter.write(outputFile, "Photo track " + folderName, description, photos);
        result.outputFile = outputFile;
        System.out.println("✅ GPX file created: " + outputFile);
        System.out.println("   📍 " + photos.size() + " points");

        double elapsedSeconds = (System.nanoTime() - start) / 1_000_000_000.0;
        result.elapsedSeconds = elapsedSeconds;
        System.out.println();
        System.out.println("📈 Statistics:");
        System.out.println(String.format(Locale.ROOT, "   ⏱️  Total time: %.1f seconds", elapsedSeconds));
        if (elapsedSeconds > 0) {
            System.out.println(String.format(Locale.ROOT, "   ⚡ Speed: %.1f photos/sec", photos.size() / elapsedSeconds));
        }
        System.out.println("   " + cache.getStats());
        System.out.println("   " + reverseGeocoder.getStats());
        log.debug("Generation finished: {} photos, {} cache hits, {} resolved", photos.size(),
            result.cacheHits, result.networkResolutions);
        return result;
    }

    public static class GenerationResult {
        private int totalPhotos;
        private int noExif;
        private int noGps;
        private int invalidGps;
        private int cacheHits;
        private int networkResolutions;
        private double elapsedSeconds;
        private Path outputFile;
        private List<GeotaggedPhoto> photos = List.of();

        public int getTotalPhotos() {
            return totalPhotos;
        }

        public int getNoExif() {
            return noExif;
        }

        public int getNoGps() {
            return noGps;
        }

        public int getInvalidGps() {
            return invalidGps;
        }

        public int getCacheHits() {
            return cacheHits;
        }

        public int getNetworkResolutions() {
            return networkResolutions;
        }

        public double getElapsedSeconds() {
            return elapsedSeconds;
        }

        public Path getOutputFile() {
            return outputFile;
        }

        public List<GeotaggedPhoto> getPhotos() {
            return photos;
        }
    }
}
