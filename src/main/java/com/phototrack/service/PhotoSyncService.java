package com.phototrack.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.phototrack.config.AppProperties;
import com.phototrack.exception.PhotoTrackException;
import com.phototrack.gpx.GpxReader;
import com.phototrack.gpx.GpxTrack;
import com.phototrack.model.MatchResult;
import com.phototrack.model.PhotoMetadata;
import com.phototrack.model.TrackPoint;
import com.phototrack.photo.PhotoMetadataReader;
import com.phototrack.photo.PhotoMetadataWriter;
import com.phototrack.photo.PhotoScanner;

/**
 * Writes positions from a GPX track onto the photos of a folder, matching each
 * photo's capture time to the closest track point.
 */
@Service
public class PhotoSyncService {

    private static final Logger log = LoggerFactory.getLogger(PhotoSyncService.class);

    static final String BACKUP_SUFFIX = ".backup";

    private final GpxReader gpxReader;
    private final TrackMatcher trackMatcher;
    private final PhotoScanner photoScanner;
    private final PhotoMetadataReader metadataReader;
    private final PhotoMetadataWriter metadataWriter;
    private final List<String> extensions;

    public PhotoSyncService(GpxReader gpxReader, TrackMatcher trackMatcher, PhotoScanner photoScanner,
                            PhotoMetadataReader metadataReader, PhotoMetadataWriter metadataWriter,
                            AppProperties appProperties) {
        this.gpxReader = gpxReader;
        this.trackMatcher = trackMatcher;
        this.photoScanner = photoScanner;
        this.metadataReader = metadataReader;
        this.metadataWriter = metadataWriter;
        this.extensions = appProperties.getSync().getExtensions();
    }

    public SyncResult sync(Path trackFile, Path photoDir, boolean backup, boolean dryRun) {
        if (!Files.isRegularFile(trackFile)) {
            throw new PhotoTrackException("GPX file '" + trackFile + "' does not exist");
        }
        if (!Files.isDirectory(photoDir)) {
            throw new PhotoTrackException("Folder '" + photoDir + "' does not exist");
        }

        GpxTrack track = gpxReader.read(trackFile);
        if (track.isEmpty()) {
            throw new PhotoTrackException("No GPX points found in " + trackFile);
        }
        System.out.println("📍 " + track.getPoints().size() + " valid GPX points loaded from " + trackFile);
        System.out.println("   📅 Period: " + track.getStart() + " → " + track.getEnd());
        if (track.getSkippedPoints() > 0) {
            System.out.println("   ⚠️  " + track.getSkippedPoints() + " points without timestamp ignored");
        }

        System.out.println();
        System.out.println("🔍 Searching for photos in: " + photoDir);
        List<Path> photos = photoScanner.scan(photoDir, extensions);
        System.out.println("   Found " + photos.size() + " photos");
        System.out.println();

        SyncResult result = new SyncResult(photos.size());
        for (Path photo : photos) {
            System.out.println("📸 " + photo.getFileName());

            Optional<PhotoMetadata> metadata = metadataReader.read(photo);
            if (metadata.isEmpty() || metadata.get().getCapturedAt() == null) {
                System.out.println("   ⚠️  No EXIF date found - SKIPPED");
                result.skippedNoDate++;
                continue;
            }

            MatchResult match = trackMatcher.closest(metadata.get().getCapturedAt(), track.getPoints());
            if (!match.isMatched()) {
                System.out.println(String.format(Locale.ROOT, "   ⏱️  Gap > %d min (%.1f min) - SKIPPED",
                    trackMatcher.getDefaultToleranceSeconds() / 60, match.getDeltaSeconds() / 60));
                result.skippedTooFar++;
                continue;
            }

            TrackPoint point = match.getPoint();
            System.out.println(String.format(Locale.ROOT, "   ✓ Match found (gap: %.0fs)", match.getDeltaSeconds()));
            System.out.println(String.format(Locale.ROOT, "   📍 GPS: %.6f, %.6f", point.getLat(), point.getLon()));
            if (point.hasPlace()) {
                System.out.println("   🌍 Place: " + point.describePlace());
            }

            if (apply(photo, point, backup, dryRun)) {
                result.synced++;
            } else {
                result.errors++;
            }
            System.out.println();
        }

        printSummary(result, backup, dryRun);
        return result;
    }

    private boolean apply(Path photo, TrackPoint point, boolean backup, boolean dryRun) {
        if (dryRun) {
            System.out.println("      [DRY-RUN] Simulated update");
            return true;
        }
        if (backup) {
            Path backupFile = photo.resolveSibling(photo.getFileName() + BACKUP_SUFFIX);
            if (!Files.exists(backupFile)) {
                try {
                    Files.copy(photo, backupFile, StandardCopyOption.COPY_ATTRIBUTES);
                } catch (IOException e) {
                    log.warn("Could not back up {}: {}", photo, e.getMessage());
                    System.out.println("      ❌ Error: backup failed");
                    return false;
                }
            }
        }
        if (metadataWriter.write(photo, point)) {
            System.out.println("      ✓ GPS and IPTC updated");
            return true;
        }
        System.out.println("      ❌ Error: metadata not written");
        return false;
    }

    private static void printSummary(SyncResult result, boolean backup, boolean dryRun) {
        System.out.println("======================================================================");
        System.out.println("📊 SUMMARY");
        System.out.println("======================================================================");
        System.out.println("Total photos:            " + result.getTotal());
        System.out.println("✅ Synced:               " + result.getSynced());
        System.out.println("⏱️  Skipped (too far):    " + result.getSkippedTooFar());
        System.out.println("⚠️  Skipped (no date):    " + result.getSkippedNoDate());
        System.out.println("❌ Errors:               " + result.getErrors());
        System.out.println();
        if (dryRun) {
            System.out.println("ℹ️  Dry-run mode: no photo was modified");
        } else {
            System.out.println("🎉 Synchronization finished!");
            if (backup) {
                System.out.println("💾 The .backup files hold the originals");
            }
        }
        System.out.println();
    }

    public static class SyncResult {
        private final int total;
        private int synced;
        private int skippedNoDate;
        private int skippedTooFar;
        private int errors;

        SyncResult(int total) {
            this.total = total;
        }

        public int getTotal() {
            return total;
        }

        public int getSynced() {
            return synced;
        }

        public int getSkippedNoDate() {
            return skippedNoDate;
        }

        public int getSkippedTooFar() {
            return skippedTooFar;
        }

        public int getErrors() {
            return errors;
        }
    }
}
