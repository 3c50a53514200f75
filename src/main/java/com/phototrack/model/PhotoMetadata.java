package com.phototrack.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * What the extraction collaborator could read from a photo. Any field may be
 * missing; a photo without GPS is still reported so it can be counted.
 */
public final class PhotoMetadata {
    private final Path path;
    private final Double latitude;
    private final Double longitude;
    private final Double altitude;
    private final Instant capturedAt;

    public PhotoMetadata(Path path, Double latitude, Double longitude, Double altitude, Instant capturedAt) {
        this.path = path;
        this.latitude = latitude;
        this.longitude = longitude;
        this.altitude = altitude;
        this.capturedAt = capturedAt;
    }

    public Path getPath() {
        return path;
    }

    public String getFileName() {
        return path.getFileName().toString();
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public Double getAltitude() {
        return altitude;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public boolean hasGps() {
        return latitude != null && longitude != null;
    }
}
