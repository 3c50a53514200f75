package com.phototrack.model;

import java.time.Instant;

/**
 * A photo joined with its resolved place, ready to become a GPX track point.
 */
public final class GeotaggedPhoto {
    private final String fileName;
    private final Instant capturedAt;
    private final double lat;
    private final double lon;
    private final Double altitude;
    private final PlaceRecord place;

    public GeotaggedPhoto(String fileName, Instant capturedAt, double lat, double lon, Double altitude, PlaceRecord place) {
        this.fileName = fileName;
        this.capturedAt = capturedAt;
        this.lat = lat;
        this.lon = lon;
        this.altitude = altitude;
        this.place = place;
    }

    public String getFileName() {
        return fileName;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public Double getAltitude() {
        return altitude;
    }

    public PlaceRecord getPlace() {
        return place;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }
}
