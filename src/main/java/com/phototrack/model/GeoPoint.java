package com.phototrack.model;

import java.util.Locale;

public final class GeoPoint {
    private final double lat;
    private final double lon;

    public GeoPoint(double lat, double lon) {
        this.lat = lat;
        this.lon = lon;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.6f, %.6f", lat, lon);
    }
}
