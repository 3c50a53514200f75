package com.phototrack.model;

import java.util.Locale;

/**
 * One coordinate submitted for batch geocoding, tagged with the caller's index.
 */
public final class CoordinateRequest {
    private final int index;
    private final double lat;
    private final double lon;

    public CoordinateRequest(int index, double lat, double lon) {
        this.index = index;
        this.lat = lat;
        this.lon = lon;
    }

    public int getIndex() {
        return index;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "#%d (%.4f, %.4f)", index, lat, lon);
    }
}
