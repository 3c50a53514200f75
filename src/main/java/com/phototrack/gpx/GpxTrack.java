package com.phototrack.gpx;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import com.phototrack.model.TrackPoint;

public final class GpxTrack {

    private final List<TrackPoint> points;
    private final int skippedPoints;

    public GpxTrack(List<TrackPoint> points, int skippedPoints) {
        this.points = Collections.unmodifiableList(points);
        this.skippedPoints = skippedPoints;
    }

    public List<TrackPoint> getPoints() {
        return points;
    }

    public int getSkippedPoints() {
        return skippedPoints;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Instant getStart() {
        return points.stream().map(TrackPoint::getTime).min(Instant::compareTo).orElse(null);
    }

    public Instant getEnd() {
        return points.stream().map(TrackPoint::getTime).max(Instant::compareTo).orElse(null);
    }
}
