package com.phototrack.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.phototrack.model.MatchResult;
import com.phototrack.model.TrackPoint;

/**
 * Pairs a capture time with the nearest-in-time track point. Stateless.
 */
public class TrackMatcher {

    private final long defaultToleranceSeconds;

    public TrackMatcher(long defaultToleranceSeconds) {
        this.defaultToleranceSeconds = defaultToleranceSeconds;
    }

    public MatchResult closest(Instant photoTime, List<TrackPoint> points) {
        return closest(photoTime, points, defaultToleranceSeconds);
    }

    /**
     * Linear scan; on equal deltas the earlier point in the list wins.
     * The delta is reported even when it exceeds the tolerance.
     */
    public MatchResult closest(Instant photoTime, List<TrackPoint> points, long toleranceSeconds) {
        TrackPoint best = null;
        double bestDelta = Double.POSITIVE_INFINITY;
        for (TrackPoint point : points) {
            double delta = secondsBetween(photoTime, point.getTime());
            if (delta < bestDelta) {
                bestDelta = delta;
                best = point;
            }
        }
        if (best == null || bestDelta > toleranceSeconds) {
            return MatchResult.noMatch(bestDelta);
        }
        return MatchResult.matched(best, bestDelta);
    }

    public long getDefaultToleranceSeconds() {
        return defaultToleranceSeconds;
    }

    private static double secondsBetween(Instant a, Instant b) {
        Duration d = Duration.between(a, b).abs();
        return d.getSeconds() + d.getNano() / 1_000_000_000.0;
    }
}
