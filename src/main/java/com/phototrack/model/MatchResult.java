package com.phototrack.model;

import java.util.Locale;

/**
 * Outcome of pairing a photo time with a track. The delta is reported even when
 * nothing matched, so callers can say how far off the closest point was.
 */
public final class MatchResult {
    private final TrackPoint point;
    private final double deltaSeconds;

    private MatchResult(TrackPoint point, double deltaSeconds) {
        this.point = point;
        this.deltaSeconds = deltaSeconds;
    }

    public static MatchResult matched(TrackPoint point, double deltaSeconds) {
        return new MatchResult(point, deltaSeconds);
    }

    public static MatchResult noMatch(double deltaSeconds) {
        return new MatchResult(null, deltaSeconds);
    }

    public boolean isMatched() {
        return point != null;
    }

    public TrackPoint getPoint() {
        return point;
    }

    public double getDeltaSeconds() {
        return deltaSeconds;
    }

    @Override
    public String toString() {
        if (isMatched()) {
            return String.format(Locale.ROOT, "match %s (delta %.0fs)", point, deltaSeconds);
        }
        return String.format(Locale.ROOT, "no match (closest delta %.0fs)", deltaSeconds);
    }
}
