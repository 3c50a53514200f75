package com.phototrack.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A timestamped sample of a track loaded from a GPX file. Read-only for the
 * duration of a sync run.
 */
public final class TrackPoint {
    private final double lat;
    private final double lon;
    private final Instant time;
    private final Double altitude;
    private final String name;
    private final String city;
    private final String state;
    private final String country;
    private final String countryCode;

    public TrackPoint(double lat, double lon, Instant time, Double altitude, String name,
                      String city, String state, String country, String countryCode) {
        this.lat = lat;
        this.lon = lon;
        this.time = Objects.requireNonNull(time, "time");
        this.altitude = altitude;
        this.name = name;
        this.city = city;
        this.state = state;
        this.country = country;
        this.countryCode = countryCode;
    }

    public TrackPoint(double lat, double lon, Instant time) {
        this(lat, lon, time, null, null, null, null, null, null);
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    public Instant getTime() {
        return time;
    }

    public Double getAltitude() {
        return altitude;
    }

    public String getName() {
        return name;
    }

    public String getCity() {
        return city;
    }

    public String getState() {
        return state;
    }

    public String getCountry() {
        return country;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public boolean hasPlace() {
        return (city != null && !city.isEmpty()) || (country != null && !country.isEmpty());
    }

    /**
     * Place as shown to the user, e.g. "Paris, Ile-de-France, France (FR)".
     */
    public String describePlace() {
        StringBuilder sb = new StringBuilder();
        if (city != null && !city.isEmpty()) {
            sb.append(city);
        }
        if (state != null && !state.isEmpty()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(state);
        }
        if (country != null && !country.isEmpty()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(country);
            if (countryCode != null && !countryCode.isEmpty()) {
                sb.append(" (").append(countryCode).append(")");
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "TrackPoint(%.4f, %.4f, %s, %s, %s)", lat, lon, time, city, country);
    }
}
