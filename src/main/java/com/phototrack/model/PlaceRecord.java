package com.phototrack.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Result of resolving a coordinate to a place.
 *
 * Stored as-is in the geocoding cache file. Fields the current version does not
 * know about are kept in {@link #getExtraProperties()} so they survive a
 * load/save cycle written by a newer version.
 */
@JsonPropertyOrder({"city", "state", "country", "country_code", "found", "lat", "lon", "anonymized"})
public class PlaceRecord {

    public static final String GPS_LABEL_PREFIX = "GPS ";
    public static final String UNKNOWN_COUNTRY = "Unknown";

    private String city;
    private String state = "";
    private String country = "";

    @JsonProperty("country_code")
    private String countryCode = "";

    private boolean found;
    private double lat;
    private double lon;

    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean anonymized;

    private final Map<String, Object> extraProperties = new LinkedHashMap<>();

    public PlaceRecord() {
    }

    public PlaceRecord(String city, String state, String country, String countryCode, double lat, double lon) {
        this.city = city;
        this.state = state != null ? state : "";
        this.country = country != null ? country : "";
        this.countryCode = countryCode != null ? countryCode.toUpperCase(Locale.ROOT) : "";
        this.found = city != null && !city.isBlank();
        this.lat = lat;
        this.lon = lon;
    }

    /**
     * Terminal record used when no tier produced a city: labelled with the raw coordinate.
     * State, country and code are carried over from the last provider answer when there was one.
     */
    public static PlaceRecord gpsFallback(double lat, double lon, PlaceRecord lastAttempt) {
        String label = String.format(Locale.ROOT, GPS_LABEL_PREFIX + "%.4f, %.4f", lat, lon);
        String state = "";
        String country = UNKNOWN_COUNTRY;
        String code = "";
        if (lastAttempt != null) {
            state = lastAttempt.getState();
            code = lastAttempt.getCountryCode();
            if (lastAttempt.getCountry() != null && !lastAttempt.getCountry().isBlank()) {
                country = lastAttempt.getCountry();
            }
        }
        PlaceRecord fallback = new PlaceRecord(label, state, country, code, lat, lon);
        fallback.setFound(true);
        return fallback;
    }

    @JsonIgnore
    public boolean hasCity() {
        return city != null && !city.isBlank();
    }

    @JsonIgnore
    public boolean isGpsFallback() {
        return city != null && city.startsWith(GPS_LABEL_PREFIX);
    }

    /**
     * One-time rewrite of the coordinate to a representative city centre.
     */
    public void anonymizeTo(double centreLat, double centreLon) {
        this.lat = centreLat;
        this.lon = centreLon;
        this.anonymized = true;
    }

    /**
     * "City, State, Country (CODE)", or "City, Country (CODE)" when there is no state.
     */
    @JsonIgnore
    public String toLocationLabel() {
        StringBuilder sb = new StringBuilder(city != null ? city : "");
        if (state != null && !state.isEmpty()) {
            sb.append(", ").append(state);
        }
        sb.append(", ").append(country != null ? country : "");
        sb.append(" (").append(countryCode != null ? countryCode : "").append(")");
        return sb.toString();
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public void setCountryCode(String countryCode) {
        this.countryCode = countryCode;
    }

    public boolean isFound() {
        return found;
    }

    public void setFound(boolean found) {
        this.found = found;
    }

    public double getLat() {
        return lat;
    }

    public void setLat(double lat) {
        this.lat = lat;
    }

    public double getLon() {
        return lon;
    }

    public void setLon(double lon) {
        this.lon = lon;
    }

    public boolean isAnonymized() {
        return anonymized;
    }

    public void setAnonymized(boolean anonymized) {
        this.anonymized = anonymized;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtraProperties() {
        return extraProperties;
    }

    @JsonAnySetter
    public void setExtraProperty(String name, Object value) {
        extraProperties.put(name, value);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%.4f, %.4f%s)", toLocationLabel(), lat, lon,
            anonymized ? ", anonymized" : "");
    }
}
