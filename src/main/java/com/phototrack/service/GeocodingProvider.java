package com.phototrack.service;

import java.util.Optional;

import com.phototrack.exception.GeocodingException;
import com.phototrack.model.GeoPoint;
import com.phototrack.model.PlaceRecord;

/**
 * Upstream geocoding service. Each method is one network request.
 */
public interface GeocodingProvider {

    /**
     * Reverse lookup at the given zoom. The returned record carries the query
     * coordinate; its city may be null when the provider knows no place name at that zoom.
     *
     * @throws GeocodingException on timeout, non-2xx status or unreadable payload
     */
    PlaceRecord reverse(double lat, double lon, int zoom);

    /**
     * Forward lookup of a free-text place query; empty when nothing matched.
     *
     * @throws GeocodingException on timeout, non-2xx status or unreadable payload
     */
    Optional<GeoPoint> search(String query);
}
