package com.phototrack.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.phototrack.exception.GeocodingException;
import com.phototrack.model.GeoPoint;
import com.phototrack.model.PlaceRecord;

/**
 * Scripted provider: answers per zoom level and per search query, and records every call.
 */
class FakeGeocodingProvider implements GeocodingProvider {

    private final Map<Integer, PlaceRecord> answersByZoom = new HashMap<>();
    private final Map<Integer, RuntimeException> failuresByZoom = new HashMap<>();
    private final Map<String, GeoPoint> cityCentres = new HashMap<>();
    private PlaceRecord defaultAnswer;
    private boolean searchFails;

    final List<Integer> reverseZooms = new ArrayList<>();
    final List<String> searchQueries = new ArrayList<>();

    FakeGeocodingProvider answer(int zoom, String city, String state, String country, String code) {
        answersByZoom.put(zoom, new PlaceRecord(city, state, country, code, 0, 0));
        return this;
    }

    FakeGeocodingProvider answerEverywhere(String city, String state, String country, String code) {
        defaultAnswer = new PlaceRecord(city, state, country, code, 0, 0);
        return this;
    }

    FakeGeocodingProvider fail(int zoom) {
        failuresByZoom.put(zoom, new GeocodingException("HTTP 503 from /reverse"));
        return this;
    }

    FakeGeocodingProvider cityCentre(String query, double lat, double lon) {
        cityCentres.put(query, new GeoPoint(lat, lon));
        return this;
    }

    FakeGeocodingProvider searchFails() {
        searchFails = true;
        return this;
    }

    int reverseCalls() {
        return reverseZooms.size();
    }

    int searchCalls() {
        return searchQueries.size();
    }

    @Override
    public PlaceRecord reverse(double lat, double lon, int zoom) {
        reverseZooms.add(zoom);
        RuntimeException failure = failuresByZoom.get(zoom);
        if (failure != null) {
            throw failure;
        }
        PlaceRecord template = answersByZoom.getOrDefault(zoom, defaultAnswer);
        if (template == null) {
            return new PlaceRecord(null, "", "", "", lat, lon);
        }
        return new PlaceRecord(template.getCity(), template.getState(), template.getCountry(),
            template.getCountryCode(), lat, lon);
    }

    @Override
    public Optional<GeoPoint> search(String query) {
        searchQueries.add(query);
        if (searchFails) {
            throw new GeocodingException("Request to /search failed: timeout");
        }
        return Optional.ofNullable(cityCentres.get(query));
    }
}
