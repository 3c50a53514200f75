package com.phototrack.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PlaceRecordTest {

    @Test
    void countryCodeIsUpperCasedAndFoundFollowsCity() {
        PlaceRecord paris = new PlaceRecord("Paris", "Ile-de-France", "France", "fr", 48.8566, 2.3522);
        PlaceRecord nowhere = new PlaceRecord(null, "", "", "", 0.0, 0.0);

        assertEquals("FR", paris.getCountryCode());
        assertTrue(paris.isFound());
        assertFalse(nowhere.isFound());
        assertFalse(nowhere.hasCity());
    }

    @Test
    void locationLabelSkipsEmptyState() {
        assertEquals("Paris, Ile-de-France, France (FR)",
            new PlaceRecord("Paris", "Ile-de-France", "France", "FR", 0, 0).toLocationLabel());
        assertEquals("Monaco, Monaco (MC)",
            new PlaceRecord("Monaco", "", "Monaco", "MC", 0, 0).toLocationLabel());
    }

    @Test
    void gpsFallbackUsesFourDecimals() {
        PlaceRecord fallback = PlaceRecord.gpsFallback(1.23456789, -98.7654321, null);

        assertEquals("GPS 1.2346, -98.7654", fallback.getCity());
        assertEquals("Unknown", fallback.getCountry());
        assertTrue(fallback.isFound());
        assertTrue(fallback.isGpsFallback());
        assertFalse(fallback.isAnonymized());
        assertEquals(1.23456789, fallback.getLat(), 1e-12);
    }

    @Test
    void gpsFallbackKeepsRegionFromLastAnswer() {
        PlaceRecord last = new PlaceRecord("", "Svalbard", "", "sj", 78.2, 15.6);

        PlaceRecord fallback = PlaceRecord.gpsFallback(78.2, 15.6, last);

        assertEquals("Svalbard", fallback.getState());
        assertEquals("Unknown", fallback.getCountry());
        assertEquals("SJ", fallback.getCountryCode());
    }

    @Test
    void anonymizeRewritesCoordinates() {
        PlaceRecord record = new PlaceRecord("Lyon", "", "France", "FR", 45.75, 4.85);

        record.anonymizeTo(45.7640, 4.8357);

        assertTrue(record.isAnonymized());
        assertEquals(45.7640, record.getLat(), 1e-12);
        assertEquals(4.8357, record.getLon(), 1e-12);
    }
}
