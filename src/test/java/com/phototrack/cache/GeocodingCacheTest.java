package com.phototrack.cache;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phototrack.model.PlaceRecord;

import static org.junit.jupiter.api.Assertions.*;

public class GeocodingCacheTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Path store;

    @BeforeEach
    void setUp() {
        store = tempDir.resolve("geocoding_cache.json");
    }

    private GeocodingCache newCache() {
        return new GeocodingCache(store, 5.0, Duration.ofSeconds(2), Duration.ofSeconds(2), objectMapper);
    }

    private static PlaceRecord paris() {
        return new PlaceRecord("Paris", "Ile-de-France", "France", "fr", 48.8566, 2.3522);
    }

    @Test
    void keyUsesSixDecimals() {
        assertEquals("48.856600,2.352200", GeocodingCache.keyFor(48.8566, 2.3522));
        assertEquals("-33.868800,151.209300", GeocodingCache.keyFor(-33.8688, 151.2093));
    }

    @Test
    void findNearbyMatchesWithinRadiusOnly() {
        GeocodingCache cache = newCache();
        PlaceRecord paris = paris();
        cache.add(48.8566, 2.3522, paris);

        assertSame(paris, cache.findNearby(48.86, 2.35));
        assertSame(paris, cache.findNearby(48.9, 2.3522));
        assertNull(cache.findNearby(45.7640, 4.8357));
        assertNull(cache.findNearby(48.86, 2.35, 0.1));

        CacheStats stats = cache.getStats();
        assertEquals(2, stats.getHits());
        assertEquals(2, stats.getMisses());
        assertEquals(1, stats.getSize());
        assertEquals("Cache: 2 hits, 2 misses (rate: 50.0%)", stats.toString());
    }

    @Test
    void firstInsertedEntryWinsWhenSeveralAreInRange() {
        GeocodingCache cache = newCache();
        PlaceRecord first = new PlaceRecord("Paris", "", "France", "FR", 48.8566, 2.3522);
        PlaceRecord second = new PlaceRecord("Montmartre", "", "France", "FR", 48.8867, 2.3431);
        cache.add(48.8566, 2.3522, first);
        cache.add(48.8867, 2.3431, second);

        assertSame(first, cache.findNearby(48.8860, 2.3430));
    }

    @Test
    void addOverwritesSameKey() {
        GeocodingCache cache = newCache();
        cache.add(48.8566, 2.3522, paris());
        PlaceRecord replacement = new PlaceRecord("Paris 1er", "", "France", "FR", 48.8566, 2.3522);
        cache.add(48.8566, 2.3522, replacement);

        assertEquals(1, cache.size());
        assertSame(replacement, cache.findNearby(48.8566, 2.3522));
    }

    @Test
    void loadOfMissingStoreIsEmpty() {
        GeocodingCache cache = newCache();
        assertTrue(cache.load().isEmpty());
        assertFalse(Files.exists(store));
    }

    @Test
    void loadOfCorruptStoreIsEmpty() throws Exception {
        Files.writeString(store, "{ this is not json");
        GeocodingCache cache = newCache();
        assertTrue(cache.load().isEmpty());
    }

    @Test
    void saveThenLoadRoundTripsRecords() {
        GeocodingCache cache = newCache();
        PlaceRecord paris = paris();
        paris.anonymizeTo(48.8534, 2.3488);
        cache.add(48.8566, 2.3522, paris);
        assertTrue(cache.save());

        GeocodingCache reloaded = newCache();
        Map<String, PlaceRecord> entries = reloaded.load();
        assertEquals(1, entries.size());
        PlaceRecord restored = entries.get("48.856600,2.352200");
        assertNotNull(restored);
        assertEquals("Paris", restored.getCity());
        assertEquals("Ile-de-France", restored.getState());
        assertEquals("FR", restored.getCountryCode());
        assertTrue(restored.isFound());
        assertTrue(restored.isAnonymized());
        assertEquals(48.8534, restored.getLat(), 1e-9);
        assertEquals(2.3488, restored.getLon(), 1e-9);
    }

    @Test
    void storeUsesSnakeCaseAndOmitsFalseAnonymizedFlag() throws Exception {
        GeocodingCache cache = newCache();
        cache.add(48.8566, 2.3522, paris());
        cache.save();

        JsonNode json = objectMapper.readTree(store.toFile()).get("48.856600,2.352200");
        assertEquals("FR", json.get("country_code").asText());
        assertFalse(json.has("countryCode"));
        assertFalse(json.has("anonymized"));
        assertTrue(json.get("found").asBoolean());
    }

    @Test
    void unknownFieldsSurviveLoadAndSave() throws Exception {
        Files.writeString(store, "{\"48.856600,2.352200\": {\"city\": \"Paris\", \"state\": \"\", \"country\": \"France\","
            + " \"country_code\": \"FR\", \"found\": true, \"lat\": 48.8566, \"lon\": 2.3522, \"postcode\": \"75001\"}}");
        GeocodingCache cache = newCache();
        cache.load();
        cache.add(45.7640, 4.8357, new PlaceRecord("Lyon", "", "France", "FR", 45.7640, 4.8357));
        assertTrue(cache.save());

        JsonNode json = objectMapper.readTree(store.toFile());
        assertEquals("75001", json.get("48.856600,2.352200").get("postcode").asText());
        assertTrue(json.has("45.764000,4.835700"));
    }

    @Test
    void saveMergesEntriesWrittenByAnotherInstance() {
        GeocodingCache first = newCache();
        GeocodingCache second = newCache();
        first.load();
        second.load();

        first.add(48.8566, 2.3522, paris());
        second.add(45.7640, 4.8357, new PlaceRecord("Lyon", "", "France", "FR", 45.7640, 4.8357));
        assertTrue(first.save());
        assertTrue(second.save());

        Map<String, PlaceRecord> merged = newCache().load();
        assertEquals(2, merged.size());
        assertTrue(merged.containsKey("48.856600,2.352200"));
        assertTrue(merged.containsKey("45.764000,4.835700"));
        assertEquals(2, second.size());
    }

    @Test
    void inMemoryEntryWinsOnKeyCollision() {
        GeocodingCache first = newCache();
        first.add(48.8566, 2.3522, paris());
        first.save();

        GeocodingCache second = newCache();
        PlaceRecord renamed = new PlaceRecord("Paris Centre", "", "France", "FR", 48.8566, 2.3522);
        second.add(48.8566, 2.3522, renamed);
        second.save();

        assertEquals("Paris Centre", newCache().load().get("48.856600,2.352200").getCity());
    }

    @Test
    void updatePersistsAnonymizationOfHeldRecord() {
        GeocodingCache cache = newCache();
        cache.add(48.8566, 2.3522, paris());
        cache.save();

        GeocodingCache next = newCache();
        next.load();
        PlaceRecord hit = next.findNearby(48.857, 2.352);
        hit.anonymizeTo(48.8534, 2.3488);
        assertTrue(next.update(hit));
        next.save();

        PlaceRecord reloaded = newCache().load().get("48.856600,2.352200");
        assertTrue(reloaded.isAnonymized());
        assertEquals(48.8534, reloaded.getLat(), 1e-9);
    }

    @Test
    void updateOfUnknownRecordAddsIt() {
        GeocodingCache cache = newCache();
        PlaceRecord lyon = new PlaceRecord("Lyon", "", "France", "FR", 45.7640, 4.8357);
        assertFalse(cache.update(lyon));
        assertSame(lyon, cache.findNearby(45.7640, 4.8357));
    }

    @Test
    void saveGivesUpWhenLockIsHeldElsewhere() throws Exception {
        GeocodingCache cache = new GeocodingCache(store, 5.0, Duration.ofMillis(300), Duration.ofMillis(300), objectMapper);
        cache.add(48.8566, 2.3522, paris());

        try (FileScopedLock holder = new FileScopedLock(tempDir.resolve("geocoding_cache.json.lock"))) {
            assertTrue(holder.acquire(Duration.ofSeconds(1)));
            assertFalse(cache.save());
            assertFalse(Files.exists(store));
        }
        assertTrue(cache.save());
        assertTrue(Files.exists(store));
    }

    @Test
    void loadReadsWithoutLockWhenLockIsHeldElsewhere() throws Exception {
        GeocodingCache writer = newCache();
        writer.add(48.8566, 2.3522, paris());
        writer.save();

        GeocodingCache reader = new GeocodingCache(store, 5.0, Duration.ofMillis(200), Duration.ofMillis(200), objectMapper);
        try (FileScopedLock holder = new FileScopedLock(tempDir.resolve("geocoding_cache.json.lock"))) {
            assertTrue(holder.acquire(Duration.ofSeconds(1)));
            assertEquals(1, reader.load().size());
        }
    }

    @Test
    void saveLeavesNoTemporaryFiles() throws Exception {
        GeocodingCache cache = newCache();
        cache.add(48.8566, 2.3522, paris());
        cache.save();

        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }
}
