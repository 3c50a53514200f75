package com.phototrack.cache;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phototrack.model.PlaceRecord;
import com.phototrack.util.GeoMath;

/**
 * Persistent coordinate -> place cache with radius lookup.
 *
 * Keys are the query coordinate formatted to 6 decimals. Lookup never matches
 * keys exactly: the first entry (in insertion order) within the radius wins.
 * Entries are never removed.
 *
 * Several processes may share the store file. {@link #save()} re-reads the file
 * under an exclusive lock and writes the in-memory entries on top, so additions
 * made by another process since our {@link #load()} are kept.
 */
public class GeocodingCache {

    private static final Logger log = LoggerFactory.getLogger(GeocodingCache.class);
    private static final TypeReference<LinkedHashMap<String, PlaceRecord>> STORE_TYPE = new TypeReference<>() {
    };

    private final Path storeFile;
    private final Path lockFile;
    private final double defaultRadiusKm;
    private final Duration loadLockTimeout;
    private final Duration saveLockTimeout;
    private final ObjectMapper objectMapper;

    private Map<String, PlaceRecord> entries = new LinkedHashMap<>();
    private int hits;
    private int misses;

    public GeocodingCache(Path storeFile, double defaultRadiusKm, Duration loadLockTimeout,
                          Duration saveLockTimeout, ObjectMapper objectMapper) {
        this.storeFile = storeFile;
        this.lockFile = storeFile.resolveSibling(storeFile.getFileName() + ".lock");
        this.defaultRadiusKm = defaultRadiusKm;
        this.loadLockTimeout = loadLockTimeout;
        this.saveLockTimeout = saveLockTimeout;
        this.objectMapper = objectMapper;
    }

    public static String keyFor(double lat, double lon) {
        return String.format(Locale.ROOT, "%.6f,%.6f", lat, lon);
    }

    /**
     * Reads the store. Never fails: a missing or unreadable store yields an empty map.
     * If the lock cannot be had in time the file is read anyway, accepting a possibly stale view.
     */
    public Map<String, PlaceRecord> load() {
        Map<String, PlaceRecord> loaded;
        try (ScopedLock lock = new FileScopedLock(lockFile)) {
            if (!lock.acquire(loadLockTimeout)) {
                log.warn("Could not acquire cache lock, reading {} without it", storeFile);
            }
            loaded = readStore();
        }
        // anything added before load() stays on top
        loaded.putAll(entries);
        entries = loaded;
        log.info("Cache loaded: {} entries from {}", entries.size(), storeFile);
        return Collections.unmodifiableMap(entries);
    }

    public PlaceRecord findNearby(double lat, double lon) {
        return findNearby(lat, lon, defaultRadiusKm);
    }

    public PlaceRecord findNearby(double lat, double lon, double radiusKm) {
        for (Map.Entry<String, PlaceRecord> entry : entries.entrySet()) {
            double[] keyCoordinate = parseKey(entry.getKey());
            if (keyCoordinate == null) {
                continue;
            }
            if (GeoMath.haversineKm(lat, lon, keyCoordinate[0], keyCoordinate[1]) <= radiusKm) {
                hits++;
                return entry.getValue();
            }
        }
        misses++;
        return null;
    }

    public void add(double lat, double lon, PlaceRecord record) {
        entries.put(keyFor(lat, lon), record);
    }

    /**
     * Records a rewrite (anonymization) of a record obtained from {@link #findNearby}.
     * Held records are persisted by reference on the next save; a record this cache
     * does not hold is added under its own coordinate.
     *
     * @return true when the record was already held
     */
    public boolean update(PlaceRecord record) {
        for (PlaceRecord held : entries.values()) {
            if (held == record) {
                return true;
            }
        }
        add(record.getLat(), record.getLon(), record);
        return false;
    }

    /**
     * Read-merge-write under the exclusive lock. Abandons the write with a warning
     * when the lock is not obtained in time; the store is never truncated without the lock.
     *
     * @return true when the store was written
     */
    public boolean save() {
        try (ScopedLock lock = new FileScopedLock(lockFile)) {
            if (!lock.acquire(saveLockTimeout)) {
                log.warn("Could not acquire lock for saving cache, {} entries not written", entries.size());
                return false;
            }
            Map<String, PlaceRecord> merged = readStore();
            merged.putAll(entries);
            try {
                writeAtomically(merged);
            } catch (IOException e) {
                log.warn("Cache saving error for {}: {}", storeFile, e.getMessage());
                return false;
            }
            entries = merged;
            log.info("Cache saved: {} entries to {}", merged.size(), storeFile);
            return true;
        }
    }

    public int size() {
        return entries.size();
    }

    public CacheStats getStats() {
        return new CacheStats(hits, misses, entries.size());
    }

    public Path getStoreFile() {
        return storeFile;
    }

    private Map<String, PlaceRecord> readStore() {
        if (!Files.exists(storeFile)) {
            return new LinkedHashMap<>();
        }
        try {
            if (Files.size(storeFile) == 0) {
                return new LinkedHashMap<>();
            }
            LinkedHashMap<String, PlaceRecord> data = objectMapper.readValue(storeFile.toFile(), STORE_TYPE);
            return data != null ? data : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.warn("Cache file {} corrupted, starting fresh: {}", storeFile, e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("Cache loading error for {}: {}", storeFile, e.getMessage());
        }
        return new LinkedHashMap<>();
    }

    private void writeAtomically(Map<String, PlaceRecord> data) throws IOException {
        Path dir = storeFile.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, storeFile.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), data);
            try {
                Files.move(tmp, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, storeFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static double[] parseKey(String key) {
        int comma = key.indexOf(',');
        if (comma < 0) {
            return null;
        }
        try {
            return new double[]{
                Double.parseDouble(key.substring(0, comma).trim()),
                Double.parseDouble(key.substring(comma + 1).trim())
            };
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
