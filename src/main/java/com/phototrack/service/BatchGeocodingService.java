package com.phototrack.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.phototrack.cache.GeocodingCache;
import com.phototrack.model.CoordinateRequest;
import com.phototrack.model.PlaceRecord;

/**
 * Resolves many coordinates with as few provider calls as possible.
 *
 * Coordinates are taken in input order. Each resolved miss goes into the cache
 * before the next coordinate is looked up, so nearby coordinates later in the
 * same batch are served from the cache.
 */
@Service
public class BatchGeocodingService {

    private static final Logger log = LoggerFactory.getLogger(BatchGeocodingService.class);

    private final GeocodingCache cache;
    private final ReverseGeocoder reverseGeocoder;

    public BatchGeocodingService(GeocodingCache cache, ReverseGeocoder reverseGeocoder) {
        this.cache = cache;
        this.reverseGeocoder = reverseGeocoder;
    }

    public BatchResult resolveBatch(List<CoordinateRequest> requests, boolean anonymize) {
        Map<Integer, PlaceRecord> places = new LinkedHashMap<>();
        int cacheHits = 0;
        int resolved = 0;

        for (CoordinateRequest request : requests) {
            PlaceRecord cached = cache.findNearby(request.getLat(), request.getLon());
            if (cached != null) {
                cacheHits++;
                if (anonymize && !cached.isAnonymized() && cached.hasCity() && !cached.isGpsFallback()
                        && reverseGeocoder.anonymize(cached)) {
                    cache.update(cached);
                }
                places.put(request.getIndex(), cached);
                continue;
            }

            PlaceRecord record = reverseGeocoder.resolve(request.getLat(), request.getLon(), anonymize);
            cache.add(request.getLat(), request.getLon(), record);
            places.put(request.getIndex(), record);
            resolved++;
        }

        log.info("Batch of {} coordinates: {} from cache, {} resolved", requests.size(), cacheHits, resolved);
        return new BatchResult(places, cacheHits, resolved);
    }

    public static class BatchResult {
        private final Map<Integer, PlaceRecord> places;
        private final int cacheHits;
        private final int networkResolutions;

        public BatchResult(Map<Integer, PlaceRecord> places, int cacheHits, int networkResolutions) {
            this.places = Collections.unmodifiableMap(places);
            this.cacheHits = cacheHits;
            this.networkResolutions = networkResolutions;
        }

        public Map<Integer, PlaceRecord> getPlaces() {
            return places;
        }

        public PlaceRecord get(int index) {
            return places.get(index);
        }

        public int getCacheHits() {
            return cacheHits;
        }

        public int getNetworkResolutions() {
            return networkResolutions;
        }
    }
}
