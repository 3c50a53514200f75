package com.phototrack.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.phototrack.model.GeoPoint;
import com.phototrack.model.PlaceRecord;

/**
 * Cascading reverse geocoder.
 *
 * Tries street, region and country zoom in turn and stops at the first answer
 * that names a place. When none does, the coordinate itself becomes the label,
 * so {@link #resolve} always returns a usable record and never throws. Every
 * network call, the anonymization lookup included, passes through the throttle.
 */
@Service
public class ReverseGeocoder {

    private static final Logger log = LoggerFactory.getLogger(ReverseGeocoder.class);

    public enum Tier {
        STREET(18),
        REGION(12),
        COUNTRY(5);

        private final int zoom;

        Tier(int zoom) {
            this.zoom = zoom;
        }

        public int getZoom() {
            return zoom;
        }
    }

    public static class ResolverStats {
        private final Map<Tier, Integer> tierSuccesses;
        private final int fallbacks;
        private final int anonymized;
        private final int anonymizationFailures;

        private ResolverStats(Map<Tier, Integer> tierSuccesses, int fallbacks, int anonymized, int anonymizationFailures) {
            this.tierSuccesses = new EnumMap<>(tierSuccesses);
            this.fallbacks = fallbacks;
            this.anonymized = anonymized;
            this.anonymizationFailures = anonymizationFailures;
        }

        public int getTierSuccesses(Tier tier) {
            return tierSuccesses.getOrDefault(tier, 0);
        }

        public int getFallbacks() {
            return fallbacks;
        }

        public int getAnonymized() {
            return anonymized;
        }

        public int getAnonymizationFailures() {
            return anonymizationFailures;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "Resolver: street %d, region %d, country %d, GPS fallback %d, anonymized %d (failed %d)",
                getTierSuccesses(Tier.STREET), getTierSuccesses(Tier.REGION), getTierSuccesses(Tier.COUNTRY),
                fallbacks, anonymized, anonymizationFailures);
        }
    }

    private final GeocodingProvider provider;
    private final RequestThrottle throttle;

    private final Map<Tier, Integer> tierSuccesses = new EnumMap<>(Tier.class);
    private int fallbacks;
    private int anonymized;
    private int anonymizationFailures;

    public ReverseGeocoder(GeocodingProvider provider, RequestThrottle throttle) {
        this.provider = provider;
        this.throttle = throttle;
    }

    public PlaceRecord resolve(double lat, double lon, boolean anonymize) {
        PlaceRecord lastAnswer = null;
        for (Tier tier : Tier.values()) {
            if (tier != Tier.STREET) {
                log.info("   → Retry at {} zoom ({}) for {}", tier.name().toLowerCase(Locale.ROOT), tier.getZoom(), coordinate(lat, lon));
            }
            Optional<PlaceRecord> answer = queryTier(lat, lon, tier);
            if (answer.isEmpty()) {
                continue;
            }
            PlaceRecord record = answer.get();
            if (record.hasCity()) {
                tierSuccesses.merge(tier, 1, Integer::sum);
                if (anonymize) {
                    anonymize(record);
                }
                return record;
            }
            lastAnswer = record;
        }

        fallbacks++;
        PlaceRecord fallback = PlaceRecord.gpsFallback(lat, lon, lastAnswer);
        log.info("   → GPS fallback for {}", coordinate(lat, lon));
        return fallback;
    }

    /**
     * Replaces the record's coordinate with the centre of its city. Best effort:
     * when the lookup fails the record is left as it was.
     *
     * @return true when the record is (now) anonymized
     */
    public boolean anonymize(PlaceRecord record) {
        if (record.isAnonymized()) {
            return true;
        }
        if (!record.hasCity() || record.isGpsFallback()) {
            return false;
        }
        String query = cityQuery(record);
        Optional<GeoPoint> centre;
        throttle.awaitTurn();
        try {
            centre = provider.search(query);
        } catch (RuntimeException e) {
            log.warn("City centre lookup failed for '{}': {}", query, e.getMessage());
            centre = Optional.empty();
        } finally {
            throttle.requestFinished();
        }

        if (centre.isEmpty()) {
            anonymizationFailures++;
            log.info("   → Anonymizing {} ❌", query);
            return false;
        }
        record.anonymizeTo(centre.get().getLat(), centre.get().getLon());
        anonymized++;
        log.info("   → Anonymizing {} ✓", query);
        return true;
    }

    public ResolverStats getStats() {
        return new ResolverStats(tierSuccesses, fallbacks, anonymized, anonymizationFailures);
    }

    private Optional<PlaceRecord> queryTier(double lat, double lon, Tier tier) {
        throttle.awaitTurn();
        try {
            return Optional.ofNullable(provider.reverse(lat, lon, tier.getZoom()));
        } catch (RuntimeException e) {
            log.warn("Reverse geocoding failed at {} tier for {}: {}", tier.name().toLowerCase(Locale.ROOT),
                coordinate(lat, lon), e.getMessage());
            return Optional.empty();
        } finally {
            throttle.requestFinished();
        }
    }

    static String cityQuery(PlaceRecord record) {
        List<String> parts = new ArrayList<>();
        parts.add(record.getCity());
        if (record.getState() != null && !record.getState().isBlank()) {
            parts.add(record.getState());
        }
        if (record.getCountry() != null && !record.getCountry().isBlank()) {
            parts.add(record.getCountry());
        }
        return String.join(", ", parts);
    }

    private static String coordinate(double lat, double lon) {
        return String.format(Locale.ROOT, "%.4f, %.4f", lat, lon);
    }
}
