package com.phototrack.cache;

import java.util.Locale;

public final class CacheStats {
    private final int hits;
    private final int misses;
    private final int size;

    public CacheStats(int hits, int misses, int size) {
        this.hits = hits;
        this.misses = misses;
        this.size = size;
    }

    public int getHits() {
        return hits;
    }

    public int getMisses() {
        return misses;
    }

    public int getSize() {
        return size;
    }

    public double hitRate() {
        int total = hits + misses;
        return total > 0 ? hits * 100.0 / total : 0.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Cache: %d hits, %d misses (rate: %.1f%%)", hits, misses, hitRate());
    }
}
