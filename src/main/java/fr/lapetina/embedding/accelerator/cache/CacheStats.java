package fr.lapetina.embedding.accelerator.cache;

/**
 * Per-tier counters at a point in time.
 */
public record CacheStats(
        long requests,
        long hits,
        long misses,
        long writes,
        long evictions,
        long expirations,
        long sizeBytes,
        long entries
) {

    public double hitRate() {
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
