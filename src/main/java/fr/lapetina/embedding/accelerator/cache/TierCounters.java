package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Request counters shared by the tier implementations, mirrored to Micrometer when a registry is present.
 */
final class TierCounters {

    private final String tier;
    private final MetricsRegistry metrics;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    TierCounters(String tier, MetricsRegistry metrics) {
        this.tier = tier;
        this.metrics = metrics;
    }

    void hit() {
        hits.incrementAndGet();
        publish("hit");
    }

    void miss() {
        misses.incrementAndGet();
        publish("miss");
    }

    void write() {
        writes.incrementAndGet();
        publish("write");
    }

    void eviction() {
        evictions.incrementAndGet();
        publish("eviction");
    }

    void expiration() {
        expirations.incrementAndGet();
        publish("expired");
    }

    CacheStats snapshot(long sizeBytes, long entries) {
        long h = hits.get();
        long m = misses.get();
        return new CacheStats(h + m, h, m, writes.get(), evictions.get(), expirations.get(), sizeBytes, entries);
    }

    private void publish(String result) {
        if (metrics != null) {
            metrics.incrementCacheCount(tier, result);
        }
    }
}
