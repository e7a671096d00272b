package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.domain.model.CacheEntry;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * In-process tier with strict LRU eviction, bounded by entry count and by the
 * total size of the stored vectors.
 */
public final class MemoryCacheTier implements CacheTier {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheTier.class);

    public static final String DEFAULT_NAME = "memory";

    private final String name;
    private final int maxEntries;
    private final long maxBytes;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();
    // access order: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final TierCounters counters;
    private long sizeBytes;

    public MemoryCacheTier(String name, int maxEntries, long maxBytes, MetricsRegistry metrics, LongSupplier clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive: " + maxEntries);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Max bytes must be positive: " + maxBytes);
        }
        this.name = Objects.requireNonNull(name, "Name is required");
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.counters = new TierCounters(name, metrics);
    }

    public MemoryCacheTier(String name, int maxEntries, long maxBytes, MetricsRegistry metrics) {
        this(name, maxEntries, maxBytes, metrics, System::currentTimeMillis);
    }

    public MemoryCacheTier(int maxEntries, long maxBytes) {
        this(DEFAULT_NAME, maxEntries, maxBytes, null);
    }

    public MemoryCacheTier(int maxEntries) {
        this(maxEntries, Long.MAX_VALUE);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CacheEntry> lookup(String key) {
        Objects.requireNonNull(key, "Key is required");
        long now = clock.getAsLong();
        CacheEntry entry;
        boolean expired = false;
        lock.lock();
        try {
            entry = entries.get(key);
            if (entry != null && entry.isExpired(now)) {
                entries.remove(key);
                sizeBytes -= entry.sizeBytes();
                entry = null;
                expired = true;
            } else if (entry != null) {
                entries.put(key, entry.touch(now));
            }
        } finally {
            lock.unlock();
        }
        if (expired) {
            counters.expiration();
            log.debug("Expired entry dropped on read: tier={}, key={}", name, key);
        }
        if (entry == null) {
            counters.miss();
            return Optional.empty();
        }
        counters.hit();
        return Optional.of(new CacheEntry(key, entry.value().clone(), entry.sizeBytes(), now, entry.expiresAt()));
    }

    @Override
    public void set(String key, float[] value, long expiresAt) {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(value, "Value is required");
        CacheEntry entry = CacheEntry.of(key, value.clone(), clock.getAsLong(), expiresAt);
        lock.lock();
        try {
            CacheEntry previous = entries.remove(key);
            if (previous != null) {
                sizeBytes -= previous.sizeBytes();
            }
            if (entry.sizeBytes() > maxBytes) {
                log.warn("Entry larger than tier bound, not stored: tier={}, key={}, bytes={}, maxBytes={}",
                        name, key, entry.sizeBytes(), maxBytes);
                return;
            }
            while (!entries.isEmpty()
                    && (entries.size() >= maxEntries || sizeBytes + entry.sizeBytes() > maxBytes)) {
                evictEldest();
            }
            entries.put(key, entry);
            sizeBytes += entry.sizeBytes();
        } finally {
            lock.unlock();
        }
        counters.write();
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        Map.Entry<String, CacheEntry> eldest = it.next();
        it.remove();
        sizeBytes -= eldest.getValue().sizeBytes();
        counters.eviction();
        log.debug("Evicted LRU entry: tier={}, key={}", name, eldest.getKey());
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            CacheEntry removed = entries.remove(key);
            if (removed == null) {
                return false;
            }
            sizeBytes -= removed.sizeBytes();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            sizeBytes = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purgeExpired() {
        long now = clock.getAsLong();
        int removed = 0;
        lock.lock();
        try {
            // values() iteration does not reorder an access-ordered map
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next();
                if (entry.isExpired(now)) {
                    it.remove();
                    sizeBytes -= entry.sizeBytes();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        for (int i = 0; i < removed; i++) {
            counters.expiration();
        }
        if (removed > 0) {
            log.debug("Purged expired entries: tier={}, count={}", name, removed);
        }
        return removed;
    }

    @Override
    public boolean contains(String key) {
        lock.lock();
        try {
            // containsKey does not count as an access
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return counters.snapshot(sizeBytes, entries.size());
        } finally {
            lock.unlock();
        }
    }
}
