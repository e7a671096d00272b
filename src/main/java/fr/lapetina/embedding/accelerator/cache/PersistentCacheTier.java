package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.domain.exception.StorageUnavailableException;
import fr.lapetina.embedding.accelerator.domain.model.CacheEntry;
import fr.lapetina.embedding.accelerator.domain.model.ErrorType;
import fr.lapetina.embedding.accelerator.domain.port.PersistentStore;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Tier over a {@link PersistentStore}, bounded by total stored bytes.
 *
 * Storage failures never reach the caller: a failed read counts as a miss and
 * a failed write is logged and skipped. Expired entries are removed when read.
 */
public final class PersistentCacheTier implements CacheTier, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PersistentCacheTier.class);

    public static final String DEFAULT_NAME = "disk";

    private final String name;
    private final PersistentStore store;
    private final long maxBytes;
    private final MetricsRegistry metrics;
    private final LongSupplier clock;
    private final TierCounters counters;
    private final ReentrantLock lock = new ReentrantLock();

    public PersistentCacheTier(String name, PersistentStore store, long maxBytes, MetricsRegistry metrics,
                               LongSupplier clock) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Max bytes must be positive: " + maxBytes);
        }
        this.name = Objects.requireNonNull(name, "Name is required");
        this.store = Objects.requireNonNull(store, "Store is required");
        this.maxBytes = maxBytes;
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.counters = new TierCounters(name, metrics);
    }

    public PersistentCacheTier(String name, PersistentStore store, long maxBytes, MetricsRegistry metrics) {
        this(name, store, maxBytes, metrics, System::currentTimeMillis);
    }

    public PersistentCacheTier(PersistentStore store, long maxBytes) {
        this(DEFAULT_NAME, store, maxBytes, null);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CacheEntry> lookup(String key) {
        Objects.requireNonNull(key, "Key is required");
        CacheEntry entry;
        boolean expired = false;
        lock.lock();
        try {
            Optional<byte[]> blob = store.read(key);
            if (blob.isEmpty()) {
                entry = null;
            } else {
                long now = clock.getAsLong();
                VectorCodec.Decoded decoded = VectorCodec.decodeEntry(blob.get());
                entry = new CacheEntry(key, decoded.vector(), blob.get().length, now, decoded.expiresAt());
                // removed under the lock so a concurrent rewrite is never lost
                if (entry.isExpired(now)) {
                    store.delete(key);
                    entry = null;
                    expired = true;
                }
            }
        } catch (StorageUnavailableException e) {
            storageFailure("decode", key, e);
            entry = null;
        } catch (IOException | RuntimeException e) {
            storageFailure("read", key, e);
            entry = null;
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
        return Optional.of(entry);
    }

    @Override
    public void set(String key, float[] value, long expiresAt) {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(value, "Value is required");
        byte[] blob = VectorCodec.encode(value, expiresAt);
        if (blob.length > maxBytes) {
            log.warn("Entry larger than tier bound, not stored: tier={}, key={}, bytes={}, maxBytes={}",
                    name, key, blob.length, maxBytes);
            return;
        }
        lock.lock();
        try {
            // the blob being replaced is freed by the write itself
            while (store.sizeBytes() - store.sizeOf(key) + blob.length > maxBytes) {
                long freed = store.evictOne();
                if (freed <= 0) {
                    log.warn("Cannot free space, entry not stored: tier={}, key={}, bytes={}, storedBytes={}, maxBytes={}",
                            name, key, blob.length, store.sizeBytes(), maxBytes);
                    return;
                }
                counters.eviction();
            }
            store.write(key, blob);
            counters.write();
        } catch (IOException | RuntimeException e) {
            storageFailure("write", key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(String key) {
        lock.lock();
        try {
            // encoded blobs are never empty
            return store.sizeOf(key) > 0;
        } catch (RuntimeException e) {
            storageFailure("lookup", key, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            return store.delete(key);
        } catch (IOException | RuntimeException e) {
            storageFailure("delete", key, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            store.clear();
        } catch (IOException | RuntimeException e) {
            storageFailure("clear", "*", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return counters.snapshot(store.sizeBytes(), store.entryCount());
        } finally {
            lock.unlock();
        }
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    private void storageFailure(String operation, String key, Exception e) {
        log.warn("Storage {} failed, continuing without tier: tier={}, key={}, error={}",
                operation, name, key, e.getMessage());
        if (metrics != null) {
            metrics.incrementErrorCount("cache_" + name, ErrorType.STORAGE_UNAVAILABLE);
        }
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
