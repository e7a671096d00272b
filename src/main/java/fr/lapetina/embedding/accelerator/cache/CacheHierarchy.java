package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.domain.model.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.LongSupplier;

/**
 * Ordered stack of cache tiers, fastest first.
 *
 * A read probes the tiers in order; a hit in a slower tier is copied into every
 * faster tier, keeping its expiry, before it is returned. Writes go through to
 * all tiers. The hierarchy holds no lock of its own, each tier guards itself.
 *
 * Every read and write bumps a per-key access count. Keys can be declared
 * related; when prefetching is on, a hit loads the related keys that were
 * accessed before into the fastest tier.
 */
public final class CacheHierarchy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheHierarchy.class);

    static final int MAX_PREFETCH = 5;
    static final int MAX_TRACKED_KEYS = 100_000;

    private final List<CacheTier> tiers;
    private final boolean prefetchEnabled;
    private final LongSupplier clock;
    private final ConcurrentHashMap<String, Long> accessCounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> relatedKeys = new ConcurrentHashMap<>();

    public CacheHierarchy(List<? extends CacheTier> tiers, boolean prefetchEnabled, LongSupplier clock) {
        Objects.requireNonNull(tiers, "Tiers are required");
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one cache tier is required");
        }
        Set<String> names = new HashSet<>();
        for (CacheTier tier : tiers) {
            if (!names.add(tier.name())) {
                throw new IllegalArgumentException("Duplicate cache tier name: " + tier.name());
            }
        }
        this.tiers = List.copyOf(tiers);
        this.prefetchEnabled = prefetchEnabled;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        log.info("CacheHierarchy initialized: tiers={}, prefetch={}", tierNames(), prefetchEnabled);
    }

    public CacheHierarchy(List<? extends CacheTier> tiers, boolean prefetchEnabled) {
        this(tiers, prefetchEnabled, System::currentTimeMillis);
    }

    public CacheHierarchy(List<? extends CacheTier> tiers) {
        this(tiers, false);
    }

    public Optional<float[]> get(String key) {
        recordAccess(key);
        Optional<CacheEntry> found = find(key);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        if (prefetchEnabled) {
            prefetchRelated(key);
        }
        return Optional.of(found.get().value());
    }

    private Optional<CacheEntry> find(String key) {
        for (int i = 0; i < tiers.size(); i++) {
            Optional<CacheEntry> found = tiers.get(i).lookup(key);
            if (found.isPresent()) {
                promote(found.get(), i);
                return found;
            }
        }
        return Optional.empty();
    }

    private void promote(CacheEntry entry, int hitTier) {
        for (int j = 0; j < hitTier; j++) {
            tiers.get(j).set(entry.key(), entry.value(), entry.expiresAt());
        }
        if (hitTier > 0) {
            log.trace("Promoted entry: key={}, from={}", entry.key(), tiers.get(hitTier).name());
        }
    }

    private void prefetchRelated(String key) {
        Set<String> related = relatedKeys.get(key);
        if (related == null) {
            return;
        }
        CacheTier fastest = tiers.get(0);
        int loaded = 0;
        for (String candidate : related) {
            if (loaded >= MAX_PREFETCH) {
                break;
            }
            if (!accessCounts.containsKey(candidate) || fastest.contains(candidate)) {
                continue;
            }
            for (int i = 1; i < tiers.size(); i++) {
                Optional<CacheEntry> found = tiers.get(i).lookup(candidate);
                if (found.isPresent()) {
                    promote(found.get(), i);
                    loaded++;
                    break;
                }
            }
        }
        if (loaded > 0) {
            log.debug("Prefetched related entries: key={}, count={}", key, loaded);
        }
    }

    public void set(String key, float[] value) {
        write(key, value, CacheEntry.NO_EXPIRY);
    }

    /**
     * Writes through to every tier; the entry expires after {@code ttl}, or never when it is null.
     */
    public void set(String key, float[] value, Duration ttl) {
        if (ttl == null) {
            write(key, value, CacheEntry.NO_EXPIRY);
            return;
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        write(key, value, clock.getAsLong() + ttl.toMillis());
    }

    private void write(String key, float[] value, long expiresAt) {
        recordAccess(key);
        for (CacheTier tier : tiers) {
            tier.set(key, value, expiresAt);
        }
    }

    /**
     * Removes the key from every tier, along with its access count and relationships.
     *
     * @return true if any tier held it
     */
    public boolean delete(String key) {
        boolean removed = false;
        for (CacheTier tier : tiers) {
            removed |= tier.delete(key);
        }
        accessCounts.remove(key);
        relatedKeys.remove(key);
        return removed;
    }

    public void clear() {
        for (CacheTier tier : tiers) {
            tier.clear();
        }
        accessCounts.clear();
        relatedKeys.clear();
        log.info("CacheHierarchy cleared: tiers={}", tierNames());
    }

    /**
     * Pre-populates every tier.
     */
    public void warm(Map<String, float[]> entries) {
        entries.forEach(this::set);
        log.info("CacheHierarchy warmed: entries={}", entries.size());
    }

    /**
     * Removes expired entries from every tier that supports scanning.
     *
     * @return total entries removed
     */
    public int purgeExpired() {
        int removed = 0;
        for (CacheTier tier : tiers) {
            removed += tier.purgeExpired();
        }
        if (removed > 0) {
            log.debug("Purged expired entries: count={}", removed);
        }
        return removed;
    }

    /**
     * Declares two keys related, in both directions.
     */
    public void addKeyRelationship(String key, String relatedKey) {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(relatedKey, "Related key is required");
        if (key.equals(relatedKey)) {
            return;
        }
        relatedKeys.computeIfAbsent(key, k -> new CopyOnWriteArraySet<>()).add(relatedKey);
        relatedKeys.computeIfAbsent(relatedKey, k -> new CopyOnWriteArraySet<>()).add(key);
    }

    public Set<String> getRelatedKeys(String key) {
        Set<String> related = relatedKeys.get(key);
        return related == null ? Set.of() : Set.copyOf(related);
    }

    /**
     * Returns a copy of the per-key access counts.
     */
    public Map<String, Long> getAccessPatterns() {
        return Map.copyOf(accessCounts);
    }

    private void recordAccess(String key) {
        if (accessCounts.size() >= MAX_TRACKED_KEYS && !accessCounts.containsKey(key)) {
            return;
        }
        accessCounts.merge(key, 1L, Long::sum);
    }

    /**
     * Returns stats per tier, in tier order.
     */
    public Map<String, CacheStats> stats() {
        Map<String, CacheStats> stats = new LinkedHashMap<>();
        for (CacheTier tier : tiers) {
            stats.put(tier.name(), tier.stats());
        }
        return Collections.unmodifiableMap(stats);
    }

    public List<String> tierNames() {
        List<String> names = new ArrayList<>(tiers.size());
        for (CacheTier tier : tiers) {
            names.add(tier.name());
        }
        return names;
    }

    public List<CacheTier> getTiers() {
        return tiers;
    }

    public boolean isPrefetchEnabled() {
        return prefetchEnabled;
    }

    @Override
    public void close() {
        for (CacheTier tier : tiers) {
            if (tier instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Error closing cache tier: tier={}", tier.name(), e);
                }
            }
        }
    }
}
