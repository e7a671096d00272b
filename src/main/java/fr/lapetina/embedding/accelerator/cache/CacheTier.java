package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.domain.model.CacheEntry;

import java.util.Optional;

/**
 * One level of the cache hierarchy.
 *
 * Implementations enforce their own bound synchronously on {@link #set} and
 * must be safe for concurrent use. An entry past its expiry is never returned:
 * it counts as a miss and is removed.
 */
public interface CacheTier {

    /**
     * Returns the tier name used in stats and metric tags.
     */
    String name();

    /**
     * Looks the key up, counting a hit or a miss.
     */
    Optional<CacheEntry> lookup(String key);

    default Optional<float[]> get(String key) {
        return lookup(key).map(CacheEntry::value);
    }

    /**
     * Stores the value until the given epoch-millis deadline, {@link CacheEntry#NO_EXPIRY} for no deadline.
     */
    void set(String key, float[] value, long expiresAt);

    default void set(String key, float[] value) {
        set(key, value, CacheEntry.NO_EXPIRY);
    }

    /**
     * Tells whether the tier holds the key, without counting a request or refreshing recency.
     */
    boolean contains(String key);

    boolean delete(String key);

    void clear();

    /**
     * Removes every expired entry the tier can find without reading its values.
     *
     * @return number of entries removed
     */
    default int purgeExpired() {
        return 0;
    }

    CacheStats stats();
}
