package fr.lapetina.embedding.accelerator.domain.model;

import java.util.Objects;

/**
 * A cached embedding vector held by one cache tier.
 * Immutable; a tier replaces the entry to refresh its access time.
 *
 * {@code expiresAt} is an epoch-millis deadline, {@link #NO_EXPIRY} for entries that never expire.
 */
public record CacheEntry(
        String key,
        float[] value,
        long sizeBytes,
        long lastAccessTime,
        long expiresAt
) {
    public static final long NO_EXPIRY = 0L;

    public CacheEntry {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(value, "Value is required");
        if (expiresAt < 0) {
            throw new IllegalArgumentException("Expiry must not be negative: " + expiresAt);
        }
    }

    /**
     * Creates a non-expiring entry sized by its vector payload.
     */
    public static CacheEntry of(String key, float[] value, long accessTime) {
        return of(key, value, accessTime, NO_EXPIRY);
    }

    public static CacheEntry of(String key, float[] value, long accessTime, long expiresAt) {
        return new CacheEntry(key, value, (long) value.length * Float.BYTES, accessTime, expiresAt);
    }

    /**
     * Returns a copy of this entry touched at the given time.
     */
    public CacheEntry touch(long accessTime) {
        return new CacheEntry(key, value, sizeBytes, accessTime, expiresAt);
    }

    public boolean isExpired(long now) {
        return expiresAt != NO_EXPIRY && now >= expiresAt;
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
                "key='" + key + '\'' +
                ", dimension=" + value.length +
                ", sizeBytes=" + sizeBytes +
                ", lastAccessTime=" + lastAccessTime +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
