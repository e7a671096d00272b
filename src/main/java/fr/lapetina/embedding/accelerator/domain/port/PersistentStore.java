package fr.lapetina.embedding.accelerator.domain.port;

import java.io.IOException;
import java.util.Optional;

/**
 * Byte-blob storage consumed by the slower cache tiers.
 *
 * Keys are content fingerprints; blobs are opaque. Implementations choose
 * which entry {@link #evictOne()} removes; the bundled file store removes
 * the least recently used one.
 */
public interface PersistentStore extends AutoCloseable {

    /**
     * Reads a blob and marks it as accessed.
     */
    Optional<byte[]> read(String key) throws IOException;

    /**
     * Writes or replaces a blob.
     */
    void write(String key, byte[] blob) throws IOException;

    /**
     * Returns the total size of all stored blobs.
     */
    long sizeBytes();

    /**
     * Returns the size of the blob stored under the key, or 0 when absent.
     */
    long sizeOf(String key);

    /**
     * Removes one entry according to the store's eviction policy.
     *
     * @return bytes freed, or 0 when the store is empty
     */
    long evictOne() throws IOException;

    /**
     * Removes the blob for the key, if present.
     */
    boolean delete(String key) throws IOException;

    /**
     * Removes all blobs.
     */
    void clear() throws IOException;

    /**
     * Returns the number of stored blobs.
     */
    int entryCount();

    @Override
    default void close() throws IOException {
    }
}
