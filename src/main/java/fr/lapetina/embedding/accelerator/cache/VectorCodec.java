package fr.lapetina.embedding.accelerator.cache;

import fr.lapetina.embedding.accelerator.domain.exception.StorageUnavailableException;
import fr.lapetina.embedding.accelerator.domain.model.CacheEntry;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Blob format for persisted vectors.
 *
 * GZIP stream of: int magic, int version, long expiresAt (version 2 only),
 * int length, then {@code length} big-endian floats. Version 1 blobs are
 * still read and never expire.
 */
public final class VectorCodec {

    static final int MAGIC = 0x45564543;
    static final int VERSION = 2;
    static final int LEGACY_VERSION = 1;
    static final int MAX_LENGTH = 1 << 26;

    /**
     * A decoded blob.
     */
    public record Decoded(float[] vector, long expiresAt) {
    }

    private VectorCodec() {
    }

    public static byte[] encode(float[] vector) {
        return encode(vector, CacheEntry.NO_EXPIRY);
    }

    public static byte[] encode(float[] vector, long expiresAt) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(24 + vector.length * Float.BYTES / 2);
        try (DataOutputStream out = new DataOutputStream(new GZIPOutputStream(bytes))) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            out.writeLong(expiresAt);
            out.writeInt(vector.length);
            for (float v : vector) {
                out.writeFloat(v);
            }
        } catch (IOException e) {
            // in-memory streams only
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * @throws StorageUnavailableException if the blob is not a valid encoded vector
     */
    public static float[] decode(byte[] blob) {
        return decodeEntry(blob).vector();
    }

    /**
     * @throws StorageUnavailableException if the blob is not a valid encoded vector
     */
    public static Decoded decodeEntry(byte[] blob) {
        try (DataInputStream in = new DataInputStream(new GZIPInputStream(new ByteArrayInputStream(blob)))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new StorageUnavailableException("Corrupted vector blob: bad magic 0x" + Integer.toHexString(magic));
            }
            int version = in.readInt();
            long expiresAt;
            if (version == VERSION) {
                expiresAt = in.readLong();
                if (expiresAt < 0) {
                    throw new StorageUnavailableException("Corrupted vector blob: expiry " + expiresAt);
                }
            } else if (version == LEGACY_VERSION) {
                expiresAt = CacheEntry.NO_EXPIRY;
            } else {
                throw new StorageUnavailableException("Unsupported vector blob version: " + version);
            }
            int length = in.readInt();
            if (length < 0 || length > MAX_LENGTH) {
                throw new StorageUnavailableException("Corrupted vector blob: length " + length);
            }
            float[] vector = new float[length];
            for (int i = 0; i < length; i++) {
                vector[i] = in.readFloat();
            }
            return new Decoded(vector, expiresAt);
        } catch (IOException e) {
            throw new StorageUnavailableException("Corrupted vector blob", e);
        }
    }
}
