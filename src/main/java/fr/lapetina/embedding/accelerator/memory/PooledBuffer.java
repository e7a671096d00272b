package fr.lapetina.embedding.accelerator.memory;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A buffer checked out from a {@link MemoryPool}.
 *
 * Ownership belongs to the caller until {@link #close()}, which hands the
 * buffer back to its pool. Intended for try-with-resources so the buffer is
 * returned on normal and exceptional exit alike.
 *
 * <pre>{@code
 * try (PooledBuffer buffer = pool.acquireArray(batch.size(), 768)) {
 *     float[] matrix = buffer.floats();
 *     // fill and consume matrix
 * }
 * }</pre>
 */
public final class PooledBuffer implements AutoCloseable {

    private final MemoryPool owner;
    private final SizeClass sizeClass;
    private final float[] floats;
    private final ByteBuffer bytes;
    private final AtomicBoolean inUse = new AtomicBoolean(false);

    private PooledBuffer(MemoryPool owner, SizeClass sizeClass, float[] floats, ByteBuffer bytes) {
        this.owner = owner;
        this.sizeClass = sizeClass;
        this.floats = floats;
        this.bytes = bytes;
    }

    static PooledBuffer allocate(MemoryPool owner, SizeClass sizeClass) {
        if (sizeClass.kind() == SizeClass.Kind.FLOAT_ARRAY) {
            return new PooledBuffer(owner, sizeClass, new float[sizeClass.elementCount()], null);
        }
        return new PooledBuffer(owner, sizeClass, null, ByteBuffer.allocate(sizeClass.dims()[0]));
    }

    /**
     * Returns the backing float array in row-major order.
     *
     * @throws IllegalStateException if this is a byte buffer or has been released
     */
    public float[] floats() {
        ensureInUse();
        if (floats == null) {
            throw new IllegalStateException("Buffer " + sizeClass + " is not a float array");
        }
        return floats;
    }

    /**
     * Returns the backing byte buffer, positioned at zero with its limit at the requested length.
     *
     * @throws IllegalStateException if this is a float array or has been released
     */
    public ByteBuffer bytes() {
        ensureInUse();
        if (bytes == null) {
            throw new IllegalStateException("Buffer " + sizeClass + " is not a byte buffer");
        }
        return bytes;
    }

    /**
     * Returns the shape for float arrays, or the capacity for byte buffers.
     */
    public int[] shape() {
        return sizeClass.dims().clone();
    }

    public long byteSize() {
        return sizeClass.byteSize();
    }

    public boolean isInUse() {
        return inUse.get();
    }

    SizeClass sizeClass() {
        return sizeClass;
    }

    boolean markInUse() {
        return inUse.compareAndSet(false, true);
    }

    boolean markAvailable() {
        return inUse.compareAndSet(true, false);
    }

    void prepare(int requestedBytes) {
        if (bytes != null) {
            bytes.clear();
            bytes.limit(requestedBytes);
        }
    }

    void reset() {
        if (floats != null) {
            Arrays.fill(floats, 0f);
        }
        if (bytes != null) {
            bytes.clear();
            Arrays.fill(bytes.array(), (byte) 0);
        }
    }

    private void ensureInUse() {
        if (!inUse.get()) {
            throw new IllegalStateException("Buffer " + sizeClass + " has already been released");
        }
    }

    /**
     * Returns this buffer to its pool. Further access throws.
     */
    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "PooledBuffer{" +
                "class=" + sizeClass +
                ", inUse=" + inUse.get() +
                '}';
    }
}
