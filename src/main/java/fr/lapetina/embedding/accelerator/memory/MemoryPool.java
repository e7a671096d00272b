package fr.lapetina.embedding.accelerator.memory;

import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of reusable float arrays and byte buffers, keyed by size class.
 *
 * Float arrays are keyed by their exact shape. Byte buffers are rounded up to
 * the next standard capacity; requests above the largest class keep their
 * exact size. Each size class keeps a free list bounded by {@code maxPoolSize};
 * a release onto a full free list drops the buffer. Running out of pooled
 * buffers is never an error, acquisition simply allocates.
 *
 * Thread-safe: each size class is guarded by its own short lock.
 */
public final class MemoryPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemoryPool.class);

    public static final int DEFAULT_MAX_POOL_SIZE = 10;

    static final int[] STANDARD_BYTE_CLASSES = {
            1 << 10,   // 1 KiB
            4 << 10,   // 4 KiB
            16 << 10,  // 16 KiB
            64 << 10,  // 64 KiB
            256 << 10, // 256 KiB
            1 << 20,   // 1 MiB
            4 << 20    // 4 MiB
    };

    private final int maxPoolSize;
    private final MetricsRegistry metrics;
    private final Map<SizeClass, ClassPool> pools = new ConcurrentHashMap<>();

    public MemoryPool(int maxPoolSize, MetricsRegistry metrics) {
        if (maxPoolSize < 0) {
            throw new IllegalArgumentException("Max pool size must be non-negative: " + maxPoolSize);
        }
        this.maxPoolSize = maxPoolSize;
        this.metrics = metrics;
        log.info("MemoryPool initialized: maxPoolSize={}", maxPoolSize);
    }

    public MemoryPool(int maxPoolSize) {
        this(maxPoolSize, null);
    }

    public MemoryPool() {
        this(DEFAULT_MAX_POOL_SIZE, null);
    }

    /**
     * Acquires a zero-filled float array of the given shape, stored row-major.
     */
    public PooledBuffer acquireArray(int... shape) {
        return acquire(SizeClass.ofShape(shape), 0);
    }

    /**
     * Acquires a byte buffer with at least {@code minBytes} of capacity.
     * The returned buffer's limit is {@code minBytes}.
     */
    public PooledBuffer acquireBytes(int minBytes) {
        if (minBytes <= 0) {
            throw new IllegalArgumentException("Byte buffer size must be positive: " + minBytes);
        }
        return acquire(SizeClass.ofBytes(byteClassFor(minBytes)), minBytes);
    }

    static int byteClassFor(int minBytes) {
        for (int capacity : STANDARD_BYTE_CLASSES) {
            if (capacity >= minBytes) {
                return capacity;
            }
        }
        return minBytes;
    }

    private PooledBuffer acquire(SizeClass sizeClass, int requestedBytes) {
        ClassPool pool = pools.computeIfAbsent(sizeClass, this::newClassPool);
        PooledBuffer buffer = pool.take();
        buffer.prepare(requestedBytes);
        return buffer;
    }

    private ClassPool newClassPool(SizeClass sizeClass) {
        ClassPool pool = new ClassPool(sizeClass);
        if (metrics != null) {
            metrics.registerGauge("pool_free_buffers", "class", sizeClass.label(), pool::freeCount);
        }
        log.debug("New size class: class={}, bytes={}", sizeClass, sizeClass.byteSize());
        return pool;
    }

    /**
     * Returns a buffer to its free list. Called by {@link PooledBuffer#close()}.
     */
    void release(PooledBuffer buffer) {
        if (!buffer.markAvailable()) {
            log.warn("Ignoring double release: class={}", buffer.sizeClass());
            return;
        }
        pools.get(buffer.sizeClass()).giveBack(buffer);
    }

    /**
     * Returns per-class statistics keyed by size class label, e.g. {@code float[100x768]}.
     */
    public Map<String, PoolStats> stats() {
        Map<String, PoolStats> result = new LinkedHashMap<>();
        pools.forEach((sizeClass, pool) -> result.put(sizeClass.label(), pool.snapshot()));
        return Collections.unmodifiableMap(result);
    }

    public long totalAllocations() {
        long total = 0;
        for (ClassPool pool : pools.values()) {
            total += pool.snapshot().allocations();
        }
        return total;
    }

    /**
     * Drops all free lists. Counters are kept; checked-out buffers still return on release.
     */
    public void clear() {
        int dropped = 0;
        for (ClassPool pool : pools.values()) {
            dropped += pool.drain();
        }
        log.info("MemoryPool cleared: droppedBuffers={}", dropped);
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    @Override
    public void close() {
        clear();
    }

    private final class ClassPool {
        private final SizeClass sizeClass;
        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<PooledBuffer> free = new ArrayDeque<>();
        private int outstanding;
        private long allocations;
        private long reuses;
        private long discards;

        ClassPool(SizeClass sizeClass) {
            this.sizeClass = sizeClass;
        }

        PooledBuffer take() {
            PooledBuffer buffer;
            lock.lock();
            try {
                buffer = free.pollFirst();
                if (buffer != null) {
                    reuses++;
                } else {
                    allocations++;
                }
                outstanding++;
            } finally {
                lock.unlock();
            }
            if (buffer == null) {
                // allocate outside the lock
                buffer = PooledBuffer.allocate(MemoryPool.this, sizeClass);
            }
            buffer.markInUse();
            return buffer;
        }

        void giveBack(PooledBuffer buffer) {
            buffer.reset();
            lock.lock();
            try {
                outstanding = Math.max(0, outstanding - 1);
                if (free.size() < maxPoolSize) {
                    free.addFirst(buffer);
                } else {
                    discards++;
                }
            } finally {
                lock.unlock();
            }
        }

        int drain() {
            lock.lock();
            try {
                int size = free.size();
                free.clear();
                return size;
            } finally {
                lock.unlock();
            }
        }

        int freeCount() {
            lock.lock();
            try {
                return free.size();
            } finally {
                lock.unlock();
            }
        }

        PoolStats snapshot() {
            lock.lock();
            try {
                return new PoolStats(outstanding, free.size(), allocations, reuses, discards);
            } finally {
                lock.unlock();
            }
        }
    }
}
