package fr.lapetina.embedding.accelerator.memory;

/**
 * Snapshot of one size class of the memory pool.
 *
 * @param outstanding buffers currently checked out
 * @param free        buffers waiting on the free list
 * @param allocations buffers allocated because the free list was empty
 * @param reuses      acquisitions served from the free list
 * @param discards    releases dropped because the free list was full
 */
public record PoolStats(
        int outstanding,
        int free,
        long allocations,
        long reuses,
        long discards
) {

    public double reuseRate() {
        long total = allocations + reuses;
        return total == 0 ? 0.0 : (double) reuses / total;
    }
}
