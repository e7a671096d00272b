package fr.lapetina.embedding.accelerator.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, immutable slice of the caller's items.
 * The offset places the batch results back at their original positions.
 */
public record BatchJob<T>(
        int batchIndex,
        int offset,
        int targetSize,
        List<T> items
) {
    public BatchJob {
        Objects.requireNonNull(items, "Items are required");
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be non-negative: " + offset);
        }
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    /**
     * Splits items into contiguous batches of {@code batchSize}; the last one may be smaller.
     */
    public static <T> List<BatchJob<T>> partition(List<T> items, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        List<BatchJob<T>> jobs = new ArrayList<>((items.size() + batchSize - 1) / batchSize);
        int index = 0;
        for (int start = 0; start < items.size(); start += batchSize) {
            int end = Math.min(start + batchSize, items.size());
            jobs.add(new BatchJob<>(index++, start, batchSize, items.subList(start, end)));
        }
        return jobs;
    }
}
