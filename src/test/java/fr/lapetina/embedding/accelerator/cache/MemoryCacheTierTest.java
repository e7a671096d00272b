package fr.lapetina.embedding.accelerator.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryCacheTierTest {

    private MemoryCacheTier tier;

    @BeforeEach
    void setUp() {
        tier = new MemoryCacheTier(2);
    }

    @Test
    @DisplayName("should evict the oldest entry when nothing was read")
    void shouldEvictOldestUntouchedEntry() {
        tier.set("a", new float[]{1f});
        tier.set("b", new float[]{2f});
        tier.set("c", new float[]{3f});

        assertThat(tier.get("a")).isEmpty();
        assertThat(tier.get("b")).hasValueSatisfying(v -> assertThat(v).containsExactly(2f));
        assertThat(tier.get("c")).hasValueSatisfying(v -> assertThat(v).containsExactly(3f));
        assertThat(tier.stats().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("should evict least recently used entry at capacity")
    void shouldEvictLeastRecentlyUsed() {
        tier.set("a", new float[]{1f});
        tier.set("b", new float[]{2f});
        tier.get("a"); // a is now most recent
        tier.set("c", new float[]{3f});

        assertThat(tier.contains("a")).isTrue();
        assertThat(tier.contains("b")).isFalse();
        assertThat(tier.contains("c")).isTrue();
        assertThat(tier.stats().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("should replace existing key without evicting")
    void shouldReplaceWithoutEviction() {
        tier.set("a", new float[]{1f});
        tier.set("b", new float[]{2f});
        tier.set("a", new float[]{9f});

        assertThat(tier.size()).isEqualTo(2);
        assertThat(tier.get("a")).hasValueSatisfying(v -> assertThat(v).containsExactly(9f));
        assertThat(tier.stats().evictions()).isZero();
    }

    @Test
    @DisplayName("should return copies so callers cannot mutate cached vectors")
    void shouldReturnCopies() {
        float[] original = {1f, 2f};
        tier.set("a", original);
        original[0] = 100f;

        float[] read = tier.get("a").orElseThrow();
        read[1] = 200f;

        assertThat(tier.get("a").orElseThrow()).containsExactly(1f, 2f);
    }

    @Test
    @DisplayName("should count hits, misses and track size")
    void shouldTrackStats() {
        tier.set("a", new float[4]);
        tier.get("a");
        tier.get("missing");

        CacheStats stats = tier.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.requests()).isEqualTo(2);
        assertThat(stats.hitRate()).isEqualTo(0.5);
        assertThat(stats.writes()).isEqualTo(1);
        assertThat(stats.sizeBytes()).isEqualTo(16);
        assertThat(stats.entries()).isEqualTo(1);
    }

    @Test
    @DisplayName("should delete and clear entries")
    void shouldDeleteAndClear() {
        tier.set("a", new float[1]);
        tier.set("b", new float[1]);

        assertThat(tier.delete("a")).isTrue();
        assertThat(tier.delete("a")).isFalse();

        tier.clear();
        assertThat(tier.size()).isZero();
        assertThat(tier.stats().sizeBytes()).isZero();
    }

    @Test
    @DisplayName("should reject non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new MemoryCacheTier(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MemoryCacheTier(10, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Byte bound")
    class ByteBoundTests {

        @Test
        @DisplayName("should evict by size even when the entry count allows more")
        void shouldEvictBySize() {
            MemoryCacheTier bounded = new MemoryCacheTier(100, 32);

            bounded.set("a", new float[4]);
            bounded.set("b", new float[4]);
            bounded.set("c", new float[4]);

            assertThat(bounded.contains("a")).isFalse();
            assertThat(bounded.contains("b")).isTrue();
            assertThat(bounded.contains("c")).isTrue();
            assertThat(bounded.stats().sizeBytes()).isEqualTo(32);
            assertThat(bounded.stats().evictions()).isEqualTo(1);
        }

        @Test
        @DisplayName("should evict several small entries to fit a large one")
        void shouldEvictSeveralForLargeEntry() {
            MemoryCacheTier bounded = new MemoryCacheTier(100, 32);
            bounded.set("a", new float[2]);
            bounded.set("b", new float[2]);
            bounded.set("c", new float[2]);

            bounded.set("big", new float[6]);

            assertThat(bounded.size()).isEqualTo(2);
            assertThat(bounded.contains("c")).isTrue();
            assertThat(bounded.contains("big")).isTrue();
            assertThat(bounded.stats().sizeBytes()).isLessThanOrEqualTo(32);
        }

        @Test
        @DisplayName("should not evict others when a key is rewritten at the same size")
        void shouldNotEvictOnSameSizeRewrite() {
            MemoryCacheTier bounded = new MemoryCacheTier(100, 32);
            bounded.set("a", new float[4]);
            bounded.set("b", new float[4]);

            bounded.set("a", new float[]{1f, 1f, 1f, 1f});

            assertThat(bounded.contains("b")).isTrue();
            assertThat(bounded.stats().evictions()).isZero();
        }

        @Test
        @DisplayName("should skip an entry larger than the whole tier")
        void shouldSkipOversizedEntry() {
            MemoryCacheTier bounded = new MemoryCacheTier(100, 8);
            bounded.set("small", new float[1]);

            bounded.set("huge", new float[3]);

            assertThat(bounded.contains("huge")).isFalse();
            assertThat(bounded.contains("small")).isTrue();
            assertThat(bounded.stats().writes()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        private final AtomicLong now = new AtomicLong(10_000);
        private final MemoryCacheTier timed =
                new MemoryCacheTier(MemoryCacheTier.DEFAULT_NAME, 10, Long.MAX_VALUE, null, now::get);

        @Test
        @DisplayName("should serve an entry until its deadline then treat it as a miss")
        void shouldExpireOnRead() {
            timed.set("a", new float[]{1f}, 15_000);

            now.set(14_999);
            assertThat(timed.get("a")).isPresent();

            now.set(15_000);
            assertThat(timed.get("a")).isEmpty();

            assertThat(timed.contains("a")).isFalse();
            CacheStats stats = timed.stats();
            assertThat(stats.hits()).isEqualTo(1);
            assertThat(stats.misses()).isEqualTo(1);
            assertThat(stats.expirations()).isEqualTo(1);
            assertThat(stats.sizeBytes()).isZero();
        }

        @Test
        @DisplayName("should keep entries without a deadline")
        void shouldKeepNonExpiringEntries() {
            timed.set("a", new float[]{1f});
            now.set(Long.MAX_VALUE - 1);

            assertThat(timed.get("a")).isPresent();
        }

        @Test
        @DisplayName("should report the deadline on lookup")
        void shouldExposeDeadline() {
            timed.set("a", new float[]{1f}, 20_000);

            assertThat(timed.lookup("a")).hasValueSatisfying(e -> assertThat(e.expiresAt()).isEqualTo(20_000));
        }

        @Test
        @DisplayName("should purge only expired entries")
        void shouldPurgeExpired() {
            timed.set("old", new float[]{1f}, 11_000);
            timed.set("fresh", new float[]{1f}, 50_000);
            timed.set("forever", new float[]{1f});
            now.set(12_000);

            assertThat(timed.purgeExpired()).isEqualTo(1);

            assertThat(timed.contains("old")).isFalse();
            assertThat(timed.size()).isEqualTo(2);
            assertThat(timed.stats().expirations()).isEqualTo(1);
            assertThat(timed.stats().sizeBytes()).isEqualTo(8);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should hold its bounds and keep counters consistent under concurrent use")
        void shouldHoldBoundsUnderConcurrency() throws Exception {
            MemoryCacheTier shared = new MemoryCacheTier(50, 50L * 4 * Float.BYTES);
            int threads = 8;
            int operations = 2_000;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    int seed = t;
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < operations; i++) {
                            String key = "k" + ((seed * 31 + i) % 200);
                            if (i % 3 == 0) {
                                shared.set(key, new float[]{seed, i, 0f, 1f});
                            } else {
                                shared.get(key);
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            CacheStats stats = shared.stats();
            assertThat(shared.size()).isLessThanOrEqualTo(50);
            assertThat(stats.entries()).isEqualTo(shared.size());
            assertThat(stats.sizeBytes()).isEqualTo((long) shared.size() * 4 * Float.BYTES);
            assertThat(stats.requests()).isEqualTo(stats.hits() + stats.misses());
            assertThat(stats.requests() + stats.writes()).isEqualTo((long) threads * operations);
        }
    }
}
