package fr.lapetina.embedding.accelerator.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheHierarchyTest {

    private MemoryCacheTier memory;
    private PersistentCacheTier disk;
    private CacheHierarchy hierarchy;

    @BeforeEach
    void setUp() {
        memory = new MemoryCacheTier(10);
        disk = new PersistentCacheTier(new InMemoryStore(), 1024 * 1024);
        hierarchy = new CacheHierarchy(List.of(memory, disk));
    }

    @Test
    @DisplayName("should write through and read back a vector")
    void shouldWriteThroughAndRead() {
        hierarchy.set("k1", new float[]{1f, 2f, 3f});

        assertThat(hierarchy.get("k1")).hasValueSatisfying(v -> assertThat(v).containsExactly(1f, 2f, 3f));
        assertThat(memory.contains("k1")).isTrue();
        assertThat(disk.stats().entries()).isEqualTo(1);
    }

    @Test
    @DisplayName("should promote hit from slower tier into faster tiers")
    void shouldPromoteOnHit() {
        disk.set("k1", new float[]{4f});
        assertThat(memory.contains("k1")).isFalse();

        assertThat(hierarchy.get("k1")).isPresent();

        assertThat(memory.contains("k1")).isTrue();
        assertThat(hierarchy.stats().get("memory").misses()).isEqualTo(1);
        assertThat(hierarchy.stats().get("disk").hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("should miss in every tier for unknown key")
    void shouldMissEverywhere() {
        assertThat(hierarchy.get("nope")).isEmpty();

        assertThat(hierarchy.stats().get("memory").misses()).isEqualTo(1);
        assertThat(hierarchy.stats().get("disk").misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("should delete from all tiers and warm all tiers")
    void shouldDeleteAndWarm() {
        hierarchy.warm(Map.of("a", new float[]{1f}, "b", new float[]{2f}));
        assertThat(memory.size()).isEqualTo(2);
        assertThat(disk.stats().entries()).isEqualTo(2);

        assertThat(hierarchy.delete("a")).isTrue();
        assertThat(hierarchy.delete("a")).isFalse();

        hierarchy.clear();
        assertThat(memory.size()).isZero();
        assertThat(disk.stats().entries()).isZero();
    }

    @Test
    @DisplayName("should report stats in tier order")
    void shouldReportStatsInOrder() {
        assertThat(hierarchy.stats().keySet()).containsExactly("memory", "disk");
        assertThat(hierarchy.tierNames()).containsExactly("memory", "disk");
    }

    @Test
    @DisplayName("should reject empty and duplicate tier lists")
    void shouldRejectInvalidTiers() {
        assertThatThrownBy(() -> new CacheHierarchy(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CacheHierarchy(List.of(new MemoryCacheTier(1), new MemoryCacheTier(2))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("memory");
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        private final AtomicLong now = new AtomicLong(5_000);
        private final MemoryCacheTier timedMemory =
                new MemoryCacheTier(MemoryCacheTier.DEFAULT_NAME, 10, Long.MAX_VALUE, null, now::get);
        private final PersistentCacheTier timedDisk = new PersistentCacheTier(
                PersistentCacheTier.DEFAULT_NAME, new InMemoryStore(), 1024 * 1024, null, now::get);
        private final CacheHierarchy timed = new CacheHierarchy(List.of(timedMemory, timedDisk), false, now::get);

        @Test
        @DisplayName("should expire entries in every tier after the TTL")
        void shouldExpireAfterTtl() {
            timed.set("k1", new float[]{1f}, Duration.ofSeconds(10));

            now.addAndGet(9_999);
            assertThat(timed.get("k1")).isPresent();

            now.addAndGet(1);
            assertThat(timed.get("k1")).isEmpty();
            assertThat(timedMemory.stats().expirations()).isEqualTo(1);
            assertThat(timedDisk.stats().expirations()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep the original deadline when promoting")
        void shouldKeepDeadlineOnPromotion() {
            timedDisk.set("k1", new float[]{1f}, 8_000);

            assertThat(timed.get("k1")).isPresent();
            assertThat(timedMemory.lookup("k1")).hasValueSatisfying(e -> assertThat(e.expiresAt()).isEqualTo(8_000));

            now.set(8_000);
            assertThat(timed.get("k1")).isEmpty();
        }

        @Test
        @DisplayName("should purge expired entries from the memory tier")
        void shouldPurgeExpired() {
            timed.set("short", new float[]{1f}, Duration.ofMillis(100));
            timed.set("long", new float[]{1f}, Duration.ofHours(1));
            now.addAndGet(200);

            assertThat(timed.purgeExpired()).isEqualTo(1);
            assertThat(timedMemory.contains("short")).isFalse();
            assertThat(timedMemory.contains("long")).isTrue();
        }

        @Test
        @DisplayName("should reject a non-positive TTL and accept none")
        void shouldValidateTtl() {
            assertThatThrownBy(() -> timed.set("k1", new float[]{1f}, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);

            timed.set("k1", new float[]{1f}, null);
            now.set(Long.MAX_VALUE - 1);
            assertThat(timed.get("k1")).isPresent();
        }
    }

    @Nested
    @DisplayName("Access patterns")
    class AccessPatternTests {

        @Test
        @DisplayName("should count reads and writes per key")
        void shouldCountAccesses() {
            hierarchy.set("a", new float[]{1f});
            hierarchy.get("a");
            hierarchy.get("a");
            hierarchy.get("missing");

            assertThat(hierarchy.getAccessPatterns()).containsEntry("a", 3L).containsEntry("missing", 1L);
        }

        @Test
        @DisplayName("should return a snapshot of the counts")
        void shouldReturnSnapshot() {
            hierarchy.get("a");
            Map<String, Long> snapshot = hierarchy.getAccessPatterns();
            hierarchy.get("a");

            assertThat(snapshot).containsEntry("a", 1L);
            assertThatThrownBy(() -> snapshot.put("b", 1L)).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("should record relationships in both directions without duplicates")
        void shouldRecordRelationships() {
            hierarchy.addKeyRelationship("a", "b");
            hierarchy.addKeyRelationship("b", "a");
            hierarchy.addKeyRelationship("a", "c");
            hierarchy.addKeyRelationship("a", "a");

            assertThat(hierarchy.getRelatedKeys("a")).containsExactlyInAnyOrder("b", "c");
            assertThat(hierarchy.getRelatedKeys("b")).containsExactly("a");
            assertThat(hierarchy.getRelatedKeys("unknown")).isEmpty();
        }

        @Test
        @DisplayName("should forget counts and relationships on delete and clear")
        void shouldForgetOnDeleteAndClear() {
            hierarchy.set("a", new float[]{1f});
            hierarchy.set("b", new float[]{1f});
            hierarchy.addKeyRelationship("a", "b");

            hierarchy.delete("a");
            assertThat(hierarchy.getAccessPatterns()).doesNotContainKey("a");
            assertThat(hierarchy.getRelatedKeys("a")).isEmpty();

            hierarchy.clear();
            assertThat(hierarchy.getAccessPatterns()).isEmpty();
            assertThat(hierarchy.getRelatedKeys("b")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Prefetch")
    class PrefetchTests {

        private CacheHierarchy prefetching;

        @BeforeEach
        void setUp() {
            prefetching = new CacheHierarchy(List.of(memory, disk), true);
        }

        @Test
        @DisplayName("should load previously seen related keys into memory on a hit")
        void shouldPrefetchRelatedKeys() {
            prefetching.set("a", new float[]{1f});
            prefetching.set("b", new float[]{2f});
            prefetching.addKeyRelationship("a", "b");
            memory.delete("b");

            prefetching.get("a");

            assertThat(memory.contains("b")).isTrue();
            assertThat(memory.get("b")).hasValueSatisfying(v -> assertThat(v).containsExactly(2f));
        }

        @Test
        @DisplayName("should not prefetch keys that were never accessed")
        void shouldSkipUnseenKeys() {
            prefetching.set("a", new float[]{1f});
            disk.set("b", new float[]{2f});
            prefetching.addKeyRelationship("a", "b");

            prefetching.get("a");

            assertThat(memory.contains("b")).isFalse();
        }

        @Test
        @DisplayName("should prefetch at most five related keys per hit")
        void shouldLimitPrefetch() {
            prefetching.set("root", new float[]{0f});
            for (int i = 0; i < 8; i++) {
                prefetching.set("r" + i, new float[]{i});
                prefetching.addKeyRelationship("root", "r" + i);
                memory.delete("r" + i);
            }

            prefetching.get("root");

            long loaded = 0;
            for (int i = 0; i < 8; i++) {
                if (memory.contains("r" + i)) {
                    loaded++;
                }
            }
            assertThat(loaded).isEqualTo(CacheHierarchy.MAX_PREFETCH);
        }

        @Test
        @DisplayName("should not prefetch when disabled")
        void shouldNotPrefetchWhenDisabled() {
            hierarchy.set("a", new float[]{1f});
            hierarchy.set("b", new float[]{2f});
            hierarchy.addKeyRelationship("a", "b");
            memory.delete("b");

            hierarchy.get("a");

            assertThat(memory.contains("b")).isFalse();
        }
    }

    @Test
    @DisplayName("should stay consistent across tiers under concurrent use")
    void shouldStayConsistentUnderConcurrency() throws Exception {
        int threads = 8;
        int operations = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int seed = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < operations; i++) {
                        String key = "k" + ((seed + i) % 40);
                        if (i % 2 == 0) {
                            hierarchy.set(key, new float[]{(seed + i) % 40});
                        } else {
                            hierarchy.get(key).ifPresent(v -> assertThat(v).hasSize(1));
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

        assertThat(memory.size()).isLessThanOrEqualTo(10);
        assertThat(disk.stats().entries()).isEqualTo(40);
        for (int k = 0; k < 40; k++) {
            int expected = k;
            assertThat(hierarchy.get("k" + k)).hasValueSatisfying(v -> assertThat(v).containsExactly((float) expected));
        }
    }
}
