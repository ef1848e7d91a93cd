package com.localllm.agent.cache;

import com.localllm.agent.resilience.FakeTimeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheTest {

    private FakeTimeSource time;
    private ResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        time = new FakeTimeSource();
        cache = new ResponseCache<>(3, Duration.ofSeconds(60), true, time);
    }

    @Test
    void get_unknownKey_emptyAndCountsMiss() {
        assertThat(cache.get("what is 2+2")).isEmpty();
        assertThat(cache.getStats().misses()).isEqualTo(1);
    }

    @Test
    void set_thenGet_returnsValueAndCountsHit() {
        cache.set("what is 2+2", "4");

        assertThat(cache.get("what is 2+2")).contains("4");
        assertThat(cache.getStats().hits()).isEqualTo(1);
        assertThat(cache.getStats().hitRate()).isEqualTo(100.0);
    }

    @Test
    void set_overCapacity_evictsLeastRecentlyUsed() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        cache.set("d", "4");

        assertThat(cache.contains("a")).isFalse();
        assertThat(cache.contains("b")).isTrue();
        assertThat(cache.contains("d")).isTrue();
        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.getStats().evictions()).isEqualTo(1);
    }

    @Test
    void get_promotesEntryPastNextEviction() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");
        cache.get("a");

        cache.set("d", "4");

        assertThat(cache.contains("a")).isTrue();
        assertThat(cache.contains("b")).isFalse();
    }

    @Test
    void set_existingKey_replacesAndPromotes() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");
        cache.set("a", "updated");

        cache.set("d", "4");

        assertThat(cache.get("a")).contains("updated");
        assertThat(cache.contains("b")).isFalse();
    }

    @Test
    void set_existingKey_refreshesAge() {
        cache.set("a", "1");
        time.advance(Duration.ofSeconds(50));
        cache.set("a", "2");
        time.advance(Duration.ofSeconds(50));

        assertThat(cache.get("a")).contains("2");
    }

    @Test
    void get_justBeforeTtl_present_justAfter_absent() {
        cache.set("a", "1");

        time.advance(Duration.ofSeconds(60).minusMillis(1));
        assertThat(cache.get("a")).contains("1");

        time.advance(Duration.ofMillis(2));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void zeroTtl_neverExpires() {
        ResponseCache<String> forever = new ResponseCache<>(2, Duration.ZERO, true, time);
        forever.set("a", "1");

        time.advance(Duration.ofDays(365));

        assertThat(forever.get("a")).contains("1");
        assertThat(forever.cleanupExpired()).isZero();
    }

    @Test
    void disabled_getAndSetAreNoOps() {
        cache.setEnabled(false);
        cache.set("a", "1");

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(cache.getStats().misses()).isZero();
    }

    @Test
    void invalidate_removesSingleEntry() {
        cache.set("a", "1");
        cache.set("b", "2");

        assertThat(cache.invalidate("a")).isTrue();
        assertThat(cache.invalidate("a")).isFalse();
        assertThat(cache.contains("b")).isTrue();
    }

    @Test
    void clear_returnsRemovedCount() {
        cache.set("a", "1");
        cache.set("b", "2");

        assertThat(cache.clear()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    void cleanupExpired_removesOnlyExpiredEntries() {
        cache.set("old", "1");
        time.advance(Duration.ofSeconds(40));
        cache.set("new", "2");
        time.advance(Duration.ofSeconds(30));

        assertThat(cache.cleanupExpired()).isEqualTo(1);
        assertThat(cache.contains("new")).isTrue();
        assertThat(cache.contains("old")).isFalse();
    }

    @Test
    void contains_doesNotTouchStatsOrRecency() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");
        cache.contains("a");

        cache.set("d", "4");

        assertThat(cache.contains("a")).isFalse();
        assertThat(cache.getStats().hits()).isZero();
        assertThat(cache.getStats().misses()).isZero();
    }

    @Test
    void keyFor_isFixedLengthAndDeterministic() {
        String shortKey = ResponseCache.keyFor("hi");
        String longKey = ResponseCache.keyFor("x".repeat(100_000));

        assertThat(shortKey).hasSize(64).isEqualTo(ResponseCache.keyFor("hi"));
        assertThat(longKey).hasSize(64).isNotEqualTo(shortKey);
    }

    @Test
    void resetStats_keepsEntries() {
        cache.set("a", "1");
        cache.get("a");
        cache.get("zzz");

        cache.resetStats();

        assertThat(cache.getStats().hits()).isZero();
        assertThat(cache.getStats().misses()).isZero();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void concurrentSetAndGet_overlappingKeys_noLostUpdates() throws Exception {
        int threads = 8;
        int opsPerThread = 500;
        ResponseCache<String> shared = new ResponseCache<>(10, Duration.ofSeconds(60), true, time);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int seed = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < opsPerThread; i++) {
                    String prompt = "prompt-" + ((seed + i) % 25);
                    shared.set(prompt, "answer to " + prompt);
                    shared.get(prompt).ifPresent(value -> assertThat(value).isEqualTo("answer to " + prompt));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        CacheStats stats = shared.getStats();
        assertThat(shared.size()).isLessThanOrEqualTo(10);
        assertThat(stats.hits() + stats.misses()).isEqualTo((long) threads * opsPerThread);
        assertThat(stats.evictions()).isPositive();
    }

    @Test
    void constructor_zeroCapacity_rejected() {
        assertThatThrownBy(() -> new ResponseCache<String>(0, Duration.ZERO, true, time))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
