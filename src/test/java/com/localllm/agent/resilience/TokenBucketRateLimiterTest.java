package com.localllm.agent.resilience;

import com.localllm.agent.exception.RateLimitTimeoutException;
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
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenBucketRateLimiterTest {

    private FakeTimeSource time;
    private TokenBucketRateLimiter limiter;

    @BeforeEach
    void setUp() {
        time = new FakeTimeSource();
        // 3 tokens, one new token per second
        limiter = new TokenBucketRateLimiter(3, 1.0, true, time);
    }

    @Test
    void newBucket_isFull() {
        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void tryAcquire_emptyBucket_returnsFalseUntilRefilled() {
        drain();

        assertThat(limiter.tryAcquire()).isFalse();

        time.advance(Duration.ofMillis(999));
        assertThat(limiter.tryAcquire()).isFalse();

        time.advance(Duration.ofMillis(1));
        assertThat(limiter.tryAcquire()).isTrue();
    }

    @Test
    void availableTokens_neverExceedsCapacity() {
        limiter.tryAcquire();
        time.advance(Duration.ofHours(1));

        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void availableTokens_doesNotConsume() {
        limiter.availableTokens();
        limiter.availableTokens();

        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void acquire_tokenAvailable_grantedWithoutWaiting() throws InterruptedException {
        assertThat(limiter.acquire()).isTrue();

        assertThat(time.sleeps()).isEmpty();
        assertThat(limiter.availableTokens()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void acquire_emptyBucket_waitsForRefill() throws InterruptedException {
        drain();
        time.advance(Duration.ofMillis(250));

        assertThat(limiter.acquire()).isTrue();

        assertThat(time.sleeps()).containsExactly(Duration.ofMillis(750));
        RateLimitStats stats = limiter.getStats();
        assertThat(stats.throttledRequests()).isEqualTo(1);
        assertThat(stats.maxWaitMs()).isCloseTo(750.0, within(1e-6));
    }

    @Test
    void acquire_waitLongerThanTimeout_rejectedWithoutSleeping() throws InterruptedException {
        drain();

        assertThat(limiter.acquire(Duration.ofMillis(500))).isFalse();

        assertThat(time.sleeps()).isEmpty();
        assertThat(limiter.getStats().rejectedRequests()).isEqualTo(1);
    }

    @Test
    void acquire_waitWithinTimeout_granted() throws InterruptedException {
        drain();

        assertThat(limiter.acquire(Duration.ofSeconds(2))).isTrue();
        assertThat(time.sleeps()).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void acquireOrThrow_timeout_raisesRateLimitTimeout() {
        drain();

        assertThatThrownBy(() -> limiter.acquireOrThrow(Duration.ofMillis(100)))
                .isInstanceOfSatisfying(RateLimitTimeoutException.class,
                        e -> assertThat(e.getTimeout()).isEqualTo(Duration.ofMillis(100)));
    }

    @Test
    void disabled_alwaysGrantsAndStillCounts() throws InterruptedException {
        limiter.setEnabled(false);

        for (int i = 0; i < 10; i++) {
            assertThat(limiter.tryAcquire()).isTrue();
        }
        assertThat(limiter.acquire(Duration.ZERO)).isTrue();

        assertThat(limiter.getStats().totalRequests()).isEqualTo(11);
        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void perMinute_defaultBurstIsOneSixthOfRate() {
        TokenBucketRateLimiter fromRpm = TokenBucketRateLimiter.perMinute(60, null, true, time);

        assertThat(fromRpm.getCapacity()).isEqualTo(10.0);
        assertThat(fromRpm.getRefillRatePerSecond()).isEqualTo(1.0);
    }

    @Test
    void perMinute_lowRate_burstAtLeastOne() {
        TokenBucketRateLimiter slow = TokenBucketRateLimiter.perMinute(3, null, true, time);

        assertThat(slow.getCapacity()).isEqualTo(1.0);
    }

    @Test
    void perMinute_explicitBurst_used() {
        assertThat(TokenBucketRateLimiter.perMinute(60, 25, true, time).getCapacity()).isEqualTo(25.0);
    }

    @Test
    void constructor_nonPositiveRate_rejected() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(1, 0, true, time))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetStats_clearsCountersButNotTokens() {
        drain();
        limiter.resetStats();

        assertThat(limiter.getStats().totalRequests()).isZero();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    void tryAcquire_concurrentCallers_grantExactlyCapacity() throws Exception {
        TokenBucketRateLimiter shared = new TokenBucketRateLimiter(10, 0.001, true, time);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger granted = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                if (shared.tryAcquire()) {
                    granted.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(granted).hasValue(10);
        assertThat(shared.getStats().totalRequests()).isEqualTo(10);
    }

    @Test
    void acquire_concurrentWaiters_neverGrantMoreThanProduced() throws Exception {
        double capacity = 2;
        double ratePerSecond = 10;
        int waiters = 4;
        int acquiresEach = 5;
        TokenBucketRateLimiter shared = new TokenBucketRateLimiter(capacity, ratePerSecond, true, time);
        long startNanos = time.nanoTime();

        ExecutorService pool = Executors.newFixedThreadPool(waiters);
        AtomicInteger granted = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < waiters; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int n = 0; n < acquiresEach; n++) {
                    if (shared.acquire(Duration.ofMinutes(10))) {
                        granted.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        double elapsedSeconds = (time.nanoTime() - startNanos) / 1e9;
        assertThat(granted).hasValue(waiters * acquiresEach);
        assertThat((double) granted.get()).isLessThanOrEqualTo(capacity + ratePerSecond * elapsedSeconds + 1e-6);
        assertThat(shared.getStats().totalRequests()).isEqualTo(waiters * acquiresEach);
        assertThat(shared.availableTokens()).isBetween(0.0, capacity);
    }

    private void drain() {
        while (limiter.tryAcquire()) {
            // empty the bucket
        }
    }
}
