package com.localllm.agent.resilience;

import java.time.Duration;

/**
 * Clock and sleeper shared by the resilience components.
 *
 * All elapsed-time arithmetic (token refill, breaker reset timeout, cache TTL)
 * is done on the monotonic {@link #nanoTime()} reading, never on wall-clock time,
 * so NTP adjustments cannot expire entries early or open a breaker late.
 *
 * {@link #sleep(Duration)} is the single suspension primitive: it is always
 * called with no lock held.
 */
public interface TimeSource {

    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            long nanos = duration.toNanos();
            if (nanos > 0) {
                Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
            }
        }
    };

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;
}
