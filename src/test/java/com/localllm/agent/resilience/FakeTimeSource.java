package com.localllm.agent.resilience;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manually driven clock. {@link #sleep} returns immediately after advancing time
 * by the requested amount, and remembers every requested sleep.
 */
public class FakeTimeSource implements TimeSource {

    // arbitrary non-zero origin, nanoTime has no fixed epoch
    private final AtomicLong now = new AtomicLong(1_000_000_000_000L);
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public long nanoTime() {
        return now.get();
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        advance(duration);
    }

    public void advance(Duration duration) {
        now.addAndGet(duration.toNanos());
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
