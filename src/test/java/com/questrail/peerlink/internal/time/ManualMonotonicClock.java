package com.questrail.peerlink.internal.time;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic test clock. It stands still unless advanced.
 *
 * <p>With a non-zero {@code tick}, every reading moves the clock forward by
 * that step after returning, so the n-th reading inside a timed operation is
 * predictable and measured durations come out as exact multiples of the tick.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong now = new AtomicLong();
    private final long tickNanos;

    public ManualMonotonicClock() {
        this(Duration.ZERO);
    }

    public ManualMonotonicClock(Duration tick) {
        if (tick.isNegative()) {
            throw new IllegalArgumentException("tick must not be negative: " + tick);
        }
        this.tickNanos = tick.toNanos();
    }

    @Override
    public long nowNanos() {
        return now.getAndAdd(tickNanos);
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("clock cannot move backwards: " + delta);
        }
        now.addAndGet(delta.toNanos());
    }
}
