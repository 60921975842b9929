package com.questrail.peerlink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for bounded waits, retry spacing and operation timings.
 *
 * <h2>Binding invariant</h2>
 * Deadlines and elapsed-time measurements MUST use a monotonic time source.
 * Wall-clock time (e.g. {@code Instant.now()}) is permitted only for
 * observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
