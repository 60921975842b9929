package com.questrail.peerlink.config;

import java.time.Duration;
import java.util.Objects;

/**
 * LinkTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for link establishment, blocking waits and teardown.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>dialAttemptTimeout</b>: Upper bound for a single outbound connect
 *       attempt to the peer.</li>
 *   <li><b>dialRetryBackoff</b>: Pause between failed outbound attempts.</li>
 *   <li><b>acceptPollInterval</b>: How often a parked accept wakes up to check
 *       whether it should stop.</li>
 *   <li><b>readPollInterval</b>: Socket read timeout used by the stream reader
 *       so it notices shutdown without the handle being yanked underneath it.</li>
 *   <li><b>connectWait</b>: How long {@code send}/{@code receive} wait for the
 *       link to come up before reporting "not connected".</li>
 *   <li><b>simultaneousOpenGrace</b>: How long a non-preferred connection is
 *       held while waiting for the preferred one when both peers dial at once.</li>
 *   <li><b>closeJoinTimeout</b>: Upper bound for joining background threads
 *       during close.</li>
 *   <li><b>closeDrainDelay</b>: Pause after releasing sockets so the OS can
 *       reclaim ports before the caller reuses them.</li>
 * </ul>
 */
public record LinkTimingPolicy(
        Duration dialAttemptTimeout,
        Duration dialRetryBackoff,
        Duration acceptPollInterval,
        Duration readPollInterval,
        Duration connectWait,
        Duration simultaneousOpenGrace,
        Duration closeJoinTimeout,
        Duration closeDrainDelay
) {
    public LinkTimingPolicy {
        requireNonNegative(dialAttemptTimeout, "dialAttemptTimeout");
        requireNonNegative(dialRetryBackoff, "dialRetryBackoff");
        requirePositive(acceptPollInterval, "acceptPollInterval");
        requirePositive(readPollInterval, "readPollInterval");
        requireNonNegative(connectWait, "connectWait");
        requireNonNegative(simultaneousOpenGrace, "simultaneousOpenGrace");
        requireNonNegative(closeJoinTimeout, "closeJoinTimeout");
        requireNonNegative(closeDrainDelay, "closeDrainDelay");
        if (dialAttemptTimeout.isZero()) {
            throw new IllegalArgumentException("dialAttemptTimeout must be positive");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>dialAttemptTimeout: 500ms</li>
     *   <li>dialRetryBackoff: 200ms</li>
     *   <li>acceptPollInterval: 200ms</li>
     *   <li>readPollInterval: 200ms</li>
     *   <li>connectWait: 2s</li>
     *   <li>simultaneousOpenGrace: 1s</li>
     *   <li>closeJoinTimeout: 2s</li>
     *   <li>closeDrainDelay: 250ms</li>
     * </ul>
     */
    public static LinkTimingPolicy defaults() {
        return new LinkTimingPolicy(
                Duration.ofMillis(500),
                Duration.ofMillis(200),
                Duration.ofMillis(200),
                Duration.ofMillis(200),
                Duration.ofSeconds(2),
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofMillis(250)
        );
    }

    public LinkTimingPolicy withConnectWait(Duration connectWait) {
        return new LinkTimingPolicy(dialAttemptTimeout, dialRetryBackoff, acceptPollInterval, readPollInterval,
                connectWait, simultaneousOpenGrace, closeJoinTimeout, closeDrainDelay);
    }

    public LinkTimingPolicy withSimultaneousOpenGrace(Duration grace) {
        return new LinkTimingPolicy(dialAttemptTimeout, dialRetryBackoff, acceptPollInterval, readPollInterval,
                connectWait, grace, closeJoinTimeout, closeDrainDelay);
    }

    public LinkTimingPolicy withCloseDrainDelay(Duration closeDrainDelay) {
        return new LinkTimingPolicy(dialAttemptTimeout, dialRetryBackoff, acceptPollInterval, readPollInterval,
                connectWait, simultaneousOpenGrace, closeJoinTimeout, closeDrainDelay);
    }

    public LinkTimingPolicy withDialRetryBackoff(Duration backoff) {
        return new LinkTimingPolicy(dialAttemptTimeout, backoff, acceptPollInterval, readPollInterval,
                connectWait, simultaneousOpenGrace, closeJoinTimeout, closeDrainDelay);
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }

    private static void requirePositive(Duration d, String name) {
        requireNonNegative(d, name);
        if (d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
