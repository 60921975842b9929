package com.questrail.peerlink.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the link stack.
 */
public record LinkErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
    public static LinkErrorEvent of(String message, Throwable cause) {
        return new LinkErrorEvent(Instant.now(), message, cause);
    }
}
