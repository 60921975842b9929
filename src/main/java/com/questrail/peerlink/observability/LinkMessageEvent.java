package com.questrail.peerlink.observability;

import java.time.Instant;

/**
 * Record representing one message passing through the connector.
 *
 * <p>{@code elapsedNanos} is the time the operation took: encode plus write for
 * {@link Stage#SENT}, time spent blocked for {@link Stage#DELIVERED}, and zero for
 * {@link Stage#QUEUED}.</p>
 */
public record LinkMessageEvent(
    Instant timestamp,
    Stage stage,
    String tag,
    int payloadLength,
    long elapsedNanos
) {
    public enum Stage {
        /** Written to the transport by {@code send}. */
        SENT,
        /** Decoded from the transport and appended to the inbound queue. */
        QUEUED,
        /** Handed to a {@code receive} caller. */
        DELIVERED
    }
}
