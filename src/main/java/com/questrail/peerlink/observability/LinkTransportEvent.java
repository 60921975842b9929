package com.questrail.peerlink.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a transport lifecycle event.
 *
 * <p>{@code detail} is free text for diagnostics (addresses, causes); it carries
 * no semantics.</p>
 */
public record LinkTransportEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        /** Local listening endpoint bound. */
        LISTENING,
        /** An outbound attempt failed; another will follow after the backoff. */
        DIAL_FAILED,
        /** An inbound connection was accepted. */
        ACCEPTED,
        /** An outbound connection was established. */
        DIALED,
        /** A surplus connection lost the race (or the preference) and was closed. */
        HANDLE_DISCARDED,
        /** The link is usable. */
        LINK_UP,
        /** An established link failed. */
        LINK_LOST,
        /** The transport released its resources. */
        CLOSED
    }

    public LinkTransportEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
    }

    public static LinkTransportEvent of(Kind kind, String detail) {
        return new LinkTransportEvent(Instant.now(), kind, detail);
    }
}
