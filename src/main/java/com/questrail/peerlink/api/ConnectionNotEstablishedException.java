package com.questrail.peerlink.api;

import java.time.Duration;

/**
 * Raised by {@code send}/{@code receive} when no connection was established
 * within the bounded connect wait.
 *
 * <p>This condition is recoverable: the peer may simply not be up yet, and the
 * caller may retry later on the same connector.</p>
 */
public final class ConnectionNotEstablishedException extends PeerLinkException
{
    private final Duration waited;

    public ConnectionNotEstablishedException(Duration waited) {
        super("Not connected to peer after waiting " + waited.toMillis() + " ms");
        this.waited = waited;
    }

    public Duration waited() {
        return waited;
    }
}
