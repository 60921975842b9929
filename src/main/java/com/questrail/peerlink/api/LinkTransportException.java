package com.questrail.peerlink.api;

/**
 * A transport-level failure: the listener could not be bound, a write failed,
 * or an established link was lost.
 *
 * <p>Once a connector has reported a lost link it stays unusable; the caller
 * must close it and create a new one.</p>
 */
public final class LinkTransportException extends PeerLinkException
{
    public LinkTransportException(String message) {
        super(message);
    }

    public LinkTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
