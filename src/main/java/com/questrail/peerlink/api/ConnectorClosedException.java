package com.questrail.peerlink.api;

/**
 * Raised when an operation is attempted on a closed connector, or when a
 * blocked {@code receive} is released because the connector was closed.
 */
public final class ConnectorClosedException extends PeerLinkException
{
    public ConnectorClosedException() {
        super("Connector is closed");
    }
}
