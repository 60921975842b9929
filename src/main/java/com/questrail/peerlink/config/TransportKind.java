package com.questrail.peerlink.config;

/**
 * Transport binding selected when a connector is built.
 */
public enum TransportKind
{
    /** Raw TCP sockets with length-prefixed framing; accept and dial race for one connection. */
    STREAM_SOCKET,

    /** Netty paired channels: bind one, connect one, message-oriented delivery. */
    PAIRED_CHANNEL
}
