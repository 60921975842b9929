package com.questrail.peerlink.api;

/**
 * Base type for all failures reported by a {@link PeerConnector}.
 *
 * <p>Subtypes let callers tell "never connected" apart from "was connected,
 * now broken" without inspecting messages or causes.</p>
 */
public class PeerLinkException extends RuntimeException
{
    public PeerLinkException(String message) {
        super(message);
    }

    public PeerLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
