package com.questrail.peerlink.api;

/**
 * Indicates a frame whose declared tag or payload length exceeds the configured
 * limits, or a message too large to encode.
 *
 * <p>On the receive path this is fatal for the connection. The wire format has
 * no sync marker, so no attempt is made to find the next frame boundary.</p>
 */
public final class LinkFramingException extends PeerLinkException
{
    public LinkFramingException(String message) {
        super(message);
    }
}
