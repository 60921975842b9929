package com.questrail.peerlink.transport;

import com.questrail.peerlink.api.Message;

/**
 * LinkTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link LinkTransport}.
 *
 * <p>{@link #onMessage(Message)} calls are delivered serially and in wire order
 * (one reader thread, or one event loop). Lifecycle callbacks may come from any
 * transport thread.</p>
 */
public interface LinkTransportListener
{
    /**
     * Called once when the link becomes usable.
     *
     * @param description human-readable description of the winning handle
     */
    void onLinkUp(String description);

    /**
     * Called for every complete message received, in arrival order.
     */
    void onMessage(Message message);

    /**
     * Called at most once when an established link fails (peer disconnect, I/O
     * error, framing violation). Not called for an orderly {@code close()}.
     *
     * @param cause diagnostic cause; {@code null} for a clean peer disconnect
     */
    void onLinkDown(Throwable cause);
}
