package com.questrail.peerlink.transport;

import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.api.PeerEndpoint;

import java.io.IOException;

/**
 * LinkTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a point-to-point link binding (stream socket, paired channel,
 * or a test double).
 *
 * <p>This port is intentionally small. The connector above it is responsible
 * for:</p>
 * <ul>
 *   <li>connection state and bounded waits</li>
 *   <li>queueing inbound messages for blocking receivers</li>
 *   <li>serializing concurrent writers</li>
 * </ul>
 *
 * <p>Implementations own listening, dialing, reading, framing and releasing
 * their handles.</p>
 */
public interface LinkTransport
{
    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #open(PeerEndpoint)}.</p>
     */
    void setListener(LinkTransportListener listener);

    /**
     * Bind the local listening endpoint and start establishing the link in the
     * background. Returns once the bind has succeeded.
     *
     * <p>When a usable link exists the implementation MUST notify its listener via
     * {@link LinkTransportListener#onLinkUp(String)} exactly once.</p>
     *
     * @throws IOException if the listening endpoint cannot be bound
     */
    void open(PeerEndpoint endpoint) throws IOException;

    /**
     * True iff a live handle exists and neither side of it has been closed.
     */
    boolean isConnected();

    /**
     * Write one message. Callers serialize invocations; implementations need not
     * guard against concurrent writers.
     *
     * @throws IOException if there is no live handle or the write fails
     */
    void write(Message message) throws IOException;

    /**
     * Stop background work, then release every handle. Idempotent and safe
     * after a failed {@link #open(PeerEndpoint)}. Must not notify
     * {@link LinkTransportListener#onLinkDown(Throwable)}.
     */
    void close();
}
