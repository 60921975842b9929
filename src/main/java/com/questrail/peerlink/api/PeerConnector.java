package com.questrail.peerlink.api;

import java.time.Duration;
import java.util.Optional;

/**
 * PeerConnector
 * -----------------------------------------------------------------------------
 * The narrow, transport-agnostic boundary through which collaborators (device
 * drivers, command encoders, dashboards) exchange tagged messages with exactly
 * one remote peer.
 *
 * <h2>Symmetric establishment</h2>
 * Both peers run identical logic. {@link #connect(PeerEndpoint)} binds a local
 * listening endpoint and, in the background, races an inbound accept against an
 * outbound dial to the peer. Either side may be started first.
 *
 * <h2>Threading</h2>
 * Implementations are thread-safe:
 * <ul>
 *   <li>{@code send} may be called concurrently; frames never interleave</li>
 *   <li>{@code receive} blocks the caller and may be called from any thread</li>
 *   <li>{@code send} and {@code receive} never block on each other</li>
 * </ul>
 *
 * <h2>Failure model</h2>
 * <ul>
 *   <li>{@link ConnectionNotEstablishedException}: no connection within the
 *       bounded connect wait (retryable)</li>
 *   <li>{@link LinkTransportException}: bind failure, write failure, or a lost
 *       link (terminal for this connector)</li>
 *   <li>{@link ConnectorClosedException}: the connector was closed</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * A connector is single-use. After {@link #close()} a new connector must be
 * created; state is never resurrected.
 */
public interface PeerConnector extends AutoCloseable
{
    /**
     * Binds {@code endpoint.listenPort()} and starts establishing the link in
     * the background. Returns without waiting for the peer.
     *
     * @throws LinkTransportException if the listening endpoint cannot be bound
     * @throws IllegalStateException  if already connected or closed
     */
    void connect(PeerEndpoint endpoint);

    default void connect(int listenPort, int peerPort) {
        connect(PeerEndpoint.of(listenPort, peerPort));
    }

    default void connect(int listenPort, int peerPort, String peerHost) {
        connect(PeerEndpoint.of(listenPort, peerPort, peerHost));
    }

    /**
     * Sends one message. Fire-and-forget: no acknowledgment is awaited.
     */
    void send(Message message);

    default void send(String tag) {
        send(Message.of(tag));
    }

    default void send(String tag, byte[] payload) {
        send(Message.of(tag, payload));
    }

    /**
     * Blocks until a message is available and returns it in arrival order.
     *
     * @throws ConnectionNotEstablishedException if the link never came up within the connect wait
     * @throws ConnectorClosedException          if the connector is closed while waiting
     * @throws LinkTransportException            if the link was lost and nothing is queued
     */
    Message receive();

    /**
     * Waits at most {@code timeout} for a message.
     *
     * @return the next message, or empty if none arrived in time
     */
    Optional<Message> receive(Duration timeout);

    /**
     * Returns the next queued message without blocking.
     */
    Optional<Message> tryReceive();

    ConnectionState state();

    /**
     * True iff a live transport handle exists and the link has not been lost
     * or closed.
     */
    boolean isConnected();

    /**
     * True once an established link has failed (peer disconnect, I/O error,
     * framing violation). The connector must then be closed and recreated.
     */
    boolean isLinkLost();

    /**
     * Stops background work, wakes blocked callers and releases all transport
     * resources. Idempotent, never throws, completes in bounded time.
     */
    @Override
    void close();
}
