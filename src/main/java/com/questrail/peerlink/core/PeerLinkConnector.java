package com.questrail.peerlink.core;

import com.questrail.peerlink.api.ConnectionNotEstablishedException;
import com.questrail.peerlink.api.ConnectionState;
import com.questrail.peerlink.api.ConnectorClosedException;
import com.questrail.peerlink.api.LinkTransportException;
import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.api.PeerConnector;
import com.questrail.peerlink.api.PeerEndpoint;
import com.questrail.peerlink.api.PeerLinkException;
import com.questrail.peerlink.config.LinkTimingPolicy;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.observability.LinkErrorEvent;
import com.questrail.peerlink.observability.LinkMessageEvent;
import com.questrail.peerlink.observability.LinkObservabilitySink;
import com.questrail.peerlink.observability.LinkTransportEvent;
import com.questrail.peerlink.transport.LinkTransport;
import com.questrail.peerlink.transport.LinkTransportListener;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PeerLinkConnector
 * =============================================================================
 * Transport-agnostic implementation of {@link PeerConnector}.
 *
 * <h2>Architectural Role</h2>
 * This class owns everything that is the same for every binding:
 * <ul>
 *   <li>the {@link ConnectionState} machine and bounded connect waits</li>
 *   <li>the {@link InboundQueue} feeding blocking receivers</li>
 *   <li>the write lock that keeps concurrent frames from interleaving</li>
 *   <li>link-loss bookkeeping and the close sequence</li>
 * </ul>
 *
 * <p>Listening, dialing, reading and framing live behind {@link LinkTransport}.</p>
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   LinkTransport reader / event loop
 *        → LinkTransportListener.onMessage
 *            → InboundQueue
 *                → receive()
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   send()
 *        → await CONNECTED (bounded)
 *            → write lock
 *                → LinkTransport.write
 * </pre>
 *
 * <h2>Link loss</h2>
 * A failed reader or write does not move the state machine back; the state stays
 * {@code CONNECTED} and {@link #isLinkLost()} turns true. Sends then fail with
 * {@link LinkTransportException}, and receivers drain whatever was queued before
 * failing the same way. There is no reconnection at this layer.
 */
public final class PeerLinkConnector implements PeerConnector
{
    private final LinkTransport transport;
    private final LinkTimingPolicy timing;
    private final LinkObservabilitySink sink;
    private final MonotonicClock clock;

    private final ConnectionStateTracker stateTracker;
    private final InboundQueue inbound = new InboundQueue();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Object lifecycleLock = new Object();

    private final AtomicBoolean linkLost = new AtomicBoolean();
    private volatile boolean closed;
    private boolean connectCalled;

    public PeerLinkConnector(LinkTransport transport,
                             LinkTimingPolicy timing,
                             LinkObservabilitySink sink,
                             MonotonicClock clock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stateTracker = new ConnectionStateTracker(sink);

        this.transport.setListener(new Listener());
    }

    @Override
    public void connect(PeerEndpoint endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");

        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Connector is closed; create a new one");
            }
            if (connectCalled) {
                throw new IllegalStateException("connect() may only be called once");
            }
            connectCalled = true;

            stateTracker.transition(ConnectionState.ESTABLISHING);
            try {
                transport.open(endpoint);
            } catch (IOException e) {
                // Establishment-phase failure: surface synchronously and abort.
                sink.onError(LinkErrorEvent.of("Failed to open " + endpoint, e));
                transport.close();
                stateTracker.transition(ConnectionState.CLOSED);
                inbound.close();
                closed = true;
                throw new LinkTransportException("Cannot listen on port " + endpoint.listenPort(), e);
            }
        }
    }

    @Override
    public void send(Message message)
    {
        Objects.requireNonNull(message, "message");
        awaitConnected();

        if (linkLost.get()) {
            throw new LinkTransportException("Connection to peer lost");
        }

        final long start = clock.nowNanos();
        writeLock.lock();
        try {
            transport.write(message);
        } catch (IOException e) {
            onLinkFailure(e);
            throw new LinkTransportException("Send failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }

        sink.onMessageEvent(new LinkMessageEvent(
                Instant.now(),
                LinkMessageEvent.Stage.SENT,
                message.tag(),
                message.payloadLength(),
                clock.nowNanos() - start));
    }

    @Override
    public Message receive()
    {
        awaitConnected();

        final long start = clock.nowNanos();
        try {
            Message message = inbound.take();
            delivered(message, start);
            return message;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PeerLinkException("Interrupted while waiting for a message", e);
        }
    }

    /**
     * Polls the inbound queue for up to {@code timeout}. Unlike {@link #receive()}
     * this does not wait for the link first; an idle or not-yet-connected link
     * simply yields empty.
     */
    @Override
    public Optional<Message> receive(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");

        final long start = clock.nowNanos();
        try {
            Optional<Message> message = inbound.poll(timeout);
            message.ifPresent(m -> delivered(m, start));
            return message;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PeerLinkException("Interrupted while waiting for a message", e);
        }
    }

    @Override
    public Optional<Message> tryReceive()
    {
        Optional<Message> message = inbound.poll();
        message.ifPresent(m -> delivered(m, clock.nowNanos()));
        return message;
    }

    @Override
    public ConnectionState state()
    {
        return stateTracker.state();
    }

    @Override
    public boolean isConnected()
    {
        return !closed
                && !linkLost.get()
                && stateTracker.state() == ConnectionState.CONNECTED
                && transport.isConnected();
    }

    @Override
    public boolean isLinkLost()
    {
        return linkLost.get();
    }

    @Override
    public void close()
    {
        final boolean drain;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            drain = connectCalled;
        }

        try {
            stateTracker.transition(ConnectionState.CLOSED);
            inbound.close();
            transport.close();
        } catch (RuntimeException e) {
            sink.onError(LinkErrorEvent.of("Error while closing connector", e));
        }

        if (drain && !timing.closeDrainDelay().isZero()) {
            try {
                Thread.sleep(timing.closeDrainDelay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String toString()
    {
        return "PeerLinkConnector[state=" + stateTracker.state() + ", linkLost=" + linkLost.get() + ']';
    }

    private void awaitConnected()
    {
        if (closed) {
            throw new ConnectorClosedException();
        }
        try {
            if (!stateTracker.awaitConnected(timing.connectWait())) {
                throw new ConnectionNotEstablishedException(timing.connectWait());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PeerLinkException("Interrupted while waiting for connection", e);
        }
    }

    private void delivered(Message message, long startNanos)
    {
        sink.onMessageEvent(new LinkMessageEvent(
                Instant.now(),
                LinkMessageEvent.Stage.DELIVERED,
                message.tag(),
                message.payloadLength(),
                clock.nowNanos() - startNanos));
    }

    private void onLinkFailure(Throwable cause)
    {
        if (!linkLost.compareAndSet(false, true)) {
            return;
        }
        inbound.markLinkLost(cause);
        sink.onTransportEvent(LinkTransportEvent.of(
                LinkTransportEvent.Kind.LINK_LOST,
                cause == null ? "peer disconnected" : String.valueOf(cause.getMessage())));
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    private final class Listener implements LinkTransportListener
    {
        @Override
        public void onLinkUp(String description)
        {
            if (stateTracker.transition(ConnectionState.CONNECTED)) {
                sink.onTransportEvent(LinkTransportEvent.of(LinkTransportEvent.Kind.LINK_UP, description));
            }
        }

        @Override
        public void onMessage(Message message)
        {
            if (inbound.put(message)) {
                sink.onMessageEvent(new LinkMessageEvent(
                        Instant.now(),
                        LinkMessageEvent.Stage.QUEUED,
                        message.tag(),
                        message.payloadLength(),
                        0L));
            }
        }

        @Override
        public void onLinkDown(Throwable cause)
        {
            if (!closed) {
                onLinkFailure(cause);
            }
        }
    }
}
