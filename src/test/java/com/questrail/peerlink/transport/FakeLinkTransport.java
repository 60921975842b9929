package com.questrail.peerlink.transport;

import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.api.PeerEndpoint;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeLinkTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link LinkTransport} implementation.
 *
 * <p>It contains no sockets and no framing; it only stores outbound messages
 * and lets tests bring the link up, inject inbound messages and fail the link
 * on demand.</p>
 */
public final class FakeLinkTransport implements LinkTransport {

    private LinkTransportListener listener;
    private final List<Message> sent = Collections.synchronizedList(new ArrayList<>());

    private volatile PeerEndpoint opened;
    private volatile boolean up;
    private volatile boolean closed;
    private volatile int closeCount;
    private volatile IOException failOpenWith;
    private volatile IOException failWriteWith;

    @Override
    public void setListener(LinkTransportListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open(PeerEndpoint endpoint) throws IOException {
        if (failOpenWith != null) {
            throw failOpenWith;
        }
        this.opened = endpoint;
    }

    @Override
    public boolean isConnected() {
        return up && !closed;
    }

    @Override
    public void write(Message message) throws IOException {
        if (failWriteWith != null) {
            throw failWriteWith;
        }
        if (!isConnected()) {
            throw new IOException("not connected");
        }
        sent.add(message);
    }

    @Override
    public void close() {
        closed = true;
        closeCount++;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void bringUp() {
        up = true;
        requireListener().onLinkUp("fake");
    }

    public void inject(Message message) {
        requireListener().onMessage(message);
    }

    public void dropLink(Throwable cause) {
        up = false;
        requireListener().onLinkDown(cause);
    }

    public void failOpenWith(IOException e) {
        this.failOpenWith = e;
    }

    public void failWriteWith(IOException e) {
        this.failWriteWith = e;
    }

    public PeerEndpoint opened() {
        return opened;
    }

    public boolean isClosed() {
        return closed;
    }

    public int closeCount() {
        return closeCount;
    }

    public List<Message> sent() {
        synchronized (sent) {
            return new ArrayList<>(sent);
        }
    }

    private LinkTransportListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
