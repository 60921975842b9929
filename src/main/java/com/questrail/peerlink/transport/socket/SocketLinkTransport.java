package com.questrail.peerlink.transport.socket;

import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.api.PeerEndpoint;
import com.questrail.peerlink.codec.FrameCodec;
import com.questrail.peerlink.config.LinkTimingPolicy;
import com.questrail.peerlink.internal.establish.ConnectionEstablisher;
import com.questrail.peerlink.internal.establish.ConnectionEstablisher.Origin;
import com.questrail.peerlink.internal.establish.ConnectionEstablisher.Preference;
import com.questrail.peerlink.observability.LinkErrorEvent;
import com.questrail.peerlink.observability.LinkObservabilitySink;
import com.questrail.peerlink.observability.LinkTransportEvent;
import com.questrail.peerlink.transport.LinkTransport;
import com.questrail.peerlink.transport.LinkTransportListener;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * SocketLinkTransport
 * =============================================================================
 * Plain TCP implementation of the {@link LinkTransport} port.
 *
 * <h2>Establishment</h2>
 * {@link #open(PeerEndpoint)} binds the listening socket synchronously, then
 * hands an accept function and a dial function to a
 * {@link ConnectionEstablisher}. The winning socket gets a read timeout of
 * {@link LinkTimingPolicy#readPollInterval()} and a dedicated
 * {@link StreamReader} thread.
 *
 * <h2>Framing</h2>
 * TCP is a byte stream, so every message is written as one length-prefixed
 * frame produced by the {@link FrameCodec}; the reader reassembles frames from
 * whatever chunk sizes the kernel delivers.
 *
 * <h2>Shutdown order</h2>
 * <ol>
 *   <li>stop the establisher (seals the handle slot, joins accept/dial loops)</li>
 *   <li>stop and join the reader</li>
 *   <li>close the connected socket and the listening socket</li>
 * </ol>
 * Handles are released only after every loop that could touch them has exited.
 */
public final class SocketLinkTransport implements LinkTransport
{
    private final LinkTimingPolicy timing;
    private final FrameCodec codec;
    private final LinkObservabilitySink sink;

    private final Object lifecycleLock = new Object();

    private volatile LinkTransportListener listener;
    private volatile boolean running;
    private volatile boolean linkDown;
    private volatile Socket socket;
    private volatile OutputStream out;

    private ServerSocket serverSocket;
    private ConnectionEstablisher<Socket> establisher;
    private StreamReader reader;
    private Thread readerThread;
    private boolean closed;

    public SocketLinkTransport(LinkTimingPolicy timing, FrameCodec codec, LinkObservabilitySink sink)
    {
        this.timing = Objects.requireNonNull(timing, "timing");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void setListener(LinkTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open(PeerEndpoint endpoint) throws IOException
    {
        Objects.requireNonNull(endpoint, "endpoint");
        requireListener();

        synchronized (lifecycleLock) {
            if (closed || serverSocket != null) {
                throw new IllegalStateException("SocketLinkTransport can only be opened once");
            }

            ServerSocket server = new ServerSocket();
            try {
                server.setReuseAddress(true);
                server.bind(new InetSocketAddress(endpoint.listenPort()));
                server.setSoTimeout(toMillis(timing.acceptPollInterval()));
            } catch (IOException e) {
                closeQuietly(server, "listening socket");
                throw e;
            }
            serverSocket = server;
            running = true;
            sink.onTransportEvent(LinkTransportEvent.of(
                    LinkTransportEvent.Kind.LISTENING,
                    "tcp port " + endpoint.listenPort()));

            final InetSocketAddress peer = new InetSocketAddress(endpoint.peerHost(), endpoint.peerPort());
            establisher = new ConnectionEstablisher<>(
                    "peerlink-tcp-" + endpoint.listenPort(),
                    pollInterval -> accept(server),
                    attemptTimeout -> dial(peer, attemptTimeout),
                    candidate -> preferenceFor(endpoint, candidate),
                    timing,
                    sink,
                    this::onEstablished);
            establisher.start();
        }
    }

    @Override
    public boolean isConnected()
    {
        Socket s = socket;
        return running
                && !linkDown
                && s != null
                && s.isConnected()
                && !s.isClosed();
    }

    @Override
    public void write(Message message) throws IOException
    {
        OutputStream o = out;
        if (o == null || !isConnected()) {
            throw new IOException("No live connection to peer");
        }
        // Encode first so an oversized message never leaves a partial frame on the wire.
        byte[] frame = codec.encode(message);
        o.write(frame);
        o.flush();
    }

    @Override
    public void close()
    {
        final ConnectionEstablisher<Socket> est;
        final StreamReader r;
        final Thread rt;
        final ServerSocket server;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            running = false;
            est = establisher;
            r = reader;
            rt = readerThread;
            server = serverSocket;
        }

        if (est != null) {
            est.stop();
        }

        if (r != null) {
            r.stop();
        }
        if (rt != null && rt != Thread.currentThread()) {
            try {
                rt.join(timing.closeJoinTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        Socket s = socket;
        if (s != null) {
            closeQuietly(s, "connected socket");
        }
        if (server != null) {
            closeQuietly(server, "listening socket");
        }
        out = null;

        sink.onTransportEvent(LinkTransportEvent.of(LinkTransportEvent.Kind.CLOSED, "tcp"));
    }

    @Override
    public String toString()
    {
        return "SocketLinkTransport[" + socket + ']';
    }

    // -------------------------------------------------------------------------
    // Establishment
    // -------------------------------------------------------------------------

    static Preference preferenceFor(PeerEndpoint endpoint, Socket candidate)
    {
        return preferenceFor(endpoint, candidate.getLocalAddress(), candidate.getInetAddress());
    }

    /**
     * Both peers keep the connection dialed by the lower listening port. When
     * the ports are equal the lower address breaks the tie, compared the same
     * way on both sides so they agree. Only a fully equal pair has no
     * preference.
     */
    static Preference preferenceFor(PeerEndpoint endpoint, InetAddress local, InetAddress remote)
    {
        if (!endpoint.symmetricPorts()) {
            return endpoint.prefersDialed() ? Preference.DIALED : Preference.ACCEPTED;
        }
        if (local == null || remote == null) {
            return Preference.NONE;
        }
        int order = compareAddresses(local, remote);
        if (order == 0) {
            return Preference.NONE;
        }
        return order < 0 ? Preference.DIALED : Preference.ACCEPTED;
    }

    private static int compareAddresses(InetAddress a, InetAddress b)
    {
        byte[] x = a.getAddress();
        byte[] y = b.getAddress();
        if (x.length != y.length) {
            return Integer.compare(x.length, y.length);
        }
        return Arrays.compareUnsigned(x, y);
    }

    private Optional<Socket> accept(ServerSocket server) throws IOException
    {
        try {
            Socket accepted = server.accept();
            accepted.setTcpNoDelay(true);
            return Optional.of(accepted);
        } catch (SocketTimeoutException e) {
            return Optional.empty();
        }
    }

    private Socket dial(InetSocketAddress peer, Duration attemptTimeout) throws IOException
    {
        Socket s = new Socket();
        try {
            s.setTcpNoDelay(true);
            s.connect(peer, toMillis(attemptTimeout));
            return s;
        } catch (IOException e) {
            closeQuietly(s, "failed dial socket");
            throw e;
        }
    }

    private void onEstablished(Socket established, Origin origin)
    {
        final Thread thread;
        synchronized (lifecycleLock) {
            if (!running) {
                closeQuietly(established, "connected socket");
                return;
            }
            try {
                established.setSoTimeout(toMillis(timing.readPollInterval()));
                out = established.getOutputStream();
                reader = new StreamReader(established.getInputStream(), codec, new ReaderSink());
            } catch (IOException e) {
                sink.onError(LinkErrorEvent.of("Cannot use " + origin + " connection " + established, e));
                closeQuietly(established, "connected socket");
                return;
            }
            socket = established;
            thread = new Thread(reader, "peerlink-tcp-reader-" + established.getLocalPort());
            thread.setDaemon(true);
            readerThread = thread;
        }

        requireListener().onLinkUp(origin.name().toLowerCase() + " " + established.getLocalSocketAddress()
                + " <-> " + established.getRemoteSocketAddress());
        thread.start();
    }

    // -------------------------------------------------------------------------
    // Reader callbacks
    // -------------------------------------------------------------------------

    private final class ReaderSink implements StreamReader.Sink
    {
        @Override
        public void onMessage(Message message)
        {
            LinkTransportListener l = listener;
            if (l != null && running) {
                l.onMessage(message);
            }
        }

        @Override
        public void onEnd(Throwable cause)
        {
            if (!running) {
                return;
            }
            linkDown = true;
            Socket s = socket;
            if (s != null) {
                closeQuietly(s, "connected socket");
            }
            LinkTransportListener l = listener;
            if (l != null) {
                l.onLinkDown(cause);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private LinkTransportListener requireListener()
    {
        LinkTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LinkTransportListener must be set before open()");
        }
        return l;
    }

    private void closeQuietly(Closeable closeable, String what)
    {
        try {
            closeable.close();
        } catch (IOException e) {
            sink.onError(LinkErrorEvent.of("Failed to close " + what, e));
        }
    }

    private static int toMillis(Duration d)
    {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, d.toMillis()));
    }
}
