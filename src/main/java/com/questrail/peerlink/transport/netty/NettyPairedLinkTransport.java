package com.questrail.peerlink.transport.netty;

import com.questrail.peerlink.api.LinkFramingException;
import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.api.PeerEndpoint;
import com.questrail.peerlink.codec.impl.LengthPrefixedFrameCodec;
import com.questrail.peerlink.config.LinkTimingPolicy;
import com.questrail.peerlink.observability.LinkErrorEvent;
import com.questrail.peerlink.observability.LinkObservabilitySink;
import com.questrail.peerlink.observability.LinkTransportEvent;
import com.questrail.peerlink.transport.LinkTransport;
import com.questrail.peerlink.transport.LinkTransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyPairedLinkTransport
 * =============================================================================
 * Netty-backed implementation of the {@link LinkTransport} port using a pair of
 * one-way channels.
 *
 * <h2>Topology</h2>
 * Each side binds one channel on its listening port and connects a second
 * channel to the peer's listening port:
 * <pre>
 *   A.outbound  ──►  B.inbound (accepted child)
 *   A.inbound   ◄──  B.outbound
 * </pre>
 * A side writes only on its outbound channel and reads only from the child it
 * accepted. There is no accept/dial race: both channels are needed, and the
 * link is up once both are active.
 *
 * <h2>Message boundaries</h2>
 * Netty's own length-field codecs delimit each part. A message travels as two
 * consecutive parts, the UTF-8 tag and then the payload (possibly empty), and
 * the inbound handler pairs them back up. Callers never see any of this.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound parts are copied into plain arrays and
 * every reference-counted buffer is released here.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #open(PeerEndpoint)} binds synchronously, then keeps connecting
 *       to the peer every {@link LinkTimingPolicy#dialRetryBackoff()} until it
 *       succeeds</li>
 *   <li>after the link is up, the loss of either channel is reported once via
 *       {@link LinkTransportListener#onLinkDown(Throwable)}; nothing reconnects</li>
 *   <li>{@link #close()} closes both channels and shuts the event loop group
 *       down, bounded by {@link LinkTimingPolicy#closeJoinTimeout()}</li>
 * </ul>
 */
public final class NettyPairedLinkTransport implements LinkTransport
{
    private static final int LENGTH_FIELD_BYTES = 4;

    private final LinkTimingPolicy timing;
    private final LinkObservabilitySink sink;
    private final int maxTagBytes;
    private final int maxPayloadBytes;

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean linkUp = new AtomicBoolean();
    private final AtomicBoolean linkDown = new AtomicBoolean();

    private volatile LinkTransportListener listener;
    private volatile boolean running;
    private volatile Channel serverChannel;
    private volatile Channel inbound;
    private volatile Channel outbound;

    private EventLoopGroup group;
    private Bootstrap clientBootstrap;
    private InetSocketAddress peerAddress;
    private boolean closed;

    public NettyPairedLinkTransport(LinkTimingPolicy timing,
                                    LinkObservabilitySink sink,
                                    int maxTagBytes,
                                    int maxPayloadBytes)
    {
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (maxTagBytes <= 0) {
            throw new IllegalArgumentException("maxTagBytes must be positive");
        }
        if (maxPayloadBytes < 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be non-negative");
        }
        if (maxFramedPartBytes(maxTagBytes, maxPayloadBytes) > LengthPrefixedFrameCodec.MAX_FRAME_BYTES) {
            throw new IllegalArgumentException("A framed part of up to " + Math.max(maxTagBytes, maxPayloadBytes)
                    + " bytes exceeds " + LengthPrefixedFrameCodec.MAX_FRAME_BYTES);
        }
        this.maxTagBytes = maxTagBytes;
        this.maxPayloadBytes = maxPayloadBytes;
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
            if (closed || group != null) {
                throw new IllegalStateException("NettyPairedLinkTransport can only be opened once");
            }

            // One loop for the accepted child, one for the outbound channel.
            group = new NioEventLoopGroup(2);
            peerAddress = new InetSocketAddress(endpoint.peerHost(), endpoint.peerPort());

            ServerBootstrap serverBootstrap = new ServerBootstrap()
                    .group(group)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch)
                        {
                            onInboundChannel(ch);
                        }
                    });

            ChannelFuture bound = serverBootstrap.bind(endpoint.listenPort()).awaitUninterruptibly();
            if (!bound.isSuccess()) {
                shutdownGroup();
                Throwable cause = bound.cause();
                if (cause instanceof IOException) {
                    throw (IOException) cause;
                }
                throw new IOException("Cannot bind port " + endpoint.listenPort(), cause);
            }
            serverChannel = bound.channel();
            running = true;
            sink.onTransportEvent(LinkTransportEvent.of(
                    LinkTransportEvent.Kind.LISTENING,
                    "paired port " + endpoint.listenPort()));

            clientBootstrap = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timing.dialAttemptTimeout().toMillis())
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch)
                        {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new LengthFieldPrepender(ByteOrder.LITTLE_ENDIAN, LENGTH_FIELD_BYTES, 0, false));
                            p.addLast(new OutboundWatcher());
                        }
                    });

            dial();
        }
    }

    @Override
    public boolean isConnected()
    {
        Channel server = serverChannel;
        Channel in = inbound;
        Channel out = outbound;
        return running
                && !linkDown.get()
                && server != null && server.isOpen()
                && in != null && in.isActive()
                && out != null && out.isActive();
    }

    @Override
    public void write(Message message) throws IOException
    {
        Channel out = outbound;
        if (out == null || !isConnected()) {
            throw new IOException("No live connection to peer");
        }

        byte[] tag = message.tag().getBytes(StandardCharsets.UTF_8);
        if (tag.length > maxTagBytes) {
            throw new LinkFramingException("Tag of " + tag.length + " bytes exceeds limit of " + maxTagBytes);
        }
        if (message.payloadLength() > maxPayloadBytes) {
            throw new LinkFramingException("Payload of " + message.payloadLength()
                    + " bytes exceeds limit of " + maxPayloadBytes);
        }

        out.write(Unpooled.wrappedBuffer(tag));
        ChannelFuture done = out.writeAndFlush(Unpooled.wrappedBuffer(message.payload())).awaitUninterruptibly();
        if (!done.isSuccess()) {
            throw new IOException("Write to peer failed", done.cause());
        }
    }

    @Override
    public void close()
    {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            running = false;
        }

        closeChannel(outbound);
        closeChannel(inbound);
        closeChannel(serverChannel);
        shutdownGroup();

        sink.onTransportEvent(LinkTransportEvent.of(LinkTransportEvent.Kind.CLOSED, "paired"));
    }

    @Override
    public String toString()
    {
        return "NettyPairedLinkTransport[in=" + inbound + ", out=" + outbound + ']';
    }

    // -------------------------------------------------------------------------
    // Outbound channel
    // -------------------------------------------------------------------------

    private void dial()
    {
        if (!running) {
            return;
        }
        clientBootstrap.connect(peerAddress).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                if (!running) {
                    future.channel().close();
                    return;
                }
                outbound = future.channel();
                sink.onTransportEvent(LinkTransportEvent.of(
                        LinkTransportEvent.Kind.DIALED,
                        String.valueOf(future.channel().remoteAddress())));
                maybeLinkUp();
            }
            else if (running) {
                sink.onTransportEvent(LinkTransportEvent.of(
                        LinkTransportEvent.Kind.DIAL_FAILED,
                        String.valueOf(future.cause())));
                future.channel().eventLoop().schedule(
                        this::dial,
                        timing.dialRetryBackoff().toMillis(),
                        TimeUnit.MILLISECONDS);
            }
        });
    }

    // -------------------------------------------------------------------------
    // Inbound channel
    // -------------------------------------------------------------------------

    private void onInboundChannel(SocketChannel ch)
    {
        synchronized (lifecycleLock) {
            if (!running || inbound != null) {
                sink.onTransportEvent(LinkTransportEvent.of(
                        LinkTransportEvent.Kind.HANDLE_DISCARDED,
                        ch.remoteAddress() + " (paired channel already accepted)"));
                ch.close();
                return;
            }
            inbound = ch;
        }

        int maxPart = (int) Math.min(Integer.MAX_VALUE, maxFramedPartBytes(maxTagBytes, maxPayloadBytes));
        ChannelPipeline p = ch.pipeline();
        p.addLast(new LengthFieldBasedFrameDecoder(
                ByteOrder.LITTLE_ENDIAN, maxPart, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES, true));
        p.addLast(new PartPairingHandler());

        sink.onTransportEvent(LinkTransportEvent.of(
                LinkTransportEvent.Kind.ACCEPTED,
                String.valueOf(ch.remoteAddress())));
        maybeLinkUp();
    }

    // -------------------------------------------------------------------------
    // Link state
    // -------------------------------------------------------------------------

    private void maybeLinkUp()
    {
        Channel in = inbound;
        Channel out = outbound;
        if (!running || in == null || out == null) {
            return;
        }
        if (linkUp.compareAndSet(false, true)) {
            LinkTransportListener l = listener;
            if (l != null) {
                l.onLinkUp("paired in=" + in.remoteAddress() + " out=" + out.remoteAddress());
            }
        }
    }

    private void linkFailed(Channel channel, Throwable cause)
    {
        if (!running) {
            return;
        }
        if (!linkUp.get()) {
            // Before the link is up a dropped channel is simply replaced.
            synchronized (lifecycleLock) {
                if (channel == inbound) {
                    inbound = null;
                }
            }
            if (channel == outbound) {
                outbound = null;
                dial();
            }
            return;
        }
        if (linkDown.compareAndSet(false, true)) {
            // Usually on an event loop thread, so close without waiting.
            Channel in = inbound;
            Channel out = outbound;
            if (in != null) {
                in.close();
            }
            if (out != null) {
                out.close();
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

    /**
     * Largest part on the wire, length field included.
     */
    static long maxFramedPartBytes(int maxTagBytes, int maxPayloadBytes)
    {
        return (long) Math.max(maxTagBytes, maxPayloadBytes) + LENGTH_FIELD_BYTES;
    }

    private LinkTransportListener requireListener()
    {
        LinkTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("LinkTransportListener must be set before open()");
        }
        return l;
    }

    private void closeChannel(Channel ch)
    {
        if (ch != null) {
            ch.close().awaitUninterruptibly(timing.closeJoinTimeout().toMillis());
        }
    }

    private void shutdownGroup()
    {
        EventLoopGroup g = group;
        if (g == null) {
            return;
        }
        boolean terminated = g.shutdownGracefully(0, timing.closeJoinTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .awaitUninterruptibly(timing.closeJoinTimeout().toMillis());
        if (!terminated) {
            sink.onError(LinkErrorEvent.of("Event loop group did not terminate within "
                    + timing.closeJoinTimeout(), null));
        }
    }

    /**
     * PartPairingHandler
     * -------------------------------------------------------------------------
     * Turns consecutive (tag, payload) parts from the accepted channel into
     * {@link Message} values and forwards them to the port listener in arrival
     * order.
     */
    private final class PartPairingHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private String pendingTag;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf part)
        {
            // Copy out of the ByteBuf (Netty containment rule).
            byte[] bytes = new byte[part.readableBytes()];
            part.getBytes(part.readerIndex(), bytes);

            if (pendingTag == null) {
                if (bytes.length > maxTagBytes) {
                    throw new LinkFramingException("Tag of " + bytes.length + " bytes exceeds limit of " + maxTagBytes);
                }
                pendingTag = new String(bytes, StandardCharsets.UTF_8);
                return;
            }

            if (bytes.length > maxPayloadBytes) {
                throw new LinkFramingException("Payload of " + bytes.length
                        + " bytes exceeds limit of " + maxPayloadBytes);
            }
            Message message = Message.of(pendingTag, bytes);
            pendingTag = null;

            LinkTransportListener l = listener;
            if (l != null && running) {
                l.onMessage(message);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            linkFailed(ctx.channel(), null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            linkFailed(ctx.channel(), cause);
            ctx.close();
        }
    }

    /**
     * Watches the outbound channel for loss; it never carries inbound data.
     */
    private final class OutboundWatcher extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ReferenceCountUtil.release(msg);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            linkFailed(ctx.channel(), null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            linkFailed(ctx.channel(), cause);
            ctx.close();
        }
    }
}
