package com.questrail.peerlink.runtime;

import com.questrail.peerlink.api.PeerConnector;
import com.questrail.peerlink.codec.impl.LengthPrefixedFrameCodec;
import com.questrail.peerlink.config.PeerLinkConfig;
import com.questrail.peerlink.core.PeerLinkConnector;
import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.internal.time.SystemMonotonicClock;
import com.questrail.peerlink.observability.LinkObservabilitySink;
import com.questrail.peerlink.observability.Slf4jLinkObservabilitySink;
import com.questrail.peerlink.transport.LinkTransport;
import com.questrail.peerlink.transport.netty.NettyPairedLinkTransport;
import com.questrail.peerlink.transport.socket.SocketLinkTransport;

import java.util.Objects;

/**
 * PeerLinkRuntime
 * =============================================================================
 * Composition root for a production {@link PeerConnector}.
 *
 * <p>Selects the transport binding named by {@link PeerLinkConfig#transport()},
 * wires it to the codec limits and timing policy, and hands it to a
 * {@link PeerLinkConnector}. No link semantics live here.</p>
 *
 * <pre>
 *   PeerConnector connector = PeerLinkRuntime.builder()
 *           .withConfig(PeerLinkConfig.defaults())
 *           .build();
 *   connector.connect(20000, 20001);
 * </pre>
 */
public final class PeerLinkRuntime {
    private PeerLinkRuntime() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PeerLinkConfig config = PeerLinkConfig.defaults();
        private LinkObservabilitySink observabilitySink;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withConfig(PeerLinkConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Defaults to an SLF4J-backed sink.
         */
        public Builder withObservabilitySink(LinkObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public PeerConnector build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");

            LinkObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jLinkObservabilitySink();

            return new PeerLinkConnector(createTransport(sink), config.timing(), sink, clock);
        }

        private LinkTransport createTransport(LinkObservabilitySink sink) {
            switch (config.transport()) {
                case STREAM_SOCKET:
                    return new SocketLinkTransport(
                            config.timing(),
                            new LengthPrefixedFrameCodec(config.maxTagBytes(), config.maxPayloadBytes()),
                            sink);
                case PAIRED_CHANNEL:
                    return new NettyPairedLinkTransport(
                            config.timing(),
                            sink,
                            config.maxTagBytes(),
                            config.maxPayloadBytes());
                default:
                    throw new IllegalArgumentException("Unsupported transport: " + config.transport());
            }
        }
    }
}
