package com.questrail.peerlink.config;

import com.questrail.peerlink.codec.impl.LengthPrefixedFrameCodec;

import java.util.Objects;

/**
 * Aggregated configuration for a peer connector.
 */
public record PeerLinkConfig(
        TransportKind transport,
        LinkTimingPolicy timing,
        int maxTagBytes,
        int maxPayloadBytes
) {
    public PeerLinkConfig {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(timing, "timing");
        if (maxTagBytes <= 0) {
            throw new IllegalArgumentException("maxTagBytes must be positive");
        }
        if (maxPayloadBytes < 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be non-negative");
        }
        LengthPrefixedFrameCodec.checkFrameLimit(maxTagBytes, maxPayloadBytes);
    }

    public static PeerLinkConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TransportKind transport = TransportKind.STREAM_SOCKET;
        private LinkTimingPolicy timing = LinkTimingPolicy.defaults();
        private int maxTagBytes = LengthPrefixedFrameCodec.DEFAULT_MAX_TAG_BYTES;
        private int maxPayloadBytes = LengthPrefixedFrameCodec.DEFAULT_MAX_PAYLOAD_BYTES;

        public Builder withTransport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder withTiming(LinkTimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public Builder withMaxTagBytes(int maxTagBytes) {
            this.maxTagBytes = maxTagBytes;
            return this;
        }

        public Builder withMaxPayloadBytes(int maxPayloadBytes) {
            this.maxPayloadBytes = maxPayloadBytes;
            return this;
        }

        public PeerLinkConfig build() {
            return new PeerLinkConfig(transport, timing, maxTagBytes, maxPayloadBytes);
        }
    }
}
