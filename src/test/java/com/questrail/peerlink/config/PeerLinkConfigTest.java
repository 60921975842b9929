package com.questrail.peerlink.config;

import com.questrail.peerlink.codec.impl.LengthPrefixedFrameCodec;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PeerLinkConfigTest {

    @Test
    void defaultsUseStreamSocketAndCodecLimits() {
        PeerLinkConfig config = PeerLinkConfig.defaults();

        assertEquals(TransportKind.STREAM_SOCKET, config.transport());
        assertEquals(LinkTimingPolicy.defaults(), config.timing());
        assertEquals(LengthPrefixedFrameCodec.DEFAULT_MAX_TAG_BYTES, config.maxTagBytes());
        assertEquals(LengthPrefixedFrameCodec.DEFAULT_MAX_PAYLOAD_BYTES, config.maxPayloadBytes());
    }

    @Test
    void builderOverridesFields() {
        LinkTimingPolicy timing = LinkTimingPolicy.defaults().withConnectWait(Duration.ofSeconds(5));

        PeerLinkConfig config = PeerLinkConfig.builder()
                .withTransport(TransportKind.PAIRED_CHANNEL)
                .withTiming(timing)
                .withMaxTagBytes(128)
                .withMaxPayloadBytes(4096)
                .build();

        assertEquals(TransportKind.PAIRED_CHANNEL, config.transport());
        assertSame(timing, config.timing());
        assertEquals(128, config.maxTagBytes());
        assertEquals(4096, config.maxPayloadBytes());
    }

    @Test
    void rejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> PeerLinkConfig.builder().withMaxTagBytes(0).build());
        assertThrows(IllegalArgumentException.class, () -> PeerLinkConfig.builder().withMaxPayloadBytes(-1).build());
        assertThrows(NullPointerException.class, () -> PeerLinkConfig.builder().withTransport(null).build());
    }

    @Test
    void limitsMustKeepLargestFrameInOneArray() {
        int largestPayload = LengthPrefixedFrameCodec.MAX_FRAME_BYTES - 8 - 1;

        PeerLinkConfig edge = PeerLinkConfig.builder()
                .withMaxTagBytes(1)
                .withMaxPayloadBytes(largestPayload)
                .build();
        assertEquals(largestPayload, edge.maxPayloadBytes());

        assertThrows(IllegalArgumentException.class,
                () -> PeerLinkConfig.builder().withMaxTagBytes(2).withMaxPayloadBytes(largestPayload).build());
        assertThrows(IllegalArgumentException.class,
                () -> PeerLinkConfig.builder().withMaxPayloadBytes(Integer.MAX_VALUE).build());
    }
}
