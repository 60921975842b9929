package com.questrail.peerlink.codec.impl;

import com.questrail.peerlink.api.LinkFramingException;
import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.codec.DecodedFrame;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LengthPrefixedFrameCodecTest
 * -----------------------------------------------------------------------------
 * Wire layout, resumable decode and length limits of
 * {@link LengthPrefixedFrameCodec}.
 */
final class LengthPrefixedFrameCodecTest
{
    private final LengthPrefixedFrameCodec codec = new LengthPrefixedFrameCodec();

    @Test
    void encodeProducesLittleEndianLengthPrefixes()
    {
        byte[] frame = codec.encode(Message.of("hello", new byte[] { 0x01, 0x02 }));

        byte[] expected = new byte[] {
                5, 0, 0, 0,
                'h', 'e', 'l', 'l', 'o',
                2, 0, 0, 0,
                0x01, 0x02
        };
        assertArrayEquals(expected, frame);
    }

    @Test
    void encodeAbsentPayloadWritesZeroLength()
    {
        byte[] frame = codec.encode(Message.of("ack"));

        assertArrayEquals(new byte[] { 3, 0, 0, 0, 'a', 'c', 'k', 0, 0, 0, 0 }, frame);
    }

    @Test
    void encodeUsesUtf8ByteLengthForTag()
    {
        byte[] frame = codec.encode(Message.of("été"));

        int tagLength = ByteBuffer.wrap(frame, 0, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
        assertEquals("été".getBytes(StandardCharsets.UTF_8).length, tagLength);
        assertEquals(5, tagLength);
    }

    @Test
    void decodeWholeFrameReportsConsumedBytes()
    {
        Message original = Message.of("scan", new byte[] { 9, 8, 7 });
        byte[] frame = codec.encode(original);

        DecodedFrame decoded = codec.decode(frame).orElseThrow();

        assertEquals(original, decoded.message());
        assertEquals(frame.length, decoded.consumed());
    }

    @Test
    void decodeIsIncompleteUntilLastByteArrives()
    {
        byte[] frame = codec.encode(Message.of("status", new byte[] { 1, 2, 3, 4 }));

        for (int available = 0; available < frame.length; available++) {
            assertTrue(codec.decode(frame, 0, available).isEmpty(), "prefix of " + available + " bytes");
        }
        assertTrue(codec.decode(frame, 0, frame.length).isPresent());
    }

    @Test
    void decodeLeavesTrailingBytesForNextCall()
    {
        byte[] first = codec.encode(Message.of("a", new byte[] { 1 }));
        byte[] second = codec.encode(Message.of("b"));
        byte[] both = concat(first, second);

        DecodedFrame one = codec.decode(both).orElseThrow();
        DecodedFrame two = codec.decode(both, one.consumed(), both.length - one.consumed()).orElseThrow();

        assertEquals("a", one.message().tag());
        assertEquals("b", two.message().tag());
        assertFalse(two.message().hasPayload());
        assertEquals(both.length, one.consumed() + two.consumed());
    }

    @Test
    void emptyAndAbsentPayloadDecodeIdentically()
    {
        Message absent = codec.decode(codec.encode(Message.of("x"))).orElseThrow().message();
        Message empty = codec.decode(codec.encode(Message.of("x", new byte[0]))).orElseThrow().message();

        assertEquals(absent, empty);
        assertEquals(0, absent.payloadLength());
    }

    @Test
    void emptyTagIsAllowed()
    {
        Message decoded = codec.decode(codec.encode(Message.of("", new byte[] { 5 }))).orElseThrow().message();

        assertEquals("", decoded.tag());
        assertArrayEquals(new byte[] { 5 }, decoded.payload());
    }

    @Test
    void oversizedTagPrefixFailsBeforeTagBytesArrive()
    {
        LengthPrefixedFrameCodec small = new LengthPrefixedFrameCodec(8, 1024);
        byte[] prefixOnly = new byte[] { 9, 0, 0, 0 };

        assertThrows(LinkFramingException.class, () -> small.decode(prefixOnly));
    }

    @Test
    void oversizedPayloadPrefixFailsBeforePayloadArrives()
    {
        LengthPrefixedFrameCodec small = new LengthPrefixedFrameCodec(8, 16);
        byte[] header = new byte[] { 1, 0, 0, 0, 't', 17, 0, 0, 0 };

        assertThrows(LinkFramingException.class, () -> small.decode(header));
    }

    @Test
    void lengthAboveSignedRangeIsRejectedNotWrapped()
    {
        byte[] hostile = new byte[] { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF };

        assertThrows(LinkFramingException.class, () -> codec.decode(hostile));
    }

    @Test
    void encodeRejectsMessagesOverLimits()
    {
        LengthPrefixedFrameCodec small = new LengthPrefixedFrameCodec(4, 4);

        assertThrows(LinkFramingException.class, () -> small.encode(Message.of("toolong")));
        assertThrows(LinkFramingException.class, () -> small.encode(Message.of("ok", new byte[5])));
        assertDoesNotThrow(() -> small.encode(Message.of("okay", new byte[4])));
    }

    @Test
    void largePayloadRoundTrips()
    {
        byte[] payload = new byte[1024 * 1024];
        Arrays.fill(payload, (byte) 0x5A);

        Optional<DecodedFrame> decoded = codec.decode(codec.encode(Message.of("blob", payload)));

        assertTrue(decoded.isPresent());
        assertArrayEquals(payload, decoded.get().message().payload());
    }

    @Test
    void decodeRejectsBadBounds()
    {
        assertThrows(IndexOutOfBoundsException.class, () -> codec.decode(new byte[4], 2, 4));
    }

    @Test
    void maxFrameBytesCoversBothPrefixes()
    {
        LengthPrefixedFrameCodec small = new LengthPrefixedFrameCodec(10, 100);

        assertEquals(118L, small.maxFrameBytes());
    }

    @Test
    void limitsThatOverflowAFrameArrayAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new LengthPrefixedFrameCodec(16, Integer.MAX_VALUE));
        assertThrows(IllegalArgumentException.class,
                () -> new LengthPrefixedFrameCodec(Integer.MAX_VALUE / 2, Integer.MAX_VALUE / 2));

        LengthPrefixedFrameCodec widest = new LengthPrefixedFrameCodec(16, LengthPrefixedFrameCodec.MAX_FRAME_BYTES - 24);
        assertEquals(LengthPrefixedFrameCodec.MAX_FRAME_BYTES, widest.maxFrameBytes());
    }

    private static byte[] concat(byte[] a, byte[] b)
    {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
