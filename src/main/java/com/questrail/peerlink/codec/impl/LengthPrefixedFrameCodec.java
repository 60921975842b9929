package com.questrail.peerlink.codec.impl;

import com.questrail.peerlink.api.LinkFramingException;
import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.codec.DecodedFrame;
import com.questrail.peerlink.codec.FrameCodec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * LengthPrefixedFrameCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameCodec} for the stream-socket transport.
 *
 * <p>Frame layout (all lengths unsigned 32-bit little-endian):</p>
 * <pre>
 *   offset 0            : tagLength
 *   offset 4            : tag bytes (UTF-8)
 *   offset 4+T          : payloadLength
 *   offset 8+T          : payload bytes
 * </pre>
 *
 * <p>Each length prefix is validated as soon as its four bytes are available,
 * before any further bytes are awaited, so a corrupted prefix is reported
 * immediately instead of causing the reader to buffer toward a bogus size.</p>
 */
public final class LengthPrefixedFrameCodec implements FrameCodec
{
    /** Size of each length prefix in bytes. */
    public static final int LENGTH_PREFIX_BYTES = 4;

    public static final int DEFAULT_MAX_TAG_BYTES = 64 * 1024;
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 64 * 1024 * 1024;

    /**
     * Upper bound for a whole frame, both prefixes included. Keeps every frame
     * within a single Java array.
     */
    public static final int MAX_FRAME_BYTES = Integer.MAX_VALUE - 8;

    private final int maxTagBytes;
    private final int maxPayloadBytes;

    public LengthPrefixedFrameCodec()
    {
        this(DEFAULT_MAX_TAG_BYTES, DEFAULT_MAX_PAYLOAD_BYTES);
    }

    public LengthPrefixedFrameCodec(int maxTagBytes, int maxPayloadBytes)
    {
        if (maxTagBytes <= 0) {
            throw new IllegalArgumentException("maxTagBytes must be positive");
        }
        if (maxPayloadBytes < 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be non-negative");
        }
        checkFrameLimit(maxTagBytes, maxPayloadBytes);
        this.maxTagBytes = maxTagBytes;
        this.maxPayloadBytes = maxPayloadBytes;
    }

    /**
     * Rejects tag and payload limits whose largest frame would not fit in
     * {@link #MAX_FRAME_BYTES}.
     */
    public static void checkFrameLimit(int maxTagBytes, int maxPayloadBytes)
    {
        long largest = 2L * LENGTH_PREFIX_BYTES + maxTagBytes + maxPayloadBytes;
        if (largest > MAX_FRAME_BYTES) {
            throw new IllegalArgumentException("maxTagBytes + maxPayloadBytes + " + (2 * LENGTH_PREFIX_BYTES)
                    + " must not exceed " + MAX_FRAME_BYTES + ", got " + largest);
        }
    }

    public int maxTagBytes()
    {
        return maxTagBytes;
    }

    public int maxPayloadBytes()
    {
        return maxPayloadBytes;
    }

    /**
     * Largest frame this codec will ever produce or accept.
     */
    public long maxFrameBytes()
    {
        return 2L * LENGTH_PREFIX_BYTES + maxTagBytes + maxPayloadBytes;
    }

    @Override
    public byte[] encode(Message message)
    {
        final byte[] tag = message.tag().getBytes(StandardCharsets.UTF_8);
        final int payloadLength = message.payloadLength();

        if (tag.length > maxTagBytes) {
            throw new LinkFramingException("Tag of " + tag.length + " bytes exceeds limit of " + maxTagBytes);
        }
        if (payloadLength > maxPayloadBytes) {
            throw new LinkFramingException("Payload of " + payloadLength + " bytes exceeds limit of " + maxPayloadBytes);
        }

        ByteBuffer frame = ByteBuffer.allocate(2 * LENGTH_PREFIX_BYTES + tag.length + payloadLength)
                .order(ByteOrder.LITTLE_ENDIAN);
        frame.putInt(tag.length);
        frame.put(tag);
        frame.putInt(payloadLength);
        if (payloadLength > 0) {
            frame.put(message.payload());
        }
        return frame.array();
    }

    @Override
    public Optional<DecodedFrame> decode(byte[] buffer, int offset, int length)
    {
        if (offset < 0 || length < 0 || offset + length > buffer.length) {
            throw new IndexOutOfBoundsException("offset=" + offset + ", length=" + length + ", buffer=" + buffer.length);
        }

        // 1) Tag length prefix
        if (length < LENGTH_PREFIX_BYTES) {
            return Optional.empty();
        }
        final long tagLength = readUint32(buffer, offset);
        if (tagLength > maxTagBytes) {
            throw new LinkFramingException("Declared tag length " + tagLength + " exceeds limit of " + maxTagBytes);
        }

        // 2) Payload length prefix
        final int payloadPrefixAt = LENGTH_PREFIX_BYTES + (int) tagLength;
        if (length < payloadPrefixAt + LENGTH_PREFIX_BYTES) {
            return Optional.empty();
        }
        final long payloadLength = readUint32(buffer, offset + payloadPrefixAt);
        if (payloadLength > maxPayloadBytes) {
            throw new LinkFramingException("Declared payload length " + payloadLength + " exceeds limit of " + maxPayloadBytes);
        }

        // 3) Whole frame present?
        final int payloadAt = payloadPrefixAt + LENGTH_PREFIX_BYTES;
        final long frameLength = (long) payloadAt + payloadLength;
        if (length < frameLength) {
            return Optional.empty();
        }

        final String tag = new String(buffer, offset + LENGTH_PREFIX_BYTES, (int) tagLength, StandardCharsets.UTF_8);
        final byte[] payload = Arrays.copyOfRange(buffer, offset + payloadAt, offset + (int) frameLength);

        return Optional.of(new DecodedFrame(Message.of(tag, payload), (int) frameLength));
    }

    private static long readUint32(byte[] buffer, int at)
    {
        return ByteBuffer.wrap(buffer, at, LENGTH_PREFIX_BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .getInt() & 0xFFFFFFFFL;
    }
}
