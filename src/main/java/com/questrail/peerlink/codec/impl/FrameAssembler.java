package com.questrail.peerlink.codec.impl;

import com.questrail.peerlink.api.LinkFramingException;
import com.questrail.peerlink.api.Message;
import com.questrail.peerlink.codec.DecodedFrame;
import com.questrail.peerlink.codec.FrameCodec;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * FrameAssembler
 * -----------------------------------------------------------------------------
 * Reassembly buffer for a byte stream. Raw reads are appended as they arrive and
 * complete messages are pulled out one at a time through the {@link FrameCodec}.
 *
 * <p>The buffer only ever grows by the number of bytes actually received; it
 * never pre-sizes itself from a declared length prefix.</p>
 *
 * <p>Not thread-safe. Each stream reader owns exactly one assembler.</p>
 */
public final class FrameAssembler
{
    private static final int INITIAL_CAPACITY = 8 * 1024;

    private final FrameCodec codec;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int start;
    private int end;

    public FrameAssembler(FrameCodec codec)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Append {@code length} bytes read from the transport.
     */
    public void append(byte[] chunk, int offset, int length)
    {
        Objects.checkFromIndexSize(offset, length, chunk.length);
        ensureWritable(length);
        System.arraycopy(chunk, offset, buffer, end, length);
        end += length;
    }

    public void append(byte[] chunk)
    {
        append(chunk, 0, chunk.length);
    }

    /**
     * Returns the next complete message, or empty if more bytes are needed.
     *
     * @throws LinkFramingException if the buffered bytes declare an oversized frame
     */
    public Optional<Message> next()
    {
        Optional<DecodedFrame> frame = codec.decode(buffer, start, end - start);
        if (frame.isEmpty()) {
            return Optional.empty();
        }
        start += frame.get().consumed();
        if (start == end) {
            start = 0;
            end = 0;
        }
        return Optional.of(frame.get().message());
    }

    /**
     * Number of received bytes not yet consumed by a complete frame.
     */
    public int buffered()
    {
        return end - start;
    }

    int capacity()
    {
        return buffer.length;
    }

    private void ensureWritable(int length)
    {
        if (buffer.length - end >= length) {
            return;
        }

        // Compact first: consumed bytes at the front are dead space.
        final int live = end - start;
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, live);
            start = 0;
            end = live;
            if (buffer.length - end >= length) {
                return;
            }
        }

        long required = (long) live + length;
        if (required > LengthPrefixedFrameCodec.MAX_FRAME_BYTES) {
            throw new LinkFramingException("Reassembly buffer would exceed " + LengthPrefixedFrameCodec.MAX_FRAME_BYTES + " bytes");
        }
        int capacity = buffer.length;
        while (capacity < required) {
            capacity = (int) Math.min((long) capacity * 2, LengthPrefixedFrameCodec.MAX_FRAME_BYTES);
        }
        buffer = Arrays.copyOf(buffer, capacity);
    }
}
