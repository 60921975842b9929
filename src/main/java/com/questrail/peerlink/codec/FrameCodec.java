package com.questrail.peerlink.codec;

import com.questrail.peerlink.api.LinkFramingException;
import com.questrail.peerlink.api.Message;

import java.util.Optional;

/**
 * FrameCodec
 * -----------------------------------------------------------------------------
 * Stateless, byte-level encoder/decoder for one {@link Message} per frame on a
 * byte-stream transport.
 *
 * <p>The codec is responsible only for:</p>
 * <ul>
 *   <li>Producing the exact wire bytes for a message</li>
 *   <li>Recognizing whether a buffer holds a complete frame</li>
 *   <li>Rejecting frames whose declared lengths exceed configured limits</li>
 * </ul>
 *
 * <p>The codec is <strong>not</strong> responsible for buffering. Accumulating
 * partial reads across calls is the job of the reassembly buffer that owns the
 * growing byte region; the codec only looks at what it is handed.</p>
 */
public interface FrameCodec
{
    /**
     * Encode a message into a single wire-ready frame.
     *
     * @throws LinkFramingException if the tag or payload exceed configured limits
     */
    byte[] encode(Message message);

    /**
     * Attempt to decode one frame starting at {@code offset}.
     *
     * <p>Resumable: returns {@link Optional#empty()} (Incomplete) until the whole
     * frame is present in {@code buffer[offset, offset + length)}. Bytes beyond the
     * returned frame are left untouched for the next call.</p>
     *
     * @return the decoded message and the exact number of bytes it occupied,
     *         or empty if more bytes are needed
     * @throws LinkFramingException if a declared length exceeds configured limits
     */
    Optional<DecodedFrame> decode(byte[] buffer, int offset, int length);

    default Optional<DecodedFrame> decode(byte[] buffer) {
        return decode(buffer, 0, buffer.length);
    }
}
