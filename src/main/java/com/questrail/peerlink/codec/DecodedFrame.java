package com.questrail.peerlink.codec;

import com.questrail.peerlink.api.Message;

import java.util.Objects;

/**
 * Result of a successful {@link FrameCodec#decode} call: the message plus the
 * number of buffer bytes the frame occupied.
 */
public record DecodedFrame(Message message, int consumed) {
    public DecodedFrame {
        Objects.requireNonNull(message, "message");
        if (consumed <= 0) {
            throw new IllegalArgumentException("consumed must be positive");
        }
    }
}
