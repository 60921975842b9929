package com.questrail.peerlink.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Message
 * -----------------------------------------------------------------------------
 * Immutable unit of exchange between two peers: a short textual tag plus an
 * optional binary payload.
 *
 * <h2>Payload semantics</h2>
 * An absent payload and an empty payload are equivalent on the wire. Both are
 * represented here as a zero-length array; {@link #payload()} never returns
 * {@code null}. Callers that need to distinguish "no data" use
 * {@link #hasPayload()}.
 *
 * <h2>Why {@code byte[]} is used for payload</h2>
 * Payloads are opaque and frequently large (sensor scans, firmware blobs).
 * Immutability is enforced via defensive copying on the way in and out.
 */
public final class Message
{
    private static final byte[] EMPTY = new byte[0];

    private final String tag;
    private final byte[] payload;

    private Message(String tag, byte[] payload) {
        this.tag = tag;
        this.payload = payload;
    }

    /**
     * Creates a message without payload.
     */
    public static Message of(String tag) {
        return new Message(Objects.requireNonNull(tag, "tag"), EMPTY);
    }

    /**
     * Creates a message with the given payload.
     *
     * @param tag     message tag (must not be {@code null})
     * @param payload payload bytes; {@code null} is treated as absent
     */
    public static Message of(String tag, byte[] payload) {
        Objects.requireNonNull(tag, "tag");
        if (payload == null || payload.length == 0) {
            return new Message(tag, EMPTY);
        }
        return new Message(tag, payload.clone());
    }

    public String tag() {
        return tag;
    }

    /**
     * Returns a copy of the payload bytes (empty when absent, never null).
     */
    public byte[] payload() {
        return payload.length == 0 ? EMPTY : payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    public boolean hasPayload() {
        return payload.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        Message other = (Message) o;
        return tag.equals(other.tag) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * tag.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Message[" +
                "tag=" + tag +
                ", payloadLength=" + payload.length +
                ']';
    }
}
