/**
 * PeerLink Codec: Stream Framing
 * =============================================================================
 *
 * <p>Wire-level rules for carrying discrete messages over a byte stream. One
 * frame encodes exactly one message:</p>
 *
 * <pre>
 *   u32le(tagByteLength) ++ utf8(tag) ++ u32le(payloadByteLength) ++ payload
 * </pre>
 *
 * <p>There is no magic number, checksum or version byte. Integrity is the
 * transport's responsibility (TCP).</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   socket bytes
 *        → FrameAssembler      (reassembly buffer, owned by the stream reader)
 *            → FrameCodec      (resumable decode)
 *                → Message
 *                    → InboundQueue
 * </pre>
 *
 * <p>The paired-channel transport does not use this codec: its messaging layer
 * delimits parts natively (part one is the tag, part two the payload).</p>
 */
package com.questrail.peerlink.codec;
