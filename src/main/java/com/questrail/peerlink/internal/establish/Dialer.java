package com.questrail.peerlink.internal.establish;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * Outbound half of establishment: one connection attempt to the peer.
 */
@FunctionalInterface
public interface Dialer<H extends Closeable>
{
    /**
     * @param attemptTimeout maximum time the attempt may take
     * @return a connected handle
     * @throws IOException if the attempt failed or timed out
     */
    H dial(Duration attemptTimeout) throws IOException;
}
