package com.questrail.peerlink.internal.establish;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Inbound half of establishment: waits a bounded time for one peer connection
 * on an already bound listening endpoint.
 */
@FunctionalInterface
public interface Acceptor<H extends Closeable>
{
    /**
     * @param pollInterval maximum time to block
     * @return the accepted handle, or empty if nothing arrived within the interval
     * @throws IOException if the listening endpoint is broken or closed
     */
    Optional<H> accept(Duration pollInterval) throws IOException;
}
