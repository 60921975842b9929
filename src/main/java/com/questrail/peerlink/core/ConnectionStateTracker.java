package com.questrail.peerlink.core;

import com.questrail.peerlink.api.ConnectionState;
import com.questrail.peerlink.api.ConnectorClosedException;
import com.questrail.peerlink.observability.LinkObservabilitySink;
import com.questrail.peerlink.observability.LinkStateTransitionEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ConnectionStateTracker
 * -----------------------------------------------------------------------------
 * Holds the single live {@link ConnectionState} of a connector and lets callers
 * wait, with a bound, for the link to come up.
 *
 * <p>Transitions are forward-only (see {@link ConnectionState#canTransitionTo}).
 * Illegal transitions are refused rather than thrown, because they are the
 * normal outcome of races such as "link came up while close was running".</p>
 */
public final class ConnectionStateTracker
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final LinkObservabilitySink sink;

    private ConnectionState state = ConnectionState.IDLE;

    public ConnectionStateTracker(LinkObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ConnectionState state()
    {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attempts to move to {@code next}.
     *
     * @return true if the transition happened
     */
    public boolean transition(ConnectionState next)
    {
        Objects.requireNonNull(next, "next");
        final ConnectionState previous;
        lock.lock();
        try {
            if (!state.canTransitionTo(next)) {
                return false;
            }
            previous = state;
            state = next;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        // Notify outside the lock; sinks may be slow.
        sink.onStateTransition(new LinkStateTransitionEvent(Instant.now(), previous, next));
        return true;
    }

    /**
     * Waits up to {@code timeout} for {@link ConnectionState#CONNECTED}.
     *
     * @return true if connected, false if the wait expired first
     * @throws ConnectorClosedException if the connector is or becomes closed
     */
    public boolean awaitConnected(Duration timeout) throws InterruptedException
    {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                if (state == ConnectionState.CLOSED) {
                    throw new ConnectorClosedException();
                }
                if (state == ConnectionState.CONNECTED) {
                    return true;
                }
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }
}
