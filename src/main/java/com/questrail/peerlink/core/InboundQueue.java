package com.questrail.peerlink.core;

import com.questrail.peerlink.api.ConnectorClosedException;
import com.questrail.peerlink.api.LinkTransportException;
import com.questrail.peerlink.api.Message;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * InboundQueue
 * -----------------------------------------------------------------------------
 * Unbounded FIFO of decoded messages plus the wake-up signal for blocked
 * receivers.
 *
 * <p>One producer (the transport's reader) appends; any number of consumers
 * take. Insertion order is arrival order on the wire and is never changed.</p>
 *
 * <h2>Wake-up rules</h2>
 * <ul>
 *   <li>{@link #close()} wakes every waiter with {@link ConnectorClosedException}
 *       and discards anything still queued</li>
 *   <li>{@link #markLinkLost(Throwable)} lets waiters drain what is already
 *       queued, then fails them with {@link LinkTransportException}</li>
 * </ul>
 */
public final class InboundQueue
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<Message> messages = new ArrayDeque<>();

    private boolean closed;
    private boolean linkLost;
    private Throwable linkLostCause;

    /**
     * Appends a message and wakes one waiter.
     *
     * @return false if the queue is closed and the message was dropped
     */
    public boolean put(Message message)
    {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            messages.addLast(message);
            changed.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a message is available.
     */
    public Message take() throws InterruptedException
    {
        lock.lockInterruptibly();
        try {
            while (true) {
                Message next = nextOrFail();
                if (next != null) {
                    return next;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits at most {@code timeout} for a message.
     */
    public Optional<Message> poll(Duration timeout) throws InterruptedException
    {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                Message next = nextOrFail();
                if (next != null) {
                    return Optional.of(next);
                }
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the next message without blocking.
     */
    public Optional<Message> poll()
    {
        lock.lock();
        try {
            return Optional.ofNullable(nextOrFail());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the producing link as dead. Already queued messages stay available.
     */
    public void markLinkLost(Throwable cause)
    {
        lock.lock();
        try {
            if (!linkLost) {
                linkLost = true;
                linkLostCause = cause;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue and releases every waiter. Idempotent.
     */
    public void close()
    {
        lock.lock();
        try {
            closed = true;
            messages.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size()
    {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock. Returns null when the caller should keep waiting.
    private Message nextOrFail()
    {
        if (closed) {
            throw new ConnectorClosedException();
        }
        Message next = messages.pollFirst();
        if (next != null) {
            return next;
        }
        if (linkLost) {
            throw new LinkTransportException("Connection to peer lost", linkLostCause);
        }
        return null;
    }
}
