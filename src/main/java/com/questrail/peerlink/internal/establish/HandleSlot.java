package com.questrail.peerlink.internal.establish;

import com.questrail.peerlink.observability.LinkErrorEvent;
import com.questrail.peerlink.observability.LinkObservabilitySink;
import com.questrail.peerlink.observability.LinkTransportEvent;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HandleSlot
 * =============================================================================
 * Single-assignment slot for the one transport handle a connector may own.
 *
 * <h2>Winner takes all</h2>
 * The first {@link #offer(Closeable)} installs its handle. Every later offer
 * loses, and the losing handle is closed immediately without being used. Once
 * {@link #seal()} has been called, all offers lose.
 *
 * <p>Backed by a one-shot {@link CompletableFuture}: {@code complete} succeeds
 * for exactly one caller, which makes the race outcome atomic without a lock.</p>
 *
 * <h2>Ownership</h2>
 * The slot closes losers. The installed handle belongs to whoever reads it via
 * {@link #get()}; the slot never closes it.
 */
public final class HandleSlot<H extends Closeable>
{
    private final CompletableFuture<H> winner = new CompletableFuture<>();
    private final LinkObservabilitySink sink;

    public HandleSlot(LinkObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Offers a handle.
     *
     * @return true if this handle was installed; false if it lost and was closed
     */
    public boolean offer(H handle)
    {
        Objects.requireNonNull(handle, "handle");
        if (winner.complete(handle)) {
            return true;
        }
        discard(handle, "slot already filled or sealed");
        return false;
    }

    /**
     * Prevents any further installation. Has no effect on an already installed
     * handle.
     */
    public void seal()
    {
        winner.cancel(false);
    }

    /**
     * True once a handle was installed or the slot was sealed.
     */
    public boolean isDone()
    {
        return winner.isDone();
    }

    public Optional<H> get()
    {
        if (!winner.isDone() || winner.isCancelled()) {
            return Optional.empty();
        }
        return Optional.ofNullable(winner.getNow(null));
    }

    /**
     * Waits up to {@code timeout} for the slot to be filled or sealed.
     *
     * @return the installed handle, or empty if sealed or still empty after the wait
     */
    public Optional<H> await(Duration timeout) throws InterruptedException
    {
        try {
            return Optional.of(winner.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException | CancellationException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            // Only ever completed normally or cancelled.
            throw new IllegalStateException(e.getCause());
        }
    }

    /**
     * Closes a handle that will never be used, reporting why.
     */
    void discard(H handle, String reason)
    {
        sink.onTransportEvent(LinkTransportEvent.of(
                LinkTransportEvent.Kind.HANDLE_DISCARDED,
                handle + " (" + reason + ")"));
        try {
            handle.close();
        } catch (IOException e) {
            sink.onError(LinkErrorEvent.of("Failed to close discarded handle " + handle, e));
        }
    }
}
