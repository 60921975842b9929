package com.questrail.peerlink.internal.establish;

import com.questrail.peerlink.config.LinkTimingPolicy;
import com.questrail.peerlink.observability.LinkErrorEvent;
import com.questrail.peerlink.observability.LinkObservabilitySink;
import com.questrail.peerlink.observability.LinkTransportEvent;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * ConnectionEstablisher
 * =============================================================================
 * Races an inbound accept against an outbound dial and installs exactly one
 * resulting handle in a {@link HandleSlot}.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li><b>accept loop</b>: polls the {@link Acceptor} until one peer connects,
 *       then stops accepting</li>
 *   <li><b>dial loop</b>: calls the {@link Dialer} with a per-attempt timeout,
 *       sleeping the retry backoff between failures, until one attempt succeeds</li>
 * </ul>
 * Both loops stop as soon as the slot is filled or {@link #stop()} is called.
 *
 * <h2>Simultaneous open</h2>
 * When both loops succeed, each peer ends up holding two TCP connections: the
 * one it dialed and the one it accepted. Pure first-wins could make the two
 * peers keep different connections and close each other's. To converge, both
 * peers prefer the connection dialed by the peer with the lower listening port
 * ({@link Origin} given by {@link Preference}):
 * <ul>
 *   <li>a preferred candidate is offered to the slot immediately</li>
 *   <li>a non-preferred candidate is held for at most
 *       {@link LinkTimingPolicy#simultaneousOpenGrace()}; if the preferred one
 *       arrives meanwhile it wins and the held one is closed, otherwise the held
 *       one is offered when the grace expires</li>
 * </ul>
 * With {@link Preference#NONE} or a zero grace every candidate is offered at
 * once, and the first completed connection wins.
 *
 * <p>The preference may depend on the candidate itself (for example on the
 * addresses of a socket when both peers listen on the same port), so it is
 * resolved per candidate.</p>
 */
public final class ConnectionEstablisher<H extends Closeable>
{
    /**
     * How a candidate handle came to exist.
     */
    public enum Origin {
        ACCEPTED,
        DIALED
    }

    /**
     * Which origin this peer should settle on when both succeed.
     */
    public enum Preference {
        ACCEPTED,
        DIALED,
        NONE;

        boolean prefers(Origin origin) {
            return this == NONE || name().equals(origin.name());
        }
    }

    private final String name;
    private final Acceptor<H> acceptor;
    private final Dialer<H> dialer;
    private final Function<? super H, Preference> preference;
    private final LinkTimingPolicy timing;
    private final LinkObservabilitySink sink;
    private final BiConsumer<H, Origin> onEstablished;

    private final HandleSlot<H> slot;
    private final Object heldLock = new Object();

    private volatile boolean running;
    private H held;
    private Thread acceptThread;
    private Thread dialThread;

    public ConnectionEstablisher(String name,
                                 Acceptor<H> acceptor,
                                 Dialer<H> dialer,
                                 Preference preference,
                                 LinkTimingPolicy timing,
                                 LinkObservabilitySink sink,
                                 BiConsumer<H, Origin> onEstablished)
    {
        this(name, acceptor, dialer, constant(preference), timing, sink, onEstablished);
    }

    /**
     * @param name          prefix for thread names and diagnostics
     * @param preference    resolves the preference for each candidate handle
     * @param onEstablished invoked once, on the thread that installed the handle
     */
    public ConnectionEstablisher(String name,
                                 Acceptor<H> acceptor,
                                 Dialer<H> dialer,
                                 Function<? super H, Preference> preference,
                                 LinkTimingPolicy timing,
                                 LinkObservabilitySink sink,
                                 BiConsumer<H, Origin> onEstablished)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
        this.dialer = Objects.requireNonNull(dialer, "dialer");
        this.preference = Objects.requireNonNull(preference, "preference");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.onEstablished = Objects.requireNonNull(onEstablished, "onEstablished");
        this.slot = new HandleSlot<>(sink);
    }

    public HandleSlot<H> slot()
    {
        return slot;
    }

    /**
     * Spawns the accept and dial loops. Returns immediately.
     */
    public synchronized void start()
    {
        if (acceptThread != null) {
            throw new IllegalStateException("already started");
        }
        running = true;

        acceptThread = new Thread(this::acceptLoop, name + "-accept");
        acceptThread.setDaemon(true);
        dialThread = new Thread(this::dialLoop, name + "-dial");
        dialThread.setDaemon(true);

        acceptThread.start();
        dialThread.start();
    }

    /**
     * Flags both loops to stop, wakes them, waits for them (bounded by
     * {@link LinkTimingPolicy#closeJoinTimeout()}), seals the slot and closes any
     * held candidate. Does not close an installed handle.
     */
    public void stop()
    {
        final Thread accept;
        final Thread dial;
        synchronized (this) {
            running = false;
            accept = acceptThread;
            dial = dialThread;
        }

        slot.seal();
        if (dial != null) {
            dial.interrupt();
        }
        if (accept != null) {
            accept.interrupt();
        }

        final long deadline = System.nanoTime() + timing.closeJoinTimeout().toNanos();
        join(accept, deadline);
        join(dial, deadline);

        H leftover;
        synchronized (heldLock) {
            leftover = held;
            held = null;
        }
        if (leftover != null) {
            slot.discard(leftover, "establisher stopped");
        }
    }

    // -------------------------------------------------------------------------
    // Loops
    // -------------------------------------------------------------------------

    private void acceptLoop()
    {
        while (running && !slot.isDone()) {
            final Optional<H> accepted;
            try {
                accepted = acceptor.accept(timing.acceptPollInterval());
            } catch (IOException e) {
                if (running) {
                    sink.onError(LinkErrorEvent.of(name + ": accept failed", e));
                }
                return;
            }
            if (accepted.isPresent()) {
                sink.onTransportEvent(LinkTransportEvent.of(LinkTransportEvent.Kind.ACCEPTED, String.valueOf(accepted.get())));
                candidate(accepted.get(), Origin.ACCEPTED);
                return;
            }
        }
    }

    private void dialLoop()
    {
        while (running && !slot.isDone()) {
            try {
                H dialed = dialer.dial(timing.dialAttemptTimeout());
                sink.onTransportEvent(LinkTransportEvent.of(LinkTransportEvent.Kind.DIALED, String.valueOf(dialed)));
                candidate(dialed, Origin.DIALED);
                return;
            } catch (IOException e) {
                sink.onTransportEvent(LinkTransportEvent.of(LinkTransportEvent.Kind.DIAL_FAILED, e.getMessage()));
            }

            try {
                Thread.sleep(timing.dialRetryBackoff().toMillis());
            } catch (InterruptedException e) {
                // stop() interrupts to cut the backoff short
                return;
            }
        }
    }

    // -------------------------------------------------------------------------
    // Candidate handling
    // -------------------------------------------------------------------------

    private void candidate(H handle, Origin origin)
    {
        if (!running) {
            slot.discard(handle, "establisher stopped");
            return;
        }

        final Duration grace = timing.simultaneousOpenGrace();
        final Preference resolved = Objects.requireNonNull(preference.apply(handle), "preference");
        if (resolved.prefers(origin) || grace.isZero()) {
            install(handle, origin);
            return;
        }

        synchronized (heldLock) {
            if (slot.isDone()) {
                slot.discard(handle, "preferred connection already installed");
                return;
            }
            held = handle;
        }

        // This loop has produced its one candidate, so its thread is free to
        // wait out the grace period for the preferred connection.
        try {
            if (slot.await(grace).isPresent()) {
                return;
            }
        } catch (InterruptedException e) {
            // stop() discards whatever is still held
            return;
        }

        H promoted;
        synchronized (heldLock) {
            promoted = held;
            held = null;
        }
        if (promoted != null && running) {
            install(promoted, origin);
        } else if (promoted != null) {
            slot.discard(promoted, "establisher stopped");
        }
    }

    private void install(H handle, Origin origin)
    {
        if (!slot.offer(handle)) {
            return;
        }

        H loser;
        synchronized (heldLock) {
            loser = held;
            held = null;
        }
        if (loser != null) {
            slot.discard(loser, "lost to preferred " + origin + " connection");
        }

        onEstablished.accept(handle, origin);
    }

    private static <H> Function<H, Preference> constant(Preference preference)
    {
        Objects.requireNonNull(preference, "preference");
        return handle -> preference;
    }

    private static void join(Thread thread, long deadlineNanos)
    {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        long remainingMillis = Math.max(1, (deadlineNanos - System.nanoTime()) / 1_000_000);
        try {
            thread.join(remainingMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
