package com.questrail.peerlink.internal.establish;

import com.questrail.peerlink.config.LinkTimingPolicy;
import com.questrail.peerlink.internal.establish.ConnectionEstablisher.Origin;
import com.questrail.peerlink.internal.establish.ConnectionEstablisher.Preference;
import com.questrail.peerlink.observability.LinkTransportEvent;
import com.questrail.peerlink.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionEstablisherTest
 * -----------------------------------------------------------------------------
 * Accept/dial race with scripted acceptors and dialers.
 */
final class ConnectionEstablisherTest {

    private static final LinkTimingPolicy TIMING = new LinkTimingPolicy(
            Duration.ofMillis(50),
            Duration.ofMillis(20),
            Duration.ofMillis(20),
            Duration.ofMillis(20),
            Duration.ofSeconds(1),
            Duration.ofMillis(300),
            Duration.ofSeconds(1),
            Duration.ZERO);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final BlockingQueue<FakeHandle> incoming = new LinkedBlockingQueue<>();
    private final List<Established> established = new CopyOnWriteArrayList<>();

    private ConnectionEstablisher<FakeHandle> establisher;

    private record Established(FakeHandle handle, Origin origin) {}

    @AfterEach
    void tearDown() {
        if (establisher != null) {
            establisher.stop();
        }
    }

    @Test
    void dialAloneEstablishes() throws InterruptedException {
        FakeHandle dialed = new FakeHandle("dialed");
        establisher = start(Preference.NONE, timeout -> dialed);

        assertSame(dialed, establisher.slot().await(Duration.ofSeconds(2)).orElseThrow());
        awaitEstablished(1);
        assertEquals(Origin.DIALED, established.get(0).origin());
    }

    @Test
    void dialRetriesUntilPeerIsUp() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        FakeHandle dialed = new FakeHandle("dialed");
        establisher = start(Preference.NONE, timeout -> {
            if (attempts.incrementAndGet() < 4) {
                throw new ConnectException("Connection refused");
            }
            return dialed;
        });

        assertSame(dialed, establisher.slot().await(Duration.ofSeconds(2)).orElseThrow());
        assertEquals(4, attempts.get());
        assertEquals(3, sink.countTransportEvents(LinkTransportEvent.Kind.DIAL_FAILED));
    }

    @Test
    void acceptAloneEstablishes() throws InterruptedException {
        establisher = start(Preference.NONE, ConnectionEstablisherTest::refuse);
        FakeHandle accepted = new FakeHandle("accepted");

        incoming.add(accepted);

        assertSame(accepted, establisher.slot().await(Duration.ofSeconds(2)).orElseThrow());
        awaitEstablished(1);
        assertEquals(Origin.ACCEPTED, established.get(0).origin());
    }

    @Test
    void preferredDialWinsOverEarlierAccept() throws InterruptedException {
        FakeHandle accepted = new FakeHandle("accepted");
        FakeHandle dialed = new FakeHandle("dialed");
        long dialReadyAt = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(100);
        incoming.add(accepted);

        establisher = start(Preference.DIALED, timeout -> {
            if (System.nanoTime() < dialReadyAt) {
                throw new ConnectException("Connection refused");
            }
            return dialed;
        });

        assertSame(dialed, establisher.slot().await(Duration.ofSeconds(2)).orElseThrow());
        awaitEstablished(1);
        assertTrue(waitUntilClosed(accepted));
        assertFalse(dialed.isClosed());
        assertEquals(1, established.size());
    }

    @Test
    void heldCandidateIsPromotedWhenPreferredNeverArrives() throws InterruptedException {
        FakeHandle accepted = new FakeHandle("accepted");
        establisher = start(Preference.DIALED, ConnectionEstablisherTest::refuse);

        long start = System.nanoTime();
        incoming.add(accepted);

        assertSame(accepted, establisher.slot().await(Duration.ofSeconds(2)).orElseThrow());
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(waitedMillis >= 250, "held for the grace period, waited " + waitedMillis + " ms");
        assertFalse(accepted.isClosed());
    }

    @Test
    void preferredAcceptWinsOverEarlierDial() throws InterruptedException {
        FakeHandle dialed = new FakeHandle("dialed");
        FakeHandle accepted = new FakeHandle("accepted");
        establisher = start(Preference.ACCEPTED, timeout -> dialed);

        Thread.sleep(50);
        incoming.add(accepted);

        assertSame(accepted, establisher.slot().await(Duration.ofSeconds(2)).orElseThrow());
        assertTrue(waitUntilClosed(dialed));
    }

    @Test
    void zeroGraceFallsBackToFirstWins() throws InterruptedException {
        FakeHandle accepted = new FakeHandle("accepted");
        incoming.add(accepted);
        establisher = new ConnectionEstablisher<>(
                "test",
                this::accept,
                ConnectionEstablisherTest::refuse,
                Preference.DIALED,
                TIMING.withSimultaneousOpenGrace(Duration.ZERO),
                sink,
                (h, o) -> established.add(new Established(h, o)));
        establisher.start();

        assertSame(accepted, establisher.slot().await(Duration.ofMillis(200)).orElseThrow());
    }

    @Test
    void preferenceIsResolvedFromEachCandidate() throws InterruptedException {
        FakeHandle accepted = new FakeHandle("accepted via 10.0.0.5");
        FakeHandle dialed = new FakeHandle("dialed via 10.0.0.5");
        List<FakeHandle> asked = new CopyOnWriteArrayList<>();
        long dialReadyAt = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(100);
        incoming.add(accepted);

        establisher = new ConnectionEstablisher<>(
                "test",
                this::accept,
                timeout -> {
                    if (System.nanoTime() < dialReadyAt) {
                        throw new ConnectException("Connection refused");
                    }
                    return dialed;
                },
                candidate -> {
                    asked.add(candidate);
                    return candidate.toString().endsWith("10.0.0.5") ? Preference.DIALED : Preference.NONE;
                },
                TIMING,
                sink,
                (h, o) -> established.add(new Established(h, o)));
        establisher.start();

        assertSame(dialed, establisher.slot().await(Duration.ofSeconds(2)).orElseThrow());
        assertTrue(waitUntilClosed(accepted));
        assertTrue(asked.contains(accepted));
        assertTrue(asked.contains(dialed));
    }

    @Test
    void stopWithoutPeerReturnsPromptlyAndSeals() {
        establisher = start(Preference.NONE, ConnectionEstablisherTest::refuse);

        long start = System.nanoTime();
        establisher.stop();

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);
        assertTrue(establisher.slot().isDone());
        assertTrue(establisher.slot().get().isEmpty());
        assertTrue(established.isEmpty());
    }

    @Test
    void stopClosesHeldCandidate() throws InterruptedException {
        FakeHandle accepted = new FakeHandle("accepted");
        establisher = start(Preference.DIALED, ConnectionEstablisherTest::refuse);
        incoming.add(accepted);
        Thread.sleep(100);

        establisher.stop();

        assertTrue(accepted.isClosed());
        assertTrue(established.isEmpty());
    }

    @Test
    void startTwiceIsRejected() {
        establisher = start(Preference.NONE, ConnectionEstablisherTest::refuse);

        assertThrows(IllegalStateException.class, establisher::start);
    }

    // -------------------------------------------------------------------------

    private ConnectionEstablisher<FakeHandle> start(Preference preference, Dialer<FakeHandle> dialer) {
        ConnectionEstablisher<FakeHandle> e = new ConnectionEstablisher<>(
                "test",
                this::accept,
                dialer,
                preference,
                TIMING,
                sink,
                (h, o) -> established.add(new Established(h, o)));
        e.start();
        return e;
    }

    private Optional<FakeHandle> accept(Duration pollInterval) throws IOException {
        try {
            return Optional.ofNullable(incoming.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private static FakeHandle refuse(Duration attemptTimeout) throws IOException {
        throw new ConnectException("Connection refused");
    }

    private void awaitEstablished(int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (established.size() < count && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(count, established.size());
    }

    private static boolean waitUntilClosed(FakeHandle handle) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!handle.isClosed() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        return handle.isClosed();
    }
}
