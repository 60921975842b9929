package com.questrail.peerlink.observability;

import com.questrail.peerlink.internal.time.MonotonicClock;
import com.questrail.peerlink.internal.time.SystemMonotonicClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PerformanceRecordingSink
 * -----------------------------------------------------------------------------
 * Decorating sink that aggregates message timings per operation and forwards
 * every event to a delegate.
 *
 * <p>One instance belongs to one connector, so measurements are never shared
 * across unrelated connectors or tests.</p>
 *
 * <ul>
 *   <li>{@code send}: encode plus write time of each {@link LinkMessageEvent.Stage#SENT} event</li>
 *   <li>{@code receive}: time each receiver spent blocked before a
 *       {@link LinkMessageEvent.Stage#DELIVERED} event</li>
 *   <li>any other name: a timer around an arbitrary code section, see
 *       {@link #startTimer(String)}</li>
 * </ul>
 *
 * <p>A timer still running when a report is taken and older than the timer
 * timeout (default one second) is stopped and recorded at that point.</p>
 */
public final class PerformanceRecordingSink implements LinkObservabilitySink {
    public static final String SEND = "send";
    public static final String RECEIVE = "receive";

    public static final Duration DEFAULT_TIMER_TIMEOUT = Duration.ofSeconds(1);

    private final LinkObservabilitySink delegate;
    private final MonotonicClock clock;
    private final long timerTimeoutNanos;
    private final Map<String, PerformanceReport.OperationStats> stats = new HashMap<>();
    private final Map<Long, RunningTimer> timers = new ConcurrentHashMap<>();
    private final AtomicLong nextTimerId = new AtomicLong();

    private record RunningTimer(String name, long startNanos) {}

    public PerformanceRecordingSink() {
        this(NullObservabilitySink.INSTANCE);
    }

    public PerformanceRecordingSink(LinkObservabilitySink delegate) {
        this(delegate, SystemMonotonicClock.INSTANCE, DEFAULT_TIMER_TIMEOUT);
    }

    public PerformanceRecordingSink(LinkObservabilitySink delegate, MonotonicClock clock, Duration timerTimeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (timerTimeout.isNegative() || timerTimeout.isZero()) {
            throw new IllegalArgumentException("timerTimeout must be positive: " + timerTimeout);
        }
        this.timerTimeoutNanos = timerTimeout.toNanos();
    }

    /**
     * Starts a named timer and returns its id for {@link #stopTimer(long)}.
     */
    public long startTimer(String name) {
        Objects.requireNonNull(name, "name");
        long id = nextTimerId.incrementAndGet();
        timers.put(id, new RunningTimer(name, clock.nowNanos()));
        return id;
    }

    /**
     * Stops a timer and records its elapsed time under the timer's name.
     *
     * @return the elapsed nanoseconds, or empty if the id is unknown or the
     *         timer was already stopped
     */
    public OptionalLong stopTimer(long id) {
        RunningTimer timer = timers.remove(id);
        if (timer == null) {
            return OptionalLong.empty();
        }
        long elapsed = clock.nowNanos() - timer.startNanos();
        record(timer.name(), elapsed, 0);
        return OptionalLong.of(elapsed);
    }

    public int runningTimers() {
        return timers.size();
    }

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {
        delegate.onStateTransition(event);
    }

    @Override
    public void onTransportEvent(LinkTransportEvent event) {
        delegate.onTransportEvent(event);
    }

    @Override
    public void onMessageEvent(LinkMessageEvent event) {
        switch (event.stage()) {
            case SENT:
                record(SEND, event);
                break;
            case DELIVERED:
                record(RECEIVE, event);
                break;
            default:
                break;
        }
        delegate.onMessageEvent(event);
    }

    @Override
    public void onError(LinkErrorEvent event) {
        delegate.onError(event);
    }

    /**
     * Returns the timings collected so far without resetting them.
     */
    public PerformanceReport report() {
        stopExpiredTimers();
        synchronized (this) {
            return new PerformanceReport(stats);
        }
    }

    /**
     * Returns the timings collected so far and starts a fresh collection window.
     */
    public PerformanceReport drainReport() {
        stopExpiredTimers();
        synchronized (this) {
            PerformanceReport report = new PerformanceReport(stats);
            stats.clear();
            return report;
        }
    }

    private void stopExpiredTimers() {
        long now = clock.nowNanos();
        List<Long> expired = new ArrayList<>();
        timers.forEach((id, timer) -> {
            if (now - timer.startNanos() > timerTimeoutNanos) {
                expired.add(id);
            }
        });
        for (Long id : expired) {
            stopTimer(id);
        }
    }

    private void record(String operation, LinkMessageEvent event) {
        record(operation, event.elapsedNanos(), event.payloadLength());
    }

    private synchronized void record(String operation, long elapsedNanos, int bytes) {
        stats.merge(operation,
                PerformanceReport.OperationStats.first(operation, elapsedNanos, bytes),
                (current, ignored) -> current.plus(elapsedNanos, bytes));
    }
}
