package com.questrail.peerlink.api;

/**
 * Lifecycle of a single {@link PeerConnector} session.
 *
 * <p>Transitions are monotonic: {@code IDLE -> ESTABLISHING -> CONNECTED -> CLOSED}.
 * {@code CLOSED} may also be entered directly from {@code IDLE} or
 * {@code ESTABLISHING} (abort, bind failure, early close). There is no way
 * back out of {@code CLOSED}.</p>
 */
public enum ConnectionState
{
    IDLE,
    ESTABLISHING,
    CONNECTED,
    CLOSED;

    /**
     * Returns true if moving from this state to {@code next} is a legal,
     * forward-only transition.
     */
    public boolean canTransitionTo(ConnectionState next) {
        if (next == null || next == this) {
            return false;
        }
        return this != CLOSED && next.ordinal() > ordinal();
    }
}
