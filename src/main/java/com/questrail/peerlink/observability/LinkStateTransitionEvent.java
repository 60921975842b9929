package com.questrail.peerlink.observability;

import com.questrail.peerlink.api.ConnectionState;

import java.time.Instant;

/**
 * Record representing a connector lifecycle transition.
 */
public record LinkStateTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState
) {
}
