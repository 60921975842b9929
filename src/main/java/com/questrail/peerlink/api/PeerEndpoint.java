package com.questrail.peerlink.api;

import java.util.Objects;

/**
 * PeerEndpoint
 * -----------------------------------------------------------------------------
 * Addressing for one side of a symmetric link: the local port this side listens
 * on, and the host/port where the peer listens.
 *
 * <p>Both peers run identical logic; the only coordination between them is that
 * each knows the other's listening port.</p>
 */
public record PeerEndpoint(
        int listenPort,
        String peerHost,
        int peerPort
) {
    public static final String DEFAULT_PEER_HOST = "127.0.0.1";

    public PeerEndpoint {
        Objects.requireNonNull(peerHost, "peerHost");
        if (peerHost.isBlank()) {
            throw new IllegalArgumentException("peerHost must not be blank");
        }
        requirePort(listenPort, "listenPort");
        requirePort(peerPort, "peerPort");
    }

    public static PeerEndpoint of(int listenPort, int peerPort) {
        return new PeerEndpoint(listenPort, DEFAULT_PEER_HOST, peerPort);
    }

    public static PeerEndpoint of(int listenPort, int peerPort, String peerHost) {
        return new PeerEndpoint(listenPort, peerHost, peerPort);
    }

    /**
     * Returns true if the connection this side dials is the one both peers
     * should settle on when both directions connect at once.
     *
     * <p>The peer with the lower listening port owns the preferred connection.
     * With equal ports (peers on different hosts) there is no preference and
     * the first completed connection wins.</p>
     */
    public boolean prefersDialed() {
        return listenPort < peerPort;
    }

    /**
     * Returns true if the ports alone cannot decide which direction is preferred.
     */
    public boolean symmetricPorts() {
        return listenPort == peerPort;
    }

    private static void requirePort(int port, String name) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(name + " must be 1-65535, was " + port);
        }
    }

    @Override
    public String toString() {
        return "PeerEndpoint[listen=" + listenPort + ", peer=" + peerHost + ":" + peerPort + ']';
    }
}
