/**
 * PeerLink Transport Ports
 * =============================================================================
 *
 * <p>These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete link binding and the connector core.</p>
 *
 * <p>Two bindings implement the same contract:</p>
 * <ul>
 *   <li>{@code transport.socket}: plain TCP sockets. Accept and dial race for a
 *       single connection; a dedicated reader thread reassembles length-prefixed
 *       frames.</li>
 *   <li>{@code transport.netty}: paired channels on Netty. Each side binds one
 *       channel and connects another; an event loop dispatches each discrete
 *       message.</li>
 * </ul>
 *
 * <h2>Containment rule</h2>
 * Netty types MUST NOT escape {@code transport.netty}. Everything above the port
 * sees only {@link com.questrail.peerlink.api.Message} values and lifecycle
 * callbacks.
 */
package com.questrail.peerlink.transport;
