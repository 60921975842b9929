package com.questrail.peerlink.observability;

/**
 * Receives observability events from a peer connector and its transport.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from caller threads, the accept/dial/reader threads and
 * transport event loops, so implementations must be thread-safe and must not
 * block.</p>
 */
public interface LinkObservabilitySink {
    /**
     * Called when the connector moves between lifecycle states.
     * @param event the transition details
     */
    void onStateTransition(LinkStateTransitionEvent event);

    /**
     * Called for transport lifecycle events (listening, dial retries, link up/lost).
     * @param event the transport event
     */
    void onTransportEvent(LinkTransportEvent event);

    /**
     * Called when a message is written, queued from the wire, or handed to a receiver.
     * @param event the message event
     */
    void onMessageEvent(LinkMessageEvent event);

    /**
     * Called when an error occurs that is not thrown to any caller.
     * @param event the error event
     */
    void onError(LinkErrorEvent event);
}
