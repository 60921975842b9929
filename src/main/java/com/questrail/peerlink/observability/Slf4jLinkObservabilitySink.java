package com.questrail.peerlink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLinkObservabilitySink implements LinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLinkObservabilitySink.class);

    private final String name;

    public Slf4jLinkObservabilitySink() {
        this("peerlink");
    }

    /**
     * @param name prefix identifying the connector in log lines (useful when a
     *             process runs several connectors)
     */
    public Slf4jLinkObservabilitySink(String name) {
        this.name = name;
    }

    @Override
    public void onStateTransition(LinkStateTransitionEvent event) {
        log.info("[{}] State: {} -> {}", name, event.oldState(), event.newState());
    }

    @Override
    public void onTransportEvent(LinkTransportEvent event) {
        switch (event.kind()) {
            case DIAL_FAILED:
            case HANDLE_DISCARDED:
                log.debug("[{}] Transport {}: {}", name, event.kind(), event.detail());
                break;
            case LINK_LOST:
                log.warn("[{}] Transport {}: {}", name, event.kind(), event.detail());
                break;
            default:
                log.info("[{}] Transport {}: {}", name, event.kind(), event.detail());
        }
    }

    @Override
    public void onMessageEvent(LinkMessageEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] Message {}: tag={}, payloadLength={}, elapsedMicros={}",
                name,
                event.stage(),
                event.tag(),
                event.payloadLength(),
                event.elapsedNanos() / 1_000);
        }
    }

    @Override
    public void onError(LinkErrorEvent event) {
        log.error("[{}] Error: {}", name, event.message(), event.cause());
    }
}
