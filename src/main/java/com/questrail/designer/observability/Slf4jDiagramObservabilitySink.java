package com.questrail.designer.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DiagramObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDiagramObservabilitySink implements DiagramObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDiagramObservabilitySink.class);

    @Override
    public void onStateTransition(DiagramTransitionEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Diagram: {} -> {} via {}",
            event.oldState(),
            event.newState(),
            event.action());

        if (!event.removedEdgeIds().isEmpty()) {
            log.debug("Diagram: removed edges {}", event.removedEdgeIds());
        }
    }

    @Override
    public void onRejected(DiagramRejectionEvent event) {
        log.info("Diagram mutation rejected ({}): {} [{}]",
            event.result().kind(),
            event.result().error(),
            event.action());
    }

    @Override
    public void onError(DiagramErrorEvent event) {
        log.error("Diagram Error: {}", event.message(), event.cause());
    }
}
