package com.questrail.designer.observability;

/**
 * Main interface for receiving diagram store observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DiagramObservabilitySink {
    /**
     * Called after a mutation has been committed.
     * @param event the transition details
     */
    void onStateTransition(DiagramTransitionEvent event);

    /**
     * Called when a mutation was refused and the state left unchanged.
     * @param event the rejected action and the reason
     */
    void onRejected(DiagramRejectionEvent event);

    /**
     * Called when an import or generation fails.
     * @param event the error event
     */
    void onError(DiagramErrorEvent event);
}
