package com.questrail.designer.observability;

/**
 * No-op implementation of DiagramObservabilitySink.
 */
public final class NullObservabilitySink implements DiagramObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(DiagramTransitionEvent event) {}

    @Override
    public void onRejected(DiagramRejectionEvent event) {}

    @Override
    public void onError(DiagramErrorEvent event) {}
}
