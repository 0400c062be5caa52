package com.questrail.designer.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements DiagramObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(DiagramTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRejected(DiagramRejectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(DiagramErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<DiagramTransitionEvent> getStateTransitions() {
        return ofType(DiagramTransitionEvent.class);
    }

    public synchronized List<DiagramRejectionEvent> getRejections() {
        return ofType(DiagramRejectionEvent.class);
    }

    public synchronized List<DiagramErrorEvent> getErrors() {
        return ofType(DiagramErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
