package com.questrail.h264meta.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SeiObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onInjected(SeiInjectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onExtracted(SeiExtractionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPayloadDropped(SeiDropEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SeiInjectionEvent> getInjections() {
        return events.stream()
            .filter(e -> e instanceof SeiInjectionEvent)
            .map(e -> (SeiInjectionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<SeiDropEvent> getDrops() {
        return events.stream()
            .filter(e -> e instanceof SeiDropEvent)
            .map(e -> (SeiDropEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasDrop(SeiDropEvent.Reason reason) {
        return getDrops().stream().anyMatch(d -> d.reason() == reason);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
