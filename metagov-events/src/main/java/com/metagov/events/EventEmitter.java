package com.metagov.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Formats domain events and hands them to in-process listeners, then to the driver forwarder when one
 * is configured. A failing listener is logged and does not stop delivery to the others.
 */
public final class EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final DriverEventForwarder forwarder;
    private final Clock clock;

    /**
     * @param forwarder driver forwarder; null = listeners only
     * @param clock     clock for event timestamps
     */
    public EventEmitter(DriverEventForwarder forwarder, Clock clock) {
        this.forwarder = forwarder;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EventEmitter(DriverEventForwarder forwarder) {
        this(forwarder, Clock.systemUTC());
    }

    public void addListener(EventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    /** Builds and emits an event. */
    public PlatformEvent emit(String community, String source, String eventType,
                              Map<String, Object> data, Map<String, Object> initiator) {
        PlatformEvent event = PlatformEvent.of(community, source, eventType, data, initiator, clock);
        emit(event);
        return event;
    }

    public void emit(PlatformEvent event) {
        Objects.requireNonNull(event, "event");
        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed for {} from {}: {}", event.eventType(), event.source(), e.getMessage(), e);
            }
        }
        if (forwarder != null) {
            forwarder.forward(event);
        }
    }
}
