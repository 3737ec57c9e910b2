package com.metagov.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Domain event forwarded to the driver. {@code timestamp} is epoch seconds with millisecond fraction.
 */
public record PlatformEvent(
        @JsonProperty("community") String community,
        @JsonProperty("source") String source,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("initiator") Map<String, Object> initiator) {

    public PlatformEvent {
        Objects.requireNonNull(community, "community");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(eventType, "eventType");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        initiator = initiator != null ? Collections.unmodifiableMap(new LinkedHashMap<>(initiator)) : Map.of();
    }

    /** Creates an event stamped with the given clock. */
    public static PlatformEvent of(String community, String source, String eventType,
                                   Map<String, Object> data, Map<String, Object> initiator, Clock clock) {
        String ts = BigDecimal.valueOf(clock.millis(), 3).toPlainString();
        return new PlatformEvent(community, source, eventType, ts, data, initiator);
    }
}
