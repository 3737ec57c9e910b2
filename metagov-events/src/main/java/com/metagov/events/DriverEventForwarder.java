package com.metagov.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts JSON-encoded events to the driver's event receiver endpoint. Delivery is best effort:
 * transport failures and non-2xx responses are logged and never thrown or retried.
 */
public final class DriverEventForwarder {

    private static final Logger log = LoggerFactory.getLogger(DriverEventForwarder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI receiverUri;
    private final Duration timeout;
    private final HttpClient httpClient;

    public DriverEventForwarder(String receiverUrl, Duration timeout) {
        this.receiverUri = URI.create(Objects.requireNonNull(receiverUrl, "receiverUrl").trim());
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(10);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .build();
    }

    /**
     * Sends the event.
     *
     * @return true if the driver answered 2xx
     */
    public boolean forward(PlatformEvent event) {
        String json;
        try {
            json = MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Event {} from {} is not serializable; dropped: {}", event.eventType(), event.source(), e.getOriginalMessage());
            return false;
        }
        log.debug("Sending event to driver: {}", json);
        HttpRequest request = HttpRequest.newBuilder(receiverUri)
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() / 100 != 2) {
                log.error("Error sending event to driver at {}: {} {}", receiverUri, response.statusCode(), response.body());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.error("Error sending event to driver at {}: {}", receiverUri, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending event {} to driver", event.eventType());
            return false;
        }
    }

    public URI getReceiverUri() {
        return receiverUri;
    }
}
