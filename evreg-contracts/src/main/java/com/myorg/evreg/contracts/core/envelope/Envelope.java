package com.myorg.evreg.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * A domain event wrapped for transport: destination topic, structured payload and an optional
 * correlation id used as the broker key and to trace retries.
 *
 * <p>The payload is copied in and out, so an envelope cannot change after it has been handed to a publisher.
 */
public record Envelope(String topic, JsonNode payload, String correlationId) {

    public Envelope {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
    }

    public static Envelope of(String topic, JsonNode payload, String correlationId) {
        return new Envelope(topic, payload, correlationId);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    public boolean hasCorrelationId() {
        return correlationId != null && !correlationId.isBlank();
    }
}
