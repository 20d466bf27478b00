package com.myorg.evreg.delivery;

import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.contracts.core.spi.BrokerAck;
import com.myorg.evreg.delivery.deadletter.RouteResult;

import java.nio.file.Path;

/**
 * Outcome of {@link DeliveryPublisher#publish}. Every status means the event is durably recorded
 * somewhere: on its topic, on its dead-letter topic, or in a local fallback file.
 */
public record PublishResult(
        Status status,
        String topic,
        String correlationId,
        BrokerAck ack,
        ErrorKind errorKind,
        String deadLetterTopic,
        Path fallbackFile
) {
    public enum Status { DELIVERED, DEAD_LETTERED, FALLBACK_STORED }

    public static PublishResult delivered(String topic, String correlationId, BrokerAck ack) {
        return new PublishResult(Status.DELIVERED, topic, correlationId, ack, null, null, null);
    }

    public static PublishResult routed(String topic, String correlationId, ErrorKind kind, RouteResult route) {
        Status status = route.disposition() == RouteResult.Disposition.FALLBACK_STORED
                ? Status.FALLBACK_STORED
                : Status.DEAD_LETTERED;
        return new PublishResult(status, topic, correlationId, route.ack(), kind, route.topic(), route.fallbackFile());
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
