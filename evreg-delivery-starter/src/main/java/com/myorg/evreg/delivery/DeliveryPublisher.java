package com.myorg.evreg.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.evreg.contracts.core.envelope.Envelope;
import com.myorg.evreg.contracts.core.exception.DeadLetterFailureException;
import com.myorg.evreg.contracts.core.spi.BrokerAck;

public interface DeliveryPublisher {

    /**
     * Deliver the envelope, or record it on the dead-letter path when delivery fails.
     *
     * @throws DeadLetterFailureException when the event could be recorded nowhere
     */
    PublishResult publish(Envelope envelope);

    default PublishResult publish(String topic, JsonNode payload, String correlationId) {
        return publish(Envelope.of(topic, payload, correlationId));
    }

    /**
     * Deliver the envelope to its topic with no dead-letter hand-off: a failure is thrown as a
     * {@link com.myorg.evreg.contracts.core.exception.DeliveryException}. Used where the caller already
     * owns the failure, e.g. recovery handlers.
     */
    BrokerAck deliver(Envelope envelope);
}
