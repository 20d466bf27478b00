package com.myorg.evreg.delivery;

import com.myorg.evreg.contracts.core.envelope.Envelope;
import com.myorg.evreg.contracts.core.exception.DeliveryException;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.contracts.core.spi.BrokerAck;
import com.myorg.evreg.delivery.deadletter.DeadLetterRouter;
import com.myorg.evreg.delivery.deadletter.RouteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class ResilientDeliveryPublisher implements DeliveryPublisher {

    private final ResilientSender sender;
    private final DeadLetterRouter router;

    @Override
    public PublishResult publish(Envelope envelope) {
        try {
            BrokerAck ack = sender.send(envelope.topic(), envelope.correlationId(), envelope.payload());
            return PublishResult.delivered(envelope.topic(), envelope.correlationId(), ack);
        } catch (DeliveryException e) {
            // an interrupted caller is shutting down: report the cancellation, claim nothing
            if (e.getKind() == ErrorKind.CANCELLED && Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.warn("Publish failed, routing to dead letter topic={} corrId={} kind={}",
                    envelope.topic(), envelope.correlationId(), e.getKind());
            RouteResult route = router.route(envelope, e);
            return PublishResult.routed(envelope.topic(), envelope.correlationId(), e.getKind(), route);
        }
    }

    @Override
    public BrokerAck deliver(Envelope envelope) {
        return sender.send(envelope.topic(), envelope.correlationId(), envelope.payload());
    }
}
