package com.myorg.evreg.example;

import com.myorg.evreg.contracts.core.envelope.Envelope;
import com.myorg.evreg.contracts.core.spi.BrokerAck;
import com.myorg.evreg.delivery.DeliveryPublisher;
import com.myorg.evreg.delivery.PublishResult;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

class RecordingPublisher implements DeliveryPublisher {

    final List<Envelope> published = new ArrayList<>();
    final List<Envelope> delivered = new ArrayList<>();
    Function<Envelope, PublishResult> onPublish =
            e -> PublishResult.delivered(e.topic(), e.correlationId(), new BrokerAck(e.topic(), 0, 1L));
    RuntimeException deliverFailure;

    @Override
    public PublishResult publish(Envelope envelope) {
        published.add(envelope);
        return onPublish.apply(envelope);
    }

    @Override
    public BrokerAck deliver(Envelope envelope) {
        delivered.add(envelope);
        if (deliverFailure != null) throw deliverFailure;
        return new BrokerAck(envelope.topic(), 0, delivered.size());
    }
}
