package com.myorg.evreg.observability;

import com.myorg.evreg.contracts.core.envelope.Envelope;
import com.myorg.evreg.contracts.core.spi.BrokerAck;
import com.myorg.evreg.delivery.DeliveryPublisher;
import com.myorg.evreg.delivery.PublishResult;
import lombok.RequiredArgsConstructor;

/** Puts topic and correlation id in the MDC so every log line of a publish, retries included, carries them. */
@RequiredArgsConstructor
public class ObservingDeliveryPublisher implements DeliveryPublisher {

    private final DeliveryPublisher delegate;
    private final ObservabilityProperties props;

    @Override
    public PublishResult publish(Envelope envelope) {
        try (DeliveryMdc.Scope ignored = scope(envelope)) {
            return delegate.publish(envelope);
        }
    }

    @Override
    public BrokerAck deliver(Envelope envelope) {
        try (DeliveryMdc.Scope ignored = scope(envelope)) {
            return delegate.deliver(envelope);
        }
    }

    private DeliveryMdc.Scope scope(Envelope envelope) {
        return props.isMdcEnabled() ? DeliveryMdc.put(envelope.topic(), envelope.correlationId()) : DeliveryMdc.none();
    }

    public DeliveryPublisher getDelegate() {
        return delegate;
    }
}
