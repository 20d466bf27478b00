package com.myorg.evreg.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.envelope.Envelope;
import com.myorg.evreg.contracts.registration.RegistrationTopics;
import com.myorg.evreg.delivery.DeliveryPublisher;
import com.myorg.evreg.delivery.reprocess.DeadLetterRecovery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

// Consumers dedupe on the event id, so sending the notification again is safe.
@Slf4j
@Component
@RequiredArgsConstructor
public class EventCreatedRecovery {

    private final DeliveryPublisher publisher;

    @DeadLetterRecovery(RegistrationTopics.EVENT_CREATED)
    public void redeliver(DeadLetterRecord record, JsonNode payload) {
        // deliver() ném lỗi khi fail -> reprocessor reroute, không dead-letter 2 lần
        publisher.deliver(Envelope.of(RegistrationTopics.EVENT_CREATED, payload, record.correlationId()));
        log.info("Redelivered event created notification corrId={} retryCount={}",
                record.correlationId(), record.retryCount());
    }
}
