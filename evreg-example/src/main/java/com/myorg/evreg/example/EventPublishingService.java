package com.myorg.evreg.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evreg.contracts.registration.EventCreated;
import com.myorg.evreg.contracts.registration.RegistrationTopics;
import com.myorg.evreg.delivery.DeliveryPublisher;
import com.myorg.evreg.delivery.PublishResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventPublishingService {

    private final DeliveryPublisher publisher;
    private final ObjectMapper mapper;

    /**
     * Tell the rest of the platform an event was created. Never fails silently: the notification is
     * delivered, dead-lettered or written to a fallback file, otherwise DeadLetterFailureException.
     */
    public PublishResult publishEventCreated(EventCreated event) {
        JsonNode payload = mapper.valueToTree(event);
        PublishResult result = publisher.publish(RegistrationTopics.EVENT_CREATED, payload, "event-" + event.getId());
        if (!result.isDelivered()) {
            log.warn("Event created notification not delivered yet eventId={} status={} kind={}",
                    event.getId(), result.status(), result.errorKind());
        }
        return result;
    }
}
