package com.myorg.evreg.example;

import com.myorg.evreg.contracts.core.envelope.DeliveryJson;
import com.myorg.evreg.contracts.core.envelope.Envelope;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.contracts.registration.EventCreated;
import com.myorg.evreg.delivery.PublishResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class EventPublishingServiceTest {

    private final RecordingPublisher publisher = new RecordingPublisher();
    private final EventPublishingService service = new EventPublishingService(publisher, DeliveryJson.defaultMapper());

    @Test
    void publishesOnEventCreatedTopicWithEventCorrelationId() {
        EventCreated event = EventCreated.builder()
                .id(42L).title("Spring Meetup").location("Hall A").date("2024-06-01").seats(120)
                .build();

        PublishResult result = service.publishEventCreated(event);

        assertThat(result.isDelivered()).isTrue();
        assertThat(publisher.published).hasSize(1);
        Envelope sent = publisher.published.get(0);
        assertThat(sent.topic()).isEqualTo("event.created");
        assertThat(sent.correlationId()).isEqualTo("event-42");
        assertThat(sent.payload().get("title").asText()).isEqualTo("Spring Meetup");
        assertThat(sent.payload().get("seats").asInt()).isEqualTo(120);
    }

    @Test
    void returnsFallbackResultWithoutThrowing() {
        publisher.onPublish = e -> new PublishResult(PublishResult.Status.FALLBACK_STORED, e.topic(), e.correlationId(),
                null, ErrorKind.TRANSIENT, "dlq.event.created", Path.of("/tmp/event_fallback/x.json"));

        PublishResult result = service.publishEventCreated(EventCreated.builder().id(7L).title("t").build());

        assertThat(result.status()).isEqualTo(PublishResult.Status.FALLBACK_STORED);
        assertThat(result.errorKind()).isEqualTo(ErrorKind.TRANSIENT);
    }
}
