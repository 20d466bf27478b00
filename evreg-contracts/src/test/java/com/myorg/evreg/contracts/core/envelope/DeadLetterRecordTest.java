package com.myorg.evreg.contracts.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadLetterRecordTest {

    private final ObjectMapper mapper = DeliveryJson.defaultMapper();

    @Test
    void nextAttemptIncrementsRetryCountAndKeepsFirstFailureTime() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");
        Instant t1 = t0.plusSeconds(30);
        ObjectNode payload = mapper.createObjectNode().put("id", 7);

        DeadLetterRecord first = DeadLetterRecord.first("event.created", payload,
                new TimeoutException("broker slow"), ErrorKind.TRANSIENT, "event-7", 0, t0);
        DeadLetterRecord second = first.nextAttempt(new IllegalStateException("handler down"), ErrorKind.TRANSIENT, t1);

        assertThat(second.retryCount()).isEqualTo(1);
        assertThat(second.firstFailureTime()).isEqualTo(t0);
        assertThat(second.lastFailureTime()).isEqualTo(t1);
        assertThat(second.originalPayload()).isEqualTo(first.originalPayload());
        assertThat(second.errorMessage()).isEqualTo("IllegalStateException: handler down");
        assertThat(first.retryCount()).isZero();
    }

    @Test
    void negativeRetryCountIsRejected() {
        assertThatThrownBy(() -> new DeadLetterRecord("t", null, "", ErrorKind.TRANSIENT, -1, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describeUsesMostSpecificCause() {
        RuntimeException wrapped = new RuntimeException("outer", new TimeoutException("inner"));
        assertThat(DeadLetterRecord.describe(wrapped)).isEqualTo("TimeoutException: inner");
    }

    @Test
    void serializesWithSnakeCaseFieldNames() throws Exception {
        DeadLetterRecord rec = DeadLetterRecord.first("event.created",
                mapper.createObjectNode().put("title", "Java Meetup"),
                new TimeoutException("t"), ErrorKind.TRANSIENT, "c-1", 2, Instant.parse("2024-05-01T10:00:00Z"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(rec));

        assertThat(json.get("original_topic").asText()).isEqualTo("event.created");
        assertThat(json.get("original_payload").get("title").asText()).isEqualTo("Java Meetup");
        assertThat(json.get("error_kind").asText()).isEqualTo("TRANSIENT");
        assertThat(json.get("retry_count").asInt()).isEqualTo(2);
        assertThat(json.get("first_failure_time").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("correlation_id").asText()).isEqualTo("c-1");

        DeadLetterRecord back = mapper.treeToValue(json, DeadLetterRecord.class);
        assertThat(back).isEqualTo(rec);
    }

    @Test
    void recordPayloadCannotBeChangedThroughTheAccessor() {
        DeadLetterRecord rec = DeadLetterRecord.first("event.created", mapper.createObjectNode().put("seats", 10),
                new TimeoutException("t"), ErrorKind.TRANSIENT, "c-1", 0, Instant.parse("2024-05-01T10:00:00Z"));

        ((ObjectNode) rec.originalPayload()).put("seats", 42);
        DeadLetterRecord next = rec.nextAttempt(new IllegalStateException("x"), ErrorKind.TRANSIENT,
                Instant.parse("2024-05-01T10:01:00Z"));

        assertThat(rec.originalPayload().get("seats").asInt()).isEqualTo(10);
        assertThat(next.originalPayload().get("seats").asInt()).isEqualTo(10);
    }

    @Test
    void envelopePayloadCannotBeChangedFromOutside() {
        ObjectNode payload = mapper.createObjectNode().put("seats", 10);
        Envelope env = Envelope.of("event.created", payload, "c-1");

        payload.put("seats", 99);
        ((ObjectNode) env.payload()).put("seats", 42);

        assertThat(env.payload().get("seats").asInt()).isEqualTo(10);
    }
}
