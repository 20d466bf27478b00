package com.myorg.evreg.observability;

import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.delivery.reprocess.ReprocessOutcome;
import com.myorg.evreg.resilience.breaker.CircuitBreakerState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ObservabilityProperties props = new ObservabilityProperties();
    private final DeliveryMetrics metrics = new DeliveryMetrics(registry, "event-service", props);

    @Test
    void base_meters_exist_before_anything_happens() {
        metrics.preRegisterBaseMeters();

        assertThat(registry.find("evreg.delivery.retry").tag("service", "event-service").counter()).isNotNull();
        assertThat(registry.find("evreg.delivery.fallback").counter()).isNotNull();
        assertThat(registry.find("evreg.delivery.dead_letter_failure").counter()).isNotNull();
        assertThat(registry.find("evreg.delivery.reprocessed").counters()).hasSize(ReprocessOutcome.values().length);
    }

    @Test
    void counts_sends_by_topic_and_outcome() {
        metrics.onSendSuccess("event.created", Duration.ofMillis(5));
        metrics.onSendSuccess("event.created", Duration.ofMillis(7));
        metrics.onSendFailure("event.created", ErrorKind.CIRCUIT_OPEN, Duration.ZERO);

        assertThat(registry.get("evreg.delivery.sent").tags("topic", "event.created", "outcome", "success")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("evreg.delivery.sent").tags("outcome", "circuit_open").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("evreg.delivery.latency").tags("outcome", "success").timer().count()).isEqualTo(2);
    }

    @Test
    void dead_letters_are_tagged_with_target_topic_and_error_kind() {
        metrics.preRegisterBaseMeters();
        metrics.onDeadLettered("event.created", "dlq.event.created", ErrorKind.TRANSIENT);
        metrics.onFallbackStored("dlq.event.created", ErrorKind.TRANSIENT);
        metrics.onDeadLetterFailure("event.created");
        metrics.onRetry("event.created", 1, new RuntimeException());

        assertThat(registry.get("evreg.delivery.dlq").tags("topic", "dlq.event.created", "error_kind", "TRANSIENT")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("evreg.delivery.fallback").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("evreg.delivery.dead_letter_failure").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("evreg.delivery.retry").counter().count()).isEqualTo(1.0);
    }

    @Test
    void topic_tag_can_be_collapsed() {
        props.setTagTopic(false);

        metrics.onSendSuccess("event.created", Duration.ZERO);

        assertThat(registry.get("evreg.delivery.sent").tag("topic", "all").counter().count()).isEqualTo(1.0);
    }

    @Test
    void records_breaker_transitions_and_reprocessing_outcomes() {
        metrics.onCircuitStateChange("kafka", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
        metrics.onReprocessed("event.created", ReprocessOutcome.REROUTED);

        assertThat(registry.get("evreg.delivery.circuit.transition")
                .tags("breaker", "kafka", "from", "CLOSED", "to", "OPEN").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("evreg.delivery.reprocessed").tag("outcome", "REROUTED").counter().count()).isEqualTo(1.0);
    }
}
