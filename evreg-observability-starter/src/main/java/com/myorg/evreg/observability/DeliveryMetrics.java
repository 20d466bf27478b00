package com.myorg.evreg.observability;

import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.delivery.DeliveryMonitor;
import com.myorg.evreg.delivery.reprocess.ReprocessOutcome;
import com.myorg.evreg.resilience.breaker.CircuitBreakerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Locale;

@RequiredArgsConstructor
public class DeliveryMetrics implements DeliveryMonitor {

    static final String SENT = "evreg.delivery.sent";
    static final String RETRY = "evreg.delivery.retry";
    static final String DLQ = "evreg.delivery.dlq";
    static final String FALLBACK = "evreg.delivery.fallback";
    static final String DEAD_LETTER_FAILURE = "evreg.delivery.dead_letter_failure";
    static final String REPROCESSED = "evreg.delivery.reprocessed";
    static final String CIRCUIT_TRANSITION = "evreg.delivery.circuit.transition";
    static final String LATENCY = "evreg.delivery.latency";

    private static final String ALL_TOPICS = "all";

    private final MeterRegistry registry;
    private final String serviceName;
    private final ObservabilityProperties props;

    private Counter cRetry;
    private Counter cFallback;
    private Counter cDeadLetterFailure;

    /** Call once on startup, so the meters exist before the first event. */
    public void preRegisterBaseMeters() {
        cRetry = Counter.builder(RETRY).tag("service", serviceName).register(registry);
        cFallback = Counter.builder(FALLBACK).tag("service", serviceName).register(registry);
        cDeadLetterFailure = Counter.builder(DEAD_LETTER_FAILURE).tag("service", serviceName).register(registry);
        for (ReprocessOutcome outcome : ReprocessOutcome.values()) {
            reprocessed(outcome);
        }
    }

    @Override
    public void onSendSuccess(String topic, Duration latency) {
        sent(topic, "success").increment();
        latency(topic, "success").record(latency);
    }

    @Override
    public void onSendFailure(String topic, ErrorKind kind, Duration latency) {
        String outcome = kind == null ? "failure" : kind.name().toLowerCase(Locale.ROOT);
        sent(topic, outcome).increment();
        latency(topic, outcome).record(latency);
    }

    @Override
    public void onRetry(String topic, int attempt, Throwable error) {
        counter(cRetry, RETRY).increment();
    }

    @Override
    public void onDeadLettered(String originalTopic, String targetTopic, ErrorKind kind) {
        Counter.builder(DLQ)
                .tag("service", serviceName)
                .tag("topic", topicTag(targetTopic))
                .tag("error_kind", kind == null ? "unknown" : kind.name())
                .register(registry)
                .increment();
    }

    @Override
    public void onFallbackStored(String targetTopic, ErrorKind kind) {
        counter(cFallback, FALLBACK).increment();
    }

    @Override
    public void onDeadLetterFailure(String originalTopic) {
        counter(cDeadLetterFailure, DEAD_LETTER_FAILURE).increment();
    }

    @Override
    public void onReprocessed(String originalTopic, ReprocessOutcome outcome) {
        reprocessed(outcome).increment();
    }

    @Override
    public void onCircuitStateChange(String breaker, CircuitBreakerState from, CircuitBreakerState to) {
        Counter.builder(CIRCUIT_TRANSITION)
                .tag("service", serviceName)
                .tag("breaker", breaker)
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
    }

    private Counter sent(String topic, String outcome) {
        return Counter.builder(SENT)
                .tag("service", serviceName)
                .tag("topic", topicTag(topic))
                .tag("outcome", outcome)
                .register(registry);
    }

    private Timer latency(String topic, String outcome) {
        return Timer.builder(LATENCY)
                .tag("service", serviceName)
                .tag("topic", topicTag(topic))
                .tag("outcome", outcome)
                .register(registry);
    }

    private Counter reprocessed(ReprocessOutcome outcome) {
        return Counter.builder(REPROCESSED)
                .tag("service", serviceName)
                .tag("outcome", outcome.name())
                .register(registry);
    }

    // trước khi preRegisterBaseMeters() chạy
    private Counter counter(Counter pre, String name) {
        return pre != null ? pre : registry.counter(name, "service", serviceName);
    }

    private String topicTag(String topic) {
        if (!props.isTagTopic() || topic == null) return ALL_TOPICS;
        return topic;
    }
}
