package com.myorg.evreg.delivery;

import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.delivery.reprocess.ReprocessOutcome;
import com.myorg.evreg.resilience.breaker.CircuitBreakerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

@Slf4j
class CompositeDeliveryMonitor implements DeliveryMonitor {

    private final List<DeliveryMonitor> delegates;

    CompositeDeliveryMonitor(List<DeliveryMonitor> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void onCircuitStateChange(String breaker, CircuitBreakerState from, CircuitBreakerState to) {
        each(m -> m.onCircuitStateChange(breaker, from, to));
    }

    @Override
    public void onSendSuccess(String topic, Duration latency) {
        each(m -> m.onSendSuccess(topic, latency));
    }

    @Override
    public void onSendFailure(String topic, ErrorKind kind, Duration latency) {
        each(m -> m.onSendFailure(topic, kind, latency));
    }

    @Override
    public void onRetry(String topic, int attempt, Throwable error) {
        each(m -> m.onRetry(topic, attempt, error));
    }

    @Override
    public void onDeadLettered(String originalTopic, String targetTopic, ErrorKind kind) {
        each(m -> m.onDeadLettered(originalTopic, targetTopic, kind));
    }

    @Override
    public void onFallbackStored(String targetTopic, ErrorKind kind) {
        each(m -> m.onFallbackStored(targetTopic, kind));
    }

    @Override
    public void onDeadLetterFailure(String originalTopic) {
        each(m -> m.onDeadLetterFailure(originalTopic));
    }

    @Override
    public void onReprocessed(String originalTopic, ReprocessOutcome outcome) {
        each(m -> m.onReprocessed(originalTopic, outcome));
    }

    private void each(Consumer<DeliveryMonitor> call) {
        for (DeliveryMonitor m : delegates) {
            try {
                call.accept(m);
            } catch (Exception e) {
                log.warn("Delivery monitor {} failed: {}", m.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
