package com.myorg.evreg.delivery;

import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.delivery.reprocess.ReprocessOutcome;
import com.myorg.evreg.resilience.breaker.CircuitBreakerState;

import java.time.Duration;
import java.util.List;

/**
 * Observation sink of the delivery path. Every method is optional; implementations must not throw
 * (a failing monitor is logged and ignored by {@link #composite(List)}).
 */
public interface DeliveryMonitor {

    DeliveryMonitor NOOP = new DeliveryMonitor() {};

    default void onCircuitStateChange(String breaker, CircuitBreakerState from, CircuitBreakerState to) {}

    default void onSendSuccess(String topic, Duration latency) {}

    default void onSendFailure(String topic, ErrorKind kind, Duration latency) {}

    default void onRetry(String topic, int attempt, Throwable error) {}

    /** A dead-letter record reached {@code targetTopic} (dead-letter or permanent-failure topic). */
    default void onDeadLettered(String originalTopic, String targetTopic, ErrorKind kind) {}

    default void onFallbackStored(String targetTopic, ErrorKind kind) {}

    default void onDeadLetterFailure(String originalTopic) {}

    default void onReprocessed(String originalTopic, ReprocessOutcome outcome) {}

    static DeliveryMonitor composite(List<DeliveryMonitor> monitors) {
        if (monitors == null || monitors.isEmpty()) return NOOP;
        return new CompositeDeliveryMonitor(monitors);
    }
}
