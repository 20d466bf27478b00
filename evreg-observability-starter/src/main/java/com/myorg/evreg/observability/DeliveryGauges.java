package com.myorg.evreg.observability;

import com.myorg.evreg.resilience.breaker.CircuitBreaker;
import com.myorg.evreg.resilience.bulkhead.Bulkhead;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;

/** Breaker state (0 closed, 1 open, 2 half-open) and bulkhead occupancy. */
@RequiredArgsConstructor
public class DeliveryGauges implements MeterBinder {

    private final String serviceName;
    private final CircuitBreaker breaker;   // may be null
    private final Bulkhead bulkhead;        // may be null

    @Override
    public void bindTo(MeterRegistry registry) {
        if (breaker != null) {
            Gauge.builder("evreg.delivery.circuit.state", breaker, b -> b.getState().gaugeValue())
                    .tag("service", serviceName)
                    .tag("breaker", breaker.getName())
                    .register(registry);
        }
        if (bulkhead != null) {
            Gauge.builder("evreg.delivery.bulkhead.in_flight", bulkhead, Bulkhead::getInFlight)
                    .tag("service", serviceName)
                    .tag("bulkhead", bulkhead.getName())
                    .register(registry);
            Gauge.builder("evreg.delivery.bulkhead.waiting", bulkhead, Bulkhead::getWaiting)
                    .tag("service", serviceName)
                    .tag("bulkhead", bulkhead.getName())
                    .register(registry);
        }
    }
}
