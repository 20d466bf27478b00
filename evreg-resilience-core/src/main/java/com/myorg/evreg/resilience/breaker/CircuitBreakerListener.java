package com.myorg.evreg.resilience.breaker;

@FunctionalInterface
public interface CircuitBreakerListener {

    CircuitBreakerListener NOOP = (breaker, from, to) -> { };

    void onStateChange(String breaker, CircuitBreakerState from, CircuitBreakerState to);
}
