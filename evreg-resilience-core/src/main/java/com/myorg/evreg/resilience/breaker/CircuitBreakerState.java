package com.myorg.evreg.resilience.breaker;

public enum CircuitBreakerState {
    CLOSED(0),
    OPEN(1),
    HALF_OPEN(2);

    private final int gaugeValue;

    CircuitBreakerState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /** Numeric code exported by the circuit state gauge. */
    public int gaugeValue() {
        return gaugeValue;
    }
}
