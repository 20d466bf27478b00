package com.myorg.evreg.contracts.core.exception;

public class CircuitOpenException extends DeliveryException {

    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super(ErrorKind.CIRCUIT_OPEN, "Circuit breaker '" + breakerName + "' is open");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
