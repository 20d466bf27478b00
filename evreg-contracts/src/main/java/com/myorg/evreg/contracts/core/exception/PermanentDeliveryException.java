package com.myorg.evreg.contracts.core.exception;

public class PermanentDeliveryException extends DeliveryException {

    private final String reason;

    public PermanentDeliveryException(String message) {
        this("NON_RETRYABLE", message);
    }

    public PermanentDeliveryException(String reason, String message) {
        this(reason, message, null);
    }

    public PermanentDeliveryException(String reason, String message, Throwable cause) {
        super(ErrorKind.PERMANENT, message, cause);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
