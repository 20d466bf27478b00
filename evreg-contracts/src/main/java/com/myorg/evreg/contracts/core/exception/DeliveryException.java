package com.myorg.evreg.contracts.core.exception;

/**
 * Failure of a delivery attempt, tagged with its {@link ErrorKind} and the number of attempts made.
 */
public class DeliveryException extends RuntimeException {

    private final ErrorKind kind;
    private final int attempts;

    public DeliveryException(ErrorKind kind, String message) {
        this(kind, message, null, 0);
    }

    public DeliveryException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, 0);
    }

    public DeliveryException(ErrorKind kind, String message, Throwable cause, int attempts) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.TRANSIENT : kind;
        this.attempts = Math.max(0, attempts);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getAttempts() {
        return attempts;
    }
}
