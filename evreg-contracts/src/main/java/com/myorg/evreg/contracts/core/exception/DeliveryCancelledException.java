package com.myorg.evreg.contracts.core.exception;

public class DeliveryCancelledException extends DeliveryException {
    public DeliveryCancelledException(String msg) {
        super(ErrorKind.CANCELLED, msg);
    }

    public DeliveryCancelledException(String msg, Throwable cause) {
        super(ErrorKind.CANCELLED, msg, cause);
    }

    public DeliveryCancelledException(String msg, Throwable cause, int attempts) {
        super(ErrorKind.CANCELLED, msg, cause, attempts);
    }
}
