package com.myorg.evreg.contracts.core.exception;

public class TransientDeliveryException extends DeliveryException {
    public TransientDeliveryException(String msg) { super(ErrorKind.TRANSIENT, msg); }
    public TransientDeliveryException(String msg, Throwable cause) { super(ErrorKind.TRANSIENT, msg, cause); }
}
