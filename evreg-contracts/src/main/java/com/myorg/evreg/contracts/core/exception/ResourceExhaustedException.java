package com.myorg.evreg.contracts.core.exception;

public class ResourceExhaustedException extends DeliveryException {
    public ResourceExhaustedException(String bulkhead, int maxConcurrent, int maxQueue) {
        super(ErrorKind.RESOURCE_EXHAUSTED,
                "Bulkhead '" + bulkhead + "' is full (maxConcurrent=" + maxConcurrent + ", maxQueue=" + maxQueue + ")");
    }
}
