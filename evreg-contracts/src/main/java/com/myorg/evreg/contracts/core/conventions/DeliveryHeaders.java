package com.myorg.evreg.contracts.core.conventions;

public final class DeliveryHeaders {
    private DeliveryHeaders() {}

    public static final String CORRELATION_ID = "evreg-correlation-id";

    public static final String ERROR_KIND = "evreg.dlq.error_kind";
    public static final String RETRY_COUNT = "evreg.dlq.retry_count";
    public static final String ORIGINAL_TOPIC = "evreg.dlq.original_topic";

    public static final String SERVICE = "evreg.dlq.service";
    public static final String TS_MS = "evreg.dlq.ts_ms";
}
