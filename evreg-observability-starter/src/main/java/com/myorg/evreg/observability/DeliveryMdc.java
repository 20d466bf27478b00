package com.myorg.evreg.observability;

import org.slf4j.MDC;

public final class DeliveryMdc {
    public static final String CORRELATION_ID = "corrId";
    public static final String TOPIC = "topic";

    private static final Scope NOOP = () -> { };

    private DeliveryMdc() {}

    /** Values that were there before go back on {@link Scope#close()}, so nested publishes keep the outer context. */
    public static Scope put(String topic, String correlationId) {
        String previousTopic = MDC.get(TOPIC);
        String previousCorrId = MDC.get(CORRELATION_ID);
        if (topic != null) MDC.put(TOPIC, topic);
        if (correlationId != null) MDC.put(CORRELATION_ID, correlationId);
        return () -> {
            restore(TOPIC, previousTopic);
            restore(CORRELATION_ID, previousCorrId);
        };
    }

    public static Scope none() {
        return NOOP;
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
