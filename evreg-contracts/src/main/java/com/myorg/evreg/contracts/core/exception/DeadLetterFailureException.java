package com.myorg.evreg.contracts.core.exception;

/**
 * The message could be written neither to its dead-letter topic nor to local fallback storage.
 * The event may be lost; callers must not treat the publish as successful.
 */
public class DeadLetterFailureException extends DeliveryException {

    private final String originalTopic;
    private final String correlationId;

    public DeadLetterFailureException(String originalTopic, String correlationId, Throwable cause) {
        super(ErrorKind.DEAD_LETTER_FAILURE,
                "Event may be lost: dead-letter publish and fallback write both failed for topic="
                        + originalTopic + ", correlationId=" + correlationId,
                cause);
        this.originalTopic = originalTopic;
        this.correlationId = correlationId;
    }

    public String getOriginalTopic() {
        return originalTopic;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
