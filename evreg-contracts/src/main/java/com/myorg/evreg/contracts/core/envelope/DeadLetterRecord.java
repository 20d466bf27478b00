package com.myorg.evreg.contracts.core.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.myorg.evreg.contracts.core.exception.ErrorKind;

import java.time.Instant;
import java.util.Objects;

/**
 * A message that could not be delivered, together with why and how often delivery was attempted.
 *
 * <p>Records are never mutated. Each failed re-delivery produces a new record through
 * {@link #nextAttempt(Throwable, ErrorKind, Instant)} with a higher {@code retryCount} and the
 * original {@code firstFailureTime}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeadLetterRecord(
        @JsonProperty("original_topic") String originalTopic,
        @JsonProperty("original_payload") JsonNode originalPayload,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("error_kind") ErrorKind errorKind,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("first_failure_time") Instant firstFailureTime,
        @JsonProperty("last_failure_time") Instant lastFailureTime,
        @JsonProperty("correlation_id") String correlationId
) {
    static final int MAX_ERROR_MESSAGE = 2000;

    public DeadLetterRecord {
        Objects.requireNonNull(originalTopic, "originalTopic");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0 but was " + retryCount);
        }
        originalPayload = originalPayload == null ? NullNode.getInstance() : originalPayload.deepCopy();
    }

    public static DeadLetterRecord first(String originalTopic,
                                         JsonNode payload,
                                         Throwable error,
                                         ErrorKind kind,
                                         String correlationId,
                                         int retryCount,
                                         Instant now) {
        return new DeadLetterRecord(
                originalTopic,
                payload,
                describe(error),
                kind,
                retryCount,
                now,
                now,
                correlationId
        );
    }

    // copied out, so a recovery handler cannot change what a reroute sends
    @Override
    @JsonProperty("original_payload")
    public JsonNode originalPayload() {
        return originalPayload.deepCopy();
    }

    public DeadLetterRecord nextAttempt(Throwable error, ErrorKind kind, Instant now) {
        return new DeadLetterRecord(
                originalTopic,
                originalPayload,
                describe(error),
                kind,
                retryCount + 1,
                firstFailureTime == null ? now : firstFailureTime,
                now,
                correlationId
        );
    }

    /** "SimpleName: message" of the most specific cause. */
    public static String describe(Throwable error) {
        if (error == null) return "";
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = root.getClass().getSimpleName() + ": " + (root.getMessage() == null ? "" : root.getMessage());
        return msg.length() > MAX_ERROR_MESSAGE ? msg.substring(0, MAX_ERROR_MESSAGE) : msg;
    }
}
