package com.myorg.evreg.delivery.fallback;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;

import java.time.Instant;

/** Content of one fallback file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FallbackEntry(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("target_topic") String targetTopic,
        @JsonProperty("reason") String reason,
        @JsonProperty("error") String error,
        @JsonProperty("record") DeadLetterRecord record
) {
}
