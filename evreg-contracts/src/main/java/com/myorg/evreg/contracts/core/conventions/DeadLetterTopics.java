package com.myorg.evreg.contracts.core.conventions;

import java.util.regex.Pattern;

/**
 * Naming of dead-letter and permanent-failure topics.
 *
 * <pre>
 *   event.created  -&gt;  dlq.event.created  -&gt;  dlq.event.created.permanent
 * </pre>
 */
public final class DeadLetterTopics {

    public static final String DEFAULT_PREFIX = "dlq.";
    public static final String DEFAULT_PERMANENT_SUFFIX = ".permanent";

    private final String prefix;
    private final String permanentSuffix;

    public DeadLetterTopics(String prefix, String permanentSuffix) {
        if (prefix == null || prefix.isBlank()) throw new IllegalArgumentException("prefix must not be blank");
        if (permanentSuffix == null || permanentSuffix.isBlank()) {
            throw new IllegalArgumentException("permanentSuffix must not be blank");
        }
        this.prefix = prefix;
        this.permanentSuffix = permanentSuffix;
    }

    public static DeadLetterTopics defaults() {
        return new DeadLetterTopics(DEFAULT_PREFIX, DEFAULT_PERMANENT_SUFFIX);
    }

    public String deadLetterTopic(String originalTopic) {
        return prefix + originalTopic;
    }

    public String permanentTopic(String originalTopic) {
        return deadLetterTopic(originalTopic) + permanentSuffix;
    }

    /** Permanent topic for a topic that is already a dead-letter topic. */
    public String permanentTopicOfDeadLetterTopic(String deadLetterTopic) {
        return isPermanent(deadLetterTopic) ? deadLetterTopic : deadLetterTopic + permanentSuffix;
    }

    public boolean isDeadLetterTopic(String topic) {
        return topic != null && topic.startsWith(prefix) && !isPermanent(topic);
    }

    public boolean isPermanent(String topic) {
        return topic != null && topic.startsWith(prefix) && topic.endsWith(permanentSuffix);
    }

    public String originalTopicOf(String deadLetterTopic) {
        if (!isDeadLetterTopic(deadLetterTopic)) {
            throw new IllegalArgumentException("Not a dead-letter topic: " + deadLetterTopic);
        }
        return deadLetterTopic.substring(prefix.length());
    }

    /** Matches every dead-letter topic but none of the permanent-failure topics. */
    public Pattern subscriptionPattern() {
        return Pattern.compile("^" + Pattern.quote(prefix) + "(?!.*" + Pattern.quote(permanentSuffix) + "$).+$");
    }

    public String getPrefix() {
        return prefix;
    }

    public String getPermanentSuffix() {
        return permanentSuffix;
    }
}
