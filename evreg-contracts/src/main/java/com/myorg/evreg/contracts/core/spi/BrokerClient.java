package com.myorg.evreg.contracts.core.spi;

import java.time.Duration;

/**
 * Raw, blocking access to the message broker. Implementations do not retry and do not
 * classify errors: whatever the broker reports is thrown as is.
 */
public interface BrokerClient {

    /**
     * Send one message and wait for the acknowledgment.
     *
     * @param topic   destination topic
     * @param key     message key, may be {@code null}
     * @param value   message value, serialized by the implementation
     * @param timeout how long to wait for the acknowledgment
     */
    BrokerAck send(String topic, String key, Object value, Duration timeout) throws Exception;
}
