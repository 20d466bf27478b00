package com.myorg.evreg.contracts.core.spi;

/** Broker acknowledgment of a sent message. Partition and offset are -1 when the broker reports none. */
public record BrokerAck(String topic, int partition, long offset) {

    public static BrokerAck unknown(String topic) {
        return new BrokerAck(topic, -1, -1L);
    }
}
