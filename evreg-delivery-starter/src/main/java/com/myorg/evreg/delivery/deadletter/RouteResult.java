package com.myorg.evreg.delivery.deadletter;

import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.spi.BrokerAck;

import java.nio.file.Path;

/**
 * Where a dead-letter record ended up. {@code topic} is the intended destination even when the record
 * was written to {@code fallbackFile} instead.
 */
public record RouteResult(
        Disposition disposition,
        String topic,
        DeadLetterRecord record,
        BrokerAck ack,
        Path fallbackFile
) {
    public enum Disposition { DEAD_LETTERED, QUARANTINED, FALLBACK_STORED }

    static RouteResult sent(Disposition disposition, String topic, DeadLetterRecord record, BrokerAck ack) {
        return new RouteResult(disposition, topic, record, ack, null);
    }

    static RouteResult stored(String topic, DeadLetterRecord record, Path file) {
        return new RouteResult(Disposition.FALLBACK_STORED, topic, record, null, file);
    }
}
