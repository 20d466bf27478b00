package com.myorg.evreg.contracts.core.spi;

import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;

/**
 * A message read from a dead-letter topic. When the value could not be parsed,
 * {@code record} is {@code null} and {@code readError} says why.
 */
public record ReceivedDeadLetter(
        String sourceTopic,
        int partition,
        long offset,
        DeadLetterRecord record,
        String rawValue,
        String readError
) {
    public static ReceivedDeadLetter readable(String sourceTopic, int partition, long offset,
                                              DeadLetterRecord record, String rawValue) {
        return new ReceivedDeadLetter(sourceTopic, partition, offset, record, rawValue, null);
    }

    public static ReceivedDeadLetter unreadable(String sourceTopic, int partition, long offset,
                                                String rawValue, String readError) {
        return new ReceivedDeadLetter(sourceTopic, partition, offset, null, rawValue, readError);
    }

    public boolean isReadable() {
        return record != null;
    }
}
