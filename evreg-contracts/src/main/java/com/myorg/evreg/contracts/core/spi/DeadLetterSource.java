package com.myorg.evreg.contracts.core.spi;

import java.time.Duration;
import java.util.List;

/**
 * Consuming side of the dead-letter topics. Not thread-safe: one reader at a time.
 */
public interface DeadLetterSource extends AutoCloseable {

    /** Up to {@code maxRecords} messages in the order the topic delivers them; empty when none arrived in time. */
    List<ReceivedDeadLetter> poll(int maxRecords, Duration timeout);

    /** Acknowledge a message and every message before it on the same partition. */
    void commit(ReceivedDeadLetter received);

    /** Forget uncommitted progress so the next poll starts again after the last commit. */
    void rewind();

    @Override
    default void close() {
        // no-op by default
    }
}
