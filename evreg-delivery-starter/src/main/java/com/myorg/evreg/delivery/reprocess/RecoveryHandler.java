package com.myorg.evreg.delivery.reprocess;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;

/**
 * Re-executes the side effect of a dead-lettered message, e.g. publishing it again to its original topic.
 *
 * <p>Dead letters are delivered at least once: a crash between the side effect and the commit replays
 * the record. Implementations must be idempotent.
 */
@FunctionalInterface
public interface RecoveryHandler {
    void recover(JsonNode payload, DeadLetterRecord record) throws Exception;
}
