package com.myorg.evreg.delivery.fallback;

import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Last line of defense for records the broker would not take. There is no tier behind it, so
 * {@link #store} reports failure through its return value and never throws.
 */
public interface FallbackStore {

    /**
     * @param targetTopic topic the record should have reached
     * @param reason      short code of why it did not
     * @param error       the failure that sent it here
     * @return the stored file, or empty when nothing could be written
     */
    Optional<Path> store(String targetTopic, DeadLetterRecord record, String reason, Throwable error);

    /** Stored entries, oldest first. */
    List<StoredFallback> list();

    boolean delete(Path file);
}
