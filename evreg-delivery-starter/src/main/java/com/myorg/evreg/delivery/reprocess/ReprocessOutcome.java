package com.myorg.evreg.delivery.reprocess;

/** What the reprocessor did with one dead letter before committing it. */
public enum ReprocessOutcome {
    /** Handler succeeded. */
    RECOVERED,
    /** Handler failed; a copy with retry_count + 1 went back to the dead-letter topic. */
    REROUTED,
    /** Retries exhausted or unreadable; moved to the permanent-failure topic. */
    QUARANTINED,
    /** No handler for the original topic. */
    DROPPED_NO_HANDLER,
    /** Already recovered, or being recovered by another instance. */
    SKIPPED_DUPLICATE
}
