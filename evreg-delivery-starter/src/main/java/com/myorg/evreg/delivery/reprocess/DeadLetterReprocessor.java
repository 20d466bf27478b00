package com.myorg.evreg.delivery.reprocess;

import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.spi.DeadLetterSource;
import com.myorg.evreg.contracts.core.spi.ReceivedDeadLetter;
import com.myorg.evreg.delivery.DeliveryMonitor;
import com.myorg.evreg.delivery.deadletter.DeadLetterRouter;
import com.myorg.evreg.delivery.idempotency.IdempotencyStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drains the dead-letter topics: every record is recovered by the handler of its original topic,
 * sent back one retry higher, or moved to the permanent-failure topic once its retries are used up.
 *
 * <p>A record is committed only after it reached one of these outcomes. When routing fails for good
 * the source is rewound, so the record is read again on the next run.
 */
@Slf4j
public class DeadLetterReprocessor {

    private final DeadLetterSource source;
    private final DeadLetterRouter router;
    private final RecoveryHandlerRegistry registry;
    private final IdempotencyStore idempotencyStore;
    private final int maxRetries;
    private final Duration pollTimeout;
    private final DeliveryMonitor monitor;

    private final ReentrantLock running = new ReentrantLock();

    public DeadLetterReprocessor(DeadLetterSource source,
                                 DeadLetterRouter router,
                                 RecoveryHandlerRegistry registry,
                                 IdempotencyStore idempotencyStore,
                                 int maxRetries,
                                 Duration pollTimeout,
                                 DeliveryMonitor monitor) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.source = source;
        this.router = router;
        this.registry = registry;
        this.idempotencyStore = idempotencyStore;
        this.maxRetries = maxRetries;
        this.pollTimeout = pollTimeout == null ? Duration.ofSeconds(1) : pollTimeout;
        this.monitor = monitor == null ? DeliveryMonitor.NOOP : monitor;
    }

    public void registerHandler(String originalTopic, RecoveryHandler handler) {
        registry.register(originalTopic, handler);
    }

    /**
     * @return number of records that reached an outcome; 0 when another run is in progress
     */
    public int process(int maxMessages) {
        if (maxMessages <= 0) return 0;
        if (!running.tryLock()) {
            log.info("Dead-letter processing already running, skipped");
            return 0;
        }
        try {
            int processed = 0;
            while (processed < maxMessages) {
                List<ReceivedDeadLetter> batch = source.poll(maxMessages - processed, pollTimeout);
                if (batch.isEmpty()) break;

                for (ReceivedDeadLetter received : batch) {
                    if (processed >= maxMessages) break;
                    ReprocessOutcome outcome;
                    try {
                        outcome = dispose(received);
                    } catch (RuntimeException e) {
                        source.rewind();
                        throw e;
                    }
                    source.commit(received);
                    monitor.onReprocessed(originalTopicOf(received), outcome);
                    processed++;
                }
            }
            if (processed > 0) {
                log.info("Dead-letter processing finished processed={}", processed);
            }
            return processed;
        } finally {
            running.unlock();
        }
    }

    private ReprocessOutcome dispose(ReceivedDeadLetter received) {
        if (!received.isReadable()) {
            log.error("Unreadable dead letter topic={} partition={} offset={} error={}",
                    received.sourceTopic(), received.partition(), received.offset(), received.readError());
            router.quarantineUnreadable(received);
            return ReprocessOutcome.QUARANTINED;
        }

        DeadLetterRecord record = received.record();
        if (record.retryCount() >= maxRetries) {
            router.quarantine(record);
            return ReprocessOutcome.QUARANTINED;
        }

        RecoveryHandler handler = registry.get(record.originalTopic());
        if (handler == null) {
            log.error("No recovery handler for topic={}, dead letter dropped corrId={} retryCount={}",
                    record.originalTopic(), record.correlationId(), record.retryCount());
            return ReprocessOutcome.DROPPED_NO_HANDLER;
        }

        String key = idempotencyKey(record);
        IdempotencyStore.Lease lease = null;
        if (key != null) {
            lease = idempotencyStore.tryBeginRecovery(key);
            if (!lease.isAcquired()) {
                log.info("Skip {} dead letter key={} topic={}",
                        lease.decision() == IdempotencyStore.Decision.RECOVERED ? "recovered" : "in-flight",
                        key, record.originalTopic());
                return ReprocessOutcome.SKIPPED_DUPLICATE;
            }
        }

        try {
            handler.recover(record.originalPayload(), record);
        } catch (Exception e) {
            if (lease != null) release(key, lease);
            log.warn("Recovery failed topic={} corrId={} retryCount={} error={}",
                    record.originalTopic(), record.correlationId(), record.retryCount(), e.toString());
            router.reroute(record, e);
            return ReprocessOutcome.REROUTED;
        }

        if (lease != null) idempotencyStore.markRecovered(key, lease.token());
        log.info("Recovered dead letter topic={} corrId={} retryCount={}",
                record.originalTopic(), record.correlationId(), record.retryCount());
        return ReprocessOutcome.RECOVERED;
    }

    private void release(String key, IdempotencyStore.Lease lease) {
        try {
            idempotencyStore.releaseRecovery(key, lease.token());
        } catch (Exception ex) {
            log.warn("Failed to release recovery lease key={}, it frees itself after the lease TTL", key, ex);
        }
    }

    // cùng record -> cùng key, kể cả sau reroute
    private String idempotencyKey(DeadLetterRecord record) {
        if (idempotencyStore == null) return null;
        String corrId = record.correlationId();
        if (corrId == null || corrId.isBlank() || record.firstFailureTime() == null) return null;
        return corrId + "@" + record.firstFailureTime().toEpochMilli();
    }

    private static String originalTopicOf(ReceivedDeadLetter received) {
        return received.isReadable() ? received.record().originalTopic() : received.sourceTopic();
    }
}
