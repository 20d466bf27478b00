package com.myorg.evreg.delivery.fallback;

import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.exception.DeliveryException;
import com.myorg.evreg.delivery.ResilientSender;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Sends fallback files back to the topics they were meant for once the broker is reachable again.
 * A file is deleted only after the broker acknowledged its record; the first failed send ends the run.
 */
@Slf4j
public class FallbackReplayer {

    private final FallbackStore store;
    private final ResilientSender sender;
    private final ReentrantLock running = new ReentrantLock();

    public FallbackReplayer(FallbackStore store, ResilientSender sender) {
        this.store = store;
        this.sender = sender;
    }

    /** @return number of records delivered and removed from the store */
    public int replay(int maxEntries) {
        if (maxEntries <= 0) return 0;
        if (!running.tryLock()) {
            log.debug("Fallback replay already running, skipping");
            return 0;
        }
        try {
            int replayed = 0;
            for (StoredFallback stored : store.list()) {
                if (replayed >= maxEntries) break;

                FallbackEntry entry = stored.entry();
                DeadLetterRecord record = entry.record();
                if (record == null || entry.targetTopic() == null) {
                    log.warn("Fallback file without record or target, leaving it for inspection file={}", stored.file());
                    continue;
                }
                try {
                    sender.send(entry.targetTopic(), record.correlationId(), record);
                } catch (DeliveryException e) {
                    log.warn("Fallback replay stopped after {} record(s): target={} kind={} error={}",
                            replayed, entry.targetTopic(), e.getKind(), e.getMessage());
                    break;
                }
                if (!store.delete(stored.file())) {
                    log.warn("Replayed record but could not delete file={}; it will be sent again", stored.file());
                }
                replayed++;
            }
            if (replayed > 0) log.info("Replayed {} fallback record(s)", replayed);
            return replayed;
        } finally {
            running.unlock();
        }
    }
}
