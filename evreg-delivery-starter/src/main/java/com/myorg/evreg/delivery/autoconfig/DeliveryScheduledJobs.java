package com.myorg.evreg.delivery.autoconfig;

import com.myorg.evreg.contracts.core.exception.DeliveryException;
import com.myorg.evreg.delivery.DeliveryProperties;
import com.myorg.evreg.delivery.fallback.FallbackReplayer;
import com.myorg.evreg.delivery.reprocess.DeadLetterReprocessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodic dead-letter reprocessing and fallback replay. Each job runs only when its feature and its
 * scheduling flag are both on; either can still be triggered by hand through the underlying bean.
 */
@Slf4j
@RequiredArgsConstructor
public class DeliveryScheduledJobs {

    private final DeliveryProperties props;
    private final DeadLetterReprocessor reprocessor; // null when disabled
    private final FallbackReplayer replayer;         // null when disabled

    @Scheduled(
            initialDelayString = "#{@evregDeliverySchedule.reprocessInitialDelayMs}",
            fixedDelayString = "#{@evregDeliverySchedule.reprocessIntervalMs}"
    )
    public void reprocessDeadLetters() {
        if (reprocessor == null) return;
        if (!props.getReprocessor().isEnabled() || !props.getReprocessor().isSchedulingEnabled()) return;
        try {
            reprocessor.process(props.getReprocessor().getBatchSize());
        } catch (DeliveryException e) {
            log.error("Scheduled dead-letter processing failed kind={} error={}", e.getKind(), e.getMessage(), e);
        }
    }

    @Scheduled(
            initialDelayString = "#{@evregDeliverySchedule.replayInitialDelayMs}",
            fixedDelayString = "#{@evregDeliverySchedule.replayIntervalMs}"
    )
    public void replayFallback() {
        if (replayer == null) return;
        DeliveryProperties.Fallback.Replay replay = props.getFallback().getReplay();
        if (!replay.isEnabled() || !replay.isSchedulingEnabled()) return;
        try {
            replayer.replay(replay.getBatchSize());
        } catch (DeliveryException e) {
            log.error("Scheduled fallback replay failed kind={} error={}", e.getKind(), e.getMessage(), e);
        }
    }
}
