package com.myorg.evreg.example;

import com.myorg.evreg.contracts.core.exception.DeadLetterFailureException;
import com.myorg.evreg.contracts.registration.EventCreated;
import com.myorg.evreg.delivery.PublishResult;
import com.myorg.evreg.delivery.fallback.FallbackReplayer;
import com.myorg.evreg.delivery.reprocess.DeadLetterReprocessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class DeliveryAdminController {

    private final EventPublishingService events;
    private final ObjectProvider<DeadLetterReprocessor> reprocessor;
    private final ObjectProvider<FallbackReplayer> replayer;

    @PostMapping("/events")
    public PublishResult createEvent(@RequestBody EventCreated event) {
        if (event.getId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "id is required");
        }
        return events.publishEventCreated(event);
    }

    @PostMapping("/admin/dead-letters/process")
    public Map<String, Object> processDeadLetters(@RequestParam(name = "max", defaultValue = "100") int max) {
        DeadLetterReprocessor r = reprocessor.getIfAvailable();
        if (r == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Dead-letter reprocessing is disabled (evreg.delivery.reprocessor.enabled=false)");
        }
        return Map.of("processed", r.process(max));
    }

    @PostMapping("/admin/dead-letters/fallback/replay")
    public Map<String, Object> replayFallback(@RequestParam(name = "max", defaultValue = "100") int max) {
        FallbackReplayer r = replayer.getIfAvailable();
        if (r == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Fallback replay is disabled (evreg.delivery.fallback.replay.enabled=false)");
        }
        return Map.of("replayed", r.replay(max));
    }

    @ExceptionHandler(DeadLetterFailureException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> onEventMayBeLost(DeadLetterFailureException e) {
        log.error("Request failed, event may be lost topic={} corrId={}", e.getOriginalTopic(), e.getCorrelationId(), e);
        return Map.of(
                "error", "EVENT_MAY_BE_LOST",
                "topic", e.getOriginalTopic(),
                "correlationId", String.valueOf(e.getCorrelationId())
        );
    }
}
