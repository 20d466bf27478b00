package com.myorg.evreg.delivery.deadletter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.myorg.evreg.contracts.core.conventions.DeadLetterTopics;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.envelope.Envelope;
import com.myorg.evreg.contracts.core.exception.DeadLetterFailureException;
import com.myorg.evreg.contracts.core.exception.DeliveryException;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.contracts.core.spi.BrokerAck;
import com.myorg.evreg.contracts.core.spi.ReceivedDeadLetter;
import com.myorg.evreg.delivery.DeliveryMonitor;
import com.myorg.evreg.delivery.ResilientSender;
import com.myorg.evreg.delivery.fallback.FallbackStore;
import com.myorg.evreg.resilience.classify.ErrorClassifier;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Records undeliverable messages. A {@link DeadLetterRecord} is sent to the dead-letter (or permanent)
 * topic through the same guarded sender as regular traffic; when that fails too, the record is written
 * to the local {@link FallbackStore}. A failed dead-letter send is never dead-lettered again.
 *
 * <p>Only when the fallback write fails as well does the router throw
 * {@link DeadLetterFailureException}: the message may be lost and the caller must know.
 */
@Slf4j
public class DeadLetterRouter {

    private final ResilientSender sender;
    private final DeadLetterTopics topics;
    private final FallbackStore fallback;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final DeliveryMonitor monitor;

    public DeadLetterRouter(ResilientSender sender,
                            DeadLetterTopics topics,
                            FallbackStore fallback,
                            ErrorClassifier classifier,
                            Clock clock,
                            DeliveryMonitor monitor) {
        this.sender = sender;
        this.topics = topics;
        this.fallback = fallback;
        this.classifier = classifier;
        this.clock = clock;
        this.monitor = monitor == null ? DeliveryMonitor.NOOP : monitor;
    }

    public RouteResult route(String originalTopic, JsonNode payload, Throwable error, String correlationId, int retryCount) {
        DeadLetterRecord record = DeadLetterRecord.first(
                originalTopic, payload, error, kindOf(error), correlationId, retryCount, clock.instant());
        return dispatch(record, topics.deadLetterTopic(originalTopic), RouteResult.Disposition.DEAD_LETTERED, "delivery-failed");
    }

    public RouteResult route(Envelope envelope, Throwable error) {
        return route(envelope.topic(), envelope.payload(), error, envelope.correlationId(), 0);
    }

    /** Send a record back to its dead-letter topic after another failed recovery, one retry higher. */
    public RouteResult reroute(DeadLetterRecord previous, Throwable error) {
        DeadLetterRecord next = previous.nextAttempt(error, kindOf(error), clock.instant());
        return dispatch(next, topics.deadLetterTopic(next.originalTopic()), RouteResult.Disposition.DEAD_LETTERED, "recovery-failed");
    }

    /** Move a record, unchanged, to the permanent-failure topic. */
    public RouteResult quarantine(DeadLetterRecord record) {
        return dispatch(record, topics.permanentTopic(record.originalTopic()), RouteResult.Disposition.QUARANTINED, "retries-exhausted");
    }

    /**
     * Move a dead letter that could not be parsed to the permanent topic of the topic it was read from.
     * The raw text travels as the payload of a new record so the permanent topic holds one format only.
     */
    public RouteResult quarantineUnreadable(ReceivedDeadLetter received) {
        String source = received.sourceTopic();
        String originalTopic = topics.isDeadLetterTopic(source) ? topics.originalTopicOf(source) : source;
        Instant now = clock.instant();
        DeadLetterRecord record = new DeadLetterRecord(
                originalTopic,
                received.rawValue() == null ? null : TextNode.valueOf(received.rawValue()),
                "Unreadable dead letter at " + source + "/" + received.partition() + "@" + received.offset()
                        + ": " + received.readError(),
                ErrorKind.PERMANENT,
                0,
                now,
                now,
                null
        );
        return dispatch(record, topics.permanentTopicOfDeadLetterTopic(source), RouteResult.Disposition.QUARANTINED, "unreadable");
    }

    private RouteResult dispatch(DeadLetterRecord record, String target, RouteResult.Disposition disposition, String reason) {
        try {
            BrokerAck ack = sender.send(target, record.correlationId(), record);
            log.warn("{} topic={} target={} corrId={} kind={} retryCount={}",
                    disposition == RouteResult.Disposition.QUARANTINED ? "Quarantined" : "Dead-lettered",
                    record.originalTopic(), target, record.correlationId(), record.errorKind(), record.retryCount());
            monitor.onDeadLettered(record.originalTopic(), target, record.errorKind());
            return RouteResult.sent(disposition, target, record, ack);
        } catch (DeliveryException e) {
            log.error("Dead-letter publish FAILED target={} corrId={} kind={} error={}",
                    target, record.correlationId(), e.getKind(), e.getMessage());

            Optional<Path> file = fallback.store(target, record, reason, e);
            if (file.isPresent()) {
                monitor.onFallbackStored(target, record.errorKind());
                return RouteResult.stored(target, record, file.get());
            }

            log.error("Event may be lost: dead-letter publish and fallback write both failed topic={} corrId={}",
                    record.originalTopic(), record.correlationId());
            monitor.onDeadLetterFailure(record.originalTopic());
            throw new DeadLetterFailureException(record.originalTopic(), record.correlationId(), e);
        }
    }

    private ErrorKind kindOf(Throwable error) {
        if (error instanceof DeliveryException de) return de.getKind();
        return classifier.classify(error);
    }
}
