package com.myorg.evreg.delivery;

import com.myorg.evreg.contracts.core.exception.CircuitOpenException;
import com.myorg.evreg.contracts.core.exception.DeliveryException;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.contracts.core.spi.BrokerAck;
import com.myorg.evreg.contracts.core.spi.BrokerClient;
import com.myorg.evreg.resilience.breaker.CircuitBreaker;
import com.myorg.evreg.resilience.bulkhead.Bulkhead;
import com.myorg.evreg.resilience.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * One guarded send to the broker, composed in a fixed order:
 * bulkhead permit, circuit breaker admission, retried raw send, breaker verdict, permit release.
 *
 * <p>Every failure leaves as a {@link DeliveryException}. Only {@link ErrorKind#TRANSIENT} outcomes count
 * against the breaker: a malformed record or a cancelled caller says nothing about broker health.
 */
@Slf4j
public class ResilientSender {

    private final BrokerClient broker;
    private final Bulkhead bulkhead;
    private final CircuitBreaker breaker;
    private final RetryPolicy retry;
    private final Duration sendTimeout;
    private final Duration deliveryTimeout; // null = no deadline
    private final Clock clock;
    private final DeliveryMonitor monitor;

    public ResilientSender(BrokerClient broker,
                           Bulkhead bulkhead,
                           CircuitBreaker breaker,
                           RetryPolicy retry,
                           Duration sendTimeout,
                           Duration deliveryTimeout,
                           Clock clock,
                           DeliveryMonitor monitor) {
        this.broker = broker;
        this.bulkhead = bulkhead;
        this.breaker = breaker;
        this.retry = retry;
        this.sendTimeout = sendTimeout;
        this.deliveryTimeout = deliveryTimeout;
        this.clock = clock;
        this.monitor = monitor == null ? DeliveryMonitor.NOOP : monitor;
    }

    public BrokerAck send(String topic, String key, Object value) {
        long start = System.nanoTime();
        Instant deadline = deliveryTimeout == null ? null : clock.instant().plus(deliveryTimeout);

        try (Bulkhead.Permit permit = bulkhead.acquire(deliveryTimeout)) {
            CircuitBreaker.Permit call = breaker.tryAcquire();
            if (call == null) {
                throw new CircuitOpenException(breaker.getName());
            }

            boolean verdict = false;
            try {
                BrokerAck ack = retry.execute(
                        () -> broker.send(topic, key, value, sendTimeout),
                        deadline,
                        (attempt, delay, error) -> monitor.onRetry(topic, attempt, error));
                call.onSuccess();
                verdict = true;
                monitor.onSendSuccess(topic, since(start));
                return ack;
            } catch (DeliveryException e) {
                if (e.getKind() == ErrorKind.TRANSIENT) {
                    call.onFailure();
                    verdict = true;
                }
                throw e;
            } finally {
                if (!verdict) call.release();
            }
        } catch (DeliveryException e) {
            log.warn("Send failed topic={} key={} kind={} attempts={} error={}",
                    topic, key, e.getKind(), e.getAttempts(), e.getMessage());
            monitor.onSendFailure(topic, e.getKind(), since(start));
            throw e;
        }
    }

    public Bulkhead getBulkhead() {
        return bulkhead;
    }

    public CircuitBreaker getBreaker() {
        return breaker;
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
