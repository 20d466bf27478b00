package com.myorg.evreg.resilience.retry;

import com.myorg.evreg.contracts.core.exception.DeliveryCancelledException;
import com.myorg.evreg.contracts.core.exception.DeliveryException;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.resilience.classify.DefaultErrorClassifier;
import com.myorg.evreg.resilience.classify.ErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential backoff and jitter. Only failures classified as
 * {@link ErrorKind#TRANSIENT} are retried.
 *
 * <p>Whatever the wrapped call throws leaves {@link #execute} as a {@link DeliveryException} carrying
 * the kind and the number of attempts made. Cancellation (interrupt or deadline) is checked before
 * every attempt and surfaces as {@link DeliveryCancelledException}.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(maxAttempts, baseDelay, maxDelay, jitterFactor, new DefaultErrorClassifier(), Sleeper.THREAD, Clock.systemUTC());
    }

    public RetryPolicy(int maxAttempts,
                       Duration baseDelay,
                       Duration maxDelay,
                       double jitterFactor,
                       ErrorClassifier classifier,
                       Sleeper sleeper,
                       Clock clock) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
        this.classifier = classifier == null ? new DefaultErrorClassifier() : classifier;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public <T> T execute(Callable<T> call) {
        return execute(call, null, RetryListener.NOOP);
    }

    public <T> T execute(Callable<T> call, Instant deadline) {
        return execute(call, deadline, RetryListener.NOOP);
    }

    /**
     * @param deadline no attempt starts after this instant; {@code null} = no deadline
     */
    public <T> T execute(Callable<T> call, Instant deadline, RetryListener listener) {
        RetryListener l = listener == null ? RetryListener.NOOP : listener;
        BackOffExecution backOff = newBackOff().start();

        Throwable last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            checkCancelled(attempt - 1, deadline, last);
            try {
                return call.call();
            } catch (Exception e) {
                last = e;
                ErrorKind kind = classifier.classify(e);

                if (kind == ErrorKind.CANCELLED) {
                    if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                    throw new DeliveryCancelledException("Cancelled during attempt " + attempt, e, attempt);
                }
                if (!kind.isRetryable()) {
                    throw wrap(kind, "Non-retryable failure on attempt " + attempt, e, attempt);
                }
                if (attempt >= maxAttempts) break;

                Duration delay = nextDelay(backOff);
                if (deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
                    throw new DeliveryCancelledException(
                            "Deadline reached after " + attempt + " attempt(s)", e, attempt);
                }

                log.warn("Retry attempt={}/{} in {}ms after {}", attempt, maxAttempts, delay.toMillis(), e.toString());
                l.onRetry(attempt, delay, e);
                sleep(delay, attempt, e);
            }
        }
        throw new DeliveryException(ErrorKind.TRANSIENT,
                "Gave up after " + maxAttempts + " attempt(s): " + (last == null ? "" : last.getMessage()),
                last, maxAttempts);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Delay before attempt {@code attempt + 1} without jitter. */
    Duration baseDelayFor(int attempt) {
        BackOffExecution execution = newBackOff().start();
        long ms = 0L;
        for (int i = 0; i < attempt; i++) {
            ms = execution.nextBackOff();
        }
        return Duration.ofMillis(ms);
    }

    private ExponentialBackOff newBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(Math.max(0L, baseDelay.toMillis()), 2.0);
        backOff.setMaxInterval(maxDelay.toMillis());
        return backOff;
    }

    private Duration nextDelay(BackOffExecution backOff) {
        long raw = backOff.nextBackOff();
        if (raw == BackOffExecution.STOP) raw = maxDelay.toMillis();

        long jitter = 0L;
        if (jitterFactor > 0.0 && raw > 0L) {
            jitter = (long) (ThreadLocalRandom.current().nextDouble() * jitterFactor * raw);
        }
        return Duration.ofMillis(Math.min(maxDelay.toMillis(), raw + jitter));
    }

    private void checkCancelled(int attemptsSoFar, Instant deadline, Throwable last) {
        if (Thread.currentThread().isInterrupted()) {
            throw new DeliveryCancelledException("Interrupted before attempt " + (attemptsSoFar + 1), last, attemptsSoFar);
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new DeliveryCancelledException("Deadline reached after " + attemptsSoFar + " attempt(s)", last, attemptsSoFar);
        }
    }

    private void sleep(Duration delay, int attempt, Throwable last) {
        if (delay.isZero()) return;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DeliveryCancelledException cancelled =
                    new DeliveryCancelledException("Interrupted while backing off after attempt " + attempt, ie, attempt);
            cancelled.addSuppressed(last);
            throw cancelled;
        }
    }

    private static DeliveryException wrap(ErrorKind kind, String message, Throwable e, int attempt) {
        return new DeliveryException(kind, message + ": " + e.getMessage(), e, attempt);
    }
}
