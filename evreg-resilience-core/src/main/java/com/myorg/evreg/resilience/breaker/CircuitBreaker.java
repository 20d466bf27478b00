package com.myorg.evreg.resilience.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consecutive-failure circuit breaker for one logical dependency.
 *
 * <p>{@code CLOSED -> OPEN} after {@code failureThreshold} consecutive failures,
 * {@code OPEN -> HALF_OPEN} once {@code resetTimeout} has elapsed, then a single trial call decides:
 * success closes the breaker, failure opens it again with a fresh timer. While the trial is running
 * every other caller is refused, exactly as if the breaker were open.
 *
 * <p>An admitted call holds a {@link Permit} and ends it with exactly one of {@link Permit#onSuccess()},
 * {@link Permit#onFailure()} or {@link Permit#release()}. A permit is stamped with the state generation it
 * was issued in; once the breaker has changed state its outcome is ignored, so a slow call admitted while
 * closed cannot decide a half-open trial it was not part of.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final CircuitBreakerListener listener;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private long generation;
    private int failureCount;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout) {
        this(name, failureThreshold, resetTimeout, Clock.systemUTC(), CircuitBreakerListener.NOOP);
    }

    public CircuitBreaker(String name,
                          int failureThreshold,
                          Duration resetTimeout,
                          Clock clock,
                          CircuitBreakerListener listener) {
        if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be >= 0");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.listener = listener == null ? CircuitBreakerListener.NOOP : listener;
    }

    /**
     * Admit a call now, or return {@code null} when the breaker refuses it.
     * Refusals are not failures and change no counters.
     */
    public Permit tryAcquire() {
        Permit permit = null;
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return new Permit(generation, false);
                case HALF_OPEN:
                    if (trialInFlight) return null;
                    trialInFlight = true;
                    return new Permit(generation, true);
                default:
                    if (clock.instant().isBefore(openedAt.plus(resetTimeout))) {
                        return null;
                    }
                    moveTo(CircuitBreakerState.HALF_OPEN);
                    trialInFlight = true;
                    permit = new Permit(generation, true);
            }
        } finally {
            lock.unlock();
        }
        if (permit != null) fireTransition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
        return permit;
    }

    private void succeeded(Permit permit) {
        CircuitBreakerState from = null;
        lock.lock();
        try {
            if (permit.generation != generation) return;
            failureCount = 0;
            if (state == CircuitBreakerState.HALF_OPEN) {
                from = state;
                moveTo(CircuitBreakerState.CLOSED);
                trialInFlight = false;
                openedAt = null;
            }
        } finally {
            lock.unlock();
        }
        if (from != null) fireTransition(from, CircuitBreakerState.CLOSED);
    }

    private void failed(Permit permit) {
        CircuitBreakerState from = null;
        lock.lock();
        try {
            if (permit.generation != generation) return;
            failureCount++;
            boolean trip = (state == CircuitBreakerState.CLOSED && failureCount >= failureThreshold)
                    || state == CircuitBreakerState.HALF_OPEN;
            if (trip) {
                from = state;
                moveTo(CircuitBreakerState.OPEN);
                openedAt = clock.instant();
                trialInFlight = false;
            }
        } finally {
            lock.unlock();
        }
        if (from != null) fireTransition(from, CircuitBreakerState.OPEN);
    }

    private void released(Permit permit) {
        lock.lock();
        try {
            if (permit.generation == generation && permit.trial) {
                trialInFlight = false;
            }
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void moveTo(CircuitBreakerState next) {
        state = next;
        generation++;
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Instant getOpenedAt() {
        lock.lock();
        try {
            return openedAt;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    /** One admitted call. Only the first of its outcome methods counts. */
    public final class Permit {
        private final long generation;
        private final boolean trial;
        private final AtomicBoolean ended = new AtomicBoolean();

        private Permit(long generation, boolean trial) {
            this.generation = generation;
            this.trial = trial;
        }

        public void onSuccess() {
            if (ended.compareAndSet(false, true)) succeeded(this);
        }

        public void onFailure() {
            if (ended.compareAndSet(false, true)) failed(this);
        }

        /** End the call without a verdict about the dependency. Frees the half-open trial slot. */
        public void release() {
            if (ended.compareAndSet(false, true)) released(this);
        }

        public boolean isTrial() {
            return trial;
        }
    }

    private void fireTransition(CircuitBreakerState from, CircuitBreakerState to) {
        if (to == CircuitBreakerState.CLOSED) {
            log.info("Circuit breaker '{}' {} -> {}", name, from, to);
        } else {
            log.warn("Circuit breaker '{}' {} -> {}", name, from, to);
        }
        try {
            listener.onStateChange(name, from, to);
        } catch (Exception e) {
            log.warn("Circuit breaker listener failed breaker={} transition={}->{}", name, from, to, e);
        }
    }
}
