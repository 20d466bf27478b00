package com.myorg.evreg.delivery.idempotency;

/**
 * Remembers which dead letters were already recovered, so a record replayed after a crash
 * (or read by two reprocessor instances) does not run its recovery handler twice.
 *
 * <p>Keys are recovery keys, {@code <correlationId>@<firstFailureTime millis>}: every reroute of the same
 * dead letter maps to the same key. Stores shared between instances must implement
 * {@link #tryBeginRecovery(String)} atomically.
 */
public interface IdempotencyStore extends AutoCloseable {

    enum Decision {
        /** The caller owns the recovery of this key until it marks it recovered or releases it. */
        ACQUIRED,
        RECOVERED,
        /** Another reprocessor is recovering it right now. */
        IN_FLIGHT
    }

    /**
     * The token identifies the owner: {@link #markRecovered} and {@link #releaseRecovery} ignore a token
     * whose lease has expired and been handed to someone else.
     */
    record Lease(Decision decision, String token) {
        public static Lease acquired(String token) { return new Lease(Decision.ACQUIRED, token); }
        public static Lease recovered() { return new Lease(Decision.RECOVERED, null); }
        public static Lease inFlight() { return new Lease(Decision.IN_FLIGHT, null); }

        public boolean isAcquired() {
            return decision == Decision.ACQUIRED;
        }
    }

    Lease tryBeginRecovery(String recoveryKey);

    void markRecovered(String recoveryKey, String token);

    /** Give the lease back after a failed recovery so the rerouted record can be tried again. */
    void releaseRecovery(String recoveryKey, String token);

    @Override
    default void close() {
    }
}
