package com.myorg.evreg.resilience.bulkhead;

import com.myorg.evreg.contracts.core.exception.DeliveryCancelledException;
import com.myorg.evreg.contracts.core.exception.ResourceExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds the number of concurrently executing calls and the number of callers waiting for a slot.
 *
 * <p>A caller that finds every slot taken and the waiting queue full is rejected at once with
 * {@link ResourceExhaustedException}. Work is never dropped silently and the queue never grows past
 * {@code maxQueue}.
 *
 * <pre>{@code
 * try (Bulkhead.Permit permit = bulkhead.acquire()) {
 *     return broker.send(...);
 * }
 * }</pre>
 */
@Slf4j
public class Bulkhead {

    private final String name;
    private final int maxConcurrent;
    private final int maxQueue;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();

    // guarded by lock
    private int inFlight;
    private int waiting;

    public Bulkhead(String name, int maxConcurrent, int maxQueue) {
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be >= 1");
        if (maxQueue < 0) throw new IllegalArgumentException("maxQueue must be >= 0");
        this.name = name;
        this.maxConcurrent = maxConcurrent;
        this.maxQueue = maxQueue;
    }

    /** Wait for a slot without a time limit. */
    public Permit acquire() {
        return acquire(null);
    }

    /**
     * Wait for a slot for at most {@code maxWait} ({@code null} = no limit).
     *
     * @throws ResourceExhaustedException when no slot is free and the waiting queue is full
     * @throws DeliveryCancelledException when {@code maxWait} elapses or the thread is interrupted
     */
    public Permit acquire(Duration maxWait) {
        lock.lock();
        try {
            if (inFlight < maxConcurrent) {
                inFlight++;
                return new Permit();
            }
            if (waiting >= maxQueue) {
                log.warn("Bulkhead '{}' rejected call: inFlight={} waiting={}", name, inFlight, waiting);
                throw new ResourceExhaustedException(name, maxConcurrent, maxQueue);
            }

            waiting++;
            try {
                long remainingNanos = maxWait == null ? Long.MAX_VALUE : Math.max(0L, maxWait.toNanos());
                while (inFlight >= maxConcurrent) {
                    if (maxWait == null) {
                        slotFreed.await();
                    } else {
                        if (remainingNanos <= 0L) {
                            throw new DeliveryCancelledException(
                                    "Bulkhead '" + name + "' wait exceeded " + maxWait.toMillis() + "ms");
                        }
                        remainingNanos = slotFreed.awaitNanos(remainingNanos);
                    }
                }
                inFlight++;
                return new Permit();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new DeliveryCancelledException("Interrupted while waiting for bulkhead '" + name + "'", ie);
            } finally {
                waiting--;
            }
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        lock.lock();
        try {
            if (inFlight > 0) inFlight--;
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getMaxQueue() {
        return maxQueue;
    }

    public int getInFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    public int getWaiting() {
        lock.lock();
        try {
            return waiting;
        } finally {
            lock.unlock();
        }
    }

    /** A held slot. Closing it more than once has no further effect. */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                Bulkhead.this.release();
            }
        }

        @Override
        public void close() {
            release();
        }
    }
}
