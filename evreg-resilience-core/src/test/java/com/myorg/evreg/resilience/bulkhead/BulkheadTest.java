package com.myorg.evreg.resilience.bulkhead;

import com.myorg.evreg.contracts.core.exception.DeliveryCancelledException;
import com.myorg.evreg.contracts.core.exception.ResourceExhaustedException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkheadTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void admitsUpToMaxConcurrentWithoutWaiting() {
        Bulkhead bulkhead = new Bulkhead("kafka", 3, 0);

        Bulkhead.Permit a = bulkhead.acquire();
        Bulkhead.Permit b = bulkhead.acquire();
        Bulkhead.Permit c = bulkhead.acquire();

        assertThat(bulkhead.getInFlight()).isEqualTo(3);
        assertThatThrownBy(bulkhead::acquire).isInstanceOf(ResourceExhaustedException.class);

        a.close();
        b.close();
        c.close();
        assertThat(bulkhead.getInFlight()).isZero();
    }

    @Test
    void waiterBeyondMaxQueueIsRejectedImmediately() throws Exception {
        Bulkhead bulkhead = new Bulkhead("kafka", 1, 2);
        Bulkhead.Permit held = bulkhead.acquire();

        List<CompletableFuture<Void>> waiters = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            waiters.add(CompletableFuture.runAsync(() -> bulkhead.acquire().close(), pool));
        }
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> bulkhead.getWaiting() == 2);

        long start = System.nanoTime();
        assertThatThrownBy(bulkhead::acquire).isInstanceOf(ResourceExhaustedException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
        assertThat(bulkhead.getWaiting()).isEqualTo(2);

        held.close();
        CompletableFuture.allOf(waiters.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        assertThat(bulkhead.getInFlight()).isZero();
        assertThat(bulkhead.getWaiting()).isZero();
    }

    @Test
    void neverRunsMoreThanMaxConcurrentAtOnce() throws Exception {
        Bulkhead bulkhead = new Bulkhead("kafka", 2, 100);
        AtomicBoolean exceeded = new AtomicBoolean();

        List<CompletableFuture<Void>> calls = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            calls.add(CompletableFuture.runAsync(() -> {
                try (Bulkhead.Permit ignored = bulkhead.acquire()) {
                    if (bulkhead.getInFlight() > 2) exceeded.set(true);
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, pool));
        }
        CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(exceeded).isFalse();
        assertThat(bulkhead.getInFlight()).isZero();
    }

    @Test
    void waitLongerThanMaxWaitIsCancelled() {
        Bulkhead bulkhead = new Bulkhead("kafka", 1, 1);
        Bulkhead.Permit held = bulkhead.acquire();

        assertThatThrownBy(() -> bulkhead.acquire(Duration.ofMillis(50)))
                .isInstanceOf(DeliveryCancelledException.class);
        assertThat(bulkhead.getWaiting()).isZero();
        held.close();
    }

    @Test
    void interruptedWaiterIsCancelledAndKeepsInterruptFlag() throws Exception {
        Bulkhead bulkhead = new Bulkhead("kafka", 1, 1);
        Bulkhead.Permit held = bulkhead.acquire();

        CompletableFuture<Boolean> flagAfterCancel = new CompletableFuture<>();
        Thread waiter = new Thread(() -> {
            try {
                bulkhead.acquire();
                flagAfterCancel.complete(false);
            } catch (DeliveryCancelledException e) {
                flagAfterCancel.complete(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> bulkhead.getWaiting() == 1);

        waiter.interrupt();

        assertThat(flagAfterCancel.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(bulkhead.getWaiting()).isZero();
        assertThat(bulkhead.getInFlight()).isEqualTo(1);
        held.close();
    }

    @Test
    void releasingAPermitTwiceFreesOnlyOneSlot() {
        Bulkhead bulkhead = new Bulkhead("kafka", 2, 0);
        Bulkhead.Permit first = bulkhead.acquire();
        Bulkhead.Permit second = bulkhead.acquire();

        first.release();
        first.close();

        assertThat(bulkhead.getInFlight()).isEqualTo(1);
        second.close();
        assertThat(bulkhead.getInFlight()).isZero();
    }
}
