package com.myorg.evreg.delivery.idempotency;

import com.myorg.evreg.delivery.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryIdempotencyStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final InMemoryIdempotencyStore store = new InMemoryIdempotencyStore(
            "evreg:recovery", Duration.ofHours(1), Duration.ofMinutes(5), 1000, Duration.ofMinutes(5), clock);

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void recovered_key_is_reported_as_recovered_afterwards() {
        IdempotencyStore.Lease lease = store.tryBeginRecovery("e-1@1");
        assertThat(lease.decision()).isEqualTo(IdempotencyStore.Decision.ACQUIRED);
        assertThat(lease.token()).isNotBlank();

        assertThat(store.tryBeginRecovery("e-1@1").decision()).isEqualTo(IdempotencyStore.Decision.IN_FLIGHT);

        store.markRecovered("e-1@1", lease.token());
        assertThat(store.tryBeginRecovery("e-1@1").decision()).isEqualTo(IdempotencyStore.Decision.RECOVERED);
    }

    @Test
    void released_lease_can_be_taken_again() {
        IdempotencyStore.Lease lease = store.tryBeginRecovery("k");
        store.releaseRecovery("k", lease.token());

        assertThat(store.tryBeginRecovery("k").decision()).isEqualTo(IdempotencyStore.Decision.ACQUIRED);
    }

    @Test
    void stale_token_cannot_complete_or_release_someone_elses_lease() {
        IdempotencyStore.Lease old = store.tryBeginRecovery("k");
        clock.advance(Duration.ofMinutes(6));
        IdempotencyStore.Lease current = store.tryBeginRecovery("k");
        assertThat(current.decision()).isEqualTo(IdempotencyStore.Decision.ACQUIRED);

        store.markRecovered("k", old.token());
        store.releaseRecovery("k", old.token());

        assertThat(store.tryBeginRecovery("k").decision()).isEqualTo(IdempotencyStore.Decision.IN_FLIGHT);
    }

    @Test
    void recovered_mark_expires_after_its_ttl() {
        IdempotencyStore.Lease lease = store.tryBeginRecovery("k");
        store.markRecovered("k", lease.token());

        clock.advance(Duration.ofHours(2));
        store.cleanupExpired();

        assertThat(store.size()).isZero();
        assertThat(store.tryBeginRecovery("k").decision()).isEqualTo(IdempotencyStore.Decision.ACQUIRED);
    }

    @Test
    void rejects_non_positive_ttls() {
        assertThatThrownBy(() -> new InMemoryIdempotencyStore("p", Duration.ZERO, Duration.ofMinutes(1), 1000, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("recoveredTtl");
    }

    @Test
    void overflow_evicts_recovered_marks_but_keeps_running_leases() {
        for (int i = 0; i < 1000; i++) {
            IdempotencyStore.Lease lease = store.tryBeginRecovery("done-" + i);
            store.markRecovered("done-" + i, lease.token());
        }
        store.tryBeginRecovery("running");

        assertThat(store.size()).isEqualTo(1000);
        assertThat(store.tryBeginRecovery("running").decision()).isEqualTo(IdempotencyStore.Decision.IN_FLIGHT);
    }
}
