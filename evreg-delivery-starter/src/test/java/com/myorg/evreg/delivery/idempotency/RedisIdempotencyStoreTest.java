package com.myorg.evreg.delivery.idempotency;

import com.myorg.evreg.delivery.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisIdempotencyStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ScriptedRedis redis = new ScriptedRedis();
    private final RedisIdempotencyStore store = new RedisIdempotencyStore(
            redis, Duration.ofHours(24), Duration.ofMinutes(5), "evreg:recovery", clock);

    @Test
    void lease_is_stored_as_a_running_hash_under_the_recovery_key() {
        IdempotencyStore.Lease lease = store.tryBeginRecovery("event-7@1714557600000");

        assertThat(lease.isAcquired()).isTrue();
        Map<String, String> mark = redis.hashes.get("evreg:recovery:event-7@1714557600000");
        assertThat(mark).containsEntry("state", "running")
                .containsEntry("owner", lease.token())
                .containsEntry("at", String.valueOf(clock.millis()));
        assertThat(redis.ttls.get("evreg:recovery:event-7@1714557600000")).isEqualTo(Duration.ofMinutes(5).toMillis());
    }

    @Test
    void recovered_key_answers_recovered_and_running_key_answers_in_flight() {
        IdempotencyStore.Lease lease = store.tryBeginRecovery("k");
        assertThat(store.tryBeginRecovery("k").decision()).isEqualTo(IdempotencyStore.Decision.IN_FLIGHT);

        store.markRecovered("k", lease.token());

        assertThat(redis.hashes.get("evreg:recovery:k")).containsEntry("state", "recovered").doesNotContainKey("owner");
        assertThat(redis.ttls.get("evreg:recovery:k")).isEqualTo(Duration.ofHours(24).toMillis());
        assertThat(store.tryBeginRecovery("k").decision()).isEqualTo(IdempotencyStore.Decision.RECOVERED);
    }

    @Test
    void only_the_owner_can_release() {
        IdempotencyStore.Lease lease = store.tryBeginRecovery("k");

        store.releaseRecovery("k", "someone-else");
        assertThat(redis.hashes).containsKey("evreg:recovery:k");

        store.releaseRecovery("k", lease.token());
        assertThat(redis.hashes).doesNotContainKey("evreg:recovery:k");
        assertThat(store.tryBeginRecovery("k").isAcquired()).isTrue();
    }

    @Test
    void missing_script_reply_is_treated_as_in_flight() {
        redis.replyNull = true;

        assertThat(store.tryBeginRecovery("k").decision()).isEqualTo(IdempotencyStore.Decision.IN_FLIGHT);
    }

    @Test
    void rejects_non_positive_ttls() {
        assertThatThrownBy(() -> new RedisIdempotencyStore(redis, Duration.ofHours(1), Duration.ZERO, "p"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("leaseTtl");
    }

    /** Runs the three recovery scripts against in-memory hashes, with the semantics of the Lua bodies. */
    static class ScriptedRedis extends StringRedisTemplate {
        final Map<String, Map<String, String>> hashes = new HashMap<>();
        final Map<String, Long> ttls = new HashMap<>();
        boolean replyNull;

        @Override
        @SuppressWarnings("unchecked")
        public <T> T execute(RedisScript<T> script, List<String> keys, Object... args) {
            if (replyNull) return null;
            String key = keys.get(0);
            Map<String, String> mark = hashes.get(key);
            long reply;
            if (script == RedisIdempotencyStore.BEGIN) {
                if (mark != null) {
                    reply = RedisIdempotencyStore.RECOVERED.equals(mark.get("state")) ? 1L : 2L;
                } else {
                    Map<String, String> running = new HashMap<>();
                    running.put("state", RedisIdempotencyStore.RUNNING);
                    running.put("owner", (String) args[0]);
                    running.put("at", (String) args[2]);
                    hashes.put(key, running);
                    ttls.put(key, Long.parseLong((String) args[1]));
                    reply = 0L;
                }
            } else if (script == RedisIdempotencyStore.MARK_RECOVERED) {
                if (mark == null || !args[0].equals(mark.get("owner"))) {
                    reply = 0L;
                } else {
                    mark.remove("owner");
                    mark.put("state", RedisIdempotencyStore.RECOVERED);
                    mark.put("at", (String) args[2]);
                    ttls.put(key, Long.parseLong((String) args[1]));
                    reply = 1L;
                }
            } else if (script == RedisIdempotencyStore.RELEASE) {
                if (mark == null || !args[0].equals(mark.get("owner"))) {
                    reply = 0L;
                } else {
                    hashes.remove(key);
                    ttls.remove(key);
                    reply = 1L;
                }
            } else {
                throw new IllegalArgumentException("unexpected script");
            }
            return (T) Long.valueOf(reply);
        }
    }
}
