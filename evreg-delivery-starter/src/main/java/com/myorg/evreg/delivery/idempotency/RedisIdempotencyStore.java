package com.myorg.evreg.delivery.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Recovery marks shared by every reprocessor instance.
 *
 * <p>One hash per recovery key, {@code <prefix><correlationId>@<firstFailureMillis>}:
 * <pre>
 *   state = running | recovered
 *   owner = lease token (running only)
 *   at    = epoch millis of the last change
 * </pre>
 * A running hash expires after the lease TTL, a recovered one after the recovered TTL. Every transition
 * is one Lua script, so two instances never both acquire the same key.
 */
@Slf4j
public class RedisIdempotencyStore implements IdempotencyStore {

    static final String RUNNING = "running";
    static final String RECOVERED = "recovered";

    // KEYS[1]=mark ARGV: token, leaseTtlMs, nowMs -> 0 acquired, 1 recovered, 2 running elsewhere
    static final DefaultRedisScript<Long> BEGIN = new DefaultRedisScript<>(
            "local state = redis.call('HGET', KEYS[1], 'state') " +
                    "if state == 'recovered' then return 1 end " +
                    "if state then return 2 end " +
                    "redis.call('HSET', KEYS[1], 'state', 'running', 'owner', ARGV[1], 'at', ARGV[3]) " +
                    "redis.call('PEXPIRE', KEYS[1], ARGV[2]) " +
                    "return 0",
            Long.class
    );

    // ARGV: token, recoveredTtlMs, nowMs -> 1 when the caller still owned the lease
    static final DefaultRedisScript<Long> MARK_RECOVERED = new DefaultRedisScript<>(
            "if redis.call('HGET', KEYS[1], 'owner') ~= ARGV[1] then return 0 end " +
                    "redis.call('HDEL', KEYS[1], 'owner') " +
                    "redis.call('HSET', KEYS[1], 'state', 'recovered', 'at', ARGV[3]) " +
                    "redis.call('PEXPIRE', KEYS[1], ARGV[2]) " +
                    "return 1",
            Long.class
    );

    // ARGV: token
    static final DefaultRedisScript<Long> RELEASE = new DefaultRedisScript<>(
            "if redis.call('HGET', KEYS[1], 'owner') ~= ARGV[1] then return 0 end " +
                    "return redis.call('DEL', KEYS[1])",
            Long.class
    );

    private final StringRedisTemplate redis;
    private final Duration recoveredTtl;
    private final Duration leaseTtl;
    private final String keyPrefix;
    private final Clock clock;

    public RedisIdempotencyStore(StringRedisTemplate redis, Duration recoveredTtl, Duration leaseTtl, String keyPrefix) {
        this(redis, recoveredTtl, leaseTtl, keyPrefix, Clock.systemUTC());
    }

    public RedisIdempotencyStore(StringRedisTemplate redis,
                                 Duration recoveredTtl,
                                 Duration leaseTtl,
                                 String keyPrefix,
                                 Clock clock) {
        if (recoveredTtl == null || recoveredTtl.isZero() || recoveredTtl.isNegative()) {
            throw new IllegalArgumentException("recoveredTtl must be positive");
        }
        if (leaseTtl == null || leaseTtl.isZero() || leaseTtl.isNegative()) {
            throw new IllegalArgumentException("leaseTtl must be positive");
        }
        this.redis = redis;
        this.recoveredTtl = recoveredTtl;
        this.leaseTtl = leaseTtl;
        this.keyPrefix = InMemoryIdempotencyStore.normalizePrefix(keyPrefix);
        this.clock = clock;
    }

    @Override
    public Lease tryBeginRecovery(String recoveryKey) {
        String token = UUID.randomUUID().toString();
        Long res = redis.execute(BEGIN, List.of(keyPrefix + recoveryKey),
                token, String.valueOf(leaseTtl.toMillis()), String.valueOf(clock.millis()));

        if (res == null) return Lease.inFlight();
        if (res == 0L) return Lease.acquired(token);
        return res == 1L ? Lease.recovered() : Lease.inFlight();
    }

    @Override
    public void markRecovered(String recoveryKey, String token) {
        Long res = redis.execute(MARK_RECOVERED, List.of(keyPrefix + recoveryKey),
                token, String.valueOf(recoveredTtl.toMillis()), String.valueOf(clock.millis()));
        if (res == null || res == 0L) {
            log.warn("Recovery lease of key={} expired before it was marked recovered; "
                    + "the record may be recovered again", recoveryKey);
        }
    }

    @Override
    public void releaseRecovery(String recoveryKey, String token) {
        redis.execute(RELEASE, List.of(keyPrefix + recoveryKey), token);
    }
}
