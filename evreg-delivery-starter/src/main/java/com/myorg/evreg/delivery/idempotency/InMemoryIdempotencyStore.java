package com.myorg.evreg.delivery.idempotency;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Recovery marks of one reprocessor instance. A mark is either a running lease (with its owner token)
 * or a recovered flag; both expire, and a daemon thread sweeps the expired ones.
 */
@Slf4j
public class InMemoryIdempotencyStore implements IdempotencyStore {

    // owner == null: recovered
    private record Mark(String owner, long expiresAtMs) {
        boolean recovered() {
            return owner == null;
        }
    }

    private final Map<String, Mark> marks = new ConcurrentHashMap<>();

    private final String keyPrefix;
    private final long recoveredTtlMs;
    private final long leaseTtlMs;
    private final int maxEntries;
    private final Clock clock;
    private final ScheduledExecutorService sweeper;

    public InMemoryIdempotencyStore(String keyPrefix,
                                    Duration recoveredTtl,
                                    Duration leaseTtl,
                                    int maxEntries,
                                    Duration cleanupInterval) {
        this(keyPrefix, recoveredTtl, leaseTtl, maxEntries, cleanupInterval, Clock.systemUTC());
    }

    public InMemoryIdempotencyStore(String keyPrefix,
                                    Duration recoveredTtl,
                                    Duration leaseTtl,
                                    int maxEntries,
                                    Duration cleanupInterval,
                                    Clock clock) {
        this.keyPrefix = normalizePrefix(keyPrefix);
        this.recoveredTtlMs = positiveMillis(recoveredTtl, "recoveredTtl");
        this.leaseTtlMs = positiveMillis(leaseTtl, "leaseTtl");
        this.maxEntries = Math.max(1000, maxEntries);
        this.clock = clock;

        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "evreg-idempotency-cleaner");
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1_000L, cleanupInterval == null ? 60_000L : cleanupInterval.toMillis());
        sweeper.scheduleAtFixedRate(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public Lease tryBeginRecovery(String recoveryKey) {
        long now = clock.millis();
        String token = UUID.randomUUID().toString();
        AtomicReference<Lease> result = new AtomicReference<>();

        marks.compute(keyPrefix + recoveryKey, (k, mark) -> {
            if (mark == null || now > mark.expiresAtMs()) {
                result.set(Lease.acquired(token));
                return new Mark(token, now + leaseTtlMs);
            }
            result.set(mark.recovered() ? Lease.recovered() : Lease.inFlight());
            return mark;
        });

        if (result.get().isAcquired() && marks.size() > maxEntries) {
            cleanupExpired();
            evictOverflow();
        }
        return result.get();
    }

    @Override
    public void markRecovered(String recoveryKey, String token) {
        long expiresAt = clock.millis() + recoveredTtlMs;
        Mark updated = marks.computeIfPresent(keyPrefix + recoveryKey,
                (k, mark) -> ownedBy(mark, token) ? new Mark(null, expiresAt) : mark);
        if (updated == null || !updated.recovered()) {
            log.warn("Recovery lease of key={} expired before it was marked recovered; "
                    + "the record may be recovered again", recoveryKey);
        }
    }

    @Override
    public void releaseRecovery(String recoveryKey, String token) {
        marks.computeIfPresent(keyPrefix + recoveryKey, (k, mark) -> ownedBy(mark, token) ? null : mark);
    }

    int size() {
        return marks.size();
    }

    void cleanupExpired() {
        long now = clock.millis();
        marks.values().removeIf(mark -> now > mark.expiresAtMs());
    }

    // xóa mark recovered cũ nhất trước, lease đang chạy thì giữ
    private void evictOverflow() {
        int over = marks.size() - maxEntries;
        if (over <= 0) return;
        marks.entrySet().stream()
                .filter(e -> e.getValue().recovered())
                .sorted(Comparator.comparingLong(e -> e.getValue().expiresAtMs()))
                .limit(over)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(marks::remove);
    }

    private void sweep() {
        try {
            cleanupExpired();
        } catch (Exception e) {
            log.warn("Recovery mark cleanup failed", e);
        }
    }

    private static boolean ownedBy(Mark mark, String token) {
        return !mark.recovered() && mark.owner().equals(token);
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
    }

    private static long positiveMillis(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d.toMillis();
    }

    static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
