package flightcache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the last completed {@link Outcome} per key together with the time it was created.
 *
 * <p>Expiry is lazy: an entry older than the TTL is reported as a miss when read, it is not removed
 * until it is overwritten, invalidated or swept by {@link #removeExpired(long)}.
 *
 * <p>Backed by a {@link ConcurrentHashMap}, so operations on one key are atomic and different keys
 * do not contend on a single lock.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author Freeman
 */
@Slf4j
final class ExpiringStore<K, V> {

    private final long ttlMillis;
    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();

    ExpiringStore(Duration ttl) {
        this.ttlMillis = toMillisSaturated(ttl);
    }

    /**
     * Clamps durations too long for a {@code long} of millis to {@link Long#MAX_VALUE}, i.e. never expire.
     */
    static long toMillisSaturated(Duration duration) {
        try {
            return duration.toMillis();
        } catch (ArithmeticException ignored) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    /**
     * @param key the key to look up
     * @param now current time in epoch millis
     * @return the stored outcome if it is still fresh at {@code now}
     */
    Optional<Outcome<V>> get(K key, long now) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isFresh(now, ttlMillis)) {
            log.trace("Entry for key '{}' expired, created at {}", key, entry.createdAt());
            return Optional.empty();
        }
        return Optional.of(entry.outcome());
    }

    void put(K key, Outcome<V> outcome, long now) {
        entries.put(key, new Entry<>(outcome, now));
    }

    boolean remove(K key) {
        return entries.remove(key) != null;
    }

    void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    /**
     * Drops every entry that is stale at {@code now}.
     *
     * @return the number of entries removed
     */
    int removeExpired(long now) {
        int removed = 0;
        for (Map.Entry<K, Entry<V>> e : entries.entrySet()) {
            // remove(key, value) keeps an entry that was refreshed after it was read
            if (!e.getValue().isFresh(now, ttlMillis) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    record Entry<V>(Outcome<V> outcome, long createdAt) {

        boolean isFresh(long now, long ttlMillis) {
            return now - createdAt < ttlMillis;
        }
    }
}
