package flightcache;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of in-progress executions, one {@link InFlight} per key at most.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │                       Flight Registration                    │
 * ├──────────────────────────────────────────────────────────────┤
 * │                                                              │
 * │  Thread 1 ──┐                                                │
 * │  Thread 2 ──┼─► ConcurrentHashMap.computeIfAbsent(key, ...)  │
 * │  Thread 3 ──┘              │                                 │
 * │                            ▼                                 │
 * │      ┌──────────────────────────────────────────────────┐    │
 * │      │ Winner: Leader, runs the operation               │    │
 * │      │ Others: Follower, wait on the winner's flight    │    │
 * │      └──────────────────────────────────────────────────┘    │
 * │                            │                                 │
 * │                            ▼                                 │
 * │      ┌──────────────────────────────────────────────────┐    │
 * │      │ Leader.finish: record, wake, publish, deregister │    │
 * │      └──────────────────────────────────────────────────┘    │
 * └──────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author Freeman
 */
@Slf4j
final class Coordinator<K, V> {

    private final ConcurrentMap<K, InFlight<V>> flights = new ConcurrentHashMap<>();

    /**
     * Registers a new flight for {@code key} or joins the one already registered.
     *
     * @param key the key, must not be {@code null}
     * @return a {@link Leader} if this caller registered the flight, otherwise a {@link Follower}
     */
    Claim<K, V> tryStart(K key) {
        InFlight<V> existing = flights.get(key);
        if (existing == null) {
            boolean[] created = new boolean[1];
            existing = flights.computeIfAbsent(key, k -> {
                created[0] = true;
                return new InFlight<>();
            });
            if (created[0]) {
                log.debug("Leader elected for key '{}'", key);
                return new Leader<>(key, existing, flights);
            }
        }
        log.debug("Following in-flight execution for key '{}'", key);
        return new Follower<>(existing);
    }

    int inFlightCount() {
        return flights.size();
    }

    /**
     * The role granted by {@link #tryStart(Object)}.
     */
    abstract static class Claim<K, V> {

        final InFlight<V> flight;

        Claim(InFlight<V> flight) {
            this.flight = flight;
        }
    }

    static final class Leader<K, V> extends Claim<K, V> {

        private final K key;
        private final ConcurrentMap<K, InFlight<V>> flights;
        private boolean finished;

        private Leader(K key, InFlight<V> flight, ConcurrentMap<K, InFlight<V>> flights) {
            super(flight);
            this.key = key;
            this.flights = flights;
        }

        /**
         * Completes the flight: records {@code outcome} and wakes every follower, runs {@code publish},
         * then removes the flight from the registry.
         *
         * <p>{@code publish} runs while the flight is still registered, so a caller that misses the store
         * before the entry lands joins this flight instead of starting another execution.
         *
         * @param outcome the outcome of the execution
         * @param publish makes the outcome visible to later lookups, may be a no-op
         */
        void finish(Outcome<V> outcome, Runnable publish) {
            if (finished) {
                throw new IllegalStateException("Leader for key '" + key + "' already finished");
            }
            finished = true;
            try {
                flight.complete(outcome);
                publish.run();
            } finally {
                flights.remove(key, flight);
            }
        }
    }

    static final class Follower<K, V> extends Claim<K, V> {

        private Follower(InFlight<V> flight) {
            super(flight);
        }

        Outcome<V> awaitResult() {
            return flight.await();
        }
    }
}
