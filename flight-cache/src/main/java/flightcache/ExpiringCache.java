package flightcache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * A thread-safe memoization cache with a fixed time-to-live that also collapses concurrent duplicate
 * executions of an expensive operation. While a result for a key is fresh it is returned without running
 * anything; on a miss exactly one caller runs the operation and every concurrent caller for the same key
 * waits for and shares that caller's result.
 *
 * <h2>Usage Examples</h2>
 *
 * <pre>{@code
 * // Entries stay fresh for five seconds
 * ExpiringCache<String, User> users = new ExpiringCache<>(Duration.ofSeconds(5));
 *
 * User user = users.call("user:" + userId, () -> {
 *     return database.findUserById(userId);
 * });
 *
 * // Custom options, failures are replayed until they expire
 * ExpiringCache<String, Quote> quotes = new ExpiringCache<>(
 *     ExpiringCache.Options.builder()
 *         .timeout(Duration.ofMillis(500))
 *         .cacheException(true)
 *         .build()
 * );
 * }</pre>
 *
 * <h2>When to Use</h2>
 * <ul>
 *   <li>Expensive or rate-limited calls whose result may be reused for a while</li>
 *   <li>Hot keys that would otherwise cause a cache stampede on expiry</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>No size bound: entries are only dropped when overwritten, invalidated or swept by {@link #cleanUp()}</li>
 *   <li>Followers wait without a timeout; an operation that never returns stalls every caller of its key</li>
 * </ul>
 *
 * <h2>Implementation Details</h2>
 * <pre>
 * ┌─────────────────────────────────────────────────────────────┐
 * │                      Cached Call Flow                       │
 * ├─────────────────────────────────────────────────────────────┤
 * │                                                             │
 * │  call(key) ──► ExpiringStore.get() ── fresh ──► return      │
 * │                       │                                     │
 * │                      miss                                   │
 * │                       ▼                                     │
 * │              Coordinator.tryStart()                         │
 * │                 │              │                            │
 * │              Leader         Follower                        │
 * │                 │              │                            │
 * │        run operation     await leader's outcome             │
 * │                 │              │                            │
 * │   finish: wake followers,      │                            │
 * │   store outcome, deregister    │                            │
 * │                 │              │                            │
 * │                 └──── same Outcome ────► return / rethrow   │
 * └─────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * @param <K> the type of the key identifying one logical call.
 *            Keys must implement {@link Object#equals(Object)} and {@link Object#hashCode()} correctly.
 * @param <V> the type of the value returned by the operation, {@code null} is allowed.
 * @author Freeman
 * @since 0.1.0
 */
@Slf4j
public final class ExpiringCache<K, V> {

    private final Options options;
    private final Clock clock;
    private final ExpiringStore<K, V> store;
    private final Coordinator<K, V> coordinator = new Coordinator<>();

    /**
     * Creates a cache whose entries stay fresh for {@code timeout}.
     *
     * @param timeout the time-to-live of every entry, must be positive
     * @throws IllegalArgumentException if {@code timeout} is {@code null} or not positive
     */
    public ExpiringCache(Duration timeout) {
        this(Options.builder().timeout(timeout).build());
    }

    /**
     * Creates a cache whose entries stay fresh for {@code timeoutMillis} milliseconds.
     *
     * @param timeoutMillis the time-to-live of every entry in milliseconds, must be positive
     * @throws IllegalArgumentException if {@code timeoutMillis} is not positive
     */
    public ExpiringCache(long timeoutMillis) {
        this(Duration.ofMillis(timeoutMillis));
    }

    /**
     * Creates a cache with the specified options.
     *
     * @param options the options to use for this instance
     */
    public ExpiringCache(Options options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.clock = options.getClock();
        this.store = new ExpiringStore<>(options.getTimeout());
    }

    /**
     * Returns the cached value for {@code key} or runs {@code operation} to produce it, ensuring that
     * concurrent calls with the same key run the operation only once.
     *
     * <p>If the operation fails, the original throwable is rethrown unchanged to this caller and to every
     * concurrent caller of the same key. Checked throwables are rethrown as is, not wrapped.
     *
     * <h3>Usage Examples</h3>
     * <pre>{@code
     * ExpiringCache<String, Integer> cache = new ExpiringCache<>(5000);
     * int price = cache.call("price:" + sku, () -> pricing.lookup(sku));
     * }</pre>
     *
     * @param key       the unique identifier for this call. Must not be {@code null}.
     * @param operation the operation to run on a miss. Must not be {@code null}.
     * @return the value, possibly {@code null} if the operation returned {@code null}
     * @throws IllegalArgumentException if {@code key} or {@code operation} is {@code null}
     * @see #execute(Object, Supplier)
     */
    public V call(K key, Supplier<? extends V> operation) {
        return execute(key, operation).get();
    }

    /**
     * Same as {@link #call(Object, Supplier)} but hands back the {@link Outcome} instead of unwrapping it.
     *
     * @param key       the unique identifier for this call. Must not be {@code null}.
     * @param operation the operation to run on a miss. Must not be {@code null}.
     * @return the outcome shared by every caller of this key within the current freshness window
     * @throws IllegalArgumentException if {@code key} or {@code operation} is {@code null}
     */
    public Outcome<V> execute(K key, Supplier<? extends V> operation) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }

        // 1) Fresh entry: no execution, no coordination
        Optional<Outcome<V>> cached = store.get(key, clock.millis());
        if (cached.isPresent()) {
            log.debug("Cache hit for key '{}'", key);
            return cached.get();
        }

        // 2) Miss: become the leader or follow the running execution
        Coordinator.Claim<K, V> claim = coordinator.tryStart(key);
        if (claim instanceof Coordinator.Follower<K, V> follower) {
            return follower.awaitResult();
        }
        if (claim instanceof Coordinator.Leader<K, V> leader) {
            return lead(key, operation, leader);
        }
        throw new IllegalStateException("Unknown claim type: " + claim.getClass().getName());
    }

    private Outcome<V> lead(K key, Supplier<? extends V> operation, Coordinator.Leader<K, V> leader) {
        // A previous leader may have published and deregistered between our miss and our claim
        Optional<Outcome<V>> published = store.get(key, clock.millis());
        if (published.isPresent()) {
            log.debug("Entry for key '{}' published before leadership was granted", key);
            Outcome<V> existing = published.get();
            leader.finish(existing, () -> {});
            return existing;
        }

        Outcome<V> outcome;
        try {
            outcome = Outcome.success(operation.get());
        } catch (Throwable e) {
            outcome = Outcome.failure(e);
        }

        // 3) Wake followers, then publish while the flight is still registered
        Outcome<V> result = outcome;
        leader.finish(result, () -> {
            if (result.isSuccess() || options.isCacheException()) {
                store.put(key, result, clock.millis());
                log.debug("Stored {} outcome for key '{}'", result.isSuccess() ? "successful" : "failed", key);
            } else {
                log.debug("Failed outcome for key '{}' not stored", key);
            }
        });
        return result;
    }

    /**
     * Discards the cached entry for {@code key}, if any. An execution already in flight is not affected
     * and will store its outcome when it completes.
     *
     * @param key the key to discard. Must not be {@code null}.
     * @return {@code true} if an entry was removed
     */
    public boolean invalidate(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        boolean removed = store.remove(key);
        if (removed) {
            log.debug("Invalidated key '{}'", key);
        }
        return removed;
    }

    /**
     * Discards every cached entry.
     */
    public void invalidateAll() {
        store.clear();
        log.debug("Invalidated all keys");
    }

    /**
     * Removes entries that are no longer fresh. Stale entries are never returned anyway, so calling this
     * only reclaims memory.
     *
     * @return the number of entries removed
     */
    public int cleanUp() {
        int removed = store.removeExpired(clock.millis());
        if (removed > 0) {
            log.debug("Removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * @return the number of stored entries, stale ones included until they are read over or swept
     */
    public int size() {
        return store.size();
    }

    int inFlightCount() {
        return coordinator.inFlightCount();
    }

    public Options getOptions() {
        return options;
    }

    /**
     * Configuration options for ExpiringCache behavior.
     *
     * @since 0.1.0
     */
    public static final class Options {

        /**
         * Time-to-live of every entry. Required, must be positive.
         */
        private final Duration timeout;

        /**
         * Whether to cache exceptions.
         *
         * <p> If {@code true}, a failure thrown by the operation is stored like a value and subsequent calls
         * with the same key rethrow the very same throwable until it expires.
         *
         * <p> If {@code false}, the next call after a failure runs the operation again.
         *
         * <p>Default is {@code false}.
         */
        private final boolean cacheException;

        /**
         * Time source for entry creation and freshness checks.
         *
         * <p>Default is a monotonic clock anchored at the wall-clock time it was created, so a wall clock
         * stepping backwards cannot keep entries fresh past their TTL. A custom clock that can step
         * backwards extends the lifetime of entries by the size of the step.
         */
        private final Clock clock;

        Options(OptionsBuilder builder) {
            this.timeout = builder.timeout;
            this.cacheException = builder.cacheException;
            this.clock = builder.clock;
        }

        public static OptionsBuilder builder() {
            return new OptionsBuilder();
        }

        public Duration getTimeout() {
            return this.timeout;
        }

        public boolean isCacheException() {
            return this.cacheException;
        }

        public Clock getClock() {
            return this.clock;
        }

        public OptionsBuilder toBuilder() {
            return new OptionsBuilder()
                    .timeout(this.timeout)
                    .cacheException(this.cacheException)
                    .clock(this.clock);
        }

        public String toString() {
            return "ExpiringCache.Options(timeout=" + this.timeout + ", cacheException=" + this.cacheException
                    + ", clock=" + this.clock + ")";
        }

        public static class OptionsBuilder {
            private static final Duration ONE_MILLI = Duration.ofMillis(1);

            private Duration timeout;
            private boolean cacheException;
            private Clock clock = MonotonicClock.INSTANCE;

            OptionsBuilder() {}

            public OptionsBuilder timeout(Duration timeout) {
                this.timeout = timeout;
                return this;
            }

            public OptionsBuilder timeoutMillis(long timeoutMillis) {
                return timeout(Duration.ofMillis(timeoutMillis));
            }

            public OptionsBuilder cacheException(boolean cacheException) {
                this.cacheException = cacheException;
                return this;
            }

            public OptionsBuilder clock(Clock clock) {
                this.clock = clock;
                return this;
            }

            /**
             * @throws IllegalArgumentException if the timeout is missing or not positive, or the clock is {@code null}
             */
            public Options build() {
                if (timeout == null) {
                    throw new IllegalArgumentException("timeout must not be null");
                }
                if (timeout.isNegative() || timeout.isZero()) {
                    throw new IllegalArgumentException("timeout must be positive, was " + timeout);
                }
                if (timeout.compareTo(ONE_MILLI) < 0) {
                    throw new IllegalArgumentException("timeout must be at least 1ms, was " + timeout);
                }
                if (clock == null) {
                    throw new IllegalArgumentException("clock must not be null");
                }
                return new Options(this);
            }

            public String toString() {
                return "ExpiringCache.Options.OptionsBuilder(timeout=" + this.timeout + ", cacheException="
                        + this.cacheException + ", clock=" + this.clock + ")";
            }
        }
    }
}
