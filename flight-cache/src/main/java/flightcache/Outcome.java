package flightcache;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.SneakyThrows;
import lombok.ToString;

/**
 * The result of one execution of a cached operation: either a value or the throwable the operation raised.
 *
 * <p>An {@code Outcome} is produced once by the leader of a flight and handed, as the very same instance,
 * to the leader's caller, to every follower of that flight, and to later callers that hit the cache.
 *
 * @param <V> the type of the value
 * @author Freeman
 * @since 0.1.0
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Outcome<V> {
    /**
     * One of value or failure will be set, a successful outcome may still carry a {@code null} value.
     */
    private final V value;
    /**
     * Non-null only for a failed outcome.
     */
    private final Throwable failure;

    public static <V> Outcome<V> success(V value) {
        return new Outcome<>(value, null);
    }

    public static <V> Outcome<V> failure(Throwable failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new Outcome<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * Returns the value, or rethrows the original failure as is.
     *
     * <p>Checked throwables are rethrown without being declared or wrapped, so a caller observes exactly
     * what the operation itself threw.
     *
     * @return the value of a successful outcome, possibly {@code null}
     */
    @SneakyThrows
    public V get() {
        if (failure != null) {
            throw failure;
        }
        return value;
    }
}
