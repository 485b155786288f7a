package flightcache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ExpiringStoreTest {

    private final ExpiringStore<String, String> store = new ExpiringStore<>(Duration.ofMillis(100));

    @Test
    void missingKeyShouldBeAMiss() {
        assertThat(store.get("absent", 0)).isEmpty();
    }

    @Test
    void entryShouldBeFreshStrictlyBeforeTtl() {
        Outcome<String> outcome = Outcome.success("value");
        store.put("key", outcome, 1_000);

        assertThat(store.get("key", 1_000)).containsSame(outcome);
        assertThat(store.get("key", 1_099)).containsSame(outcome);
        assertThat(store.get("key", 1_100)).isEmpty(); // now - createdAt == TTL is stale
        assertThat(store.get("key", 5_000)).isEmpty();
    }

    @Test
    void staleEntryShouldStayStoredUntilSwept() {
        store.put("key", Outcome.success("value"), 0);

        assertThat(store.get("key", 200)).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void putShouldOverwriteAndResetCreationTime() {
        Outcome<String> first = Outcome.success("first");
        Outcome<String> second = Outcome.success("second");

        store.put("key", first, 0);
        store.put("key", second, 90);

        assertThat(store.get("key", 150)).containsSame(second);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void removeExpiredShouldOnlyDropStaleEntries() {
        store.put("old-1", Outcome.success("a"), 0);
        store.put("old-2", Outcome.failure(new IllegalStateException("boom")), 10);
        store.put("fresh", Outcome.success("c"), 150);

        int removed = store.removeExpired(200);

        assertThat(removed).isEqualTo(2);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("fresh", 200)).isPresent();
    }

    @Test
    void removeAndClear() {
        store.put("a", Outcome.success("a"), 0);
        store.put("b", Outcome.success("b"), 0);

        assertThat(store.remove("a")).isTrue();
        assertThat(store.remove("a")).isFalse();
        assertThat(store.get("a", 0)).isEmpty();

        store.clear();
        assertThat(store.size()).isZero();
    }
}
