package flightcache;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

/**
 * A UTC {@link Clock} that never goes backwards: wall-clock time at creation plus the elapsed
 * {@link System#nanoTime()}.
 *
 * @author Freeman
 */
final class MonotonicClock extends Clock {

    static final MonotonicClock INSTANCE = new MonotonicClock();

    private final long originMillis;
    private final long originNanos;

    private MonotonicClock() {
        this.originMillis = System.currentTimeMillis();
        this.originNanos = System.nanoTime();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    /**
     * Zones other than UTC fall back to the system clock of that zone, which is not monotonic.
     */
    @Override
    public Clock withZone(ZoneId zone) {
        return ZoneOffset.UTC.equals(zone) ? this : Clock.system(zone);
    }

    @Override
    public long millis() {
        return originMillis + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - originNanos);
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis());
    }

    @Override
    public String toString() {
        return "MonotonicClock[origin=" + Instant.ofEpochMilli(originMillis) + "]";
    }
}
