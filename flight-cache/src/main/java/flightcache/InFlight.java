package flightcache;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An execution in progress for one key, shared by its leader and all followers.
 *
 * <p>The completion flag and the outcome slot are only touched while holding {@link #lock}, so a follower
 * that attaches after {@link #complete(Outcome)} sees the outcome immediately and one that attaches before
 * is woken by the same signal.
 *
 * @author Freeman
 */
final class InFlight<V> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition done = lock.newCondition();

    private boolean completed;
    private Outcome<V> outcome;

    void complete(Outcome<V> result) {
        lock.lock();
        try {
            if (completed) {
                throw new IllegalStateException("Flight already completed");
            }
            outcome = result;
            completed = true;
            done.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the leader completes this flight.
     *
     * <p>The wait is uninterruptible, a follower only returns once its leader has published.
     * If the calling thread was interrupted while waiting, its interrupt status is left set.
     */
    Outcome<V> await() {
        lock.lock();
        try {
            while (!completed) {
                done.awaitUninterruptibly();
            }
            if (outcome == null) {
                throw new IllegalStateException("Flight completed without an outcome");
            }
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    boolean isCompleted() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }
}
