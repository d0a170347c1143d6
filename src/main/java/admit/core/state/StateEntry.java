package admit.core.state;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry holding one key's state with its associated lock.
 *
 * Thread-safety:
 * - The lock must be held to replace the state
 * - state and lastAccessMillis are volatile so the idle sweep and
 *   diagnostics can read them without the lock
 * - An entry is retired under its lock before it leaves the map. A caller
 *   that locks a retired entry must look the key up again
 */
final class StateEntry<S> {

    private final ReentrantLock lock;
    private volatile S state;
    private volatile long lastAccessMillis;
    private volatile boolean retired;

    StateEntry(long createdMillis) {
        this.lock = new ReentrantLock(); // Non-fair for better throughput
        this.lastAccessMillis = createdMillis;
    }

    ReentrantLock getLock() {
        return lock;
    }

    /**
     * MUST be called while holding the lock when the result feeds a write.
     */
    S getState() {
        return state;
    }

    void update(S newState, long nowMillis) {
        this.state = newState;
        if (nowMillis > lastAccessMillis) {
            this.lastAccessMillis = nowMillis;
        }
    }

    boolean isRetired() {
        return retired;
    }

    /**
     * Retires the entry if its lock is free. Never blocks, and refuses when
     * the calling thread already holds the lock.
     *
     * @return true if the entry is now retired and may be removed
     */
    boolean tryRetire() {
        return tryRetireIf(true);
    }

    /**
     * Like {@link #tryRetire()}, but only once the entry has been untouched
     * for strictly longer than idleTtlMillis.
     */
    boolean tryRetireIfIdle(long nowMillis, long idleTtlMillis) {
        return tryRetireIf(nowMillis - lastAccessMillis > idleTtlMillis);
    }

    /**
     * Retires unconditionally, without the lock. A compute still running on the
     * entry finishes against state nobody will read again.
     */
    void retire() {
        this.retired = true;
    }

    private boolean tryRetireIf(boolean condition) {
        if (!condition || lock.isHeldByCurrentThread() || !lock.tryLock()) {
            return false;
        }
        try {
            retired = true;
            return true;
        } finally {
            lock.unlock();
        }
    }
}
