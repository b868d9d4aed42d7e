package com.deltavault.vault;

import com.deltavault.exception.VaultException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-instance lock held for the duration of a mutating vault operation.
 *
 * <p>Callers on different threads queue on the lock and run one at a time. Entry from the
 * thread that already holds it (a nested call, or a collaborator calling back into the
 * vault) fails at once with {@code REENTRANT_CALL} and never waits.
 */
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock();

    // Written and read only by the lock holder
    private String inFlight;

    public <T> T execute(String operation, Supplier<T> body) {
        requireNotReentered(operation);
        lock.lock();
        try {
            inFlight = operation;
            return body.get();
        } finally {
            inFlight = null;
            lock.unlock();
        }
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Fails if the calling thread is inside a guarded operation. Does not take the lock,
     * so a caller on another thread passes while an operation is in flight.
     */
    public void requireNotReentered(String operation) {
        if (lock.isHeldByCurrentThread()) {
            throw VaultException.reentrantCall(operation, String.valueOf(inFlight));
        }
    }

    public boolean isEntered() {
        return lock.isLocked();
    }

    /** Callers currently queued behind the operation in flight. Approximate. */
    public int getQueueLength() {
        return lock.getQueueLength();
    }
}
