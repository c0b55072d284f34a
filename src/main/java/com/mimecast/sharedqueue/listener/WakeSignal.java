package com.mimecast.sharedqueue.listener;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single value "messages may be available" notification.
 * <p>Producers call {@link #signal()} after enqueuing, the poll loop waits on {@link #await(Duration)}
 * <br>instead of sleeping so a new message is picked up without waiting out the backoff.
 * <p>Signals raised while nobody waits are kept, repeated signals coalesce into one.
 */
public class WakeSignal {

    private final Lock lock = new ReentrantLock();
    private final Condition signalled = lock.newCondition();
    private boolean pending = false;

    /**
     * Raise the signal.
     */
    public void signal() {
        lock.lock();
        try {
            pending = true;
            signalled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the signal, consuming it.
     *
     * @param timeout Maximum wait.
     * @return true if signalled, false if the timeout elapsed.
     * @throws InterruptedException Waiting thread interrupted.
     */
    public boolean await(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (!pending) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = signalled.awaitNanos(remaining);
            }
            pending = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check for a pending signal without consuming it.
     *
     * @return true if signalled.
     */
    public boolean isPending() {
        lock.lock();
        try {
            return pending;
        } finally {
            lock.unlock();
        }
    }
}
