package io.rulekit.core.objects;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts the rule evaluations still outstanding for one key and serializes
 * them.
 *
 * <p>
 * A task calls {@link #lock()} before touching its key and {@link #unlock()}
 * when done, which decrements the count. Because the evaluation lock is held
 * for the whole evaluation, rules on the same key never overlap. A count of
 * zero means the key is settled; {@link #awaitSettled()} blocks until then.
 * The counter is never re-armed during an apply.
 *
 * <p>
 * The count has its own lock so that {@link #release()} and
 * {@link #awaitSettled()} never wait behind a running evaluation.
 */
final class FieldCounter {

    private final String name;
    private final ReentrantLock evaluationLock = new ReentrantLock();
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition settled = stateLock.newCondition();
    private int count;

    FieldCounter(String name) {
        this.name = name;
    }

    void increment() {
        stateLock.lock();
        try {
            count++;
        } finally {
            stateLock.unlock();
        }
    }

    /** Acquires exclusive access to the key. Must be paired with {@link #unlock()}. */
    void lock() {
        evaluationLock.lock();
    }

    /**
     * Decrements the count, wakes waiters when it reaches zero, then releases
     * the evaluation lock.
     *
     * @throws IllegalStateException if the count drops below zero
     */
    void unlock() {
        try {
            decrement();
        } finally {
            evaluationLock.unlock();
        }
    }

    /** Accounts for an evaluation that will never run. Does not take the evaluation lock. */
    void release() {
        decrement();
    }

    private void decrement() {
        stateLock.lock();
        try {
            count--;
            if (count == 0) {
                settled.signalAll();
            } else if (count < 0) {
                throw new IllegalStateException("negative rule counter for key " + name + ": " + count);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /** Blocks until no evaluation is outstanding. */
    void awaitSettled() {
        stateLock.lock();
        try {
            while (count > 0) {
                settled.awaitUninterruptibly();
            }
        } finally {
            stateLock.unlock();
        }
    }

    int count() {
        stateLock.lock();
        try {
            return count;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "FieldCounter[" + name + ", count=" + count() + "]";
    }
}
