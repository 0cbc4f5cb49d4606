package org.yafcp.queue;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO work queue with task accounting and cooperative cancellation.
 * <p>
 * Each {@link #enqueue(Object)} raises the outstanding count by one and each {@link #markDone()} lowers it by one.
 * The queue is drained when the outstanding count is zero, which means every item has been dequeued
 * <em>and</em> reported complete. {@link #awaitDrained()} waits for that state, not for the buffer to empty.
 * <p>
 * Invariants:
 * <ul>
 *     <li>no lost items, no duplicate items: each enqueued item is returned by exactly one {@link #dequeue()}</li>
 *     <li>0 &lt;= outstanding &lt;= enqueued</li>
 *     <li>after {@link #cancel()} no consumer stays blocked in {@link #dequeue()}</li>
 * </ul>
 *
 * @param <T> item type, nulls are rejected
 */
public class WorkQueue<T> {

    private final Queue<T> pending = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition drained = lock.newCondition();

    private long outstanding = 0;
    private long enqueuedCount = 0;
    private long completedCount = 0;
    private boolean cancelled = false;

    /**
     * Appends an item and counts it as outstanding.
     *
     * @throws IllegalArgumentException if {@code item} is null
     * @throws IllegalStateException    if the queue was cancelled
     */
    public void enqueue(T item) {
        if (item == null) throw new IllegalArgumentException("item cannot be null");
        lock.lock();
        try {
            if (cancelled) throw new IllegalStateException("Queue is cancelled, cannot enqueue " + item);
            pending.offer(item);
            outstanding++;
            enqueuedCount++;
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the oldest item, blocking while the queue is empty.
     *
     * @throws QueueCancelledException if the queue is, or becomes, cancelled while waiting
     * @throws InterruptedException    if the calling thread is interrupted while waiting
     */
    public T dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!cancelled && pending.isEmpty()) notEmpty.await();
            if (cancelled) throw new QueueCancelledException("Queue cancelled");
            return pending.poll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports one dequeued item as fully processed.
     *
     * @throws IllegalStateException if called more times than items were enqueued
     */
    public void markDone() {
        lock.lock();
        try {
            if (outstanding <= 0) throw new IllegalStateException("markDone called too many times");
            outstanding--;
            completedCount++;
            if (outstanding == 0) drained.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until every enqueued item has been marked done. Returns at once when nothing is outstanding.
     */
    public void awaitDrained() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (outstanding > 0) drained.await();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the queue and wakes every consumer blocked in {@link #dequeue()}. Idempotent.
     * Items still buffered are never delivered.
     */
    public void cancel() {
        lock.lock();
        try {
            cancelled = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Items enqueued but not yet marked done.
     */
    public long outstanding() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Items waiting to be dequeued.
     */
    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public long enqueuedCount() {
        lock.lock();
        try {
            return enqueuedCount;
        } finally {
            lock.unlock();
        }
    }

    public long completedCount() {
        lock.lock();
        try {
            return completedCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "WorkQueue[size=" + pending.size() + ", outstanding=" + outstanding
                   + ", cancelled=" + cancelled + "]";
        } finally {
            lock.unlock();
        }
    }
}
