package org.yafcp.queue;

/**
 * Thrown from {@link WorkQueue#dequeue()} once the queue has been cancelled. Consumers treat it as the signal
 * to leave their loop.
 */
public class QueueCancelledException extends RuntimeException {

    public QueueCancelledException(String message) {
        super(message);
    }
}
