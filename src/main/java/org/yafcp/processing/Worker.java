package org.yafcp.processing;

import org.yafcp.metrics.Status;
import org.yafcp.metrics.WorkResult;
import org.yafcp.queue.QueueCancelledException;
import org.yafcp.queue.WorkQueue;

import java.util.logging.Logger;

/**
 * Long-lived consumer loop: dequeue a locator, hand it to the {@link WorkItemProcessor}, mark it done.
 * <p>
 * Cancellation is only observed while waiting in {@link WorkQueue#dequeue()}. An interrupt that lands while an
 * item is being processed is held until the item is marked done; the worker then leaves at the dequeue boundary.
 */
public class Worker implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(Worker.class.getName());

    public enum State {
        IDLE, DEQUEUING, PROCESSING, CANCELLED
    }

    private final int workerId;
    private final WorkQueue<String> queue;
    private final WorkItemProcessor processor;

    private volatile State state = State.IDLE;
    private volatile int processedCount = 0;
    private volatile int failedCount = 0;

    public Worker(int workerId, WorkQueue<String> queue, WorkItemProcessor processor) {
        this.workerId = workerId;
        this.queue = queue;
        this.processor = processor;
    }

    @Override
    public void run() {
        LOGGER.fine(() -> "worker_id=" + workerId + " started on " + Thread.currentThread().getName());
        try {
            while (true) {
                state = State.DEQUEUING;
                final String locator;
                try {
                    locator = queue.dequeue();
                } catch (final QueueCancelledException e) {
                    break;
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }

                state = State.PROCESSING;
                try {
                    WorkResult result = processor.process(locator, workerId);
                    processedCount++;
                    if (result.status() == Status.FAIL) failedCount++;
                } finally {
                    queue.markDone();
                }
                state = State.IDLE;

                if (Thread.currentThread().isInterrupted()) break; // deferred cancellation
            }
        } finally {
            state = State.CANCELLED;
            LOGGER.fine(() -> String.format("worker_id=%d cancelled after %d items (%d failed)",
                    workerId, processedCount, failedCount));
        }
    }

    public int workerId() {
        return workerId;
    }

    public State state() {
        return state;
    }

    public int processedCount() {
        return processedCount;
    }

    public int failedCount() {
        return failedCount;
    }
}
