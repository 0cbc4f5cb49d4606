package org.yafcp.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling executors and worker threads.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());

    public static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named, non-daemon platform threads: {@code <prefix>0, <prefix>1, ...}.
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService using the default wait of {@link #SHUTDOWN_WAIT_TIMEOUT}.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        shutdownExecutorService(executor, name, SHUTDOWN_WAIT_TIMEOUT);
    }

    /**
     * Gracefully shuts down an ExecutorService. Running tasks are given {@code waitTimeout} to finish before
     * they are interrupted.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name,
                                               final Duration waitTimeout) {
        if (executor == null) return;
        LOGGER.fine(() -> "Attempting graceful shutdown of executor: " + name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(waitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning(String.format("Executor %s did not terminate in %dms, attempting forceful shutdown...",
                        name, waitTimeout.toMillis()));
                final List<Runnable> droppedTasks = executor.shutdownNow(); // Interrupt executing tasks
                LOGGER.warning(String.format("Executor %s forcing shutdown. Dropped %d waiting tasks.",
                        name, droppedTasks.size()));

                if (!executor.awaitTermination(waitTimeout.toMillis(), TimeUnit.MILLISECONDS))
                    LOGGER.severe(String.format("Executor %s did not terminate even after forcing.", name));
                else
                    LOGGER.info(String.format("Executor %s terminated after forcing.", name));

            } else
                LOGGER.fine(() -> "Executor " + name + " terminated gracefully.");

        } catch (final InterruptedException ie) {
            LOGGER.log(Level.WARNING, "Shutdown wait for executor " + name + " interrupted. Forcing shutdown now.", ie);
            executor.shutdownNow(); // Re-cancel if interrupted
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Sleeps for the given duration without giving up early on interrupt. The interrupt flag is restored on
     * return so the caller can react to it at its next safe point.
     */
    public static void sleepUninterruptibly(final Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) return;
        boolean interrupted = false;
        final long deadline = System.nanoTime() + duration.toNanos();
        try {
            long remaining = duration.toNanos();
            while (remaining > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                } catch (final InterruptedException e) {
                    interrupted = true;
                }
                remaining = deadline - System.nanoTime();
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }
}
