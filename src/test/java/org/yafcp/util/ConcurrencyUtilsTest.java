package org.yafcp.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyUtilsTest {

    @Test
    void testCreatePlatformThreadFactory() {
        ThreadFactory factory = ConcurrencyUtils.createPlatformThreadFactory("MyTestThread-");
        assertNotNull(factory);
        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});
        assertEquals("MyTestThread-0", first.getName());
        assertEquals("MyTestThread-1", second.getName());
        assertFalse(first.isDaemon(), "Worker threads should keep the JVM alive until joined.");
    }

    @Test
    void testShutdownExecutorService_nullExecutor() {
        // Should not throw an exception
        assertDoesNotThrow(() -> ConcurrencyUtils.shutdownExecutorService(null, "NullTestExecutor"));
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_normalShutdown() {
        ExecutorService localExecutor = Executors.newFixedThreadPool(1);
        localExecutor.submit(() -> {
            try {
                Thread.sleep(50); // Simulate some work
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        ConcurrencyUtils.shutdownExecutorService(localExecutor, "NormalShutdownTest");
        assertTrue(localExecutor.isTerminated(), "Executor should be terminated after shutdown.");
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testShutdownExecutorService_forcesStuckTask() throws InterruptedException {
        ExecutorService localExecutor = Executors.newFixedThreadPool(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);
        localExecutor.submit(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));

        ConcurrencyUtils.shutdownExecutorService(localExecutor, "StuckTest", Duration.ofMillis(100));

        assertTrue(localExecutor.isTerminated());
        assertTrue(interrupted.get(), "Stuck task should be interrupted after the grace period.");
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testSleepUninterruptibly_completesAndRestoresFlag() {
        long start = System.nanoTime();
        Thread.currentThread().interrupt();
        ConcurrencyUtils.sleepUninterruptibly(Duration.ofMillis(80));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(Thread.interrupted(), "Interrupt flag should be restored (and is cleared here).");
        assertTrue(elapsedMillis >= 80, "Sleep should not be cut short, took " + elapsedMillis + "ms");
    }

    @Test
    void testSleepUninterruptibly_zeroOrNull() {
        assertDoesNotThrow(() -> ConcurrencyUtils.sleepUninterruptibly(Duration.ZERO));
        assertDoesNotThrow(() -> ConcurrencyUtils.sleepUninterruptibly(null));
    }
}
