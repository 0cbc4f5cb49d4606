package org.yafcp.processing;

import org.yafcp.config.ParsingOptions;
import org.yafcp.config.PipelineConfig;
import org.yafcp.fetch.HttpResourceFetcher;
import org.yafcp.fetch.NetworkContext;
import org.yafcp.metrics.RunInfo;
import org.yafcp.parsing.CsvRecordParser;
import org.yafcp.plugin.RecordParser;
import org.yafcp.plugin.ResourceFetcher;
import org.yafcp.queue.WorkQueue;
import org.yafcp.util.ConcurrencyUtils;
import org.yafcp.util.Utils;

import java.nio.charset.Charset;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Runs a fixed pool of {@link Worker}s over one {@link WorkQueue} of locators.
 * <p>
 * The queue is filled before any worker starts. The coordinator waits for the queue to drain, then cancels it so
 * every worker leaves its loop at the dequeue boundary, joins the pool, and finally closes the shared
 * {@link NetworkContext}. Cancellation and join happen on every exit path.
 */
public class PoolCoordinator {

    private static final Logger LOGGER = Logger.getLogger(PoolCoordinator.class.getName());

    public static final String WORKER_THREAD_PREFIX = "YAFCP-Worker-";

    private final PipelineConfig config;
    private final ParsingOptions options;
    private final Supplier<NetworkContext> contextSupplier;
    private final Function<NetworkContext, ResourceFetcher> fetcherFactory;
    private final RecordParser parser;

    private final List<Worker> lastWorkers = new ArrayList<>();

    public PoolCoordinator(PipelineConfig config, ParsingOptions options, Supplier<NetworkContext> contextSupplier,
                           Function<NetworkContext, ResourceFetcher> fetcherFactory, RecordParser parser) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.contextSupplier = Objects.requireNonNull(contextSupplier, "contextSupplier cannot be null");
        this.fetcherFactory = Objects.requireNonNull(fetcherFactory, "fetcherFactory cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        if (config.workerCount() < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + config.workerCount());
        }
    }

    /**
     * Coordinator fetching over HTTP and parsing CSV.
     */
    public static PoolCoordinator forHttp(PipelineConfig config, ParsingOptions options) {
        final Charset charset = Charset.forName(options.encoding());
        return new PoolCoordinator(config, options,
                () -> NetworkContext.open(config.fetchTimeout(), config.workerCount()),
                context -> new HttpResourceFetcher(context, charset),
                new CsvRecordParser());
    }

    /**
     * Processes every locator once and returns when the queue has drained and all workers have stopped.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting for the drain
     */
    public RunInfo run(final List<String> locators) throws InterruptedException {
        Objects.requireNonNull(locators, "locators cannot be null");
        final Instant runStart = Instant.now();
        final int workerCount = config.workerCount();

        final WorkQueue<String> queue = new WorkQueue<>();
        for (final String locator : locators) {
            queue.enqueue(locator);
        }
        LOGGER.info("The url queue has " + queue);

        try (NetworkContext context = contextSupplier.get()) {
            final WorkItemProcessor processor = new WorkItemProcessor(fetcherFactory.apply(context), parser, options,
                    config.fetchTimeout(), config.processingDelay());

            final ExecutorService workerPool = Executors.newFixedThreadPool(workerCount,
                    ConcurrencyUtils.createPlatformThreadFactory(WORKER_THREAD_PREFIX));
            final List<Worker> workers = new ArrayList<>(workerCount);
            try {
                for (int workerId = 0; workerId < workerCount; workerId++) {
                    final Worker worker = new Worker(workerId, queue, processor);
                    workers.add(worker);
                    workerPool.execute(worker);
                }
                LOGGER.info(String.format("Started %d workers for %d urls.", workerCount, locators.size()));

                queue.awaitDrained();
                LOGGER.info(String.format("Url queue drained: %d of %d urls processed.",
                        queue.completedCount(), queue.enqueuedCount()));
            } finally {
                queue.cancel();
                ConcurrencyUtils.shutdownExecutorService(workerPool, "WorkerPool");
                synchronized (lastWorkers) {
                    lastWorkers.clear();
                    lastWorkers.addAll(workers);
                }
            }
        } finally {
            LOGGER.info(config.runLabel() + " -> Entire Run took: "
                        + Utils.formatSeconds(Duration.between(runStart, Instant.now())));
        }

        return new RunInfo(config.runLabel(), Duration.between(runStart, Instant.now()), workerCount,
                queue.enqueuedCount(), queue.completedCount());
    }

    /**
     * Workers of the most recent run, in id order. Empty before the first run.
     */
    public List<Worker> lastWorkers() {
        synchronized (lastWorkers) {
            return List.copyOf(lastWorkers);
        }
    }
}
