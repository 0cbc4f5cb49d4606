package org.yafcp.fetch;

import org.yafcp.util.ConcurrencyUtils;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * One connection-pooling {@link HttpClient} shared by every worker of a run, together with the executor it
 * runs its exchanges on. Opened by the pool coordinator before workers start and closed after they stop.
 */
public final class NetworkContext implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(NetworkContext.class.getName());

    private static final Duration EXECUTOR_SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final HttpClient client;
    private final ExecutorService httpExecutor;
    private volatile boolean closed = false;

    private NetworkContext(HttpClient client, ExecutorService httpExecutor) {
        this.client = client;
        this.httpExecutor = httpExecutor;
    }

    /**
     * @param connectTimeout TCP connect timeout for new pooled connections
     * @param ioThreads      size of the executor backing the client
     */
    public static NetworkContext open(Duration connectTimeout, int ioThreads) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, ioThreads),
                ConcurrencyUtils.createPlatformThreadFactory("YAFCP-Http-"));
        try {
            HttpClient client = HttpClient.newBuilder()
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .connectTimeout(connectTimeout)
                    .version(HttpClient.Version.HTTP_1_1)
                    .executor(executor)
                    .build();
            LOGGER.fine("Opened shared HTTP client");
            return new NetworkContext(client, executor);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw new IllegalStateException("Could not create shared HTTP client", e);
        }
    }

    public HttpClient client() {
        if (closed) throw new IllegalStateException("Network context is closed");
        return client;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        ConcurrencyUtils.shutdownExecutorService(httpExecutor, "HttpClientExecutor", EXECUTOR_SHUTDOWN_WAIT);
        LOGGER.fine("Closed shared HTTP client");
    }
}
