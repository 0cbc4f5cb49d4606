package org.yafcp.plugin;

import java.time.Duration;

/**
 * Retrieves the payload behind one locator. Implementations are shared by all workers and must be thread-safe.
 */
@FunctionalInterface
public interface ResourceFetcher {
    /**
     * Performs a single retrieval, no retries.
     *
     * @return the decoded payload
     * @throws FetchException with {@link FetchException.Kind#TIMEOUT} when {@code timeout} elapses first,
     *                        {@link FetchException.Kind#TRANSPORT} for any other failure
     */
    String fetch(String locator, Duration timeout) throws FetchException;
}
