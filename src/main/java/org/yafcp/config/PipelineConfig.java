package org.yafcp.config;

import java.time.Duration;

/**
 * Pool sizing and timing knobs. Null fields fall back to the defaults below.
 *
 * @param workerCount           number of concurrent workers sharing the queue
 * @param fetchTimeoutMillis    hard timeout for one fetch
 * @param processingDelayMillis simulated CPU-bound step applied after each successful parse
 * @param runLabel              prefix of the final "Entire Run took" line
 */
public record PipelineConfig(Integer workerCount, Long fetchTimeoutMillis, Long processingDelayMillis,
                             String runLabel) {

    public static final int DEFAULT_WORKER_COUNT = 5;
    public static final long DEFAULT_FETCH_TIMEOUT_MILLIS = 5_000L;
    public static final long DEFAULT_PROCESSING_DELAY_MILLIS = 500L;
    public static final String DEFAULT_RUN_LABEL = "With shared work queue";
    public static final String SEQUENTIAL_RUN_LABEL = "Normal sequential run";

    public PipelineConfig {
        workerCount = workerCount != null ? workerCount : DEFAULT_WORKER_COUNT;
        fetchTimeoutMillis = fetchTimeoutMillis != null ? fetchTimeoutMillis : DEFAULT_FETCH_TIMEOUT_MILLIS;
        processingDelayMillis = processingDelayMillis != null ? processingDelayMillis : DEFAULT_PROCESSING_DELAY_MILLIS;
        runLabel = runLabel != null && !runLabel.isBlank() ? runLabel : DEFAULT_RUN_LABEL;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, null);
    }

    public Duration fetchTimeout() {
        return Duration.ofMillis(fetchTimeoutMillis);
    }

    public Duration processingDelay() {
        return Duration.ofMillis(processingDelayMillis);
    }

    /**
     * Same timings, one worker: the sequential variant of the run.
     */
    public PipelineConfig sequential() {
        return new PipelineConfig(1, fetchTimeoutMillis, processingDelayMillis, SEQUENTIAL_RUN_LABEL);
    }
}
