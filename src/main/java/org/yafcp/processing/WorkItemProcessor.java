package org.yafcp.processing;

import org.yafcp.config.ParsingOptions;
import org.yafcp.metrics.StatusHelper;
import org.yafcp.metrics.WorkResult;
import org.yafcp.parsing.RecordSet;
import org.yafcp.plugin.PipelineException;
import org.yafcp.plugin.RecordParser;
import org.yafcp.plugin.ResourceFetcher;
import org.yafcp.util.ConcurrencyUtils;
import org.yafcp.util.Utils;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one work item: timed fetch, parse, simulated processing step, preview log.
 * <p>
 * {@link #process(String, int)} never throws. Fetch and parse errors, and any runtime failure in between, are
 * logged with the locator and worker id and returned as a FAIL {@link WorkResult}.
 */
public class WorkItemProcessor {

    private static final Logger LOGGER = Logger.getLogger(WorkItemProcessor.class.getName());

    private final ResourceFetcher fetcher;
    private final RecordParser parser;
    private final ParsingOptions options;
    private final Duration fetchTimeout;
    private final Duration processingDelay;

    public WorkItemProcessor(ResourceFetcher fetcher, RecordParser parser, ParsingOptions options,
                             Duration fetchTimeout, Duration processingDelay) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout cannot be null");
        this.processingDelay = processingDelay != null ? processingDelay : Duration.ZERO;
    }

    public WorkResult process(final String locator, final int workerId) {
        final Instant start = Instant.now();
        final String label = String.format("In worker_id=%d, url=%s, transformation", workerId, locator);
        try {
            LOGGER.info(String.format("For worker_id=%d, getting the url=%s", workerId, locator));
            final String rawText = fetcher.fetch(locator, fetchTimeout);

            LOGGER.info(String.format("worker_id=%d has started to parse CSV file for url=%s.", workerId, locator));
            final RecordSet recordSet = parser.parse(rawText, options);

            // stand-in for CPU-bound work after the I/O; finishes even if interrupted
            ConcurrencyUtils.sleepUninterruptibly(processingDelay);

            LOGGER.info(String.format("worker_id=%d has finished parsing the CSV file for url=%s.", workerId, locator));
            final Map<String, String> preview = recordSet.firstRowPreview(RecordSet.PREVIEW_FIELDS);
            LOGGER.info("Print out first five columns of the first row of the record set: " + preview);

            final WorkResult result = StatusHelper.createPassedWorkResult(locator, workerId, start, preview);
            LOGGER.info(Utils.timingLine(label, result.duration()));
            return result;

        } catch (final PipelineException e) {
            LOGGER.log(Level.SEVERE, String.format("Error processing url=%s on worker_id=%d [%s]: %s",
                    locator, workerId, e.category(), e.getMessage()), e);
            return fail(locator, workerId, start, label, e);
        } catch (final RuntimeException e) {
            LOGGER.log(Level.SEVERE, String.format("Error processing url=%s on worker_id=%d: %s",
                    locator, workerId, StatusHelper.describe(e)), e);
            return fail(locator, workerId, start, label, e);
        }
    }

    private static WorkResult fail(String locator, int workerId, Instant start, String label, Throwable cause) {
        final WorkResult result = StatusHelper.createFailedWorkResult(locator, workerId, start, cause);
        LOGGER.info(Utils.timingLine(label, result.duration()));
        return result;
    }

    public Duration fetchTimeout() {
        return fetchTimeout;
    }

    public Duration processingDelay() {
        return processingDelay;
    }
}
