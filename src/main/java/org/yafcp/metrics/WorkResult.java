package org.yafcp.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one locator's fetch + parse cycle, returned by the work item processor after it has logged the
 * preview or the failure. The worker only counts it.
 *
 * @param preview      first row of the parsed record set, limited to the first five fields; empty on failure
 * @param failureCause null on success
 */
public record WorkResult(String locator, int workerId, Status status, Duration duration, String threadName,
                         Map<String, String> preview, Throwable failureCause) {
}
