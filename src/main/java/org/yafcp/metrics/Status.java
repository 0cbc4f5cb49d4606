package org.yafcp.metrics;

/**
 * Represents the outcome of one work item.
 */
public enum Status {
    PASS, // Fetched, parsed and previewed
    FAIL  // Fetch or parse failed, logged and skipped
}
