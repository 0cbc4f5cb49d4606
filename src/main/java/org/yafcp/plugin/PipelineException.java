package org.yafcp.plugin;

/**
 * Base of the per-item failures. The work item processor catches these, logs them with the locator
 * and worker id, and moves on.
 */
public abstract class PipelineException extends Exception {

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Category name used in log lines, e.g. {@code FetchError::Timeout}.
     */
    public abstract String category();
}
