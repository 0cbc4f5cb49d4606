package org.yafcp.plugin;

public class FetchException extends PipelineException {

    public enum Kind {
        TIMEOUT,   // no complete response within the fetch timeout
        TRANSPORT  // DNS, refused connection, bad URI, non-2xx status, interruption
    }

    private final Kind kind;
    private final String locator;

    public FetchException(Kind kind, String locator, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.locator = locator;
    }

    public static FetchException timeout(String locator, long timeoutMillis, Throwable cause) {
        return new FetchException(Kind.TIMEOUT, locator, "Fetch of " + locator + " timed out after " + timeoutMillis + "ms", cause);
    }

    public static FetchException transport(String locator, String reason, Throwable cause) {
        return new FetchException(Kind.TRANSPORT, locator, "Fetch of " + locator + " failed: " + reason, cause);
    }

    public Kind kind() {
        return kind;
    }

    public String locator() {
        return locator;
    }

    @Override
    public String category() {
        return kind == Kind.TIMEOUT ? "FetchError::Timeout" : "FetchError::Transport";
    }
}
