package org.yafcp.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helper methods for creating {@link WorkResult} instances.
 */
public final class StatusHelper {

    private StatusHelper() {
    } // Prevent instantiation

    public static WorkResult createPassedWorkResult(String locator, int workerId, Instant start,
                                                    Map<String, String> preview) {
        return new WorkResult(locator, workerId, Status.PASS, Duration.between(start, Instant.now()),
                Thread.currentThread().getName(), Collections.unmodifiableMap(new LinkedHashMap<>(preview)), null);
    }

    public static WorkResult createFailedWorkResult(String locator, int workerId, Instant start, Throwable cause) {
        return new WorkResult(locator, workerId, Status.FAIL, Duration.between(start, Instant.now()),
                Thread.currentThread().getName(), Map.of(), cause);
    }

    /**
     * Short "Type: message" description of a failure, walking to the innermost cause that carries a message.
     */
    public static String describe(Throwable cause) {
        if (cause == null) return "N/A";
        Throwable current = cause;
        while (current.getCause() != null && current.getCause() != current && current.getMessage() == null) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return current.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
