package org.yafcp.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Small formatting helpers shared by the timing log lines.
 */
public final class Utils {

    private Utils() {
    }

    /**
     * Seconds with four decimals, e.g. {@code 0.5123}.
     */
    public static String formatSeconds(final Duration duration) {
        return String.format(Locale.ROOT, "%.4f", duration.toNanos() / 1_000_000_000.0);
    }

    /**
     * {@code "<label> -> took: <seconds>"}, the line every timed span ends with.
     */
    public static String timingLine(final String label, final Duration duration) {
        return label + " -> took: " + formatSeconds(duration);
    }
}
