package org.yafcp.metrics;

import java.time.Duration;

public record RunInfo(String runLabel, Duration totalDuration, int workerCount, long enqueuedCount,
                      long completedCount) {
}
