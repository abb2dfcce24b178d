package com.autotask.simpleSDK.http.performance;

import java.time.Instant;

/**
 * Running totals kept by {@link PerformanceMonitor} since it was created or last reset. Times are in
 * milliseconds; {@code errorRate} is a percentage.
 */
public record PerformanceMetrics(
    long requestCount,
    long successCount,
    long errorCount,
    double averageResponseTime,
    long minResponseTime,
    long maxResponseTime,
    long totalResponseTime,
    double requestsPerSecond,
    double errorRate,
    Instant lastRequestTime,
    Instant startTime
) {
}
