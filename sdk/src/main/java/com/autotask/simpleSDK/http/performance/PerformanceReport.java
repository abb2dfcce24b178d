package com.autotask.simpleSDK.http.performance;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a {@link PerformanceMonitor}: the running metrics plus percentiles and per-endpoint
 * figures computed over the retained timing history.
 *
 * @param endpointStats keyed by {@code "METHOD endpoint"}, in first-seen order
 */
public record PerformanceReport(
    PerformanceMetrics metrics,
    List<RequestTiming> recentTimings,
    Percentiles percentiles,
    Map<String, EndpointStats> endpointStats
) {
    /** Response-time percentiles in milliseconds, using the nearest-rank method. */
    public record Percentiles(long p50, long p90, long p95, long p99) {
    }

    public record EndpointStats(long count, double averageTime, long errorCount, double errorRate) {
    }
}
