package com.autotask.simpleSDK.http.performance;

import java.time.Duration;
import java.time.Instant;

/**
 * One finished logical request as seen by {@link PerformanceMonitor}. Retries of the same call are
 * folded into a single timing.
 *
 * @param statusCode HTTP status of the final response, or {@code null} when none was received
 * @param error      message of the final failure, or {@code null} on success
 */
public record RequestTiming(
    Instant startTime,
    Instant endTime,
    Duration duration,
    String endpoint,
    String method,
    Integer statusCode,
    boolean success,
    String error
) {
    public String endpointKey() {
        return method + " " + endpoint;
    }
}
