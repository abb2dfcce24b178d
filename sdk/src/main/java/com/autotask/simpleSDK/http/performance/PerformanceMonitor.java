package com.autotask.simpleSDK.http.performance;

import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collects timings of finished requests and derives throughput, error rate and response-time
 * percentiles from them. Only the most recent {@value #MAX_TIMINGS_HISTORY} timings are kept for the
 * detailed report; the running totals cover every request since the last reset.
 *
 * <p>Each recorded timing is checked against the warning thresholds and logged when it crosses one.
 */
public class PerformanceMonitor {
    public static final int MAX_TIMINGS_HISTORY = 1000;
    public static final Duration SLOW_REQUEST_THRESHOLD = Duration.ofSeconds(5);
    public static final double HIGH_ERROR_RATE_PERCENT = 10.0;
    public static final double LOW_THROUGHPUT_REQUESTS_PER_SECOND = 0.1;

    private static final int HIGH_ERROR_RATE_MIN_REQUESTS = 10;
    private static final int LOW_THROUGHPUT_MIN_REQUESTS = 5;

    private final Logger logger;
    private final Clock clock;
    private final Deque<RequestTiming> recentTimings = new ArrayDeque<>();

    private Instant startTime;
    private Instant lastRequestTime;
    private long requestCount;
    private long successCount;
    private long errorCount;
    private long totalResponseTime;
    private long minResponseTime;
    private long maxResponseTime;

    public PerformanceMonitor(Logger logger) {
        this(logger, Clock.systemUTC());
    }

    public PerformanceMonitor(Logger logger, Clock clock) {
        this.logger = logger;
        this.clock = clock;
        clear();
    }

    /**
     * Starts timing one request. The returned timer records the request when it is stopped.
     */
    public RequestTimer startTimer(String endpoint, String method) {
        return new RequestTimer(endpoint, method, clock.instant());
    }

    public void recordRequest(RequestTiming timing) {
        PerformanceMetrics metrics;
        synchronized (this) {
            long duration = timing.duration().toMillis();
            requestCount++;
            lastRequestTime = timing.endTime();
            totalResponseTime += duration;
            if (timing.success()) {
                successCount++;
            } else {
                errorCount++;
            }
            minResponseTime = Math.min(minResponseTime, duration);
            maxResponseTime = Math.max(maxResponseTime, duration);

            recentTimings.addLast(timing);
            if (recentTimings.size() > MAX_TIMINGS_HISTORY) {
                recentTimings.removeFirst();
            }
            metrics = snapshot();
        }
        checkThresholds(timing, metrics);
    }

    private void checkThresholds(RequestTiming timing, PerformanceMetrics metrics) {
        if (timing.duration().compareTo(SLOW_REQUEST_THRESHOLD) > 0) {
            logger.warn("Slow request detected endpoint={} method={} durationMs={} statusCode={}",
                timing.endpoint(), timing.method(), timing.duration().toMillis(), timing.statusCode());
        }
        if (metrics.errorRate() > HIGH_ERROR_RATE_PERCENT && metrics.requestCount() > HIGH_ERROR_RATE_MIN_REQUESTS) {
            logger.warn("High error rate detected errorRate={} errorCount={} totalRequests={}",
                format(metrics.errorRate(), 2), metrics.errorCount(), metrics.requestCount());
        }
        if (metrics.requestsPerSecond() < LOW_THROUGHPUT_REQUESTS_PER_SECOND && metrics.requestCount() > LOW_THROUGHPUT_MIN_REQUESTS) {
            logger.warn("Low request throughput detected requestsPerSecond={} totalRequests={}",
                format(metrics.requestsPerSecond(), 3), metrics.requestCount());
        }
    }

    public synchronized PerformanceMetrics getMetrics() {
        return snapshot();
    }

    public synchronized PerformanceReport getDetailedReport() {
        List<RequestTiming> timings = new ArrayList<>(recentTimings);

        long[] sorted = timings.stream().mapToLong(timing -> timing.duration().toMillis()).sorted().toArray();
        PerformanceReport.Percentiles percentiles = new PerformanceReport.Percentiles(
            percentile(sorted, 50), percentile(sorted, 90), percentile(sorted, 95), percentile(sorted, 99));

        Map<String, long[]> totals = new LinkedHashMap<>();
        for (RequestTiming timing : timings) {
            long[] counters = totals.computeIfAbsent(timing.endpointKey(), key -> new long[3]);
            counters[0]++;
            counters[1] += timing.duration().toMillis();
            if (!timing.success()) {
                counters[2]++;
            }
        }
        Map<String, PerformanceReport.EndpointStats> endpointStats = new LinkedHashMap<>();
        totals.forEach((key, counters) -> endpointStats.put(key, new PerformanceReport.EndpointStats(
            counters[0], (double) counters[1] / counters[0], counters[2], counters[2] * 100.0 / counters[0])));

        return new PerformanceReport(snapshot(), Collections.unmodifiableList(timings), percentiles,
            Collections.unmodifiableMap(endpointStats));
    }

    public void reset() {
        synchronized (this) {
            clear();
        }
        logger.info("Performance metrics reset");
    }

    public void logSummary() {
        PerformanceReport report = getDetailedReport();
        PerformanceMetrics metrics = report.metrics();
        double successRate = metrics.requestCount() == 0 ? 0 : metrics.successCount() * 100.0 / metrics.requestCount();
        logger.info("Performance Summary totalRequests={} successRate={} errorRate={} averageResponseTimeMs={} "
                + "requestsPerSecond={} p50={} p95={} p99={}",
            metrics.requestCount(), format(successRate, 2), format(metrics.errorRate(), 2),
            format(metrics.averageResponseTime(), 2), format(metrics.requestsPerSecond(), 2),
            report.percentiles().p50(), report.percentiles().p95(), report.percentiles().p99());
    }

    private void clear() {
        recentTimings.clear();
        startTime = clock.instant();
        lastRequestTime = null;
        requestCount = 0;
        successCount = 0;
        errorCount = 0;
        totalResponseTime = 0;
        minResponseTime = Long.MAX_VALUE;
        maxResponseTime = 0;
    }

    private PerformanceMetrics snapshot() {
        long elapsedMillis = Math.max(1, Duration.between(startTime, clock.instant()).toMillis());
        return new PerformanceMetrics(
            requestCount,
            successCount,
            errorCount,
            requestCount == 0 ? 0 : (double) totalResponseTime / requestCount,
            requestCount == 0 ? 0 : minResponseTime,
            maxResponseTime,
            totalResponseTime,
            requestCount * 1000.0 / elapsedMillis,
            requestCount == 0 ? 0 : errorCount * 100.0 / requestCount,
            lastRequestTime,
            startTime
        );
    }

    static long percentile(long[] sorted, int percentile) {
        if (sorted.length == 0) {
            return 0;
        }
        int index = (int) Math.ceil(percentile / 100.0 * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(index, sorted.length - 1))];
    }

    private static String format(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    /**
     * Timer for a single request. Stopping it more than once records only the first stop.
     */
    public final class RequestTimer {
        private final String endpoint;
        private final String method;
        private final Instant startTime;
        private boolean stopped;

        private RequestTimer(String endpoint, String method, Instant startTime) {
            this.endpoint = endpoint;
            this.method = method;
            this.startTime = startTime;
        }

        /**
         * @param statusCode HTTP status of the final response, or {@code null}
         * @param error      failure message, or {@code null} when the request succeeded
         */
        public void stop(Integer statusCode, String error) {
            synchronized (this) {
                if (stopped) {
                    return;
                }
                stopped = true;
            }
            Instant endTime = clock.instant();
            boolean success = error == null && (statusCode == null || statusCode < 400);
            recordRequest(new RequestTiming(startTime, endTime, Duration.between(startTime, endTime),
                endpoint, method, statusCode, success, error));
        }
    }
}
