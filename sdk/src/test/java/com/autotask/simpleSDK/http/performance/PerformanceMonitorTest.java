package com.autotask.simpleSDK.http.performance;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceMonitorTest {
    private ch.qos.logback.classic.Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private SteppingClock clock;
    private PerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("autotask.test.performance");
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        clock = new SteppingClock(Instant.parse("2024-05-14T09:00:00Z"));
        monitor = new PerformanceMonitor(logger, clock);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void testTotalsCoverSuccessesAndErrors() {
        time("/Tickets/1", "GET", 120, 200);
        time("/Tickets/1", "GET", 80, 200);
        time("/Tickets", "POST", 400, 500);

        PerformanceMetrics metrics = monitor.getMetrics();
        assertEquals(3, metrics.requestCount());
        assertEquals(2, metrics.successCount());
        assertEquals(1, metrics.errorCount());
        assertEquals(80, metrics.minResponseTime());
        assertEquals(400, metrics.maxResponseTime());
        assertEquals(600, metrics.totalResponseTime());
        assertEquals(200.0, metrics.averageResponseTime());
        assertEquals(100.0 / 3, metrics.errorRate(), 1e-9);
        assertEquals(Instant.parse("2024-05-14T09:00:00.600Z"), metrics.lastRequestTime());
        assertEquals(5.0, metrics.requestsPerSecond(), 1e-9);
    }

    @Test
    void testEmptyMonitorReportsZeros() {
        PerformanceReport report = monitor.getDetailedReport();

        assertEquals(0, report.metrics().minResponseTime());
        assertEquals(0.0, report.metrics().averageResponseTime());
        assertEquals(0.0, report.metrics().errorRate());
        assertNull(report.metrics().lastRequestTime());
        assertEquals(new PerformanceReport.Percentiles(0, 0, 0, 0), report.percentiles());
        assertTrue(report.endpointStats().isEmpty());
    }

    @Test
    void testPercentilesUseNearestRank() {
        for (int millis = 10; millis >= 1; millis--) {
            time("/Contacts/query", "POST", millis, 200);
        }

        assertEquals(new PerformanceReport.Percentiles(5, 9, 10, 10), monitor.getDetailedReport().percentiles());
        assertEquals(7, PerformanceMonitor.percentile(new long[] {7}, 50));
    }

    @Test
    void testEndpointStatsAreKeyedByMethodAndPath() {
        time("/Tickets/1", "GET", 100, 200);
        time("/Tickets/1", "GET", 300, 404);
        time("/Tickets/1", "PATCH", 50, 200);

        PerformanceReport report = monitor.getDetailedReport();

        assertEquals(List.of("GET /Tickets/1", "PATCH /Tickets/1"), List.copyOf(report.endpointStats().keySet()));
        assertEquals(new PerformanceReport.EndpointStats(2, 200.0, 1, 50.0), report.endpointStats().get("GET /Tickets/1"));
        assertEquals(new PerformanceReport.EndpointStats(1, 50.0, 0, 0.0), report.endpointStats().get("PATCH /Tickets/1"));
    }

    @Test
    void testHistoryKeepsOnlyRecentTimings() {
        for (int i = 0; i < PerformanceMonitor.MAX_TIMINGS_HISTORY + 5; i++) {
            time("/Tickets/" + i, "GET", 1, 200);
        }

        PerformanceReport report = monitor.getDetailedReport();

        assertEquals(PerformanceMonitor.MAX_TIMINGS_HISTORY + 5, report.metrics().requestCount());
        assertEquals(PerformanceMonitor.MAX_TIMINGS_HISTORY, report.recentTimings().size());
        assertEquals("/Tickets/5", report.recentTimings().get(0).endpoint());
    }

    @Test
    void testSlowRequestIsLogged() {
        time("/Tickets/1", "GET", 5000, 200);
        assertTrue(warnings().isEmpty());

        time("/Tickets/2", "GET", 5001, 200);

        assertEquals(List.of("Slow request detected endpoint=/Tickets/2 method=GET durationMs=5001 statusCode=200"), warnings());
    }

    @Test
    void testHighErrorRateIsLoggedOnceEnoughRequestsWereSeen() {
        for (int i = 0; i < 10; i++) {
            time("/Tickets/1", "GET", 1, 503);
        }
        assertTrue(warnings().isEmpty());

        time("/Tickets/1", "GET", 1, 503);

        assertEquals(List.of("High error rate detected errorRate=100.00 errorCount=11 totalRequests=11"), warnings());
    }

    @Test
    void testLowThroughputIsLogged() {
        for (int i = 0; i < 6; i++) {
            clock.advance(Duration.ofSeconds(20));
            time("/Companies/query", "POST", 1, 200);
        }

        List<String> warnings = warnings();
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).startsWith("Low request throughput detected requestsPerSecond=0.050 totalRequests=6"));
    }

    @Test
    void testTimerCountsErrorStatusesAndStopsOnce() {
        PerformanceMonitor.RequestTimer timer = monitor.startTimer("/Tickets/1", "GET");
        clock.advance(Duration.ofMillis(30));
        timer.stop(429, null);
        timer.stop(200, null);

        PerformanceReport report = monitor.getDetailedReport();
        assertEquals(1, report.metrics().requestCount());
        RequestTiming timing = report.recentTimings().get(0);
        assertFalse(timing.success());
        assertEquals(Duration.ofMillis(30), timing.duration());
        assertEquals(Instant.parse("2024-05-14T09:00:00Z"), timing.startTime());
    }

    @Test
    void testResetStartsOver() {
        time("/Tickets/1", "GET", 10, 500);
        clock.advance(Duration.ofSeconds(1));

        monitor.reset();

        PerformanceMetrics metrics = monitor.getMetrics();
        assertEquals(0, metrics.requestCount());
        assertEquals(clock.instant(), metrics.startTime());
        assertTrue(monitor.getDetailedReport().recentTimings().isEmpty());
        assertEquals("Performance metrics reset", appender.list.get(appender.list.size() - 1).getFormattedMessage());
    }

    @Test
    void testSummaryIsLogged() {
        time("/Tickets/1", "GET", 100, 200);
        time("/Tickets/1", "GET", 300, 500);

        monitor.logSummary();

        ILoggingEvent summary = appender.list.get(appender.list.size() - 1);
        assertEquals(Level.INFO, summary.getLevel());
        assertEquals("Performance Summary totalRequests=2 successRate=50.00 errorRate=50.00 averageResponseTimeMs=200.00 "
            + "requestsPerSecond=5.00 p50=100 p95=300 p99=300", summary.getFormattedMessage());
    }

    private void time(String endpoint, String method, long millis, int statusCode) {
        PerformanceMonitor.RequestTimer timer = monitor.startTimer(endpoint, method);
        clock.advance(Duration.ofMillis(millis));
        timer.stop(statusCode, statusCode >= 400 ? "HTTP " + statusCode : null);
    }

    private List<String> warnings() {
        return appender.list.stream()
            .filter(event -> event.getLevel() == Level.WARN)
            .map(ILoggingEvent::getFormattedMessage)
            .collect(Collectors.toList());
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
