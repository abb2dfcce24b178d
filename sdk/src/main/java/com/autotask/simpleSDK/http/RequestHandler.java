package com.autotask.simpleSDK.http;

import com.autotask.simpleSDK.http.exceptions.AutotaskNetworkException;
import com.autotask.simpleSDK.http.exceptions.AutotaskServiceException;
import com.autotask.simpleSDK.http.performance.PerformanceMetrics;
import com.autotask.simpleSDK.http.performance.PerformanceMonitor;
import com.autotask.simpleSDK.http.performance.PerformanceReport;
import com.autotask.simpleSDK.http.retry.ExponentialBackoffStrategy;
import com.autotask.simpleSDK.http.retry.RetryPolicy;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one logical API call: invokes the supplied request, retries retryable failures with exponential
 * backoff, and logs each attempt. Results and final failures are passed back unchanged. When
 * performance monitoring is enabled each logical call, retries included, is timed once by the
 * handler's {@link PerformanceMonitor}.
 *
 * <p>Attempts are chained on the returned future, so the caller's thread never waits on I/O or on a
 * backoff delay.
 */
public class RequestHandler {
    private final Logger logger;
    private final RetryPolicy retryPolicy;
    private final ExponentialBackoffStrategy backoffStrategy;
    private final DelayScheduler delayScheduler;
    private final PerformanceMonitor performanceMonitor;
    private volatile RequestOptions globalOptions;

    public RequestHandler(Logger logger) {
        this(logger, RetryPolicy.DEFAULT, RequestOptions.defaults());
    }

    public RequestHandler(Logger logger, RetryPolicy retryPolicy, RequestOptions globalOptions) {
        this(logger, retryPolicy, globalOptions, new ExponentialBackoffStrategy(), DelayScheduler.systemDefault());
    }

    public RequestHandler(Logger logger, RetryPolicy retryPolicy, RequestOptions globalOptions,
                          ExponentialBackoffStrategy backoffStrategy, DelayScheduler delayScheduler) {
        this(logger, retryPolicy, globalOptions, backoffStrategy, delayScheduler, new PerformanceMonitor(logger));
    }

    public RequestHandler(Logger logger, RetryPolicy retryPolicy, RequestOptions globalOptions,
                          ExponentialBackoffStrategy backoffStrategy, DelayScheduler delayScheduler,
                          PerformanceMonitor performanceMonitor) {
        this.logger = logger;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.DEFAULT;
        this.globalOptions = globalOptions != null ? globalOptions : RequestOptions.defaults();
        this.backoffStrategy = backoffStrategy;
        this.delayScheduler = delayScheduler;
        this.performanceMonitor = performanceMonitor;
    }

    public <T> CompletableFuture<T> executeRequest(Supplier<CompletableFuture<T>> requestCall, String endpoint, String method) {
        return executeRequest(requestCall, endpoint, method, RequestOptions.defaults());
    }

    /**
     * @param requestCall performs the HTTP call; invoked once per attempt
     * @param endpoint    logical endpoint path, used for logging
     * @param method      HTTP verb, used for logging and the idempotency check
     * @param options     per-call options merged over the global options
     * @return future completing with the call's result, or failing with the last error once retries are spent
     */
    public <T> CompletableFuture<T> executeRequest(Supplier<CompletableFuture<T>> requestCall, String endpoint,
                                                   String method, RequestOptions options) {
        RequestOptions mergedOptions = globalOptions.merge(options);
        String requestId = mergedOptions.getRequestId().orElseGet(() -> UUID.randomUUID().toString());
        PerformanceMonitor.RequestTimer timer = mergedOptions.isPerformanceMonitoringEnabled()
            ? performanceMonitor.startTimer(endpoint, method)
            : null;
        RequestContext context = new RequestContext(requestId, endpoint, method, mergedOptions, timer, System.nanoTime());

        CompletableFuture<T> result = new CompletableFuture<>();
        runAttempt(requestCall, context, 1, result);
        return result;
    }

    private <T> void runAttempt(Supplier<CompletableFuture<T>> requestCall, RequestContext context, int attempt,
                                CompletableFuture<T> result) {
        logRequest(context, attempt);

        CompletableFuture<T> call;
        try {
            call = requestCall.get();
            if (call == null) {
                call = CompletableFuture.failedFuture(
                    new IllegalStateException("Request supplier returned no future for " + context.method + " " + context.endpoint));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        Optional<Duration> timeout = context.options.getTimeout();
        if (timeout.isPresent()) {
            call = call.copy().orTimeout(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
        }

        call.whenComplete((value, error) -> {
            if (error == null) {
                logResponse(context, attempt);
                context.stopTimer(value instanceof HttpCallResult ? ((HttpCallResult) value).statusCode() : null, null);
                result.complete(value);
                return;
            }

            Throwable failure = unwrap(error);
            if (failure instanceof TimeoutException && timeout.isPresent()) {
                failure = new AutotaskNetworkException("Request timeout after " + timeout.get().toMillis() + "ms", true, failure);
            }
            logError(context, failure, attempt);

            if (shouldRetry(context, failure, attempt)) {
                Duration delay = backoffStrategy.calculateDelay(attempt, context.options.getBaseDelay(), retryPolicy, failure);
                logger.warn("Request failed, retrying in {}ms requestId={} endpoint={} method={} attempt={} maxRetries={} errorType={}",
                    delay.toMillis(), context.requestId, context.endpoint, context.method, attempt,
                    context.options.getRetries(), failure.getClass().getSimpleName());
                try {
                    delayScheduler.after(delay).execute(() -> runAttempt(requestCall, context, attempt + 1, result));
                } catch (RuntimeException e) {
                    e.addSuppressed(failure);
                    context.stopTimer(null, String.valueOf(e.getMessage()));
                    result.completeExceptionally(e);
                }
                return;
            }

            context.stopTimer(failure instanceof AutotaskServiceException
                ? ((AutotaskServiceException) failure).getStatusCode()
                : null, String.valueOf(failure.getMessage()));
            result.completeExceptionally(failure);
        });
    }

    private boolean shouldRetry(RequestContext context, Throwable failure, int attempt) {
        if (attempt > context.options.getRetries()) {
            return false;
        }
        boolean idempotent = context.options.getIdempotent().orElseGet(() -> retryPolicy.isIdempotent(context.method));
        return idempotent && retryPolicy.isRetryable(failure);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void logRequest(RequestContext context, int attempt) {
        if (!context.options.isRequestLoggingEnabled()) {
            return;
        }
        if (attempt > 1) {
            logger.info("Retrying request requestId={} endpoint={} method={} attempt={}",
                context.requestId, context.endpoint, context.method, attempt);
        } else {
            logger.info("Making request requestId={} endpoint={} method={}",
                context.requestId, context.endpoint, context.method);
        }
    }

    private void logResponse(RequestContext context, int attempt) {
        if (!context.options.isResponseLoggingEnabled()) {
            return;
        }
        logger.info("Request completed successfully requestId={} endpoint={} method={} attempt={} durationMs={}",
            context.requestId, context.endpoint, context.method, attempt, context.elapsedMillis());
    }

    private void logError(RequestContext context, Throwable failure, int attempt) {
        Integer statusCode = failure instanceof AutotaskServiceException
            ? ((AutotaskServiceException) failure).getStatusCode()
            : null;

        if (statusCode != null && statusCode >= 500) {
            logger.error("Server error occurred requestId={} endpoint={} method={} attempt={} statusCode={} message={}",
                context.requestId, context.endpoint, context.method, attempt, statusCode, failure.getMessage());
        } else if (statusCode != null) {
            logger.warn("Client error occurred requestId={} endpoint={} method={} attempt={} statusCode={} message={}",
                context.requestId, context.endpoint, context.method, attempt, statusCode, failure.getMessage());
        } else if (failure instanceof AutotaskNetworkException) {
            logger.error("Network error occurred requestId={} endpoint={} method={} attempt={} timeout={} message={}",
                context.requestId, context.endpoint, context.method, attempt,
                ((AutotaskNetworkException) failure).isTimeout(), failure.getMessage());
        } else {
            logger.error("Request failed requestId={} endpoint={} method={} attempt={} errorType={} message={}",
                context.requestId, context.endpoint, context.method, attempt,
                failure.getClass().getSimpleName(), failure.getMessage());
        }
    }

    public void updateGlobalOptions(RequestOptions options) {
        synchronized (this) {
            this.globalOptions = this.globalOptions.merge(options);
        }
    }

    public RequestOptions getGlobalOptions() {
        return globalOptions;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Logger getLogger() {
        return logger;
    }

    public PerformanceMonitor getPerformanceMonitor() {
        return performanceMonitor;
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return performanceMonitor.getMetrics();
    }

    public PerformanceReport getPerformanceReport() {
        return performanceMonitor.getDetailedReport();
    }

    public void resetPerformanceMetrics() {
        performanceMonitor.reset();
    }

    public void logPerformanceSummary() {
        performanceMonitor.logSummary();
    }

    private static final class RequestContext {
        final String requestId;
        final String endpoint;
        final String method;
        final RequestOptions options;
        final PerformanceMonitor.RequestTimer timer;
        final long startNanos;

        RequestContext(String requestId, String endpoint, String method, RequestOptions options,
                       PerformanceMonitor.RequestTimer timer, long startNanos) {
            this.requestId = requestId;
            this.endpoint = endpoint;
            this.method = method;
            this.options = options;
            this.timer = timer;
            this.startNanos = startNanos;
        }

        void stopTimer(Integer statusCode, String error) {
            if (timer != null) {
                timer.stop(statusCode, error);
            }
        }

        long elapsedMillis() {
            return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        }
    }
}
