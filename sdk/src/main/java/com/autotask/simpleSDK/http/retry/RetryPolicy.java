package com.autotask.simpleSDK.http.retry;

import com.autotask.simpleSDK.http.exceptions.AutotaskNetworkException;
import com.autotask.simpleSDK.http.exceptions.AutotaskServiceException;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which failures are worth another attempt and bounds the delay between attempts.
 * The attempt budget and base delay live in {@link com.autotask.simpleSDK.http.RequestOptions}.
 */
public class RetryPolicy {
    private final Duration maxDelay;
    private final double jitterFactor;
    private final Set<Integer> retryableStatusCodes;
    private final Set<String> idempotentMethods;
    private final boolean retryOnTimeout;
    private final boolean retryOnNetworkError;

    public static final RetryPolicy DEFAULT = new Builder().build();

    private RetryPolicy(Builder builder) {
        this.maxDelay = builder.maxDelay;
        this.jitterFactor = builder.jitterFactor;
        this.retryableStatusCodes = Set.copyOf(builder.retryableStatusCodes);
        this.idempotentMethods = Set.copyOf(builder.idempotentMethods);
        this.retryOnTimeout = builder.retryOnTimeout;
        this.retryOnNetworkError = builder.retryOnNetworkError;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    public boolean shouldRetry(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }

    public boolean shouldRetryOnTimeout() {
        return retryOnTimeout;
    }

    public boolean shouldRetryOnNetworkError() {
        return retryOnNetworkError;
    }

    public boolean isIdempotent(String method) {
        return method != null && idempotentMethods.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * Classifies a failure. Service errors retry only on the configured status codes, transport errors
     * follow the timeout and network switches, anything else (malformed responses, programming errors)
     * is final.
     */
    public boolean isRetryable(Throwable failure) {
        if (failure instanceof AutotaskServiceException) {
            return shouldRetry(((AutotaskServiceException) failure).getStatusCode());
        }
        if (failure instanceof AutotaskNetworkException) {
            AutotaskNetworkException networkException = (AutotaskNetworkException) failure;
            return networkException.isTimeout() ? retryOnTimeout : retryOnNetworkError;
        }
        return failure instanceof IOException && retryOnNetworkError;
    }

    public static class Builder {
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitterFactor = 0.0;
        private Set<Integer> retryableStatusCodes = Set.of(408, 429, 500, 502, 503, 504);
        private Set<String> idempotentMethods = Set.of("GET", "HEAD", "PUT", "DELETE");
        private boolean retryOnTimeout = true;
        private boolean retryOnNetworkError = true;

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("maxDelay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            if (jitterFactor < 0.0 || jitterFactor > 1.0) {
                throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
            }
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryableStatusCodes(Set<Integer> statusCodes) {
            this.retryableStatusCodes = statusCodes;
            return this;
        }

        public Builder idempotentMethods(Set<String> methods) {
            this.idempotentMethods = methods;
            return this;
        }

        public Builder retryOnTimeout(boolean retryOnTimeout) {
            this.retryOnTimeout = retryOnTimeout;
            return this;
        }

        public Builder retryOnNetworkError(boolean retryOnNetworkError) {
            this.retryOnNetworkError = retryOnNetworkError;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
