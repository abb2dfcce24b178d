package com.autotask.simpleSDK.http;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-call options for {@link RequestHandler}. Unset values fall through to the handler's global
 * options and then to the defaults (3 retries, 500 ms base delay, request and response logging on,
 * performance monitoring on, no per-attempt timeout beyond the transport's own).
 */
public final class RequestOptions {
    public static final int DEFAULT_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);

    private static final RequestOptions EMPTY = new Builder().build();

    private final Integer retries;
    private final Duration baseDelay;
    private final Boolean enableRequestLogging;
    private final Boolean enableResponseLogging;
    private final String requestId;
    private final Boolean idempotent;
    private final Boolean enablePerformanceMonitoring;
    private final Duration timeout;

    private RequestOptions(Builder builder) {
        this.retries = builder.retries;
        this.baseDelay = builder.baseDelay;
        this.enableRequestLogging = builder.enableRequestLogging;
        this.enableResponseLogging = builder.enableResponseLogging;
        this.requestId = builder.requestId;
        this.idempotent = builder.idempotent;
        this.enablePerformanceMonitoring = builder.enablePerformanceMonitoring;
        this.timeout = builder.timeout;
    }

    public static RequestOptions defaults() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns options where every value set on {@code overrides} replaces the value held here.
     */
    public RequestOptions merge(RequestOptions overrides) {
        if (overrides == null) {
            return this;
        }
        Builder merged = toBuilder();
        if (overrides.retries != null) {
            merged.retries(overrides.retries);
        }
        if (overrides.baseDelay != null) {
            merged.baseDelay(overrides.baseDelay);
        }
        if (overrides.enableRequestLogging != null) {
            merged.enableRequestLogging(overrides.enableRequestLogging);
        }
        if (overrides.enableResponseLogging != null) {
            merged.enableResponseLogging(overrides.enableResponseLogging);
        }
        if (overrides.requestId != null) {
            merged.requestId(overrides.requestId);
        }
        if (overrides.idempotent != null) {
            merged.idempotent(overrides.idempotent);
        }
        if (overrides.enablePerformanceMonitoring != null) {
            merged.enablePerformanceMonitoring(overrides.enablePerformanceMonitoring);
        }
        if (overrides.timeout != null) {
            merged.timeout(overrides.timeout);
        }
        return merged.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.retries = retries;
        builder.baseDelay = baseDelay;
        builder.enableRequestLogging = enableRequestLogging;
        builder.enableResponseLogging = enableResponseLogging;
        builder.requestId = requestId;
        builder.idempotent = idempotent;
        builder.enablePerformanceMonitoring = enablePerformanceMonitoring;
        builder.timeout = timeout;
        return builder;
    }

    public int getRetries() {
        return retries != null ? retries : DEFAULT_RETRIES;
    }

    public Duration getBaseDelay() {
        return baseDelay != null ? baseDelay : DEFAULT_BASE_DELAY;
    }

    public boolean isRequestLoggingEnabled() {
        return enableRequestLogging == null || enableRequestLogging;
    }

    public boolean isResponseLoggingEnabled() {
        return enableResponseLogging == null || enableResponseLogging;
    }

    public Optional<String> getRequestId() {
        return Optional.ofNullable(requestId);
    }

    public Optional<Boolean> getIdempotent() {
        return Optional.ofNullable(idempotent);
    }

    public boolean isPerformanceMonitoringEnabled() {
        return enablePerformanceMonitoring == null || enablePerformanceMonitoring;
    }

    /**
     * Upper bound for a single attempt; an attempt that runs longer fails as a retryable timeout.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    @Override
    public String toString() {
        return String.format("RequestOptions{retries=%d, baseDelay=%s, requestLogging=%s, responseLogging=%s, idempotent=%s, "
                + "performanceMonitoring=%s, timeout=%s}",
            getRetries(), getBaseDelay(), isRequestLoggingEnabled(), isResponseLoggingEnabled(), idempotent,
            isPerformanceMonitoringEnabled(), timeout);
    }

    public static class Builder {
        private Integer retries;
        private Duration baseDelay;
        private Boolean enableRequestLogging;
        private Boolean enableResponseLogging;
        private String requestId;
        private Boolean idempotent;
        private Boolean enablePerformanceMonitoring;
        private Duration timeout;

        public Builder retries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("retries must not be negative");
            }
            this.retries = retries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must not be negative");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder enableRequestLogging(boolean enableRequestLogging) {
            this.enableRequestLogging = enableRequestLogging;
            return this;
        }

        public Builder enableResponseLogging(boolean enableResponseLogging) {
            this.enableResponseLogging = enableResponseLogging;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        /**
         * Marks the call as safe to repeat regardless of its HTTP verb (e.g. a POST that only queries).
         */
        public Builder idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public Builder enablePerformanceMonitoring(boolean enablePerformanceMonitoring) {
            this.enablePerformanceMonitoring = enablePerformanceMonitoring;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
