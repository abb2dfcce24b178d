package com.autotask.simpleSDK.http.retry;

import com.autotask.simpleSDK.http.exceptions.AutotaskRateLimitException;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Random;

public class ExponentialBackoffStrategy {
    private final Random random;

    public ExponentialBackoffStrategy() {
        this(new Random());
    }

    public ExponentialBackoffStrategy(Random random) {
        this.random = random;
    }

    /**
     * Delay before the attempt following {@code attemptNumber} (1-based): {@code baseDelay * 2^(attemptNumber-1)},
     * plus jitter, capped at the policy's maximum. A rate-limit failure carrying {@code Retry-After} wins.
     */
    public Duration calculateDelay(int attemptNumber, Duration baseDelay, RetryPolicy retryPolicy, Throwable failure) {
        if (failure instanceof AutotaskRateLimitException) {
            Duration retryAfterDelay = parseRetryAfterHeader(((AutotaskRateLimitException) failure).getRetryAfter());
            if (retryAfterDelay != null) {
                return retryAfterDelay;
            }
        }

        long baseDelayMs = baseDelay.toMillis();
        long maxDelayMs = retryPolicy.getMaxDelay().toMillis();

        long exponentialDelay = baseDelayMs * (1L << Math.min(attemptNumber - 1, 30));

        long jitter = (long) (exponentialDelay * retryPolicy.getJitterFactor() * random.nextDouble());
        long delayWithJitter = exponentialDelay + jitter;

        return Duration.ofMillis(Math.min(delayWithJitter, maxDelayMs));
    }

    private Duration parseRetryAfterHeader(String retryAfterValue) {
        if (retryAfterValue == null || retryAfterValue.isEmpty()) {
            return null;
        }

        if (retryAfterValue.matches("\\d+")) {
            try {
                return Duration.ofSeconds(Long.parseLong(retryAfterValue));
            } catch (NumberFormatException e) {
                return null;
            }
        }

        // HTTP-date form
        try {
            ZonedDateTime retryAfterTime = ZonedDateTime.parse(retryAfterValue, DateTimeFormatter.RFC_1123_DATE_TIME);
            ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
            Duration delay = Duration.between(now, retryAfterTime);
            return delay.isNegative() ? Duration.ZERO : delay;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
