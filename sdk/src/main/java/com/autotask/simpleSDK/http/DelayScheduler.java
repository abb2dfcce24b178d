package com.autotask.simpleSDK.http;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Supplies an executor that runs submitted work after the given delay.
 */
@FunctionalInterface
public interface DelayScheduler {
    Executor after(Duration delay);

    static DelayScheduler systemDefault() {
        return delay -> CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
