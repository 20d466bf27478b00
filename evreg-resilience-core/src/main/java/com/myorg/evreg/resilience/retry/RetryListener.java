package com.myorg.evreg.resilience.retry;

import java.time.Duration;

@FunctionalInterface
public interface RetryListener {

    RetryListener NOOP = (attempt, delay, error) -> { };

    /** Called after {@code attempt} failed transiently and before sleeping {@code delay}. */
    void onRetry(int attempt, Duration delay, Throwable error);
}
